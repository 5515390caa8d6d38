package io.pacer.spi;

/**
 * Thrown when the execution layer did not accept a job.
 */
public class EnqueueException
        extends Exception
{
    public EnqueueException(String message)
    {
        super(message);
    }

    public EnqueueException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
