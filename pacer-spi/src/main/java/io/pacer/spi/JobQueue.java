package io.pacer.spi;

/**
 * Hand-off point to the execution layer. An implementation returns once the job is
 * accepted; it never waits for the job to run.
 */
public interface JobQueue
{
    void enqueue(JobRequest request)
        throws EnqueueException;
}
