package io.pacer.core.repository;

/**
 * Thrown when an operation names a schedule that is not stored. Retrying does not help.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }
}
