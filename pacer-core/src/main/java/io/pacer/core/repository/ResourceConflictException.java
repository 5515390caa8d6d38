package io.pacer.core.repository;

/**
 * Thrown when a row with the same unique key is already stored.
 */
public class ResourceConflictException extends Exception
{
    private final String key;

    public ResourceConflictException(String key)
    {
        super("Resource already exists: " + key);
        this.key = key;
    }

    public String getKey()
    {
        return key;
    }
}
