package io.pacer.commons.config;

/**
 * Thrown when system configuration or a schedule definition is invalid.
 */
public class ConfigException
        extends RuntimeException
{
    public ConfigException(String message)
    {
        super(message);
    }

    public ConfigException(Throwable cause)
    {
        super(cause);
    }

    public ConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
