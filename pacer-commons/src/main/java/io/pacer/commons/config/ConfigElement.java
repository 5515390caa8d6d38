package io.pacer.commons.config;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Immutable snapshot of a {@link Config}. The system configuration is passed around
 * in this form and converted to a Config for each reader.
 */
public class ConfigElement
{
    public static ConfigElement copyOf(Config mutableConfig)
    {
        return new ConfigElement(mutableConfig.object);
    }

    public static ConfigElement empty()
    {
        return new ConfigElement(JsonNodeFactory.instance.objectNode());
    }

    private final ObjectNode object;  // never modified after construction

    private ConfigElement(ObjectNode node)
    {
        this.object = node.deepCopy();
    }

    public Config toConfig(ConfigFactory factory)
    {
        return new Config(factory.objectMapper, object.deepCopy());
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof ConfigElement)) {
            return false;
        }
        return object.equals(((ConfigElement) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
