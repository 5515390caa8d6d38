package io.pacer.commons.config;

import java.io.IOException;
import com.google.inject.Inject;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static java.util.Locale.ENGLISH;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config create(JsonNode object)
    {
        if (!object.isObject()) {
            throw new ConfigException("Expected a JSON object but got " + object.getNodeType().toString().toLowerCase(ENGLISH));
        }
        return new Config(objectMapper, object.deepCopy());
    }

    public Config fromJsonString(String json)
    {
        try {
            return create(objectMapper.readTree(json));
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
    }
}
