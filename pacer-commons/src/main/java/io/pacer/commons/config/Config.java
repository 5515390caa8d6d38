package io.pacer.commons.config;

import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.annotation.JacksonInject;
import io.pacer.commons.guava.ThrowablesUtil;

import static java.util.Locale.ENGLISH;

/**
 * Mutable, JSON object backed key-value set. Used for the system configuration and
 * for the typed fields of a schedule definition handed to due-time calculators.
 */
public class Config
{
    protected final ObjectMapper mapper;
    protected final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    protected Config(Config config)
    {
        this.mapper = config.mapper;
        this.object = config.object.deepCopy();
    }

    @JsonCreator
    public static Config deserializeFromJackson(@JacksonInject ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + object);
        }
        return new Config(mapper, (ObjectNode) object);
    }

    @JsonValue
    public ObjectNode getInternalObjectNode()
    {
        return object;
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config setOptional(String key, Optional<?> v)
    {
        if (v.isPresent()) {
            set(key, v.get());
        }
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public Config deepCopy()
    {
        return new Config(this);
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public <E> E get(String key, Class<E> type)
    {
        return lookup(key, type).or(() -> {
            String state = object.has(key) ? "null" : "not set";
            throw new ConfigException("Parameter '" + key + "' is required but " + state);
        });
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        return lookup(key, type).or(defaultValue);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return lookup(key, type);
    }

    private <E> Optional<E> lookup(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of(readObject(mapper.getTypeFactory().constructType(type), value, key));
    }

    private JsonNode writeObject(Object obj)
    {
        try {
            return mapper.valueToTree(obj);
        }
        catch (IllegalArgumentException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }

    private <E> E readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(mapper.treeAsTokens(value), type);
        }
        catch (Exception ex) {
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                    typeNameOf(type), key, jsonSample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
            throw new ConfigException(message, ex);
        }
    }

    private static String typeNameOf(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(int.class) || raw.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (raw.equals(long.class) || raw.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (raw.equals(boolean.class) || raw.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        else if (List.class.isAssignableFrom(raw)) {
            return "array type";
        }
        return type.toString();
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        else {
            return json.substring(0, 97) + "...";
        }
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
