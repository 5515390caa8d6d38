package io.pacer.core.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigElement;
import io.pacer.commons.config.ConfigFactory;

import static io.pacer.commons.ObjectMappers.objectMapper;

/**
 * System configuration is read from java.util.Properties. Keys stay flat, so
 * {@code database.type} is a single key of the resulting Config.
 */
public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        return load(Files.newBufferedReader(file, StandardCharsets.UTF_8));
    }

    public static Properties loadString(String text)
        throws IOException
    {
        return load(new StringReader(text));
    }

    private static Properties load(Reader source)
        throws IOException
    {
        Properties props = new Properties();
        try (Reader reader = source) {
            props.load(reader);
        }
        return props;
    }

    public static ConfigElement toConfigElement(Properties props)
    {
        Config config = new ConfigFactory(objectMapper()).create();
        props.stringPropertyNames().forEach(key -> config.set(key, props.getProperty(key)));
        return ConfigElement.copyOf(config);
    }
}
