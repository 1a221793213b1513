package io.tickwork.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import io.tickwork.client.api.ObjectMappers;
import io.tickwork.client.config.Config;
import io.tickwork.client.config.ConfigElement;
import io.tickwork.client.config.ConfigFactory;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    /**
     * Keys stay flat. {@code database.type=h2} becomes the key
     * {@code "database.type"}, not a nested object.
     */
    public static ConfigElement toConfigElement(Properties props)
    {
        Config builder = new ConfigFactory(ObjectMappers.objectMapper()).create();
        for (String key : props.stringPropertyNames()) {
            builder.set(key, props.getProperty(key));
        }
        return ConfigElement.copyOf(builder);
    }
}
