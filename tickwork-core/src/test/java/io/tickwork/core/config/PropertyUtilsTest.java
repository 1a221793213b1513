package io.tickwork.core.config;

import io.tickwork.client.api.ObjectMappers;
import io.tickwork.client.config.Config;
import io.tickwork.client.config.ConfigFactory;
import io.tickwork.core.database.DatabaseConfig;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class PropertyUtilsTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private final ConfigFactory cf = new ConfigFactory(ObjectMappers.objectMapper());

    @Test
    public void loadAndConvertFlatKeys()
            throws Exception
    {
        Path file = folder.newFile("tickwork.properties").toPath();
        Files.write(file, ("# comment\n" +
                    "database.type = h2\n" +
                    "database.path = /var/lib/tickwork\n" +
                    "database.maximumPoolSize = 4\n").getBytes(StandardCharsets.UTF_8));

        Properties props = PropertyUtils.loadFile(file);
        Config config = PropertyUtils.toConfigElement(props).toConfig(cf);

        assertThat(config.get("database.type", String.class), is("h2"));
        assertThat(config.has("database"), is(false));
        // string values are converted on read
        assertThat(config.get("database.maximumPoolSize", int.class), is(4));

        DatabaseConfig db = DatabaseConfig.convertFrom(config);
        assertThat(db.getType(), is("h2"));
        assertThat(db.getMaximumPoolSize(), is(4));
    }

    @Test
    public void emptyProperties()
    {
        Config config = PropertyUtils.toConfigElement(new Properties()).toConfig(cf);
        assertThat(config.isEmpty(), is(true));
    }
}
