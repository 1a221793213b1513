package io.tickwork.cli;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.tickwork.client.api.ObjectMappers;
import io.tickwork.client.config.Config;
import io.tickwork.client.config.ConfigFactory;
import io.tickwork.core.config.PropertyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

public abstract class Command
{
    private static final Logger log = LoggerFactory.getLogger(Command.class);

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-o", "--database"})
    protected String database = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    protected Properties loadSystemProperties()
        throws IOException
    {
        // Later sources take precedence:
        // 1. Default config file (unless --config was specified)
        // 2. TICKWORK_CONFIG env var
        // 3. JVM System properties (-D... and -X...)
        // 4. Explicit configuration file (if --config was specified)
        // 5. --database option

        Properties props = new Properties();

        if (configPath == null) {
            Path defaultConfigPath = ConfigUtil.defaultConfigPath(env);
            try {
                props.putAll(PropertyUtils.loadFile(defaultConfigPath));
            }
            catch (NoSuchFileException ex) {
                log.trace("configuration file not found: {}", defaultConfigPath, ex);
            }
        }

        props.load(new StringReader(env.getOrDefault("TICKWORK_CONFIG", "")));

        props.putAll(System.getProperties());

        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }

        if (database != null) {
            props.setProperty("database.type", "h2");
            props.setProperty("database.path", Paths.get(database).toAbsolutePath().toString());
        }

        return props;
    }

    protected Config buildSystemConfig(Properties props)
    {
        ConfigFactory cf = new ConfigFactory(ObjectMappers.objectMapper());
        return PropertyUtils.toConfigElement(props).toConfig(cf);
    }
}
