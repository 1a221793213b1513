package io.tickwork.core.database;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.tickwork.client.config.Config;
import io.tickwork.client.config.ConfigException;
import org.immutables.value.Value;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

@Value.Immutable
public interface DatabaseConfig
{
    String getType();

    Optional<String> getPath();

    Map<String, String> getOptions();

    Optional<RemoteDatabaseConfig> getRemoteDatabaseConfig();

    boolean getAutoMigrate();

    PoolProfile getPoolProfile();

    ////
    // HikariCP config params
    //

    int getConnectionTimeout();  // seconds

    int getIdleTimeout();  // seconds

    int getMaxLifetime();  // seconds

    int getValidationTimeout();  // seconds

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    long getLeakDetectionThreshold();  // milliseconds

    /**
     * Preset pool sizing. A process that is the only gateway to the database
     * keeps a larger warm pool. Processes that share the database with other
     * gateways keep a smaller pool that can shrink to zero.
     */
    enum PoolProfile
    {
        DEFAULT("default", 0, -1, 600, 1800, 30),
        SINGLE_GATEWAY("single_gateway", 64, 2, 480, 2400, 40),
        MULTIPLE_GATEWAYS("multiple_gateways", 32, 0, 120, 1200, 40);

        private final String name;
        private final int maximumPoolSize;
        private final int minimumPoolSize;
        private final int idleTimeout;
        private final int maxLifetime;
        private final int connectionTimeout;

        PoolProfile(String name, int maximumPoolSize, int minimumPoolSize,
                int idleTimeout, int maxLifetime, int connectionTimeout)
        {
            this.name = name;
            this.maximumPoolSize = maximumPoolSize;
            this.minimumPoolSize = minimumPoolSize;
            this.idleTimeout = idleTimeout;
            this.maxLifetime = maxLifetime;
            this.connectionTimeout = connectionTimeout;
        }

        public String getName()
        {
            return name;
        }

        public int getMaximumPoolSize()
        {
            if (maximumPoolSize <= 0) {
                return Runtime.getRuntime().availableProcessors() * 32;
            }
            return maximumPoolSize;
        }

        // negative means same as maximum
        public int getMinimumPoolSize(int maximumPoolSize)
        {
            if (minimumPoolSize < 0) {
                return maximumPoolSize;
            }
            return minimumPoolSize;
        }

        public int getIdleTimeout()
        {
            return idleTimeout;
        }

        public int getMaxLifetime()
        {
            return maxLifetime;
        }

        public int getConnectionTimeout()
        {
            return connectionTimeout;
        }

        public static PoolProfile of(String name)
        {
            for (PoolProfile profile : values()) {
                if (profile.name.equals(name)) {
                    return profile;
                }
            }
            throw new ConfigException("Unknown database.poolProfile: " + name);
        }
    }

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        return convertFrom(config, "database");
    }

    static DatabaseConfig convertFrom(Config config, String keyPrefix)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        // database.type, path, host, user, password, port, database
        String type = config.get(keyPrefix + "." + "type", String.class, "memory");
        switch (type) {
        case "h2":
            builder.type("h2");
            builder.path(Optional.of(config.get(keyPrefix + "." + "path", String.class)));
            builder.remoteDatabaseConfig(Optional.absent());
            break;
        case "memory":
            builder.type("h2");
            builder.path(Optional.absent());
            builder.remoteDatabaseConfig(Optional.absent());
            break;
        case "postgresql":
            builder.type("postgresql");
            builder.remoteDatabaseConfig(Optional.of(
                RemoteDatabaseConfig.builder()
                    .user(config.get(keyPrefix + "." + "user", String.class))
                    .password(config.get(keyPrefix + "." + "password", String.class, ""))
                    .host(config.get(keyPrefix + "." + "host", String.class))
                    .port(config.getOptional(keyPrefix + "." + "port", Integer.class))
                    .database(config.get(keyPrefix + "." + "database", String.class))
                    .loginTimeout(config.get(keyPrefix + "." + "loginTimeout", int.class, 30))
                    .socketTimeout(config.get(keyPrefix + "." + "socketTimeout", int.class, 1800))
                    .ssl(config.get(keyPrefix + "." + "ssl", boolean.class, false))
                    .sslfactory(config.get(keyPrefix + "." + "sslfactory", String.class, "org.postgresql.ssl.NonValidatingFactory"))
                    .sslmode(config.getOptional(keyPrefix + "." + "sslmode", String.class))
                    .build()));
            break;
        default:
            throw new ConfigException("Unknown database.type: " + type);
        }

        PoolProfile profile = PoolProfile.of(
                config.get(keyPrefix + "." + "poolProfile", String.class, PoolProfile.DEFAULT.getName()));
        builder.poolProfile(profile);

        builder.connectionTimeout(
                config.get(keyPrefix + "." + "connectionTimeout", int.class, profile.getConnectionTimeout()));
        builder.idleTimeout(
                config.get(keyPrefix + "." + "idleTimeout", int.class, profile.getIdleTimeout()));
        builder.maxLifetime(
                config.get(keyPrefix + "." + "maxLifetime", int.class, profile.getMaxLifetime()));
        builder.validationTimeout(
                config.get(keyPrefix + "." + "validationTimeout", int.class, 5));  // HikariCP default: 5

        int maximumPoolSize = config.get(keyPrefix + "." + "maximumPoolSize", int.class,
                profile.getMaximumPoolSize());
        builder.maximumPoolSize(maximumPoolSize);
        builder.minimumPoolSize(
                config.get(keyPrefix + "." + "minimumPoolSize", int.class, profile.getMinimumPoolSize(maximumPoolSize)));

        builder.leakDetectionThreshold(
                config.get(keyPrefix + "." + "leakDetectionThreshold", long.class, 0L));  // HikariCP default: 0

        // database.opts.* to options
        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        String optionKey = keyPrefix + "." + "opts.";
        for (String key : config.getKeys()) {
            if (key.startsWith(optionKey)) {
                options.put(key.substring(optionKey.length()), config.get(key, String.class));
            }
        }
        builder.options(options.build());

        builder.autoMigrate(
                config.get(keyPrefix + "." + "migrate", boolean.class, true));

        DatabaseConfig built = builder.build();
        if (built.getMinimumPoolSize() > built.getMaximumPoolSize()) {
            throw new ConfigException(String.format(Locale.ENGLISH,
                        "%s.minimumPoolSize (%d) must not be larger than %s.maximumPoolSize (%d)",
                        keyPrefix, built.getMinimumPoolSize(), keyPrefix, built.getMaximumPoolSize()));
        }
        return built;
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        switch (config.getType()) {
        case "h2":
            if (config.getPath().isPresent()) {
                Path dir = FileSystems.getDefault().getPath(config.getPath().get());
                try {
                    Files.createDirectories(dir);
                }
                catch (IOException ex) {
                    throw new ConfigException(ex);
                }
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:%s",
                        dir.resolve("tickwork").toAbsolutePath().toString());  // h2 requires absolute path
            }
            else {
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:mem:tickwork-%s",
                        UUID.randomUUID());
            }

        case "postgresql":
            {
                if (!config.getRemoteDatabaseConfig().isPresent()) {
                    throw new IllegalArgumentException("Database type is postgresql but remoteDatabaseConfig is not set");
                }
                RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
                if (remote.getPort().isPresent()) {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s:%d/%s",
                            remote.getHost(), remote.getPort().get(), remote.getDatabase());
                }
                else {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s/%s",
                            remote.getHost(), remote.getDatabase());
                }
            }

        default:
            throw new ConfigException("Unsupported database type: " + config.getType());
        }
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();

        if (config.getRemoteDatabaseConfig().isPresent()) {
            RemoteDatabaseConfig rc = config.getRemoteDatabaseConfig().get();
            props.setProperty("loginTimeout", Integer.toString(rc.getLoginTimeout()));
            props.setProperty("socketTimeout", Integer.toString(rc.getSocketTimeout()));
            props.setProperty("tcpKeepAlive", "true");
            props.setProperty("user", rc.getUser());
            props.setProperty("password", rc.getPassword());
            if (rc.getSsl()) {
                props.setProperty("ssl", "true");
                props.setProperty("sslfactory", rc.getSslfactory());
                if (rc.getSslmode().isPresent()) {
                    props.setProperty("sslmode", rc.getSslmode().get());
                }
            }
        }

        for (Map.Entry<String, String> pair : config.getOptions().entrySet()) {
            props.setProperty(pair.getKey(), pair.getValue());
        }

        return props;
    }

    static boolean isPostgres(String databaseType)
    {
        return databaseType.equals("postgresql");
    }
}
