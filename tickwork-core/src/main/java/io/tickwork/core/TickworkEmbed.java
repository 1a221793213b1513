package io.tickwork.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.util.Modules;
import io.tickwork.client.api.ObjectMappers;
import io.tickwork.client.config.Config;
import io.tickwork.client.config.ConfigElement;
import io.tickwork.client.config.ConfigFactory;
import io.tickwork.core.config.ConfigModule;
import io.tickwork.core.database.DataSourceProvider;
import io.tickwork.core.database.DatabaseConfig;
import io.tickwork.core.database.DatabaseMigrator;
import io.tickwork.core.database.DatabaseModule;
import io.tickwork.core.database.TransactionManager;
import io.tickwork.core.schedule.ClaimedScheduleHandler;
import io.tickwork.core.schedule.LoggingClaimedScheduleHandler;
import io.tickwork.core.schedule.ScheduleClaimExecutor;
import io.tickwork.core.schedule.ScheduleClaimQueue;
import io.tickwork.core.schedule.ScheduleExecutorModule;
import io.tickwork.core.schedule.ScheduleModule;
import io.tickwork.core.schedule.ScheduleStoreManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the schedule store, the claim queue and optionally the poller
 * from a system configuration.
 *
 * <pre>
 * try (TickworkEmbed embed = new TickworkEmbed.Bootstrap()
 *         .setSystemConfig(systemConfig)
 *         .initialize()) {
 *     embed.getScheduleClaimQueue().claimDue(10, Instant.now());
 * }
 * </pre>
 */
public class TickworkEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(TickworkEmbed.class);

    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();
        private boolean withScheduleExecutor = true;

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public Bootstrap withScheduleExecutor(boolean v)
        {
            this.withScheduleExecutor = v;
            return this;
        }

        /**
         * Builds the injector, applies migrations if {@code database.migrate}
         * is true and starts the poller if it is enabled.
         */
        public TickworkEmbed initialize()
        {
            List<Module> modules = standardModules(systemConfig);
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(modules);

            TickworkEmbed embed = new TickworkEmbed(injector, withScheduleExecutor);
            try {
                embed.start();
            }
            catch (RuntimeException ex) {
                embed.close();
                throw ex;
            }
            return embed;
        }

        private List<Module> standardModules(ConfigElement systemConfig)
        {
            ImmutableList.Builder<Module> builder = ImmutableList.builder();
            builder.addAll(Arrays.asList(
                    new DatabaseModule(),
                    new ScheduleModule(),
                    new ConfigModule(),
                    (binder) -> {
                        binder.bind(ObjectMapper.class).toInstance(ObjectMappers.objectMapper());
                        binder.bind(ConfigElement.class).toInstance(systemConfig);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class);
                        binder.bind(Clock.class).toInstance(Clock.systemUTC());
                    }
                ));
            if (withScheduleExecutor) {
                builder.add(new ScheduleExecutorModule());
                builder.add((binder) -> {
                    binder.bind(ClaimedScheduleHandler.class).to(LoggingClaimedScheduleHandler.class).in(Scopes.SINGLETON);
                });
            }
            return builder.build();
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;
    private final boolean withScheduleExecutor;

    TickworkEmbed(Injector injector, boolean withScheduleExecutor)
    {
        this.injector = injector;
        this.withScheduleExecutor = withScheduleExecutor;
    }

    private void start()
    {
        DatabaseConfig databaseConfig = injector.getInstance(DatabaseConfig.class);
        if (databaseConfig.getAutoMigrate()) {
            injector.getInstance(DatabaseMigrator.class).migrate();
        }
        if (withScheduleExecutor) {
            injector.getInstance(ScheduleClaimExecutor.class).start();
        }
    }

    public Injector getInjector()
    {
        return injector;
    }

    public TransactionManager getTransactionManager()
    {
        return injector.getInstance(TransactionManager.class);
    }

    public ScheduleStoreManager getScheduleStoreManager()
    {
        return injector.getInstance(ScheduleStoreManager.class);
    }

    public ScheduleClaimQueue getScheduleClaimQueue()
    {
        return injector.getInstance(ScheduleClaimQueue.class);
    }

    /**
     * Stops the poller, then closes the data source.
     */
    @Override
    public void close()
    {
        try {
            if (withScheduleExecutor) {
                injector.getInstance(ScheduleClaimExecutor.class).shutdown();
            }
        }
        finally {
            injector.getInstance(DataSourceProvider.class).close();
            logger.debug("Closed tickwork");
        }
    }
}
