package io.pacer.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Binder;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import com.google.inject.util.Modules;
import io.pacer.commons.ObjectMappers;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigElement;
import io.pacer.commons.config.ConfigFactory;
import io.pacer.core.database.DataSourceProvider;
import io.pacer.core.database.DatabaseModule;
import io.pacer.core.database.TransactionManager;
import io.pacer.core.health.HealthChecker;
import io.pacer.core.metrics.StdPacerMetrics;
import io.pacer.core.schedule.ScheduleCache;
import io.pacer.core.schedule.ScheduleExecutor;
import io.pacer.core.schedule.ScheduleExecutorModule;
import io.pacer.core.schedule.ScheduleModule;
import io.pacer.spi.metrics.PacerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PacerEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(PacerEmbed.class);

    public static class Bootstrap
    {
        private final List<Module> additionalModules = new ArrayList<>();
        private final List<Module> overridingModules = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();
        private boolean withScheduleExecutor = true;
        private boolean withExtensionLoader = true;

        public Bootstrap addModules(Module... modules)
        {
            additionalModules.addAll(Arrays.asList(modules));
            return this;
        }

        /**
         * Replaces bindings of the standard modules, for example to plug a JobQueue
         * that hands jobs to a message broker.
         */
        public Bootstrap overrideModulesWith(Module... modules)
        {
            overridingModules.addAll(Arrays.asList(modules));
            return this;
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

        public Bootstrap withExtensionLoader(boolean v)
        {
            this.withExtensionLoader = v;
            return this;
        }

        /**
         * Builds the injector and applies pending schema migrations. The scheduler loop
         * is not started; call {@link ScheduleExecutor#start()} for that.
         */
        public PacerEmbed initialize()
        {
            Module modules = Modules.combine(Iterables.concat(standardModules(), additionalModules));
            if (!overridingModules.isEmpty()) {
                modules = Modules.override(modules).with(overridingModules);
            }
            Injector injector = Guice.createInjector(modules);
            PacerEmbed embed = new PacerEmbed(injector, withScheduleExecutor);
            try {
                injector.getInstance(DatabaseModule.AutoMigrator.class).migrate();
            }
            catch (RuntimeException ex) {
                embed.close();
                throw ex;
            }
            return embed;
        }

        private List<Module> standardModules()
        {
            ImmutableList.Builder<Module> builder = ImmutableList.<Module>builder()
                .add(new DatabaseModule())
                .add(new ScheduleModule())
                .add(new SystemModule(systemConfig));
            if (withScheduleExecutor) {
                builder.add(new ScheduleExecutorModule());
            }
            if (withExtensionLoader) {
                builder.add(new ExtensionServiceLoaderModule());
            }
            return builder.build();
        }
    }

    static class SystemModule
            implements Module
    {
        private final ConfigElement systemConfig;

        SystemModule(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
        }

        @Override
        public void configure(Binder binder)
        {
            binder.bind(ObjectMapper.class).toInstance(ObjectMappers.objectMapper());
            binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
            binder.bind(PacerMetrics.class).toInstance(StdPacerMetrics.empty());
            binder.bind(Clock.class).toInstance(Clock.systemUTC());
            binder.bind(HealthChecker.class).in(Scopes.SINGLETON);
        }

        @Provides
        @Singleton
        public Config provideSystemConfig(ConfigFactory cf)
        {
            return systemConfig.toConfig(cf);
        }
    }

    private final Injector injector;
    private final boolean withScheduleExecutor;

    PacerEmbed(Injector injector, boolean withScheduleExecutor)
    {
        this.injector = injector;
        this.withScheduleExecutor = withScheduleExecutor;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public TransactionManager getTransactionManager()
    {
        return getInjector().getInstance(TransactionManager.class);
    }

    public ScheduleExecutor getScheduleExecutor()
    {
        return getInjector().getInstance(ScheduleExecutor.class);
    }

    public ScheduleCache getScheduleCache()
    {
        return getInjector().getInstance(ScheduleCache.class);
    }

    public HealthChecker getHealthChecker()
    {
        return getInjector().getInstance(HealthChecker.class);
    }

    @Override
    public void close()
    {
        if (withScheduleExecutor) {
            try {
                getScheduleExecutor().shutdown();
            }
            catch (RuntimeException ex) {
                logger.warn("Failed to shut down the scheduler", ex);
            }
        }
        injector.getInstance(DataSourceProvider.class).close();
    }
}
