package io.pacer.core.database;

import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Binder;
import com.google.inject.Scopes;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import javax.sql.DataSource;
import io.pacer.commons.config.Config;
import io.pacer.core.schedule.ScheduleStore;
import io.pacer.spi.JobQueue;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(AutoMigrator.class).in(Scopes.SINGLETON);
        binder.bind(Jdbi.class).toProvider(JdbiProvider.class);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(ConfigMapper.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseMigrator.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleStore.class).to(DatabaseScheduleStore.class).in(Scopes.SINGLETON);
        binder.bind(JobQueue.class).to(DatabaseJobQueue.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    public DatabaseConfig provideDatabaseConfig(Config systemConfig)
    {
        return DatabaseConfig.convertFrom(systemConfig);
    }

    /**
     * Applies pending migrations when database.migrate is true. Called once by
     * PacerEmbed before any store is used.
     */
    public static class AutoMigrator
    {
        private DatabaseMigrator migrator;

        @Inject
        public AutoMigrator(DataSource ds, DatabaseConfig config)
        {
            if (config.getAutoMigrate()) {
                this.migrator = new DatabaseMigrator(Jdbi.create(ds), config);
            }
        }

        public synchronized void migrate()
        {
            if (migrator != null) {
                migrator.migrate();
                migrator = null;
            }
        }
    }

    public static class JdbiProvider
            implements Provider<Jdbi>
    {
        private final DataSource ds;

        @Inject
        public JdbiProvider(DataSource ds)
        {
            this.ds = ds;
        }

        @Override
        public Jdbi get()
        {
            return Jdbi.create(ds).installPlugin(new SqlObjectPlugin());
        }
    }
}
