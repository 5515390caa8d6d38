package io.pacer.core.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;
import java.util.UUID;
import javax.sql.DataSource;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.pacer.commons.config.ConfigException;
import io.pacer.commons.guava.ThrowablesUtil;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Locale.ENGLISH;

/**
 * Creates the DataSource on first use and closes it with the process.
 * PostgreSQL connections are pooled by HikariCP. H2 runs in the same process
 * and is used without a pool.
 */
public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DataSourceProvider.class);

    private final DatabaseConfig config;
    private DataSource ds;

    // keeps an in-memory h2 database alive. H2 drops it when the last connection closes.
    private Connection h2KeepAlive;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            ds = config.isPostgres() ? createPool() : createH2();
        }
        return ds;
    }

    private DataSource createH2()
    {
        JdbcDataSource h2 = new JdbcDataSource();
        // the database must outlive h2's own shutdown hook until the final bookkeeping flush
        h2.setURL(jdbcUrl(config) + ";DB_CLOSE_ON_EXIT=FALSE");
        logger.debug("Using h2 database {}", h2.getURL());
        try {
            h2KeepAlive = h2.getConnection();
        }
        catch (SQLException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        return h2;
    }

    private DataSource createPool()
    {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("pacer");
        hikari.setJdbcUrl(jdbcUrl(config));
        hikari.setDriverClassName("org.postgresql.Driver");
        hikari.setDataSourceProperties(jdbcProperties(config));
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());
        hikari.setConnectionTimeout(config.getConnectionTimeoutSeconds() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeoutSeconds() * 1000L);
        // No connectionTestQuery: it would replace Connection.isValid, which the
        // transaction manager checks before commit.
        logger.debug("Using database {}", hikari.getJdbcUrl());
        return new HikariDataSource(hikari);
    }

    @VisibleForTesting
    static String jdbcUrl(DatabaseConfig config)
    {
        if (config.isPostgres()) {
            DatabaseServer server = config.getServer().get();
            String address = server.getPort().isPresent()
                ? server.getHost() + ":" + server.getPort().get()
                : server.getHost();
            return String.format(ENGLISH, "jdbc:postgresql://%s/%s", address, server.getDatabase());
        }
        if (!config.getPath().isPresent()) {
            return "jdbc:h2:mem:pacer-" + UUID.randomUUID();
        }
        Path dir = Paths.get(config.getPath().get()).toAbsolutePath();
        try {
            Files.createDirectories(dir);
        }
        catch (IOException ex) {
            throw new ConfigException("Failed to create database directory " + dir, ex);
        }
        // h2 requires an absolute path
        return "jdbc:h2:" + dir.resolve("pacer");
    }

    @VisibleForTesting
    static Properties jdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        if (config.isPostgres()) {
            DatabaseServer server = config.getServer().get();
            props.setProperty("user", server.getUser());
            props.setProperty("password", server.getPassword());
            if (server.getSslMode().isPresent()) {
                props.setProperty("sslmode", server.getSslMode().get());
            }
            props.setProperty("tcpKeepAlive", "true");
        }
        props.putAll(config.getOptions());
        return props;
    }

    @Override
    public synchronized void close()
    {
        if (ds == null) {
            return;
        }
        try {
            if (ds instanceof HikariDataSource) {
                ((HikariDataSource) ds).close();
            }
            if (h2KeepAlive != null) {
                h2KeepAlive.close();
            }
        }
        catch (SQLException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        finally {
            ds = null;
            h2KeepAlive = null;
        }
    }
}
