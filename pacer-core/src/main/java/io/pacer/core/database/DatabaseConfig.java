package io.pacer.core.database;

import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigException;
import org.immutables.value.Value;

/**
 * Settings of the database that holds schedules and queued jobs, read from the
 * {@code database.*} keys of the system config.
 *
 * <pre>
 * database.type = memory | h2 | postgresql   (default: memory)
 * database.path = DIR                        (h2)
 * database.host, port, database, user, password, sslmode   (postgresql)
 * database.maximum_pool_size, minimum_pool_size, connection_timeout_seconds, idle_timeout_seconds
 * database.migrate = true | false            (default: true)
 * database.opts.NAME = VALUE                 (JDBC driver properties)
 * </pre>
 */
@Value.Immutable
public interface DatabaseConfig
{
    String H2 = "h2";
    String POSTGRESQL = "postgresql";

    String getType();

    // directory of a file database. Absent for an in-memory database.
    Optional<String> getPath();

    Optional<DatabaseServer> getServer();

    Map<String, String> getOptions();

    @Value.Default
    default boolean getAutoMigrate()
    {
        return true;
    }

    @Value.Default
    default int getMaximumPoolSize()
    {
        // the loop, the dispatcher threads and the bookkeeping writer share the pool
        return 10;
    }

    @Value.Default
    default int getMinimumPoolSize()
    {
        return getMaximumPoolSize();
    }

    @Value.Default
    default int getConnectionTimeoutSeconds()
    {
        return 30;
    }

    @Value.Default
    default int getIdleTimeoutSeconds()
    {
        return 600;
    }

    default boolean isPostgres()
    {
        return POSTGRESQL.equals(getType());
    }

    @Value.Check
    default void check()
    {
        if (isPostgres() != getServer().isPresent()) {
            throw new ConfigException("database.type " + getType() + " and server settings don't match");
        }
        if (getMaximumPoolSize() < 1) {
            throw new ConfigException("database.maximum_pool_size must be positive but got " + getMaximumPoolSize());
        }
    }

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        String type = config.get("database.type", String.class, "memory");
        switch (type) {
        case "memory":
            builder.type(H2);
            break;
        case H2:
            builder.type(H2).path(config.get("database.path", String.class));
            break;
        case POSTGRESQL:
            builder.type(POSTGRESQL).server(DatabaseServer.builder()
                    .host(config.get("database.host", String.class))
                    .port(config.getOptional("database.port", Integer.class))
                    .database(config.get("database.database", String.class))
                    .user(config.get("database.user", String.class))
                    .password(config.get("database.password", String.class, ""))
                    .sslMode(config.getOptional("database.sslmode", String.class))
                    .build());
            break;
        default:
            throw new ConfigException("Unknown database.type: " + type);
        }

        int maximumPoolSize = config.get("database.maximum_pool_size", int.class, 10);
        builder.maximumPoolSize(maximumPoolSize)
            .minimumPoolSize(config.get("database.minimum_pool_size", int.class, maximumPoolSize))
            .connectionTimeoutSeconds(config.get("database.connection_timeout_seconds", int.class, 30))
            .idleTimeoutSeconds(config.get("database.idle_timeout_seconds", int.class, 600))
            .autoMigrate(config.get("database.migrate", boolean.class, true));

        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        for (String key : config.getKeys()) {
            if (key.startsWith("database.opts.")) {
                options.put(key.substring("database.opts.".length()), config.get(key, String.class));
            }
        }
        builder.options(options.build());

        return builder.build();
    }
}
