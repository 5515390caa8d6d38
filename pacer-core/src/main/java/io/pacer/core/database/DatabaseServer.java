package io.pacer.core.database;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Address and credentials of a PostgreSQL server.
 */
@Value.Immutable
public interface DatabaseServer
{
    String getHost();

    Optional<Integer> getPort();

    String getDatabase();

    String getUser();

    @Value.Default
    default String getPassword()
    {
        return "";
    }

    // disable, require, verify-ca or verify-full. The driver default applies when absent.
    Optional<String> getSslMode();

    static ImmutableDatabaseServer.Builder builder()
    {
        return ImmutableDatabaseServer.builder();
    }
}
