package io.pacer.core.database;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import com.google.inject.Inject;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigFactory;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Stores {@link Config} values, such as the kwargs of a queued job, as JSON text.
 */
public class ConfigMapper
{
    private final ConfigFactory cf;

    @Inject
    public ConfigMapper(ConfigFactory cf)
    {
        this.cf = cf;
    }

    /**
     * Lets statements bind a Config directly. A null Config is bound as SQL NULL.
     */
    public AbstractArgumentFactory<Config> getArgumentFactory()
    {
        return new AbstractArgumentFactory<Config>(Types.CLOB)
        {
            @Override
            protected Argument build(Config value, ConfigRegistry registry)
            {
                return new JsonTextArgument(value);
            }
        };
    }

    /**
     * Reads a JSON object column. NULL reads as an empty Config.
     */
    public Config fromResultSetOrEmpty(ResultSet rs, String column)
            throws SQLException
    {
        String text = rs.getString(column);
        if (text == null) {
            return cf.create();
        }
        return cf.fromJsonString(text);
    }

    private static class JsonTextArgument
            implements Argument
    {
        private final Config config;

        JsonTextArgument(Config config)
        {
            this.config = config;
        }

        @Override
        public void apply(int position, PreparedStatement statement, StatementContext ctx)
                throws SQLException
        {
            if (config == null) {
                statement.setNull(position, Types.CLOB);
            }
            else {
                statement.setString(position, config.toString());
            }
        }

        @Override
        public String toString()
        {
            return String.valueOf(config);
        }
    }
}
