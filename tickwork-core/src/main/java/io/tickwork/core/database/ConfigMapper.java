package io.tickwork.core.database;

import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import io.tickwork.client.config.Config;
import io.tickwork.client.config.ConfigFactory;
import io.tickwork.core.ThrowablesUtil;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Stores {@link Config} objects as JSON text columns.
 */
public class ConfigMapper
{
    private final ObjectMapper jsonTreeMapper;
    private final ConfigFactory cf;

    @Inject
    public ConfigMapper(ConfigFactory cf)
    {
        this.jsonTreeMapper = new ObjectMapper();
        this.cf = cf;
    }

    public ConfigArgumentFactory getArgumentFactory()
    {
        return new ConfigArgumentFactory();
    }

    public Config fromResultSetOrEmpty(ResultSet rs, String column)
            throws SQLException
    {
        String text = rs.getString(column);
        if (rs.wasNull()) {
            return cf.create();
        }
        else {
            return fromText(text);
        }
    }

    private Config fromText(String text)
    {
        try {
            JsonNode node = jsonTreeMapper.readTree(text);
            Preconditions.checkState(node != null && node.isObject(), "Stored Config must be an object");
            return cf.create(node);
        }
        catch (IOException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }

    public String toText(Config config)
    {
        try {
            return jsonTreeMapper.writeValueAsString(config.getInternalObjectNode());
        }
        catch (IOException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }

    public class ConfigArgumentFactory extends AbstractArgumentFactory<Config>
    {
        public ConfigArgumentFactory()
        {
            super(Types.VARCHAR);
        }

        @Override
        protected Argument build(Config value, ConfigRegistry config)
        {
            return new ConfigArgument(value);
        }
    }

    public class ConfigArgument
            implements Argument
    {
        private final Config config;

        public ConfigArgument(Config config)
        {
            this.config = config;
        }

        @Override
        public void apply(int position, PreparedStatement statement, StatementContext ctx)
                throws SQLException
        {
            statement.setString(position, toText(config));
        }

        @Override
        public String toString()
        {
            return String.valueOf(config);
        }
    }
}
