package com.libragraph.cron.core.dao;

import com.libragraph.cron.types.ExecutionMode;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class ExecutionModeArgumentFactory extends AbstractArgumentFactory<ExecutionMode> {

    public ExecutionModeArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(ExecutionMode value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}
