package com.libragraph.cron.core.dao;

import com.libragraph.cron.types.RunStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class RunStatusArgumentFactory extends AbstractArgumentFactory<RunStatus> {

    public RunStatusArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(RunStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}
