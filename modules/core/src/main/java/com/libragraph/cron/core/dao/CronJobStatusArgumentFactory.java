package com.libragraph.cron.core.dao;

import com.libragraph.cron.types.CronJobStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class CronJobStatusArgumentFactory extends AbstractArgumentFactory<CronJobStatus> {

    public CronJobStatusArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(CronJobStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}
