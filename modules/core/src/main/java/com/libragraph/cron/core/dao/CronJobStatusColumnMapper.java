package com.libragraph.cron.core.dao;

import com.libragraph.cron.types.CronJobStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class CronJobStatusColumnMapper implements ColumnMapper<CronJobStatus> {

    @Override
    public CronJobStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String label = r.getString(columnNumber);
        return label == null ? null : CronJobStatus.fromLabel(label);
    }
}
