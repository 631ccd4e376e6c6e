package com.libragraph.cron.core.dao;

import com.libragraph.cron.types.ExecutionMode;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ExecutionModeColumnMapper implements ColumnMapper<ExecutionMode> {

    @Override
    public ExecutionMode map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String label = r.getString(columnNumber);
        return label == null ? null : ExecutionMode.fromLabel(label);
    }
}
