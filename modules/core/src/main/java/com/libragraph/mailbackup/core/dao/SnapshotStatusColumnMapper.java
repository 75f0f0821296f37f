package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.SnapshotStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class SnapshotStatusColumnMapper implements ColumnMapper<SnapshotStatus> {

    @Override
    public SnapshotStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return SnapshotStatus.fromId(r.getShort(columnNumber));
    }
}
