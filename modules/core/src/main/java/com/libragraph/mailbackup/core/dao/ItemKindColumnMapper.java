package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemKind;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ItemKindColumnMapper implements ColumnMapper<ItemKind> {

    @Override
    public ItemKind map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return ItemKind.fromId(r.getShort(columnNumber));
    }
}
