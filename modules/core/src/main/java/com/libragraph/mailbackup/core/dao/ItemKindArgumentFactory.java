package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemKind;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class ItemKindArgumentFactory extends AbstractArgumentFactory<ItemKind> {

    public ItemKindArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(ItemKind value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
