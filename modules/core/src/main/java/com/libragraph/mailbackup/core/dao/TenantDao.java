package com.libragraph.mailbackup.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(TenantRecord.class)
public interface TenantDao {

    @SqlQuery("SELECT * FROM tenant WHERE id = :id")
    Optional<TenantRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT * FROM tenant WHERE active = TRUE ORDER BY id")
    List<TenantRecord> findActive();

    @SqlQuery("SELECT * FROM tenant ORDER BY id")
    List<TenantRecord> findAll();

    @SqlUpdate("INSERT INTO tenant (id, name, active, created_at, updated_at) " +
            "VALUES (:id, :name, TRUE, :now, :now)")
    void insert(@Bind("id") String id, @Bind("name") String name, @Bind("now") Instant now);

    @SqlUpdate("UPDATE tenant SET name = :name, active = TRUE, updated_at = :now WHERE id = :id")
    int reactivate(@Bind("id") String id, @Bind("name") String name, @Bind("now") Instant now);

    @SqlUpdate("UPDATE tenant SET name = :name, updated_at = :now WHERE id = :id")
    int rename(@Bind("id") String id, @Bind("name") String name, @Bind("now") Instant now);

    @SqlUpdate("UPDATE tenant SET active = FALSE, updated_at = :now WHERE id = :id AND active = TRUE")
    int deactivate(@Bind("id") String id, @Bind("now") Instant now);
}
