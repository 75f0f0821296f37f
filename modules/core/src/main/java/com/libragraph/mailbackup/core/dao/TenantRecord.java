package com.libragraph.mailbackup.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record TenantRecord(
        @ColumnName("id") String id,
        @ColumnName("name") String name,
        @ColumnName("active") boolean active,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {}
