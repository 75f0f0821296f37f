package com.libragraph.mailbackup.core.dao;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;

class SqlStatesTest {

    @Test
    void detectsUniqueViolationDeepInCauseChain() {
        SQLException duplicate = new SQLException("duplicate key", "23505");
        RuntimeException wrapped = new RuntimeException("insert failed", new IllegalStateException(duplicate));

        assertThat(SqlStates.isUniqueViolation(wrapped)).isTrue();
    }

    @Test
    void ignoresOtherStates() {
        assertThat(SqlStates.isUniqueViolation(new SQLException("fk", "23503"))).isFalse();
        assertThat(SqlStates.isUniqueViolation(new RuntimeException("plain"))).isFalse();
        assertThat(SqlStates.isUniqueViolation(null)).isFalse();
    }
}
