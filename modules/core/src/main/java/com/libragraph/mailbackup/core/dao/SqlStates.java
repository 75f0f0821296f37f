package com.libragraph.mailbackup.core.dao;

import java.sql.SQLException;

/**
 * SQLSTATE inspection for the constraint races the store resolves by retrying.
 * Codes are the standard ones emitted by both PostgreSQL and H2.
 */
public final class SqlStates {

    public static final String UNIQUE_VIOLATION = "23505";

    private SqlStates() {
    }

    /**
     * Walks the cause chain looking for a unique-constraint violation.
     */
    public static boolean isUniqueViolation(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
            if (cur.getCause() == cur) {
                break;
            }
        }
        return false;
    }
}
