package com.querycache.session;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * HikariCP SQL exception override that keeps the session's only connection alive on
 * statement-level failures.
 *
 * Compilation errors (SQLSTATE class 42), data exceptions (class 22) and unsupported features
 * (class 0A) say nothing about the health of the connection. Evicting the single pooled connection
 * on those would force a fresh login, which for browser authentication means another interactive prompt.
 */
public class WarehouseSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict the connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("42") || sqlState.startsWith("22") || sqlState.startsWith("0A"))) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
