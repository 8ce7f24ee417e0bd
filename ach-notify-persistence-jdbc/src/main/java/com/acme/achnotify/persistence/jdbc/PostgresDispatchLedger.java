package com.acme.achnotify.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of DispatchLedger
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresDispatchLedger extends JdbcDispatchLedger {

    public PostgresDispatchLedger(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getClaimSql() {
        return """
                INSERT INTO notification_dispatch
                (token, group_key, run_id, status, attempts, created_at, updated_at)
                VALUES (?, ?, ?, 'PENDING', 1, now(), now())
                ON CONFLICT (token) DO UPDATE
                SET status = 'PENDING', attempts = notification_dispatch.attempts + 1,
                    last_error = NULL, updated_at = now()
                WHERE notification_dispatch.status = 'FAILED'
                """;
    }
}
