package com.acme.achnotify.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * H2-specific implementation of DispatchLedger
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DispatchLedger extends JdbcDispatchLedger {

    public H2DispatchLedger(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getClaimSql() {
        return """
                MERGE INTO notification_dispatch d
                USING (SELECT CAST(? AS VARCHAR(64)) AS token,
                              CAST(? AS VARCHAR(255)) AS group_key,
                              CAST(? AS VARCHAR(64)) AS run_id) s
                ON d.token = s.token
                WHEN MATCHED AND d.status = 'FAILED' THEN
                    UPDATE SET status = 'PENDING', attempts = d.attempts + 1,
                               last_error = NULL, updated_at = CURRENT_TIMESTAMP
                WHEN NOT MATCHED THEN
                    INSERT (token, group_key, run_id, status, attempts, created_at, updated_at)
                    VALUES (s.token, s.group_key, s.run_id, 'PENDING', 1, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
                """;
    }
}
