package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.spi.DispatchLedger;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Abstract JDBC implementation of DispatchLedger using Template Method pattern.
 * Subclasses supply the dialect-specific claim statement.
 *
 * <p>A token moves PENDING -> SENT, or PENDING -> FAILED -> PENDING when a send failed and the
 * run is retried. Only PENDING tokens change status on markSent and markFailed, so a SENT token
 * is final.
 */
public abstract class JdbcDispatchLedger implements DispatchLedger {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDispatchLedger.class);

    static final String STATUS_PENDING = "PENDING";
    static final String STATUS_SENT = "SENT";
    static final String STATUS_FAILED = "FAILED";

    protected final DataSource dataSource;

    protected JdbcDispatchLedger(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public boolean begin(String token, String groupKey, String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getClaimSql())) {
            ps.setString(1, token);
            ps.setString(2, groupKey);
            ps.setString(3, runId);

            boolean claimed = ps.executeUpdate() > 0;
            if (claimed) {
                LOG.debug("Claimed dispatch token {} for group {} in run {}", token, groupKey, runId);
            } else {
                LOG.debug("Dispatch token {} already pending or sent", token);
            }
            return claimed;
        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.debug("Dispatch token {} claimed concurrently", token);
                return false;
            }
            throw ExceptionTranslator.translateException(e, "claim dispatch token " + token, LOG);
        }
    }

    @Override
    @Transactional
    public void markSent(String token) {
        updateStatus(token, STATUS_SENT, null);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isSent(String token) {
        String sql = "SELECT status FROM notification_dispatch WHERE token = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, token);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && STATUS_SENT.equals(rs.getString("status"));
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "read dispatch token " + token, LOG);
        }
    }

    @Override
    @Transactional
    public void markFailed(String token, String error) {
        updateStatus(token, STATUS_FAILED, error);
    }

    private void updateStatus(String token, String status, String error) {
        String sql = """
                UPDATE notification_dispatch
                SET status = ?, last_error = ?, updated_at = CURRENT_TIMESTAMP
                WHERE token = ? AND status = 'PENDING'
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status);
            ps.setString(2, error);
            ps.setString(3, token);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No pending dispatch row for token {} when marking {}", token, status);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark dispatch " + token + " " + status, LOG);
        }
    }

    // Template method for database-specific SQL

    /**
     * Inserts a PENDING row for the token, or flips a FAILED row back to PENDING. Must update
     * nothing when the row is PENDING or SENT. Parameters: token, group key, run id.
     */
    protected abstract String getClaimSql();
}
