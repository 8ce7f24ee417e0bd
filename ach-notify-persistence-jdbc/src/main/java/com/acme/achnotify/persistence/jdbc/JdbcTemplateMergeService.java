package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.core.PermanentException;
import com.acme.achnotify.core.TemplatePlaceholders;
import com.acme.achnotify.domain.MergedEmail;
import com.acme.achnotify.spi.TemplateMergeService;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Merges an email template with the sending employee and the receiving vendor.
 *
 * <p>Placeholders available in subject and body: {@code ${author.name}},
 * {@code ${author.email}}, {@code ${recipient.name}}, {@code ${recipient.email}} and
 * {@code ${recipient.id}}. Values merged into an HTML body are escaped.
 */
@Singleton
public class JdbcTemplateMergeService implements TemplateMergeService {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcTemplateMergeService.class);

    private final DataSource dataSource;

    public JdbcTemplateMergeService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public MergedEmail mergeTemplate(String templateId, String authorId, String recipientId) {
        try (Connection conn = dataSource.getConnection()) {
            Map<String, Object> values = new HashMap<>();
            putParty(conn, "SELECT name, email FROM employee WHERE id = ?", authorId, "author", values);
            putParty(conn, "SELECT company_name, email FROM vendor WHERE id = ?", recipientId, "recipient", values);
            values.put("recipient.id", recipientId);

            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT subject, body, is_html FROM email_template WHERE template_id = ?")) {
                ps.setString(1, templateId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new PermanentException("Email template not found: " + templateId);
                    }
                    LOG.debug("Merging email template {} for recipient {}", templateId, recipientId);
                    boolean html = rs.getBoolean("is_html");
                    String body = html
                            ? TemplatePlaceholders.fillHtml(rs.getString("body"), values)
                            : TemplatePlaceholders.fill(rs.getString("body"), values);
                    return new MergedEmail(
                            TemplatePlaceholders.fill(rs.getString("subject"), values), body, html);
                }
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "merge email template " + templateId, LOG);
        }
    }

    private void putParty(Connection conn, String sql, String id, String prefix, Map<String, Object> values)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new PermanentException("No " + prefix + " found with ID " + id);
                }
                values.put(prefix + ".name", rs.getString(1));
                values.put(prefix + ".email", rs.getString(2));
            }
        }
    }
}
