package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.core.TemplateNotFoundException;
import com.acme.achnotify.spi.EmailTemplateLookup;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/** Reads the account to email template mapping from {@code account_email_template}. */
@Singleton
public class JdbcEmailTemplateLookup implements EmailTemplateLookup {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcEmailTemplateLookup.class);

    private final DataSource dataSource;

    public JdbcEmailTemplateLookup(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public String findEmailTemplate(String accountId) {
        String sql = "SELECT email_template_id FROM account_email_template WHERE account_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, accountId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new TemplateNotFoundException(accountId);
                }
                return rs.getString(1);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                    e, "find email template for account " + accountId, LOG);
        }
    }
}
