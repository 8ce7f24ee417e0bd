package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.core.PermanentException;
import com.acme.achnotify.domain.PrintTemplate;
import com.acme.achnotify.spi.PrintTemplateStore;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

@Singleton
public class JdbcPrintTemplateStore implements PrintTemplateStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcPrintTemplateStore.class);

    private final DataSource dataSource;

    public JdbcPrintTemplateStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public PrintTemplate findPrintTemplate(String templateId) {
        String sql = "SELECT title, body FROM print_template WHERE template_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, templateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new PermanentException("Print template not found: " + templateId);
                }
                return new PrintTemplate(templateId, rs.getString("title"), rs.getString("body"));
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "load print template " + templateId, LOG);
        }
    }
}
