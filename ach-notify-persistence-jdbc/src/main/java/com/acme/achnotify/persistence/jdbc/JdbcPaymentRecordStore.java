package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.core.PermanentException;
import com.acme.achnotify.domain.PaymentRecord;
import com.acme.achnotify.domain.RecordType;
import com.acme.achnotify.spi.PaymentRecordStore;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads payment records as column maps and writes back only the changed columns. Column names
 * always come from the table's own metadata, never from callers.
 */
@Singleton
public class JdbcPaymentRecordStore implements PaymentRecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcPaymentRecordStore.class);

    private final DataSource dataSource;

    public JdbcPaymentRecordStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentRecord load(RecordType type, String id) {
        String sql = "SELECT * FROM " + type.getTableName() + " WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new PermanentException("Record not found: " + type.getTableName() + " " + id);
                }
                ResultSetMetaData meta = rs.getMetaData();
                Map<String, Object> fields = new LinkedHashMap<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    fields.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
                }
                return new PaymentRecord(type, id, fields);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "load " + type.getTableName() + " " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void save(PaymentRecord record) {
        if (record.getDirtyFields().isEmpty()) {
            return;
        }
        List<String> columns = new ArrayList<>(record.getDirtyFields());
        StringBuilder sql = new StringBuilder("UPDATE ")
                .append(record.getType().getTableName())
                .append(" SET ");
        for (int i = 0; i < columns.size(); i++) {
            sql.append(i == 0 ? "" : ", ").append(columns.get(i)).append(" = ?");
        }
        sql.append(" WHERE id = ?");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int index = 1;
            for (String column : columns) {
                ps.setObject(index++, record.getValue(column));
            }
            ps.setString(index, record.getId());

            int updated = ps.executeUpdate();
            if (updated == 0) {
                throw new PermanentException(
                        "Record not found: " + record.getType().getTableName() + " " + record.getId());
            }
            LOG.debug("Saved {} {}: {}", record.getType().getTableName(), record.getId(), columns);
            record.markClean();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                    e, "save " + record.getType().getTableName() + " " + record.getId(), LOG);
        }
    }
}
