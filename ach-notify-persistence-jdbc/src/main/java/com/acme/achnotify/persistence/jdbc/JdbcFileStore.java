package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.domain.VoucherFile;
import com.acme.achnotify.spi.FileStore;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/** Stores rendered vouchers in the {@code stored_file} table. */
@Singleton
public class JdbcFileStore implements FileStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcFileStore.class);

    private final DataSource dataSource;

    public JdbcFileStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public VoucherFile createFile(String name, byte[] contents, String folder) {
        String sql = """
                INSERT INTO stored_file (name, folder, content_type, contents, created_at)
                VALUES (?, ?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, new String[] {"id"})) {
            ps.setString(1, name);
            ps.setString(2, folder);
            ps.setString(3, VoucherFile.CONTENT_TYPE);
            ps.setBytes(4, contents);
            ps.setTimestamp(5, Timestamp.from(Instant.now()));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for stored file " + name);
                }
                String fileId = String.valueOf(keys.getLong(1));
                LOG.debug("Stored file {} in folder {} with id {}", name, folder, fileId);
                return new VoucherFile(fileId, name, folder, contents);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "store file " + name, LOG);
        }
    }
}
