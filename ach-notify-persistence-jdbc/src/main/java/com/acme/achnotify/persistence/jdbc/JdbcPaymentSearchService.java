package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.core.ConfigurationException;
import com.acme.achnotify.domain.RawPaymentRecord;
import com.acme.achnotify.spi.PaymentSearchService;
import com.acme.achnotify.spi.SearchResultSet;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs saved searches stored in the {@code saved_search} table. Each search is a SELECT whose
 * rows carry an {@code id} column plus the payment fields; it is paged by wrapping it in an
 * outer query ordered by id.
 *
 * <p>Counting and paging go back through this bean so each page read runs in its own read-only
 * transaction.
 */
@Singleton
public class JdbcPaymentSearchService implements PaymentSearchService {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcPaymentSearchService.class);

    private final DataSource dataSource;
    private final SearchRowMapper rowMapper = new SearchRowMapper();

    public JdbcPaymentSearchService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public SearchResultSet runSearch(String searchId) {
        String selectSql = loadSearch(searchId);
        LOG.debug("Loaded saved search {}", searchId);
        return new JdbcSearchResultSet(searchId, selectSql);
    }

    private String loadSearch(String searchId) {
        String sql = "SELECT select_sql FROM saved_search WHERE search_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, searchId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new ConfigurationException("Saved search not found: " + searchId);
                }
                return rs.getString(1);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "load saved search " + searchId, LOG);
        }
    }

    @Transactional(readOnly = true)
    public long countRows(String searchId, String selectSql) {
        String sql = "SELECT COUNT(*) FROM (" + selectSql + ") q";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count search " + searchId, LOG);
        }
    }

    @Transactional(readOnly = true)
    public List<RawPaymentRecord> readPage(String searchId, String selectSql, int pageIndex, int pageSize) {
        String sql = "SELECT * FROM (" + selectSql + ") q ORDER BY q.id LIMIT ? OFFSET ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, pageSize);
            ps.setLong(2, (long) pageIndex * pageSize);
            List<RawPaymentRecord> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(rowMapper.map(rs));
                }
            }
            LOG.debug("Read page {} of search {}: {} rows", pageIndex, searchId, rows.size());
            return rows;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                    e, "read page " + pageIndex + " of search " + searchId, LOG);
        }
    }

    private class JdbcSearchResultSet implements SearchResultSet {
        private final String searchId;
        private final String selectSql;

        JdbcSearchResultSet(String searchId, String selectSql) {
            this.searchId = searchId;
            this.selectSql = selectSql;
        }

        @Override
        public long count() {
            return countRows(searchId, selectSql);
        }

        @Override
        public List<RawPaymentRecord> page(int pageIndex, int pageSize) {
            return readPage(searchId, selectSql, pageIndex, pageSize);
        }
    }
}
