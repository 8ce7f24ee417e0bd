package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.domain.RawPaymentRecord;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps one row of a saved search to a {@link RawPaymentRecord}.
 *
 * <p>The column {@code id} becomes the record id. A column labelled {@code <field>.text} is the
 * display text of {@code <field>}; both are combined into a {@code {value, text}} select pair.
 * Every other column is a scalar field.
 */
public class SearchRowMapper {

    static final String ID_COLUMN = "id";
    static final String TEXT_SUFFIX = ".text";

    public RawPaymentRecord map(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        String recordId = null;
        Map<String, Object> scalars = new LinkedHashMap<>();
        Map<String, Object> texts = new LinkedHashMap<>();

        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String label = meta.getColumnLabel(i).toLowerCase(Locale.ROOT);
            Object value = rs.getObject(i);
            if (label.equals(ID_COLUMN)) {
                recordId = value != null ? value.toString() : null;
            } else if (label.endsWith(TEXT_SUFFIX)) {
                texts.put(label.substring(0, label.length() - TEXT_SUFFIX.length()), value);
            } else {
                scalars.put(label, value);
            }
        }

        Map<String, Object> values = new LinkedHashMap<>(scalars);
        texts.forEach((field, text) -> {
            Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("value", scalars.get(field));
            pair.put("text", text);
            values.put(field, pair);
        });
        return new RawPaymentRecord(recordId, values);
    }
}
