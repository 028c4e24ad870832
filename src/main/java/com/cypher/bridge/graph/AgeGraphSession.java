package com.cypher.bridge.graph;

import com.cypher.bridge.core.model.ColumnSpec;
import com.cypher.bridge.core.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphSession} over a single PostgreSQL connection with the Apache AGE extension.
 *
 * <p>Each query is sent as
 * {@code SELECT * FROM cypher('<graph>', $$ <query> $$) AS (<columns>);}.
 * Auto-commit is switched off so the caller controls commit and rollback.</p>
 */
public class AgeGraphSession implements GraphSession {
    private static final Logger log = LoggerFactory.getLogger(AgeGraphSession.class);

    private final Connection connection;
    private final AgtypeDecoder decoder;

    public AgeGraphSession(Connection connection) {
        this(connection, true);
    }

    /**
     * @param connection   open connection; closed by {@link #close()}
     * @param decodeAgtype if false, values are returned as the raw agtype text
     */
    public AgeGraphSession(Connection connection, boolean decodeAgtype) {
        this.connection = connection;
        this.decoder = decodeAgtype ? new AgtypeDecoder() : null;
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw BridgeException.from(e);
        }
    }

    static final String DOLLAR_QUOTE = "$$";

    /**
     * Builds the bridge SQL for one query.
     *
     * @throws IllegalArgumentException if the graph name is not an identifier or the
     *                                  query contains {@code $$}, which would end the dollar quote
     */
    public static String buildSql(String graphName, String query, ColumnSpec schema) {
        return "SELECT * FROM cypher('" + GraphNames.validate(graphName) + "', $$ " + validateQuery(query)
                + " $$) AS " + schema.toSql() + ";";
    }

    static String validateQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Cypher query must not be blank");
        }
        if (query.contains(DOLLAR_QUOTE)) {
            throw new IllegalArgumentException("Cypher query must not contain '$$'");
        }
        return query;
    }

    @Override
    public List<Row> cypher(String graphName, String query, ColumnSpec schema) {
        String sql = buildSql(graphName, query, schema);
        log.debug("DB IN  > {}", sql);
        List<Row> rows = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            int columnCount = meta.getColumnCount();
            List<String> names = schema.names();
            while (rs.next()) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    String key = i <= names.size() ? names.get(i - 1) : meta.getColumnLabel(i);
                    values.put(key, toValue(rs.getString(i)));
                }
                rows.add(new Row(values));
            }
        } catch (SQLException e) {
            throw BridgeException.from(e);
        }
        log.debug("DB OUT < rows={} sample={}", rows.size(), rows.isEmpty() ? null : rows.get(0));
        return rows;
    }

    private Object toValue(String text) {
        return decoder != null ? decoder.decode(text) : text;
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw BridgeException.from(e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw BridgeException.from(e);
        }
    }

    @Override
    public boolean isOpen() {
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            log.warn("Connection state check failed", e);
            return false;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing AGE session connection", e);
        }
        log.info("AGE session closed");
    }
}
