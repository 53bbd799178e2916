package com.schemalens.dialects.jdbc;

import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.CatalogReader;
import com.schemalens.core.catalog.CatalogRows;
import com.schemalens.core.catalog.DatabaseInfo;
import com.schemalens.core.catalog.QueryFailureException;
import com.schemalens.core.catalog.RawRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs a dialect's catalog queries over one JDBC connection, sequentially. Values are
 * turned into strings, booleans and exact numbers; large objects are read as text.
 * The connection is owned by the caller.
 */
public class JdbcCatalogReader implements CatalogReader {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCatalogReader.class);

    private final Connection connection;
    private final JdbcDialect dialect;

    public JdbcCatalogReader(Connection connection, JdbcDialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    @Override
    public DatabaseInfo describe() throws QueryFailureException {
        try {
            List<RawRow> rows = query(dialect.describeQuery());
            if (rows.isEmpty()) {
                throw new QueryFailureException(CatalogKind.SCHEMAS, new SQLException("describe query returned no rows"));
            }
            return dialect.describe(rows.get(0));
        } catch (SQLException e) {
            throw new QueryFailureException(CatalogKind.SCHEMAS, e);
        }
    }

    @Override
    public CatalogRows list(CatalogKind kind) throws QueryFailureException {
        List<String> sqls = dialect.queries().get(kind);
        if (sqls == null || sqls.isEmpty()) {
            return CatalogRows.notApplicable();
        }
        List<RawRow> rows = new ArrayList<>();
        try {
            for (String sql : sqls) {
                rows.addAll(query(sql));
            }
        } catch (SQLException e) {
            throw new QueryFailureException(kind, e);
        }
        logger.debug("{} returned {} rows", kind, rows.size());
        return CatalogRows.of(rows);
    }

    private List<RawRow> query(String sql) throws SQLException {
        List<RawRow> result = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            int count = meta.getColumnCount();
            while (rs.next()) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 1; i <= count; i++) {
                    values.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), value(rs, i, meta.getColumnType(i)));
                }
                result.add(new RawRow(values));
            }
        }
        return result;
    }

    static Object value(ResultSet rs, int column, int sqlType) throws SQLException {
        switch (sqlType) {
            case Types.CLOB, Types.NCLOB, Types.LONGVARCHAR, Types.LONGNVARCHAR, Types.SQLXML -> {
                return rs.getString(column);
            }
            case Types.BLOB, Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY -> {
                return null;
            }
            case Types.BOOLEAN, Types.BIT -> {
                boolean b = rs.getBoolean(column);
                return rs.wasNull() ? null : b;
            }
            case Types.NUMERIC, Types.DECIMAL -> {
                return rs.getBigDecimal(column);
            }
            default -> {
                return normalize(rs.getObject(column));
            }
        }
    }

    static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long
                || value instanceof BigInteger || value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        return value.toString();
    }
}
