package com.productvideo.matching.shared.db;

import com.productvideo.matching.shared.bus.RetryableException;
import com.productvideo.matching.shared.config.DatabaseConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLTransientException;

public final class JdbcSupport {
    private JdbcSupport() {}

    public static Connection open(DatabaseConfig config) throws SQLException {
        return DriverManager.getConnection(config.getJdbcUrl(), config.getUsername(), config.getPassword());
    }

    /**
     * Wraps a JDBC failure. Connection problems (SQLSTATE class 08) and transient
     * errors become {@link RetryableException} so the delivery is retried.
     */
    public static RuntimeException wrap(String message, SQLException e) {
        String state = e.getSQLState();
        if (e instanceof SQLTransientException || (state != null && state.startsWith("08"))) {
            return new RetryableException(message, e);
        }
        return new RuntimeException(message, e);
    }

    /** pgvector literal, e.g. {@code [0.1,0.2]}. */
    public static String vectorLiteral(float[] values) {
        StringBuilder sb = new StringBuilder(values.length * 8 + 2).append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(values[i]);
        }
        return sb.append(']').toString();
    }
}
