package fr.lapetina.aigateway.infrastructure.store;

import org.h2.jdbcx.JdbcConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Embedded H2 database backing the persistent cache tier and the usage ledger.
 *
 * A location starting with {@code jdbc:} is used as-is (tests use {@code jdbc:h2:mem:...});
 * anything else is treated as a file path.
 */
public final class H2Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(H2Database.class);

    private final String url;
    private final JdbcConnectionPool pool;

    private H2Database(String url) {
        this.url = url;
        this.pool = JdbcConnectionPool.create(url, "sa", "");
    }

    public static H2Database open(String location) {
        String url = toJdbcUrl(location);
        log.info("Opening H2 database: url={}", url);
        return new H2Database(url);
    }

    static String toJdbcUrl(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Database location is required");
        }
        if (location.startsWith("jdbc:")) {
            return location;
        }
        return "jdbc:h2:file:" + Path.of(location).toAbsolutePath().normalize();
    }

    public Connection getConnection() throws SQLException {
        return pool.getConnection();
    }

    /**
     * Runs DDL statements in order.
     */
    public void execute(String... statements) {
        try (Connection connection = getConnection(); Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize schema at " + url, e);
        }
    }

    public String getUrl() {
        return url;
    }

    @Override
    public void close() {
        pool.dispose();
        log.info("H2 database closed: url={}", url);
    }

    /**
     * Unchecked wrapper for storage failures.
     */
    public static class StoreException extends RuntimeException {
        public StoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
