package fr.lapetina.aigateway.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.infrastructure.store.H2Database;
import fr.lapetina.aigateway.infrastructure.store.H2Database.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistent cache tier in the {@code cache_entries} table. Authoritative for the cache.
 */
public final class CacheStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS cache_entries (
                fingerprint VARCHAR(64) PRIMARY KEY,
                scope VARCHAR(255) NOT NULL,
                embedding VARBINARY(65536),
                response CLOB NOT NULL,
                created_at BIGINT NOT NULL,
                expires_at BIGINT NOT NULL,
                hit_count BIGINT DEFAULT 0 NOT NULL
            )""";
    private static final String CREATE_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_cache_entries_expires ON cache_entries(expires_at)";

    private final H2Database database;
    private final ObjectMapper objectMapper;

    public CacheStore(H2Database database, ObjectMapper objectMapper) {
        this.database = database;
        this.objectMapper = objectMapper;
        database.execute(CREATE_TABLE, CREATE_INDEX);
    }

    public Optional<CacheEntry> get(String fingerprint) {
        String sql = "SELECT fingerprint, scope, embedding, response, created_at, expires_at "
                + "FROM cache_entries WHERE fingerprint = ?";
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, fingerprint);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(readEntry(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read cache entry " + fingerprint, e);
        }
    }

    /**
     * Inserts the entry unless an unexpired entry with the same fingerprint exists. An expired
     * entry is replaced.
     *
     * @return true if the entry was written
     */
    public synchronized boolean putIfAbsentOrExpired(CacheEntry entry, Instant now) {
        try (Connection connection = database.getConnection()) {
            connection.setAutoCommit(false);
            try {
                Long existingExpiry = readExpiry(connection, entry.fingerprint());
                boolean written;
                if (existingExpiry == null) {
                    insert(connection, entry);
                    written = true;
                } else if (existingExpiry <= now.toEpochMilli()) {
                    replace(connection, entry);
                    written = true;
                } else {
                    written = false;
                }
                connection.commit();
                return written;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to write cache entry " + entry.fingerprint(), e);
        }
    }

    private Long readExpiry(Connection connection, String fingerprint) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT expires_at FROM cache_entries WHERE fingerprint = ?")) {
            statement.setString(1, fingerprint);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    private void insert(Connection connection, CacheEntry entry) throws SQLException {
        String sql = "INSERT INTO cache_entries (scope, embedding, response, created_at, expires_at, fingerprint) "
                + "VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bindEntry(statement, entry);
            statement.executeUpdate();
        }
    }

    private void replace(Connection connection, CacheEntry entry) throws SQLException {
        String sql = "UPDATE cache_entries SET scope = ?, embedding = ?, response = ?, created_at = ?, "
                + "expires_at = ?, hit_count = 0 WHERE fingerprint = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bindEntry(statement, entry);
            statement.executeUpdate();
        }
    }

    private void bindEntry(PreparedStatement statement, CacheEntry entry) throws SQLException {
        statement.setString(1, entry.scope());
        if (entry.embedding() != null) {
            statement.setBytes(2, toBytes(entry.embedding()));
        } else {
            statement.setNull(2, Types.VARBINARY);
        }
        statement.setString(3, writeResponse(entry.response()));
        statement.setLong(4, entry.createdAt().toEpochMilli());
        statement.setLong(5, entry.expiresAt().toEpochMilli());
        statement.setString(6, entry.fingerprint());
    }

    public void recordHit(String fingerprint) {
        executeUpdate("UPDATE cache_entries SET hit_count = hit_count + 1 WHERE fingerprint = ?", fingerprint);
    }

    public long getHitCount(String fingerprint) {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT hit_count FROM cache_entries WHERE fingerprint = ?")) {
            statement.setString(1, fingerprint);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read hit count of " + fingerprint, e);
        }
    }

    /**
     * Embeddings of all unexpired entries that carry one.
     */
    public List<IndexedEmbedding> loadEmbeddings(Instant now) {
        String sql = "SELECT fingerprint, scope, embedding, expires_at FROM cache_entries "
                + "WHERE embedding IS NOT NULL AND expires_at > ?";
        List<IndexedEmbedding> result = new ArrayList<>();
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, now.toEpochMilli());
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(new IndexedEmbedding(
                            rs.getString(1),
                            rs.getString(2),
                            fromBytes(rs.getBytes(3)),
                            Instant.ofEpochMilli(rs.getLong(4))
                    ));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load cache embeddings", e);
        }
        return result;
    }

    public int deleteExpired(Instant now) {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "DELETE FROM cache_entries WHERE expires_at <= ?")) {
            statement.setLong(1, now.toEpochMilli());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to purge expired cache entries", e);
        }
    }

    public boolean delete(String fingerprint) {
        return executeUpdate("DELETE FROM cache_entries WHERE fingerprint = ?", fingerprint) > 0;
    }

    public int clear() {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM cache_entries")) {
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to clear cache entries", e);
        }
    }

    public long count() {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM cache_entries");
             ResultSet rs = statement.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new StoreException("Failed to count cache entries", e);
        }
    }

    private int executeUpdate(String sql, String fingerprint) {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, fingerprint);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Cache update failed for " + fingerprint, e);
        }
    }

    private CacheEntry readEntry(ResultSet rs) throws SQLException {
        byte[] embedding = rs.getBytes("embedding");
        return new CacheEntry(
                rs.getString("fingerprint"),
                rs.getString("scope"),
                embedding != null ? fromBytes(embedding) : null,
                readResponse(rs.getString("response")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("expires_at"))
        );
    }

    private String writeResponse(CompletionResult response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize cached response", e);
        }
    }

    private CompletionResult readResponse(String json) {
        try {
            return objectMapper.readValue(json, CompletionResult.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot deserialize cached response", e);
        }
    }

    static byte[] toBytes(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    static float[] fromBytes(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    @Override
    public void close() {
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing cache store", e);
        }
    }

    /**
     * Embedding of a stored entry, as kept by the similarity index.
     */
    public record IndexedEmbedding(String fingerprint, String scope, float[] vector, Instant expiresAt) {
        public boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
