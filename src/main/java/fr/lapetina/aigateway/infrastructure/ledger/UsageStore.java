package fr.lapetina.aigateway.infrastructure.ledger;

import fr.lapetina.aigateway.infrastructure.store.H2Database;
import fr.lapetina.aigateway.infrastructure.store.H2Database.StoreException;
import org.h2.api.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only usage ledger in the {@code usage_records} table, with raised budget alerts kept
 * in the {@code budget_alerts} table.
 */
public final class UsageStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UsageStore.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS usage_records (
                request_id VARCHAR(128) PRIMARY KEY,
                provider_id VARCHAR(128) NOT NULL,
                model VARCHAR(255),
                input_tokens INT NOT NULL,
                output_tokens INT NOT NULL,
                cost DECIMAL(20, 10) NOT NULL,
                latency_ms BIGINT NOT NULL,
                recorded_at BIGINT NOT NULL,
                success BOOLEAN NOT NULL
            )""";
    private static final String CREATE_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_usage_records_time ON usage_records(recorded_at)";

    private static final String CREATE_ALERTS_TABLE = """
            CREATE TABLE IF NOT EXISTS budget_alerts (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                period VARCHAR(16) NOT NULL,
                consumed DECIMAL(20, 10) NOT NULL,
                limit_amount DECIMAL(20, 10) NOT NULL,
                threshold DOUBLE PRECISION NOT NULL,
                triggered_at BIGINT NOT NULL
            )""";

    private final H2Database database;

    public UsageStore(H2Database database) {
        this.database = database;
        database.execute(CREATE_TABLE, CREATE_INDEX, CREATE_ALERTS_TABLE);
    }

    /**
     * Appends a record.
     *
     * @return false if a record with the same request id already exists
     */
    public boolean append(UsageRecord record) {
        String sql = "INSERT INTO usage_records (request_id, provider_id, model, input_tokens, output_tokens, "
                + "cost, latency_ms, recorded_at, success) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.requestId());
            statement.setString(2, record.providerId());
            statement.setString(3, record.model());
            statement.setInt(4, record.inputTokens());
            statement.setInt(5, record.outputTokens());
            statement.setBigDecimal(6, record.cost());
            statement.setLong(7, record.latencyMs());
            statement.setLong(8, record.timestamp().toEpochMilli());
            statement.setBoolean(9, record.success());
            statement.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (e.getErrorCode() == ErrorCode.DUPLICATE_KEY_1) {
                log.debug("Duplicate usage record ignored: requestId={}", record.requestId());
                return false;
            }
            throw new StoreException("Failed to append usage record " + record.requestId(), e);
        }
    }

    /**
     * Total cost of records at or after the given instant.
     */
    public BigDecimal sumCostSince(Instant from) {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT COALESCE(SUM(cost), 0) FROM usage_records WHERE recorded_at >= ?")) {
            statement.setLong(1, from.toEpochMilli());
            try (ResultSet rs = statement.executeQuery()) {
                rs.next();
                return rs.getBigDecimal(1).stripTrailingZeros();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to sum usage cost", e);
        }
    }

    /**
     * Usage grouped by provider and model for records in {@code [from, to)}.
     */
    public List<UsageSummary> aggregateByProviderModel(Instant from, Instant to) {
        String sql = "SELECT provider_id, model, COUNT(*), SUM(input_tokens), SUM(output_tokens), SUM(cost) "
                + "FROM usage_records WHERE recorded_at >= ? AND recorded_at < ? "
                + "GROUP BY provider_id, model ORDER BY provider_id, model";
        List<UsageSummary> result = new ArrayList<>();
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, from.toEpochMilli());
            statement.setLong(2, to.toEpochMilli());
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(new UsageSummary(
                            rs.getString(1),
                            rs.getString(2),
                            rs.getLong(3),
                            rs.getLong(4),
                            rs.getLong(5),
                            rs.getBigDecimal(6).stripTrailingZeros()
                    ));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to aggregate usage", e);
        }
        return result;
    }

    public void appendAlert(BudgetAlert alert) {
        String sql = "INSERT INTO budget_alerts (period, consumed, limit_amount, threshold, triggered_at) "
                + "VALUES (?, ?, ?, ?, ?)";
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, alert.period().name());
            statement.setBigDecimal(2, alert.consumed());
            statement.setBigDecimal(3, alert.limit());
            statement.setDouble(4, alert.threshold());
            statement.setLong(5, alert.triggeredAt().toEpochMilli());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to append budget alert for " + alert.period().getName(), e);
        }
    }

    /**
     * Alerts raised at or after the given instant, most recent first.
     */
    public List<BudgetAlert> alertsSince(Instant from, int limit) {
        String sql = "SELECT period, consumed, limit_amount, threshold, triggered_at FROM budget_alerts "
                + "WHERE triggered_at >= ? ORDER BY triggered_at DESC, id DESC LIMIT ?";
        List<BudgetAlert> result = new ArrayList<>();
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, from.toEpochMilli());
            statement.setInt(2, limit);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(new BudgetAlert(
                            BudgetPeriod.valueOf(rs.getString(1)),
                            rs.getBigDecimal(2).stripTrailingZeros(),
                            rs.getBigDecimal(3).stripTrailingZeros(),
                            rs.getDouble(4),
                            Instant.ofEpochMilli(rs.getLong(5))
                    ));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list budget alerts", e);
        }
        return result;
    }

    public int purgeOlderThan(Instant cutoff) {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "DELETE FROM usage_records WHERE recorded_at < ?")) {
            statement.setLong(1, cutoff.toEpochMilli());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to purge usage records", e);
        }
    }

    public long count() {
        try (Connection connection = database.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM usage_records");
             ResultSet rs = statement.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new StoreException("Failed to count usage records", e);
        }
    }

    @Override
    public void close() {
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing usage store", e);
        }
    }
}
