package space.ketterling.congestion.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.forecast.ForecastSink;
import space.ketterling.congestion.model.ForecastPoint;
import space.ketterling.congestion.model.ForecastSet;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores computed forecasts in {@code traffic_prediction}.
 */
public class PredictionRepo implements ForecastSink {
    private static final Logger log = LoggerFactory.getLogger(PredictionRepo.class);

    private final HikariDataSource ds;

    public PredictionRepo(HikariDataSource ds) {
        this.ds = ds;
        ensureTable();
    }

    private void ensureTable() {
        String sql = """
                CREATE TABLE IF NOT EXISTS traffic_prediction (
                    id BIGSERIAL PRIMARY KEY,
                    location_id TEXT NOT NULL,
                    prediction_time TIMESTAMPTZ NOT NULL,
                    target_time TIMESTAMPTZ NOT NULL,
                    horizon_hours INTEGER NOT NULL,
                    predicted_congestion DOUBLE PRECISION NOT NULL,
                    congestion_level INTEGER NOT NULL,
                    confidence DOUBLE PRECISION,
                    horizon_confidence DOUBLE PRECISION,
                    model_type TEXT,
                    model_version TEXT,
                    created_at TIMESTAMPTZ DEFAULT now()
                )
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.execute();
        } catch (Exception e) {
            log.warn("Could not ensure traffic_prediction table: {}", e.getMessage());
        }
    }

    /**
     * Writes every point of the set in one batch.
     */
    @Override
    public void store(String locationId, ForecastSet set, String modelType, String modelVersion) throws Exception {
        String sql = """
                INSERT INTO traffic_prediction (location_id, prediction_time, target_time, horizon_hours,
                    predicted_congestion, congestion_level, confidence, horizon_confidence, model_type, model_version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (ForecastPoint p : set.points()) {
                ps.setString(1, locationId);
                ps.setTimestamp(2, Timestamp.from(set.asOf()));
                ps.setTimestamp(3, Timestamp.from(p.targetTime()));
                ps.setInt(4, p.horizonHours());
                ps.setDouble(5, p.predictedCongestion());
                ps.setInt(6, p.congestionLevel());
                ps.setDouble(7, p.confidence());
                ps.setDouble(8, p.horizonConfidence());
                ps.setString(9, modelType);
                ps.setString(10, modelVersion);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        log.debug("Stored {} forecast points for {}", set.points().size(), locationId);
    }

    /**
     * Most recent stored predictions for a location, newest first.
     */
    public List<StoredPrediction> latest(String locationId, int limit) throws Exception {
        String sql = """
                SELECT location_id, prediction_time, target_time, horizon_hours, predicted_congestion,
                       congestion_level, confidence, horizon_confidence, model_type, model_version
                FROM traffic_prediction
                WHERE location_id = ?
                ORDER BY prediction_time DESC, horizon_hours ASC
                LIMIT ?
                """;
        List<StoredPrediction> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StoredPrediction(
                            rs.getString("location_id"),
                            rs.getTimestamp("prediction_time").toInstant().toString(),
                            rs.getTimestamp("target_time").toInstant().toString(),
                            rs.getInt("horizon_hours"),
                            rs.getDouble("predicted_congestion"),
                            rs.getInt("congestion_level"),
                            rs.getDouble("confidence"),
                            rs.getDouble("horizon_confidence"),
                            rs.getString("model_type"),
                            rs.getString("model_version")));
                }
            }
        }
        return out;
    }

    public record StoredPrediction(
            String locationId,
            String predictionTime,
            String targetTime,
            int horizonHours,
            double predictedCongestion,
            int congestionLevel,
            double confidence,
            double horizonConfidence,
            String modelType,
            String modelVersion) {
    }
}
