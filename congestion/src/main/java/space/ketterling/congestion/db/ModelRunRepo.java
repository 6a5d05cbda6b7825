package space.ketterling.congestion.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.ml.TrainingMetrics;
import space.ketterling.congestion.training.ModelRunLog;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Training run history ({@code ml_model_run}).
 */
public class ModelRunRepo implements ModelRunLog {
    private static final Logger log = LoggerFactory.getLogger(ModelRunRepo.class);

    private final HikariDataSource ds;

    public ModelRunRepo(HikariDataSource ds) {
        this.ds = ds;
        ensureTable();
    }

    private void ensureTable() {
        String sql = """
                CREATE TABLE IF NOT EXISTS ml_model_run (
                    run_id BIGSERIAL PRIMARY KEY,
                    model_name TEXT NOT NULL,
                    model_version TEXT,
                    feature_version TEXT NOT NULL,
                    training_source TEXT,
                    status TEXT NOT NULL,
                    sample_count INTEGER,
                    rmse DOUBLE PRECISION,
                    mae DOUBLE PRECISION,
                    r2 DOUBLE PRECISION,
                    artifact_path TEXT,
                    error TEXT,
                    started_at TIMESTAMPTZ DEFAULT now(),
                    finished_at TIMESTAMPTZ
                )
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.execute();
        } catch (Exception e) {
            log.warn("Could not ensure ml_model_run table: {}", e.getMessage());
        }
    }

    @Override
    public long start(String modelName, String featureVersion, String trainingSource) throws Exception {
        String sql = """
                INSERT INTO ml_model_run (model_name, feature_version, training_source, status)
                VALUES (?, ?, ?, 'running')
                RETURNING run_id
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, modelName);
            ps.setString(2, featureVersion);
            ps.setString(3, trainingSource);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return rs.getLong(1);
            }
        }
        return -1;
    }

    @Override
    public void finishSuccess(long runId, String modelVersion, int samples, TrainingMetrics metrics,
            String artifactPath) throws Exception {
        String sql = """
                UPDATE ml_model_run
                SET status = 'success', model_version = ?, sample_count = ?, rmse = ?, mae = ?, r2 = ?,
                    artifact_path = ?, finished_at = now()
                WHERE run_id = ?
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, modelVersion);
            ps.setInt(2, samples);
            ps.setDouble(3, metrics.rmse());
            ps.setDouble(4, metrics.mae());
            ps.setDouble(5, metrics.r2());
            ps.setString(6, artifactPath);
            ps.setLong(7, runId);
            ps.executeUpdate();
        }
    }

    @Override
    public void finishFailure(long runId, String error) throws Exception {
        String sql = "UPDATE ml_model_run SET status = 'failed', error = ?, finished_at = now() WHERE run_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, error);
            ps.setLong(2, runId);
            ps.executeUpdate();
        }
    }

    public List<ModelRun> list(int limit) throws Exception {
        String sql = """
                SELECT run_id, model_name, model_version, feature_version, training_source, status, sample_count,
                       rmse, mae, r2, error, started_at, finished_at
                FROM ml_model_run
                ORDER BY started_at DESC
                LIMIT ?
                """;
        List<ModelRun> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ModelRun(
                            rs.getLong("run_id"),
                            rs.getString("model_name"),
                            rs.getString("model_version"),
                            rs.getString("feature_version"),
                            rs.getString("training_source"),
                            rs.getString("status"),
                            (Integer) rs.getObject("sample_count"),
                            (Double) rs.getObject("rmse"),
                            (Double) rs.getObject("mae"),
                            (Double) rs.getObject("r2"),
                            rs.getString("error"),
                            String.valueOf(rs.getObject("started_at")),
                            rs.getObject("finished_at") == null ? null : String.valueOf(rs.getObject("finished_at"))));
                }
            }
        }
        return out;
    }

    public record ModelRun(
            long runId,
            String modelName,
            String modelVersion,
            String featureVersion,
            String trainingSource,
            String status,
            Integer sampleCount,
            Double rmse,
            Double mae,
            Double r2,
            String error,
            String startedAt,
            String finishedAt) {
    }
}
