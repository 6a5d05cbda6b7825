package space.ketterling.congestion.api;

import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;

import space.ketterling.congestion.ml.ModelInfo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        HikariDataSource ds = api.ds();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "congestion-forecast",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "POST /api/predictions/{locationId}",
                        "GET /api/predictions/{locationId}/latest?limit=24",
                        "POST /api/predict",
                        "GET /api/model/info",
                        "GET /api/model/features",
                        "POST /api/model/retrain",
                        "GET /api/model/runs",
                        "GET /api/metrics/forecast"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());

            try (Connection c = ds.getConnection();
                    PreparedStatement ps = c.prepareStatement("SELECT 1");
                    ResultSet rs = ps.executeQuery()) {
                out.put("db", rs.next() ? "ok" : "unknown");
            } catch (Exception e) {
                out.put("db", "fail");
                out.put("db_error", e.getMessage());
                ctx.status(503);
            }

            ModelInfo info = api.services().predictor().modelInfo();
            out.put("model", info.loaded() ? "ok" : "not_loaded");
            if (info.loaded())
                out.put("model_version", info.version());
            else
                out.put("status", "degraded");

            ctx.json(out);
        });
    }
}
