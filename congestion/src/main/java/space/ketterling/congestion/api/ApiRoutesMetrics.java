package space.ketterling.congestion.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import space.ketterling.congestion.metrics.ForecastMetrics;

/**
 * Rolling outcome counters and cache statistics.
 */
final class ApiRoutesMetrics {
    private ApiRoutesMetrics() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/metrics/forecast", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ForecastMetrics.windowMinutes());
            ArrayNode ops = out.putArray("operations");

            for (var e : ForecastMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("operation", e.getKey());
                row.put("calls_last_hour", snap.callsLastHour());
                row.put("failures_last_hour", snap.failuresLastHour());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                ops.add(row);
            }

            var stats = api.services().cache().stats();
            ObjectNode cache = out.putObject("cache");
            cache.put("size", stats.size());
            cache.put("hits", stats.hits());
            cache.put("misses", stats.misses());
            cache.put("hit_rate", stats.hitRate());
            cache.put("evictions", stats.evictions());

            out.put("retraining", api.services().retrain() != null && api.services().retrain().isRetraining());
            ctx.json(out);
        });
    }
}
