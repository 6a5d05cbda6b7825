/*
* Copyright 2025 Taylor Ketterling
* API Server for the congestion forecasting service.
* utalizes Javalin for HTTP server and provides endpoints for forecasts and model management.
* uses Jackson for JSON processing and HikariCP for database connection pooling.
*/

package space.ketterling.congestion.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.config.AppConfig;
import space.ketterling.congestion.db.ModelRunRepo;
import space.ketterling.congestion.db.PredictionRepo;
import space.ketterling.congestion.error.ErrorKind;
import space.ketterling.congestion.error.ForecastException;
import space.ketterling.congestion.error.InvalidRequestException;
import space.ketterling.congestion.forecast.ForecastCache;
import space.ketterling.congestion.forecast.PredictionService;
import space.ketterling.congestion.ml.EnsemblePredictor;
import space.ketterling.congestion.training.RetrainScheduler;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HikariDataSource ds;
    private final Services services;
    private Javalin app;

    /**
     * What the routes need besides the data source.
     */
    public record Services(
            PredictionService predictions,
            EnsemblePredictor predictor,
            ForecastCache cache,
            PredictionRepo predictionRepo,
            ModelRunRepo modelRuns,
            RetrainScheduler retrain) {
    }

    public ApiServer(AppConfig cfg, ObjectMapper om, HikariDataSource ds, Services services) {
        this.cfg = cfg;
        this.om = om;
        this.ds = ds;
        this.services = services;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(ForecastException.class, (e, ctx) -> {
            if (e.kind().httpStatus() >= 500)
                log.warn("{} on {} {}: {}", e.kind().wireName(), ctx.method(), ctx.path(), e.getMessage());
            ctx.status(e.kind().httpStatus()).json(errorBody(om, e));
        });

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesPredictions.register(this);
        ApiRoutesModel.register(this);
        ApiRoutesMetrics.register(this);

        app.start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    HikariDataSource ds() {
        return ds;
    }

    AppConfig cfg() {
        return cfg;
    }

    Services services() {
        return services;
    }

    // --------------------------------------------------------------------
    // helpers shared by the route classes
    // --------------------------------------------------------------------

    /**
     * {@code {"error": kind, "category": ..., "message": ...}}
     */
    static ObjectNode errorBody(ObjectMapper om, ForecastException e) {
        ErrorKind kind = e.kind();
        return om.createObjectNode()
                .put("error", kind.wireName())
                .put("category", kind.category().name().toLowerCase())
                .put("message", e.getMessage() == null ? kind.wireName() : e.getMessage());
    }

    /**
     * Parses the request body as JSON; an empty body reads as an empty object.
     */
    static JsonNode readBody(ObjectMapper om, Context ctx) {
        String body = ctx.body();
        if (body == null || body.isBlank())
            return om.createObjectNode();
        try {
            return om.readTree(body);
        } catch (Exception e) {
            throw new InvalidRequestException("request body is not valid JSON");
        }
    }

    static void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Integer || value instanceof Long)
            obj.put(key, ((Number) value).longValue());
        else if (value instanceof Number n)
            obj.put(key, n.doubleValue());
        else
            obj.put(key, value.toString());
    }

    static Integer parseInt(String s, Integer def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
