package space.ketterling.congestion.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.error.ModelNotLoadedException;
import space.ketterling.congestion.ml.EnsemblePredictor;
import space.ketterling.congestion.ml.ModelInfo;
import space.ketterling.congestion.ml.TrainingMetrics;

import java.util.Map;

/**
 * Model information, feature importance, retraining and run history.
 */
final class ApiRoutesModel {
    private static final Logger log = LoggerFactory.getLogger(ApiRoutesModel.class);

    private ApiRoutesModel() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        EnsemblePredictor predictor = api.services().predictor();

        app.get("/api/model/info", ctx -> ctx.json(modelInfo(om, predictor.modelInfo())));

        app.get("/api/model/features", ctx -> {
            Map<String, Double> importance = predictor.featureImportance();
            if (importance.isEmpty())
                throw new ModelNotLoadedException("feature importance not available");
            ObjectNode out = om.createObjectNode();
            out.set("feature_importance", ForecastJson.importance(om, importance));
            ctx.json(out);
        });

        app.post("/api/model/retrain", ctx -> {
            api.services().retrain().triggerNow();
            log.info("Manual retrain accepted");
            ctx.status(202).json(om.createObjectNode()
                    .put("status", "accepted")
                    .put("message", "retrain started"));
        });

        app.get("/api/model/runs", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 25, 1, 200);
            ArrayNode arr = om.createArrayNode();
            for (var r : api.services().modelRuns().list(limit)) {
                ObjectNode row = om.createObjectNode();
                row.put("run_id", r.runId());
                row.put("model_name", r.modelName());
                ApiServer.putNullable(row, "model_version", r.modelVersion());
                row.put("feature_version", r.featureVersion());
                ApiServer.putNullable(row, "training_source", r.trainingSource());
                row.put("status", r.status());
                ApiServer.putNullable(row, "sample_count", r.sampleCount());
                ApiServer.putNullable(row, "rmse", r.rmse());
                ApiServer.putNullable(row, "mae", r.mae());
                ApiServer.putNullable(row, "r2", r.r2());
                ApiServer.putNullable(row, "error", r.error());
                row.put("started_at", r.startedAt());
                ApiServer.putNullable(row, "finished_at", r.finishedAt());
                arr.add(row);
            }
            ctx.json(arr);
        });
    }

    static ObjectNode modelInfo(ObjectMapper om, ModelInfo info) {
        ObjectNode out = om.createObjectNode();
        out.put("loaded", info.loaded());
        out.put("model_type", info.modelType());
        ApiServer.putNullable(out, "model_version", info.version());
        ApiServer.putNullable(out, "feature_version", info.schemaVersion());
        ArrayNode names = out.putArray("features");
        info.featureNames().forEach(names::add);
        ApiServer.putNullable(out, "stable_model", info.stableType());
        ApiServer.putNullable(out, "reactive_model", info.reactiveType());
        ApiServer.putNullable(out, "trained_at", info.trainedAt());
        ApiServer.putNullable(out, "training_source", info.trainingSource());
        TrainingMetrics m = info.metrics();
        if (m != null) {
            ObjectNode mn = out.putObject("metrics");
            mn.put("mse", m.mse());
            mn.put("rmse", m.rmse());
            mn.put("mae", m.mae());
            mn.put("r2", m.r2());
            mn.put("train_samples", m.trainSamples());
            mn.put("test_samples", m.testSamples());
        }
        return out;
    }
}
