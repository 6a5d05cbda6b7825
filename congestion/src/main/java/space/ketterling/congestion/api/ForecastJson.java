package space.ketterling.congestion.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import space.ketterling.congestion.forecast.PredictionService.PredictionResponse;
import space.ketterling.congestion.model.ForecastPoint;
import space.ketterling.congestion.model.ForecastSet;
import space.ketterling.congestion.model.HorizonFailure;

import java.util.Map;

/**
 * JSON rendering of forecast responses.
 */
final class ForecastJson {
    private ForecastJson() {
    }

    static ObjectNode response(ObjectMapper om, PredictionResponse r) {
        ObjectNode out = om.createObjectNode();
        out.put("location_id", r.location().id());
        ApiServer.putNullable(out, "location_name", r.location().name());
        out.put("prediction_time", r.predictionTime().toString());

        ForecastSet set = r.forecast();
        ArrayNode forecasts = out.putArray("forecasts");
        for (ForecastPoint p : set.points())
            forecasts.add(point(om, p));

        ArrayNode failures = out.putArray("failures");
        for (HorizonFailure f : set.failures()) {
            failures.add(om.createObjectNode()
                    .put("hours_ahead", f.horizonHours())
                    .put("reason", f.reason())
                    .put("message", f.message()));
        }
        out.put("partial", set.isPartial());
        out.put("model_type", r.modelType());
        ApiServer.putNullable(out, "model_version", r.modelVersion());

        if (r.featureImportance() != null)
            out.set("feature_importance", importance(om, r.featureImportance()));
        return out;
    }

    static ObjectNode point(ObjectMapper om, ForecastPoint p) {
        ObjectNode n = om.createObjectNode();
        n.put("timestamp", p.targetTime().toString());
        n.put("hours_ahead", p.horizonHours());
        n.put("predicted_congestion_level", p.congestionLevel());
        n.put("predicted_congestion_percent", round(p.predictedCongestion(), 2));
        n.put("confidence", round(p.confidence(), 4));
        n.put("horizon_confidence", round(p.horizonConfidence(), 4));
        n.put("model", p.model());
        return n;
    }

    static ObjectNode importance(ObjectMapper om, Map<String, Double> importance) {
        ObjectNode n = om.createObjectNode();
        importance.forEach((k, v) -> n.put(k, round(v, 6)));
        return n;
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
