package space.ketterling.congestion.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import space.ketterling.congestion.db.PredictionRepo;
import space.ketterling.congestion.error.InvalidRequestException;
import space.ketterling.congestion.forecast.PredictionService;

import java.util.ArrayList;
import java.util.List;

/**
 * Forecast endpoints: multi-horizon forecasts per location, stored history
 * and single-point scoring.
 */
final class ApiRoutesPredictions {
    private ApiRoutesPredictions() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        PredictionService predictions = api.services().predictions();
        PredictionRepo predictionRepo = api.services().predictionRepo();

        app.post("/api/predictions/{locationId}", ctx -> {
            String locationId = ctx.pathParam("locationId");
            JsonNode body = ApiServer.readBody(om, ctx);
            List<Integer> horizons = readHorizons(body.get("forecast_hours"));
            boolean includeFeatures = body.path("include_features").asBoolean(false);

            var response = predictions.predict(locationId, horizons, includeFeatures);
            ctx.json(ForecastJson.response(om, response));
        });

        app.get("/api/predictions/{locationId}/latest", ctx -> {
            String locationId = ctx.pathParam("locationId");
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 24, 1, 500);

            ArrayNode arr = om.createArrayNode();
            for (var p : predictionRepo.latest(locationId, limit)) {
                ObjectNode row = om.createObjectNode();
                row.put("location_id", p.locationId());
                row.put("prediction_time", p.predictionTime());
                row.put("timestamp", p.targetTime());
                row.put("hours_ahead", p.horizonHours());
                row.put("predicted_congestion_level", p.congestionLevel());
                row.put("predicted_congestion_percent", ForecastJson.round(p.predictedCongestion(), 2));
                row.put("confidence", p.confidence());
                row.put("horizon_confidence", p.horizonConfidence());
                row.put("model_type", p.modelType());
                ApiServer.putNullable(row, "model_version", p.modelVersion());
                arr.add(row);
            }
            ctx.json(arr);
        });

        app.post("/api/predict", ctx -> {
            JsonNode body = ApiServer.readBody(om, ctx);
            if (!body.hasNonNull("hour") || !body.hasNonNull("day_of_week"))
                throw new InvalidRequestException("hour and day_of_week are required");
            if (!body.get("hour").canConvertToInt() || !body.get("day_of_week").canConvertToInt())
                throw new InvalidRequestException("hour and day_of_week must be integers");

            double freeFlow = body.path("free_flow_speed").asDouble(api.cfg().freeFlowSpeed());
            var score = predictions.scorePoint(
                    body.get("hour").asInt(),
                    body.get("day_of_week").asInt(),
                    body.path("lat").asDouble(0),
                    body.path("lon").asDouble(0),
                    freeFlow);

            ObjectNode out = om.createObjectNode();
            out.put("congestion_level", ForecastJson.round(score.congestion(), 2));
            out.put("congestion_class", score.congestionLevel());
            out.put("confidence", ForecastJson.round(score.confidence(), 2));
            out.put("current_speed", ForecastJson.round(score.currentSpeed(), 2));
            out.put("free_flow_speed", score.freeFlowSpeed());
            out.put("speed_reduction_percent", ForecastJson.round(score.speedReductionPercent(), 2));
            ApiServer.putNullable(out, "model_version", score.modelVersion());
            ctx.json(out);
        });
    }

    /**
     * Reads {@code forecast_hours}; absent means the defaults.
     */
    static List<Integer> readHorizons(JsonNode node) {
        if (node == null || node.isNull())
            return null;
        if (!node.isArray())
            throw new InvalidRequestException("forecast_hours must be an array of integers");
        List<Integer> out = new ArrayList<>();
        for (JsonNode n : node) {
            if (!n.isIntegralNumber())
                throw new InvalidRequestException("forecast_hours must be an array of integers");
            out.add(n.asInt());
        }
        return out;
    }
}
