package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads a serialized {@link Regressor} back by its type tag.
 */
public final class Regressors {
    private Regressors() {
    }

    public static Regressor fromJson(JsonNode n) {
        String type = n.path("type").asText("");
        return switch (type) {
            case RandomForestRegressor.TYPE -> RandomForestRegressor.fromJson(n);
            case GradientBoostingRegressor.TYPE -> GradientBoostingRegressor.fromJson(n);
            default -> throw new IllegalArgumentException("unknown regressor type: " + type);
        };
    }
}
