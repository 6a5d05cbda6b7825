package space.ketterling.congestion.ml;

import java.time.Instant;
import java.util.List;

/**
 * Describes the served model for the info endpoint and health checks.
 */
public record ModelInfo(
        boolean loaded,
        String modelType,
        String version,
        String schemaVersion,
        List<String> featureNames,
        String stableType,
        String reactiveType,
        Instant trainedAt,
        String trainingSource,
        TrainingMetrics metrics) {

    public static ModelInfo notLoaded() {
        return new ModelInfo(false, EnsemblePredictor.MODEL_TYPE, null, null, List.of(), null, null, null, null,
                null);
    }
}
