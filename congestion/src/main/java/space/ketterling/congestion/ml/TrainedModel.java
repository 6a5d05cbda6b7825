package space.ketterling.congestion.ml;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, fully fitted model: both regressors, the scaler they were
 * trained behind, and the feature layout they expect.
 */
public record TrainedModel(
        String version,
        String schemaVersion,
        List<String> featureNames,
        FeatureScaler scaler,
        Regressor stable,
        Regressor reactive,
        Instant trainedAt,
        String trainingSource,
        TrainingMetrics metrics) {

    public TrainedModel {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(schemaVersion, "schemaVersion");
        featureNames = List.copyOf(featureNames);
        Objects.requireNonNull(scaler, "scaler");
        Objects.requireNonNull(trainedAt, "trainedAt");
        if (scaler.size() != featureNames.size())
            throw new IllegalArgumentException("scaler has " + scaler.size() + " columns, model has "
                    + featureNames.size() + " features");
    }

    public boolean isComplete() {
        return stable != null && reactive != null && stable.isFitted() && reactive.isFitted();
    }
}
