package space.ketterling.congestion.training;

import java.util.Objects;

/**
 * Feature rows (in {@code FeatureSchema} order) with their congestion labels
 * on the 0-100 scale.
 */
public record TrainingData(double[][] rows, double[] labels, String source) {

    public TrainingData {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(labels, "labels");
    }

    public int size() {
        return rows.length;
    }
}
