package space.ketterling.congestion.ml;

import space.ketterling.congestion.error.FeatureShapeException;
import space.ketterling.congestion.error.ModelNotLoadedException;
import space.ketterling.congestion.model.FeatureVector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores feature vectors with the currently installed model.
 *
 * <p>
 * The two regressor outputs are averaged and clipped to 0-100. Confidence
 * starts at 95 and drops by the gap between the two, never below 70.
 * </p>
 */
public final class EnsemblePredictor {
    public static final String MODEL_TYPE = "ensemble";
    public static final double MAX_CONFIDENCE = 95.0;
    public static final double MIN_CONFIDENCE = 70.0;

    private final ModelHolder holder;

    public EnsemblePredictor(ModelHolder holder) {
        this.holder = holder;
    }

    /**
     * The model to score with. Callers scoring several vectors should take
     * one snapshot so every vector sees the same model.
     */
    public TrainedModel snapshot() {
        TrainedModel m = holder.current().orElse(null);
        if (m == null)
            throw new ModelNotLoadedException("no model is loaded");
        if (!m.isComplete())
            throw new ModelNotLoadedException("model " + m.version() + " is missing a regressor");
        return m;
    }

    public EnsemblePrediction predict(FeatureVector features) {
        return predict(snapshot(), features);
    }

    public EnsemblePrediction predict(TrainedModel model, FeatureVector features) {
        if (model == null || !model.isComplete())
            throw new ModelNotLoadedException("no complete model is loaded");
        checkShape(model.featureNames(), features);

        double[] scaled = model.scaler().transform(features.toArray());
        double a = model.stable().predict(scaled);
        double b = model.reactive().predict(scaled);

        double congestion = clip((a + b) / 2.0, 0, 100);
        double confidence = clip(MAX_CONFIDENCE - Math.abs(a - b), MIN_CONFIDENCE, MAX_CONFIDENCE);
        return new EnsemblePrediction(congestion, confidence, a, b, model.version());
    }

    /**
     * Importance per feature name, averaged over both regressors and
     * normalized to sum to 1. Empty when no model is loaded.
     */
    public Map<String, Double> featureImportance() {
        TrainedModel m = holder.current().orElse(null);
        Map<String, Double> out = new LinkedHashMap<>();
        if (m == null || !m.isComplete())
            return out;
        double[] a = m.stable().featureImportance();
        double[] b = m.reactive().featureImportance();
        List<String> names = m.featureNames();
        double total = 0;
        double[] avg = new double[names.size()];
        for (int i = 0; i < avg.length; i++) {
            avg[i] = (valueAt(a, i) + valueAt(b, i)) / 2.0;
            total += avg[i];
        }
        for (int i = 0; i < avg.length; i++)
            out.put(names.get(i), total > 0 ? avg[i] / total : 0.0);
        return out;
    }

    public ModelInfo modelInfo() {
        TrainedModel m = holder.current().orElse(null);
        if (m == null || !m.isComplete())
            return ModelInfo.notLoaded();
        return new ModelInfo(true, MODEL_TYPE, m.version(), m.schemaVersion(), m.featureNames(),
                m.stable().type(), m.reactive().type(), m.trainedAt(), m.trainingSource(), m.metrics());
    }

    private static void checkShape(List<String> expected, FeatureVector features) {
        if (features.size() != expected.size()) {
            throw new FeatureShapeException("feature vector has " + features.size()
                    + " fields, model expects " + expected.size());
        }
        List<String> names = features.names();
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).equals(names.get(i))) {
                throw new FeatureShapeException("feature " + i + " is '" + names.get(i)
                        + "', model expects '" + expected.get(i) + "'");
            }
        }
    }

    private static double valueAt(double[] arr, int i) {
        return i < arr.length ? arr[i] : 0.0;
    }

    static double clip(double v, double lo, double hi) {
        if (Double.isNaN(v))
            return lo;
        return Math.max(lo, Math.min(hi, v));
    }
}
