package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A trainable regression model.
 *
 * <p>
 * Implementations are fitted once and read-only afterwards, so a fitted
 * instance can be shared by any number of predicting threads.
 * </p>
 */
public interface Regressor {

    /**
     * Stable type tag written into model bundles.
     */
    String type();

    /**
     * Fits the model on already scaled rows.
     */
    void fit(double[][] x, double[] y);

    boolean isFitted();

    double predict(double[] x);

    /**
     * Impurity-gain importance per input column, summing to 1 (or all zero
     * when no split was ever made).
     */
    double[] featureImportance();

    /**
     * Serializes the fitted state, including the {@link #type()} tag.
     */
    ObjectNode toJson(ObjectMapper om);
}
