package space.ketterling.congestion.training;

import space.ketterling.congestion.ml.TrainingMetrics;

/**
 * Records training runs.
 */
public interface ModelRunLog {

    /**
     * Opens a run and returns its id.
     */
    long start(String modelName, String featureVersion, String trainingSource) throws Exception;

    void finishSuccess(long runId, String modelVersion, int samples, TrainingMetrics metrics, String artifactPath)
            throws Exception;

    void finishFailure(long runId, String error) throws Exception;
}
