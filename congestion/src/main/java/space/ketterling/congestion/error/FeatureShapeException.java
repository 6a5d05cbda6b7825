package space.ketterling.congestion.error;

/**
 * A feature vector does not match the schema the loaded model was trained on.
 */
public class FeatureShapeException extends ForecastException {
    public FeatureShapeException(String message) {
        super(ErrorKind.FEATURE_SHAPE, message);
    }
}
