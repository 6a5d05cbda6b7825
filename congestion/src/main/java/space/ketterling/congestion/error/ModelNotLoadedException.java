package space.ketterling.congestion.error;

/**
 * No trained ensemble is available. Predictions fail until a model is loaded.
 */
public class ModelNotLoadedException extends ForecastException {
    public ModelNotLoadedException(String message) {
        super(ErrorKind.MODEL_NOT_LOADED, message);
    }
}
