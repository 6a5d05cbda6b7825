package space.ketterling.congestion.error;

/**
 * Too few samples to fit and evaluate an ensemble. The current model stays in
 * service.
 */
public class TrainingDataInsufficientException extends ForecastException {
    public TrainingDataInsufficientException(String message) {
        super(ErrorKind.TRAINING_DATA_INSUFFICIENT, message);
    }
}
