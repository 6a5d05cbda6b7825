package space.ketterling.congestion.error;

/**
 * Base class for errors raised by the forecasting engine.
 */
public class ForecastException extends RuntimeException {
    private final ErrorKind kind;

    public ForecastException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ForecastException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
