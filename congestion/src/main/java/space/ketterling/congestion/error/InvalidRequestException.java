package space.ketterling.congestion.error;

public class InvalidRequestException extends ForecastException {
    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
