package space.ketterling.congestion.error;

/**
 * Unknown location, or a location without any recorded observation.
 */
public class NotFoundException extends ForecastException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
