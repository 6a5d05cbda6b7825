package space.ketterling.congestion.model;

/**
 * A requested horizon that could not be computed.
 *
 * @param reason short code: {@code feature_shape}, {@code model_not_loaded},
 *               {@code timeout} or {@code error}
 */
public record HorizonFailure(int horizonHours, String reason, String message) {
    public static final String FEATURE_SHAPE = "feature_shape";
    public static final String MODEL_NOT_LOADED = "model_not_loaded";
    public static final String TIMEOUT = "timeout";
    public static final String ERROR = "error";
}
