package space.ketterling.congestion.error;

/**
 * Error kinds surfaced by the forecasting engine.
 *
 * <p>
 * Each kind carries the category a caller needs to decide what to do next
 * and the HTTP status the API answers with.
 * </p>
 */
public enum ErrorKind {
    MODEL_NOT_LOADED(Category.RETRY_LATER, 503),
    FEATURE_SHAPE(Category.FIX_CALLER, 500),
    INVALID_REQUEST(Category.FIX_CALLER, 400),
    NOT_FOUND(Category.FIX_CALLER, 404),
    PARTIAL_HORIZON(Category.DEGRADED, 200),
    CACHE_UNAVAILABLE(Category.DEGRADED, 200),
    TRAINING_DATA_INSUFFICIENT(Category.DATA_PROBLEM, 422),
    RETRAIN_IN_PROGRESS(Category.RETRY_LATER, 409);

    /**
     * What the caller should do about an error.
     */
    public enum Category {
        RETRY_LATER,
        FIX_CALLER,
        DATA_PROBLEM,
        DEGRADED
    }

    private final Category category;
    private final int httpStatus;

    ErrorKind(Category category, int httpStatus) {
        this.category = category;
        this.httpStatus = httpStatus;
    }

    public Category category() {
        return category;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Lower-case wire name, e.g. {@code model_not_loaded}.
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
