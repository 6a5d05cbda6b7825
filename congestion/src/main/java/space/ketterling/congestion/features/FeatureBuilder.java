package space.ketterling.congestion.features;

import space.ketterling.congestion.model.FeatureSchema;
import space.ketterling.congestion.model.FeatureVector;
import space.ketterling.congestion.model.Observation;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Turns an observation plus its recent history into a model feature vector.
 *
 * <p>
 * Time features come from the instant being forecast, not from the
 * observation, so one observation can be featurized for several horizons.
 * Missing measurements fall back to fixed defaults; a short history falls
 * back to the default congestion / speed instead of failing.
 * </p>
 */
public final class FeatureBuilder {
    public static final double DEFAULT_TEMPERATURE = 20.0;
    public static final double DEFAULT_PRECIPITATION = 0.0;
    public static final double DEFAULT_VISIBILITY = 10.0;
    public static final double DEFAULT_VEHICLE_COUNT = 100;
    public static final double DEFAULT_AVERAGE_SPEED = 40.0;
    public static final double DEFAULT_CONGESTION_LEVEL = 2;

    /** Observations the lag features can look back over. */
    public static final int MAX_WINDOW = 24;

    private final ZoneId zone;

    public FeatureBuilder(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Builds the feature vector.
     *
     * @param observation      the current observation
     * @param asOfTime         the instant the features describe (the forecast
     *                         target)
     * @param historicalWindow earlier observations for the same location,
     *                         oldest first; may be empty or {@code null}
     */
    public FeatureVector build(Observation observation, Instant asOfTime, List<Observation> historicalWindow) {
        Objects.requireNonNull(observation, "observation");
        Objects.requireNonNull(asOfTime, "asOfTime");
        List<Observation> window = historicalWindow == null ? List.of() : historicalWindow;

        ZonedDateTime t = asOfTime.atZone(zone);
        int dayOfWeek = t.getDayOfWeek().getValue() - 1; // Monday = 0

        double[] v = new double[FeatureSchema.SIZE];
        v[FeatureSchema.HOUR_OF_DAY] = t.getHour();
        v[FeatureSchema.DAY_OF_WEEK] = dayOfWeek;
        v[FeatureSchema.IS_WEEKEND] = dayOfWeek >= 5 ? 1 : 0;
        v[FeatureSchema.IS_HOLIDAY] = flag(observation.holiday());

        v[FeatureSchema.TEMPERATURE] = orDefault(observation.temperature(), DEFAULT_TEMPERATURE);
        v[FeatureSchema.PRECIPITATION] = orDefault(observation.precipitation(), DEFAULT_PRECIPITATION);
        v[FeatureSchema.VISIBILITY] = orDefault(observation.visibility(), DEFAULT_VISIBILITY);

        v[FeatureSchema.VEHICLE_COUNT] = observation.vehicleCount() == null
                ? DEFAULT_VEHICLE_COUNT
                : observation.vehicleCount();
        v[FeatureSchema.AVERAGE_SPEED] = orDefault(observation.averageSpeed(), DEFAULT_AVERAGE_SPEED);
        v[FeatureSchema.INCIDENT_REPORTED] = flag(observation.incidentReported());
        v[FeatureSchema.EVENT_NEARBY] = flag(observation.eventNearby());

        if (window.isEmpty()) {
            v[FeatureSchema.CONGESTION_LAG_1H] = congestion(observation);
            v[FeatureSchema.CONGESTION_LAG_3H] = DEFAULT_CONGESTION_LEVEL;
            v[FeatureSchema.CONGESTION_LAG_24H] = DEFAULT_CONGESTION_LEVEL;
            v[FeatureSchema.SPEED_LAG_1H] = orDefault(observation.averageSpeed(), DEFAULT_AVERAGE_SPEED);
        } else {
            Observation last = window.get(window.size() - 1);
            v[FeatureSchema.CONGESTION_LAG_1H] = congestion(last);
            v[FeatureSchema.CONGESTION_LAG_3H] = congestionFromEnd(window, 3);
            v[FeatureSchema.CONGESTION_LAG_24H] = congestionFromEnd(window, 24);
            v[FeatureSchema.SPEED_LAG_1H] = orDefault(last.averageSpeed(), DEFAULT_AVERAGE_SPEED);
        }

        return FeatureVector.ofSchema(v);
    }

    /**
     * Congestion level {@code position} elements from the end (1 = last).
     */
    private static double congestionFromEnd(List<Observation> window, int position) {
        if (window.size() < position)
            return DEFAULT_CONGESTION_LEVEL;
        return congestion(window.get(window.size() - position));
    }

    private static double congestion(Observation o) {
        return o.congestionLevel() == null ? DEFAULT_CONGESTION_LEVEL : o.congestionLevel();
    }

    private static double orDefault(Double v, double def) {
        return v == null ? def : v;
    }

    private static double flag(Boolean b) {
        return Boolean.TRUE.equals(b) ? 1 : 0;
    }
}
