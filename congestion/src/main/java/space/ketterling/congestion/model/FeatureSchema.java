package space.ketterling.congestion.model;

import java.util.List;

/**
 * The one feature ordering shared by feature construction and training.
 *
 * <p>
 * A trained model stores the names it was fitted with; inference refuses any
 * vector whose names differ from them.
 * </p>
 */
public final class FeatureSchema {
    public static final String VERSION = "traffic-features-v1";

    public static final List<String> NAMES = List.of(
            "hour_of_day",
            "day_of_week",
            "is_weekend",
            "is_holiday",
            "temperature",
            "precipitation",
            "visibility",
            "vehicle_count",
            "average_speed",
            "incident_reported",
            "event_nearby",
            "congestion_lag_1h",
            "congestion_lag_3h",
            "congestion_lag_24h",
            "speed_lag_1h");

    public static final int SIZE = NAMES.size();

    public static final int HOUR_OF_DAY = 0;
    public static final int DAY_OF_WEEK = 1;
    public static final int IS_WEEKEND = 2;
    public static final int IS_HOLIDAY = 3;
    public static final int TEMPERATURE = 4;
    public static final int PRECIPITATION = 5;
    public static final int VISIBILITY = 6;
    public static final int VEHICLE_COUNT = 7;
    public static final int AVERAGE_SPEED = 8;
    public static final int INCIDENT_REPORTED = 9;
    public static final int EVENT_NEARBY = 10;
    public static final int CONGESTION_LAG_1H = 11;
    public static final int CONGESTION_LAG_3H = 12;
    public static final int CONGESTION_LAG_24H = 13;
    public static final int SPEED_LAG_1H = 14;

    private FeatureSchema() {
    }
}
