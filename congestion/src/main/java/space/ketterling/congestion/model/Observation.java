package space.ketterling.congestion.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single traffic/weather observation recorded for a location.
 *
 * <p>
 * Every measurement is optional; {@code null} means "not reported". The
 * congestion level is the ordinal 1-5 scale used by the ingestion side.
 * </p>
 */
public record Observation(
        String locationId,
        double lat,
        double lon,
        Instant timestamp,
        Integer congestionLevel,
        Double averageSpeed,
        Integer vehicleCount,
        Double temperature,
        Double precipitation,
        Double visibility,
        Boolean incidentReported,
        Boolean eventNearby,
        Boolean holiday) {

    public Observation {
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Observation with a location and time only; all measurements missing.
     */
    public static Observation bare(String locationId, double lat, double lon, Instant timestamp) {
        return new Observation(locationId, lat, lon, timestamp,
                null, null, null, null, null, null, null, null, null);
    }

    /**
     * Copy with the traffic fields replaced.
     */
    public Observation withTraffic(Integer congestionLevel, Double averageSpeed, Integer vehicleCount) {
        return new Observation(locationId, lat, lon, timestamp, congestionLevel, averageSpeed, vehicleCount,
                temperature, precipitation, visibility, incidentReported, eventNearby, holiday);
    }

    /**
     * Copy with the weather triple replaced.
     */
    public Observation withWeather(Double temperature, Double precipitation, Double visibility) {
        return new Observation(locationId, lat, lon, timestamp, congestionLevel, averageSpeed, vehicleCount,
                temperature, precipitation, visibility, incidentReported, eventNearby, holiday);
    }

    /**
     * Copy with the incident / event / holiday flags replaced.
     */
    public Observation withFlags(Boolean incidentReported, Boolean eventNearby, Boolean holiday) {
        return new Observation(locationId, lat, lon, timestamp, congestionLevel, averageSpeed, vehicleCount,
                temperature, precipitation, visibility, incidentReported, eventNearby, holiday);
    }
}
