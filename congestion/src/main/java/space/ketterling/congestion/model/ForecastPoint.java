package space.ketterling.congestion.model;

import java.time.Instant;

/**
 * One time-shifted congestion prediction.
 *
 * @param predictedCongestion percent, 0-100
 * @param congestionLevel     ordinal 1-5 derived from the percentage
 * @param confidence          model agreement confidence, 0-1
 * @param horizonConfidence   coarse confidence decayed with the horizon, 0-1
 */
public record ForecastPoint(
        Instant targetTime,
        int horizonHours,
        double predictedCongestion,
        int congestionLevel,
        double confidence,
        double horizonConfidence,
        String model) {
}
