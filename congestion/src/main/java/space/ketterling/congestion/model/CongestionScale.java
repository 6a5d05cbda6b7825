package space.ketterling.congestion.model;

/**
 * Conversions between the internal 0-100 percent scale and the ordinal 1-5
 * congestion level used at the edges of the system.
 *
 * <p>
 * Predictions are always computed and cached as percentages. The ordinal
 * level is derived only when a point is built for a caller: 1 = free flow
 * (0%), 5 = standstill (100%), 25 points per level.
 * </p>
 */
public final class CongestionScale {
    public static final double MIN_PERCENT = 0.0;
    public static final double MAX_PERCENT = 100.0;
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 5;

    private static final double PERCENT_PER_LEVEL = 25.0;

    private CongestionScale() {
    }

    public static double clipPercent(double percent) {
        if (Double.isNaN(percent))
            return MIN_PERCENT;
        return Math.max(MIN_PERCENT, Math.min(MAX_PERCENT, percent));
    }

    /**
     * Rounds a percentage to the nearest ordinal level.
     */
    public static int toLevel(double percent) {
        int level = MIN_LEVEL + (int) Math.round(clipPercent(percent) / PERCENT_PER_LEVEL);
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }

    /**
     * Lower edge of an ordinal level on the percent scale.
     */
    public static double toPercent(int level) {
        int clamped = Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
        return (clamped - MIN_LEVEL) * PERCENT_PER_LEVEL;
    }
}
