package space.ketterling.congestion.ml;

/**
 * Speed implied by a congestion percentage: up to 60% slower than free flow
 * at full congestion.
 */
public record SpeedEstimate(double freeFlowSpeed, double currentSpeed, double speedReductionPercent) {
    public static final double MAX_REDUCTION = 0.6;

    public static SpeedEstimate of(double congestionPercent, double freeFlowSpeed) {
        double reduction = Math.max(0, Math.min(100, congestionPercent)) / 100.0 * MAX_REDUCTION;
        return new SpeedEstimate(freeFlowSpeed, freeFlowSpeed * (1 - reduction), reduction * 100.0);
    }
}
