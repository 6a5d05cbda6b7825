package space.ketterling.congestion.ml;

/**
 * One ensemble output.
 *
 * @param congestion percent in [0, 100]
 * @param confidence percent in [70, 95]; lower when the two models disagree
 */
public record EnsemblePrediction(double congestion, double confidence, double stableRaw, double reactiveRaw,
        String modelVersion) {

    public SpeedEstimate speed(double freeFlowSpeed) {
        return SpeedEstimate.of(congestion, freeFlowSpeed);
    }
}
