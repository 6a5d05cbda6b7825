package space.ketterling.congestion.ml;

/**
 * Holdout error of the ensemble output, on the 0-100 congestion scale.
 */
public record TrainingMetrics(double mse, double rmse, double mae, double r2, int trainSamples, int testSamples) {

    public static TrainingMetrics of(double[] actual, double[] predicted, int trainSamples) {
        int n = actual.length;
        if (n == 0)
            return new TrainingMetrics(0, 0, 0, 0, trainSamples, 0);
        double sq = 0, abs = 0, mean = 0;
        for (double a : actual)
            mean += a;
        mean /= n;
        double tot = 0;
        for (int i = 0; i < n; i++) {
            double d = actual[i] - predicted[i];
            sq += d * d;
            abs += Math.abs(d);
            double t = actual[i] - mean;
            tot += t * t;
        }
        double mse = sq / n;
        double r2 = tot > 0 ? 1 - sq / tot : 0;
        return new TrainingMetrics(mse, Math.sqrt(mse), abs / n, r2, trainSamples, n);
    }
}
