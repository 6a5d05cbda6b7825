package space.ketterling.congestion.training;

import space.ketterling.congestion.features.FeatureBuilder;
import space.ketterling.congestion.model.FeatureSchema;

import java.util.Random;

/**
 * Generates rows from a time-of-day congestion prior, used when no real
 * history exists yet.
 *
 * <p>
 * Labels depend only on the hour band and the weekend flag. Every other
 * column, the lags included, is drawn around its default and carries no
 * signal.
 * </p>
 */
public final class SyntheticTrainingDataSource implements TrainingDataSource {
    public static final String NAME = "synthetic";

    private final int samples;
    private final long seed;

    public SyntheticTrainingDataSource(int samples, long seed) {
        if (samples < 1)
            throw new IllegalArgumentException("samples must be >= 1");
        this.samples = samples;
        this.seed = seed;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TrainingData load() {
        return generate(samples, seed);
    }

    public static TrainingData generate(int n, long seed) {
        Random rnd = new Random(seed);
        double[][] rows = new double[n][];
        double[] labels = new double[n];
        for (int i = 0; i < n; i++) {
            int hour = rnd.nextInt(24);
            int dow = rnd.nextInt(7);
            boolean weekend = dow >= 5;

            double[] v = new double[FeatureSchema.SIZE];
            v[FeatureSchema.HOUR_OF_DAY] = hour;
            v[FeatureSchema.DAY_OF_WEEK] = dow;
            v[FeatureSchema.IS_WEEKEND] = weekend ? 1 : 0;
            v[FeatureSchema.IS_HOLIDAY] = rnd.nextDouble() < 0.03 ? 1 : 0;
            v[FeatureSchema.TEMPERATURE] = FeatureBuilder.DEFAULT_TEMPERATURE + rnd.nextGaussian() * 8;
            v[FeatureSchema.PRECIPITATION] = rnd.nextDouble() < 0.8 ? 0 : rnd.nextDouble() * 10;
            v[FeatureSchema.VISIBILITY] = 5 + rnd.nextDouble() * 5;
            v[FeatureSchema.VEHICLE_COUNT] = Math.max(0,
                    Math.round(FeatureBuilder.DEFAULT_VEHICLE_COUNT + rnd.nextGaussian() * 30));
            v[FeatureSchema.AVERAGE_SPEED] = Math.max(5, FeatureBuilder.DEFAULT_AVERAGE_SPEED + rnd.nextGaussian() * 10);
            v[FeatureSchema.INCIDENT_REPORTED] = rnd.nextDouble() < 0.05 ? 1 : 0;
            v[FeatureSchema.EVENT_NEARBY] = rnd.nextDouble() < 0.05 ? 1 : 0;
            v[FeatureSchema.CONGESTION_LAG_1H] = 1 + rnd.nextInt(5);
            v[FeatureSchema.CONGESTION_LAG_3H] = 1 + rnd.nextInt(5);
            v[FeatureSchema.CONGESTION_LAG_24H] = 1 + rnd.nextInt(5);
            v[FeatureSchema.SPEED_LAG_1H] = Math.max(5, FeatureBuilder.DEFAULT_AVERAGE_SPEED + rnd.nextGaussian() * 10);
            rows[i] = v;

            double label = prior(hour, rnd);
            if (weekend)
                label *= 0.7;
            label += rnd.nextGaussian() * 5;
            labels[i] = Math.max(0, Math.min(100, label));
        }
        return new TrainingData(rows, labels, NAME);
    }

    /**
     * Base congestion for the hour, before the weekend factor and noise.
     */
    static double prior(int hour, Random rnd) {
        if (hour >= 7 && hour <= 9)
            return 60 + rnd.nextDouble() * 30;
        if (hour >= 17 && hour <= 19)
            return 65 + rnd.nextDouble() * 30;
        if (hour >= 11 && hour <= 14)
            return 35 + rnd.nextDouble() * 25;
        if (hour >= 22 || hour <= 5)
            return 5 + rnd.nextDouble() * 20;
        return 25 + rnd.nextDouble() * 25;
    }
}
