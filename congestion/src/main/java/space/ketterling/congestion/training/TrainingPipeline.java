package space.ketterling.congestion.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.error.TrainingDataInsufficientException;
import space.ketterling.congestion.ml.FeatureScaler;
import space.ketterling.congestion.ml.GradientBoostingRegressor;
import space.ketterling.congestion.ml.RandomForestRegressor;
import space.ketterling.congestion.ml.TrainedModel;
import space.ketterling.congestion.ml.TrainingMetrics;
import space.ketterling.congestion.model.FeatureSchema;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Random;

/**
 * Fits both regressors on a shuffled 80/20 split and evaluates the averaged
 * output on the holdout.
 */
public final class TrainingPipeline {
    private static final Logger log = LoggerFactory.getLogger(TrainingPipeline.class);

    public static final double TEST_FRACTION = 0.2;

    private static final DateTimeFormatter VERSION_FMT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
            .withZone(ZoneOffset.UTC);

    private final Hyperparameters params;
    private final Clock clock;

    public TrainingPipeline(Hyperparameters params, Clock clock) {
        this.params = params;
        this.clock = clock;
    }

    /**
     * Settings for one training run.
     */
    public record Hyperparameters(
            int rfTrees,
            int rfMaxDepth,
            int rfMinSamplesSplit,
            int gbTrees,
            int gbMaxDepth,
            double gbLearningRate,
            int minSamples,
            long seed) {

        public static Hyperparameters defaults() {
            return new Hyperparameters(100, 15, 10, 100, 5, 0.1, 50, 42L);
        }
    }

    public Hyperparameters params() {
        return params;
    }

    public TrainingResult train(TrainingData data) {
        return train(data.rows(), data.labels(), data.source());
    }

    public TrainingResult train(double[][] rows, double[] labels, String source) {
        if (rows.length != labels.length) {
            throw new TrainingDataInsufficientException(
                    "rows and labels disagree: " + rows.length + " vs " + labels.length);
        }
        if (rows.length < params.minSamples()) {
            throw new TrainingDataInsufficientException(
                    "need at least " + params.minSamples() + " samples, got " + rows.length);
        }
        for (double[] r : rows) {
            if (r.length != FeatureSchema.SIZE) {
                throw new IllegalArgumentException(
                        "training row has " + r.length + " columns, expected " + FeatureSchema.SIZE);
            }
        }

        int n = rows.length;
        int[] order = shuffled(n, params.seed());
        int testSize = (int) Math.ceil(n * TEST_FRACTION);
        int trainSize = n - testSize;

        double[][] trainX = new double[trainSize][];
        double[] trainY = new double[trainSize];
        double[][] testX = new double[testSize][];
        double[] testY = new double[testSize];
        for (int i = 0; i < n; i++) {
            int src = order[i];
            if (i < testSize) {
                testX[i] = rows[src];
                testY[i] = labels[src];
            } else {
                trainX[i - testSize] = rows[src];
                trainY[i - testSize] = labels[src];
            }
        }

        long started = System.currentTimeMillis();
        FeatureScaler scaler = FeatureScaler.fit(trainX);
        double[][] scaledTrain = scaler.transformAll(trainX);

        RandomForestRegressor stable = new RandomForestRegressor(params.rfTrees(), params.rfMaxDepth(),
                params.rfMinSamplesSplit(), params.seed());
        GradientBoostingRegressor reactive = new GradientBoostingRegressor(params.gbTrees(), params.gbMaxDepth(),
                params.gbLearningRate(), 2, params.seed());
        stable.fit(scaledTrain, trainY);
        reactive.fit(scaledTrain, trainY);

        double[] predicted = new double[testSize];
        for (int i = 0; i < testSize; i++) {
            double[] x = scaler.transform(testX[i]);
            double avg = (stable.predict(x) + reactive.predict(x)) / 2.0;
            predicted[i] = Math.max(0, Math.min(100, avg));
        }
        TrainingMetrics metrics = TrainingMetrics.of(testY, predicted, trainSize);

        Instant trainedAt = clock.instant();
        String version = "ensemble-" + VERSION_FMT.format(trainedAt);
        TrainedModel model = new TrainedModel(version, FeatureSchema.VERSION, FeatureSchema.NAMES, scaler, stable,
                reactive, trainedAt, source, metrics);

        log.info("Trained {} on {} rows ({}) in {} ms: rmse={} mae={} r2={}",
                version, trainSize, source, System.currentTimeMillis() - started,
                String.format("%.3f", metrics.rmse()), String.format("%.3f", metrics.mae()),
                String.format("%.3f", metrics.r2()));
        return new TrainingResult(model, metrics);
    }

    /**
     * Synthetic rows from the time-of-day prior, seeded with this pipeline's
     * seed.
     */
    public TrainingData generateSynthetic(int n) {
        return SyntheticTrainingDataSource.generate(n, params.seed());
    }

    private static int[] shuffled(int n, long seed) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++)
            idx[i] = i;
        Random rnd = new Random(seed);
        for (int i = n - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
        }
        return idx;
    }
}
