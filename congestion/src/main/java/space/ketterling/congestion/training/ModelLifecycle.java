package space.ketterling.congestion.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import space.ketterling.congestion.error.ErrorKind;
import space.ketterling.congestion.error.ForecastException;
import space.ketterling.congestion.forecast.ForecastCache;
import space.ketterling.congestion.metrics.ForecastMetrics;
import space.ketterling.congestion.ml.EnsemblePredictor;
import space.ketterling.congestion.ml.ModelHolder;
import space.ketterling.congestion.ml.ModelStore;
import space.ketterling.congestion.ml.TrainedModel;
import space.ketterling.congestion.model.FeatureSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loads the served model at start-up and replaces it on retrain.
 *
 * <p>
 * Only one retrain runs at a time; a second request while one is running is
 * rejected with {@link ErrorKind#RETRAIN_IN_PROGRESS}. A retrain persists the
 * new bundle before installing it, so a crash never leaves the served model
 * ahead of the artifact on disk.
 * </p>
 */
public final class ModelLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ModelLifecycle.class);

    public enum LoadOutcome {
        LOADED,
        BOOTSTRAPPED,
        MISSING,
        CORRUPT
    }

    private final ModelHolder holder;
    private final ModelStore store;
    private final Path artifactPath;
    private final TrainingPipeline pipeline;
    private final TrainingDataSource source;
    private final TrainingDataSource bootstrapSource;
    private final ForecastCache cache; // nullable
    private final ModelRunLog runs; // nullable

    private final AtomicBoolean retraining = new AtomicBoolean(false);

    public ModelLifecycle(ModelHolder holder, ModelStore store, Path artifactPath, TrainingPipeline pipeline,
            TrainingDataSource source, TrainingDataSource bootstrapSource, ForecastCache cache, ModelRunLog runs) {
        this.holder = holder;
        this.store = store;
        this.artifactPath = artifactPath;
        this.pipeline = pipeline;
        this.source = source;
        this.bootstrapSource = bootstrapSource;
        this.cache = cache;
        this.runs = runs;
    }

    /**
     * Installs the persisted model. A missing artifact is trained from the
     * bootstrap source when allowed; an unreadable one never is, and the
     * engine stays without a model.
     */
    public LoadOutcome loadOrBootstrap(boolean bootstrapOnMissing) {
        if (Files.exists(artifactPath)) {
            try {
                TrainedModel m = store.load(artifactPath);
                holder.swap(m);
                log.info("Loaded model {} from {}", m.version(), artifactPath);
                return LoadOutcome.LOADED;
            } catch (IOException | RuntimeException e) {
                log.error("Model artifact {} could not be loaded; serving without a model", artifactPath, e);
                return LoadOutcome.CORRUPT;
            }
        }
        if (!bootstrapOnMissing) {
            log.warn("No model artifact at {} and bootstrap disabled", artifactPath);
            return LoadOutcome.MISSING;
        }
        log.info("No model artifact at {}; bootstrapping from {} data", artifactPath, bootstrapSource.name());
        try {
            retrainWith(bootstrapSource);
            return LoadOutcome.BOOTSTRAPPED;
        } catch (Exception e) {
            log.error("Bootstrap training failed", e);
            return LoadOutcome.MISSING;
        }
    }

    public boolean isRetraining() {
        return retraining.get();
    }

    /**
     * Runs a retrain on {@code executor}. Fails immediately when one is
     * already running.
     */
    public Future<TrainedModel> submitRetrain(ExecutorService executor) {
        if (!retraining.compareAndSet(false, true))
            throw inProgress();
        try {
            return executor.submit(() -> {
                MDC.put("job", "retrain-manual");
                try {
                    return doRetrain(source);
                } finally {
                    retraining.set(false);
                    MDC.remove("job");
                }
            });
        } catch (RuntimeException e) {
            retraining.set(false);
            throw e;
        }
    }

    /**
     * Retrains from the configured source on the calling thread.
     */
    public TrainedModel retrain() throws Exception {
        return retrainWith(source);
    }

    private TrainedModel retrainWith(TrainingDataSource from) throws Exception {
        if (!retraining.compareAndSet(false, true))
            throw inProgress();
        try {
            return doRetrain(from);
        } finally {
            retraining.set(false);
        }
    }

    private TrainedModel doRetrain(TrainingDataSource from) throws Exception {
        long runId = -1;
        if (runs != null) {
            try {
                runId = runs.start(EnsemblePredictor.MODEL_TYPE, FeatureSchema.VERSION, from.name());
            } catch (Exception e) {
                log.warn("Could not record training run start: {}", e.getMessage());
            }
        }
        try {
            TrainingData data = from.load();
            TrainingResult result = pipeline.train(data);
            TrainedModel model = result.model();
            store.save(model, artifactPath);
            TrainedModel previous = holder.swap(model);
            if (cache != null)
                cache.invalidateAll();
            log.info("Installed model {} (replaced {})", model.version(),
                    previous == null ? "none" : previous.version());
            ForecastMetrics.record(ForecastMetrics.RETRAIN, true);
            if (runs != null && runId >= 0) {
                try {
                    runs.finishSuccess(runId, model.version(), data.size(), result.metrics(),
                            artifactPath.toString());
                } catch (Exception e) {
                    log.warn("Could not record training run {}: {}", runId, e.getMessage());
                }
            }
            return model;
        } catch (Exception e) {
            ForecastMetrics.record(ForecastMetrics.RETRAIN, false);
            log.error("Retrain from {} failed: {}", from.name(), e.getMessage());
            if (runs != null && runId >= 0) {
                try {
                    runs.finishFailure(runId, e.getMessage());
                } catch (Exception inner) {
                    log.warn("Could not record failure of training run {}: {}", runId, inner.getMessage());
                }
            }
            throw e;
        }
    }

    private static ForecastException inProgress() {
        return new ForecastException(ErrorKind.RETRAIN_IN_PROGRESS, "a retrain is already running");
    }
}
