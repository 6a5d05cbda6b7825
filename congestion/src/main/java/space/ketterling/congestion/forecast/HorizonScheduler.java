package space.ketterling.congestion.forecast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.error.FeatureShapeException;
import space.ketterling.congestion.error.ModelNotLoadedException;
import space.ketterling.congestion.features.FeatureBuilder;
import space.ketterling.congestion.metrics.ForecastMetrics;
import space.ketterling.congestion.ml.EnsemblePrediction;
import space.ketterling.congestion.ml.EnsemblePredictor;
import space.ketterling.congestion.ml.TrainedModel;
import space.ketterling.congestion.model.CongestionScale;
import space.ketterling.congestion.model.FeatureVector;
import space.ketterling.congestion.model.ForecastPoint;
import space.ketterling.congestion.model.ForecastSet;
import space.ketterling.congestion.model.HorizonFailure;
import space.ketterling.congestion.model.Observation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Expands one observation into forecasts at several hours ahead.
 *
 * <p>
 * Every horizon is scored independently with features describing its target
 * hour. A horizon that fails is logged and reported in
 * {@link ForecastSet#failures()}; the others still come back. All horizons of
 * one call are scored against the same model snapshot.
 * </p>
 */
public final class HorizonScheduler {
    private static final Logger log = LoggerFactory.getLogger(HorizonScheduler.class);

    private final Clock clock;
    private final FeatureBuilder features;
    private final EnsemblePredictor predictor;
    private final ExecutorService workers; // nullable, only needed for budgets

    public HorizonScheduler(Clock clock, FeatureBuilder features, EnsemblePredictor predictor,
            ExecutorService workers) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.features = Objects.requireNonNull(features, "features");
        this.predictor = Objects.requireNonNull(predictor, "predictor");
        this.workers = workers;
    }

    public ForecastSet forecast(String locationId, Observation current, List<Integer> horizons,
            List<Observation> window) {
        return forecast(locationId, current, horizons, window, null);
    }

    /**
     * @param budget per-horizon time limit; {@code null} scores inline
     */
    public ForecastSet forecast(String locationId, Observation current, List<Integer> horizons,
            List<Observation> window, Duration budget) {
        Instant now = clock.instant();
        List<ForecastPoint> points = new ArrayList<>();
        List<HorizonFailure> failures = new ArrayList<>();

        TrainedModel model;
        try {
            model = predictor.snapshot();
        } catch (ModelNotLoadedException e) {
            for (int h : horizons)
                failures.add(new HorizonFailure(h, HorizonFailure.MODEL_NOT_LOADED, e.getMessage()));
            log.warn("No model loaded; {} horizons for {} not computed", horizons.size(), locationId);
            return new ForecastSet(locationId, now, horizons, points, failures);
        }

        if (budget == null || workers == null) {
            for (int h : horizons) {
                try {
                    points.add(score(model, locationId, current, window, now, h));
                    ForecastMetrics.record(ForecastMetrics.HORIZON, true);
                } catch (RuntimeException e) {
                    failures.add(failure(locationId, h, e));
                }
            }
        } else {
            runWithBudget(model, locationId, current, window, now, horizons, budget, points, failures);
        }
        return new ForecastSet(locationId, now, horizons, points, failures, model.version());
    }

    private void runWithBudget(TrainedModel model, String locationId, Observation current,
            List<Observation> window, Instant now, List<Integer> horizons, Duration budget,
            List<ForecastPoint> points, List<HorizonFailure> failures) {
        Map<Integer, Future<ForecastPoint>> futures = new LinkedHashMap<>();
        for (int h : horizons) {
            futures.put(h, workers.submit(() -> score(model, locationId, current, window, now, h)));
        }
        long deadline = System.nanoTime() + budget.toNanos();
        for (var e : futures.entrySet()) {
            int h = e.getKey();
            Future<ForecastPoint> f = e.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                points.add(f.get(remaining, TimeUnit.NANOSECONDS));
                ForecastMetrics.record(ForecastMetrics.HORIZON, true);
            } catch (TimeoutException te) {
                f.cancel(true);
                ForecastMetrics.record(ForecastMetrics.HORIZON, false);
                log.warn("Horizon {}h for {} exceeded {}", h, locationId, budget);
                failures.add(new HorizonFailure(h, HorizonFailure.TIMEOUT, "exceeded " + budget));
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause() == null ? ee : ee.getCause();
                failures.add(failure(locationId, h, cause));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                f.cancel(true);
                failures.add(new HorizonFailure(h, HorizonFailure.ERROR, "interrupted"));
            }
        }
    }

    private ForecastPoint score(TrainedModel model, String locationId, Observation current,
            List<Observation> window, Instant now, int h) {
        Instant target = now.plus(Duration.ofHours(h));
        FeatureVector fv = features.build(current, target, window);
        EnsemblePrediction p = predictor.predict(model, fv);
        double congestion = CongestionScale.clipPercent(p.congestion());
        return new ForecastPoint(
                target,
                h,
                congestion,
                CongestionScale.toLevel(congestion),
                p.confidence() / 100.0,
                horizonConfidence(h),
                EnsemblePredictor.MODEL_TYPE);
    }

    private static HorizonFailure failure(String locationId, int h, Throwable e) {
        ForecastMetrics.record(ForecastMetrics.HORIZON, false);
        String reason;
        if (e instanceof FeatureShapeException) {
            reason = HorizonFailure.FEATURE_SHAPE;
        } else if (e instanceof ModelNotLoadedException) {
            reason = HorizonFailure.MODEL_NOT_LOADED;
        } else {
            reason = HorizonFailure.ERROR;
        }
        log.warn("Horizon {}h for {} failed ({}): {}", h, locationId, reason, e.getMessage());
        return new HorizonFailure(h, reason, e.getMessage());
    }

    /**
     * Coarse confidence that decays with the horizon: 0.85 minus 0.02 per
     * hour, kept within [0.5, 0.95].
     */
    public static double horizonConfidence(int horizonHours) {
        double c = 0.85 - 0.02 * horizonHours;
        return Math.max(0.5, Math.min(0.95, c));
    }

    /**
     * Horizons paired with their coarse confidence, in the order given.
     */
    public List<HorizonRank> rankHorizons(List<Integer> horizons) {
        List<HorizonRank> out = new ArrayList<>(horizons.size());
        for (int h : horizons)
            out.add(new HorizonRank(h, horizonConfidence(h)));
        return out;
    }

    public record HorizonRank(int horizonHours, double confidence) {
    }
}
