package space.ketterling.congestion.forecast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.error.InvalidRequestException;
import space.ketterling.congestion.error.ModelNotLoadedException;
import space.ketterling.congestion.error.NotFoundException;
import space.ketterling.congestion.features.FeatureBuilder;
import space.ketterling.congestion.metrics.ForecastMetrics;
import space.ketterling.congestion.ml.EnsemblePrediction;
import space.ketterling.congestion.ml.EnsemblePredictor;
import space.ketterling.congestion.ml.SpeedEstimate;
import space.ketterling.congestion.model.CongestionScale;
import space.ketterling.congestion.model.FeatureSchema;
import space.ketterling.congestion.model.FeatureVector;
import space.ketterling.congestion.model.ForecastSet;
import space.ketterling.congestion.model.HorizonFailure;
import space.ketterling.congestion.model.Location;
import space.ketterling.congestion.model.Observation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-facing forecast operation: validates the request, serves from the
 * cache or computes, and hands fresh results to the sink.
 */
public final class PredictionService {
    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final LocationLookup locations;
    private final ObservationSource observations;
    private final ForecastSink sink;
    private final HorizonScheduler scheduler;
    private final ForecastCache cache;
    private final EnsemblePredictor predictor;
    private final FeatureBuilder features;
    private final Clock clock;
    private final List<Integer> defaultHorizons;
    private final int maxHorizonHours;
    private final Duration horizonBudget; // nullable

    public PredictionService(LocationLookup locations, ObservationSource observations, ForecastSink sink,
            HorizonScheduler scheduler, ForecastCache cache, EnsemblePredictor predictor, FeatureBuilder features,
            Clock clock, List<Integer> defaultHorizons, int maxHorizonHours, Duration horizonBudget) {
        this.locations = locations;
        this.observations = observations;
        this.sink = sink;
        this.scheduler = scheduler;
        this.cache = cache;
        this.predictor = predictor;
        this.features = features;
        this.clock = clock;
        this.defaultHorizons = List.copyOf(defaultHorizons);
        this.maxHorizonHours = maxHorizonHours;
        this.horizonBudget = horizonBudget;
    }

    /**
     * Forecasts congestion for a location.
     *
     * @param horizons hours ahead; {@code null} or empty means the defaults
     */
    public PredictionResponse predict(String locationId, List<Integer> horizons, boolean includeFeatures)
            throws Exception {
        List<Integer> wanted = normalizeHorizons(horizons);
        Location location = locations.find(locationId)
                .orElseThrow(() -> new NotFoundException("Location not found: " + locationId));

        Instant now = clock.instant();
        AtomicBoolean fresh = new AtomicBoolean(false);
        ForecastSet set;
        try {
            set = cache.getOrCompute(locationId, now, s -> s.covers(wanted), () -> {
                fresh.set(true);
                return compute(locationId, withCachedHorizons(locationId, now, wanted));
            });
        } catch (RuntimeException e) {
            ForecastMetrics.record(ForecastMetrics.FORECAST, false);
            throw e;
        }

        if (set.isEmpty() && !set.failures().isEmpty()
                && set.failures().stream().allMatch(f -> HorizonFailure.MODEL_NOT_LOADED.equals(f.reason()))) {
            ForecastMetrics.record(ForecastMetrics.FORECAST, false);
            throw new ModelNotLoadedException("no model is loaded");
        }

        String version = set.modelVersion() != null ? set.modelVersion() : predictor.modelInfo().version();
        if (fresh.get())
            storeQuietly(locationId, set, version);

        ForecastMetrics.record(ForecastMetrics.FORECAST, !set.isEmpty());
        Map<String, Double> importance = includeFeatures ? predictor.featureImportance() : null;
        return new PredictionResponse(location, now, set.select(wanted), EnsemblePredictor.MODEL_TYPE, version,
                importance);
    }

    /**
     * The requested horizons plus those of the set already cached for this
     * hour, so a recompute does not drop horizons another caller asked for.
     */
    private List<Integer> withCachedHorizons(String locationId, Instant now, List<Integer> wanted) {
        TreeSet<Integer> merged = new TreeSet<>(wanted);
        cache.peek(locationId, now).ifPresent(s -> merged.addAll(s.requestedHorizons()));
        return List.copyOf(merged);
    }

    private ForecastSet compute(String locationId, List<Integer> horizons) {
        Observation latest;
        List<Observation> recent;
        try {
            latest = observations.latest(locationId)
                    .orElseThrow(() -> new NotFoundException("No traffic data available for " + locationId));
            recent = observations.recent(locationId, FeatureBuilder.MAX_WINDOW + 1);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Observation lookup failed for " + locationId, e);
        }
        return scheduler.forecast(locationId, latest, horizons, historyBefore(latest, recent), horizonBudget);
    }

    /**
     * Oldest-first window of at most {@link FeatureBuilder#MAX_WINDOW}
     * observations strictly older than {@code latest}, the same history a
     * training row sees.
     */
    static List<Observation> historyBefore(Observation latest, List<Observation> recentFirst) {
        List<Observation> window = new ArrayList<>(FeatureBuilder.MAX_WINDOW);
        for (Observation o : recentFirst) {
            if (window.size() == FeatureBuilder.MAX_WINDOW)
                break;
            if (o.timestamp().isBefore(latest.timestamp()))
                window.add(o);
        }
        Collections.reverse(window);
        return window;
    }

    private void storeQuietly(String locationId, ForecastSet set, String version) {
        if (sink == null || set.isEmpty())
            return;
        try {
            sink.store(locationId, set, EnsemblePredictor.MODEL_TYPE, version);
            ForecastMetrics.record(ForecastMetrics.SINK, true);
        } catch (Exception e) {
            ForecastMetrics.record(ForecastMetrics.SINK, false);
            log.warn("Failed to store forecast for {}: {}", locationId, e.getMessage());
        }
    }

    /**
     * Scores one hour/day combination with default measurements, plus the
     * speed implied by the result.
     */
    public PointScore scorePoint(int hourOfDay, int dayOfWeek, double lat, double lon, double freeFlowSpeed) {
        if (hourOfDay < 0 || hourOfDay > 23)
            throw new InvalidRequestException("hour must be between 0 and 23");
        if (dayOfWeek < 0 || dayOfWeek > 6)
            throw new InvalidRequestException("day_of_week must be between 0 and 6");
        if (!(freeFlowSpeed > 0))
            throw new InvalidRequestException("free_flow_speed must be positive");

        Instant now = clock.instant();
        Observation obs = Observation.bare("adhoc", lat, lon, now);
        double[] v = features.build(obs, now, List.of()).toArray();
        v[FeatureSchema.HOUR_OF_DAY] = hourOfDay;
        v[FeatureSchema.DAY_OF_WEEK] = dayOfWeek;
        v[FeatureSchema.IS_WEEKEND] = dayOfWeek >= 5 ? 1 : 0;

        EnsemblePrediction p = predictor.predict(FeatureVector.ofSchema(v));
        SpeedEstimate speed = p.speed(freeFlowSpeed);
        return new PointScore(p.congestion(), CongestionScale.toLevel(p.congestion()), p.confidence(),
                speed.currentSpeed(), freeFlowSpeed, speed.speedReductionPercent(), p.modelVersion());
    }

    List<Integer> normalizeHorizons(List<Integer> horizons) {
        if (horizons == null || horizons.isEmpty())
            return defaultHorizons;
        TreeSet<Integer> out = new TreeSet<>();
        for (Integer h : horizons) {
            if (h == null || h < 1)
                throw new InvalidRequestException("forecast hours must be positive integers");
            if (h > maxHorizonHours)
                throw new InvalidRequestException("forecast hours must be at most " + maxHorizonHours);
            out.add(h);
        }
        return List.copyOf(out);
    }

    public record PredictionResponse(
            Location location,
            Instant predictionTime,
            ForecastSet forecast,
            String modelType,
            String modelVersion,
            Map<String, Double> featureImportance) {
    }

    public record PointScore(
            double congestion,
            int congestionLevel,
            double confidence,
            double currentSpeed,
            double freeFlowSpeed,
            double speedReductionPercent,
            String modelVersion) {
    }
}
