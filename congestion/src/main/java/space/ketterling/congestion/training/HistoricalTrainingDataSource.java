package space.ketterling.congestion.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.features.FeatureBuilder;
import space.ketterling.congestion.forecast.ObservationSource;
import space.ketterling.congestion.model.CongestionScale;
import space.ketterling.congestion.model.Observation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds training rows from stored observations.
 *
 * <p>
 * Each observation with a recorded congestion level becomes one row, labelled
 * with that level on the percent scale and featurized from the observations
 * before it. Observations with no earlier history are skipped, since their
 * 1h lag would otherwise repeat the label.
 * </p>
 */
public final class HistoricalTrainingDataSource implements TrainingDataSource {
    private static final Logger log = LoggerFactory.getLogger(HistoricalTrainingDataSource.class);

    public static final String NAME = "historical";

    private final ObservationSource observations;
    private final FeatureBuilder features;
    private final Clock clock;
    private final int historyDays;

    public HistoricalTrainingDataSource(ObservationSource observations, FeatureBuilder features, Clock clock,
            int historyDays) {
        this.observations = observations;
        this.features = features;
        this.clock = clock;
        this.historyDays = historyDays;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TrainingData load() throws Exception {
        Instant to = clock.instant();
        Instant from = to.minus(Duration.ofDays(historyDays));
        List<Observation> all = observations.between(from, to);

        Map<String, List<Observation>> byLocation = new LinkedHashMap<>();
        for (Observation o : all)
            byLocation.computeIfAbsent(o.locationId(), k -> new ArrayList<>()).add(o);

        List<double[]> rows = new ArrayList<>();
        List<Double> labels = new ArrayList<>();
        for (List<Observation> series : byLocation.values()) {
            series.sort(Comparator.comparing(Observation::timestamp));
            for (int i = 1; i < series.size(); i++) {
                Observation o = series.get(i);
                if (o.congestionLevel() == null)
                    continue;
                List<Observation> window = series.subList(Math.max(0, i - FeatureBuilder.MAX_WINDOW), i);
                rows.add(features.build(o, o.timestamp(), window).toArray());
                labels.add(CongestionScale.toPercent(o.congestionLevel()));
            }
        }

        log.info("Historical training data: {} rows from {} locations over {} days",
                rows.size(), byLocation.size(), historyDays);
        double[] y = new double[labels.size()];
        for (int i = 0; i < y.length; i++)
            y[i] = labels.get(i);
        return new TrainingData(rows.toArray(new double[0][]), y, NAME);
    }
}
