package space.ketterling.congestion.features;

import org.junit.jupiter.api.Test;

import space.ketterling.congestion.model.FeatureSchema;
import space.ketterling.congestion.model.FeatureVector;
import space.ketterling.congestion.model.Observation;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureBuilderTest {
    // Monday
    private static final Instant NOW = Instant.parse("2024-03-04T08:00:00Z");

    private final FeatureBuilder builder = new FeatureBuilder(ZoneOffset.UTC);

    private static Observation obs(Instant ts, Integer congestion, Double speed) {
        return Observation.bare("loc-1", 34.05, -118.24, ts).withTraffic(congestion, speed, 120);
    }

    private static List<Observation> window(int size) {
        List<Observation> out = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            // oldest first; congestion cycles 1..5 so positions are distinguishable
            out.add(obs(NOW.minusSeconds(3600L * (size - i)), 1 + (i % 5), 30.0 + i));
        }
        return out;
    }

    @Test
    void build_shouldProduceSchemaOrderedVector() {
        FeatureVector v = builder.build(obs(NOW, 3, 35.0), NOW, List.of());
        assertEquals(FeatureSchema.SIZE, v.size());
        assertEquals(FeatureSchema.NAMES, v.names());
    }

    @Test
    void build_shouldFillDefaultsForMissingMeasurements() {
        FeatureVector v = builder.build(Observation.bare("loc-1", 0, 0, NOW), NOW, null);
        assertEquals(20.0, v.get("temperature"));
        assertEquals(0.0, v.get("precipitation"));
        assertEquals(10.0, v.get("visibility"));
        assertEquals(100.0, v.get("vehicle_count"));
        assertEquals(40.0, v.get("average_speed"));
        assertEquals(0.0, v.get("incident_reported"));
        assertEquals(2.0, v.get("congestion_lag_1h"));
        assertEquals(40.0, v.get("speed_lag_1h"));
    }

    @Test
    void build_shouldTakeTimeFeaturesFromAsOfTime() {
        Instant saturdayEvening = Instant.parse("2024-03-09T18:00:00Z");
        FeatureVector v = builder.build(obs(NOW, 3, 35.0), saturdayEvening, List.of());
        assertEquals(18.0, v.get("hour_of_day"));
        assertEquals(5.0, v.get("day_of_week"));
        assertEquals(1.0, v.get("is_weekend"));
    }

    @Test
    void build_shouldUseConfiguredZone() {
        FeatureBuilder la = new FeatureBuilder(ZoneId.of("America/Los_Angeles"));
        FeatureVector v = la.build(obs(NOW, 3, 35.0), NOW, List.of());
        // 08:00Z on Monday is 00:00 Monday in Los Angeles (PST, UTC-8)
        assertEquals(0.0, v.get("hour_of_day"));
        assertEquals(0.0, v.get("day_of_week"));
    }

    @Test
    void build_shouldFallBackToObservationForLagsWhenWindowEmpty() {
        FeatureVector v = builder.build(obs(NOW, 4, 22.0), NOW, List.of());
        assertEquals(4.0, v.get("congestion_lag_1h"));
        assertEquals(2.0, v.get("congestion_lag_3h"));
        assertEquals(2.0, v.get("congestion_lag_24h"));
        assertEquals(22.0, v.get("speed_lag_1h"));
    }

    @Test
    void build_shouldReadLagsByPositionFromEnd() {
        List<Observation> w = window(24);
        FeatureVector v = builder.build(obs(NOW, 1, 50.0), NOW, w);

        assertEquals(w.get(23).congestionLevel().doubleValue(), v.get("congestion_lag_1h"));
        assertEquals(w.get(21).congestionLevel().doubleValue(), v.get("congestion_lag_3h"));
        assertEquals(w.get(0).congestionLevel().doubleValue(), v.get("congestion_lag_24h"));
        assertEquals(w.get(23).averageSpeed(), v.get("speed_lag_1h"));
    }

    @Test
    void build_shouldDefaultLag24hWhenWindowTooShort() {
        List<Observation> w = window(23);
        FeatureVector v = builder.build(obs(NOW, 1, 50.0), NOW, w);
        assertEquals(FeatureBuilder.DEFAULT_CONGESTION_LEVEL, v.get("congestion_lag_24h"));
        assertEquals(w.get(20).congestionLevel().doubleValue(), v.get("congestion_lag_3h"));
    }

    @Test
    void build_shouldDefaultLagWhenElementValueMissing() {
        List<Observation> w = new ArrayList<>(window(3));
        w.set(2, Observation.bare("loc-1", 0, 0, NOW.minusSeconds(3600)));
        FeatureVector v = builder.build(obs(NOW, 5, 10.0), NOW, w);
        assertEquals(2.0, v.get("congestion_lag_1h"));
        assertEquals(40.0, v.get("speed_lag_1h"));
    }

    @Test
    void build_shouldBeDeterministic() {
        List<Observation> w = window(10);
        Observation o = obs(NOW, 3, 35.0).withWeather(12.0, 1.5, 8.0).withFlags(true, false, true);
        assertEquals(builder.build(o, NOW, w), builder.build(o, NOW, w));
    }
}
