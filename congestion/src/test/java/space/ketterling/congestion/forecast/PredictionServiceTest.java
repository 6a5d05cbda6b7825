package space.ketterling.congestion.forecast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import space.ketterling.congestion.error.InvalidRequestException;
import space.ketterling.congestion.error.ModelNotLoadedException;
import space.ketterling.congestion.error.NotFoundException;
import space.ketterling.congestion.features.FeatureBuilder;
import space.ketterling.congestion.ml.EnsemblePredictor;
import space.ketterling.congestion.ml.ModelFixtures;
import space.ketterling.congestion.ml.ModelHolder;
import space.ketterling.congestion.model.ForecastPoint;
import space.ketterling.congestion.model.ForecastSet;
import space.ketterling.congestion.model.Location;
import space.ketterling.congestion.model.Observation;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PredictionServiceTest {
    private static final List<Integer> DEFAULTS = List.of(1, 3, 6, 12, 24);
    private static final Instant NOW = ModelFixtures.CLOCK.instant();

    private LocationLookup locations;
    private ObservationSource observations;
    private ForecastSink sink;
    private ModelHolder holder;
    private PredictionService service;

    @BeforeEach
    void setUp() throws Exception {
        locations = mock(LocationLookup.class);
        observations = mock(ObservationSource.class);
        sink = mock(ForecastSink.class);
        holder = new ModelHolder(ModelFixtures.constant(40, 50));

        when(locations.find("loc-1")).thenReturn(Optional.of(new Location("loc-1", "Main St", 40.7, -111.9)));
        when(locations.find("nowhere")).thenReturn(Optional.empty());
        Observation latest = Observation.bare("loc-1", 40.7, -111.9, NOW.minusSeconds(600)).withTraffic(3, 30.0, 200);
        when(observations.latest("loc-1")).thenReturn(Optional.of(latest));
        when(observations.recent(eq("loc-1"), anyInt())).thenReturn(List.of(latest));

        service = newService(holder);
    }

    private PredictionService newService(HorizonScheduler scheduler) {
        FeatureBuilder features = new FeatureBuilder(ZoneOffset.UTC);
        return new PredictionService(locations, observations, sink, scheduler,
                new ForecastCache(Duration.ofMinutes(30), 100), new EnsemblePredictor(holder), features,
                ModelFixtures.CLOCK, DEFAULTS, 168, null);
    }

    private PredictionService newService(ModelHolder h) {
        FeatureBuilder features = new FeatureBuilder(ZoneOffset.UTC);
        EnsemblePredictor predictor = new EnsemblePredictor(h);
        HorizonScheduler scheduler = new HorizonScheduler(ModelFixtures.CLOCK, features, predictor, null);
        return new PredictionService(locations, observations, sink, scheduler,
                new ForecastCache(Duration.ofMinutes(30), 100), predictor, features, ModelFixtures.CLOCK,
                DEFAULTS, 168, null);
    }

    @Test
    void predict_shouldForecastDefaultHorizons() throws Exception {
        PredictionService.PredictionResponse r = service.predict("loc-1", null, false);

        assertEquals("Main St", r.location().name());
        assertEquals(NOW, r.predictionTime());
        assertEquals(DEFAULTS, r.forecast().points().stream().map(ForecastPoint::horizonHours).toList());
        assertEquals("ensemble", r.modelType());
        assertEquals("const-test", r.modelVersion());
        assertNull(r.featureImportance());
    }

    @Test
    void predict_shouldRejectUnknownLocation() throws Exception {
        assertThrows(NotFoundException.class, () -> service.predict("nowhere", null, false));
        verify(observations, never()).latest(anyString());
    }

    @Test
    void predict_shouldRejectLocationWithoutObservations() throws Exception {
        when(observations.latest("loc-1")).thenReturn(Optional.empty());

        NotFoundException e = assertThrows(NotFoundException.class, () -> service.predict("loc-1", null, false));
        assertTrue(e.getMessage().contains("No traffic data"));
        verify(sink, never()).store(any(), any(), any(), any());
    }

    @Test
    void predict_shouldRejectOutOfRangeHorizons() {
        assertThrows(InvalidRequestException.class, () -> service.predict("loc-1", List.of(0), false));
        assertThrows(InvalidRequestException.class, () -> service.predict("loc-1", List.of(3, 169), false));
    }

    @Test
    void normalizeHorizons_shouldSortAndDeduplicate() {
        assertEquals(List.of(1, 6, 12), service.normalizeHorizons(List.of(12, 1, 6, 1)));
        assertEquals(DEFAULTS, service.normalizeHorizons(List.of()));
    }

    @Test
    void predict_shouldStoreFreshForecastOnceAndServeRepeatFromCache() throws Exception {
        service.predict("loc-1", null, false);
        service.predict("loc-1", List.of(3, 6), false);

        verify(sink, times(1)).store(eq("loc-1"), any(ForecastSet.class), eq("ensemble"), eq("const-test"));
        verify(observations, times(1)).latest("loc-1");
    }

    @Test
    void predict_shouldNarrowCachedSetToRequestedHorizons() throws Exception {
        service.predict("loc-1", null, false);
        PredictionService.PredictionResponse r = service.predict("loc-1", List.of(6, 3), false);

        assertEquals(List.of(3, 6), r.forecast().points().stream().map(ForecastPoint::horizonHours).toList());
    }

    @Test
    void predict_shouldRecomputeWhenCachedSetLacksHorizon() throws Exception {
        service.predict("loc-1", List.of(1), false);
        PredictionService.PredictionResponse r = service.predict("loc-1", List.of(1, 48), false);

        assertEquals(2, r.forecast().points().size());
        verify(observations, times(2)).latest("loc-1");
    }

    @Test
    void predict_shouldTolerateSinkFailure() throws Exception {
        doThrow(new SQLException("connection refused")).when(sink).store(any(), any(), any(), any());

        PredictionService.PredictionResponse r = service.predict("loc-1", null, false);

        assertEquals(5, r.forecast().points().size());
    }

    @Test
    void predict_shouldIncludeFeatureImportanceWhenAsked() throws Exception {
        PredictionService.PredictionResponse r = service.predict("loc-1", null, true);

        assertEquals(15, r.featureImportance().size());
        assertTrue(r.featureImportance().containsKey("congestion_lag_1h"));
    }

    @Test
    void predict_shouldSurfaceMissingModel() throws Exception {
        PredictionService noModel = newService(new ModelHolder());

        assertThrows(ModelNotLoadedException.class, () -> noModel.predict("loc-1", null, false));
        verify(sink, never()).store(any(), any(), any(), any());
    }

    @Test
    void scorePoint_shouldReturnCongestionAndSpeed() {
        PredictionService.PointScore s = service.scorePoint(8, 1, 40.7, -111.9, 60);

        assertEquals(45.0, s.congestion(), 1e-9);
        assertEquals(3, s.congestionLevel());
        assertEquals(85.0, s.confidence(), 1e-9);
        assertEquals(60.0 * (1 - 0.27), s.currentSpeed(), 1e-9);
        assertEquals(27.0, s.speedReductionPercent(), 1e-9);
    }

    @Test
    void scorePoint_shouldValidateInputs() {
        assertThrows(InvalidRequestException.class, () -> service.scorePoint(24, 1, 0, 0, 60));
        assertThrows(InvalidRequestException.class, () -> service.scorePoint(8, 7, 0, 0, 60));
        assertThrows(InvalidRequestException.class, () -> service.scorePoint(8, 1, 0, 0, 0));
    }

    @Test
    void predict_shouldPassOnlyOlderObservationsOldestFirstAsHistory() throws Exception {
        Observation latest = Observation.bare("loc-1", 40.7, -111.9, NOW.minusSeconds(600)).withTraffic(3, 30.0, 200);
        Observation hourAgo = Observation.bare("loc-1", 40.7, -111.9, NOW.minusSeconds(4200)).withTraffic(2, 20.0, 150);
        Observation twoHoursAgo = Observation.bare("loc-1", 40.7, -111.9, NOW.minusSeconds(7800))
                .withTraffic(1, 10.0, 100);
        when(observations.latest("loc-1")).thenReturn(Optional.of(latest));
        when(observations.recent("loc-1", FeatureBuilder.MAX_WINDOW + 1))
                .thenReturn(List.of(latest, hourAgo, twoHoursAgo));
        HorizonScheduler scheduler = mock(HorizonScheduler.class);
        when(scheduler.forecast(any(), any(), any(), any(), any()))
                .thenReturn(new ForecastSet("loc-1", NOW, DEFAULTS, List.of(), List.of()));

        newService(scheduler).predict("loc-1", null, false);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Observation>> window = ArgumentCaptor.forClass(List.class);
        verify(scheduler).forecast(eq("loc-1"), eq(latest), eq(DEFAULTS), window.capture(), any());
        assertEquals(List.of(twoHoursAgo, hourAgo), window.getValue());
    }

    @Test
    void historyBefore_shouldKeepAtMostMaxWindow() {
        Observation latest = Observation.bare("loc-1", 40.7, -111.9, NOW);
        List<Observation> recent = new ArrayList<>();
        recent.add(latest);
        for (int i = 1; i <= FeatureBuilder.MAX_WINDOW + 1; i++)
            recent.add(Observation.bare("loc-1", 40.7, -111.9, NOW.minusSeconds(3600L * i)));

        List<Observation> window = PredictionService.historyBefore(latest, recent);

        assertEquals(FeatureBuilder.MAX_WINDOW, window.size());
        assertFalse(window.contains(latest));
        assertEquals(NOW.minusSeconds(3600L * FeatureBuilder.MAX_WINDOW), window.get(0).timestamp());
        assertEquals(NOW.minusSeconds(3600L), window.get(window.size() - 1).timestamp());
    }

    @Test
    void predict_shouldStoreVersionOfModelThatScoredTheForecast() throws Exception {
        ForecastPoint p = new ForecastPoint(NOW.plusSeconds(3600), 1, 40, 3, 0.85, 0.83, "ensemble");
        HorizonScheduler scheduler = mock(HorizonScheduler.class);
        when(scheduler.forecast(any(), any(), any(), any(), any()))
                .thenReturn(new ForecastSet("loc-1", NOW, List.of(1), List.of(p), List.of(), "scored-with"));

        PredictionService.PredictionResponse r = newService(scheduler).predict("loc-1", List.of(1), false);

        assertEquals("scored-with", r.modelVersion());
        assertEquals("scored-with", r.forecast().modelVersion());
        verify(sink).store(eq("loc-1"), any(ForecastSet.class), eq("ensemble"), eq("scored-with"));
    }

    @Test
    void predict_shouldCacheUnionWhenRequestsAlternateBetweenHorizons() throws Exception {
        service.predict("loc-1", List.of(1), false);
        PredictionService.PredictionResponse wide = service.predict("loc-1", List.of(48), false);
        PredictionService.PredictionResponse narrow = service.predict("loc-1", List.of(1), false);
        service.predict("loc-1", List.of(48), false);

        assertEquals(List.of(48), wide.forecast().requestedHorizons());
        assertEquals(List.of(1), narrow.forecast().requestedHorizons());
        verify(observations, times(2)).latest("loc-1");
    }
}
