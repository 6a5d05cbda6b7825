package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import space.ketterling.congestion.features.FeatureBuilder;
import space.ketterling.congestion.model.FeatureVector;
import space.ketterling.congestion.model.Observation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ModelStoreTest {
    private final ObjectMapper om = new ObjectMapper();
    private final ModelStore store = new ModelStore(om);

    @TempDir
    Path dir;

    @Test
    void load_shouldReproducePredictionsOfSavedModel() throws Exception {
        TrainedModel model = ModelFixtures.small();
        Path file = dir.resolve("models").resolve("ensemble.json.gz");
        store.save(model, file);

        TrainedModel restored = store.load(file);
        assertEquals(model.version(), restored.version());
        assertEquals(model.featureNames(), restored.featureNames());
        assertEquals(model.trainedAt(), restored.trainedAt());

        FeatureBuilder builder = new FeatureBuilder(ZoneOffset.UTC);
        EnsemblePredictor before = new EnsemblePredictor(new ModelHolder(model));
        EnsemblePredictor after = new EnsemblePredictor(new ModelHolder(restored));
        for (int hour : new int[] { 3, 8, 13, 18 }) {
            Instant at = Instant.parse("2024-03-05T00:00:00Z").plusSeconds(hour * 3600L);
            FeatureVector fv = builder.build(Observation.bare("loc-1", 40.0, -111.0, at), at, List.of());
            assertEquals(before.predict(fv).congestion(), after.predict(fv).congestion(), 1e-9);
        }
    }

    @Test
    void save_shouldLeaveNoTempFilesAndReplaceExisting() throws Exception {
        Path file = dir.resolve("ensemble.json.gz");
        store.save(ModelFixtures.small(), file);
        store.save(ModelFixtures.small(), file);

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void load_shouldFailOnGarbage() throws Exception {
        Path file = dir.resolve("broken.json.gz");
        Files.writeString(file, "not a model", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> store.load(file));
    }

    @Test
    void fromJson_shouldRejectBundleWithoutReactiveModel() {
        ObjectNode json = store.toJson(ModelFixtures.small());
        json.remove("reactive");
        assertThrows(IllegalArgumentException.class, () -> store.fromJson(json));
    }

    @Test
    void load_shouldWrapIncompleteBundleAsIOException() throws Exception {
        ObjectNode json = store.toJson(ModelFixtures.small());
        json.put("format_version", 99);
        Path file = dir.resolve("future.json.gz");
        try (var out = new org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream(
                Files.newOutputStream(file))) {
            out.write(om.writeValueAsBytes(json));
        }
        assertThrows(IOException.class, () -> store.load(file));
    }
}
