package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reads and writes model bundles: one gzip-compressed JSON document with both
 * regressors, the scaler and the feature layout.
 *
 * <p>
 * Writes go to a temp file in the same directory which is then moved over the
 * target, so a reader never sees a half-written bundle. Loading fails closed:
 * anything missing or unreadable is an {@link IOException}.
 * </p>
 */
public final class ModelStore {
    private static final Logger log = LoggerFactory.getLogger(ModelStore.class);

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper om;

    public ModelStore(ObjectMapper om) {
        this.om = om;
    }

    public void save(TrainedModel model, Path target) throws IOException {
        if (!model.isComplete())
            throw new IllegalArgumentException("refusing to persist an incomplete model");
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null)
            Files.createDirectories(dir);

        Path tmp = target.resolveSibling(target.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            try (var fos = Files.newOutputStream(tmp);
                    var bos = new BufferedOutputStream(fos);
                    var gos = new GzipCompressorOutputStream(bos)) {
                om.writeValue(gos, toJson(model));
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        log.info("Saved model {} to {}", model.version(), target);
    }

    public TrainedModel load(Path source) throws IOException {
        JsonNode root;
        try (var fis = Files.newInputStream(source);
                var bis = new BufferedInputStream(fis);
                var gis = new GzipCompressorInputStream(bis)) {
            root = om.readTree(gis);
        }
        try {
            return fromJson(root);
        } catch (RuntimeException e) {
            throw new IOException("model bundle " + source + " is incomplete or corrupt: " + e.getMessage(), e);
        }
    }

    ObjectNode toJson(TrainedModel model) {
        ObjectNode root = om.createObjectNode();
        root.put("format_version", FORMAT_VERSION);
        root.put("model_version", model.version());
        root.put("schema_version", model.schemaVersion());
        root.put("trained_at", model.trainedAt().toString());
        if (model.trainingSource() != null)
            root.put("training_source", model.trainingSource());
        ArrayNode names = root.putArray("feature_names");
        model.featureNames().forEach(names::add);
        root.set("scaler", model.scaler().toJson(om));
        root.set("stable", model.stable().toJson(om));
        root.set("reactive", model.reactive().toJson(om));

        TrainingMetrics m = model.metrics();
        if (m != null) {
            ObjectNode mn = root.putObject("metrics");
            mn.put("mse", m.mse());
            mn.put("rmse", m.rmse());
            mn.put("mae", m.mae());
            mn.put("r2", m.r2());
            mn.put("train_samples", m.trainSamples());
            mn.put("test_samples", m.testSamples());
        }
        return root;
    }

    TrainedModel fromJson(JsonNode root) {
        int format = root.path("format_version").asInt(-1);
        if (format != FORMAT_VERSION)
            throw new IllegalArgumentException("unsupported format_version " + format);
        String version = required(root, "model_version");
        String schema = required(root, "schema_version");
        Instant trainedAt = Instant.parse(required(root, "trained_at"));

        List<String> names = new ArrayList<>();
        for (JsonNode n : root.path("feature_names"))
            names.add(n.asText());
        if (names.isEmpty())
            throw new IllegalArgumentException("feature_names missing");

        if (!root.has("stable") || !root.has("reactive") || !root.has("scaler"))
            throw new IllegalArgumentException("bundle is missing a regressor or the scaler");
        FeatureScaler scaler = FeatureScaler.fromJson(root.get("scaler"));
        Regressor stable = Regressors.fromJson(root.get("stable"));
        Regressor reactive = Regressors.fromJson(root.get("reactive"));

        TrainingMetrics metrics = null;
        JsonNode mn = root.path("metrics");
        if (mn.isObject()) {
            metrics = new TrainingMetrics(
                    mn.path("mse").asDouble(),
                    mn.path("rmse").asDouble(),
                    mn.path("mae").asDouble(),
                    mn.path("r2").asDouble(),
                    mn.path("train_samples").asInt(),
                    mn.path("test_samples").asInt());
        }
        String source = root.hasNonNull("training_source") ? root.get("training_source").asText() : null;
        return new TrainedModel(version, schema, names, scaler, stable, reactive, trainedAt, source, metrics);
    }

    private static String required(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull() || n.asText().isBlank())
            throw new IllegalArgumentException(field + " missing");
        return n.asText();
    }
}
