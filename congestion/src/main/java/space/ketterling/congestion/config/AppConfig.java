package space.ketterling.congestion.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, database, model
 * artifact, training runs and forecasting.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbApiPoolMax,
        int dbJobPoolMax,

        // Time
        ZoneId clockZoneId,

        // Model artifact
        String modelArtifactPath,
        boolean modelBootstrapOnMissing,

        // Training
        String trainingSource,
        int trainingSyntheticSamples,
        int trainingMinSamples,
        int trainingHistoryDays,
        long trainingSeed,
        int rfTrees,
        int rfMaxDepth,
        int rfMinSamplesSplit,
        int gbTrees,
        int gbMaxDepth,
        double gbLearningRate,

        // Scheduled retrain
        boolean retrainEnabled,
        Duration retrainSchedule,

        // Forecasting
        Duration forecastCacheTtl,
        long forecastCacheMaxEntries,
        List<Integer> forecastDefaultHorizons,
        int forecastMaxHorizonHours,
        Duration forecastHorizonBudget,
        int forecastWorkers,
        double freeFlowSpeed) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            log.warn("Could not read application.properties: {}", e.getMessage());
        }
        return fromProperties(p, true);
    }

    /**
     * Builds a config from {@code p} alone, ignoring the environment.
     */
    public static AppConfig fromProperties(Properties p) {
        return fromProperties(p, false);
    }

    /**
     * Reads every setting through a {@link Lookup}, applying defaults and
     * validating required values.
     */
    private static AppConfig fromProperties(Properties p, boolean useEnv) {
        Lookup l = new Lookup(p, useEnv);

        // Required
        String dbUrl = requireNonBlank(l.get("DB_JDBC_URL", "db.jdbcUrl", ""), "db.jdbcUrl");
        String dbUser = requireNonBlank(l.get("DB_USERNAME", "db.username", ""), "db.username");
        String dbPass = l.get("DB_PASSWORD", "db.password", ""); // ok empty if local trust auth

        int dbApiPoolMax = Integer.parseInt(l.get("DB_API_POOL_MAX", "db.api.poolMax", "8"));
        int dbJobPoolMax = Integer.parseInt(l.get("DB_JOB_POOL_MAX", "db.job.poolMax", "4"));
        int port = Integer.parseInt(l.get("API_PORT", "api.port", "8080"));

        ZoneId zoneId = ZoneId.of(l.get("CLOCK_ZONE", "clock.zone", "UTC"));

        String artifactPath = l.get("MODEL_ARTIFACT_PATH", "model.artifactPath",
                "./models/traffic-ensemble.json.gz");
        boolean bootstrap = Boolean.parseBoolean(
                l.get("MODEL_BOOTSTRAP_ON_MISSING", "model.bootstrapOnMissing", "true"));

        String source = l.get("TRAINING_SOURCE", "training.source", "synthetic").trim().toLowerCase(Locale.ROOT);
        if (!source.equals("synthetic") && !source.equals("historical"))
            throw new IllegalStateException("training.source must be 'synthetic' or 'historical', got " + source);
        int syntheticSamples = Integer.parseInt(l.get("TRAINING_SYNTHETIC_SAMPLES", "training.syntheticSamples",
                "10000"));
        int minSamples = Integer.parseInt(l.get("TRAINING_MIN_SAMPLES", "training.minSamples", "50"));
        int historyDays = Integer.parseInt(l.get("TRAINING_HISTORY_DAYS", "training.historyDays", "90"));
        long seed = Long.parseLong(l.get("TRAINING_SEED", "training.seed", "42"));

        int rfTrees = Integer.parseInt(l.get("RF_TREES", "model.rf.trees", "100"));
        int rfDepth = Integer.parseInt(l.get("RF_MAX_DEPTH", "model.rf.maxDepth", "15"));
        int rfSplit = Integer.parseInt(l.get("RF_MIN_SPLIT", "model.rf.minSamplesSplit", "10"));
        int gbTrees = Integer.parseInt(l.get("GB_TREES", "model.gb.trees", "100"));
        int gbDepth = Integer.parseInt(l.get("GB_MAX_DEPTH", "model.gb.maxDepth", "5"));
        double gbRate = Double.parseDouble(l.get("GB_LEARNING_RATE", "model.gb.learningRate", "0.1"));

        boolean retrainEnabled = Boolean.parseBoolean(
                l.get("SCHED_RETRAIN_ENABLED", "schedule.retrain.enabled", "false"));
        Duration retrainSchedule = Duration.parse(l.get("SCHED_RETRAIN", "schedule.retrain", "P1D"));

        Duration cacheTtl = Duration.parse(l.get("FORECAST_CACHE_TTL", "forecast.cacheTtl", "PT30M"));
        long cacheMax = Long.parseLong(l.get("FORECAST_CACHE_MAX", "forecast.cacheMaxEntries", "10000"));
        List<Integer> horizons = parseHorizons(l.get("FORECAST_HORIZONS", "forecast.defaultHorizons",
                "1,3,6,12,24"));
        int maxHorizon = Integer.parseInt(l.get("FORECAST_MAX_HORIZON", "forecast.maxHorizonHours", "168"));
        String budgetRaw = l.get("FORECAST_HORIZON_BUDGET", "forecast.horizonBudget", "PT2S");
        Duration budget = budgetRaw.isBlank() || budgetRaw.equalsIgnoreCase("none") ? null
                : Duration.parse(budgetRaw);
        int workers = Integer.parseInt(l.get("FORECAST_WORKERS", "forecast.workers", "4"));
        double freeFlow = Double.parseDouble(l.get("FREE_FLOW_SPEED", "forecast.freeFlowSpeed", "60"));

        for (int h : horizons) {
            if (h < 1 || h > maxHorizon)
                throw new IllegalStateException("forecast.defaultHorizons entry out of range: " + h);
        }

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbApiPoolMax,
                dbJobPoolMax,

                zoneId,

                artifactPath,
                bootstrap,

                source,
                syntheticSamples,
                minSamples,
                historyDays,
                seed,
                rfTrees,
                rfDepth,
                rfSplit,
                gbTrees,
                gbDepth,
                gbRate,

                retrainEnabled,
                retrainSchedule,

                cacheTtl,
                cacheMax,
                horizons,
                maxHorizon,
                budget,
                workers,
                freeFlow);
    }

    // ----------------------------
    // helpers
    // ----------------------------

    /**
     * Source of raw config values, with or without the environment.
     */
    private record Lookup(Properties p, boolean useEnv) {
        /**
         * Reads a value from env, then JVM property, then properties file fallback.
         */
        String get(String envKey, String propKey, String def) {
            if (useEnv) {
                String v = System.getenv(envKey);
                if (v != null && !v.isBlank())
                    return v;
                String sys = System.getProperty(propKey);
                if (sys != null && !sys.isBlank())
                    return sys;
            }
            return p.getProperty(propKey, def);
        }
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v, String key) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + key + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    /**
     * Parses horizons in the format "1,3,6".
     */
    static List<Integer> parseHorizons(String s) {
        if (s == null || s.isBlank())
            return List.of();
        TreeSet<Integer> out = new TreeSet<>();
        for (String part : s.split(",")) {
            String t = part.trim();
            if (t.isEmpty())
                continue;
            out.add(Integer.parseInt(t));
        }
        return List.copyOf(out);
    }
}
