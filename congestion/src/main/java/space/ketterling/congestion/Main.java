/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for the congestion forecasting service.
*
* Initializes configuration, database connections, repositories, the forecasting engine
* and the model lifecycle, then starts the API server. Startup flow loads configuration,
* sets up repositories, loads (or bootstraps) the model, starts the retrain scheduler
* and the API server; program also handles a graceful shutdown.
*/

package space.ketterling.congestion;

import space.ketterling.congestion.api.ApiServer;
import space.ketterling.congestion.config.AppConfig;
import space.ketterling.congestion.db.*;
import space.ketterling.congestion.features.FeatureBuilder;
import space.ketterling.congestion.forecast.ForecastCache;
import space.ketterling.congestion.forecast.HorizonScheduler;
import space.ketterling.congestion.forecast.PredictionService;
import space.ketterling.congestion.ml.EnsemblePredictor;
import space.ketterling.congestion.ml.ModelHolder;
import space.ketterling.congestion.ml.ModelStore;
import space.ketterling.congestion.training.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();

        ObjectMapper om = new ObjectMapper();
        HikariDataSource apiDs = Database.createApiDataSource(cfg);
        HikariDataSource jobDs = Database.createJobDataSource(cfg);

        // Repos
        LocationRepo locationRepo = new LocationRepo(apiDs);
        ObservationRepo observationRepo = new ObservationRepo(apiDs);
        ObservationRepo trainingObservations = new ObservationRepo(jobDs);
        PredictionRepo predictionRepo = new PredictionRepo(apiDs);
        ModelRunRepo modelRunRepo = new ModelRunRepo(jobDs);

        // Engine
        Clock clock = Clock.systemUTC();
        FeatureBuilder features = new FeatureBuilder(cfg.clockZoneId());
        ModelHolder holder = new ModelHolder();
        EnsemblePredictor predictor = new EnsemblePredictor(holder);
        ForecastCache cache = new ForecastCache(cfg.forecastCacheTtl(), cfg.forecastCacheMaxEntries());

        AtomicInteger workerId = new AtomicInteger();
        ExecutorService forecastWorkers = Executors.newFixedThreadPool(Math.max(1, cfg.forecastWorkers()), r -> {
            Thread t = new Thread(r, "forecast-worker-" + workerId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        HorizonScheduler horizons = new HorizonScheduler(clock, features, predictor, forecastWorkers);
        PredictionService predictions = new PredictionService(locationRepo, observationRepo, predictionRepo,
                horizons, cache, predictor, features, clock, cfg.forecastDefaultHorizons(),
                cfg.forecastMaxHorizonHours(), cfg.forecastHorizonBudget());

        // Training
        TrainingPipeline pipeline = new TrainingPipeline(new TrainingPipeline.Hyperparameters(
                cfg.rfTrees(), cfg.rfMaxDepth(), cfg.rfMinSamplesSplit(),
                cfg.gbTrees(), cfg.gbMaxDepth(), cfg.gbLearningRate(),
                cfg.trainingMinSamples(), cfg.trainingSeed()), clock);
        TrainingDataSource synthetic = new SyntheticTrainingDataSource(cfg.trainingSyntheticSamples(),
                cfg.trainingSeed());
        TrainingDataSource source = "historical".equals(cfg.trainingSource())
                ? new HistoricalTrainingDataSource(trainingObservations, features, clock, cfg.trainingHistoryDays())
                : synthetic;
        ModelLifecycle lifecycle = new ModelLifecycle(holder, new ModelStore(om), Path.of(cfg.modelArtifactPath()),
                pipeline, source, synthetic, cache, modelRunRepo);

        MDC.put("job", "startup-model");
        try {
            ModelLifecycle.LoadOutcome outcome = lifecycle.loadOrBootstrap(cfg.modelBootstrapOnMissing());
            log.info("Model startup: {}", outcome);
        } finally {
            MDC.remove("job");
        }

        RetrainScheduler retrain = new RetrainScheduler(lifecycle, cfg.retrainEnabled(), cfg.retrainSchedule());
        retrain.start();

        ApiServer api = new ApiServer(cfg, om, apiDs, new ApiServer.Services(
                predictions, predictor, cache, predictionRepo, modelRunRepo, retrain));
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                retrain.stop();
                forecastWorkers.shutdownNow();
                forecastWorkers.awaitTermination(3, TimeUnit.SECONDS);
                apiDs.close();
                jobDs.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
