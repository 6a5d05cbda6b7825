package space.ketterling.congestion.training;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import space.ketterling.congestion.error.ErrorKind;
import space.ketterling.congestion.error.ForecastException;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Runs model retraining on a fixed delay. Also owns the background thread
 * that API-triggered retrains run on.
 */
public final class RetrainScheduler {
    private static final Logger log = LoggerFactory.getLogger(RetrainScheduler.class);

    private final ScheduledExecutorService retrainExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "model-retrain"));

    private final ModelLifecycle lifecycle;
    private final boolean enabled;
    private final Duration interval;

    private ScheduledFuture<?> retrainTask;

    public RetrainScheduler(ModelLifecycle lifecycle, boolean enabled, Duration interval) {
        this.lifecycle = lifecycle;
        this.enabled = enabled;
        this.interval = interval;
    }

    public void start() {
        if (!enabled) {
            log.info("Scheduled retraining disabled.");
            return;
        }
        long seconds = Math.max(60L, interval.toSeconds());
        retrainTask = retrainExec.scheduleWithFixedDelay(safe("retrain", lifecycle::retrain),
                seconds, seconds, TimeUnit.SECONDS);
        log.info("Retrain scheduler started (every {}).", interval);
    }

    /**
     * Starts a retrain in the background now.
     *
     * @throws ForecastException with {@link ErrorKind#RETRAIN_IN_PROGRESS} when
     *                           one is already running
     */
    public Future<?> triggerNow() {
        return lifecycle.submitRetrain(retrainExec);
    }

    public boolean isRetraining() {
        return lifecycle.isRetraining();
    }

    public void stop() {
        if (retrainTask != null)
            retrainTask.cancel(true);
        retrainExec.shutdownNow();
        try {
            if (!retrainExec.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("retrainExec did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (ForecastException e) {
                log.warn("Scheduled job skipped: {} ({})", name, e.getMessage());
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
