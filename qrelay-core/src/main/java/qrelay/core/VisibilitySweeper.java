package qrelay.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the visibility-expiry sweep periodically on a daemon thread. Receive sweeps its
 * own queue lazily, so the sweeper only matters for queues nobody is polling.
 */
public class VisibilitySweeper implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VisibilitySweeper.class);

    private final MessageLifecycleEngine engine;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public VisibilitySweeper(MessageLifecycleEngine engine, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive: " + interval);
        }
        this.engine = engine;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "qrelay-visibility-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Visibility sweeper started with interval {} ms", millis);
    }

    private void sweep() {
        try {
            engine.sweepExpired();
        } catch (RuntimeException e) {
            // keep the schedule alive, a thrown exception would cancel it
            logger.error("Visibility sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Visibility sweeper stopped");
    }
}
