package fr.lapetina.ocr.pipeline.infrastructure.health;

import fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.ocr.pipeline.infrastructure.http.InferenceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Readiness and identity checks against the inference backend.
 *
 * Used once at startup to verify the served model, and optionally in the
 * background to detect a backend that stopped answering.
 */
public final class BackendHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthChecker.class);

    private final InferenceClient client;
    private final Duration checkInterval;
    private final int failureThreshold;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    public BackendHealthChecker(InferenceClient client, Duration checkInterval, int failureThreshold) {
        this.client = client;
        this.checkInterval = checkInterval;
        this.failureThreshold = failureThreshold;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backend-health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Checks that the backend serves {@code expectedModel}.
     *
     * @throws ConfigurationException if the backend is unreachable or serves another model
     */
    public void verifyModel(String expectedModel, Duration timeout) {
        List<String> served;
        try {
            served = client.listModels(timeout).get(timeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationException("Interrupted while verifying inference endpoint", e);
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConfigurationException(
                    "Inference endpoint unreachable: " + client.getBaseUrl() + " (" + cause.getMessage() + ")", e);
        }

        if (!served.contains(expectedModel)) {
            throw new ConfigurationException(
                    "Inference endpoint serves " + served + " but configuration expects model " + expectedModel);
        }
        log.info("Inference endpoint verified: url={}, model={}", client.getBaseUrl(), expectedModel);
    }

    /**
     * Polls readiness until it succeeds or {@code timeout} elapses.
     *
     * @return true if the backend became ready in time
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        int probes = 0;
        while (true) {
            probes++;
            if (probeOnce()) {
                log.info("Backend ready: url={}, probes={}", client.getBaseUrl(), probes);
                return true;
            }
            if (!Instant.now().plus(checkInterval).isBefore(deadline)) {
                log.warn("Backend not ready before timeout: url={}, probes={}, timeoutMs={}",
                        client.getBaseUrl(), probes, timeout.toMillis());
                return false;
            }
            Thread.sleep(checkInterval.toMillis());
        }
    }

    private boolean probeOnce() throws InterruptedException {
        try {
            return client.isReady().get();
        } catch (ExecutionException e) {
            return false;
        }
    }

    /**
     * Starts periodic checks; {@code onUnhealthy} runs each time {@code failureThreshold}
     * consecutive probes fail.
     */
    public void start(Runnable onUnhealthy) {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    () -> checkBackend(onUnhealthy),
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started: interval={}, failureThreshold={}", checkInterval, failureThreshold);
        }
    }

    void checkBackend(Runnable onUnhealthy) {
        if (!running.get()) {
            return;
        }
        boolean healthy;
        try {
            healthy = probeOnce();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        if (healthy) {
            int previous = consecutiveFailures.getAndSet(0);
            if (previous > 0) {
                log.info("Backend health restored: url={}, previousFailures={}", client.getBaseUrl(), previous);
            }
            return;
        }

        int failures = consecutiveFailures.incrementAndGet();
        log.warn("Health check failed: url={}, consecutiveFailures={}", client.getBaseUrl(), failures);
        if (failures >= failureThreshold) {
            consecutiveFailures.set(0);
            try {
                onUnhealthy.run();
            } catch (RuntimeException e) {
                log.error("Unhealthy-backend handler failed: url={}", client.getBaseUrl(), e);
            }
        }
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Health checker stopped");
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
