package fr.lapetina.ocr.pipeline.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the inference server as a child process when the pipeline manages it itself.
 *
 * The process is restarted when it exits unexpectedly or when the health checker
 * reports it unresponsive, at most {@code maxRestarts} times. Past that limit
 * {@code onFatal} runs and the process is left down.
 */
public final class InferenceServerManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceServerManager.class);

    private final List<String> command;
    private final BackendHealthChecker healthChecker;
    private final int maxRestarts;
    private final Duration startupTimeout;
    private final Runnable onFatal;
    private final ExecutorService supervisor;
    private final AtomicInteger restarts = new AtomicInteger(0);

    private volatile Process process;
    private volatile boolean stopping;
    private volatile boolean failed;

    public InferenceServerManager(
            List<String> command,
            BackendHealthChecker healthChecker,
            int maxRestarts,
            Duration startupTimeout,
            Runnable onFatal
    ) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Server command is required");
        }
        this.command = List.copyOf(command);
        this.healthChecker = healthChecker;
        this.maxRestarts = maxRestarts;
        this.startupTimeout = startupTimeout;
        this.onFatal = onFatal;
        this.supervisor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "inference-server-supervisor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Launches the server and blocks until it answers the readiness probe.
     *
     * @throws InferenceServerException if it cannot be started or never becomes ready
     */
    public void start() throws InterruptedException {
        launch();
        if (!healthChecker.awaitReady(startupTimeout)) {
            throw new InferenceServerException("Inference server not ready after " + startupTimeout.toSeconds() + "s");
        }
        healthChecker.start(this::requestRestart);
    }

    private void launch() {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        Process started;
        try {
            started = builder.start();
        } catch (IOException e) {
            throw new InferenceServerException("Failed to launch inference server: " + command, e);
        }
        process = started;
        log.info("Inference server launched: pid={}, command={}", started.pid(), command);

        Thread reader = new Thread(() -> pipeOutput(started), "inference-server-log-" + started.pid());
        reader.setDaemon(true);
        reader.start();

        started.onExit().thenAccept(exited -> {
            if (!stopping && exited == process) {
                log.warn("Inference server exited unexpectedly: pid={}, exitCode={}",
                        exited.pid(), exited.exitValue());
                requestRestart();
            }
        });
    }

    private void pipeOutput(Process p) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[inference-server] {}", line);
            }
        } catch (IOException e) {
            log.debug("Inference server output closed: pid={}, error={}", p.pid(), e.getMessage());
        }
    }

    /**
     * Schedules a restart on the supervisor thread.
     */
    public void requestRestart() {
        if (stopping || failed) {
            return;
        }
        supervisor.execute(this::restart);
    }

    private void restart() {
        if (stopping || failed) {
            return;
        }
        int attempt = restarts.incrementAndGet();
        if (attempt > maxRestarts) {
            failed = true;
            log.error("Inference server restart limit reached: maxRestarts={}", maxRestarts);
            destroy();
            onFatal.run();
            return;
        }

        log.warn("Restarting inference server: restart={}/{}", attempt, maxRestarts);
        destroy();
        try {
            launch();
            if (!healthChecker.awaitReady(startupTimeout)) {
                log.error("Inference server not ready after restart: restart={}", attempt);
                requestRestart();
            }
        } catch (InferenceServerException e) {
            log.error("Inference server relaunch failed: restart={}", attempt, e);
            requestRestart();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroy() {
        Process current = process;
        if (current == null || !current.isAlive()) {
            return;
        }
        // Mark stale before killing so its exit hook does not trigger another restart
        process = null;
        current.destroy();
        try {
            if (!current.waitFor(10, TimeUnit.SECONDS)) {
                current.destroyForcibly();
            }
        } catch (InterruptedException e) {
            current.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    public int getRestartCount() {
        return Math.min(restarts.get(), maxRestarts);
    }

    public boolean isFailed() {
        return failed;
    }

    public boolean isAlive() {
        Process current = process;
        return current != null && current.isAlive();
    }

    @Override
    public void close() {
        stopping = true;
        healthChecker.close();
        supervisor.shutdownNow();
        destroy();
        log.info("Inference server stopped");
    }

    /**
     * The inference server could not be started.
     */
    public static class InferenceServerException extends RuntimeException {
        public InferenceServerException(String message) {
            super(message);
        }

        public InferenceServerException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
