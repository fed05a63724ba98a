package fr.lapetina.ocr.pipeline.worker;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Two-step shutdown flag shared by the orchestrator, the workers and the page processors.
 *
 * A stop request ends leasing; work in progress carries on. Forcing also makes
 * page processors give up on their remaining attempts.
 */
public final class ShutdownSignal {

    private final CountDownLatch stopLatch = new CountDownLatch(1);
    private volatile boolean forced;

    public void requestStop() {
        stopLatch.countDown();
    }

    public void force() {
        forced = true;
        stopLatch.countDown();
    }

    public boolean isStopRequested() {
        return stopLatch.getCount() == 0;
    }

    public boolean isForced() {
        return forced;
    }

    /**
     * Waits up to {@code timeout} for a stop request.
     *
     * @return true if stop was requested
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
