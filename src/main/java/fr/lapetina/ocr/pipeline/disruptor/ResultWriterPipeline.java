package fr.lapetina.ocr.pipeline.disruptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.ocr.pipeline.disruptor.handlers.CompletionHandler;
import fr.lapetina.ocr.pipeline.disruptor.handlers.MetricsHandler;
import fr.lapetina.ocr.pipeline.disruptor.handlers.SerializationHandler;
import fr.lapetina.ocr.pipeline.disruptor.handlers.StorageHandler;
import fr.lapetina.ocr.pipeline.domain.event.BatchResultEvent;
import fr.lapetina.ocr.pipeline.domain.event.BatchResultEventFactory;
import fr.lapetina.ocr.pipeline.domain.event.BatchWriteResult;
import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.domain.model.WorkItem;
import fr.lapetina.ocr.pipeline.infrastructure.config.PipelineConfig;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.PipelineMetrics;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disruptor pipeline writing finished batches to the workspace.
 *
 * Workers publish a batch once all of its documents are assembled; the handlers
 * then run in sequence:
 * <pre>
 * Serialization -> Storage -> Metrics -> Completion
 * </pre>
 *
 * PRODUCER TYPE: MULTI, every worker thread publishes.
 *
 * BACKPRESSURE: publishing uses the blocking {@link RingBuffer#next()}. A worker
 * whose batch does not fit waits for a free slot; finished batches are never
 * rejected, because dropping one would lose pages that were already paid for.
 */
public final class ResultWriterPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultWriterPipeline.class);

    private final Disruptor<BatchResultEvent> disruptor;
    private final RingBuffer<BatchResultEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ResultWriterPipeline(Builder builder) {
        ThreadFactory threadFactory = new DisruptorThreadFactory("result-writer");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new BatchResultEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        disruptor
                .handleEventsWith(new SerializationHandler(builder.objectMapper, builder.markdownEnabled))
                .then(new StorageHandler(builder.objectStore))
                .then(new MetricsHandler(builder.metrics))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("ResultWriterPipeline created: ringBufferSize={}, waitStrategy={}, markdown={}",
                builder.ringBufferSize, builder.waitStrategy, builder.markdownEnabled);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("ResultWriterPipeline started");
        }
    }

    /**
     * Submits a finished batch for writing.
     * Blocks while the ring buffer is full.
     *
     * @return future completing once the batch is durably written
     */
    public CompletableFuture<BatchWriteResult> submit(WorkItem workItem, List<Document> documents) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Pipeline not running"));
        }

        CompletableFuture<BatchWriteResult> resultFuture = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            BatchResultEvent event = ringBuffer.get(sequence);
            event.initialize(workItem, documents, resultFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Batch submitted: workItemId={}, documents={}, sequence={}",
                workItem.id(), documents.size(), sequence);
        return resultFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Drains published batches, then stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down ResultWriterPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("ResultWriterPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("ResultWriterPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class DisruptorExceptionHandler implements ExceptionHandler<BatchResultEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, BatchResultEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            event.markFailed(ex);
            if (event.getResultFuture() != null && !event.getResultFuture().isDone()) {
                event.getResultFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for ResultWriterPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 64;
        private String waitStrategy = "blocking";
        private boolean markdownEnabled = false;
        private ObjectStore objectStore;
        private PipelineMetrics metrics = PipelineMetrics.NOOP;
        private ObjectMapper objectMapper;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder markdownEnabled(boolean enabled) {
            this.markdownEnabled = enabled;
            return this;
        }

        public Builder objectStore(ObjectStore store) {
            this.objectStore = store;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.objectMapper = mapper;
            return this;
        }

        public Builder fromConfig(PipelineConfig.OutputConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            this.markdownEnabled = config.isMarkdown();
            return this;
        }

        public ResultWriterPipeline build() {
            if (objectStore == null) {
                throw new IllegalStateException("ObjectStore is required");
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
            }
            return new ResultWriterPipeline(this);
        }
    }
}
