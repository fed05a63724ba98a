package fr.lapetina.ocr.pipeline.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating BatchResultEvent instances in the Disruptor ring buffer.
 *
 * Events are pre-allocated at startup and reused by clearing and re-initializing them.
 */
public final class BatchResultEventFactory implements EventFactory<BatchResultEvent> {

    @Override
    public BatchResultEvent newInstance() {
        return new BatchResultEvent();
    }
}
