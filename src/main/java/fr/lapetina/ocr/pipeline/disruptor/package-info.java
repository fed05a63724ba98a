/**
 * LMAX Disruptor-based writer for finished batches.
 *
 * <p>Workers hand over the assembled documents of a batch; handler threads
 * serialize them to JSONL (and optionally markdown), store them, record
 * output metrics and complete the worker's future.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Serialization → Storage → Metrics → Completion
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ocr.pipeline.disruptor.ResultWriterPipeline} - Ring buffer and handler wiring</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.disruptor.OutputKeys} - Output key layout</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.ocr.pipeline.disruptor;
