/**
 * Domain model classes representing core concepts of the page pipeline.
 *
 * <p>This package contains immutable value objects shared by the queue,
 * the processors and the output writer.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ocr.pipeline.domain.model.WorkItem} - Batch of document references, the unit of leasing</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.domain.model.Lease} - Time-bounded claim on a work item</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.domain.model.InferenceResponse} - Tagged completion result (text or {@link fr.lapetina.ocr.pipeline.domain.model.ErrorType})</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.domain.model.PageResult} - Accepted or fallback outcome of one page</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.domain.model.Document} - Assembled text with page spans, keyed by content hash</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All types here are records; collections are copied on construction.
 */
package fr.lapetina.ocr.pipeline.domain.model;
