/**
 * Page OCR Pipeline - distributed conversion of PDF and image documents into text
 * with a vision language model.
 *
 * <p>Documents are grouped into batches on a lease-based work queue kept in a
 * shared workspace. Any number of worker processes lease batches, render every
 * page, ask an OpenAI-compatible inference server for a structured transcription,
 * validate the answer (retrying with escalated sampling) and write one JSONL
 * record per document.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ocr.pipeline.PipelineFactory} - Wires every component from YAML configuration</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.PipelineOrchestrator} - Backend startup, queue population,
 *       workers and graceful shutdown</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.PageOcrApplication} - Command line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml")) {
 *     RunSummary summary = new PipelineOrchestrator(factory).run();
 *     System.out.println(summary);
 * }
 * }</pre>
 *
 * @see fr.lapetina.ocr.pipeline.worker.WorkerManager
 * @see fr.lapetina.ocr.pipeline.disruptor.ResultWriterPipeline
 */
package fr.lapetina.ocr.pipeline;
