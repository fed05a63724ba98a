/**
 * Configuration loading.
 *
 * <p>This package binds the YAML configuration file to {@link fr.lapetina.ocr.pipeline.infrastructure.config.PipelineConfig}
 * and validates it before any component is built.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ocr.pipeline.infrastructure.config.PipelineConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code workspace}, {@code sources} - Shared workspace directory and source selectors</li>
 *   <li>{@code inference} - Endpoint, model, retries, health probe and circuit breaker</li>
 *   <li>{@code page} - Attempt budget, rendering size, prompt and fallback settings</li>
 *   <li>{@code document} - Page concurrency per document</li>
 *   <li>{@code worker} - Worker count, leasing and shutdown timings</li>
 *   <li>{@code queue} - Queue prefix and batch size</li>
 *   <li>{@code output} - Markdown output and result writer ring buffer</li>
 *   <li>{@code render} - Render thread count</li>
 *   <li>{@code metrics} - Prometheus metrics prefix</li>
 *   <li>{@code server} - Status endpoint and self-managed server restarts</li>
 * </ul>
 */
package fr.lapetina.ocr.pipeline.infrastructure.config;
