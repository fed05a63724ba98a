package fr.lapetina.ocr.pipeline;

import fr.lapetina.ocr.pipeline.domain.model.RunSummary;
import fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.ocr.pipeline.infrastructure.health.InferenceServerManager.InferenceServerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point: {@code PageOcrApplication [config.yaml]}.
 *
 * Exit codes: 0 when every batch completed, 1 when some batch failed or was
 * left outstanding, 2 when the pipeline could not start.
 */
public class PageOcrApplication {

    private static final Logger log = LoggerFactory.getLogger(PageOcrApplication.class);

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        System.exit(run(configPath));
    }

    static int run(String configPath) {
        log.info("Starting page OCR pipeline: config={}", configPath);

        PipelineFactory factory;
        try {
            factory = PipelineFactory.create(configPath);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return PipelineOrchestrator.EXIT_STARTUP_FAILURE;
        }

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(factory);
        Thread hook = new Thread(orchestrator::shutdown, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        try (factory) {
            RunSummary summary = orchestrator.run();
            return summary.exitCode() == 0 && !orchestrator.isBackendLost()
                    ? PipelineOrchestrator.EXIT_OK
                    : PipelineOrchestrator.EXIT_INCOMPLETE;
        } catch (ConfigurationException | InferenceServerException e) {
            log.error("Pipeline failed to start: {}", e.getMessage(), e);
            return PipelineOrchestrator.EXIT_STARTUP_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pipeline interrupted");
            return PipelineOrchestrator.EXIT_INCOMPLETE;
        } catch (RuntimeException e) {
            log.error("Pipeline crashed", e);
            return PipelineOrchestrator.EXIT_INCOMPLETE;
        } finally {
            removeHook(hook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down
            log.debug("Shutdown in progress, hook kept");
        }
    }
}
