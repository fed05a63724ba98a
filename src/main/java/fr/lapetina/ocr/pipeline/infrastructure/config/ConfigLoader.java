package fr.lapetina.ocr.pipeline.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and validates the pipeline configuration.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Defaults for every field left out of the YAML
 * - Validation of cross-field constraints before anything starts
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(PipelineConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded, validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public PipelineConfig load() {
        PipelineConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private PipelineConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private PipelineConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public PipelineConfig loadFromStream(InputStream inputStream) {
        PipelineConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private PipelineConfig parse(InputStream is, String origin) {
        try {
            PipelineConfig config = yaml.load(is);
            // An empty document means all defaults
            return config != null ? config : new PipelineConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks constraints that bean binding cannot express.
     *
     * @throws ConfigurationException listing every violation found
     */
    public static void validate(PipelineConfig config) {
        List<String> errors = new ArrayList<>();
        PipelineConfig.InferenceConfig inference = config.getInference();

        if (isBlank(config.getWorkspace())) {
            errors.add("workspace is required");
        }
        if (isBlank(inference.getModel())) {
            errors.add("inference.model is required");
        }
        if (isBlank(inference.getUrl())) {
            errors.add("inference.url is required");
        }
        if (inference.isStartServer() && inference.getServerCommand().isEmpty()) {
            errors.add("inference.serverCommand is required when inference.startServer is true");
        }
        if (inference.getMaxInFlight() < 1) {
            errors.add("inference.maxInFlight must be >= 1");
        }
        if (inference.getRetry().getMaxAttempts() < 1 || inference.getOverloadRetry().getMaxAttempts() < 1) {
            errors.add("inference retry maxAttempts must be >= 1");
        }
        if (config.getPage().getMaxAttempts() < 1) {
            errors.add("page.maxAttempts must be >= 1");
        }
        if (config.getPage().getFallbackText() == null) {
            errors.add("page.fallbackText is required");
        }
        if (config.getDocument().getMaxConcurrentPages() < 1) {
            errors.add("document.maxConcurrentPages must be >= 1");
        }
        PipelineConfig.WorkerConfig worker = config.getWorker();
        if (worker.getCount() < 1) {
            errors.add("worker.count must be >= 1");
        }
        if (worker.getLeaseVisibilityMs() <= 0) {
            errors.add("worker.leaseVisibilityMs must be > 0");
        }
        if (worker.getRenewIntervalMs() <= 0 || worker.getRenewIntervalMs() >= worker.getLeaseVisibilityMs()) {
            errors.add("worker.renewIntervalMs must be > 0 and shorter than worker.leaseVisibilityMs");
        }
        if (worker.getMaxBatchAttempts() < 1) {
            errors.add("worker.maxBatchAttempts must be >= 1");
        }
        if (config.getQueue().getBatchSize() < 1) {
            errors.add("queue.batchSize must be >= 1");
        }
        int ringBufferSize = config.getOutput().getRingBufferSize();
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1) {
            errors.add("output.ringBufferSize must be a power of two");
        }
        if (config.getRender().getThreads() < 1) {
            errors.add("render.threads must be >= 1");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Creates a default configuration.
     */
    public static PipelineConfig createDefault() {
        return new PipelineConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
