package fr.lapetina.ocr.pipeline.infrastructure.config;

import fr.lapetina.ocr.pipeline.domain.model.FallbackTextMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the pipeline.
 * Designed to be populated from YAML.
 */
public class PipelineConfig {

    private String workspace = "./workspace";
    private List<String> sources = new ArrayList<>();
    private InferenceConfig inference = new InferenceConfig();
    private PageConfig page = new PageConfig();
    private DocumentConfig document = new DocumentConfig();
    private WorkerConfig worker = new WorkerConfig();
    private QueueConfig queue = new QueueConfig();
    private OutputConfig output = new OutputConfig();
    private RenderConfig render = new RenderConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private ServerConfig server = new ServerConfig();

    // Getters and Setters
    public String getWorkspace() { return workspace; }
    public void setWorkspace(String workspace) { this.workspace = workspace; }

    public List<String> getSources() { return sources; }
    public void setSources(List<String> sources) { this.sources = sources; }

    public InferenceConfig getInference() { return inference; }
    public void setInference(InferenceConfig inference) { this.inference = inference; }

    public PageConfig getPage() { return page; }
    public void setPage(PageConfig page) { this.page = page; }

    public DocumentConfig getDocument() { return document; }
    public void setDocument(DocumentConfig document) { this.document = document; }

    public WorkerConfig getWorker() { return worker; }
    public void setWorker(WorkerConfig worker) { this.worker = worker; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }

    public RenderConfig getRender() { return render; }
    public void setRender(RenderConfig render) { this.render = render; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    /**
     * Inference endpoint, either external or started by the pipeline.
     */
    public static class InferenceConfig {
        private String url = "http://localhost:30024";
        private String model = "olmocr";
        private boolean startServer = false;
        private List<String> serverCommand = new ArrayList<>();
        private int maxInFlight = 64;
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 600000;
        private RetryConfig retry = new RetryConfig();
        private RetryConfig overloadRetry = RetryConfig.overload();
        private HealthProbeConfig healthProbe = new HealthProbeConfig();
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public boolean isStartServer() { return startServer; }
        public void setStartServer(boolean startServer) { this.startServer = startServer; }

        public List<String> getServerCommand() { return serverCommand; }
        public void setServerCommand(List<String> serverCommand) { this.serverCommand = serverCommand; }

        public int getMaxInFlight() { return maxInFlight; }
        public void setMaxInFlight(int maxInFlight) { this.maxInFlight = maxInFlight; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }

        public RetryConfig getOverloadRetry() { return overloadRetry; }
        public void setOverloadRetry(RetryConfig overloadRetry) { this.overloadRetry = overloadRetry; }

        public HealthProbeConfig getHealthProbe() { return healthProbe; }
        public void setHealthProbe(HealthProbeConfig healthProbe) { this.healthProbe = healthProbe; }

        public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
        public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    }

    /**
     * Transport retry configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 5;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 30000;
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.5;

        static RetryConfig overload() {
            RetryConfig config = new RetryConfig();
            config.setMaxAttempts(10);
            config.setInitialBackoffMs(10000);
            config.setMaxBackoffMs(300000);
            return config;
        }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }

    /**
     * Readiness probing after a suspected backend crash.
     */
    public static class HealthProbeConfig {
        private long intervalMs = 1000;
        private long ceilingMs = 600000;
        private long timeoutMs = 5000;
        private int failuresBeforeRestart = 3;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getCeilingMs() { return ceilingMs; }
        public void setCeilingMs(long ceilingMs) { this.ceilingMs = ceilingMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getFailuresBeforeRestart() { return failuresBeforeRestart; }
        public void setFailuresBeforeRestart(int failuresBeforeRestart) { this.failuresBeforeRestart = failuresBeforeRestart; }
    }

    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long recoveryMs = 30000;
        private int halfOpenMaxCalls = 3;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryMs() { return recoveryMs; }
        public void setRecoveryMs(long recoveryMs) { this.recoveryMs = recoveryMs; }

        public int getHalfOpenMaxCalls() { return halfOpenMaxCalls; }
        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) { this.halfOpenMaxCalls = halfOpenMaxCalls; }
    }

    /**
     * Per-page validation and retry configuration.
     */
    public static class PageConfig {
        private int maxAttempts = 8;
        private int targetLongestImageDim = 1288;
        private int anchorTextLength = 6000;
        private int maxTokens = 4500;
        private int modelMaxContext = 16384;
        private FallbackTextMode fallbackText = FallbackTextMode.EXTRACTED_TEXT;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public int getTargetLongestImageDim() { return targetLongestImageDim; }
        public void setTargetLongestImageDim(int targetLongestImageDim) { this.targetLongestImageDim = targetLongestImageDim; }

        public int getAnchorTextLength() { return anchorTextLength; }
        public void setAnchorTextLength(int anchorTextLength) { this.anchorTextLength = anchorTextLength; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public int getModelMaxContext() { return modelMaxContext; }
        public void setModelMaxContext(int modelMaxContext) { this.modelMaxContext = modelMaxContext; }

        public FallbackTextMode getFallbackText() { return fallbackText; }
        public void setFallbackText(FallbackTextMode fallbackText) { this.fallbackText = fallbackText; }
    }

    public static class DocumentConfig {
        private int maxConcurrentPages = 16;

        public int getMaxConcurrentPages() { return maxConcurrentPages; }
        public void setMaxConcurrentPages(int maxConcurrentPages) { this.maxConcurrentPages = maxConcurrentPages; }
    }

    /**
     * Worker pool and leasing configuration.
     */
    public static class WorkerConfig {
        private int count = 8;
        private long leaseVisibilityMs = 1800000;
        private long renewIntervalMs = 300000;
        private int maxBatchAttempts = 3;
        private long pollIntervalMs = 5000;
        private boolean runForever = false;
        private long shutdownGraceMs = 30000;
        private long reportIntervalMs = 60000;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public long getLeaseVisibilityMs() { return leaseVisibilityMs; }
        public void setLeaseVisibilityMs(long leaseVisibilityMs) { this.leaseVisibilityMs = leaseVisibilityMs; }

        public long getRenewIntervalMs() { return renewIntervalMs; }
        public void setRenewIntervalMs(long renewIntervalMs) { this.renewIntervalMs = renewIntervalMs; }

        public int getMaxBatchAttempts() { return maxBatchAttempts; }
        public void setMaxBatchAttempts(int maxBatchAttempts) { this.maxBatchAttempts = maxBatchAttempts; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public boolean isRunForever() { return runForever; }
        public void setRunForever(boolean runForever) { this.runForever = runForever; }

        public long getShutdownGraceMs() { return shutdownGraceMs; }
        public void setShutdownGraceMs(long shutdownGraceMs) { this.shutdownGraceMs = shutdownGraceMs; }

        public long getReportIntervalMs() { return reportIntervalMs; }
        public void setReportIntervalMs(long reportIntervalMs) { this.reportIntervalMs = reportIntervalMs; }
    }

    public static class QueueConfig {
        private String prefix = "queue";
        private int batchSize = 100;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    /**
     * Result writing configuration.
     */
    public static class OutputConfig {
        private boolean markdown = false;
        private int ringBufferSize = 64;
        private String waitStrategy = "blocking";
        private String pipelineVersion = "1.0.0";

        public boolean isMarkdown() { return markdown; }
        public void setMarkdown(boolean markdown) { this.markdown = markdown; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public String getPipelineVersion() { return pipelineVersion; }
        public void setPipelineVersion(String pipelineVersion) { this.pipelineVersion = pipelineVersion; }
    }

    public static class RenderConfig {
        private int threads = Math.max(1, Runtime.getRuntime().availableProcessors());

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "page_ocr";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Status HTTP server and self-managed inference server limits.
     */
    public static class ServerConfig {
        private boolean enabled = false;
        private String host = "0.0.0.0";
        private int port = 8080;
        private int maxRestarts = 5;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getMaxRestarts() { return maxRestarts; }
        public void setMaxRestarts(int maxRestarts) { this.maxRestarts = maxRestarts; }
    }
}
