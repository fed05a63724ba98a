package fr.lapetina.ocr.pipeline.infrastructure.config;

import fr.lapetina.ocr.pipeline.domain.model.FallbackTextMode;
import fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static PipelineConfig fromYaml(String yaml) {
        return new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        PipelineConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getInference().getModel()).isEqualTo("test-model");
        assertThat(config.getInference().getRetry().getMaxAttempts()).isEqualTo(2);
        assertThat(config.getPage().getFallbackText()).isEqualTo(FallbackTextMode.EMPTY);
        assertThat(config.getWorker().getCount()).isEqualTo(2);
        assertThat(config.getOutput().isMarkdown()).isTrue();
        assertThat(config.getOutput().getRingBufferSize()).isEqualTo(16);
    }

    @Test
    @DisplayName("should apply defaults to omitted sections")
    void shouldApplyDefaults() {
        PipelineConfig config = fromYaml("workspace: /tmp/ws\n");

        assertThat(config.getWorkspace()).isEqualTo("/tmp/ws");
        assertThat(config.getPage().getMaxAttempts()).isEqualTo(8);
        assertThat(config.getPage().getFallbackText()).isEqualTo(FallbackTextMode.EXTRACTED_TEXT);
        assertThat(config.getQueue().getBatchSize()).isEqualTo(100);
        assertThat(config.getOutput().getWaitStrategy()).isEqualTo("blocking");
        assertThat(config.getServer().isEnabled()).isFalse();
    }

    @Test
    @DisplayName("should fail when the file does not exist")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> new ConfigLoader("does/not/exist.yaml").load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should report every invalid setting at once")
    void shouldReportAllViolations() {
        String yaml = "worker:\n  count: 0\n  leaseVisibilityMs: 1000\n  renewIntervalMs: 2000\n"
                + "output:\n  ringBufferSize: 10\n";

        assertThatThrownBy(() -> fromYaml(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("worker.count")
                .hasMessageContaining("worker.renewIntervalMs")
                .hasMessageContaining("output.ringBufferSize");
    }

    @Test
    @DisplayName("should require a server command for a self-managed backend")
    void shouldRequireServerCommand() {
        assertThatThrownBy(() -> fromYaml("inference:\n  startServer: true\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("inference.serverCommand");
    }

    @Test
    @DisplayName("should reject unknown keys")
    void shouldRejectUnknownKeys() {
        assertThatThrownBy(() -> fromYaml("workers: 3\n"))
                .isInstanceOf(ConfigurationException.class);
    }
}
