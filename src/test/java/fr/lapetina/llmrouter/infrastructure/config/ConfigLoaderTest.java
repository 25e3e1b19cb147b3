package fr.lapetina.llmrouter.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws IOException {
        Path file = tempDir.resolve("router.yaml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }

    @Nested
    @DisplayName("loading")
    class LoadingTests {

        @Test
        @DisplayName("should load configuration from the classpath")
        void shouldLoadFromClasspath() {
            try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
                RouterConfig config = loader.load();

                assertThat(config.getModels()).extracting(RouterConfig.ModelConfig::getId)
                        .containsExactly("model-a", "model-b", "model-embed", "model-legacy");
                assertThat(config.getModels().get(0).getWeight()).isEqualTo(2);
                assertThat(config.getModels().get(0).getCostPerThousandTokens()).isEqualByComparingTo("0.50");
                assertThat(config.getModels().get(2).getCacheTtlSeconds()).isEqualTo(7200L);
                assertThat(config.getModels().get(3).isEnabled()).isFalse();
                assertThat(config.getStrategy().getType()).isEqualTo("round-robin");
                assertThat(config.getCache().getKeyPrefix()).isEqualTo("test:");
                assertThat(config.getCache().getShared().isEnabled()).isFalse();
                assertThat(config.getFailover().getMaxRetries()).isEqualTo(1);
                assertThat(config.getMetrics().getSampleWindowSize()).isEqualTo(200);
                assertThat(config.getValidation().getMaxPromptLength()).isEqualTo(2000);
                assertThat(loader.getCurrentConfig()).isSameAs(config);
            }
        }

        @Test
        @DisplayName("should read per-type TTLs as numbers")
        void shouldReadTypeTtls() {
            try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
                Object ttl = loader.load().getCache().getModelTypeTtlSeconds().get("chat");

                assertThat(((Number) ttl).longValue()).isEqualTo(120L);
            }
        }

        @Test
        @DisplayName("should fill unspecified sections with defaults")
        void shouldApplyDefaults() throws IOException {
            Path file = writeConfig("models:\n  - id: solo\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                RouterConfig config = loader.load();

                assertThat(config.getModels()).hasSize(1);
                assertThat(config.getModels().get(0).getWeight()).isEqualTo(1);
                assertThat(config.getModels().get(0).isEnabled()).isTrue();
                assertThat(config.getStrategy().getType()).isEqualTo("round-robin");
                assertThat(config.getCache().getLocalMaxEntries()).isEqualTo(10000);
                assertThat(config.getCache().getDefaultTtlSeconds()).isEqualTo(1800);
                assertThat(config.getFailover().isEnabled()).isTrue();
                assertThat(config.getMetrics().getUnhealthyErrorRate()).isEqualTo(0.10);
            }
        }

        @Test
        @DisplayName("should treat an empty document as the default configuration")
        void shouldTreatEmptyDocumentAsDefault() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
                RouterConfig config = loader.loadFromStream(new ByteArrayInputStream(new byte[0]));

                assertThat(config.getModels()).isEmpty();
                assertThat(config.getPool().getIdleTimeoutSeconds()).isEqualTo(1800);
            }
        }

        @Test
        @DisplayName("should reject missing files")
        void shouldRejectMissingFile() {
            try (ConfigLoader loader = new ConfigLoader(tempDir.resolve("absent.yaml").toString())) {
                assertThatThrownBy(loader::load)
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("not found");
            }
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() throws IOException {
            Path file = writeConfig("models: [\n  - id: broken\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                assertThatThrownBy(loader::load)
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("Invalid configuration");
            }
        }

        @Test
        @DisplayName("should reject unknown properties")
        void shouldRejectUnknownProperties() throws IOException {
            Path file = writeConfig("strategy:\n  kind: random\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                assertThatThrownBy(loader::load).isInstanceOf(ConfigLoader.ConfigurationException.class);
            }
        }
    }

    @Nested
    @DisplayName("reloading")
    class ReloadTests {

        @Test
        @DisplayName("should notify listeners with old and new configuration")
        void shouldNotifyListeners() throws IOException {
            Path file = writeConfig("strategy:\n  type: random\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                RouterConfig first = loader.load();
                List<String> changes = new ArrayList<>();
                loader.addListener((oldConfig, newConfig) ->
                        changes.add(oldConfig.getStrategy().getType() + "->" + newConfig.getStrategy().getType()));

                writeConfig("strategy:\n  type: performance-based\n");
                RouterConfig reloaded = loader.reload();

                assertThat(reloaded).isNotSameAs(first);
                assertThat(changes).containsExactly("random->performance-based");
            }
        }

        @Test
        @DisplayName("should keep the current configuration when reload fails")
        void shouldKeepConfigOnFailedReload() throws IOException {
            Path file = writeConfig("strategy:\n  type: random\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                RouterConfig first = loader.load();

                writeConfig("strategy: [unclosed\n");
                RouterConfig current = loader.reload();

                assertThat(current).isSameAs(first);
            }
        }

        @Test
        @DisplayName("should not notify listeners when the document is unchanged")
        void shouldSkipUnchangedDocument() throws IOException {
            Path file = writeConfig("strategy:\n  type: random\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                RouterConfig first = loader.load();
                List<RouterConfig> received = new ArrayList<>();
                loader.addListener((oldConfig, newConfig) -> received.add(newConfig));

                writeConfig("strategy:\n  type: random\n");

                assertThat(loader.reload()).isSameAs(first);
                assertThat(received).isEmpty();
            }
        }

        @Test
        @DisplayName("should reject duplicate model ids and keep the current configuration")
        void shouldRejectDuplicateModelIds() throws IOException {
            Path file = writeConfig("models:\n  - id: model-a\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                RouterConfig first = loader.load();
                List<RouterConfig> received = new ArrayList<>();
                loader.addListener((oldConfig, newConfig) -> received.add(newConfig));

                writeConfig("models:\n  - id: model-a\n  - id: model-a\n    weight: 3\n");

                assertThatThrownBy(loader::load)
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("Duplicate model id 'model-a'");
                assertThat(loader.reload()).isSameAs(first);
                assertThat(received).isEmpty();
            }
        }

        @Test
        @DisplayName("should reject models the registry cannot describe")
        void shouldRejectUnknownCapability() throws IOException {
            Path file = writeConfig("models:\n  - id: model-a\n    capabilities: [telepathy]\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                assertThatThrownBy(loader::load)
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("telepathy");
                assertThat(loader.getCurrentConfig()).isNull();
            }
        }

        @Test
        @DisplayName("should reject an emptied section")
        void shouldRejectEmptySection() throws IOException {
            Path file = writeConfig("strategy:\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                assertThatThrownBy(loader::load)
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("'strategy'");
            }
        }

        @Test
        @DisplayName("should publish file changes while watching")
        void shouldPublishWatchedChanges() throws Exception {
            Path file = writeConfig("strategy:\n  type: random\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString(), Duration.ofMillis(50))) {
                loader.load();
                CountDownLatch published = new CountDownLatch(1);
                loader.addListener((oldConfig, newConfig) -> published.countDown());
                loader.startWatching();

                writeConfig("strategy:\n  type: weighted-round-robin\n");

                assertThat(published.await(5, TimeUnit.SECONDS)).isTrue();
                assertThat(loader.getCurrentConfig().getStrategy().getType()).isEqualTo("weighted-round-robin");
            }
        }

        @Test
        @DisplayName("should isolate failing listeners")
        void shouldIsolateFailingListeners() throws IOException {
            Path file = writeConfig("strategy:\n  type: random\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                List<RouterConfig> received = new ArrayList<>();
                loader.addListener((oldConfig, newConfig) -> {
                    throw new IllegalStateException("listener bug");
                });
                loader.addListener((oldConfig, newConfig) -> received.add(newConfig));

                RouterConfig loaded = loader.load();

                assertThat(received).containsExactly(loaded);
            }
        }
    }
}
