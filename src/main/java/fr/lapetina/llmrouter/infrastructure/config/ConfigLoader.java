package fr.lapetina.llmrouter.infrastructure.config;

import fr.lapetina.llmrouter.domain.model.ModelDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Loads the router configuration and republishes it when its file changes.
 *
 * <p>A document is checked before it is published: every section must be present,
 * every model must convert to a {@link ModelDescriptor} and model ids must be unique.
 * A rejected document, or one whose text did not change, leaves the published
 * configuration in place. Listeners therefore only see configurations the router can
 * apply as a whole, and publications never overlap.
 *
 * <p>The location is read from the file system first, then from the classpath. Only a
 * file can be watched: a daemon task polls it and publishes its content when it differs
 * from the last published or rejected text.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    private final String location;
    private final Path configPath;
    private final Duration pollInterval;
    private final Yaml yaml;
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Object publishLock = new Object();

    private volatile RouterConfig currentConfig;
    private volatile String publishedContent;
    private volatile String rejectedContent;
    private ScheduledExecutorService poller;

    public ConfigLoader(String location) {
        this(location, DEFAULT_POLL_INTERVAL);
    }

    public ConfigLoader(String location, Duration pollInterval) {
        this.location = Objects.requireNonNull(location, "Configuration location is required");
        this.configPath = Paths.get(location);
        this.pollInterval = Objects.requireNonNull(pollInterval, "Poll interval is required");
        this.yaml = new Yaml(new Constructor(RouterConfig.class, new LoaderOptions()));
    }

    /**
     * Reads and publishes the configuration.
     *
     * @return The published configuration, the current one if the text is unchanged
     * @throws ConfigurationException if the document is missing, malformed or rejected
     */
    public RouterConfig load() {
        return publish(read());
    }

    /**
     * Publishes a configuration read from a stream.
     */
    public RouterConfig loadFromStream(InputStream inputStream) {
        try {
            return publish(new ConfigDocument(
                    new String(inputStream.readAllBytes(), StandardCharsets.UTF_8), "stream"));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration stream", e);
        }
    }

    /**
     * Loads the configuration again, keeping the current one if the new document is rejected.
     */
    public RouterConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration rejected, keeping current: location={}", location, e);
            return currentConfig;
        }
    }

    public RouterConfig getCurrentConfig() {
        return currentConfig;
    }

    /**
     * Starts polling the configuration file. Classpath configurations are not watched.
     */
    public synchronized void startWatching() {
        if (poller != null) {
            return;
        }
        if (!Files.isRegularFile(configPath)) {
            log.warn("Configuration is not a file, hot reload disabled: {}", location);
            return;
        }

        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-poller");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(1, pollInterval.toMillis());
        poller.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Configuration hot reload enabled: file={}, interval={}", configPath, pollInterval);
    }

    private void poll() {
        try {
            ConfigDocument document = read();
            if (document.content().equals(publishedContent) || document.content().equals(rejectedContent)) {
                return;
            }
            log.info("Configuration file changed, publishing: {}", configPath);
            publish(document);
        } catch (ConfigurationException e) {
            log.error("Configuration change rejected, keeping current: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Configuration poll failed: file={}", configPath, e);
        }
    }

    private RouterConfig publish(ConfigDocument document) {
        synchronized (publishLock) {
            if (currentConfig != null && document.content().equals(publishedContent)) {
                log.debug("Configuration unchanged: {}", document.origin());
                return currentConfig;
            }

            RouterConfig config;
            List<ModelDescriptor> descriptors;
            try {
                config = parse(document);
                descriptors = check(config, document.origin());
            } catch (ConfigurationException e) {
                rejectedContent = document.content();
                throw e;
            }

            RouterConfig previous = currentConfig;
            currentConfig = config;
            publishedContent = document.content();
            rejectedContent = null;
            log.info("Configuration published: origin={}, models={}, strategy={}",
                    document.origin(), descriptors.size(), config.getStrategy().getType());
            notifyListeners(previous, config);
            return config;
        }
    }

    private ConfigDocument read() {
        if (Files.isRegularFile(configPath)) {
            try {
                return new ConfigDocument(Files.readString(configPath, StandardCharsets.UTF_8), configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration from: " + configPath, e);
            }
        }

        String resource = location.replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Configuration file not found: " + location);
            }
            return new ConfigDocument(new String(is.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration from classpath: " + resource, e);
        }
    }

    private RouterConfig parse(ConfigDocument document) {
        try {
            RouterConfig config = yaml.load(document.content());
            // An empty document yields null
            return config != null ? config : new RouterConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + document.origin(), e);
        }
    }

    private static List<ModelDescriptor> check(RouterConfig config, String origin) {
        requireSection(config.getModels(), "models", origin);
        requireSection(config.getStrategy(), "strategy", origin);
        requireSection(config.getCache(), "cache", origin);
        requireSection(config.getFailover(), "failover", origin);
        requireSection(config.getMetrics(), "metrics", origin);
        requireSection(config.getPool(), "pool", origin);
        requireSection(config.getValidation(), "validation", origin);

        String strategyType = config.getStrategy().getType();
        if (strategyType == null || strategyType.isBlank()) {
            throw new ConfigurationException("Strategy type is required in " + origin);
        }

        List<ModelDescriptor> descriptors = ConfigModelRegistry.toDescriptors(config);
        Set<String> ids = new HashSet<>();
        for (ModelDescriptor descriptor : descriptors) {
            if (!ids.add(descriptor.id())) {
                throw new ConfigurationException("Duplicate model id '" + descriptor.id() + "' in " + origin);
            }
        }
        return descriptors;
    }

    private static void requireSection(Object section, String name, String origin) {
        if (section == null) {
            throw new ConfigurationException("Section '" + name + "' must not be empty in " + origin);
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RouterConfig oldConfig, RouterConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (poller == null) {
            return;
        }
        poller.shutdown();
        try {
            poller.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        poller = null;
    }

    private record ConfigDocument(String content, String origin) {
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
