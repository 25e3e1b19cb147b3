package fr.lapetina.llmrouter;

import fr.lapetina.llmrouter.domain.model.HealthSnapshot;
import fr.lapetina.llmrouter.domain.model.ModelDescriptor;
import fr.lapetina.llmrouter.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.llmrouter.domain.strategy.RoundRobinStrategy;
import fr.lapetina.llmrouter.domain.strategy.StrategyFactory;
import fr.lapetina.llmrouter.infrastructure.cache.RedisSharedCacheTier;
import fr.lapetina.llmrouter.infrastructure.cache.ResponseCache;
import fr.lapetina.llmrouter.infrastructure.cache.SharedCacheTier;
import fr.lapetina.llmrouter.infrastructure.config.ConfigLoader;
import fr.lapetina.llmrouter.infrastructure.config.ConfigModelRegistry;
import fr.lapetina.llmrouter.infrastructure.config.RouterConfig;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsCollector;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrouter.infrastructure.pool.InstancePool;
import fr.lapetina.llmrouter.infrastructure.pool.ModelBackendFactory;
import fr.lapetina.llmrouter.router.RequestRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Factory for creating a fully-wired router from configuration.
 * This is the primary entry point for obtaining a configured RequestRouter.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RouterFactory factory = RouterFactory.create("config.yaml", backendFactory).start()) {
 *     RequestRouter router = factory.getRouter();
 *     // use router...
 * }
 * }</pre>
 */
public class RouterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterFactory.class);

    private final ConfigLoader configLoader;
    private final RouterConfig config;
    private final MetricsRegistry metricsRegistry;
    private final MetricsCollector metricsCollector;
    private final ConfigModelRegistry modelRegistry;
    private final StrategyFactory<String> strategyFactory;
    private final ResponseCache responseCache;
    private final InstancePool instancePool;
    private final RequestRouter router;

    protected RouterFactory(String configPath, ModelBackendFactory backendFactory, SharedCacheTier sharedTierOverride) {
        log.info("Initializing RouterFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        RouterConfig.MetricsConfig metricsConfig = config.getMetrics();
        this.metricsRegistry = metricsConfig.isEnabled()
                ? new MetricsRegistry(metricsConfig.getPrefix())
                : new MetricsRegistry(metricsConfig.getPrefix(), new SimpleMeterRegistry());
        this.metricsCollector = new MetricsCollector(
                metricsRegistry,
                metricsConfig.getSampleWindowSize(),
                metricsConfig.getUnhealthyErrorRate());

        // Initialize model registry
        this.modelRegistry = new ConfigModelRegistry(config);

        // Initialize cache (allow shared tier override for testing)
        this.responseCache = createResponseCache(sharedTierOverride);

        // Initialize instance pool
        this.instancePool = new InstancePool(
                modelRegistry,
                backendFactory,
                null,
                Duration.ofSeconds(config.getPool().getIdleTimeoutSeconds()),
                Duration.ofSeconds(config.getPool().getCleanupIntervalSeconds()));

        // Create strategy
        this.strategyFactory = StrategyFactory.withBuiltIns();
        LoadBalancingStrategy<String> strategy = strategyFactory.createOrDefault(
                config.getStrategy().getType(),
                new RoundRobinStrategy<>());
        log.info("Using load balancing strategy: {}", strategy.getName());

        // Build router
        this.router = RequestRouter.builder()
                .fromConfig(config)
                .modelRegistry(modelRegistry)
                .instancePool(instancePool)
                .responseCache(responseCache)
                .metricsCollector(metricsCollector)
                .strategy(strategy)
                .build();
        router.applyWeights(modelRegistry.snapshot());

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        // Register model metrics
        registerModelMetrics(modelRegistry.snapshot());

        log.info("RouterFactory initialized with {} models", modelRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static RouterFactory create(String configPath, ModelBackendFactory backendFactory) {
        return new RouterFactory(configPath, backendFactory, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static RouterFactory create(ModelBackendFactory backendFactory) {
        return create("config.yaml", backendFactory);
    }

    /**
     * Starts idle handle eviction and configuration watching.
     */
    public RouterFactory start() {
        instancePool.start();
        configLoader.startWatching();
        log.info("Router started");
        return this;
    }

    public RequestRouter getRouter() {
        return router;
    }

    public ConfigModelRegistry getModelRegistry() {
        return modelRegistry;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    public ResponseCache getResponseCache() {
        return responseCache;
    }

    public InstancePool getInstancePool() {
        return instancePool;
    }

    public RouterConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private ResponseCache createResponseCache(SharedCacheTier sharedTierOverride) {
        RouterConfig.CacheConfig cacheConfig = config.getCache();
        SharedCacheTier sharedTier = sharedTierOverride;
        if (sharedTier == null && cacheConfig.isEnabled() && cacheConfig.getShared().isEnabled()) {
            try {
                sharedTier = RedisSharedCacheTier.connect(
                        cacheConfig.getShared().getUri(),
                        Duration.ofMillis(cacheConfig.getShared().getCommandTimeoutMs()));
            } catch (RuntimeException e) {
                log.warn("Shared cache tier unavailable, caching locally only: uri={}, error={}",
                        cacheConfig.getShared().getUri(), e.toString());
            }
        }
        return ResponseCache.builder()
                .sharedTier(sharedTier)
                .maxLocalEntries(cacheConfig.getLocalMaxEntries())
                .localTtl(Duration.ofSeconds(cacheConfig.getLocalTtlSeconds()))
                .sharedTtl(Duration.ofSeconds(cacheConfig.getSharedTtlSeconds()))
                .build();
    }

    private void registerModelMetrics(List<ModelDescriptor> descriptors) {
        for (ModelDescriptor descriptor : descriptors) {
            String modelId = descriptor.id();
            metricsRegistry.registerModelHealth(modelId, () -> {
                HealthSnapshot health = metricsCollector.getHealth(modelId);
                return switch (health.status()) {
                    case HEALTHY -> 2;
                    case UNKNOWN -> 1;
                    case UNHEALTHY -> 0;
                };
            });
        }
    }

    private void onConfigChanged(RouterConfig oldConfig, RouterConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        // Reload models
        List<ModelDescriptor> descriptors = ConfigModelRegistry.toDescriptors(newConfig);
        modelRegistry.replaceAll(descriptors);
        int disposed = instancePool.reconcile(descriptors);
        if (disposed > 0) {
            log.info("Disposed {} stale model handles", disposed);
        }
        registerModelMetrics(descriptors);

        // Update strategy if changed
        if (oldConfig == null ||
                !oldConfig.getStrategy().getType().equals(newConfig.getStrategy().getType())) {
            LoadBalancingStrategy<String> newStrategy = strategyFactory.createOrDefault(
                    newConfig.getStrategy().getType(),
                    router.getStrategy()
            );
            if (newStrategy != router.getStrategy()) {
                router.setStrategy(newStrategy);
            }
        }
        router.applyWeights(descriptors);

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down RouterFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            instancePool.close();
        } catch (Exception e) {
            log.warn("Error closing instance pool", e);
        }

        try {
            responseCache.close();
        } catch (Exception e) {
            log.warn("Error closing response cache", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("RouterFactory shut down");
    }
}
