package fr.lapetina.llmrouter.infrastructure.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the router.
 * Designed to be populated from YAML.
 */
public class RouterConfig {

    private List<ModelConfig> models = new ArrayList<>();
    private StrategyConfig strategy = new StrategyConfig();
    private CacheConfig cache = new CacheConfig();
    private FailoverConfig failover = new FailoverConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private PoolConfig pool = new PoolConfig();
    private ValidationConfig validation = new ValidationConfig();

    // Getters and Setters
    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public FailoverConfig getFailover() { return failover; }
    public void setFailover(FailoverConfig failover) { this.failover = failover; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    /**
     * Individual model configuration.
     */
    public static class ModelConfig {
        private String id;
        private Set<String> capabilities = new LinkedHashSet<>();
        private String modelType;
        private int weight = 1;
        private Long cacheTtlSeconds;
        private BigDecimal costPerThousandTokens;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public Set<String> getCapabilities() { return capabilities; }
        public void setCapabilities(Set<String> capabilities) { this.capabilities = capabilities; }

        public String getModelType() { return modelType; }
        public void setModelType(String modelType) { this.modelType = modelType; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public Long getCacheTtlSeconds() { return cacheTtlSeconds; }
        public void setCacheTtlSeconds(Long cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }

        public BigDecimal getCostPerThousandTokens() { return costPerThousandTokens; }
        public void setCostPerThousandTokens(BigDecimal cost) { this.costPerThousandTokens = cost; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Load balancing strategy configuration.
     */
    public static class StrategyConfig {
        private String type = "round-robin";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private String keyPrefix = "llm:";
        private long localMaxEntries = 10000;
        private long localTtlSeconds = 3600;
        private long sharedTtlSeconds = 86400;
        private long defaultTtlSeconds = 1800;
        // Values may arrive as Integer from YAML, read them as Number
        private Map<String, Long> modelTypeTtlSeconds = new HashMap<>();
        private SharedTierConfig shared = new SharedTierConfig();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

        public long getLocalMaxEntries() { return localMaxEntries; }
        public void setLocalMaxEntries(long localMaxEntries) { this.localMaxEntries = localMaxEntries; }

        public long getLocalTtlSeconds() { return localTtlSeconds; }
        public void setLocalTtlSeconds(long localTtlSeconds) { this.localTtlSeconds = localTtlSeconds; }

        public long getSharedTtlSeconds() { return sharedTtlSeconds; }
        public void setSharedTtlSeconds(long sharedTtlSeconds) { this.sharedTtlSeconds = sharedTtlSeconds; }

        public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
        public void setDefaultTtlSeconds(long defaultTtlSeconds) { this.defaultTtlSeconds = defaultTtlSeconds; }

        public Map<String, Long> getModelTypeTtlSeconds() { return modelTypeTtlSeconds; }
        public void setModelTypeTtlSeconds(Map<String, Long> modelTypeTtlSeconds) { this.modelTypeTtlSeconds = modelTypeTtlSeconds; }

        public SharedTierConfig getShared() { return shared; }
        public void setShared(SharedTierConfig shared) { this.shared = shared; }
    }

    /**
     * Shared (Redis) cache tier configuration.
     */
    public static class SharedTierConfig {
        private boolean enabled = false;
        private String uri = "redis://localhost:6379";
        private long commandTimeoutMs = 2000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getUri() { return uri; }
        public void setUri(String uri) { this.uri = uri; }

        public long getCommandTimeoutMs() { return commandTimeoutMs; }
        public void setCommandTimeoutMs(long commandTimeoutMs) { this.commandTimeoutMs = commandTimeoutMs; }
    }

    /**
     * Failover configuration.
     */
    public static class FailoverConfig {
        private boolean enabled = true;
        private int maxRetries = 1;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_router";
        private int sampleWindowSize = 1000;
        private double unhealthyErrorRate = 0.10;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public int getSampleWindowSize() { return sampleWindowSize; }
        public void setSampleWindowSize(int sampleWindowSize) { this.sampleWindowSize = sampleWindowSize; }

        public double getUnhealthyErrorRate() { return unhealthyErrorRate; }
        public void setUnhealthyErrorRate(double unhealthyErrorRate) { this.unhealthyErrorRate = unhealthyErrorRate; }
    }

    /**
     * Backend handle pool configuration.
     */
    public static class PoolConfig {
        private long idleTimeoutSeconds = 1800;
        private long cleanupIntervalSeconds = 300;

        public long getIdleTimeoutSeconds() { return idleTimeoutSeconds; }
        public void setIdleTimeoutSeconds(long idleTimeoutSeconds) { this.idleTimeoutSeconds = idleTimeoutSeconds; }

        public long getCleanupIntervalSeconds() { return cleanupIntervalSeconds; }
        public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) { this.cleanupIntervalSeconds = cleanupIntervalSeconds; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxPromptLength = 100000;

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }
    }
}
