package fr.lapetina.llmrouter.infrastructure.config;

import fr.lapetina.llmrouter.domain.model.ModelCapability;
import fr.lapetina.llmrouter.domain.model.ModelDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Model registry fed by the {@code models} section of the configuration.
 * Replaced wholesale on every reload.
 */
public final class ConfigModelRegistry implements ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfigModelRegistry.class);

    private final AtomicReference<Map<String, ModelDescriptor>> models = new AtomicReference<>(Map.of());

    public ConfigModelRegistry(RouterConfig config) {
        replaceAll(toDescriptors(config));
    }

    public ConfigModelRegistry(Collection<ModelDescriptor> descriptors) {
        replaceAll(descriptors);
    }

    @Override
    public List<ModelDescriptor> snapshot() {
        return List.copyOf(models.get().values());
    }

    @Override
    public Optional<ModelDescriptor> find(String modelId) {
        return Optional.ofNullable(models.get().get(modelId));
    }

    public int size() {
        return models.get().size();
    }

    /**
     * Replaces the registry contents. Later duplicates of an id win.
     */
    public void replaceAll(Collection<ModelDescriptor> descriptors) {
        Map<String, ModelDescriptor> next = new LinkedHashMap<>();
        for (ModelDescriptor descriptor : descriptors) {
            next.put(descriptor.id(), descriptor);
        }
        Map<String, ModelDescriptor> previous = models.getAndSet(Collections.unmodifiableMap(next));

        for (String id : next.keySet()) {
            if (!previous.containsKey(id)) {
                log.info("Model registered: {}", next.get(id));
            } else if (!previous.get(id).equals(next.get(id))) {
                log.info("Model updated: {}", next.get(id));
            }
        }
        for (String id : previous.keySet()) {
            if (!next.containsKey(id)) {
                log.info("Model removed: {}", id);
            }
        }
    }

    /**
     * Converts the {@code models} section into descriptors.
     *
     * @throws ConfigLoader.ConfigurationException on a missing id or an unknown capability
     */
    public static List<ModelDescriptor> toDescriptors(RouterConfig config) {
        return config.getModels().stream()
                .map(ConfigModelRegistry::toDescriptor)
                .toList();
    }

    private static ModelDescriptor toDescriptor(RouterConfig.ModelConfig modelConfig) {
        if (modelConfig.getId() == null || modelConfig.getId().isBlank()) {
            throw new ConfigLoader.ConfigurationException("Model id is required");
        }
        return ModelDescriptor.builder()
                .id(modelConfig.getId())
                .capabilities(parseCapabilities(modelConfig.getId(), modelConfig.getCapabilities()))
                .modelType(modelConfig.getModelType())
                .weight(modelConfig.getWeight())
                .cacheTtl(modelConfig.getCacheTtlSeconds() != null
                        ? Duration.ofSeconds(modelConfig.getCacheTtlSeconds())
                        : null)
                .costPerThousandTokens(modelConfig.getCostPerThousandTokens())
                .enabled(modelConfig.isEnabled())
                .build();
    }

    private static Set<ModelCapability> parseCapabilities(String modelId, Set<String> names) {
        Set<ModelCapability> capabilities = EnumSet.noneOf(ModelCapability.class);
        if (names == null) {
            return capabilities;
        }
        for (String name : names) {
            try {
                capabilities.add(ModelCapability.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
            } catch (IllegalArgumentException e) {
                throw new ConfigLoader.ConfigurationException(
                        "Unknown capability '" + name + "' for model " + modelId, e);
            }
        }
        return capabilities;
    }
}
