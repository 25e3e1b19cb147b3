package fr.lapetina.llmrouter.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Registry entry describing one routable model.
 * Immutable; a configuration reload produces new descriptors.
 *
 * @param id unique model identifier
 * @param capabilities capabilities advertised by the model
 * @param modelType free-form type used to look up per-type cache TTLs, may be null
 * @param weight relative share for weighted strategies, at least 1
 * @param cacheTtl cache TTL override for responses of this model, may be null
 * @param costPerThousandTokens declared cost, may be null when unknown
 * @param enabled disabled models are never routed to
 */
public record ModelDescriptor(
        String id,
        Set<ModelCapability> capabilities,
        String modelType,
        int weight,
        Duration cacheTtl,
        BigDecimal costPerThousandTokens,
        boolean enabled
) {
    public ModelDescriptor {
        Objects.requireNonNull(id, "Model ID is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Model ID must not be blank");
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
        weight = Math.max(1, weight);
    }

    /**
     * Returns true if this model advertises every given capability.
     */
    public boolean supports(Set<ModelCapability> required) {
        return capabilities.containsAll(required);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private final Set<ModelCapability> capabilities = new HashSet<>();
        private String modelType;
        private int weight = 1;
        private Duration cacheTtl;
        private BigDecimal costPerThousandTokens;
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder capabilities(Set<ModelCapability> capabilities) {
            this.capabilities.clear();
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder addCapability(ModelCapability capability) {
            this.capabilities.add(capability);
            return this;
        }

        public Builder modelType(String modelType) {
            this.modelType = modelType;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder costPerThousandTokens(BigDecimal costPerThousandTokens) {
            this.costPerThousandTokens = costPerThousandTokens;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ModelDescriptor build() {
            return new ModelDescriptor(
                    id, capabilities, modelType, weight, cacheTtl, costPerThousandTokens, enabled
            );
        }
    }
}
