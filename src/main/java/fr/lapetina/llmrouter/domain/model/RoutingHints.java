package fr.lapetina.llmrouter.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Optional constraints narrowing the models a request may be routed to.
 *
 * @param requiredCapabilities capabilities every candidate must advertise
 * @param maxCostPerThousandTokens ceiling on the model's declared cost, or null
 * @param maxAverageLatency ceiling on the model's observed average latency, or null
 */
public record RoutingHints(
        Set<ModelCapability> requiredCapabilities,
        BigDecimal maxCostPerThousandTokens,
        Duration maxAverageLatency
) {
    private static final RoutingHints NONE = new RoutingHints(Set.of(), null, null);

    public RoutingHints {
        requiredCapabilities = requiredCapabilities == null || requiredCapabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(requiredCapabilities));
    }

    public static RoutingHints none() {
        return NONE;
    }

    public static RoutingHints requiring(ModelCapability... capabilities) {
        return new RoutingHints(Set.copyOf(Arrays.asList(capabilities)), null, null);
    }

    public boolean isEmpty() {
        return requiredCapabilities.isEmpty()
                && maxCostPerThousandTokens == null
                && maxAverageLatency == null;
    }
}
