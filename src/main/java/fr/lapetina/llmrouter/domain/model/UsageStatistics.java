package fr.lapetina.llmrouter.domain.model;

import java.math.BigDecimal;

/**
 * Token usage and cost reported by a backend for one invocation.
 */
public record UsageStatistics(
        int inputTokens,
        int outputTokens,
        BigDecimal cost,
        String currency
) {
    public UsageStatistics {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("Token counts must be non-negative");
        }
        if (cost == null) {
            cost = BigDecimal.ZERO;
        }
        if (currency == null) {
            currency = "USD";
        }
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }

    public static UsageStatistics of(int inputTokens, int outputTokens) {
        return new UsageStatistics(inputTokens, outputTokens, BigDecimal.ZERO, "USD");
    }

    public static UsageStatistics empty() {
        return of(0, 0);
    }
}
