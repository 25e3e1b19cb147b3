package fr.lapetina.llmrouter.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmrouter.domain.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Derives the response-cache key of a request.
 *
 * <p>Key layout:
 * <pre>
 * prefix + modelId + ":" + h(systemPrompt) + ":" + h(userPrompt) [+ ":" + h(history)] [+ ":" + h(settings)]
 * </pre>
 * where {@code h} is the first 16 hex characters of a SHA-256 digest and an absent
 * prompt hashes to the empty string. History and settings segments are only present
 * when the request carries them; their digests are domain-separated so one can never
 * stand in for the other.
 *
 * <p>Truncating to 64 bits keeps keys short at the price of a small collision
 * probability, which is accepted.
 *
 * <p>Building a key never throws. When the settings cannot be fingerprinted the
 * builder returns a unique {@code prefix + "fallback:" + uuid} key, so the request
 * simply misses the cache.
 */
public final class CacheKeyBuilder {

    private static final Logger log = LoggerFactory.getLogger(CacheKeyBuilder.class);

    public static final String DEFAULT_PREFIX = "llm:";
    static final int HASH_LENGTH = 16;

    private static final String HISTORY_DOMAIN = "history\n";
    private static final String SETTINGS_DOMAIN = "settings\n";

    private final String prefix;
    private final ObjectMapper objectMapper;
    private final int hashLength;

    public CacheKeyBuilder(String prefix, ObjectMapper objectMapper) {
        this(prefix, objectMapper, HASH_LENGTH);
    }

    /**
     * @param hashLength Hex characters kept from each digest, between 1 and 64
     */
    CacheKeyBuilder(String prefix, ObjectMapper objectMapper, int hashLength) {
        if (hashLength < 1 || hashLength > 64) {
            throw new IllegalArgumentException("Hash length must be between 1 and 64: " + hashLength);
        }
        this.prefix = prefix != null ? prefix : DEFAULT_PREFIX;
        this.objectMapper = objectMapper;
        this.hashLength = hashLength;
    }

    public CacheKeyBuilder(String prefix) {
        this(prefix, JsonCacheSerializer.defaultObjectMapper());
    }

    public CacheKeyBuilder() {
        this(DEFAULT_PREFIX);
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Builds the cache key of a request.
     */
    public String build(GenerationRequest request) {
        try {
            StringBuilder key = new StringBuilder(prefix)
                    .append(request.modelId())
                    .append(':').append(hash(request.systemPrompt(), hashLength))
                    .append(':').append(hash(request.userPrompt(), hashLength));

            if (!request.history().isEmpty()) {
                key.append(':').append(hash(HISTORY_DOMAIN + joinHistory(request.history()), hashLength));
            }
            if (!request.executionSettings().isEmpty()) {
                String settingsJson = objectMapper.writeValueAsString(request.executionSettings());
                key.append(':').append(hash(SETTINGS_DOMAIN + settingsJson, hashLength));
            }
            return key.toString();
        } catch (Exception e) {
            String fallback = prefix + "fallback:" + UUID.randomUUID();
            log.error("Cache key generation failed, using unique key: model={}, key={}",
                    request.modelId(), fallback, e);
            return fallback;
        }
    }

    /**
     * Returns true if the key was generated as a fallback and will never hit.
     */
    public boolean isFallback(String key) {
        return key.startsWith(prefix + "fallback:");
    }

    /**
     * Hashes a string to the first 16 uppercase hex characters of its SHA-256 digest.
     * Null and empty input hash to the empty string.
     */
    static String hash16(String input) {
        return hash(input, HASH_LENGTH);
    }

    private static String hash(String input, int length) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().withUpperCase().formatHex(hash).substring(0, length);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // Length-prefixed so separators inside roles or contents cannot shift boundaries
    private static String joinHistory(List<GenerationRequest.ChatMessage> history) {
        StringBuilder joined = new StringBuilder();
        for (GenerationRequest.ChatMessage message : history) {
            appendField(joined, message.role());
            appendField(joined, message.content());
        }
        return joined.toString();
    }

    private static void appendField(StringBuilder target, String value) {
        String safe = value != null ? value : "";
        target.append(safe.length()).append(':').append(safe).append('|');
    }
}
