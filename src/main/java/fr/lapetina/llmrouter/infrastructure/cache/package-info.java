/**
 * Two-tier response caching.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.cache.CacheKeyBuilder} - Deterministic request fingerprints</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.cache.ResponseCache} - Local Caffeine tier over an optional shared tier</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.cache.SharedCacheTier} - Remote store contract, Redis by default</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.cache.CacheSerializer} - Payload encoding, compact JSON by default</li>
 * </ul>
 *
 * <h2>Failure Policy</h2>
 * <p>Caching never fails a request. Lookups return a {@link fr.lapetina.llmrouter.infrastructure.cache.CacheResult}
 * whose outcome separates a plain miss from a broken tier; writes and deletes log and move on.
 */
package fr.lapetina.llmrouter.infrastructure.cache;
