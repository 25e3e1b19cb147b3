/**
 * Configuration loading, hot-reload support and the configuration-backed model registry.
 *
 * <p>This package handles YAML configuration parsing and runtime configuration updates
 * without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.config.RouterConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.config.ModelRegistry} - Read-only model snapshots used for routing</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.config.ConfigModelRegistry} - Registry built from the {@code models} section</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Configuration changes are detected via file system watching. When the configuration file
 * is modified, registered listeners are notified and can update their state accordingly.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code models} - Routable models, capabilities, weights and TTL overrides</li>
 *   <li>{@code strategy} - Load balancing strategy selection</li>
 *   <li>{@code cache} - Key prefix, tier sizes and TTLs, shared tier connection</li>
 *   <li>{@code failover} - Retry against other candidates after a backend failure</li>
 *   <li>{@code metrics} - Metric prefix, sample window and health threshold</li>
 *   <li>{@code pool} - Idle eviction of backend handles</li>
 *   <li>{@code validation} - Request size limits</li>
 * </ul>
 *
 * @see fr.lapetina.llmrouter.infrastructure.config.RouterConfig
 * @see fr.lapetina.llmrouter.infrastructure.config.ConfigLoader
 */
package fr.lapetina.llmrouter.infrastructure.config;
