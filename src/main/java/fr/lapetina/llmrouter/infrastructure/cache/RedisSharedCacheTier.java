package fr.lapetina.llmrouter.infrastructure.cache;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.SetArgs;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Shared cache tier on Redis, through Lettuce's asynchronous API.
 * Keys are UTF-8 strings, values raw bytes.
 */
public final class RedisSharedCacheTier implements SharedCacheTier {

    private static final Logger log = LoggerFactory.getLogger(RedisSharedCacheTier.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, byte[]> connection;
    private final RedisAsyncCommands<String, byte[]> commands;

    RedisSharedCacheTier(RedisClient client, StatefulRedisConnection<String, byte[]> connection) {
        this.client = client;
        this.connection = connection;
        this.commands = connection.async();
    }

    /**
     * Connects to Redis.
     *
     * @param uri Redis URI, e.g. {@code redis://localhost:6379/0}
     * @param commandTimeout Timeout applied to every command
     */
    public static RedisSharedCacheTier connect(String uri, Duration commandTimeout) {
        RedisClient client = RedisClient.create(uri);
        client.setOptions(ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .keepAlive(true)
                        .build())
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(commandTimeout))
                .build());

        try {
            StatefulRedisConnection<String, byte[]> connection =
                    client.connect(RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE));
            log.info("Connected shared cache tier: uri={}, commandTimeout={}", uri, commandTimeout);
            return new RedisSharedCacheTier(client, connection);
        } catch (RuntimeException e) {
            client.shutdown();
            throw e;
        }
    }

    @Override
    public CompletableFuture<byte[]> get(String key) {
        return commands.get(key).toCompletableFuture();
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] payload, Duration ttl) {
        return commands.set(key, payload, SetArgs.Builder.px(ttl.toMillis()))
                .toCompletableFuture()
                .thenApply(reply -> null);
    }

    @Override
    public CompletableFuture<Void> remove(String key) {
        return commands.del(key)
                .toCompletableFuture()
                .thenApply(deleted -> null);
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Error closing Redis connection", e);
        }
        client.shutdown();
        log.info("Shared cache tier closed");
    }
}
