package com.roomlink.client.config;

import com.roomlink.core.msg.MessageCodec;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.util.function.Function;

/**
 * Session options. Every field has a default, so {@code ClientConfig.builder().build()} is usable.
 */
@Value
@Builder(toBuilder = true)
public class ClientConfig {

    @Builder.Default
    boolean reconnect = true;
    @Builder.Default
    int maxReconnectAttempts = 5;
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration authTimeout = Duration.ofSeconds(15);

    @Builder.Default
    Duration backoffBase = Duration.ofSeconds(1);
    @Builder.Default
    Duration backoffMax = Duration.ofSeconds(30);
    @Builder.Default
    Duration backoffJitter = Duration.ofSeconds(1);

    /**
     * Write inactivity after which a websocket ping is sent.
     */
    @Builder.Default
    Duration pingInterval = Duration.ofSeconds(10);
    /**
     * Read inactivity (no frame, no pong) after which the connection is considered dead.
     */
    @Builder.Default
    Duration idleTimeout = Duration.ofSeconds(30);

    @Builder.Default
    int maxFrameBytes = MessageCodec.DEFAULT_MAX_FRAME_BYTES;
    @Builder.Default
    int maxTextLength = MessageCodec.DEFAULT_MAX_TEXT_LENGTH;

    /**
     * Fixed websocket endpoint. When null the endpoint and token are looked up at {@link #apiBaseUrl}.
     */
    String gatewayUrl;
    /**
     * Token sent with {@code login} when {@link #gatewayUrl} is used.
     */
    String gatewayToken;
    @Builder.Default
    String apiBaseUrl = "https://tinychat.com/api/v1.0";

    @Builder.Default
    String origin = "https://tinychat.com";
    @Builder.Default
    String userAgent = "roomlink-java/1.0";

    /**
     * Answer for a password-protected room, sent automatically when the server asks.
     */
    @ToString.Exclude
    String roomPassword;

    public static ClientConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Reads {@code ROOMLINK_*} variables through {@code env}; absent variables keep the defaults.
     */
    public static ClientConfig fromEnv(Function<String, String> env) {
        ClientConfig defaults = ClientConfig.builder().build();
        return defaults.toBuilder()
                .reconnect(Boolean.parseBoolean(getEnv("ROOMLINK_RECONNECT", String.valueOf(defaults.isReconnect()), env)))
                .maxReconnectAttempts(Integer.parseInt(getEnv("ROOMLINK_MAX_RECONNECT_ATTEMPTS",
                        String.valueOf(defaults.getMaxReconnectAttempts()), env)))
                .connectTimeout(Duration.ofMillis(Long.parseLong(getEnv("ROOMLINK_CONNECT_TIMEOUT_MS",
                        String.valueOf(defaults.getConnectTimeout().toMillis()), env))))
                .authTimeout(Duration.ofMillis(Long.parseLong(getEnv("ROOMLINK_AUTH_TIMEOUT_MS",
                        String.valueOf(defaults.getAuthTimeout().toMillis()), env))))
                .pingInterval(Duration.ofSeconds(Long.parseLong(getEnv("ROOMLINK_PING_INTERVAL_SEC",
                        String.valueOf(defaults.getPingInterval().toSeconds()), env))))
                .idleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("ROOMLINK_IDLE_TIMEOUT_SEC",
                        String.valueOf(defaults.getIdleTimeout().toSeconds()), env))))
                .gatewayUrl(env.apply("ROOMLINK_GATEWAY_URL"))
                .gatewayToken(env.apply("ROOMLINK_GATEWAY_TOKEN"))
                .apiBaseUrl(getEnv("ROOMLINK_API_BASE_URL", defaults.getApiBaseUrl(), env))
                .build();
    }

    private static String getEnv(String key, String defaultValue, Function<String, String> env) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }
}
