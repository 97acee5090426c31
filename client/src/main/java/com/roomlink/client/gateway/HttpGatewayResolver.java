package com.roomlink.client.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.roomlink.core.error.ConnectFailedException;
import com.roomlink.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Requests the websocket endpoint and login token from the service's HTTP API:
 * {@code GET {apiBaseUrl}/room/token/{room}} answering {@code {"result": token, "endpoint": url}}.
 */
public class HttpGatewayResolver implements IGatewayResolver {
    private static final Logger log = LoggerFactory.getLogger(HttpGatewayResolver.class);

    private final HttpClient httpClient;
    private final String apiBaseUrl;
    private final Duration timeout;

    public HttpGatewayResolver(String apiBaseUrl, String userAgent, Duration timeout) {
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.create()
                .responseTimeout(timeout)
                .headers(headers -> headers.set("User-Agent", userAgent).set("Accept", "application/json"));
    }

    @Override
    public Mono<Gateway> resolve(String room) {
        String url = apiBaseUrl + "/room/token/" + URLEncoder.encode(room, StandardCharsets.UTF_8);
        log.info("Requesting gateway for room {}", room);

        return httpClient.get()
                .uri(url)
                .responseSingle((response, body) -> {
                    int status = response.status().code();
                    if (status != 200) {
                        return Mono.error(new ConnectFailedException("Gateway lookup " + url + " answered HTTP " + status));
                    }
                    return body.asString(StandardCharsets.UTF_8);
                })
                .map(HttpGatewayResolver::parse)
                .switchIfEmpty(Mono.error(() -> new ConnectFailedException("Gateway lookup " + url + " returned no body")))
                .timeout(timeout)
                .doOnNext(gateway -> log.debug("Gateway for {}: {}", room, gateway.getEndpoint()))
                .onErrorMap(e -> !(e instanceof ConnectFailedException),
                        e -> new ConnectFailedException("Gateway lookup for room " + room + " failed", e));
    }

    static Gateway parse(String json) {
        JsonNode tree;
        try {
            tree = JsonUtils.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConnectFailedException("Gateway answer is not JSON", e);
        }
        String token = tree.path("result").asText("");
        String endpoint = tree.path("endpoint").asText("");
        if (token.isEmpty() || endpoint.isEmpty()) {
            throw new ConnectFailedException("Gateway answer lacks token or endpoint: " + json);
        }
        try {
            return new Gateway(URI.create(endpoint), token);
        } catch (IllegalArgumentException e) {
            throw new ConnectFailedException("Gateway endpoint is not a URI: " + endpoint, e);
        }
    }
}
