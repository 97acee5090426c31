package com.roomlink.client.gateway;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Gateway fixed by configuration.
 */
@RequiredArgsConstructor
public class StaticGatewayResolver implements IGatewayResolver {
    private final URI endpoint;
    private final String token;

    @Override
    public Mono<Gateway> resolve(String room) {
        return Mono.just(new Gateway(endpoint, token == null ? "" : token));
    }
}
