package com.roomlink.client.gateway;

import reactor.core.publisher.Mono;

/**
 * Looks up where and with which token a room session connects.
 */
public interface IGatewayResolver {
    /**
     * @param room room name
     * @return Mono of the gateway, or {@link com.roomlink.core.error.ConnectFailedException}
     */
    Mono<Gateway> resolve(String room);
}
