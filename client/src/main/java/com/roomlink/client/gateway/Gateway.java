package com.roomlink.client.gateway;

import lombok.ToString;
import lombok.Value;

import java.net.URI;

/**
 * Websocket endpoint and the one-time token the server expects in {@code login}.
 */
@Value
public class Gateway {
    URI endpoint;

    @ToString.Exclude
    String token;
}
