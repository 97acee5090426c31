package com.roomlink.client.auth;

import com.roomlink.core.error.AuthException;
import com.roomlink.core.error.AuthFailureReason;
import com.roomlink.core.msg.Commands;
import com.roomlink.core.msg.Message;
import com.roomlink.core.msg.Opcode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Login handshake: one {@code login} frame, then exactly one of {@code login_ok},
 * {@code login_failed}, {@code rate_limited} or {@code closed} within the auth timeout.
 * <p>
 * Never retries; the session decides what a failure means.
 * </p>
 */
public class AuthFlow {
    private static final Logger log = LoggerFactory.getLogger(AuthFlow.class);

    private static final Set<Opcode> REPLIES = EnumSet.of(
            Opcode.LOGIN_OK, Opcode.LOGIN_FAILED, Opcode.RATE_LIMITED, Opcode.CLOSED);

    private final Duration authTimeout;

    public AuthFlow(Duration authTimeout) {
        this.authTimeout = authTimeout;
    }

    public static boolean isAuthReply(Message message) {
        return REPLIES.contains(message.getOpcode());
    }

    /**
     * Runs the handshake.
     *
     * @param credentials nick and optional account
     * @param token       gateway token
     * @param sender      encodes and sends a command on the open transport
     * @param replies     inbound messages of the connection
     * @return Mono of the identity, or {@link AuthException}; transport failures pass through unchanged
     */
    public Mono<Identity> authenticate(Credentials credentials, String token,
                                       Consumer<Message> sender, Flux<Message> replies) {
        return Mono.defer(() -> {
            log.debug("Logging in as {} ({})", credentials.getNick(),
                    credentials.isGuest() ? "guest" : "account " + credentials.getAccount());
            sender.accept(Commands.login(token, credentials.getNick(),
                    credentials.getAccount(), credentials.getPassword()));

            return replies.filter(AuthFlow::isAuthReply)
                    .next()
                    .switchIfEmpty(Mono.error(() -> new AuthException(AuthFailureReason.PROTOCOL_ERROR,
                            "connection closed before a login reply")))
                    .timeout(authTimeout, Mono.error(() -> new AuthException(AuthFailureReason.TIMEOUT,
                            "no login reply within " + authTimeout.toMillis() + " ms")))
                    .flatMap(this::toIdentity);
        });
    }

    private Mono<Identity> toIdentity(Message reply) {
        return switch (reply.getOpcode()) {
            case LOGIN_OK -> {
                Identity identity = Identity.fromLoginOk(reply);
                log.info("Logged in as {} (handle {}, role {})", identity.getNick(), identity.getHandle(), identity.getRole());
                yield Mono.just(identity);
            }
            case LOGIN_FAILED -> Mono.error(new AuthException(
                    AuthFailureReason.fromWire(reply.text("reason")),
                    reply.has("text") ? reply.text("text") : "login rejected"));
            case RATE_LIMITED -> Mono.error(new AuthException(AuthFailureReason.RATE_LIMITED,
                    "retry after " + reply.intValue("retry_after", 0) + " s"));
            default -> Mono.error(new AuthException(AuthFailureReason.PROTOCOL_ERROR,
                    "server closed the connection during login, code " + reply.intValue("error", -1)));
        };
    }
}
