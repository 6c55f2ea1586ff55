package com.tikrai.mailsink.live;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tikrai.mailsink.model.MailEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * {@code GET /ws?email=<identity>}: registers the socket as the live connection for that
 * identity until either side closes it.
 */
public class SubscriptionWebSocketHandler implements WebSocketHandler {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionWebSocketHandler.class);

  static final String IDENTITY_PARAM = "email";

  private final SubscriptionRegistry registry;
  private final ObjectMapper objectMapper;

  public SubscriptionWebSocketHandler(SubscriptionRegistry registry, ObjectMapper objectMapper) {
    this.registry = registry;
    this.objectMapper = objectMapper;
  }

  @Override
  public Mono<Void> handle(WebSocketSession session) {
    String identity = identityOf(session);
    log.info("WS NEW CONNECTION - id: {}, identity: {}, RemoteAddress: {}",
        session.getId(), identity, session.getHandshakeInfo().getRemoteAddress());

    WebSocketLiveConnection connection = new WebSocketLiveConnection(session, objectMapper);
    SubscribeOutcome outcome = registry.subscribe(identity, connection);
    if (!outcome.accepted()) {
      return reject(session, outcome);
    }

    Mono<Void> outbound = session.send(connection.outbound());
    Mono<Void> inbound = session.receive()
        .doOnNext(msg -> log.debug("WS {} ignoring inbound {} frame", session.getId(), msg.getType()))
        .then()
        .then(Mono.defer(connection::close));

    return Mono.when(outbound, inbound)
        .doOnError(e -> log.warn("WS {} ({}) failed: {}", session.getId(), identity, e.getMessage()))
        .doFinally(signal -> {
          registry.unsubscribe(identity, connection);
          log.info("WS CLOSED - id: {}, identity: {}, signal: {}", session.getId(), identity, signal);
        });
  }

  private Mono<Void> reject(WebSocketSession session, SubscribeOutcome outcome) {
    return Mono.fromCallable(() -> objectMapper.writeValueAsString(MailEvent.error(outcome.reason())))
        .flatMap(json -> session.send(Mono.just(session.textMessage(json))))
        .then(Mono.defer(session::close));
  }

  private static String identityOf(WebSocketSession session) {
    String raw = UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
        .build()
        .getQueryParams()
        .getFirst(IDENTITY_PARAM);
    return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
  }
}
