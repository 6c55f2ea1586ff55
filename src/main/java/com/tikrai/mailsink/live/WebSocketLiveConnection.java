package com.tikrai.mailsink.live;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tikrai.mailsink.model.MailEvent;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link LiveConnection} over a WebFlux {@link WebSocketSession}. Events are encoded as JSON
 * text frames and buffered until the session's send loop picks them up.
 */
class WebSocketLiveConnection implements LiveConnection {

  private final WebSocketSession session;
  private final ObjectMapper objectMapper;
  private final Sinks.Many<String> frames = Sinks.many().unicast().onBackpressureBuffer();
  private final AtomicBoolean closed = new AtomicBoolean();

  WebSocketLiveConnection(WebSocketSession session, ObjectMapper objectMapper) {
    this.session = session;
    this.objectMapper = objectMapper;
  }

  /** Frames to hand to {@link WebSocketSession#send}; completes when the connection closes. */
  Flux<WebSocketMessage> outbound() {
    return frames.asFlux().map(session::textMessage);
  }

  @Override
  public Mono<Void> send(MailEvent event) {
    return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
        .flatMap(json -> {
          Sinks.EmitResult result;
          synchronized (frames) {
            result = closed.get() ? Sinks.EmitResult.FAIL_TERMINATED : frames.tryEmitNext(json);
          }
          if (result.isFailure()) {
            return Mono.<Void>error(new ConnectionClosedException(
                "Connection " + session.getId() + " is closed (" + result + ")"));
          }
          return Mono.<Void>empty();
        });
  }

  @Override
  public Mono<Void> close() {
    if (!closed.compareAndSet(false, true)) {
      return Mono.empty();
    }
    synchronized (frames) {
      frames.tryEmitComplete();
    }
    return session.close();
  }

  @Override
  public boolean isOpen() {
    return !closed.get() && session.isOpen();
  }
}
