package com.tikrai.mailsink.live;

import com.tikrai.mailsink.model.MailEvent;
import reactor.core.publisher.Mono;

/**
 * Push channel to one subscriber.
 */
public interface LiveConnection {

  /**
   * Queues {@code event} for delivery. Fails with {@link ConnectionClosedException} once the
   * connection is closed.
   */
  Mono<Void> send(MailEvent event);

  /**
   * Closes the connection. Calling it again is a no-op.
   */
  Mono<Void> close();

  boolean isOpen();
}
