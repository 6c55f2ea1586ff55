package com.tikrai.mailsink.live;

import com.tikrai.mailsink.model.MailEvent;
import com.tikrai.mailsink.model.MailRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Best-effort push of stored mail to the recipient's live connection, if there is one.
 * Failures are logged and dropped: the record is already stored.
 */
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final SubscriptionRegistry registry;

  public NotificationDispatcher(SubscriptionRegistry registry) {
    this.registry = registry;
  }

  public Mono<Void> dispatch(MailRecord record) {
    return registry.lookup(record.to())
        .map(connection -> connection.send(MailEvent.newMail(record))
            .doOnSuccess(v -> log.info("Notified subscriber {} of mail {}", record.to(), record.id()))
            .onErrorResume(e -> {
              log.debug("Notification to {} not delivered: {}", record.to(), e.getMessage());
              return Mono.empty();
            }))
        .orElseGet(() -> {
          log.debug("No subscriber for {}", record.to());
          return Mono.empty();
        });
  }
}
