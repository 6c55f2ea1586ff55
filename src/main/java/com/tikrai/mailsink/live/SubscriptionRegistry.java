package com.tikrai.mailsink.live;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recipient identity to its single live connection.
 *
 * <p>Backed by a {@link ConcurrentHashMap}: operations on one identity are atomic, distinct
 * identities do not contend, and no lock is held while talking to a connection.
 */
public class SubscriptionRegistry {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

  private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();

  public SubscribeOutcome subscribe(String identity, LiveConnection connection) {
    if (identity == null || identity.isBlank()) {
      log.warn("Subscribe rejected - no identity given");
      return SubscribeOutcome.MISSING_IDENTITY;
    }
    LiveConnection existing = connections.putIfAbsent(identity, connection);
    if (existing != null) {
      log.warn("Subscribe rejected - {} already has a live connection", identity);
      return SubscribeOutcome.ALREADY_SUBSCRIBED;
    }
    log.info("Subscriber registered: {}", identity);
    return SubscribeOutcome.ACCEPTED;
  }

  public Optional<LiveConnection> lookup(String identity) {
    return identity == null ? Optional.empty() : Optional.ofNullable(connections.get(identity));
  }

  public void unsubscribe(String identity) {
    if (identity != null && connections.remove(identity) != null) {
      log.info("Subscriber removed: {}", identity);
    }
  }

  /**
   * Removes the entry only while it still belongs to {@code connection}.
   */
  public void unsubscribe(String identity, LiveConnection connection) {
    if (identity != null && connections.remove(identity, connection)) {
      log.info("Subscriber removed: {}", identity);
    }
  }

  public int size() {
    return connections.size();
  }

  /**
   * Closes every registered connection that is still open and empties the registry.
   */
  public Mono<Void> closeAll() {
    return Flux.fromIterable(Map.copyOf(connections).entrySet())
        .flatMap(entry -> {
          unsubscribe(entry.getKey(), entry.getValue());
          LiveConnection connection = entry.getValue();
          if (!connection.isOpen()) {
            return Mono.empty();
          }
          log.debug("Closing live connection of {}", entry.getKey());
          return connection.close()
              .onErrorResume(e -> {
                log.warn("Failed to close live connection of {}: {}", entry.getKey(), e.getMessage());
                return Mono.empty();
              });
        })
        .then();
  }
}
