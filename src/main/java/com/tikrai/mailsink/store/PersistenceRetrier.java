package com.tikrai.mailsink.store;

import com.tikrai.mailsink.model.MailRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes records to the {@link MailStore}, retrying every failure forever.
 *
 * <p>The wait before the n-th retry is {@code initialBackoff * 2^(n-1)}, with no ceiling.
 * Waits run on {@code scheduler} and end as soon as the subscription is cancelled, which
 * is how shutdown gets a unit out of a long backoff.
 */
public class PersistenceRetrier {

  private static final Logger log = LoggerFactory.getLogger(PersistenceRetrier.class);

  private final MailStore store;
  private final Duration initialBackoff;
  private final Scheduler scheduler;

  public PersistenceRetrier(MailStore store, Duration initialBackoff, Scheduler scheduler) {
    if (initialBackoff.isNegative() || initialBackoff.isZero()) {
      throw new IllegalArgumentException("initialBackoff must be positive: " + initialBackoff);
    }
    this.store = store;
    this.initialBackoff = initialBackoff;
    this.scheduler = scheduler;
  }

  /**
   * Completes with the stored record once an insert succeeds. Never emits an error.
   */
  public Mono<MailRecord> persist(MailRecord record) {
    AtomicReference<Duration> nextWait = new AtomicReference<>(initialBackoff);
    return Mono.defer(() -> store.insert(record))
        .retryWhen(Retry.from(failures -> failures.concatMap(signal -> {
          Duration wait = nextWait.getAndUpdate(d -> d.multipliedBy(2));
          Throwable error = signal.failure();
          log.error("Failed to store mail - attempt: {}, ERROR: {}",
              signal.totalRetries() + 1, error.getMessage(), error);
          log.error("Unstored mail: {}", record);
          log.error("Retry after {} seconds", wait.toSeconds());
          return Mono.delay(wait, scheduler);
        })));
  }
}
