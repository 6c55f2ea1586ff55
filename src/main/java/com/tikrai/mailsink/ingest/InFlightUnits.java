package com.tikrai.mailsink.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Supervised group of running units of work.
 *
 * <p>A unit is in the group from {@link #spawn} until it terminates, whether it completes,
 * fails or is cancelled. Once {@link #cancelAll} has been called the group takes no new units.
 */
public class InFlightUnits {

  private static final Logger log = LoggerFactory.getLogger(InFlightUnits.class);

  private final Set<Unit> units = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  /**
   * Subscribes to {@code work} as a new unit.
   *
   * @return false if the group is closed and the work was not started
   */
  public boolean spawn(String name, Mono<?> work) {
    if (closed) {
      log.warn("Refusing new unit while draining: {}", name);
      return false;
    }
    Unit unit = new Unit(name);
    units.add(unit);
    unit.start(work.doFinally(signal -> {
      unit.outcome = signal;
      units.remove(unit);
      unit.finished.tryEmitEmpty();
      log.debug("Unit {} finished: {}", name, signal);
    }));
    if (closed && unit.outcome != SignalType.ON_COMPLETE) {
      // cancelAll ran while this unit was starting
      log.warn("Draining began while starting unit, cancelled: {}", name);
      unit.cancel();
      return false;
    }
    return true;
  }

  public int size() {
    return units.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes the group, cancels every running unit and completes once all of them have
   * unwound. Individual outcomes are not propagated.
   */
  public Mono<Void> cancelAll() {
    closed = true;
    Set<Unit> snapshot = Set.copyOf(units);
    log.info("Cancelling {} in-flight units", snapshot.size());
    return Flux.fromIterable(snapshot)
        .doOnNext(Unit::cancel)
        .flatMap(unit -> unit.finished.asMono())
        .then();
  }

  private static final class Unit {
    final String name;
    final Disposable.Swap handle = Disposables.swap();
    final Sinks.Empty<Void> finished = Sinks.empty();
    volatile SignalType outcome;

    Unit(String name) {
      this.name = name;
    }

    void start(Mono<?> work) {
      handle.update(work.subscribe(
          value -> { },
          error -> log.error("Unit {} failed: {}", name, error.getMessage(), error)));
    }

    void cancel() {
      handle.dispose();
    }
  }
}
