package com.tikrai.mailsink.ingest;

import com.tikrai.mailsink.live.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import reactor.core.publisher.Mono;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orderly stop: close the SMTP listener, cancel and drain in-flight units, close live
 * connections, release the store client.
 *
 * <p>Runs as the first {@link SmartLifecycle} to stop, ahead of the web server.
 */
public class ShutdownCoordinator implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

  public enum State { RUNNING, DRAINING, STOPPED }

  private final AutoCloseable mailAcceptor;
  private final InFlightUnits inFlight;
  private final SubscriptionRegistry registry;
  private final Closeable storeClient;
  private final Duration drainTimeout;
  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

  public ShutdownCoordinator(
      AutoCloseable mailAcceptor,
      InFlightUnits inFlight,
      SubscriptionRegistry registry,
      Closeable storeClient,
      Duration drainTimeout
  ) {
    this.mailAcceptor = mailAcceptor;
    this.inFlight = inFlight;
    this.registry = registry;
    this.storeClient = storeClient;
    this.drainTimeout = drainTimeout;
  }

  public State state() {
    return state.get();
  }

  /**
   * Runs the shutdown sequence once. Later calls return immediately.
   */
  public void shutdown() {
    if (!state.compareAndSet(State.RUNNING, State.DRAINING)) {
      return;
    }
    log.info("Shutdown started - in-flight units: {}, subscribers: {}", inFlight.size(), registry.size());

    try {
      mailAcceptor.close();
    } catch (Exception e) {
      log.error("Failed to stop mail listener: {}", e.getMessage(), e);
    }

    await("in-flight units", inFlight.cancelAll());
    await("live connections", registry.closeAll());

    try {
      storeClient.close();
      log.info("Store client closed");
    } catch (Exception e) {
      log.error("Failed to close store client: {}", e.getMessage(), e);
    }

    state.set(State.STOPPED);
    log.info("Shutdown complete");
  }

  private void await(String what, Mono<Void> step) {
    try {
      step.block(drainTimeout);
      log.info("Drained {}", what);
    } catch (IllegalStateException e) {
      log.warn("Gave up waiting for {} after {}: {}", what, drainTimeout, e.getMessage());
    }
  }

  @Override
  public void start() {
    log.debug("Shutdown coordinator armed");
  }

  @Override
  public void stop() {
    shutdown();
  }

  @Override
  public boolean isRunning() {
    return state.get() == State.RUNNING;
  }

  @Override
  public int getPhase() {
    return SmartLifecycle.DEFAULT_PHASE;
  }
}
