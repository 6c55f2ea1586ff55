package com.tikrai.mailsink.ingest;

import com.mongodb.reactivestreams.client.MongoClient;
import com.tikrai.mailsink.live.NotificationDispatcher;
import com.tikrai.mailsink.live.SubscriptionRegistry;
import com.tikrai.mailsink.smtp.PayloadNormalizer;
import com.tikrai.mailsink.smtp.SmtpServerConfig;
import com.tikrai.mailsink.store.PersistenceRetrier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PayloadNormalizer payloadNormalizer(Clock clock) {
    return new PayloadNormalizer(clock);
  }

  @Bean
  public SubscriptionRegistry subscriptionRegistry() {
    return new SubscriptionRegistry();
  }

  @Bean
  public NotificationDispatcher notificationDispatcher(SubscriptionRegistry registry) {
    return new NotificationDispatcher(registry);
  }

  @Bean
  public InFlightUnits inFlightUnits() {
    return new InFlightUnits();
  }

  @Bean
  public IngestPipeline ingestPipeline(
      PayloadNormalizer normalizer,
      PersistenceRetrier retrier,
      NotificationDispatcher dispatcher,
      InFlightUnits inFlight
  ) {
    return new IngestPipeline(normalizer, retrier, dispatcher, inFlight);
  }

  @Bean
  public ShutdownCoordinator shutdownCoordinator(
      SmtpServerConfig smtpServerConfig,
      InFlightUnits inFlight,
      SubscriptionRegistry registry,
      MongoClient mongoClient,
      @Value("${app.shutdown.drain-timeout:30s}") Duration drainTimeout
  ) {
    return new ShutdownCoordinator(smtpServerConfig, inFlight, registry, mongoClient, drainTimeout);
  }
}
