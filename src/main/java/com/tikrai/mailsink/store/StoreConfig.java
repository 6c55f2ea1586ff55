package com.tikrai.mailsink.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.convert.DefaultMongoTypeMapper;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.convert.NoOpDbRefResolver;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class StoreConfig {

  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean
  public MongoClientSettingsBuilderCustomizer mailStoreTimeouts(
      @Value("${app.store.timeout:3s}") Duration timeout
  ) {
    int millis = Math.toIntExact(timeout.toMillis());
    log.info("Mongo client timeouts - connect/read/server selection: {} ms", millis);
    return settings -> settings
        .applyToSocketSettings(s -> s
            .connectTimeout(millis, TimeUnit.MILLISECONDS)
            .readTimeout(millis, TimeUnit.MILLISECONDS))
        .applyToClusterSettings(c -> c.serverSelectionTimeout(millis, TimeUnit.MILLISECONDS));
  }

  /**
   * Boot's converter without the {@code _class} type hint, so stored mail documents carry
   * only the record's own fields.
   */
  @Bean
  public MappingMongoConverter mappingMongoConverter(
      MongoMappingContext mappingContext,
      MongoCustomConversions conversions
  ) {
    MappingMongoConverter converter = new MappingMongoConverter(NoOpDbRefResolver.INSTANCE, mappingContext);
    converter.setCustomConversions(conversions);
    converter.setTypeMapper(new DefaultMongoTypeMapper(null));
    return converter;
  }

  @Bean
  public MailStore mailStore(
      ReactiveMongoOperations mongo,
      @Value("${app.store.collection:emails}") String collection
  ) {
    log.info("Mail store collection: {}", collection);
    return new MongoMailStore(mongo, collection);
  }

  @Bean
  public PersistenceRetrier persistenceRetrier(
      MailStore mailStore,
      @Value("${app.store.retry.initial-backoff:60s}") Duration initialBackoff
  ) {
    return new PersistenceRetrier(mailStore, initialBackoff, Schedulers.parallel());
  }
}
