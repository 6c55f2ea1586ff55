package com.tikrai.mailsink.store;

import com.tikrai.mailsink.model.MailRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import reactor.core.publisher.Mono;

public class MongoMailStore implements MailStore {

  private static final Logger log = LoggerFactory.getLogger(MongoMailStore.class);

  private final ReactiveMongoOperations mongo;
  private final String collection;

  public MongoMailStore(ReactiveMongoOperations mongo, String collection) {
    this.mongo = mongo;
    this.collection = collection;
  }

  @Override
  public Mono<MailRecord> insert(MailRecord record) {
    return mongo.insert(record, collection)
        .doOnNext(saved -> log.info("Stored mail {} in {} - FROM: {}, TO: {}",
            saved.id(), collection, saved.from(), saved.to()));
  }
}
