package com.tikrai.mailsink.store;

import com.mongodb.MongoClientSettings;
import com.tikrai.mailsink.model.MailRecord;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreConfigTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final StoreConfig config = new StoreConfig();
  private MappingMongoConverter converter;

  @BeforeEach
  void setup() {
    MongoCustomConversions conversions = new MongoCustomConversions(List.of());
    MongoMappingContext context = new MongoMappingContext();
    context.setSimpleTypeHolder(conversions.getSimpleTypeHolder());
    context.afterPropertiesSet();
    converter = config.mappingMongoConverter(context, conversions);
    converter.afterPropertiesSet();
  }

  @Test
  void storedDocumentHasOnlyMailFields() {
    Document doc = new Document();

    converter.write(MailRecord.of("u@dom", "a@x.com", "Hi", "hello", NOW), doc);

    assertEquals(Set.of("from", "to", "subject", "text", "timestamp"), doc.keySet());
  }

  @Test
  void savedRecordKeepsIdButNoTypeHint() {
    Document doc = new Document();

    converter.write(MailRecord.of("u@dom", "a@x.com", "Hi", "hello", NOW).withId("663210f0c1a2b3c4d5e6f708"), doc);

    assertTrue(doc.containsKey("_id"));
    assertFalse(doc.containsKey("_class"));
  }

  @Test
  void timeoutsAreAppliedToClientSettings() {
    MongoClientSettingsBuilderCustomizer customizer = config.mailStoreTimeouts(Duration.ofSeconds(3));
    MongoClientSettings.Builder builder = MongoClientSettings.builder();

    customizer.customize(builder);
    MongoClientSettings settings = builder.build();

    assertEquals(3000, settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS));
    assertEquals(3000, settings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS));
    assertEquals(3000, settings.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
  }
}
