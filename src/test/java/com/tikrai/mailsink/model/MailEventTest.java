package com.tikrai.mailsink.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class MailEventTest {

  private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

  @Test
  void newMailEventCarriesRecordWithIsoTimestamp() throws Exception {
    MailRecord record = MailRecord.of("u@dom", "a@x.com", "Hi", "hello", Instant.parse("2024-05-01T10:00:00Z"))
        .withId("663210f0c1a2b3c4d5e6f708");

    JsonNode json = mapper.readTree(mapper.writeValueAsString(MailEvent.newMail(record)));

    assertEquals("new_mail", json.get("type").asText());
    JsonNode payload = json.get("payload");
    assertEquals("663210f0c1a2b3c4d5e6f708", payload.get("_id").asText());
    assertEquals("u@dom", payload.get("from").asText());
    assertEquals("a@x.com", payload.get("to").asText());
    assertEquals("Hi", payload.get("subject").asText());
    assertEquals("hello", payload.get("text").asText());
    assertEquals("2024-05-01T10:00:00Z", payload.get("timestamp").asText());
  }

  @Test
  void unsavedRecordHasNoIdField() throws Exception {
    MailRecord record = MailRecord.of("u@dom", "a@x.com", "Hi", "hello", Instant.parse("2024-05-01T10:00:00Z"));

    JsonNode json = mapper.readTree(mapper.writeValueAsString(MailEvent.newMail(record)));

    assertFalse(json.get("payload").has("_id"));
    assertFalse(json.get("payload").has("id"));
  }

  @Test
  void errorEventCarriesMessage() throws Exception {
    JsonNode json = mapper.readTree(mapper.writeValueAsString(MailEvent.error("subscriber already exists")));

    assertEquals("error", json.get("type").asText());
    assertEquals("subscriber already exists", json.get("payload").get("msg").asText());
  }
}
