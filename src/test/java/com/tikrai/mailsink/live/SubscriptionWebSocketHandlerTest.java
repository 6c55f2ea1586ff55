package com.tikrai.mailsink.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tikrai.mailsink.ingest.IngestPipeline;
import com.tikrai.mailsink.smtp.TestMessages;
import com.tikrai.mailsink.store.InMemoryMailStore;
import com.tikrai.mailsink.store.MailStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "app.relay.allowed-domains=x.com",
        "app.smtp.port=0",
        "app.shutdown.drain-timeout=2s"
    })
class SubscriptionWebSocketHandlerTest {

  @TestConfiguration
  static class InMemoryStoreConfig {
    @Bean
    @Primary
    MailStore inMemoryMailStore() {
      return new InMemoryMailStore();
    }
  }

  @LocalServerPort
  int port;

  @Autowired
  IngestPipeline pipeline;

  @Autowired
  SubscriptionRegistry registry;

  @Autowired
  ObjectMapper objectMapper;

  private final WebSocketClient client = new ReactorNettyWebSocketClient();

  @Test
  void subscriberReceivesNewMailEvent() throws Exception {
    List<String> received = new CopyOnWriteArrayList<>();
    CompletableFuture<Void> session = client.execute(uri("?email=a@x.com"), s -> s.receive()
            .map(WebSocketMessage::getPayloadAsText)
            .doOnNext(received::add)
            .take(1)
            .then())
        .toFuture();
    waitFor(() -> registry.lookup("a@x.com").isPresent());

    pipeline.onMessageReceived(TestMessages.parse(TestMessages.PLAIN));
    session.get(5, TimeUnit.SECONDS);

    assertEquals(1, received.size());
    JsonNode event = objectMapper.readTree(received.get(0));
    assertEquals("new_mail", event.get("type").asText());
    assertEquals("hello", event.get("payload").get("text").asText());
    assertEquals("a@x.com", event.get("payload").get("to").asText());
    assertTrue(event.get("payload").has("_id"));
    assertTrue(event.get("payload").has("timestamp"));

    waitFor(() -> registry.lookup("a@x.com").isEmpty());
  }

  @Test
  void duplicateSubscriberGetsErrorAndIsClosed() throws Exception {
    Disposable first = client.execute(uri("?email=dup@x.com"), s -> s.receive().then()).subscribe();
    try {
      waitFor(() -> registry.lookup("dup@x.com").isPresent());
      LiveConnection original = registry.lookup("dup@x.com").orElseThrow();

      List<String> received = receiveUntilClosed("?email=dup@x.com");

      assertEquals(1, received.size());
      JsonNode event = objectMapper.readTree(received.get(0));
      assertEquals("error", event.get("type").asText());
      assertEquals("subscriber already exists", event.get("payload").get("msg").asText());
      assertEquals(original, registry.lookup("dup@x.com").orElseThrow());
    } finally {
      first.dispose();
    }
  }

  @Test
  void subscriberWithoutIdentityGetsErrorAndIsClosed() throws Exception {
    List<String> received = receiveUntilClosed("");

    assertEquals(1, received.size());
    JsonNode event = objectMapper.readTree(received.get(0));
    assertEquals("error", event.get("type").asText());
    assertEquals("email should be defined", event.get("payload").get("msg").asText());
  }

  private List<String> receiveUntilClosed(String query) {
    List<String> received = new CopyOnWriteArrayList<>();
    client.execute(uri(query), s -> s.receive()
            .map(WebSocketMessage::getPayloadAsText)
            .doOnNext(received::add)
            .then())
        .block(Duration.ofSeconds(5));
    return received;
  }

  private URI uri(String query) {
    return URI.create("ws://localhost:" + port + "/ws" + query);
  }

  private static void waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 5s");
      }
      Thread.sleep(20);
    }
  }
}
