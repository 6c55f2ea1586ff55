package com.tikrai.mailsink.live;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

  @Bean
  public SubscriptionWebSocketHandler subscriptionWebSocketHandler(
      SubscriptionRegistry registry,
      ObjectMapper objectMapper
  ) {
    return new SubscriptionWebSocketHandler(registry, objectMapper);
  }

  @Bean
  public HandlerMapping subscriptionHandlerMapping(SubscriptionWebSocketHandler handler) {
    return new SimpleUrlHandlerMapping(Map.of("/ws", handler), -1);
  }
}
