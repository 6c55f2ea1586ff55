package com.tikrai.mailsink.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * One received message, normalized. Stored as a single document and pushed as the
 * payload of a {@code new_mail} event.
 *
 * <p>{@code id} is null until the store has assigned one.
 */
public record MailRecord(
    @Id
    @JsonProperty("_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String id,
    String from,
    String to,
    String subject,
    String text,
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp
) {

  public static MailRecord of(String from, String to, String subject, String text, Instant timestamp) {
    return new MailRecord(null, from, to, subject, text, timestamp);
  }

  public MailRecord withId(String id) {
    return new MailRecord(id, from, to, subject, text, timestamp);
  }
}
