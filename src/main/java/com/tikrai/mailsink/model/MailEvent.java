package com.tikrai.mailsink.model;

import java.util.Map;

/**
 * Envelope written to live subscribers: {@code {"type": ..., "payload": ...}}.
 */
public record MailEvent(String type, Object payload) {

  public static final String NEW_MAIL = "new_mail";
  public static final String ERROR = "error";

  public static MailEvent newMail(MailRecord record) {
    return new MailEvent(NEW_MAIL, record);
  }

  public static MailEvent error(String msg) {
    return new MailEvent(ERROR, Map.of("msg", msg));
  }
}
