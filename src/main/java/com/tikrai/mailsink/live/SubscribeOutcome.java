package com.tikrai.mailsink.live;

public enum SubscribeOutcome {
  ACCEPTED(null),
  MISSING_IDENTITY("email should be defined"),
  ALREADY_SUBSCRIBED("subscriber already exists");

  private final String reason;

  SubscribeOutcome(String reason) {
    this.reason = reason;
  }

  public boolean accepted() {
    return this == ACCEPTED;
  }

  /** Text sent to the rejected client; null for {@link #ACCEPTED}. */
  public String reason() {
    return reason;
  }
}
