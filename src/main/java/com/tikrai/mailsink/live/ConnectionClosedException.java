package com.tikrai.mailsink.live;

public class ConnectionClosedException extends RuntimeException {

  public ConnectionClosedException(String message) {
    super(message);
  }
}
