package com.tikrai.mailsink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SMTP receiver that stores every message in MongoDB and pushes it to the recipient's
 * WebSocket subscriber, if one is connected.
 *
 * <p>Endpoints:
 * <pre>
 * SMTP  :${app.smtp.port}            - mail intake
 * GET   /ws?email=a@example.com      - live new_mail events for one recipient
 * GET   /nginx-auth                  - nginx mail proxy auth callback
 * </pre>
 */
@SpringBootApplication
public class MailSinkApplication {

  public static void main(String[] args) {
    SpringApplication.run(MailSinkApplication.class, args);
  }
}
