package com.tikrai.mailsink.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Auth callback for an nginx mail proxy. Always answers 200; the verdict is in the
 * {@code Auth-Status} header.
 */
@RestController
public class RelayAuthController {

  private static final Logger log = LoggerFactory.getLogger(RelayAuthController.class);

  static final String RECIPIENT_HEADER = "Auth-SMTP-To";

  private final RelayAuthorizer authorizer;
  private final int smtpPort;

  public RelayAuthController(RelayAuthorizer authorizer, @Value("${app.smtp.port:8025}") int smtpPort) {
    this.authorizer = authorizer;
    this.smtpPort = smtpPort;
  }

  @GetMapping("/nginx-auth")
  public ResponseEntity<Void> authorize(
      @RequestHeader(name = RECIPIENT_HEADER, defaultValue = "") String recipient,
      @RequestHeader(name = HttpHeaders.HOST, defaultValue = "") String host
  ) {
    if (!authorizer.isAllowed(recipient)) {
      log.warn("Relay FORBIDDEN - {}: {}", RECIPIENT_HEADER, recipient);
      return ResponseEntity.ok()
          .header("Auth-Status", "FORBIDDEN")
          .header("Auth-Wait", "0")
          .build();
    }
    log.info("Relay OK - {}: {}, server: {}, port: {}", RECIPIENT_HEADER, recipient, host, smtpPort);
    return ResponseEntity.ok()
        .header("Auth-Status", "OK")
        .header("Auth-Server", host)
        .header("Auth-Port", String.valueOf(smtpPort))
        .build();
  }
}
