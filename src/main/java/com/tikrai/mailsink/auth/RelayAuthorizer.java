package com.tikrai.mailsink.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether mail for a recipient is accepted, by the recipient's domain.
 */
@Component
public class RelayAuthorizer {

  private static final Logger log = LoggerFactory.getLogger(RelayAuthorizer.class);

  private final Set<String> allowedDomains;

  public RelayAuthorizer(@Value("${app.relay.allowed-domains}") List<String> allowedDomains) {
    this.allowedDomains = allowedDomains.stream()
        .map(String::trim)
        .filter(d -> !d.isEmpty())
        .map(d -> d.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
    if (this.allowedDomains.isEmpty()) {
      throw new IllegalArgumentException("app.relay.allowed-domains must name at least one domain");
    }
    log.info("Relay allowed for domains: {}", this.allowedDomains);
  }

  /**
   * Accepts {@code local@domain}, {@code <local@domain>} and {@code Name <local@domain>}.
   */
  public boolean isAllowed(String recipient) {
    Optional<String> domain = domainOf(recipient);
    boolean allowed = domain.map(allowedDomains::contains).orElse(false);
    if (!allowed) {
      log.debug("Recipient {} not allowed (domain: {})", recipient, domain.orElse("-"));
    }
    return allowed;
  }

  /**
   * Text after the last {@code @} and before any {@code >}, lower-cased.
   */
  static Optional<String> domainOf(String recipient) {
    if (recipient == null) {
      return Optional.empty();
    }
    String address = recipient;
    int open = address.indexOf('<');
    if (open >= 0) {
      address = address.substring(open + 1);
    }
    int close = address.indexOf('>');
    if (close >= 0) {
      address = address.substring(0, close);
    }
    int at = address.lastIndexOf('@');
    if (at < 0) {
      return Optional.empty();
    }
    String domain = address.substring(at + 1).trim().toLowerCase(Locale.ROOT);
    return domain.isEmpty() ? Optional.empty() : Optional.of(domain);
  }
}
