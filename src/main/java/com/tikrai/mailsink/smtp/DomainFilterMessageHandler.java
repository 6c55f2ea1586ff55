package com.tikrai.mailsink.smtp;

import com.tikrai.mailsink.auth.RelayAuthorizer;
import com.tikrai.mailsink.ingest.IngestPipeline;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.RejectException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Handles one SMTP transaction: rejects recipients outside the allowed domains and hands
 * the received message to the {@link IngestPipeline}. One instance per connection.
 */
public class DomainFilterMessageHandler implements MessageHandler {

  private static final Logger log = LoggerFactory.getLogger(DomainFilterMessageHandler.class);

  private static final Session SESSION = Session.getInstance(new Properties());

  private final RelayAuthorizer authorizer;
  private final IngestPipeline pipeline;

  private String mailFrom;
  private final List<String> rcptTo = new ArrayList<>();

  public DomainFilterMessageHandler(RelayAuthorizer authorizer, IngestPipeline pipeline) {
    this.authorizer = authorizer;
    this.pipeline = pipeline;
  }

  @Override
  public void from(String from) throws RejectException {
    this.mailFrom = from;
    log.info("SMTP MAIL FROM: {}", from);
  }

  @Override
  public void recipient(String recipient) throws RejectException {
    String r = recipient.trim().toLowerCase(Locale.ROOT);
    log.info("SMTP RCPT TO: {}", r);
    if (!authorizer.isAllowed(r)) {
      log.warn("SMTP RCPT TO rejected - domain not allowed: {}", r);
      throw new RejectException(550, "Relaying denied");
    }
    rcptTo.add(r);
    log.debug("SMTP RCPT TO accepted: {}", r);
  }

  @Override
  public void data(InputStream data) throws RejectException {
    try {
      log.info("SMTP DATA received - FROM: {}, TO: {}", mailFrom, rcptTo);
      byte[] rawBytes = data.readAllBytes();
      log.debug("SMTP DATA size: {} bytes", rawBytes.length);

      MimeMessage msg = new MimeMessage(SESSION, new ByteArrayInputStream(rawBytes));
      log.debug("SMTP EMAIL Content-Type: {}", msg.getContentType());
      pipeline.onMessageReceived(msg);

    } catch (Exception e) {
      log.error("Failed to process email - FROM: {}, TO: {}, ERROR: {}",
          mailFrom, rcptTo, e.getMessage(), e);
      throw new RejectException(451, "Processing error");
    }
  }

  @Override
  public void done() {
    log.debug("SMTP transaction done - clearing FROM: {}, TO: {}", mailFrom, rcptTo);
    mailFrom = null;
    rcptTo.clear();
  }
}
