package com.tikrai.mailsink.smtp;

import com.tikrai.mailsink.model.MailRecord;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a parsed message into a {@link MailRecord}.
 *
 * <p>Header values are taken verbatim. For a multipart message the text comes from the
 * first direct {@code text/plain} part; a multipart message without one is dropped.
 */
public class PayloadNormalizer {

  private static final Logger log = LoggerFactory.getLogger(PayloadNormalizer.class);

  private final Clock clock;

  public PayloadNormalizer(Clock clock) {
    this.clock = clock;
  }

  /**
   * @return the record, or empty if the message has nothing to store
   */
  public Optional<MailRecord> normalize(MimeMessage msg) throws MessagingException, IOException {
    String from = header(msg, "From");
    String to = header(msg, "To");
    String subject = header(msg, "Subject");
    Instant timestamp = Instant.now(clock);

    String text;
    if (msg.isMimeType("multipart/*")) {
      text = firstPlainText(msg);
      if (text == null) {
        log.error("Message without text/plain:\n{}\n\n{}\n",
            MailRecord.of(from, to, subject, null, timestamp), render(msg));
        return Optional.empty();
      }
    } else {
      text = readText(msg);
    }

    return Optional.of(MailRecord.of(from, to, subject, trim(text), timestamp));
  }

  /**
   * Strips spaces, tabs, CR and LF from both ends in any order.
   */
  static String trim(String text) {
    return text == null ? "" : text.strip();
  }

  private static String header(MimeMessage msg, String name) throws MessagingException {
    return Objects.requireNonNullElse(msg.getHeader(name, ", "), "");
  }

  private static String firstPlainText(Part part) throws MessagingException, IOException {
    Object content = part.getContent();
    if (!(content instanceof Multipart)) {
      log.warn("Multipart message returned unexpected content type: {}",
          content != null ? content.getClass().getName() : "null");
      return null;
    }
    Multipart mp = (Multipart) content;
    log.debug("Multipart has {} parts", mp.getCount());
    for (int i = 0; i < mp.getCount(); i++) {
      Part bodyPart = mp.getBodyPart(i);
      if (bodyPart.isMimeType("text/plain")) {
        log.debug("Using text/plain part {} of {}", i + 1, mp.getCount());
        return readText(bodyPart);
      }
    }
    return null;
  }

  /**
   * Decoded text for {@code text/*} parts; anything else, or text in a charset the JVM does
   * not know, is taken as the raw undecoded body.
   */
  private static String readText(Part part) throws MessagingException, IOException {
    Object content;
    try {
      content = part.getContent();
    } catch (UnsupportedEncodingException e) {
      log.warn("Unsupported charset in {}, using raw body: {}", part.getContentType(), e.getMessage());
      return rawBody(part);
    }
    if (content instanceof String) {
      return (String) content;
    }
    return rawBody(part);
  }

  private static String rawBody(Part part) throws MessagingException, IOException {
    InputStream raw;
    if (part instanceof MimeMessage) {
      raw = ((MimeMessage) part).getRawInputStream();
    } else if (part instanceof MimeBodyPart) {
      raw = ((MimeBodyPart) part).getRawInputStream();
    } else {
      raw = part.getInputStream();
    }
    try (InputStream in = raw) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static String render(MimeMessage msg) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      msg.writeTo(out);
    } catch (IOException | MessagingException e) {
      return "<unrenderable message: " + e.getMessage() + ">";
    }
    return out.toString(StandardCharsets.UTF_8);
  }
}
