package com.tikrai.mailsink.ingest;

import com.tikrai.mailsink.live.NotificationDispatcher;
import com.tikrai.mailsink.model.MailRecord;
import com.tikrai.mailsink.smtp.PayloadNormalizer;
import com.tikrai.mailsink.store.PersistenceRetrier;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Entry point for received mail: normalize on the caller's thread, then store and notify in
 * a unit of its own.
 *
 * <p>Units are independent. Two messages for the same recipient may be stored and notified
 * in either order.
 */
public class IngestPipeline {

  private static final Logger log = LoggerFactory.getLogger(IngestPipeline.class);

  private final PayloadNormalizer normalizer;
  private final PersistenceRetrier retrier;
  private final NotificationDispatcher dispatcher;
  private final InFlightUnits inFlight;

  public IngestPipeline(
      PayloadNormalizer normalizer,
      PersistenceRetrier retrier,
      NotificationDispatcher dispatcher,
      InFlightUnits inFlight
  ) {
    this.normalizer = normalizer;
    this.retrier = retrier;
    this.dispatcher = dispatcher;
    this.inFlight = inFlight;
  }

  /**
   * Returns as soon as the message is normalized and its unit started.
   *
   * @throws IllegalStateException if shutdown has begun and no new work is accepted
   */
  public void onMessageReceived(MimeMessage message) throws MessagingException, IOException {
    Optional<MailRecord> normalized = normalizer.normalize(message);
    if (normalized.isEmpty()) {
      return;
    }
    MailRecord record = normalized.get();
    log.info("Mail accepted - FROM: {}, TO: {}, SUBJECT: {}, text length: {}",
        record.from(), record.to(), record.subject(), record.text().length());

    boolean started = inFlight.spawn("mail to " + record.to(),
        retrier.persist(record).flatMap(dispatcher::dispatch));
    if (!started) {
      throw new IllegalStateException("Pipeline is draining, mail to " + record.to() + " not accepted");
    }
  }
}
