package com.tikrai.mailsink.store;

import com.tikrai.mailsink.model.MailRecord;
import reactor.core.publisher.Mono;

/**
 * Durable home of received mail. Implementations must be safe for concurrent use.
 */
public interface MailStore {

  /**
   * Inserts one record. Emits the stored record, carrying its assigned id, or an error
   * if the store could not take the write.
   */
  Mono<MailRecord> insert(MailRecord record);
}
