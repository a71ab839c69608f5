package com.codeheadsystems.ledger.codec;

import com.codeheadsystems.ledger.model.AuditEvent;

/**
 * Turns an event into one segment line and back.
 */
public interface SegmentCodec {

  /**
   * Encode an event as a single line without a newline.
   *
   * @param event the event
   * @return the line
   */
  String encode(AuditEvent event);

  /**
   * Decode a line.
   *
   * @param line the line
   * @return the event
   * @throws com.codeheadsystems.ledger.exception.ChainIntegrityException if the line cannot be decoded.
   */
  AuditEvent decode(String line);

}
