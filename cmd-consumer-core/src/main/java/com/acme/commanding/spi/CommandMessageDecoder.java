package com.acme.commanding.spi;

/** Turns a raw queue payload into a typed command. */
public interface CommandMessageDecoder {

  /**
   * @throws com.acme.commanding.core.CommandDecodeException if the body is not a valid envelope
   */
  DecodedCommand decode(byte[] body);
}
