package com.xpresspay.payment.gateway.codec;

import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;

/**
 * Keeps the encrypted plaintext pure ASCII, byte for byte as the gateway's reference
 * encoder writes it. Every character from DEL upwards, and every control character without
 * a short escape, becomes a six-character unicode escape with lowercase hex. Characters
 * outside the BMP are written as their two escaped surrogates.
 */
final class AsciiJsonEscapes extends CharacterEscapes {

  private static final long serialVersionUID = 1L;

  private static final int DEL = 0x7F;

  private final int[] asciiEscapes;

  AsciiJsonEscapes() {
    asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
    for (int ch = 0; ch < 0x20; ch++) {
      if (asciiEscapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
        asciiEscapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
      }
    }
    asciiEscapes[DEL] = CharacterEscapes.ESCAPE_CUSTOM;
  }

  @Override
  public int[] getEscapeCodesForAscii() {
    return asciiEscapes;
  }

  @Override
  public SerializableString getEscapeSequence(int ch) {
    return new SerializedString(String.format("\\u%04x", ch));
  }
}
