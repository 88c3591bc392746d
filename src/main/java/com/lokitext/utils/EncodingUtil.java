package com.lokitext.utils;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import com.google.common.io.BaseEncoding;

/**
 * Base64 and hex encoding of UTF-8 text.
 */
public class EncodingUtil {

  /**
   * @throws IllegalArgumentException if encoded is not padded standard
   *     Base64 or does not decode to UTF-8
   */
  public static String decodeBase64(String encoded) {
    byte[] bytes = BaseEncoding.base64().decode(encoded);
    return decodeUtf8(bytes);
  }

  /**
   * @throws IllegalArgumentException on odd length, non-hex characters or
   *     bytes that are not UTF-8
   */
  public static String decodeHex(String encoded) {
    try {
      return decodeUtf8(Hex.decodeHex(encoded));
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Invalid hex string: " + e.getMessage(), e);
    }
  }

  public static String encodeBase64(String text) {
    return BaseEncoding.base64().encode(text.getBytes(StandardCharsets.UTF_8));
  }

  /** Lower-case hex, two digits per byte. */
  public static String encodeHex(String text) {
    return Hex.encodeHexString(text.getBytes(StandardCharsets.UTF_8));
  }

  private static String decodeUtf8(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException("Decoded bytes are not valid UTF-8", e);
    }
  }

  private EncodingUtil() {
  }
}
