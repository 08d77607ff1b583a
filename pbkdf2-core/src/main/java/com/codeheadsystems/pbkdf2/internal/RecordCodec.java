package com.codeheadsystems.pbkdf2.internal;

import com.codeheadsystems.pbkdf2.common.ByteUtils;
import com.codeheadsystems.pbkdf2.model.Pbkdf2Record;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes and strictly decodes the text record {@code pbkdf2_sha256$<iterations>$<salt>$<hash>}.
 * <p>
 * Decoding accepts only records that split into the tag plus exactly three non-empty fields.
 * Iterations must be 1 to 10 ASCII digits within {@code int} range. Salt and hash must be
 * canonical, padded, standard-alphabet Base64.
 */
public class RecordCodec {

  public static final String ALGORITHM_TAG = Pbkdf2HmacSha256.ALGORITHM;
  public static final String SEPARATOR = "$";
  public static final String PREFIX = ALGORITHM_TAG + SEPARATOR;
  public static final int MAX_ITERATION_DIGITS = 10;

  private static final Logger log = LoggerFactory.getLogger(RecordCodec.class);
  private static final Pattern SPLITTER = Pattern.compile(Pattern.quote(SEPARATOR));
  private static final Base64.Encoder ENCODER = Base64.getEncoder();
  private static final Base64.Decoder DECODER = Base64.getDecoder();

  private RecordCodec() {
  }

  /**
   * Builds the record string.
   *
   * @param iterations the iterations
   * @param salt       the salt
   * @param hash       the derived key
   * @return the record
   */
  public static String encode(final int iterations, final byte[] salt, final byte[] hash) {
    return PREFIX + Integer.toString(iterations)
        + SEPARATOR + ENCODER.encodeToString(salt)
        + SEPARATOR + ENCODER.encodeToString(hash);
  }

  /**
   * Parses a record. Every malformation yields an empty result; the caller learns nothing about
   * which check failed.
   *
   * @param record the record text
   * @return the decoded record, which the caller must close
   */
  public static Optional<Pbkdf2Record> decode(final String record) {
    if (record == null || record.isBlank()) {
      log.debug("decode: blank record");
      return Optional.empty();
    }
    if (!record.startsWith(PREFIX)) {
      log.debug("decode: unexpected algorithm tag");
      return Optional.empty();
    }
    final String[] fields = SPLITTER.split(record.substring(PREFIX.length()), -1);
    if (fields.length != 3) {
      log.debug("decode: expected 3 fields after tag, found {}", fields.length);
      return Optional.empty();
    }
    for (String field : fields) {
      if (field.isEmpty()) {
        log.debug("decode: empty field");
        return Optional.empty();
      }
    }
    final int iterations = parseIterations(fields[0]);
    if (iterations <= 0) {
      log.debug("decode: invalid iterations");
      return Optional.empty();
    }
    final byte[] salt = decodeBase64(fields[1]);
    if (salt == null) {
      log.debug("decode: invalid salt encoding");
      return Optional.empty();
    }
    final byte[] hash = decodeBase64(fields[2]);
    if (hash == null) {
      ByteUtils.wipe(salt);
      log.debug("decode: invalid hash encoding");
      return Optional.empty();
    }
    return Optional.of(new Pbkdf2Record(iterations, salt, hash));
  }

  /**
   * Parses unsigned ASCII decimal digits.
   *
   * @return the value, or -1 when not a positive int of at most {@link #MAX_ITERATION_DIGITS} digits
   */
  static int parseIterations(final String text) {
    if (text.isEmpty() || text.length() > MAX_ITERATION_DIGITS) {
      return -1;
    }
    long value = 0;
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
      value = value * 10 + (c - '0');
    }
    if (value > Integer.MAX_VALUE) {
      return -1;
    }
    return (int) value;
  }

  /**
   * Decodes padded standard Base64, rejecting unpadded input and non-zero trailing bits.
   *
   * @return the bytes, or null when the text is not canonical Base64 of at least one byte
   */
  static byte[] decodeBase64(final String text) {
    if (text.length() % 4 != 0) {
      return null;
    }
    final byte[] decoded;
    try {
      decoded = DECODER.decode(text);
    } catch (IllegalArgumentException e) {
      return null;
    }
    if (decoded.length == 0 || !ENCODER.encodeToString(decoded).equals(text)) {
      ByteUtils.wipe(decoded);
      return null;
    }
    return decoded;
  }
}
