package com.codeheadsystems.pbkdf2.common;

import java.security.SecureRandom;

/**
 * Salt source for the hash manager. Writes CSPRNG output into a buffer the caller owns, so the
 * caller decides when the salt is wiped.
 *
 * @param random the generator, replaceable in tests for a deterministic salt
 */
public record RandomProvider(SecureRandom random) {

  public RandomProvider {
    if (random == null) {
      throw new IllegalArgumentException("random must not be null");
    }
  }

  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Overwrites every byte of {@code buffer} with random bytes.
   *
   * @param buffer the salt buffer; an empty buffer is left untouched
   */
  public void fill(final byte[] buffer) {
    if (buffer == null) {
      throw new IllegalArgumentException("buffer must not be null");
    }
    if (buffer.length > 0) {
      random.nextBytes(buffer);
    }
  }
}
