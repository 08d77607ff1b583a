package com.codeheadsystems.pbkdf2.internal;

/**
 * Password-based key derivation primitive.
 */
public interface KeyDerivationFunction {

  /**
   * Derives {@code output.length} key bytes from the password and salt, writing directly into
   * the caller-owned {@code output} array. Implementations must not retain references to any of
   * the arrays after returning.
   *
   * @param password   the password bytes
   * @param salt       the salt bytes
   * @param iterations the iteration count, at least 1
   * @param output     destination for the derived key, at least one byte long
   */
  void derive(byte[] password, byte[] salt, int iterations, byte[] output);

  /**
   * Algorithm name as it appears in the record tag.
   *
   * @return the name
   */
  String algorithm();
}
