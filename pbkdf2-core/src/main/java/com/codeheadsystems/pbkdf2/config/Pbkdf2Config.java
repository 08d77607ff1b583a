package com.codeheadsystems.pbkdf2.config;

/**
 * Parameters for producing a PBKDF2-HMAC-SHA256 record.
 * Holds the iteration count and the salt and derived-key lengths, in bytes.
 *
 * @param iterations  PBKDF2 iteration count, strictly positive
 * @param saltLength  number of random salt bytes, strictly positive
 * @param hashLength  number of derived key bytes, strictly positive
 */
public record Pbkdf2Config(int iterations, int saltLength, int hashLength) {

  // Tuned for tens of milliseconds of CPU on typical hardware.
  public static final int DEFAULT_ITERATIONS = 300_000;
  public static final int DEFAULT_SALT_LENGTH = 16;
  public static final int DEFAULT_HASH_LENGTH = 32;

  /**
   * Default configuration for production use: 300000 iterations, 16 byte salt, 32 byte hash.
   */
  public static final Pbkdf2Config DEFAULT =
      new Pbkdf2Config(DEFAULT_ITERATIONS, DEFAULT_SALT_LENGTH, DEFAULT_HASH_LENGTH);

  /**
   * Validates all parameters.
   *
   * @throws IllegalArgumentException if any parameter is not strictly positive
   */
  public Pbkdf2Config {
    requirePositive("iterations", iterations);
    requirePositive("saltLength", saltLength);
    requirePositive("hashLength", hashLength);
  }

  /**
   * Creates a cheap configuration for tests: 1000 iterations with the default lengths.
   */
  public static Pbkdf2Config forTesting() {
    return new Pbkdf2Config(1_000, DEFAULT_SALT_LENGTH, DEFAULT_HASH_LENGTH);
  }

  /**
   * Returns a new config identical to this one but using the given iteration count.
   */
  public Pbkdf2Config withIterations(int iterations) {
    return new Pbkdf2Config(iterations, saltLength, hashLength);
  }

  /**
   * Returns a new config identical to this one but using the given salt length.
   */
  public Pbkdf2Config withSaltLength(int saltLength) {
    return new Pbkdf2Config(iterations, saltLength, hashLength);
  }

  /**
   * Returns a new config identical to this one but using the given hash length.
   */
  public Pbkdf2Config withHashLength(int hashLength) {
    return new Pbkdf2Config(iterations, saltLength, hashLength);
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
  }
}
