package com.codeheadsystems.pbkdf2;

import com.codeheadsystems.pbkdf2.config.Pbkdf2Config;
import com.codeheadsystems.pbkdf2.manager.Pbkdf2HashManager;
import com.codeheadsystems.pbkdf2.manager.Pbkdf2VerifyManager;

/**
 * Static entry points for hashing and verifying PBKDF2-HMAC-SHA256 records with the default
 * parameters. Backed by shared, thread-safe managers.
 * <p>
 * Records look like {@code pbkdf2_sha256$300000$<saltB64>$<hashB64>}.
 */
public class Pbkdf2HashingUtil {

  public static final int DEFAULT_ITERATIONS = Pbkdf2Config.DEFAULT_ITERATIONS;
  public static final int DEFAULT_SALT_BYTES = Pbkdf2Config.DEFAULT_SALT_LENGTH;
  public static final int DEFAULT_HASH_BYTES = Pbkdf2Config.DEFAULT_HASH_LENGTH;

  private static final Pbkdf2HashManager HASH_MANAGER = new Pbkdf2HashManager(Pbkdf2Config.DEFAULT);
  private static final Pbkdf2VerifyManager VERIFY_MANAGER = new Pbkdf2VerifyManager();

  private Pbkdf2HashingUtil() {
  }

  /**
   * Hashes a secret with 300000 iterations, a 16 byte salt and a 32 byte hash.
   *
   * @param secret the secret, not blank
   * @return the record
   */
  public static String hash(String secret) {
    return HASH_MANAGER.hash(secret);
  }

  /**
   * Hashes a secret with explicit parameters.
   *
   * @param secret     the secret, not blank
   * @param iterations the iterations
   * @param saltBytes  the salt length
   * @param hashBytes  the hash length
   * @return the record
   */
  public static String hash(String secret, int iterations, int saltBytes, int hashBytes) {
    return HASH_MANAGER.hash(secret, iterations, saltBytes, hashBytes);
  }

  /**
   * Verifies a secret against a record. Never throws.
   *
   * @param secret the secret
   * @param record the record
   * @return true if the secret matches
   */
  public static boolean verify(String secret, String record) {
    return VERIFY_MANAGER.verify(secret, record);
  }
}
