package com.codeheadsystems.pbkdf2.manager;

import com.codeheadsystems.pbkdf2.common.ByteUtils;
import com.codeheadsystems.pbkdf2.common.RandomProvider;
import com.codeheadsystems.pbkdf2.common.SensitiveBytes;
import com.codeheadsystems.pbkdf2.config.Pbkdf2Config;
import com.codeheadsystems.pbkdf2.exceptions.Pbkdf2OperationException;
import com.codeheadsystems.pbkdf2.internal.KeyDerivationFunction;
import com.codeheadsystems.pbkdf2.internal.Pbkdf2HmacSha256;
import com.codeheadsystems.pbkdf2.internal.RecordCodec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hashes secrets into {@code pbkdf2_sha256$<iterations>$<salt>$<hash>} records.
 * Stateless apart from its immutable collaborators, so one instance can serve all threads.
 */
@Singleton
public class Pbkdf2HashManager {

  private static final Logger log = LoggerFactory.getLogger(Pbkdf2HashManager.class);

  private final Pbkdf2Config config;
  private final RandomProvider randomProvider;
  private final KeyDerivationFunction kdf;

  /**
   * Instantiates a hash manager using the default configuration.
   */
  public Pbkdf2HashManager() {
    this(Pbkdf2Config.DEFAULT);
  }

  /**
   * Instantiates a hash manager with a {@link java.security.SecureRandom} salt source and the
   * BouncyCastle-backed PBKDF2-HMAC-SHA256.
   *
   * @param config parameters used by {@link #hash(String)}
   */
  @Inject
  public Pbkdf2HashManager(final Pbkdf2Config config) {
    this(config, new RandomProvider(), new Pbkdf2HmacSha256());
  }

  /**
   * Instantiates a hash manager with explicit collaborators.
   *
   * @param config         parameters used by {@link #hash(String)}
   * @param randomProvider salt source
   * @param kdf            key derivation primitive
   */
  public Pbkdf2HashManager(final Pbkdf2Config config,
                           final RandomProvider randomProvider,
                           final KeyDerivationFunction kdf) {
    log.info("Pbkdf2HashManager({}, {})", config, kdf.algorithm());
    this.config = config;
    this.randomProvider = randomProvider;
    this.kdf = kdf;
  }

  public Pbkdf2Config config() {
    return config;
  }

  /**
   * Hashes the secret with this manager's configuration.
   *
   * @param secret the secret, not blank
   * @return the record string
   * @throws IllegalArgumentException  if the secret is null or blank
   * @throws Pbkdf2OperationException if key derivation fails
   */
  public String hash(final String secret) {
    return hash(secret, config);
  }

  /**
   * Hashes the secret with explicit parameters.
   *
   * @param secret     the secret, not blank
   * @param iterations iteration count, positive
   * @param saltLength salt length in bytes, positive
   * @param hashLength derived key length in bytes, positive
   * @return the record string
   * @throws IllegalArgumentException  if the secret is blank or any parameter is not positive
   * @throws Pbkdf2OperationException if key derivation fails
   */
  public String hash(final String secret, final int iterations, final int saltLength, final int hashLength) {
    requireSecret(secret);
    return hash(secret, new Pbkdf2Config(iterations, saltLength, hashLength));
  }

  /**
   * Hashes the secret with the given configuration. The UTF-8 secret bytes, the derived key and
   * the salt are zeroed before this method returns or throws.
   *
   * @param secret the secret, not blank
   * @param config the parameters
   * @return the record string
   * @throws IllegalArgumentException  if the secret is null or blank
   * @throws Pbkdf2OperationException if key derivation fails
   */
  public String hash(final String secret, final Pbkdf2Config config) {
    requireSecret(secret);
    if (config == null) {
      throw new IllegalArgumentException("config must not be null");
    }
    log.trace("hash(iterations={}, saltLength={}, hashLength={})",
        config.iterations(), config.saltLength(), config.hashLength());
    final byte[] salt = new byte[config.saltLength()];
    try (SensitiveBytes password = SensitiveBytes.utf8(secret);
         SensitiveBytes derived = SensitiveBytes.allocate(config.hashLength())) {
      randomProvider.fill(salt);
      derive(password.bytes(), salt, config.iterations(), derived.bytes());
      return RecordCodec.encode(config.iterations(), salt, derived.bytes());
    } finally {
      ByteUtils.wipe(salt);
    }
  }

  private void derive(final byte[] password, final byte[] salt, final int iterations, final byte[] output) {
    try {
      kdf.derive(password, salt, iterations, output);
    } catch (Pbkdf2OperationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new Pbkdf2OperationException("Key derivation failed for " + kdf.algorithm(), e);
    }
  }

  private static void requireSecret(final String secret) {
    if (secret == null) {
      throw new IllegalArgumentException("secret must not be null");
    }
    if (secret.isBlank()) {
      throw new IllegalArgumentException("secret must not be empty or whitespace");
    }
  }
}
