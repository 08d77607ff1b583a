package com.codeheadsystems.pbkdf2.manager;

import com.codeheadsystems.pbkdf2.common.ByteUtils;
import com.codeheadsystems.pbkdf2.common.SensitiveBytes;
import com.codeheadsystems.pbkdf2.internal.KeyDerivationFunction;
import com.codeheadsystems.pbkdf2.internal.Pbkdf2HmacSha256;
import com.codeheadsystems.pbkdf2.internal.RecordCodec;
import com.codeheadsystems.pbkdf2.model.Pbkdf2Record;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies secrets against {@code pbkdf2_sha256} records.
 * <p>
 * {@link #verify(String, String)} never throws. A malformed record, a wrong secret and a failing
 * key derivation backend all produce {@code false}.
 */
@Singleton
public class Pbkdf2VerifyManager {

  private static final Logger log = LoggerFactory.getLogger(Pbkdf2VerifyManager.class);

  private final KeyDerivationFunction kdf;

  /**
   * Instantiates a verify manager backed by BouncyCastle PBKDF2-HMAC-SHA256.
   */
  @Inject
  public Pbkdf2VerifyManager() {
    this(new Pbkdf2HmacSha256());
  }

  /**
   * Instantiates a verify manager with the given key derivation primitive.
   *
   * @param kdf the kdf
   */
  public Pbkdf2VerifyManager(final KeyDerivationFunction kdf) {
    log.info("Pbkdf2VerifyManager({})", kdf.algorithm());
    this.kdf = kdf;
  }

  /**
   * Checks the secret against the record. The cost is governed by the iteration count stored in
   * the record. The candidate key, the decoded record and the UTF-8 secret bytes are zeroed
   * before returning.
   *
   * @param secret the secret
   * @param record the record text
   * @return true only if the record is well formed and was produced from this secret
   */
  public boolean verify(final String secret, final String record) {
    if (secret == null || secret.isBlank()) {
      log.debug("verify: blank secret");
      return false;
    }
    final Optional<Pbkdf2Record> decoded = RecordCodec.decode(record);
    if (decoded.isEmpty()) {
      return false;
    }
    try (Pbkdf2Record parsed = decoded.get();
         SensitiveBytes password = SensitiveBytes.utf8(secret);
         SensitiveBytes candidate = SensitiveBytes.allocate(parsed.hash().length)) {
      log.trace("verify(iterations={}, hashLength={})", parsed.iterations(), parsed.hash().length);
      kdf.derive(password.bytes(), parsed.salt(), parsed.iterations(), candidate.bytes());
      return ByteUtils.constantTimeEquals(parsed.hash(), candidate.bytes());
    } catch (RuntimeException e) {
      log.warn("verify: key derivation failed for {}, treating as mismatch", kdf.algorithm(), e);
      return false;
    }
  }
}
