package com.codeheadsystems.pbkdf2.model;

import com.codeheadsystems.pbkdf2.common.ByteUtils;
import com.codeheadsystems.pbkdf2.internal.RecordCodec;
import java.util.Arrays;

/**
 * A decoded {@code pbkdf2_sha256$<iterations>$<salt>$<hash>} record.
 * <p>
 * Owns its arrays: {@link #close()} zero-fills both salt and hash, so decoded records should be
 * used in try-with-resources. Equality compares array contents, not array identity.
 *
 * @param iterations the PBKDF2 iteration count
 * @param salt       the decoded salt
 * @param hash       the decoded derived key
 */
public record Pbkdf2Record(int iterations, byte[] salt, byte[] hash) implements AutoCloseable {

  /**
   * Re-encodes this record in its canonical text form.
   *
   * @return the record string
   */
  public String encode() {
    return RecordCodec.encode(iterations, salt, hash);
  }

  @Override
  public void close() {
    ByteUtils.wipe(salt, hash);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Pbkdf2Record other)) {
      return false;
    }
    return iterations == other.iterations
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(hash, other.hash);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(iterations);
    result = 31 * result + Arrays.hashCode(salt);
    result = 31 * result + Arrays.hashCode(hash);
    return result;
  }

  @Override
  public String toString() {
    return "Pbkdf2Record[iterations=" + iterations + ", saltLength=" + salt.length
        + ", hashLength=" + hash.length + "]";
  }
}
