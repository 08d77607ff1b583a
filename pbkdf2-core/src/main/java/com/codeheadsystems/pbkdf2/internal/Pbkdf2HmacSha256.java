package com.codeheadsystems.pbkdf2.internal;

import com.codeheadsystems.pbkdf2.common.ByteUtils;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Pack;

/**
 * PBKDF2 (RFC 8018 §5.2) with HMAC-SHA256 as the PRF.
 * <p>
 * Each block T_i = U_1 ^ U_2 ^ ... ^ U_c is accumulated in place inside the caller's output
 * array, so no key-sized intermediate array is allocated. The single U scratch block and the
 * MAC's copy of the password are zeroed before returning, and the MAC is re-keyed with an empty
 * key so its ipad/opad state no longer depends on the password.
 * <p>
 * Instances are stateless and thread-safe; a fresh {@link HMac} is created per call.
 */
public class Pbkdf2HmacSha256 implements KeyDerivationFunction {

  public static final String ALGORITHM = "pbkdf2_sha256";

  // SHA-256 output length (hLen)
  private static final int H_LEN = 32;

  private static final byte[] EMPTY_KEY = new byte[0];

  @Override
  public void derive(final byte[] password, final byte[] salt, final int iterations, final byte[] output) {
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be positive: " + iterations);
    }
    if (output.length == 0) {
      throw new IllegalArgumentException("output must not be empty");
    }
    final HMac hmac = newMac();
    final KeyParameter key = new KeyParameter(password);
    final byte[] u = new byte[H_LEN];
    final byte[] blockIndex = new byte[4];
    try {
      hmac.init(key);
      final int blocks = blockCount(output.length);
      for (int i = 1; i <= blocks; i++) {
        final int offset = (i - 1) * H_LEN;
        final int len = Math.min(H_LEN, output.length - offset);

        // U_1 = PRF(P, S || INT(i))
        Pack.intToBigEndian(i, blockIndex, 0);
        hmac.update(salt, 0, salt.length);
        hmac.update(blockIndex, 0, blockIndex.length);
        hmac.doFinal(u, 0);
        System.arraycopy(u, 0, output, offset, len);

        // U_j = PRF(P, U_{j-1})
        for (int j = 1; j < iterations; j++) {
          hmac.update(u, 0, H_LEN);
          hmac.doFinal(u, 0);
          for (int k = 0; k < len; k++) {
            output[offset + k] ^= u[k];
          }
        }
      }
    } finally {
      ByteUtils.wipe(u, key.getKey());
      // reset() alone leaves password ^ ipad/opad in the pads
      hmac.init(new KeyParameter(EMPTY_KEY));
      hmac.reset();
    }
  }

  HMac newMac() {
    return new HMac(new SHA256Digest());
  }

  static int blockCount(final int outputLength) {
    return (int) ((outputLength + (long) H_LEN - 1) / H_LEN);
  }

  @Override
  public String algorithm() {
    return ALGORITHM;
  }
}
