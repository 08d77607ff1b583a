package com.codeheadsystems.pbkdf2.internal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class Pbkdf2HmacSha256Test {

  private final Pbkdf2HmacSha256 kdf = new Pbkdf2HmacSha256();

  private byte[] derive(byte[] password, byte[] salt, int iterations, int length) {
    byte[] out = new byte[length];
    kdf.derive(password, salt, iterations, out);
    return out;
  }

  private static byte[] bouncyCastle(byte[] password, byte[] salt, int iterations, int length) {
    PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
    gen.init(password, salt, iterations);
    return ((KeyParameter) gen.generateDerivedParameters(length * 8)).getKey();
  }

  // ─── Known answers ────────────────────────────────────────────────────────

  @Test
  void publishedVector_passwdSaltOneIteration() {
    // PBKDF2-HMAC-SHA256 vector from RFC 7914 §11
    byte[] expected = Hex.decode(
        "55ac046e56e3089fec1691c22544b605f94185216dde0465e68b9d57c20dacbc"
            + "49ca9cccf179b645991664b39d77ef317c71b845b1e30bd509112041d3a19783");
    byte[] actual = derive(
        "passwd".getBytes(StandardCharsets.US_ASCII),
        "salt".getBytes(StandardCharsets.US_ASCII), 1, 64);
    assertThat(actual).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({
      "password, salt, 1, 32",
      "password, salt, 2, 32",
      "password, salt, 4096, 20",
      "passwordPASSWORDpassword, saltSALTsaltSALTsaltSALTsaltSALTsalt, 4096, 40",
      "correct horse battery staple, NaCl, 1000, 48"
  })
  void matchesJcaProvider(String password, String salt, int iterations, int length) throws Exception {
    SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
    PBEKeySpec spec = new PBEKeySpec(password.toCharArray(),
        salt.getBytes(StandardCharsets.US_ASCII), iterations, length * 8);
    byte[] expected = factory.generateSecret(spec).getEncoded();
    spec.clearPassword();

    byte[] actual = derive(password.getBytes(StandardCharsets.US_ASCII),
        salt.getBytes(StandardCharsets.US_ASCII), iterations, length);
    assertThat(actual).isEqualTo(expected);
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 16, 31, 32, 33, 63, 64, 65, 100})
  void matchesBouncyCastleGeneratorForAllBlockBoundaries(int length) {
    byte[] password = "pässwörd 🚀".getBytes(StandardCharsets.UTF_8);
    byte[] salt = Hex.decode("000102030405060708090a0b0c0d0e0f");
    assertThat(derive(password, salt, 50, length)).isEqualTo(bouncyCastle(password, salt, 50, length));
  }

  @Test
  void longPasswordIsHashedFirstLikeHmacRequires() {
    byte[] password = new byte[10_000];
    Arrays.fill(password, (byte) 'x');
    byte[] salt = {1, 2, 3, 4, 5, 6, 7, 8};
    assertThat(derive(password, salt, 10, 32)).isEqualTo(bouncyCastle(password, salt, 10, 32));
  }

  // ─── Properties ───────────────────────────────────────────────────────────

  @Test
  void shorterOutputIsPrefixOfLongerOutput() {
    byte[] password = "password".getBytes(StandardCharsets.UTF_8);
    byte[] salt = "salt".getBytes(StandardCharsets.UTF_8);
    byte[] full = derive(password, salt, 100, 48);
    byte[] prefix = derive(password, salt, 100, 20);
    assertThat(Arrays.copyOf(full, 20)).isEqualTo(prefix);
  }

  @Test
  void differentIterationsGiveDifferentKeys() {
    byte[] password = "password".getBytes(StandardCharsets.UTF_8);
    byte[] salt = "salt".getBytes(StandardCharsets.UTF_8);
    assertThat(derive(password, salt, 1000, 32)).isNotEqualTo(derive(password, salt, 1001, 32));
  }

  @Test
  void doesNotMutateInputs() {
    byte[] password = {1, 2, 3};
    byte[] salt = {4, 5, 6};
    derive(password, salt, 3, 32);
    assertThat(password).isEqualTo(new byte[]{1, 2, 3});
    assertThat(salt).isEqualTo(new byte[]{4, 5, 6});
  }

  @Test
  void outputIsOverwrittenNotAccumulated() {
    byte[] password = "password".getBytes(StandardCharsets.UTF_8);
    byte[] salt = "salt".getBytes(StandardCharsets.UTF_8);
    byte[] dirty = new byte[32];
    Arrays.fill(dirty, (byte) 0x77);
    kdf.derive(password, salt, 5, dirty);
    assertThat(dirty).isEqualTo(derive(password, salt, 5, 32));
  }

  // ─── Key residue ──────────────────────────────────────────────────────────

  /**
   * Keeps a handle on the MAC used by the last derive call so its state can be inspected.
   */
  private static final class CapturingKdf extends Pbkdf2HmacSha256 {
    private HMac mac;

    @Override
    HMac newMac() {
      mac = super.newMac();
      return mac;
    }
  }

  private static byte[] macOf(HMac mac, byte[] data) {
    byte[] out = new byte[mac.getMacSize()];
    mac.update(data, 0, data.length);
    mac.doFinal(out, 0);
    return out;
  }

  @Test
  void macIsRekeyedWithEmptyKeyAfterDerive() {
    CapturingKdf capturing = new CapturingKdf();
    byte[] password = "hunter2".getBytes(StandardCharsets.UTF_8);
    capturing.derive(password, "salt".getBytes(StandardCharsets.UTF_8), 3, new byte[32]);

    HMac emptyKeyed = new HMac(new SHA256Digest());
    emptyKeyed.init(new KeyParameter(new byte[0]));
    HMac passwordKeyed = new HMac(new SHA256Digest());
    passwordKeyed.init(new KeyParameter(password));
    byte[] data = {9, 8, 7};

    byte[] leftover = macOf(capturing.mac, data);
    assertThat(leftover).isEqualTo(macOf(emptyKeyed, data));
    assertThat(leftover).isNotEqualTo(macOf(passwordKeyed, data));
  }

  @Test
  void macPadsHoldNoPasswordBytesAfterDerive() throws Exception {
    CapturingKdf capturing = new CapturingKdf();
    byte[] password = "hunter2".getBytes(StandardCharsets.UTF_8);
    capturing.derive(password, "salt".getBytes(StandardCharsets.UTF_8), 2, new byte[32]);

    Field inputPadField = HMac.class.getDeclaredField("inputPad");
    inputPadField.setAccessible(true);
    byte[] inputPad = (byte[]) inputPadField.get(capturing.mac);
    assertThat(inputPad).containsOnly((byte) 0x36);
  }

  @Test
  void macIsRekeyedEvenWhenDeriveFails() {
    CapturingKdf capturing = new CapturingKdf();
    byte[] password = "hunter2".getBytes(StandardCharsets.UTF_8);
    assertThatThrownBy(() -> capturing.derive(password, null, 2, new byte[32]))
        .isInstanceOf(NullPointerException.class);

    HMac emptyKeyed = new HMac(new SHA256Digest());
    emptyKeyed.init(new KeyParameter(new byte[0]));
    byte[] data = {1};
    assertThat(macOf(capturing.mac, data)).isEqualTo(macOf(emptyKeyed, data));
  }

  // ─── Block count ──────────────────────────────────────────────────────────

  @ParameterizedTest
  @CsvSource({
      "1, 1",
      "32, 1",
      "33, 2",
      "64, 2",
      "2147483616, 67108863",
      "2147483647, 67108864"
  })
  void blockCountRoundsUpWithoutOverflow(int outputLength, int expected) {
    assertThat(Pbkdf2HmacSha256.blockCount(outputLength)).isEqualTo(expected);
  }

  // ─── Argument checks ──────────────────────────────────────────────────────

  @Test
  void zeroIterationsThrows() {
    assertThatThrownBy(() -> kdf.derive(new byte[]{1}, new byte[]{1}, 0, new byte[32]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("iterations");
  }

  @Test
  void emptyOutputThrows() {
    assertThatThrownBy(() -> kdf.derive(new byte[]{1}, new byte[]{1}, 1, new byte[0]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("output");
  }

  @Test
  void algorithmNameMatchesRecordTag() {
    assertThat(kdf.algorithm()).isEqualTo("pbkdf2_sha256");
  }
}
