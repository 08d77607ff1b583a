package com.codeheadsystems.pbkdf2;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;
import org.junit.jupiter.api.Test;

class Pbkdf2HashingUtilTest {

  @Test
  void hash_usesDefaults() {
    String record = Pbkdf2HashingUtil.hash("password");
    String[] parts = record.split("\\$", -1);

    assertThat(parts).hasSize(4);
    assertThat(parts[0]).isEqualTo("pbkdf2_sha256");
    assertThat(parts[1]).isEqualTo(String.valueOf(Pbkdf2HashingUtil.DEFAULT_ITERATIONS)).matches("^\\d+$");
    assertThat(Base64.getDecoder().decode(parts[2])).hasSize(Pbkdf2HashingUtil.DEFAULT_SALT_BYTES);
    assertThat(Base64.getDecoder().decode(parts[3])).hasSize(Pbkdf2HashingUtil.DEFAULT_HASH_BYTES);
    assertThat(Pbkdf2HashingUtil.verify("password", record)).isTrue();
    assertThat(Pbkdf2HashingUtil.verify("passw0rd", record)).isFalse();
  }

  @Test
  void hash_customParameters() {
    String record = Pbkdf2HashingUtil.hash("password", 123_456, 24, 48);
    String[] parts = record.split("\\$", -1);

    assertThat(parts[1]).isEqualTo("123456");
    assertThat(Base64.getDecoder().decode(parts[2])).hasSize(24);
    assertThat(Base64.getDecoder().decode(parts[3])).hasSize(48);
    assertThat(Pbkdf2HashingUtil.verify("password", record)).isTrue();
  }

  @Test
  void hash_rejectsBlankSecret() {
    assertThatThrownBy(() -> Pbkdf2HashingUtil.hash(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Pbkdf2HashingUtil.hash("")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Pbkdf2HashingUtil.hash("   ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void verify_neverThrows() {
    assertThat(Pbkdf2HashingUtil.verify(null, null)).isFalse();
    assertThat(Pbkdf2HashingUtil.verify("password", "pbkdf2_sha256$NaN$AAAA$BBBB")).isFalse();
  }
}
