package com.codeheadsystems.locker.crypto.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class VaultKeyTest {

  private static byte[] keyBytes() {
    byte[] bytes = new byte[VaultKey.LENGTH];
    Arrays.fill(bytes, (byte) 7);
    return bytes;
  }

  @Test
  void of_copiesInput() {
    byte[] raw = keyBytes();
    VaultKey key = VaultKey.of(raw);
    raw[0] = 0;
    assertThat(key.bytes()).isEqualTo(keyBytes());
  }

  @Test
  void of_wrongLength_throws() {
    assertThatThrownBy(() -> VaultKey.of(new byte[16])).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> VaultKey.of(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bytes_returnsIndependentCopy() {
    VaultKey key = VaultKey.of(keyBytes());
    byte[] copy = key.bytes();
    Arrays.fill(copy, (byte) 0);
    assertThat(key.bytes()).isEqualTo(keyBytes());
  }

  @Test
  void destroy_blocksLaterUseButNotEarlierCopies() {
    VaultKey key = VaultKey.of(keyBytes());
    byte[] inFlight = key.bytes();

    key.destroy();

    assertThat(key.isDestroyed()).isTrue();
    assertThat(inFlight).isEqualTo(keyBytes());
    assertThatThrownBy(key::bytes).isInstanceOf(IllegalStateException.class);
    assertThat(key.matches(keyBytes())).isFalse();
  }

  @Test
  void matches_comparesKeyBytes() {
    VaultKey key = VaultKey.of(keyBytes());
    assertThat(key.matches(keyBytes())).isTrue();
    assertThat(key.matches(new byte[VaultKey.LENGTH])).isFalse();
  }

  @Test
  void toString_doesNotLeakKey() {
    assertThat(VaultKey.of(keyBytes()).toString()).isEqualTo("VaultKey[redacted]");
  }
}
