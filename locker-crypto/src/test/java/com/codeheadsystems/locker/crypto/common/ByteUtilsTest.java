package com.codeheadsystems.locker.crypto.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  @Test
  void concat_joinsInOrder() {
    byte[] result = ByteUtils.concat(new byte[]{1}, new byte[0], new byte[]{2, 3});
    assertThat(result).containsExactly(1, 2, 3);
  }

  @Test
  void slice_copiesRange() {
    byte[] source = {0, 1, 2, 3, 4};
    assertThat(ByteUtils.slice(source, 1, 3)).containsExactly(1, 2, 3);
    assertThat(ByteUtils.tail(source, 3)).containsExactly(3, 4);
    assertThat(ByteUtils.tail(source, 5)).isEmpty();
  }

  @Test
  void slice_outOfRange_throws() {
    byte[] source = {0, 1, 2};
    assertThatThrownBy(() -> ByteUtils.slice(source, 2, 2))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ByteUtils.slice(source, -1, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void wipe_zeroesAndIgnoresNull() {
    byte[] secret = {9, 9, 9};
    ByteUtils.wipe(secret);
    ByteUtils.wipe(null);
    assertThat(secret).containsOnly(0);
  }
}
