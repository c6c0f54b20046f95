package com.codeheadsystems.cipherkit.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  @Test
  void i2osp_encodesBigEndian() {
    assertThat(ByteUtils.I2OSP(1, 4)).isEqualTo(Hex.decode("00000001"));
    assertThat(ByteUtils.I2OSP(0x0102, 2)).isEqualTo(Hex.decode("0102"));
    assertThat(ByteUtils.I2OSP(0xFFFFFFFFL, 4)).isEqualTo(Hex.decode("ffffffff"));
  }

  @Test
  void i2osp_rejectsValuesThatDoNotFit() {
    assertThatThrownBy(() -> ByteUtils.I2OSP(256, 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ByteUtils.I2OSP(-1, 4)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void concat_treatsNullAsEmpty() {
    assertThat(ByteUtils.concat(new byte[]{1}, null, new byte[]{2, 3})).containsExactly(1, 2, 3);
    assertThat(ByteUtils.concat()).isEmpty();
  }

  @Test
  void slice_copiesRange() {
    assertThat(ByteUtils.slice(new byte[]{1, 2, 3, 4}, 1, 3)).containsExactly(2, 3);
    assertThatThrownBy(() -> ByteUtils.slice(new byte[2], 1, 3)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void xor_requiresEqualLengths() {
    assertThat(ByteUtils.xor(new byte[]{0x0F, 0x00}, new byte[]{0x01, 0x10})).containsExactly(0x0E, 0x10);
    assertThatThrownBy(() -> ByteUtils.xor(new byte[1], new byte[2])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constantTimeEquals_comparesContent() {
    assertThat(ByteUtils.constantTimeEquals(new byte[]{1, 2}, new byte[]{1, 2})).isTrue();
    assertThat(ByteUtils.constantTimeEquals(new byte[]{1, 2}, new byte[]{1, 3})).isFalse();
    assertThat(ByteUtils.constantTimeEquals(new byte[]{1, 2}, new byte[]{1})).isFalse();
  }

  @Test
  void copyOrEmpty_copiesAndReplacesNull() {
    byte[] original = {1, 2};
    byte[] copy = ByteUtils.copyOrEmpty(original);
    original[0] = 9;

    assertThat(copy).containsExactly(1, 2);
    assertThat(ByteUtils.copyOrEmpty(null)).isEmpty();
  }
}
