package com.codeheadsystems.cipherkit.padding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherkit.exception.InvalidPaddingException;
import java.util.Arrays;
import java.util.stream.IntStream;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class PaddingTest {

  private static final int BLOCK = 16;

  static IntStream offsets() {
    return IntStream.range(0, BLOCK);
  }

  private static byte[] content() {
    byte[] block = new byte[BLOCK];
    for (int i = 0; i < BLOCK; i++) {
      block[i] = (byte) (0x41 + i);
    }
    return block;
  }

  // ─── PKCS7 ────────────────────────────────────────────────────────────────

  @ParameterizedTest
  @MethodSource("offsets")
  void pkcs7_unpadInvertsPad(int offset) {
    byte[] block = content();
    byte[] padded = Padding.pad(block, offset, PaddingScheme.PKCS7);

    assertThat(Padding.unpad(padded, PaddingScheme.PKCS7)).isEqualTo(Arrays.copyOf(block, offset));
    assertThat(Padding.unpad(padded, offset, PaddingScheme.PKCS7)).isEqualTo(Arrays.copyOf(block, offset));
    assertThat(Padding.count(padded, PaddingScheme.PKCS7)).isEqualTo(BLOCK - offset);
  }

  @Test
  void pkcs7_writesPadLengthIntoEveryByte() {
    byte[] padded = Padding.pad(content(), 7, PaddingScheme.PKCS7);

    assertThat(Hex.toHexString(padded)).isEqualTo("41424344454647090909090909090909");
  }

  @Test
  void pkcs7_corruptPaddingIsRejected() {
    byte[] padded = Padding.pad(content(), 12, PaddingScheme.PKCS7);
    padded[13] = 0x05;

    assertThatThrownBy(() -> Padding.count(padded, PaddingScheme.PKCS7))
        .isInstanceOf(InvalidPaddingException.class);
  }

  @Test
  void pkcs7_zeroAndOversizedCountsAreRejected() {
    byte[] zero = new byte[BLOCK];
    byte[] tooBig = content();
    tooBig[BLOCK - 1] = 17;

    assertThatThrownBy(() -> Padding.count(zero, PaddingScheme.PKCS7)).isInstanceOf(InvalidPaddingException.class);
    assertThatThrownBy(() -> Padding.count(tooBig, PaddingScheme.PKCS7)).isInstanceOf(InvalidPaddingException.class);
  }

  // ─── ZeroByte / TBC ───────────────────────────────────────────────────────

  @Test
  void zeroByte_countIncludesTrailingZeroContent() {
    byte[] block = content();
    block[5] = 0;
    byte[] padded = Padding.pad(block, 6, PaddingScheme.ZERO_BYTE);

    assertThat(Padding.count(padded, PaddingScheme.ZERO_BYTE)).isEqualTo(BLOCK - 5);
    assertThat(Padding.unpad(padded, 6, PaddingScheme.ZERO_BYTE)).isEqualTo(Arrays.copyOf(block, 6));
  }

  @Test
  void tbc_complementsLastContentBit() {
    byte[] even = content();
    even[3] = 0x02;
    byte[] odd = content();
    odd[3] = 0x03;

    assertThat(Arrays.copyOfRange(Padding.pad(even, 4, PaddingScheme.TBC), 4, BLOCK)).containsOnly((byte) 0xFF);
    assertThat(Arrays.copyOfRange(Padding.pad(odd, 4, PaddingScheme.TBC), 4, BLOCK)).containsOnly((byte) 0x00);
    assertThat(Padding.count(Padding.pad(even, 4, PaddingScheme.TBC), PaddingScheme.TBC)).isEqualTo(BLOCK - 4);
  }

  @ParameterizedTest
  @MethodSource("offsets")
  void tbc_unpadWithOffsetInvertsPad(int offset) {
    byte[] block = content();
    byte[] padded = Padding.pad(block, offset, PaddingScheme.TBC);

    assertThat(Padding.unpad(padded, offset, PaddingScheme.TBC)).isEqualTo(Arrays.copyOf(block, offset));
  }

  @ParameterizedTest
  @EnumSource(PaddingScheme.class)
  void unpad_wrongOffsetIsRejected(PaddingScheme scheme) {
    byte[] padded = Padding.pad(content(), 8, scheme);

    assertThatThrownBy(() -> Padding.unpad(padded, 4, scheme)).isInstanceOf(InvalidPaddingException.class);
  }

  // ─── Ownership ────────────────────────────────────────────────────────────

  @Test
  void padInPlace_mutatesAndReturnsSameBuffer() {
    byte[] block = content();

    byte[] result = Padding.padInPlace(block, 10, PaddingScheme.PKCS7);

    assertThat(result).isSameAs(block);
    assertThat(block[15]).isEqualTo((byte) 6);
  }

  @Test
  void pad_leavesInputUntouched() {
    byte[] block = content();

    byte[] result = Padding.pad(block, 10, PaddingScheme.ZERO_BYTE);

    assertThat(result).isNotSameAs(block);
    assertThat(block).isEqualTo(content());
  }

  @Test
  void offsetOutsideBlockIsRejected() {
    assertThatThrownBy(() -> Padding.pad(new byte[BLOCK], BLOCK + 1, PaddingScheme.PKCS7))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ─── Messages ─────────────────────────────────────────────────────────────

  @Test
  void padMessage_alignedMessageGetsFullBlock() {
    byte[] padded = Padding.padMessage(new byte[32], BLOCK, PaddingScheme.PKCS7);

    assertThat(padded).hasSize(48);
    assertThat(Padding.unpadMessage(padded, BLOCK, PaddingScheme.PKCS7)).hasSize(32);
  }

  @Test
  void padMessage_zeroByteLeavesAlignedMessageAlone() {
    assertThat(Padding.padMessage(new byte[32], BLOCK, PaddingScheme.ZERO_BYTE)).hasSize(32);
  }

  @Test
  void unpadMessage_rejectsMisalignedInput() {
    assertThatThrownBy(() -> Padding.unpadMessage(new byte[17], BLOCK, PaddingScheme.PKCS7))
        .isInstanceOf(InvalidPaddingException.class);
    assertThatThrownBy(() -> Padding.unpadMessage(new byte[0], BLOCK, PaddingScheme.PKCS7))
        .isInstanceOf(InvalidPaddingException.class);
  }

  // ─── Large blocks ─────────────────────────────────────────────────────────

  @ParameterizedTest
  @MethodSource("largePadLengths")
  void pkcs7_countsPadLengthsAbove127(int padLength) {
    byte[] padded = Padding.pad(new byte[200], 200 - padLength, PaddingScheme.PKCS7);

    assertThat(Padding.count(padded, PaddingScheme.PKCS7)).isEqualTo(padLength);
    assertThat(Padding.unpad(padded, PaddingScheme.PKCS7)).hasSize(200 - padLength);
    assertThat(Padding.unpad(padded, 200 - padLength, PaddingScheme.PKCS7)).hasSize(200 - padLength);
  }

  static IntStream largePadLengths() {
    return IntStream.of(128, 129, 200);
  }

  @Test
  void pkcs7_messageWithLargeBlockSizeRoundTrips() {
    byte[] message = new byte[10];
    byte[] padded = Padding.padMessage(message, 200, PaddingScheme.PKCS7);

    assertThat(padded).hasSize(200);
    assertThat(padded[199] & 0xFF).isEqualTo(190);
    assertThat(Padding.unpadMessage(padded, 200, PaddingScheme.PKCS7)).isEqualTo(message);
  }

  @Test
  void pkcs7_largeBlockWithCorruptPaddingFails() {
    byte[] padded = Padding.pad(new byte[200], 0, PaddingScheme.PKCS7);
    padded[50] = (byte) 0xC9;

    assertThatThrownBy(() -> Padding.count(padded, PaddingScheme.PKCS7))
        .isInstanceOf(InvalidPaddingException.class);
  }

  @Test
  void pkcs7_padLongerThan255IsRejected() {
    assertThatThrownBy(() -> Padding.pad(new byte[256], 0, PaddingScheme.PKCS7))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(Padding.pad(new byte[256], 1, PaddingScheme.PKCS7)[255] & 0xFF).isEqualTo(255);
  }
}
