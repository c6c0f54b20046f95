package com.codeheadsystems.cipherkit.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.cipherkit.engine.source.InputStreamSource;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class DigestsTest {

  private static final byte[] ABC = "abc".getBytes(StandardCharsets.UTF_8);

  static Stream<Arguments> abcVectors() {
    return Stream.of(
        Arguments.of(DigestAlgorithm.SHA256, "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad"),
        Arguments.of(DigestAlgorithm.SHA1, "a9993e364706816aba3e25717850c26c9cd0d89d"),
        Arguments.of(DigestAlgorithm.SHA3_256, "3a985da74fe225b2045c172d6bd390bd855f086e3e9d525b46bfe24511431532"),
        Arguments.of(DigestAlgorithm.BLAKE2B_256, "bddd813c634239723171ef3fee98579b94964e3bb1cb3e427262c8c068d52319")
    );
  }

  @ParameterizedTest
  @MethodSource("abcVectors")
  void digest_matchesKnownAnswer(DigestAlgorithm algorithm, String expectedHex) {
    assertThat(Hex.toHexString(Digests.digest(algorithm, ABC))).isEqualTo(expectedHex);
  }

  @ParameterizedTest
  @EnumSource(DigestAlgorithm.class)
  void digest_outputHasDeclaredSize(DigestAlgorithm algorithm) {
    assertThat(Digests.digest(algorithm, ABC)).hasSize(algorithm.digestSize());
  }

  @Test
  void digest_streamedInSmallChunksMatchesOneShot() {
    byte[] message = new byte[1000];
    for (int i = 0; i < message.length; i++) {
      message[i] = (byte) i;
    }
    byte[] streamed = Digests.digest(DigestAlgorithm.SHA512,
        new InputStreamSource(new ByteArrayInputStream(message), 7));

    assertThat(streamed).isEqualTo(Digests.digest(DigestAlgorithm.SHA512, message));
  }

  @Test
  void fromName_acceptsCommonSpellings() {
    assertThat(DigestAlgorithm.fromName("SHA-256")).isEqualTo(DigestAlgorithm.SHA256);
    assertThat(DigestAlgorithm.fromName("sha3_512")).isEqualTo(DigestAlgorithm.SHA3_512);
    assertThat(DigestAlgorithm.fromName("blake2b-512")).isEqualTo(DigestAlgorithm.BLAKE2B_512);
  }
}
