package com.codeheadsystems.cipherkit.engine.bc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherkit.engine.BlockCipherAlgorithm;
import com.codeheadsystems.cipherkit.engine.Digest;
import com.codeheadsystems.cipherkit.engine.DigestAlgorithm;
import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.Mac;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;
import com.codeheadsystems.cipherkit.engine.RawBlockCipher;
import com.codeheadsystems.cipherkit.engine.RawStreamCipher;
import com.codeheadsystems.cipherkit.engine.StreamCipherAlgorithm;
import com.codeheadsystems.cipherkit.exception.EngineNotInitializedException;
import com.codeheadsystems.cipherkit.exception.InvalidKeyMaterialException;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class BouncyCastleEngineProviderTest {

  private static final byte[] AES_KEY = Hex.decode("2b7e151628aed2a6abf7158809cf4f3c");
  private final BouncyCastleEngineProvider provider = BouncyCastleEngineProvider.INSTANCE;

  // ─── Digest ───────────────────────────────────────────────────────────────

  @Test
  void digest_isConsumedUntilReset() {
    Digest digest = provider.digest(DigestAlgorithm.SHA256);
    digest.update("ab".getBytes(StandardCharsets.UTF_8));
    digest.update((byte) 'c');
    byte[] first = digest.digest();

    assertThatThrownBy(() -> digest.update(new byte[1])).isInstanceOf(EngineNotInitializedException.class);
    assertThatThrownBy(digest::digest).isInstanceOf(EngineNotInitializedException.class);

    digest.reset();
    digest.update("abc".getBytes(StandardCharsets.UTF_8));
    assertThat(digest.digest()).isEqualTo(first);
  }

  // ─── Mac ──────────────────────────────────────────────────────────────────

  @Test
  void mac_usedBeforeInitFails() {
    Mac mac = provider.mac(MacAlgorithm.HMAC_SHA256);

    assertThatThrownBy(() -> mac.update(new byte[1])).isInstanceOf(EngineNotInitializedException.class);
    assertThatThrownBy(mac::reset).isInstanceOf(EngineNotInitializedException.class);
  }

  @Test
  void mac_resetKeepsKey() {
    Mac mac = provider.mac(MacAlgorithm.HMAC_SHA256);
    mac.init("key".getBytes(StandardCharsets.UTF_8));
    mac.update(new byte[]{1, 2, 3});
    byte[] first = mac.doFinal();

    assertThatThrownBy(() -> mac.update(new byte[1])).isInstanceOf(EngineNotInitializedException.class);

    mac.reset();
    mac.update(new byte[]{1, 2, 3});
    assertThat(mac.doFinal()).isEqualTo(first);
  }

  @Test
  void mac_hmacRejectsNonce() {
    Mac mac = provider.mac(MacAlgorithm.HMAC_SHA1);

    assertThatThrownBy(() -> mac.init(new byte[16], new byte[16]))
        .isInstanceOf(InvalidKeyMaterialException.class);
  }

  @ParameterizedTest
  @EnumSource(MacAlgorithm.class)
  void mac_tagHasDeclaredSize(MacAlgorithm algorithm) {
    Mac mac = provider.mac(algorithm);
    byte[] key = new byte[algorithm.kind() == MacAlgorithm.Kind.CMAC ? 16 : 32];
    mac.init(key, algorithm.requiresIv() ? new byte[16] : null);
    mac.update(new byte[40]);

    assertThat(mac.doFinal()).hasSize(algorithm.macSize());
  }

  // ─── Raw ciphers ──────────────────────────────────────────────────────────

  @Test
  void blockCipher_matchesFips197Example() {
    RawBlockCipher aes = provider.blockCipher(BlockCipherAlgorithm.AES);
    aes.init(Direction.ENCRYPT, AES_KEY);

    byte[] ciphertext = aes.processBlock(Hex.decode("6bc1bee22e409f96e93d7e117393172a"));

    assertThat(Hex.toHexString(ciphertext)).isEqualTo("3ad77bb40d7a3660a89ecaf32466ef97");
    aes.init(Direction.DECRYPT, AES_KEY);
    assertThat(Hex.toHexString(aes.processBlock(ciphertext))).isEqualTo("6bc1bee22e409f96e93d7e117393172a");
  }

  @Test
  void blockCipher_lifecycleAndBounds() {
    RawBlockCipher twofish = provider.blockCipher(BlockCipherAlgorithm.TWOFISH);

    assertThatThrownBy(() -> twofish.processBlock(new byte[16])).isInstanceOf(EngineNotInitializedException.class);
    assertThatThrownBy(() -> twofish.init(Direction.ENCRYPT, new byte[20]))
        .isInstanceOf(InvalidKeyMaterialException.class);

    twofish.init(Direction.ENCRYPT, new byte[32]);
    assertThatThrownBy(() -> twofish.processBlock(new byte[15])).isInstanceOf(IllegalArgumentException.class);

    twofish.reset();
    assertThatThrownBy(() -> twofish.processBlock(new byte[16])).isInstanceOf(EngineNotInitializedException.class);
  }

  @Test
  void streamCipher_chacha20StartsAtBlockZero() {
    RawStreamCipher chacha = provider.streamCipher(StreamCipherAlgorithm.CHACHA20);
    chacha.init(Direction.ENCRYPT, range(0, 32), range(0, 12));

    byte[] ciphertext = chacha.processBytes("Hello World.".getBytes(StandardCharsets.UTF_8));

    assertThat(Hex.toHexString(ciphertext)).isEqualTo("585f9d7daeab03f24b48eb9e");
  }

  @Test
  void streamCipher_validatesNonceLength() {
    RawStreamCipher salsa = provider.streamCipher(StreamCipherAlgorithm.SALSA20);

    assertThatThrownBy(() -> salsa.init(Direction.ENCRYPT, new byte[32], new byte[12]))
        .isInstanceOf(InvalidKeyMaterialException.class);
    assertThatThrownBy(() -> salsa.processBytes(new byte[4])).isInstanceOf(EngineNotInitializedException.class);
  }

  private static byte[] range(int from, int to) {
    byte[] out = new byte[to - from];
    for (int i = 0; i < out.length; i++) {
      out[i] = (byte) (from + i);
    }
    return out;
  }
}
