package com.codeheadsystems.cipherkit.cipher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherkit.config.CipherKitConfig;
import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.exception.EngineNotInitializedException;
import com.codeheadsystems.cipherkit.exception.InvalidKeyMaterialException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class CipherEngineLifecycleTest {

  private static byte[] keyFor(CipherAlgorithm algorithm) {
    return new byte[algorithm.keySizes()[0]];
  }

  private static byte[] ivFor(CipherAlgorithm algorithm) {
    return new byte[algorithm.ivSize()];
  }

  @ParameterizedTest
  @EnumSource(CipherAlgorithm.class)
  void processingBeforeInitFails(CipherAlgorithm algorithm) {
    CipherEngine engine = CipherEngines.create(algorithm);

    assertThat(engine.isInitialized()).isFalse();
    assertThatThrownBy(() -> engine.processBytes(new byte[16]))
        .isInstanceOf(EngineNotInitializedException.class);
  }

  @ParameterizedTest
  @EnumSource(CipherAlgorithm.class)
  void resetReturnsToUninitialized(CipherAlgorithm algorithm) {
    CipherEngine engine = CipherEngines.create(algorithm);
    engine.init(Direction.ENCRYPT, keyFor(algorithm), ivFor(algorithm));
    assertThat(engine.isInitialized()).isTrue();

    engine.reset();

    assertThat(engine.isInitialized()).isFalse();
    assertThatThrownBy(() -> engine.processBytes(new byte[16]))
        .isInstanceOf(EngineNotInitializedException.class);
  }

  @ParameterizedTest
  @EnumSource(value = CipherMode.class, names = {"CTR", "OFB", "STREAM"})
  void reinitRestartsTheKeystream(CipherMode mode) {
    for (CipherAlgorithm algorithm : CipherAlgorithm.values()) {
      if (algorithm.mode() != mode) {
        continue;
      }
      CipherEngine engine = CipherEngines.create(algorithm);
      engine.init(Direction.ENCRYPT, keyFor(algorithm), ivFor(algorithm));
      byte[] first = engine.processBytes(new byte[20]);
      engine.processBytes(new byte[5]);

      engine.init(Direction.ENCRYPT, keyFor(algorithm), ivFor(algorithm));

      assertThat(engine.processBytes(new byte[20])).as(algorithm.algorithmName()).isEqualTo(first);
    }
  }

  @ParameterizedTest
  @EnumSource(CipherAlgorithm.class)
  void wrongKeyOrIvSizeIsRejected(CipherAlgorithm algorithm) {
    CipherEngine engine = CipherEngines.create(algorithm);

    assertThatThrownBy(() -> engine.init(Direction.ENCRYPT, new byte[7], ivFor(algorithm)))
        .isInstanceOf(InvalidKeyMaterialException.class);
    assertThatThrownBy(() -> engine.init(Direction.ENCRYPT, keyFor(algorithm), new byte[algorithm.ivSize() + 1]))
        .isInstanceOf(InvalidKeyMaterialException.class);
    assertThatThrownBy(() -> engine.init(Direction.ENCRYPT, keyFor(algorithm), null))
        .isInstanceOf(InvalidKeyMaterialException.class);
    assertThat(engine.isInitialized()).isFalse();
  }

  @Test
  void cbc_requiresWholeBlocks() {
    CipherEngine engine = CipherEngines.create(CipherAlgorithm.AES_256_CBC);
    engine.init(Direction.ENCRYPT, new byte[32], new byte[16]);

    assertThatThrownBy(() -> engine.processBytes(new byte[17])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void processBlock_requiresExactBlockSize() {
    CipherEngine engine = CipherEngines.create(CipherAlgorithm.AES_128_CTR);
    engine.init(Direction.ENCRYPT, new byte[16], new byte[16]);

    assertThat(engine.blockSize()).isEqualTo(16);
    assertThatThrownBy(() -> engine.processBlock(new byte[15])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void processBytes_rejectsRangeOutsideInput() {
    CipherEngine engine = CipherEngines.create(CipherAlgorithm.CHACHA20);
    engine.init(Direction.ENCRYPT, new byte[32], new byte[12]);

    assertThatThrownBy(() -> engine.processBytes(new byte[8], 4, 8)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> engine.processBytes(new byte[8], 4, Integer.MAX_VALUE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void outputSize_addsTagOnlyForAead() {
    CipherEngine ctr = CipherEngines.create(CipherAlgorithm.AES_128_CTR);
    CipherEngine gcm = CipherEngines.create(CipherAlgorithm.AES_128_GCM);
    gcm.init(Direction.ENCRYPT, new byte[16], new byte[12]);

    assertThat(ctr.outputSize(10)).isEqualTo(10);
    assertThat(gcm.outputSize(10)).isEqualTo(26);
    assertThat(gcm).isInstanceOf(AeadCipherEngine.class);
  }

  @Test
  void createAead_rejectsUnauthenticatedAlgorithms() {
    assertThatThrownBy(() -> CipherEngines.createAead(CipherAlgorithm.AES_128_CBC, CipherKitConfig.DEFAULT))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromName_resolvesAlgorithms() {
    assertThat(CipherAlgorithm.fromName("AES-256-GCM")).isEqualTo(CipherAlgorithm.AES_256_GCM);
    assertThat(CipherAlgorithm.fromName("chacha20-poly1305")).isEqualTo(CipherAlgorithm.CHACHA20_POLY1305);
  }
}
