package com.codeheadsystems.cipherkit.cipher;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.cipherkit.engine.Direction;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.engines.Salsa20Engine;
import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class StreamCipherEngineTest {

  private static final byte[] MESSAGE = "stream ciphers take any length".getBytes(StandardCharsets.UTF_8);

  @Test
  void chacha20_matchesKnownAnswer() {
    byte[] key = new byte[32];
    byte[] nonce = new byte[12];
    for (int i = 0; i < key.length; i++) {
      key[i] = (byte) i;
    }
    for (int i = 0; i < nonce.length; i++) {
      nonce[i] = (byte) i;
    }
    CipherEngine engine = CipherEngines.create(CipherAlgorithm.CHACHA20);
    engine.init(Direction.ENCRYPT, key, nonce);

    assertThat(Hex.toHexString(engine.processBytes("Hello World.".getBytes(StandardCharsets.UTF_8))))
        .isEqualTo("585f9d7daeab03f24b48eb9e");
  }

  @Test
  void salsa20_matchesBouncyCastleEngine() {
    byte[] key = new byte[16];
    byte[] nonce = new byte[8];
    key[0] = 0x42;
    Salsa20Engine reference = new Salsa20Engine();
    reference.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
    byte[] expected = new byte[MESSAGE.length];
    reference.processBytes(MESSAGE, 0, MESSAGE.length, expected, 0);

    CipherEngine engine = CipherEngines.create(CipherAlgorithm.SALSA20);
    engine.init(Direction.ENCRYPT, key, nonce);

    assertThat(engine.processBytes(MESSAGE)).isEqualTo(expected);
  }

  @Test
  void xsalsa20_decryptInvertsEncrypt() {
    byte[] key = new byte[32];
    byte[] nonce = new byte[24];
    XSalsa20Engine reference = new XSalsa20Engine();
    reference.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
    byte[] expected = new byte[MESSAGE.length];
    reference.processBytes(MESSAGE, 0, MESSAGE.length, expected, 0);

    CipherEngine encryptor = CipherEngines.create(CipherAlgorithm.XSALSA20);
    encryptor.init(Direction.ENCRYPT, key, nonce);
    byte[] ciphertext = encryptor.processBytes(MESSAGE);
    CipherEngine decryptor = CipherEngines.create(CipherAlgorithm.XSALSA20);
    decryptor.init(Direction.DECRYPT, key, nonce);

    assertThat(ciphertext).isEqualTo(expected);
    assertThat(decryptor.processBytes(ciphertext)).isEqualTo(MESSAGE);
  }
}
