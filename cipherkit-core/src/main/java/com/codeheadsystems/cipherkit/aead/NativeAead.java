package com.codeheadsystems.cipherkit.aead;

import com.codeheadsystems.cipherkit.cipher.AeadCipherEngine;
import com.codeheadsystems.cipherkit.cipher.CipherEngines;
import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.config.CipherKitConfig;
import com.codeheadsystems.cipherkit.engine.Direction;

// GCM and ChaCha20-Poly1305: the mode produces and checks the tag itself.
class NativeAead implements AeadConstruction {

  private final AeadScheme scheme;
  private final CipherKitConfig config;

  NativeAead(AeadScheme scheme, CipherKitConfig config) {
    this.scheme = scheme;
    this.config = config;
  }

  @Override
  public byte[] encrypt(byte[] key, byte[] iv, byte[] plaintext, byte[] aad) {
    AeadCipherEngine engine = start(Direction.ENCRYPT, key, iv, aad);
    byte[] ciphertext = engine.processBytes(plaintext);
    return ByteUtils.concat(ciphertext, engine.doFinal());
  }

  @Override
  public byte[] decrypt(byte[] key, byte[] iv, byte[] envelope, byte[] aad) {
    AeadCipherEngine engine = start(Direction.DECRYPT, key, iv, aad);
    engine.processBytes(envelope);
    return engine.doFinal();
  }

  private AeadCipherEngine start(Direction direction, byte[] key, byte[] iv, byte[] aad) {
    AeadCipherEngine engine = CipherEngines.createAead(scheme.cipher(), config);
    engine.init(direction, key, iv);
    engine.updateAad(aad);
    return engine;
  }
}
