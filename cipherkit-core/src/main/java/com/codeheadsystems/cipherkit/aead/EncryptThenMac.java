package com.codeheadsystems.cipherkit.aead;

import com.codeheadsystems.cipherkit.cipher.CipherEngine;
import com.codeheadsystems.cipherkit.cipher.CipherEngines;
import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.config.CipherKitConfig;
import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.KeyMaterial;
import com.codeheadsystems.cipherkit.engine.Mac;
import com.codeheadsystems.cipherkit.exception.AuthenticationFailureException;
import com.codeheadsystems.cipherkit.padding.Padding;
import com.codeheadsystems.cipherkit.padding.PaddingScheme;
import java.util.Arrays;

/**
 * AES_CBC_HMAC_SHA2 from RFC 7518 §5.2. The key splits into {@code MAC_KEY || ENC_KEY}; the
 * plaintext is PKCS7 padded and CBC encrypted; the tag is the first half of
 * {@code HMAC(MAC_KEY, A || IV || C || AL)} where AL is the bit length of A as a 64-bit
 * big-endian integer.
 */
class EncryptThenMac implements AeadConstruction {

  private final AeadScheme scheme;
  private final CipherKitConfig config;

  EncryptThenMac(AeadScheme scheme, CipherKitConfig config) {
    this.scheme = scheme;
    this.config = config;
  }

  @Override
  public byte[] encrypt(byte[] key, byte[] iv, byte[] plaintext, byte[] aad) {
    KeyMaterial.requireKeyLength(scheme.schemeName(), key, scheme.keySize());
    CipherEngine cbc = CipherEngines.create(scheme.cipher(), config);
    cbc.init(Direction.ENCRYPT, encryptionKey(key), iv);
    byte[] ciphertext = cbc.processBytes(Padding.padMessage(plaintext, cbc.blockSize(), PaddingScheme.PKCS7));
    cbc.reset();
    return ByteUtils.concat(ciphertext, tag(key, iv, ciphertext, aad));
  }

  @Override
  public byte[] decrypt(byte[] key, byte[] iv, byte[] envelope, byte[] aad) {
    KeyMaterial.requireKeyLength(scheme.schemeName(), key, scheme.keySize());
    scheme.cipher().validate(encryptionKey(key), iv);
    int blockSize = scheme.cipher().blockSize();
    int ciphertextLength = envelope.length - scheme.tagSize();
    if (ciphertextLength < blockSize || ciphertextLength % blockSize != 0) {
      throw new AuthenticationFailureException();
    }
    byte[] ciphertext = Arrays.copyOf(envelope, ciphertextLength);
    byte[] received = Arrays.copyOfRange(envelope, ciphertextLength, envelope.length);
    if (!ByteUtils.constantTimeEquals(tag(key, iv, ciphertext, aad), received)) {
      throw new AuthenticationFailureException();
    }
    CipherEngine cbc = CipherEngines.create(scheme.cipher(), config);
    cbc.init(Direction.DECRYPT, encryptionKey(key), iv);
    byte[] padded = cbc.processBytes(ciphertext);
    cbc.reset();
    return Padding.unpadMessage(padded, blockSize, PaddingScheme.PKCS7);
  }

  private byte[] tag(byte[] key, byte[] iv, byte[] ciphertext, byte[] aad) {
    Mac hmac = config.engineProvider().mac(scheme.mac());
    hmac.init(macKey(key));
    hmac.update(aad);
    hmac.update(iv);
    hmac.update(ciphertext);
    hmac.update(ByteUtils.I2OSP(8L * aad.length, 8));
    return Arrays.copyOf(hmac.doFinal(), scheme.tagSize());
  }

  private static byte[] macKey(byte[] key) {
    return Arrays.copyOf(key, key.length / 2);
  }

  private static byte[] encryptionKey(byte[] key) {
    return Arrays.copyOfRange(key, key.length / 2, key.length);
  }
}
