package com.codeheadsystems.cipherkit.engine.bc;

import com.codeheadsystems.cipherkit.engine.BlockCipherAlgorithm;
import com.codeheadsystems.cipherkit.engine.Digest;
import com.codeheadsystems.cipherkit.engine.DigestAlgorithm;
import com.codeheadsystems.cipherkit.engine.EngineProvider;
import com.codeheadsystems.cipherkit.engine.Mac;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;
import com.codeheadsystems.cipherkit.engine.RawBlockCipher;
import com.codeheadsystems.cipherkit.engine.RawStreamCipher;
import com.codeheadsystems.cipherkit.engine.StreamCipherAlgorithm;
import org.bouncycastle.crypto.BlockCipher;
import org.bouncycastle.crypto.StreamCipher;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA224Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA384Digest;
import org.bouncycastle.crypto.digests.SHA3Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.engines.ChaCha7539Engine;
import org.bouncycastle.crypto.engines.Salsa20Engine;
import org.bouncycastle.crypto.engines.TwofishEngine;
import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.macs.CMac;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.macs.Poly1305;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds every algorithm identifier to a BouncyCastle lightweight-API engine.
 */
public class BouncyCastleEngineProvider implements EngineProvider {

  /**
   * Shared instance; the provider itself holds no state.
   */
  public static final BouncyCastleEngineProvider INSTANCE = new BouncyCastleEngineProvider();

  private static final Logger log = LoggerFactory.getLogger(BouncyCastleEngineProvider.class);

  @Override
  public Digest digest(DigestAlgorithm algorithm) {
    log.trace("digest({})", algorithm);
    return new BcDigest(algorithm, bcDigest(algorithm));
  }

  @Override
  public Mac mac(MacAlgorithm algorithm) {
    log.trace("mac({})", algorithm);
    org.bouncycastle.crypto.Mac delegate = switch (algorithm.kind()) {
      case HMAC -> new HMac(bcDigest(algorithm.digest()));
      case CMAC -> new CMac(bcBlockCipher(algorithm.cipher()));
      case POLY1305 -> algorithm.cipher() == null
          ? new Poly1305()
          : new Poly1305(bcBlockCipher(algorithm.cipher()));
    };
    return new BcMac(algorithm, delegate);
  }

  @Override
  public RawBlockCipher blockCipher(BlockCipherAlgorithm algorithm) {
    log.trace("blockCipher({})", algorithm);
    return new BcBlockCipher(algorithm, bcBlockCipher(algorithm));
  }

  @Override
  public RawStreamCipher streamCipher(StreamCipherAlgorithm algorithm) {
    log.trace("streamCipher({})", algorithm);
    StreamCipher delegate = switch (algorithm) {
      case CHACHA20 -> new ChaCha7539Engine();
      case SALSA20 -> new Salsa20Engine();
      case XSALSA20 -> new XSalsa20Engine();
    };
    return new BcStreamCipher(algorithm, delegate);
  }

  private static org.bouncycastle.crypto.Digest bcDigest(DigestAlgorithm algorithm) {
    return switch (algorithm) {
      case SHA1 -> new SHA1Digest();
      case SHA224 -> new SHA224Digest();
      case SHA256 -> new SHA256Digest();
      case SHA384 -> new SHA384Digest();
      case SHA512 -> new SHA512Digest();
      case SHA3_256 -> new SHA3Digest(256);
      case SHA3_384 -> new SHA3Digest(384);
      case SHA3_512 -> new SHA3Digest(512);
      case BLAKE2B_256 -> new Blake2bDigest(256);
      case BLAKE2B_512 -> new Blake2bDigest(512);
    };
  }

  private static BlockCipher bcBlockCipher(BlockCipherAlgorithm algorithm) {
    return switch (algorithm) {
      case AES -> new AESEngine();
      case TWOFISH -> new TwofishEngine();
    };
  }
}
