package com.codeheadsystems.cipherkit.engine.bc;

import com.codeheadsystems.cipherkit.engine.BlockCipherAlgorithm;
import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.RawBlockCipher;
import com.codeheadsystems.cipherkit.exception.EngineNotInitializedException;
import org.bouncycastle.crypto.BlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;

// Not thread safe.
class BcBlockCipher implements RawBlockCipher {

  private final BlockCipherAlgorithm algorithm;
  private final BlockCipher delegate;
  private boolean initialized;

  BcBlockCipher(BlockCipherAlgorithm algorithm, BlockCipher delegate) {
    this.algorithm = algorithm;
    this.delegate = delegate;
  }

  @Override
  public BlockCipherAlgorithm algorithm() {
    return algorithm;
  }

  @Override
  public void init(Direction direction, byte[] key) {
    algorithm.validateKey(key);
    delegate.init(direction.forEncryption(), new KeyParameter(key));
    initialized = true;
  }

  @Override
  public void processBlock(byte[] in, int inOffset, byte[] out, int outOffset) {
    if (!initialized) {
      throw new EngineNotInitializedException(algorithm.algorithmName() + " used before init()");
    }
    int blockSize = blockSize();
    if (in.length - inOffset < blockSize || out.length - outOffset < blockSize) {
      throw new IllegalArgumentException(algorithm.algorithmName() + " needs a full " + blockSize + "-byte block");
    }
    delegate.processBlock(in, inOffset, out, outOffset);
  }

  @Override
  public void reset() {
    delegate.reset();
    initialized = false;
  }
}
