package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.exception.EngineNotInitializedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the uninitialized/ready state machine so modes only implement the transforms.
 */
abstract class AbstractCipherEngine implements CipherEngine {

  private static final Logger log = LoggerFactory.getLogger(AbstractCipherEngine.class);

  private final CipherAlgorithm algorithm;
  private Direction direction;

  AbstractCipherEngine(CipherAlgorithm algorithm) {
    this.algorithm = algorithm;
  }

  @Override
  public CipherAlgorithm algorithm() {
    return algorithm;
  }

  @Override
  public final void init(Direction direction, byte[] key, byte[] iv) {
    if (direction == null) {
      throw new IllegalArgumentException("direction must not be null");
    }
    algorithm.validate(key, iv);
    engineInit(direction, key, iv);
    this.direction = direction;
    log.trace("init({}, {})", algorithm, direction);
  }

  @Override
  public boolean isInitialized() {
    return direction != null;
  }

  @Override
  public int outputSize(int inputLength) {
    return inputLength;
  }

  @Override
  public final byte[] processBytes(byte[] input, int offset, int length) {
    requireReady();
    if (offset < 0 || length < 0 || length > input.length - offset) {
      throw new IllegalArgumentException("range [" + offset + ", " + offset + "+" + length
          + ") outside input of " + input.length + " bytes");
    }
    return engineProcess(input, offset, length);
  }

  @Override
  public final void reset() {
    if (direction != null) {
      engineReset();
      direction = null;
      log.trace("reset({})", algorithm);
    }
  }

  protected Direction direction() {
    return direction;
  }

  protected void requireReady() {
    if (direction == null) {
      throw new EngineNotInitializedException(algorithm.algorithmName() + " used before init()");
    }
  }

  protected abstract void engineInit(Direction direction, byte[] key, byte[] iv);

  protected abstract byte[] engineProcess(byte[] input, int offset, int length);

  protected abstract void engineReset();
}
