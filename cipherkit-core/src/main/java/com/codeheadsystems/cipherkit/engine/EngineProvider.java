package com.codeheadsystems.cipherkit.engine;

/**
 * Source of primitive engines. Every call returns a fresh instance owned by the caller.
 * Unsupported identifiers fail here, before any data is processed.
 */
public interface EngineProvider {

  Digest digest(DigestAlgorithm algorithm);

  Mac mac(MacAlgorithm algorithm);

  RawBlockCipher blockCipher(BlockCipherAlgorithm algorithm);

  RawStreamCipher streamCipher(StreamCipherAlgorithm algorithm);
}
