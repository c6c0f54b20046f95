package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.DigestAlgorithm;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;

/**
 * Inputs to {@link Kdf#engine}. Which fields an algorithm reads:
 * <ul>
 *   <li>HKDF: key, salt, info, digest (or an HMAC in mac)</li>
 *   <li>KDF1/KDF2: key, salt (appended after the counter), digest</li>
 *   <li>CMKDF: key, label, context, declaredLength, mac or digest</li>
 *   <li>FMKDF: key, iv, label, context, mac or digest</li>
 *   <li>DPIMKDF: key, label, context, mac or digest</li>
 *   <li>PBKDF2: key (the password), salt, iterations, digest</li>
 * </ul>
 * Byte arrays are copied by the builder; absent arrays are empty.
 *
 * @param algorithm      the KDF
 * @param key            the input keying material
 * @param salt           the salt
 * @param info           HKDF context information
 * @param label          SP 800-108 label
 * @param context        SP 800-108 context
 * @param iv             SP 800-108 feedback-mode initial value
 * @param digest         the digest, or null
 * @param mac            the MAC used as PRF, or null to use HMAC over {@code digest}
 * @param iterations     PBKDF2 iteration count
 * @param declaredLength CMKDF output length in bytes encoded into every round, 0 for the MAC size
 */
public record KdfParameters(
    KdfAlgorithm algorithm,
    byte[] key,
    byte[] salt,
    byte[] info,
    byte[] label,
    byte[] context,
    byte[] iv,
    DigestAlgorithm digest,
    MacAlgorithm mac,
    int iterations,
    int declaredLength
) {

  public static final int DEFAULT_ITERATIONS = 1;

  /**
   * Starts a builder for the given algorithm.
   *
   * @param algorithm the algorithm
   * @return the builder
   */
  public static Builder builder(KdfAlgorithm algorithm) {
    return new Builder(algorithm);
  }

  /**
   * The type Builder.
   */
  public static class Builder {
    private final KdfAlgorithm algorithm;
    private byte[] key;
    private byte[] salt = new byte[0];
    private byte[] info = new byte[0];
    private byte[] label = new byte[0];
    private byte[] context = new byte[0];
    private byte[] iv = new byte[0];
    private DigestAlgorithm digest;
    private MacAlgorithm mac;
    private int iterations = DEFAULT_ITERATIONS;
    private int declaredLength;

    private Builder(KdfAlgorithm algorithm) {
      if (algorithm == null) {
        throw new IllegalArgumentException("algorithm must not be null");
      }
      this.algorithm = algorithm;
    }

    public Builder withKey(byte[] key) {
      this.key = key == null ? null : key.clone();
      return this;
    }

    public Builder withSalt(byte[] salt) {
      this.salt = ByteUtils.copyOrEmpty(salt);
      return this;
    }

    public Builder withInfo(byte[] info) {
      this.info = ByteUtils.copyOrEmpty(info);
      return this;
    }

    public Builder withLabel(byte[] label) {
      this.label = ByteUtils.copyOrEmpty(label);
      return this;
    }

    public Builder withContext(byte[] context) {
      this.context = ByteUtils.copyOrEmpty(context);
      return this;
    }

    public Builder withIv(byte[] iv) {
      this.iv = ByteUtils.copyOrEmpty(iv);
      return this;
    }

    public Builder withDigest(DigestAlgorithm digest) {
      this.digest = digest;
      return this;
    }

    public Builder withMac(MacAlgorithm mac) {
      this.mac = mac;
      return this;
    }

    public Builder withIterations(int iterations) {
      this.iterations = iterations;
      return this;
    }

    public Builder withDeclaredLength(int declaredLength) {
      this.declaredLength = declaredLength;
      return this;
    }

    public KdfParameters build() {
      if (iterations < 1) {
        throw new IllegalArgumentException("iterations must be >= 1");
      }
      if (declaredLength < 0) {
        throw new IllegalArgumentException("declaredLength must be >= 0");
      }
      return new KdfParameters(algorithm, key, salt, info, label, context, iv, digest, mac, iterations, declaredLength);
    }
  }
}
