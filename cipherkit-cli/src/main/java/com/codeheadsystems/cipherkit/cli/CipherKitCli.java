package com.codeheadsystems.cipherkit.cli;

import com.codeheadsystems.cipherkit.aead.Aead;
import com.codeheadsystems.cipherkit.aead.AeadScheme;
import com.codeheadsystems.cipherkit.engine.DigestAlgorithm;
import com.codeheadsystems.cipherkit.engine.Digests;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;
import com.codeheadsystems.cipherkit.engine.Macs;
import com.codeheadsystems.cipherkit.exception.CipherKitException;
import com.codeheadsystems.cipherkit.exception.UnsupportedAlgorithmException;
import com.codeheadsystems.cipherkit.kdf.Kdf;
import com.codeheadsystems.cipherkit.kdf.KdfAlgorithm;
import com.codeheadsystems.cipherkit.kdf.KdfParameters;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end for one-shot digests, MACs, key derivation and AEAD.
 *
 * <pre>
 * Usage:
 *   java -jar cipherkit-cli.jar digest  &lt;alg&gt; &lt;text&gt;
 *   java -jar cipherkit-cli.jar mac     &lt;alg&gt; &lt;keyHex&gt; &lt;text&gt;
 *   java -jar cipherkit-cli.jar kdf     &lt;alg&gt; &lt;digest&gt; &lt;key&gt; &lt;salt&gt; &lt;length&gt; [iterations]
 *   java -jar cipherkit-cli.jar encrypt &lt;scheme&gt; &lt;keyHex&gt; &lt;ivHex&gt; &lt;text&gt;
 *   java -jar cipherkit-cli.jar decrypt &lt;scheme&gt; &lt;keyHex&gt; &lt;ivHex&gt; &lt;envelopeHex&gt;
 * </pre>
 *
 * <p>Binary output is printed as lowercase hex. Exit status is 0 on success, 1 for usage errors
 * (unknown command or algorithm, bad hex, wrong argument count) and 2 when the cryptographic
 * operation itself fails, for example a forged envelope or a KDF asked for more output than it
 * can produce.
 */
public class CipherKitCli {

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_CRYPTO_FAILURE = 2;

  private static final Logger log = LoggerFactory.getLogger(CipherKitCli.class);
  private static final HexFormat HEX = HexFormat.of();

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Runs one command.
   *
   * @param args the arguments
   * @param out  where results go
   * @param err  where errors and usage go
   * @return the exit status
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length == 0) {
      usage(err);
      return EXIT_USAGE;
    }
    try {
      String result = switch (args[0]) {
        case "digest" -> digest(args);
        case "mac" -> mac(args);
        case "kdf" -> kdf(args);
        case "encrypt" -> encrypt(args);
        case "decrypt" -> decrypt(args);
        default -> throw new UsageException("Unknown command: " + args[0]);
      };
      out.println(result);
      return EXIT_OK;
    } catch (UsageException | UnsupportedAlgorithmException | IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      usage(err);
      return EXIT_USAGE;
    } catch (CipherKitException | IllegalStateException e) {
      log.debug("{} failed", args[0], e);
      err.println("Error: " + e.getMessage());
      return EXIT_CRYPTO_FAILURE;
    }
  }

  private static String digest(String[] args) {
    requireArgs(args, 3);
    DigestAlgorithm algorithm = DigestAlgorithm.fromName(args[1]);
    return HEX.formatHex(Digests.digest(algorithm, utf8(args[2])));
  }

  private static String mac(String[] args) {
    requireArgs(args, 4);
    MacAlgorithm algorithm = MacAlgorithm.fromName(args[1]);
    return HEX.formatHex(Macs.mac(algorithm, HEX.parseHex(args[2]), utf8(args[3])));
  }

  private static String kdf(String[] args) {
    if (args.length != 6 && args.length != 7) {
      throw new UsageException("kdf expects 5 or 6 arguments, got " + (args.length - 1));
    }
    KdfParameters.Builder builder = KdfParameters.builder(KdfAlgorithm.fromName(args[1]))
        .withDigest(DigestAlgorithm.fromName(args[2]))
        .withKey(utf8(args[3]))
        .withSalt(utf8(args[4]));
    if (args.length == 7) {
      builder.withIterations(parseInt(args[6], "iterations"));
    }
    return HEX.formatHex(Kdf.derive(builder.build(), parseInt(args[5], "length")));
  }

  private static String encrypt(String[] args) {
    requireArgs(args, 5);
    AeadScheme scheme = AeadScheme.fromName(args[1]);
    return HEX.formatHex(Aead.encrypt(utf8(args[4]), HEX.parseHex(args[2]), HEX.parseHex(args[3]), scheme));
  }

  private static String decrypt(String[] args) {
    requireArgs(args, 5);
    AeadScheme scheme = AeadScheme.fromName(args[1]);
    byte[] plaintext = Aead.decrypt(HEX.parseHex(args[4]), HEX.parseHex(args[2]), HEX.parseHex(args[3]), scheme);
    return new String(plaintext, StandardCharsets.UTF_8);
  }

  private static void requireArgs(String[] args, int expected) {
    if (args.length != expected) {
      throw new UsageException(args[0] + " expects " + (expected - 1) + " arguments, got " + (args.length - 1));
    }
  }

  private static int parseInt(String value, String name) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new UsageException(name + " must be an integer, was " + value);
    }
  }

  private static byte[] utf8(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static void usage(PrintStream err) {
    err.println("Usage:");
    err.println("  digest  <alg> <text>");
    err.println("  mac     <alg> <keyHex> <text>");
    err.println("  kdf     <alg> <digest> <key> <salt> <length> [iterations]");
    err.println("  encrypt <scheme> <keyHex> <ivHex> <text>");
    err.println("  decrypt <scheme> <keyHex> <ivHex> <envelopeHex>");
  }

  /**
   * Malformed command line.
   */
  static class UsageException extends RuntimeException {

    UsageException(String message) {
      super(message);
    }
  }
}
