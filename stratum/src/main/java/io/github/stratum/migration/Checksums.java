package io.github.stratum.migration;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content checksums for migration artifacts: the first 8 bytes of a SHA-256 digest as 16 lowercase
 * hex characters.
 */
public final class Checksums {

  /**
   * Length of a checksum in characters.
   */
  public static final int LENGTH = 16;

  private Checksums() {
  }

  /**
   * Checksum of the given content.
   *
   * @param content the content
   * @return the checksum
   */
  public static String of(final byte[] content) {
    final MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
    return HexFormat.of().formatHex(digest.digest(content), 0, LENGTH / 2);
  }
}
