package org.example.crowdledger.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Immutable 32-byte digest used for content-addressed hashes (content and metadata).
 *
 * <p>Only the hash is stored by the ledger; the media itself lives elsewhere. {@link #ZERO} is the
 * "empty" digest used by tombstones and by cleared metadata.
 *
 * <p>Text form: 64 lowercase hex characters, optionally prefixed with {@code 0x} on input.
 */
public final class Digest {
  public static final int LENGTH = 32;

  public static final Digest ZERO = new Digest(new byte[LENGTH]);

  private static final HexFormat HEX = HexFormat.of();

  private final byte[] bytes;

  private Digest(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Wraps a copy of the given bytes.
   *
   * @param bytes exactly {@value #LENGTH} bytes
   * @return digest
   * @throws IllegalArgumentException if the length is wrong
   */
  public static Digest of(byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException(
          "Digest must be " + LENGTH + " bytes, got " + (bytes == null ? "null" : bytes.length));
    }
    return new Digest(bytes.clone());
  }

  /**
   * Parses a 64-character hex string (an optional {@code 0x} prefix is accepted).
   *
   * @param hex hex text
   * @return digest
   * @throws IllegalArgumentException on wrong length or non-hex characters
   */
  public static Digest fromHex(String hex) {
    if (hex == null) throw new IllegalArgumentException("Digest hex is required.");
    String s = hex.trim().toLowerCase(Locale.ROOT);
    if (s.startsWith("0x")) s = s.substring(2);
    if (s.length() != LENGTH * 2) {
      throw new IllegalArgumentException("Digest hex must have 64 characters: " + hex);
    }
    return new Digest(HEX.parseHex(s));
  }

  public byte[] toBytes() {
    return bytes.clone();
  }

  public boolean isZero() {
    for (byte b : bytes) if (b != 0) return false;
    return true;
  }

  public String toHex() {
    return HEX.formatHex(bytes);
  }

  /** Short form for console listings: first 8 hex characters. */
  public String shortHex() {
    return toHex().substring(0, 8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Digest)) return false;
    return Arrays.equals(bytes, ((Digest) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
