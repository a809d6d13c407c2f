package org.example.crowdledger.cli;

import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.Scanner;

/**
 * Console input helpers for the CLI.
 *
 * <p>Wraps one UTF-8 {@link Scanner} over {@code System.in}, created when the class is first used.
 * Tests that script the console must set {@code System.in} before that.
 */
public final class InputUtils {

  private static final Scanner SC = new Scanner(System.in, StandardCharsets.UTF_8);

  private InputUtils() {}

  /**
   * Prints {@code prompt} and reads one line.
   *
   * @param prompt printed as-is, without newline
   * @return trimmed line, or {@code null} on EOF
   */
  public static String readTrimmed(String prompt) {
    System.out.print(prompt);
    try {
      String s = SC.nextLine();
      return s == null ? null : s.trim();
    } catch (IllegalStateException | NoSuchElementException e) {
      return null; // input stream closed
    }
  }

  /**
   * Parses a non-negative whole number.
   *
   * @param s text, may be {@code null}
   * @param fallback value for blank or invalid input
   * @return parsed value or {@code fallback}
   */
  public static long parseLongOr(String s, long fallback) {
    if (s == null || s.isBlank()) return fallback;
    try {
      long v = Long.parseLong(s.trim());
      return v < 0 ? fallback : v;
    } catch (NumberFormatException e) {
      return fallback;
    }
  }
}
