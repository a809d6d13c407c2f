package org.example.crowdledger.util;

/**
 * Validator for usernames stored in the fixed 15-slot username field.
 *
 * <p>A username occupies exactly {@value #SLOTS} character slots, left-justified. The used slots
 * hold {@code [a-z0-9_]}; the remaining slots are NUL ({@code '\0'}) padding. Input shorter than
 * {@value #SLOTS} characters is treated as if it were padded with NULs on the right.
 *
 * <p>Rejected when:
 *
 * <ul>
 *   <li>the input is {@code null}, empty, or longer than {@value #SLOTS} characters;
 *   <li>any slot holds a character outside {@code [a-z0-9_]} other than NUL;
 *   <li>fewer than {@value #MIN_CHARS} slots are non-NUL;
 *   <li>a non-NUL character follows a NUL (padding must be one contiguous suffix).
 * </ul>
 *
 * <p>This class is a static holder and is not meant to be instantiated.
 */
public final class UsernameValidator {
  private UsernameValidator() {}

  /** Fixed width of the username field. */
  public static final int SLOTS = 15;

  /** Minimum number of non-padding characters. */
  public static final int MIN_CHARS = 4;

  private static final char PAD = '\0';

  /**
   * Checks the candidate against the rules above.
   *
   * @param name candidate username, with or without trailing NUL padding
   * @return {@code true} if valid
   */
  public static boolean isValid(String name) {
    if (name == null || name.isEmpty() || name.length() > SLOTS) return false;
    int used = 0;
    boolean padSeen = false;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == PAD) {
        padSeen = true;
        continue;
      }
      if (padSeen) return false;
      if (!isLegal(c)) return false;
      used++;
    }
    return used >= MIN_CHARS;
  }

  /**
   * Removes the NUL padding from a valid username.
   *
   * @param name a name accepted by {@link #isValid(String)}
   * @return the name without its padding suffix
   */
  public static String stripPadding(String name) {
    int end = name.indexOf(PAD);
    return end < 0 ? name : name.substring(0, end);
  }

  private static boolean isLegal(char c) {
    return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
  }
}
