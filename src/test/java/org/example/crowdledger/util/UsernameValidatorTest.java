package org.example.crowdledger.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

public class UsernameValidatorTest {

  @Test
  @DisplayName("lower-case letters, digits and underscore, at least four of them")
  void acceptsLegalNames() {
    assertTrue(UsernameValidator.isValid("ab_1"));
    assertTrue(UsernameValidator.isValid("abcdefghijklmno"));
    assertTrue(UsernameValidator.isValid("abcd\0\0\0"));
  }

  @Test
  @DisplayName("rejects short, long, upper-case, interior NUL and empty names")
  void rejectsIllegalNames() {
    assertFalse(UsernameValidator.isValid("ab1"));
    assertFalse(UsernameValidator.isValid("ab\0cd"));
    assertFalse(UsernameValidator.isValid("AB12"));
    assertFalse(UsernameValidator.isValid("abcdefghijklmnop"));
    assertFalse(UsernameValidator.isValid("ab-cd"));
    assertFalse(UsernameValidator.isValid(""));
    assertFalse(UsernameValidator.isValid(null));
    assertFalse(UsernameValidator.isValid("\0\0\0\0"));
  }

  @Test
  @DisplayName("stripPadding drops the NUL suffix")
  void stripPadding() {
    assertEquals("abcd", UsernameValidator.stripPadding("abcd\0\0"));
    assertEquals("abcd", UsernameValidator.stripPadding("abcd"));
  }
}
