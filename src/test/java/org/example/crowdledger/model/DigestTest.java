package org.example.crowdledger.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

public class DigestTest {

  private static final String HEX =
      "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";

  @Test
  @DisplayName("fromHex accepts an optional 0x prefix and upper-case digits")
  void fromHex_prefixAndCase() {
    Digest a = Digest.fromHex(HEX);
    Digest b = Digest.fromHex("0x" + HEX.toUpperCase());
    assertEquals(a, b);
    assertEquals(HEX, b.toHex());
    assertEquals("00112233", a.shortHex());
    assertFalse(a.isZero());
  }

  @Test
  @DisplayName("ZERO is all zero bytes")
  void zero() {
    assertTrue(Digest.ZERO.isZero());
    assertEquals("0".repeat(64), Digest.ZERO.toHex());
    assertEquals(Digest.ZERO, Digest.of(new byte[32]));
  }

  @Test
  @DisplayName("wrong lengths and non-hex input are rejected")
  void rejectsBadInput() {
    assertThrows(IllegalArgumentException.class, () -> Digest.of(new byte[31]));
    assertThrows(IllegalArgumentException.class, () -> Digest.fromHex("abcd"));
    assertThrows(IllegalArgumentException.class, () -> Digest.fromHex("zz" + HEX.substring(2)));
  }

  @Test
  @DisplayName("byte arrays are copied in and out")
  void immutable() {
    byte[] raw = new byte[32];
    Digest d = Digest.of(raw);
    raw[0] = 7;
    assertTrue(d.isZero());
    d.toBytes()[1] = 9;
    assertTrue(d.isZero());
  }
}
