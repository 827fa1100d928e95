/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.stmt;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 *
 */
public class FormatsTest {

  @Test
  public void testBinary() {
    assertEquals("0101", Formats.format('b', "0101"));
    assertEquals("1", Formats.format('B', "1"));
  }


  @Test
  public void testHex() {
    assertEquals("1F", Formats.format('h', "11111"));
    assertEquals(" 1", Formats.format('h', "00001"));
    assertEquals("A", Formats.format('h', "1010"));
  }


  @Test
  public void testUnsigned() {
    assertEquals("15", Formats.format('u', "1111"));
    assertEquals(" 1", Formats.format('u', "0001"));
    assertEquals("  0", Formats.format('u', "00000000"));
  }


  @Test
  public void testSigned() {
    assertEquals("-1", Formats.format('d', "1111"));
    assertEquals("-8", Formats.format('d', "1000"));
    assertEquals(" 7", Formats.format('d', "0111"));
    assertEquals("-1", Formats.format('d', "1"));
    assertEquals(" 0", Formats.format('d', "0"));
  }


  @Test
  public void testWidth() {
    assertEquals(8, Formats.width('b', 8));
    assertEquals(8, Formats.width('h', 32));
    assertEquals(10, Formats.width('u', 32));
    assertEquals(11, Formats.width('d', 32));
    assertThrows(IllegalArgumentException.class, () -> Formats.width('b', 33));
    assertThrows(IllegalArgumentException.class, () -> Formats.width('x', 4));
  }


  @Test
  public void testNextValue() {
    assertEquals("00", Formats.nextValue("11"));
    assertEquals("10", Formats.nextValue("01"));
    assertEquals("0000", Formats.nextValue("1111"));
    assertEquals("1", Formats.nextValue("0"));
  }


  @Test
  public void testBadBinary() {
    assertThrows(IllegalArgumentException.class, () -> Formats.nextValue(""));
    assertThrows(IllegalArgumentException.class, () -> Formats.format('b', "012"));
    assertThrows(IllegalArgumentException.class, () -> Formats.format('b', "1".repeat(33)));
  }

}
