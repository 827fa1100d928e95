/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.ArrayList;
import java.util.List;

import io.crums.boolsim.BoolsimConstants;

/**
 * Parsed numeric constant: {@code [count]'b0101}, {@code [count]'hA},
 * {@code [count]'d10}, {@code [count]'10}, or bare decimal digits.
 * 
 * @param text      the constant's text (sans {@code ~} prefix)
 * @param bitCount  the explicit bit count, or -1 if not specified
 * @param format    one of {@code 'b'}, {@code 'h'}, or {@code 'd'} (lower case)
 * @param digits    the value digits in the given format
 */
public record Constant(String text, int bitCount, char format, String digits) {
  
  /**
   * Returns the value, or -1 if it doesn't fit in 32 bits.
   */
  public long value() {
    int radix = switch (format) {
    case 'b' -> 2;
    case 'h' -> 16;
    default -> 10;
    };
    // strip leading zeroes so long digit strings of zeroes still parse
    String d = digits.replaceFirst("^0+(?=.)", "");
    if (d.length() > 32)
      return -1;
    long value;
    try {
      value = Long.parseLong(d, radix);
    } catch (NumberFormatException nfx) {
      return -1;
    }
    return value >>> BoolsimConstants.MAX_BITS == 0 ? value : -1;
  }
  
  
  /**
   * Returns the natural bits of the value, most significant first, before
   * any padding. Binary constants keep their written digits (including
   * leading zeroes); hex and decimal constants use the minimal number of
   * bits (one for zero).
   */
  public String naturalBits() {
    return format == 'b' ? digits : Long.toBinaryString(value());
  }
  
  
  /**
   * Returns {@code true} if the natural bits fit in the explicit bit count,
   * if any, and the value fits in 32 bits.
   */
  public boolean fits() {
    if (value() == -1 || naturalBits().length() > BoolsimConstants.MAX_BITS)
      return false;
    return bitCount == -1 || naturalBits().length() <= bitCount;
  }
  
  
  /** Returns the width: the explicit bit count, if any; the natural width, o.w. */
  public int width() {
    return bitCount == -1 ? naturalBits().length() : bitCount;
  }
  
  
  /**
   * Returns the bits as {@code "0"} / {@code "1"} strings, most significant
   * first, zero-padded on the left to {@linkplain #width()}.
   */
  public List<String> bits() {
    return bits(width());
  }
  
  
  /**
   * Returns the bits as {@code "0"} / {@code "1"} strings, most significant
   * first, zero-padded on the left to the given width.
   * 
   * @param width &ge; the natural width
   */
  public List<String> bits(int width) {
    String natural = naturalBits();
    if (width < natural.length())
      throw new IllegalArgumentException(
          "width %d < natural width %d of %s".formatted(width, natural.length(), text));
    List<String> out = new ArrayList<>(width);
    for (int count = width - natural.length(); count-- > 0; )
      out.add("0");
    for (int index = 0; index < natural.length(); ++index)
      out.add(String.valueOf(natural.charAt(index)));
    return out;
  }

}
