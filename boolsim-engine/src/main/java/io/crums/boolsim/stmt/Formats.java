/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.stmt;


/**
 * Value formatting for format specifiers ({@code %b %h %d %u}). Values are
 * given as binary strings, most significant bit first, at most 32 bits.
 */
public class Formats {
  
  private Formats() {  }
  
  
  /**
   * Formats the given binary string, left-padded with spaces to
   * {@linkplain #width(char, int)}.
   * 
   * @param format  one of {@code b h d u} (case insensitive)
   * @param binary  non-empty string of {@code 0}s and {@code 1}s
   */
  public static String format(char format, String binary) {
    String out = formatRaw(format, binary);
    int width = width(format, binary.length());
    return out.length() >= width ? out : " ".repeat(width - out.length()) + out;
  }
  
  
  static String formatRaw(char format, String binary) {
    checkBinary(binary);
    long unsigned = Long.parseLong(binary, 2);
    return switch (Character.toLowerCase(format)) {
    case 'b' -> binary;
    case 'h' -> Long.toHexString(unsigned).toUpperCase();
    case 'u' -> Long.toString(unsigned);
    case 'd' -> Long.toString(signed(binary, unsigned));
    default -> throw new IllegalArgumentException("unknown format: '" + format + "'");
    };
  }
  
  
  private static long signed(String binary, long unsigned) {
    return binary.charAt(0) == '1' ? unsigned - (1L << binary.length()) : unsigned;
  }
  
  
  /**
   * Returns the display width of a value of the given bit count in the
   * given format: enough characters for the widest value (including the
   * sign, for {@code d}).
   */
  public static int width(char format, int bits) {
    if (bits < 1 || bits > 32)
      throw new IllegalArgumentException("bits: " + bits);
    return switch (Character.toLowerCase(format)) {
    case 'b' -> bits;
    case 'h' -> (bits + 3) / 4;
    case 'u' -> Long.toString((1L << bits) - 1).length();
    case 'd' -> Long.toString(1L << (bits - 1)).length() + 1;
    default -> throw new IllegalArgumentException("unknown format: '" + format + "'");
    };
  }
  
  
  /**
   * Returns the binary value one greater than the given one, wrapping
   * within its width ({@code "11"} yields {@code "00"}).
   */
  public static String nextValue(String binary) {
    checkBinary(binary);
    int width = binary.length();
    long next = (Long.parseLong(binary, 2) + 1) & ((1L << width) - 1);
    String out = Long.toBinaryString(next);
    return out.length() == width ? out : "0".repeat(width - out.length()) + out;
  }
  
  
  private static void checkBinary(String binary) {
    if (binary.isEmpty() || binary.length() > 32 || !binary.matches("[01]+"))
      throw new IllegalArgumentException("not a binary string of 1-32 bits: \"" + binary + "\"");
  }

}
