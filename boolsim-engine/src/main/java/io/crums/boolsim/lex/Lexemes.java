/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexeme patterns and parsers. Prefixes ({@code ~}, {@code *}) are accepted
 * where the grammar allows them; parse methods take the lexeme with or
 * without them.
 */
public class Lexemes {
  // no-one calls
  private Lexemes() {  }
  
  
  /** Name: letter or underscore, then word chars, not ending in a digit. */
  public final static String NAME = "[_a-zA-Z]\\w*(?<!\\d)";
  
  private final static Pattern SCALAR =
      Pattern.compile("^[~*]*(" + NAME + ")(\\d+)?$");
  
  private final static Pattern VECTOR =
      Pattern.compile("^[~*]*(" + NAME + ")\\[(?:(\\d+)\\.(\\d+)?\\.(\\d+))?\\]$");
  
  private final static Pattern CONSTANT =
      Pattern.compile(
          "^~*(?:" +
          "(\\d+)?'([bB])([01]+)" +
          "|(\\d+)?'([hH])([0-9a-fA-F]+)" +
          "|(?:(\\d+)?'([dD])?)?(\\d+)" +
          ")$");
  
  private final static Pattern FORMATTER = Pattern.compile("^%([ubhdUBHD])$");
  
  private final static Pattern INSTANCE = Pattern.compile("^(\\w+)\\.(\\w+)$");
  
  private final static Pattern OPERATOR =
      Pattern.compile("^(?:([=+^|-])|(<=(?:@(" + NAME + "\\d*))?)|(~+)|(==))$");
  
  /** Separator characters. */
  private final static Pattern SEPARATOR = Pattern.compile("[\\s{}():,;]");
  
  /** Characters that may never appear outside a comment. */
  private final static Pattern INVALID = Pattern.compile("[^\\s_a-zA-Z0-9~@%^*()=+\\[\\]{}<|:;',.-]");
  
  /** Comment line: {@code [ws][+|-]"text"[;]}. */
  public final static Pattern COMMENT = Pattern.compile("^(\\s*)([+-])?\"(.*)\";?$");
  
  /** Library directive. */
  public final static Pattern LIBRARY = Pattern.compile("^#library\\s+(.+?);$");
  
  
  
  public static boolean isSeparator(char c) {
    return SEPARATOR.matcher(String.valueOf(c)).matches();
  }
  
  
  public static boolean isInvalid(char c) {
    return INVALID.matcher(String.valueOf(c)).matches();
  }
  
  
  /**
   * Parses a scalar lexeme. The bit index, if any, is not range-checked.
   * Note that some over-large digit strings yield a bit of
   * {@linkplain Integer#MAX_VALUE}.
   */
  public static Optional<ScalarRef> scalar(String lexeme) {
    Matcher m = SCALAR.matcher(lexeme);
    if (!m.matches())
      return Optional.empty();
    int bit = m.group(2) == null ? -1 : parseIndex(m.group(2));
    return Optional.of(new ScalarRef(m.group(1), bit));
  }
  
  
  /** Parses a vector lexeme. Bounds and step are not range-checked. */
  public static Optional<VectorRef> vector(String lexeme) {
    Matcher m = VECTOR.matcher(lexeme);
    if (!m.matches())
      return Optional.empty();
    String name = m.group(1);
    if (m.group(2) == null)
      return Optional.of(new VectorRef(name, -1, 1, -1));
    int left = parseIndex(m.group(2));
    int step = m.group(3) == null ? 1 : parseIndex(m.group(3));
    int right = parseIndex(m.group(4));
    return Optional.of(new VectorRef(name, left, step, right));
  }
  
  
  private static int parseIndex(String digits) {
    return digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
  }
  
  
  /** Parses a constant lexeme. Bit counts are not range-checked. */
  public static Optional<Constant> constant(String lexeme) {
    Matcher m = CONSTANT.matcher(lexeme);
    if (!m.matches())
      return Optional.empty();
    String text = lexeme.replaceFirst("^~+", "");
    String count;
    char format;
    String digits;
    if (m.group(3) != null) {
      count = m.group(1);
      format = 'b';
      digits = m.group(3);
    } else if (m.group(6) != null) {
      count = m.group(4);
      format = 'h';
      digits = m.group(6);
    } else {
      count = m.group(7);
      format = 'd';
      digits = m.group(9);
    }
    int bitCount = count == null ? -1 : parseIndex(count);
    return Optional.of(new Constant(text, bitCount, format, digits));
  }
  
  
  public static boolean isConstant(String lexeme) {
    return CONSTANT.matcher(lexeme).matches();
  }
  
  
  /** Returns the lower-case format char of a formatter lexeme, if it is one. */
  public static Optional<Character> formatter(String lexeme) {
    Matcher m = FORMATTER.matcher(lexeme);
    return m.matches() ?
        Optional.of(Character.toLowerCase(m.group(1).charAt(0))) :
          Optional.empty();
  }
  
  
  /** Instantiation lexeme: {@code [design, instance]}. */
  public static Optional<String[]> instance(String lexeme) {
    Matcher m = INSTANCE.matcher(lexeme);
    return m.matches() ?
        Optional.of(new String[] { m.group(1), m.group(2) }) :
          Optional.empty();
  }
  
  
  /**
   * Classifies an operator lexeme.
   * 
   * @return one of {@code ASSIGN, CLOCK_ASSIGN, OR, XOR, EQUALS, PLUS, MINUS, NOT}
   */
  public static Optional<TokenType> operator(String lexeme) {
    Matcher m = OPERATOR.matcher(lexeme);
    if (!m.matches())
      return Optional.empty();
    if (m.group(1) != null) {
      return Optional.of(
          switch (m.group(1).charAt(0)) {
          case '=' -> TokenType.ASSIGN;
          case '+' -> TokenType.PLUS;
          case '-' -> TokenType.MINUS;
          case '^' -> TokenType.XOR;
          default -> TokenType.OR;
          });
    }
    if (m.group(2) != null)
      return Optional.of(TokenType.CLOCK_ASSIGN);
    if (m.group(4) != null)
      return Optional.of(TokenType.NOT);
    return Optional.of(TokenType.EQUALS);
  }
  
  
  /**
   * Returns the alternate clock name of a clock-assignment lexeme
   * ({@code <=@clk}), if any.
   */
  public static Optional<String> altClock(String clockAssign) {
    int at = clockAssign.indexOf('@');
    return at == -1 ? Optional.empty() : Optional.of(clockAssign.substring(at + 1));
  }

}
