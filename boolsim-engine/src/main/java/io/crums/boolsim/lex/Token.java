/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.Objects;

/**
 * A lexeme tagged with its category. The text is kept verbatim (including
 * any {@code ~} or {@code *} prefixes) so that a statement can be
 * reassembled from its tokens.
 */
public record Token(TokenType type, String text) {
  
  public Token {
    Objects.requireNonNull(type, "null type");
    if (text.isEmpty())
      throw new IllegalArgumentException("empty token text");
  }
  
  
  /** Returns the number of leading {@code ~}s. */
  public int tildes() {
    int count = 0;
    for (int index = 0; index < text.length(); ++index) {
      char c = text.charAt(index);
      if (c == '~')
        ++count;
      else if (c != '*')
        break;
    }
    return count;
  }
  
  
  /** Returns {@code true} if prefixed with an odd number of {@code ~}s. */
  public boolean negated() {
    return (tildes() & 1) == 1;
  }
  
  
  /** Returns {@code true} if prefixed with a {@code *} (initial value 1). */
  public boolean starred() {
    for (int index = 0; index < text.length(); ++index) {
      char c = text.charAt(index);
      if (c == '*')
        return true;
      if (c != '~')
        return false;
    }
    return false;
  }
  
  
  /** Returns the text sans {@code ~} and {@code *} prefixes. */
  public String body() {
    int index = 0;
    while (index < text.length() && (text.charAt(index) == '~' || text.charAt(index) == '*'))
      ++index;
    return text.substring(index);
  }
  
  
  public boolean is(TokenType type) {
    return this.type == type;
  }
  
  
  @Override
  public String toString() {
    return type + "(" + text + ")";
  }

}
