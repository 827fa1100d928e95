/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


/**
 * Token categories produced by the {@linkplain Lexer}.
 */
public enum TokenType {
  
  /** Scalar name, optionally with bit index ({@code a}, {@code a3}). May carry {@code ~} or {@code *} prefixes. */
  SCALAR,
  /** Vector reference ({@code a[3..0]}, {@code a[6.2.0]}, {@code a[]}). May carry {@code ~} or {@code *} prefixes. */
  VECTOR,
  /** Numeric constant ({@code 'b01}, {@code 4'hA}, {@code 12}). May carry a {@code ~} prefix. */
  CONSTANT,
  /** Format specifier ({@code %b}, {@code %h}, {@code %d}, {@code %u}). */
  FORMATTER,
  /** The current design's own name, opening a module declaration. */
  MODULE_NAME,
  /** {@code Design.instance}, opening a submodule instantiation. */
  INSTANCE,
  /** {@code =} */
  ASSIGN,
  /** {@code <=} or {@code <=@clock} */
  CLOCK_ASSIGN,
  /** {@code |} */
  OR,
  /** {@code ^} */
  XOR,
  /** {@code ==} */
  EQUALS,
  /** {@code +} */
  PLUS,
  /** {@code -} */
  MINUS,
  /** Free-standing {@code ~} attached to a parenthesis or concatenation. */
  NOT,
  LPAREN,
  RPAREN,
  LBRACE,
  RBRACE,
  COMMA,
  COLON,
  SEMICOLON,
  /** A run of whitespace. */
  SPACE;
  
  
  
  /** Scalar, vector or constant. */
  public boolean isOperand() {
    return this == SCALAR || this == VECTOR || this == CONSTANT;
  }
  
  /** Scalar or vector. */
  public boolean isVariable() {
    return this == SCALAR || this == VECTOR;
  }
  
  /** Explicit binary operators (juxtaposition AND is implicit). */
  public boolean isBinaryOperator() {
    return switch (this) {
    case OR, XOR, EQUALS, PLUS, MINUS -> true;
    default -> false;
    };
  }
  
  /** {@code +} or {@code -}. */
  public boolean isMath() {
    return this == PLUS || this == MINUS;
  }
  
  public boolean isAssignment() {
    return this == ASSIGN || this == CLOCK_ASSIGN;
  }

}
