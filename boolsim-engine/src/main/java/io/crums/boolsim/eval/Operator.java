/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.eval;


import io.crums.boolsim.lex.TokenType;

/**
 * Binary operators, by precedence. Boolean operators treat any non-zero
 * value as 1 and yield 0 or 1; {@code ==} compares (integer) values; the
 * math operators work on unsigned integers (the result is masked to the
 * dependent's width by the caller).
 */
public enum Operator {
  
  /** Juxtaposition. */
  AND(3, " "),
  OR(2, "|"),
  XOR(1, "^"),
  EQUALS(1, "=="),
  PLUS(1, "+"),
  MINUS(1, "-");
  
  
  private final int precedence;
  private final String symbol;
  
  private Operator(int precedence, String symbol) {
    this.precedence = precedence;
    this.symbol = symbol;
  }
  
  
  public int precedence() {
    return precedence;
  }
  
  public String symbol() {
    return symbol;
  }
  
  
  public long apply(long left, long right) {
    return switch (this) {
    case AND -> bool(left != 0 && right != 0);
    case OR -> bool(left != 0 || right != 0);
    case XOR -> bool((left != 0) ^ (right != 0));
    case EQUALS -> bool(left == right);
    case PLUS -> left + right;
    case MINUS -> left - right;
    };
  }
  
  
  private static long bool(boolean value) {
    return value ? 1 : 0;
  }
  
  
  /** Maps an operator token type to its operator. */
  public static Operator of(TokenType type) {
    return switch (type) {
    case OR -> OR;
    case XOR -> XOR;
    case EQUALS -> EQUALS;
    case PLUS -> PLUS;
    case MINUS -> MINUS;
    default -> throw new IllegalArgumentException("not an operator: " + type);
    };
  }

}
