/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.eval;


/**
 * The value of an expression, along with the value of each of its
 * parenthesized sub-expressions (indexed by {@linkplain Term.Open#index()}).
 */
public record Solution(long value, long[] parens) {
  
  /** Returns the value of the given parenthesis pair. */
  public long paren(int index) {
    return parens[index];
  }
  
  /** Returns the value masked to the given width. */
  public long value(int width) {
    return width >= 64 ? value : value & ((1L << width) - 1);
  }

}
