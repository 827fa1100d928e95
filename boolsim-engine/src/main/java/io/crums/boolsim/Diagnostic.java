/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.util.Objects;

/**
 * A line-indexed problem found while parsing a design.
 * 
 * @param lineNo    1-based line number in the design source; zero if the
 *                  problem is not tied to a particular line
 * @param category  not null
 * @param message   not null, not blank
 */
public record Diagnostic(int lineNo, Category category, String message) {
  
  /** Diagnostic taxonomy. */
  public enum Category {
    /** Malformed or illegal token, unmatched grouping. */
    LEXICAL,
    /** Namespace or width conflicts, port-arity mismatch, oversized constants. */
    SEMANTIC,
    /** Circular combinational dependency, re-assignment of a dependent. */
    DEPENDENCY,
    /** Missing or header-less sub-design. */
    RESOLUTION;
  }
  
  
  public Diagnostic {
    if (lineNo < 0)
      throw new IllegalArgumentException("negative lineNo: " + lineNo);
    Objects.requireNonNull(category, "null category");
    if (message.isBlank())
      throw new IllegalArgumentException("blank message");
  }
  
  
  
  /** Returns {@code "Line N: message"}. */
  @Override
  public String toString() {
    return "Line " + lineNo + ": " + message;
  }

}
