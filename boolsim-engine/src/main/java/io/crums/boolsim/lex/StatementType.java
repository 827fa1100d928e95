/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


/**
 * Statement kinds inferred by the {@linkplain Lexer}.
 */
public enum StatementType {
  /** Blank line. */
  EMPTY,
  /** Quoted comment line, optionally flagged {@code +} or {@code -}. */
  COMMENT,
  /** {@code #library path;} directive. */
  LIBRARY,
  /** Variable list or format-specifier display statement. */
  DISPLAY,
  /** The design's own header ({@code Name(ins : outs);}). */
  MODULE,
  /** Sub-design instantiation ({@code Child.inst(ins : outs);}). */
  SUBMODULE,
  /** Combinational assignment ({@code dep = expr;}). */
  BOOLEAN,
  /** Clocked assignment ({@code dep <= expr;} or {@code dep <=@clk expr;}). */
  CLOCK;
  
  
  public boolean isAssignment() {
    return this == BOOLEAN || this == CLOCK;
  }

}
