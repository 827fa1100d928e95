/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.util.List;

import io.crums.boolsim.stmt.DisplayToken;

/**
 * Outcome of a run, click or tick: either the rendered display tokens, or
 * the diagnostics explaining why there are none.
 *
 * @param tokens      rendered output (empty on failure)
 * @param diagnostics line-indexed diagnostics (empty on success)
 */
public record ParseResult(List<DisplayToken> tokens, List<Diagnostic> diagnostics) {

  public ParseResult {
    tokens = List.copyOf(tokens);
    diagnostics = List.copyOf(diagnostics);
    if (!tokens.isEmpty() && !diagnostics.isEmpty())
      throw new IllegalArgumentException("both tokens and diagnostics present");
  }


  public static ParseResult success(List<DisplayToken> tokens) {
    return new ParseResult(tokens, List.of());
  }


  public static ParseResult failure(List<Diagnostic> diagnostics) {
    if (diagnostics.isEmpty())
      throw new IllegalArgumentException("empty diagnostics");
    return new ParseResult(List.of(), diagnostics);
  }


  /** Shell-level misuse: a single {@code SEMANTIC} diagnostic at line 0. */
  public static ParseResult misuse(String message) {
    return failure(List.of(new Diagnostic(0, Diagnostic.Category.SEMANTIC, message)));
  }


  /** Returns {@code true} iff there are no diagnostics. */
  public boolean ok() {
    return diagnostics.isEmpty();
  }

}
