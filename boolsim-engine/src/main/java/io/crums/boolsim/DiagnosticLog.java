/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.crums.boolsim.Diagnostic.Category;

/**
 * Accumulates the diagnostics of a single parse pass. Scanning continues
 * after a bad line, so a pass typically collects every problem before
 * it is reported as failed.
 */
public class DiagnosticLog {
  
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  
  
  
  public void add(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }
  
  
  public void add(int lineNo, Category category, String message) {
    add(new Diagnostic(lineNo, category, message));
  }
  
  
  public void lexical(int lineNo, String message) {
    add(lineNo, Category.LEXICAL, message);
  }
  
  public void semantic(int lineNo, String message) {
    add(lineNo, Category.SEMANTIC, message);
  }
  
  public void dependency(int lineNo, String message) {
    add(lineNo, Category.DEPENDENCY, message);
  }
  
  public void resolution(int lineNo, String message) {
    add(lineNo, Category.RESOLUTION, message);
  }
  
  
  /** Returns {@code true} if nothing has been logged. */
  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }
  
  
  public int size() {
    return diagnostics.size();
  }
  
  
  /** Returns a read-only view of the diagnostics, in the order logged. */
  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }
  
  
  /** Returns the diagnostics logged for the given line. */
  public List<Diagnostic> forLine(int lineNo) {
    return diagnostics.stream().filter(d -> d.lineNo() == lineNo).toList();
  }

}
