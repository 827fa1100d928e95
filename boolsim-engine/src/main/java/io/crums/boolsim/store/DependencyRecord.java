/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.store;


import java.util.List;
import java.util.Objects;

/**
 * Records the variables a dependent's defining expression reads, in the
 * order they appear, along with the raw expression text.
 */
public record DependencyRecord(String dependent, List<String> reads, String expression) {
  
  public DependencyRecord {
    Objects.requireNonNull(dependent, "null dependent");
    reads = List.copyOf(reads);
    Objects.requireNonNull(expression, "null expression");
  }

}
