/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.ArrayList;
import java.util.List;

/**
 * Parsed vector reference: {@code name[left.step.right]}, {@code name[left..right]}
 * or {@code name[]}.
 * 
 * @param namespace base name
 * @param left      first written bound; -1 for the implicit {@code name[]} form
 * @param step      step (defaults to 1)
 * @param right     second written bound; -1 for the implicit form
 */
public record VectorRef(String namespace, int left, int step, int right) {
  
  /** Returns {@code true} for the {@code name[]} form. */
  public boolean isImplicit() {
    return left == -1;
  }
  
  
  /** Returns the most significant bound. */
  public int msb() {
    return Math.max(left, right);
  }
  
  /** Returns the least significant bound. */
  public int lsb() {
    return Math.min(left, right);
  }
  
  
  /**
   * Returns the component names, most significant first. The bounds are
   * flipped if written low-to-high; with a step, the walk starts at the
   * most significant bound.
   * 
   * @throws IllegalStateException if {@linkplain #isImplicit() implicit}
   */
  public List<String> components() {
    if (isImplicit())
      throw new IllegalStateException("implicit vector " + namespace + "[]");
    List<String> out = new ArrayList<>();
    for (int bit = msb(); bit >= lsb(); bit -= step)
      out.add(namespace + bit);
    return out;
  }

}
