/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.store;


import java.util.ArrayList;
import java.util.List;

import io.crums.boolsim.BoolsimConstants;

/**
 * Vector-namespace metadata. A namespace is either scalar-only (just
 * the bare name) or vector-only (name plus bit indices, each between 0
 * and 31). The declared bits of a vector namespace always form a
 * contiguous range: declaring a bit outside the current range fills in
 * the bits in between.
 */
public final class Namespace {
  
  private final String name;
  private final boolean vector;
  private int msb = -1;
  private int lsb = -1;
  
  
  Namespace(String name, boolean vector) {
    this.name = name;
    this.vector = vector;
  }
  
  
  
  public String name() {
    return name;
  }
  
  /** Returns {@code true} if this is a vector namespace. */
  public boolean isVector() {
    return vector;
  }
  
  /** Returns {@code true} if this is a scalar namespace. */
  public boolean isScalar() {
    return !vector;
  }
  
  
  /** Most significant declared bit; -1 if a scalar namespace. */
  public int msb() {
    return msb;
  }
  
  /** Least significant declared bit; -1 if a scalar namespace. */
  public int lsb() {
    return lsb;
  }
  
  
  /** Returns the number of bits in the namespace (1 for scalars). */
  public int width() {
    return vector ? msb - lsb + 1 : 1;
  }
  
  
  void addBit(int bit) {
    if (!vector)
      throw new IllegalStateException("scalar namespace " + name);
    if (bit < 0 || bit > BoolsimConstants.MAX_BIT_INDEX)
      throw new IllegalArgumentException("bit out of bounds: " + bit);
    if (msb == -1) {
      msb = lsb = bit;
    } else {
      msb = Math.max(msb, bit);
      lsb = Math.min(lsb, bit);
    }
  }
  
  
  /**
   * Returns the variable names in this namespace, most significant
   * first. For a scalar namespace, it's just the name.
   */
  public List<String> components() {
    if (!vector)
      return List.of(name);
    List<String> out = new ArrayList<>(width());
    for (int bit = msb; bit >= lsb; --bit)
      out.add(name + bit);
    return out;
  }
  
  
  @Override
  public String toString() {
    return vector ? name + "[" + msb + ".." + lsb + "]" : name;
  }

}
