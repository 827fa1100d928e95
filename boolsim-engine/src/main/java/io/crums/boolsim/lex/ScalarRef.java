/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


/**
 * Parsed scalar reference.
 * 
 * @param namespace base name (never ends in a digit)
 * @param bit       bit index, or -1 if a plain scalar
 */
public record ScalarRef(String namespace, int bit) {
  
  /** Returns the variable name ({@code namespace} followed by the bit, if any). */
  public String name() {
    return bit == -1 ? namespace : namespace + bit;
  }
  
  public boolean isVectorComponent() {
    return bit != -1;
  }

}
