/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.eval;


import java.util.List;

/**
 * Elements of a parsed {@linkplain Expression}, in source order.
 */
public sealed interface Term {
  
  /** A scalar variable reference. */
  record Scalar(String name, boolean negated) implements Term {  }
  
  /**
   * A numeric constant.
   * 
   * @param text    as written (sans {@code ~})
   * @param value   unsigned value
   * @param width   bit width
   */
  record Literal(String text, long value, int width, boolean negated) implements Term {  }
  
  /**
   * A concatenation, evaluated as an unsigned integer, most significant
   * member first.
   * 
   * @param members {@linkplain Scalar}s (never negated) and {@linkplain Literal}s
   */
  record Concat(List<Term> members, boolean negated) implements Term {
    public Concat {
      members = List.copyOf(members);
    }
    
    /** Total bit width. */
    public int width() {
      int width = 0;
      for (var m : members)
        width += m instanceof Literal lit ? lit.width() : 1;
      return width;
    }
  }
  
  /**
   * An opening parenthesis.
   * 
   * @param index   ordinal of the parenthesis pair in the expression
   */
  record Open(int index, boolean negated) implements Term {  }
  
  /**
   * A closing parenthesis.
   * 
   * @param index   ordinal of the matching {@linkplain Open}
   */
  record Close(int index) implements Term {  }
  
  /** A binary operator (juxtaposition included). */
  record Op(Operator operator) implements Term {  }

}
