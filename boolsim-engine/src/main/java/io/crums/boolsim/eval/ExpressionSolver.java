/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.eval;


import java.util.ArrayDeque;
import java.util.Deque;

import io.crums.boolsim.BoolsimException;
import io.crums.boolsim.store.ValueStore;

/**
 * Two-stack (operand / operator) evaluator.
 * <ul>
 * <li>{@code ~} binds to the immediately following primary (scalar,
 * constant, concatenation, or parenthesis).</li>
 * <li>Precedence: AND (juxtaposition) &gt; OR &gt; the exclusive operators
 * ({@code ^ == + -}). Same-precedence operators evaluate left to right.</li>
 * <li>A closing parenthesis folds pending operators down to its match, then
 * applies a pending {@code ~}.</li>
 * <li>A concatenation evaluates to an unsigned integer, most significant
 * member first; a negated one is complemented within its width.</li>
 * </ul>
 */
public class ExpressionSolver {
  
  private ExpressionSolver() {  }
  
  
  /**
   * Evaluates the given expression against the current values in the
   * store. Unknown variables read as 0.
   */
  public static Solution solve(Expression expression, ValueStore store) {
    Deque<Long> values = new ArrayDeque<>();
    Deque<Term> operators = new ArrayDeque<>();
    long[] parens = new long[expression.parenCount()];
    
    for (var term : expression.terms()) {
      if (term instanceof Term.Scalar s) {
        values.push(bit(store, s.name()) ^ (s.negated() ? 1L : 0L));
      
      } else if (term instanceof Term.Literal lit) {
        values.push(lit.negated() ? ~lit.value() & mask(lit.width()) : lit.value());
      
      } else if (term instanceof Term.Concat c) {
        long v = concatValue(c, store);
        values.push(c.negated() ? ~v & mask(c.width()) : v);
      
      } else if (term instanceof Term.Open) {
        operators.push(term);
      
      } else if (term instanceof Term.Close) {
        while (!(operators.peek() instanceof Term.Open))
          execute(values, operators);
        var open = (Term.Open) operators.pop();
        long v = values.pop();
        if (open.negated())
          v = v == 0 ? 1 : 0;
        parens[open.index()] = v;
        values.push(v);
      
      } else if (term instanceof Term.Op op) {
        while (operators.peek() instanceof Term.Op top &&
            top.operator().precedence() >= op.operator().precedence())
          execute(values, operators);
        operators.push(term);
      }
    }
    
    while (!operators.isEmpty())
      execute(values, operators);
    
    if (values.size() != 1)
      throw new BoolsimException(
          "malformed expression '%s' (%d values left on stack)"
          .formatted(expression.text(), values.size()));
    
    return new Solution(values.pop(), parens);
  }
  
  
  private static void execute(Deque<Long> values, Deque<Term> operators) {
    if (!(operators.pop() instanceof Term.Op op) || values.size() < 2)
      throw new BoolsimException("malformed expression: operator stack out of sync");
    long right = values.pop();
    long left = values.pop();
    values.push(op.operator().apply(left, right));
  }
  
  
  private static long bit(ValueStore store, String name) {
    return store.getValue(name) == 1 ? 1L : 0L;
  }
  
  
  /** Returns the unsigned value of the given concatenation. */
  public static long concatValue(Term.Concat concat, ValueStore store) {
    long value = 0;
    for (var member : concat.members()) {
      if (member instanceof Term.Literal lit)
        value = (value << lit.width()) | lit.value();
      else
        value = (value << 1) | bit(store, ((Term.Scalar) member).name());
    }
    return value;
  }
  
  
  static long mask(int width) {
    return width >= 64 ? -1L : (1L << width) - 1;
  }

}
