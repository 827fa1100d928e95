/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.stmt;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.crums.boolsim.eval.Expression;
import io.crums.boolsim.eval.ExpressionSolver;
import io.crums.boolsim.store.Node;
import io.crums.boolsim.store.ValueStore;

/**
 * Evaluates an expression and writes the result's low bits to its targets,
 * most significant target first. The targets are either a combinational
 * assignment's dependents, or a clocked assignment's {@code .d} slots.
 */
public class AssignmentNode implements Node {
  
  private final List<String> targets;
  private final Expression expression;
  private final List<String> inputs;
  
  
  /**
   * @param targets     names written, most significant first (1 to 32 of them)
   * @param expression  the expression evaluated
   */
  public AssignmentNode(List<String> targets, Expression expression) {
    this.targets = List.copyOf(targets);
    this.expression = Objects.requireNonNull(expression, "null expression");
    this.inputs = expression.reads();
    if (this.targets.isEmpty() || this.targets.size() > 32)
      throw new IllegalArgumentException("targets: " + targets);
  }
  
  
  public List<String> targets() {
    return targets;
  }
  
  
  public Expression expression() {
    return expression;
  }
  

  @Override
  public List<String> inputs() {
    return inputs;
  }
  

  @Override
  public List<String> update(ValueStore store) {
    long value = ExpressionSolver.solve(expression, store).value(targets.size());
    List<String> changed = new ArrayList<>(2);
    final int last = targets.size() - 1;
    for (int index = 0; index <= last; ++index) {
      boolean bit = ((value >>> (last - index)) & 1L) == 1L;
      String name = targets.get(index);
      if (store.assign(name, bit))
        changed.add(name);
    }
    return changed;
  }
  
  
  @Override
  public String toString() {
    return targets + " <- " + expression;
  }

}
