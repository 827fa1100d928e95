/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.eval;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.boolsim.DiagnosticLog;
import io.crums.boolsim.lex.Lexer;
import io.crums.boolsim.lex.TokenType;
import io.crums.boolsim.store.ValueStore;

/**
 *
 */
public class ExpressionSolverTest {

  private final ValueStore store = new ValueStore();
  private final DiagnosticLog log = new DiagnosticLog();
  private final Lexer lexer = new Lexer("Top", store, log);


  /** Parses the right hand side of {@code z = <rhs>;}. */
  private Expression parse(String rhs) {
    var statement = lexer.lex(1, "z = " + rhs + ";");
    assertTrue(statement.isPresent(), () -> rhs + " -> " + log.diagnostics());
    var tokens = statement.get().tokens();
    int assign = 0;
    while (!tokens.get(assign).is(TokenType.ASSIGN))
      ++assign;
    return Expression.parse(tokens.subList(assign + 1, tokens.size() - 1));
  }


  private void set(String name, boolean value) {
    if (!store.addVariable(name, value, true))
      store.assign(name, value);
  }


  private long solve(String rhs) {
    return ExpressionSolver.solve(parse(rhs), store).value();
  }


  @Test
  public void testAnd() {
    set("a", true);
    set("b", true);
    assertEquals(1, solve("a b"));
    set("b", false);
    assertEquals(0, solve("a b"));
    assertEquals(1, solve("a ~b"));
  }


  @Test
  public void testAndBindsTighterThanOr() {
    set("a", false);
    set("b", true);
    set("c", false);
    assertEquals(0, solve("a | b c"));
    assertEquals(1, solve("a | b ~c"));
    assertEquals(0, solve("(a | b) c"));
  }


  @Test
  public void testXor() {
    set("a", true);
    set("b", true);
    assertEquals(0, solve("a ^ b"));
    assertEquals(1, solve("a ^ ~b"));
    assertEquals(1, solve("a ^ b ^ a"));
  }


  @Test
  public void testNegatedParens() {
    set("a", true);
    set("b", true);
    var expression = parse("~(a b) | ~~(a)");
    var solution = ExpressionSolver.solve(expression, store);
    assertEquals(2, expression.parenCount());
    assertEquals(0, solution.paren(0));
    assertEquals(1, solution.paren(1));
    assertEquals(1, solution.value());
  }


  @Test
  public void testUnknownReadsZero() {
    assertEquals(0, solve("nope"));
    assertEquals(1, solve("~nope"));
  }


  @Test
  public void testConcatValue() {
    set("a", true);
    set("b", false);
    set("c", true);
    assertEquals(5, solve("{a b c}"));
    assertEquals(2, solve("~{a b c}"));
    assertEquals(0b1011, solve("{a 2'b01 c}"));
  }


  @Test
  public void testMath() {
    set("a1", true);
    set("a0", true);
    set("b1", false);
    set("b0", true);
    assertEquals(4, solve("{a1 a0} + {b1 b0}"));
    assertEquals(2, solve("{a1 a0} - {b1 b0}"));
    assertEquals(4, ExpressionSolver.solve(parse("{a1 a0} + {b1 b0}"), store).value(3));
    assertEquals(0, ExpressionSolver.solve(parse("{a1 a0} + {b1 b0}"), store).value(2));
    assertTrue(parse("{a1 a0} + 1").isMath());
  }


  @Test
  public void testEquality() {
    set("a1", true);
    set("a0", false);
    assertEquals(1, solve("{a1 a0} == 2"));
    assertEquals(0, solve("{a1 a0} == 'b11"));
    assertEquals(1, solve("a1 == ~a0"));
  }


  @Test
  public void testReads() {
    var expression = parse("a ~b | {c a 1'b1} (d)");
    assertEquals(List.of("a", "b", "c", "d"), expression.reads());
  }

}
