/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.expand;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.boolsim.DiagnosticLog;
import io.crums.boolsim.lex.LexedStatement;
import io.crums.boolsim.lex.Lexer;
import io.crums.boolsim.store.ValueStore;

/**
 *
 */
public class MacroExpanderTest {

  private final ValueStore store = new ValueStore();
  private final DiagnosticLog log = new DiagnosticLog();
  private final Lexer lexer = new Lexer("Top", store, log);
  private final MacroExpander expander = new MacroExpander(store, log);


  private LexedStatement lex(String line) {
    var statement = lexer.lex(1, line);
    assertTrue(statement.isPresent(), () -> line + " -> " + log.diagnostics());
    return statement.get();
  }


  private List<String> expand(String line) {
    var expanded = expander.expand(lex(line));
    assertTrue(expanded.isPresent(), () -> line + " -> " + log.diagnostics());
    return expanded.get();
  }


  @Test
  public void testNeedsExpansion() {
    assertFalse(expander.needsExpansion(lex("a = b c;")));
    assertFalse(expander.needsExpansion(lex("%b{a b};")));
    assertTrue(expander.needsExpansion(lex("y[1..0] = x[1..0];")));
    assertTrue(expander.needsExpansion(lex("z = {a b} == 2'b10;")));
  }


  @Test
  public void testDisplayVectors() {
    assertEquals(List.of("x2 x1 x0 *y1 *y0;"), expand("x[2..0] *y[1..0];"));
  }


  @Test
  public void testFormatterKeepsBraces() {
    assertEquals(List.of("%b{a1 a0} %h{b3 b2 b1 b0};"), expand("%b{a[1..0]} %h{b[3..0]};"));
  }


  @Test
  public void testVertical() {
    assertEquals(
        List.of("s1 = a1 ^ b1;", "s0 = a0 ^ b0;"),
        expand("s[1..0] = a[1..0] ^ b[1..0];"));
  }


  @Test
  public void testSteppedVector() {
    assertEquals(
        List.of("y4 = x2;", "y2 = x1;", "y0 = x0;"),
        expand("y[4.2.0] = x[2..0];"));
  }


  @Test
  public void testImplicitVector() {
    lex("x[3..0];");
    assertEquals(
        List.of("y3 = ~x3;", "y2 = ~x2;", "y1 = ~x1;", "y0 = ~x0;"),
        expand("y[3..0] = ~x[];"));
  }


  @Test
  public void testConstantPaddedVertically() {
    assertEquals(
        List.of("y2 = x2 | 0;", "y1 = x1 | 0;", "y0 = x0 | 1;"),
        expand("y[2..0] = x[2..0] | 'b1;"));
  }


  @Test
  public void testLoneConstantWrapped() {
    assertEquals(List.of("{a3 a2 a1 a0} = {1 0 1 0};"), expand("a[3..0] = 'hA;"));
    assertEquals(List.of("{b2 b1 b0} = {0 1 1};"), expand("b[2..0] = 3;"));
  }


  @Test
  public void testMathStaysOnOneLine() {
    assertEquals(
        List.of("{c s1 s0} = {a1 a0} + {b1 b0};"),
        expand("{c s[1..0]} = a[1..0] + b[1..0];"));
  }


  @Test
  public void testSingleBitComparison() {
    assertEquals(List.of("eq = {a3 a2 a1 a0} == 'hA;"), expand("eq = a[3..0] == 'hA;"));
  }


  @Test
  public void testSubmoduleConstantsToBits() {
    assertEquals(List.of("Adder.u(a1 a0, 0 1 : s);"), expand("Adder.u(a[1..0], 2'b01 : s);"));
  }


  @Test
  public void testMismatchedWidths() {
    assertTrue(expander.expand(lex("y[1..0] = x[2..0];")).isEmpty());
    assertEquals(
        "Vector and/or concatenation element counts must be consistent " +
        "across the entire expression.",
        log.diagnostics().get(0).message());
  }


  @Test
  public void testConstantTooWide() {
    assertTrue(expander.expand(lex("y[1..0] = 'b101;")).isEmpty());
    assertEquals("'b101 has more bits than its 2-bit dependent.", log.diagnostics().get(0).message());
  }


  @Test
  public void testIdempotent() {
    for (var line : List.of("a = b c;", "q <= ~d | e;", "a b *c;", "Adder.u(a, b : s);")) {
      assertEquals(List.of(line), expand(line));
    }
    for (var line : expand("t[1..0] = m[1..0] ^ n[1..0];"))
      assertEquals(List.of(line), expand(line));
  }

}
