/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.crums.boolsim.Diagnostic;
import io.crums.boolsim.DiagnosticLog;
import io.crums.boolsim.store.ValueStore;

/**
 *
 */
public class LexerTest {

  private final ValueStore store = new ValueStore();
  private final DiagnosticLog log = new DiagnosticLog();
  private final Lexer lexer = new Lexer("Top", store, log);


  private StatementType typeOf(String line) {
    var statement = lexer.lex(1, line);
    assertTrue(statement.isPresent(), () -> line + " -> " + log.diagnostics());
    return statement.get().type();
  }


  private Diagnostic error(String line) {
    Optional<LexedStatement> statement = lexer.lex(7, line);
    assertTrue(statement.isEmpty(), line);
    var errors = log.forLine(7);
    assertEquals(1, errors.size());
    return errors.get(0);
  }


  @Test
  public void testStatementTypes() {
    assertEquals(StatementType.EMPTY, typeOf("   "));
    assertEquals(StatementType.COMMENT, typeOf("\"half adder\";"));
    assertEquals(StatementType.COMMENT, typeOf("  -\"hidden\""));
    assertEquals(StatementType.LIBRARY, typeOf("#library parts;"));
    assertEquals(StatementType.DISPLAY, typeOf("a b *c;"));
    assertEquals(StatementType.DISPLAY, typeOf("%b{a b} %h{x[3..0]};"));
    assertEquals(StatementType.BOOLEAN, typeOf("y = a b | ~c;"));
    assertEquals(StatementType.CLOCK, typeOf("q <= d;"));
    assertEquals(StatementType.CLOCK, typeOf("r <=@clk d;"));
    assertEquals(StatementType.MODULE, typeOf("Top(a, b : y);"));
    assertEquals(StatementType.SUBMODULE, typeOf("Half.h1(a, b : s, c);"));
    assertTrue(log.isEmpty());
  }


  @Test
  public void testTokens() {
    var statement = lexer.lex(1, "y = ~(a b) {c 1'b0};").get();
    var types = statement.significantTokens().stream().map(Token::type).toList();
    assertEquals(
        List.of(
            TokenType.SCALAR, TokenType.ASSIGN, TokenType.NOT, TokenType.LPAREN,
            TokenType.SCALAR, TokenType.SCALAR, TokenType.RPAREN, TokenType.LBRACE,
            TokenType.SCALAR, TokenType.CONSTANT, TokenType.RBRACE, TokenType.SEMICOLON),
        types);
    assertEquals(statement.text(), statement.joinTokens());
  }


  @Test
  public void testNamespacesRegistered() {
    typeOf("x[3..0] = y[3..0];");
    assertEquals(List.of("x3", "x2", "x1", "x0"), store.components("x"));
    assertEquals(4, store.namespace("y").get().width());
    typeOf("z = x[] y4;");
    assertEquals(5, store.namespace("y").get().width());
  }


  @Test
  public void testMissingSemicolon() {
    assertEquals("Missing ';'.", error("a = b").message());
  }


  @Test
  public void testInvalidCharacter() {
    var d = error("a = b & c;");
    assertEquals(Diagnostic.Category.LEXICAL, d.category());
    assertEquals("Invalid character '&'.", d.message());
  }


  @Test
  public void testUnmatched() {
    assertEquals("Unmatched ')'.", error("a = b c);").message());
    assertEquals("'(' is not matched.", error("a = (b c;").message());
  }


  @Test
  public void testImplicitVectorNeedsDimension() {
    var d = error("a = w[];");
    assertEquals(Diagnostic.Category.SEMANTIC, d.category());
    assertEquals("'w[]' cannot be used without an explicit dimension somewhere.", d.message());
  }


  @Test
  public void testScalarVectorConflict() {
    typeOf("n = a;");
    var d = error("n[1..0] = b[1..0];");
    assertEquals("Namespace 'n' is already being used by a scalar.", d.message());
  }


  @Test
  public void testOversizedConstant() {
    assertEquals("Constant can have at most 32 bits.", error("a = 33'b0;").message());
    assertEquals("2'hF doesn't specify enough bits.", error("a[1..0] = 2'hF;").message());
  }


  @Test
  public void testMixedMathAndBoolean() {
    assertEquals(
        "'+' and '-' can't appear with boolean operators.",
        error("s = {a b} + {c d} | e;").message());
  }


  @Test
  public void testStarOutsideVariableList() {
    assertEquals(
        "'*' can only be used in a variable list statement.",
        error("*a = b;").message());
  }


  @Test
  public void testSelfInstantiation() {
    assertEquals(
        "You cannot instantiate from the current design.",
        error("Top.t(a : b);").message());
  }


  @Test
  public void testDuplicateInstanceName() {
    typeOf("Half.h1(a, b : s, c);");
    assertEquals(
        "Instantiation name 'h1' is already being used.",
        error("Full.h1(a, b : s, c);").message());
    // re-lexing an expanded line skips the check
    assertTrue(lexer.relex(1, "Half.h1(a, b : s, c);").isPresent());
  }


  @Test
  public void testConstantInModuleHeader() {
    assertEquals(
        "Module ports must be scalars, vectors or concatenations of them.",
        error("Top(a, 1 : y);").message());
  }


  @Test
  public void testFormatterOutsideBraces() {
    assertEquals(
        "Scalars and vectors in a format specifier statement must be inside a format specifier.",
        error("%b{a b} c;").message());
  }

}
