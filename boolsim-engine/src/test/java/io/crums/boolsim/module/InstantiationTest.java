/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.module;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.boolsim.Config;
import io.crums.boolsim.Design;
import io.crums.boolsim.Diagnostic;
import io.crums.boolsim.ParseResult;
import io.crums.boolsim.stmt.DisplayToken;

/**
 * Sub-design instantiation, using design files written to a temp directory.
 */
public class InstantiationTest {

  final static String HALF =
      """
      Half(a, b : s, c);
      s = a ^ b;
      c = a b;
      """;

  final static String GATE =
      """
      Gate(a, b : y);
      y = a b;
      """;

  final static String REG =
      """
      Reg(d : q);
      q <= d;
      """;

  final static String ADDER =
      """
      Adder(a[1..0], b[1..0] : s[2..0]);
      s[2..0] = a[1..0] + b[1..0];
      """;


  @TempDir
  Path dir;


  private File write(String name, String text) throws IOException {
    return write(dir, name, text);
  }


  private static File write(Path dir, String name, String text) throws IOException {
    Files.createDirectories(dir);
    var path = dir.resolve(name + ".vbi");
    Files.writeString(path, text);
    return path.toFile();
  }


  private static Design load(File file) {
    return Design.load(file, Config.DEFAULT);
  }


  private static void assertOk(ParseResult result) {
    assertTrue(result.ok(), () -> result.diagnostics().toString());
  }


  private static boolean value(Design design, String name) {
    return design.circuit().get().store().value(name);
  }


  private static List<String> messages(ParseResult result) {
    return result.diagnostics().stream().map(Diagnostic::message).toList();
  }


  @Test
  public void testHalfAdder() throws Exception {
    write("Half", HALF);
    var top = load(write("Top", "x y;\nHalf.h(x, y : sum, carry);\n"));
    assertOk(top.run(Map.of("x", true, "y", true)));
    assertFalse(value(top, "sum"));
    assertTrue(value(top, "carry"));

    assertOk(top.click("y"));
    assertTrue(value(top, "sum"));
    assertFalse(value(top, "carry"));

    var circuit = top.circuit().get();
    assertEquals(1, circuit.instances().size());
    assertEquals("h", circuit.instances().get(0).instance());
    assertEquals(List.of("sum", "carry"), circuit.instances().get(0).outputs());
  }


  @Test
  public void testRenderInstance() throws Exception {
    write("Half", HALF);
    var result = load(write("Top", "Half.h(x, y : NC, carry);")).run();
    assertOk(result);
    var tokens = result.tokens();
    assertEquals(new DisplayToken.Instance("Half", "h"), tokens.get(0));
    assertTrue(tokens.contains(new DisplayToken.Punctuation("NC")));
    assertTrue(tokens.contains(new DisplayToken.Variable("carry", false, false, false)));
    assertTrue(tokens.contains(new DisplayToken.Variable("x", false, true, false)));
  }


  @Test
  public void testNoContact() throws Exception {
    write("Half", HALF);
    var top = load(write("Top", "*x *y;\nHalf.h(x, y : NC, carry);\n"));
    assertOk(top.run());
    assertTrue(value(top, "carry"));
    assertFalse(top.circuit().get().store().contains("NC"));
  }


  @Test
  public void testVectorPorts() throws Exception {
    write("Adder", ADDER);
    var top = load(write("Top", "*p[1..0] q[1..0];\nAdder.u(p[1..0], q[1..0] : r[2..0]);\n"));
    assertOk(top.run());
    assertFalse(value(top, "r2"));
    assertTrue(value(top, "r1"));
    assertTrue(value(top, "r0"));

    top.click("q0");
    assertTrue(value(top, "r2"));
    assertFalse(value(top, "r1"));
    assertFalse(value(top, "r0"));
  }


  @Test
  public void testConstantInputs() throws Exception {
    write("Gate", GATE);
    var top = load(write("Top", "x;\nGate.g(x, 1 : y);\nGate.n(x, 0 : z);\n"));
    assertOk(top.run());
    assertFalse(value(top, "y"));
    top.click("x");
    assertTrue(value(top, "y"));
    assertFalse(value(top, "z"));
  }


  @Test
  public void testInputArity() throws Exception {
    write("Gate", GATE);
    var result = load(write("Top", "Gate.g(x, y, z : o);")).run();
    assertFalse(result.ok());
    var d = result.diagnostics().get(0);
    assertEquals(Diagnostic.Category.SEMANTIC, d.category());
    assertEquals(1, d.lineNo());
    assertEquals("Instantiation 'g' has 3 input(s), but design 'Gate' declares 2.", d.message());
  }


  @Test
  public void testOutputArity() throws Exception {
    write("Gate", GATE);
    var result = load(write("Top", "Gate.g(x, y : o, p, q);")).run();
    assertEquals(
        List.of("Instantiation 'g' has 3 output(s), but design 'Gate' declares 1."),
        messages(result));
  }


  @Test
  public void testPortWidth() throws Exception {
    write("Gate", GATE);
    var result = load(write("Top", "Gate.g(x[1..0], y : o);")).run();
    assertEquals(
        List.of("Input 1 of instantiation 'g' has 2 bit(s), but design 'Gate' expects 1."),
        messages(result));
  }


  @Test
  public void testConstantOutput() throws Exception {
    write("Gate", GATE);
    var result = load(write("Top", "Gate.g(x, y : 1);")).run();
    assertEquals(
        List.of("Instantiation outputs must be scalars, vectors or concatenations of them."),
        messages(result));
  }


  @Test
  public void testMissingDesign() throws Exception {
    write("Plain", "a = b;\n");
    var result = load(write("Top", "Nope.n(x : y);\nPlain.p(x : z);")).run();
    assertEquals(
        List.of(
            "Unable to find a design named 'Nope' with a module declaration.",
            "Unable to find a design named 'Plain' with a module declaration."),
        messages(result));
    assertEquals(Diagnostic.Category.RESOLUTION, result.diagnostics().get(0).category());
  }


  @Test
  public void testChildErrorsForwarded() throws Exception {
    write("Bad", "Bad(a : y);\ny = a &;\n");
    var result = load(write("Top", "Bad.b(x : z);")).run();
    assertFalse(result.ok());
    assertTrue(
        messages(result).contains("Error in design 'Bad' (Line 2: Invalid character '&'.)."),
        messages(result).toString());
  }


  @Test
  public void testCyclicInstantiation() throws Exception {
    write("B", "B(i : o);\nA.a(i : o);\n");
    var a = load(write("A", "A(i : o);\nB.b(i : o);\n"));
    var result = a.run();
    assertFalse(result.ok());
    assertTrue(
        messages(result).stream().anyMatch(m -> m.contains("Cyclic instantiation: A -> B -> A.")),
        messages(result).toString());
  }


  @Test
  public void testLoopThroughInstance() throws Exception {
    write("Buf", "Buf(a : y);\ny = a;\n");
    var result = load(write("Top", "Buf.b(x : z);\nx = z;\n")).run();
    assertFalse(result.ok());
    assertEquals(List.of("Circular dependency found for 'x'."), messages(result));
    var d = result.diagnostics().get(0);
    assertEquals(Diagnostic.Category.DEPENDENCY, d.category());
    assertEquals(2, d.lineNo());

    result = load(write("Top2", "x = z;\nBuf.b(x : z);\n")).run();
    assertEquals(List.of("Circular dependency found for 'z'."), messages(result));
    assertEquals(2, result.diagnostics().get(0).lineNo());
  }


  @Test
  public void testOscillatingLoopThroughInstance() throws Exception {
    write("Inv", "Inv(a : y);\ny = ~a;\n");
    var result = load(write("Top", "Inv.i(x : z);\nx = z;\n")).run();
    assertFalse(result.ok());
    assertEquals(List.of("Circular dependency found for 'x'."), messages(result));
  }


  @Test
  public void testLoopThroughNestedInstance() throws Exception {
    write("Buf", "Buf(a : y);\ny = a;\n");
    write("Wrap", "Wrap(a : y);\nBuf.b(a : y);\n");
    var result = load(write("Top", "Wrap.w(x : z);\nx = ~z;\n")).run();
    assertEquals(List.of("Circular dependency found for 'x'."), messages(result));
  }


  @Test
  public void testLoopThroughRegisterAllowed() throws Exception {
    write("Reg", REG);
    var top = load(write("Top", "Reg.r(x : y);\nx = ~y;\n"));
    assertOk(top.run());
    assertFalse(value(top, "y"));
    assertTrue(value(top, "x"));

    top.tick();
    assertTrue(value(top, "y"));
    assertFalse(value(top, "x"));
    top.tick();
    assertFalse(value(top, "y"));
    assertTrue(value(top, "x"));
  }


  @Test
  public void testUnsettledPropagationReported() throws Exception {
    write("Gate", GATE);
    var props = new Properties();
    props.setProperty(Config.PROPAGATION_LIMIT, "1");
    var file = write("Top", "c = ~y;\nd = ~c;\nGate.g(1, 1 : y);\n");
    var result = Design.load(file, new Config(props)).run();
    assertFalse(result.ok());
    var d = result.diagnostics().get(0);
    assertEquals(Diagnostic.Category.DEPENDENCY, d.category());
    assertEquals(3, d.lineNo());
    assertTrue(d.message().startsWith("Values do not settle"), d.message());
  }


  @Test
  public void testChildTicks() throws Exception {
    write("Reg", REG);
    var top = load(write("Top", "*x;\nReg.r(x : y);\n"));
    assertOk(top.run());
    assertFalse(value(top, "y"));

    top.tick();
    assertTrue(value(top, "y"));

    top.click("x");
    assertTrue(value(top, "y"));
    top.tick();
    assertFalse(value(top, "y"));
  }


  @Test
  public void testInstancesKeepOwnState() throws Exception {
    write("Reg", REG);
    var top = load(write("Top", "*x;\nReg.r1(x : y);\nReg.r2(y : z);\n"));
    assertOk(top.run());

    top.tick();
    assertTrue(value(top, "y"));
    assertFalse(value(top, "z"));

    top.tick();
    assertTrue(value(top, "y"));
    assertTrue(value(top, "z"));

    var instances = top.circuit().get().instances();
    assertNotSame(instances.get(0).child(), instances.get(1).child());
  }


  @Test
  public void testChildAltClock() throws Exception {
    write("Latch", "Latch(d, clk : q);\nq <=@clk d;\n");
    var top = load(write("Top", "*x;\nk;\nLatch.l(x, k : y);\n"));
    assertOk(top.run());
    assertFalse(value(top, "y"));

    top.click("k");
    assertTrue(value(top, "y"));
    top.click("x");
    assertTrue(value(top, "y"));
    top.click("k");
    top.click("k");
    assertFalse(value(top, "y"));
  }


  @Test
  public void testLibraryDirective() throws Exception {
    write(dir.resolve("lib"), "Gate", GATE);
    var top = load(write("Top", "#library lib;\n*x *y;\nGate.g(x, y : o);\n"));
    assertOk(top.run());
    assertTrue(value(top, "o"));
  }


  @Test
  public void testBadLibrary() throws Exception {
    var result = load(write("Top", "#library nowhere;\nx;\n")).run();
    assertEquals(List.of("Library 'nowhere' is not a directory."), messages(result));
  }


  @Test
  public void testConfiguredLibraryPath() throws Exception {
    write(dir.resolve("parts"), "Gate", GATE);
    var props = new Properties();
    props.setProperty(Config.BASE_DIR, dir.toString());
    props.setProperty(Config.LIBRARY_PATHS, "parts");
    var config = new Config(props);
    var top = Design.load(write(dir.resolve("designs"), "Top", "*x *y;\nGate.g(x, y : o);\n"), config);
    assertOk(top.run());
    assertTrue(value(top, "o"));
  }

}
