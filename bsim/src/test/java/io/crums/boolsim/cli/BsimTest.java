/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.cli;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.boolsim.Design;
import io.crums.boolsim.DesignSource;
import io.crums.boolsim.stmt.DisplayToken;
import picocli.CommandLine;

/**
 *
 */
public class BsimTest {

  @TempDir
  Path dir;


  private String write(String name, String text) throws Exception {
    var path = dir.resolve(name + ".vbi");
    Files.writeString(path, text);
    return path.toString();
  }


  private static int execute(String... args) {
    return new CommandLine(new Bsim()).execute(args);
  }


  @Test
  public void testCheck() throws Exception {
    assertEquals(0, execute(Check.NAME, write("Good", "a = b c;\n")));
    assertEquals(Bsim.ERR_USER, execute(Check.NAME, write("Bad", "a = a;\n")));
  }


  @Test
  public void testCheckMissingFile() {
    var missing = dir.resolve("nope.vbi").toString();
    assertEquals(CommandLine.ExitCode.USAGE, execute(Check.NAME, missing));
  }


  @Test
  public void testRun() throws Exception {
    var path = write("Clocked", "q <= d;\n");
    assertEquals(0, execute(Run.NAME, "-s", "d=1", "-t", "2", path));
    assertEquals(0, execute(Run.NAME, "--json", path));
    assertEquals(CommandLine.ExitCode.USAGE, execute(Run.NAME, "-s", "d=2", path));
    assertEquals(CommandLine.ExitCode.USAGE, execute(Run.NAME, "-t", "-1", path));
  }


  @Test
  public void testSimCommands() {
    var design = new Design(new DesignSource("Top", "q <= d;\n"));
    assertTrue(design.run().ok());

    assertTrue(Sim.execute(design, new String[] { "click", "d" }).ok());
    var result = Sim.execute(design, new String[] { "tick", "1" });
    assertTrue(result.ok());
    assertTrue(design.circuit().get().store().value("q"));

    assertFalse(Sim.execute(design, new String[] { "click", "q" }).ok());
    assertTrue(Sim.execute(design, new String[] { "click", "d", "0" }).ok());
    assertTrue(Sim.execute(design, new String[] { "print" }).ok());
    assertTrue(Sim.execute(design, new String[] { "rerun" }).ok());

    assertNull(Sim.execute(design, new String[] { "tock" }));
    assertNull(Sim.execute(design, new String[] { "tick", "many" }));
    assertNull(Sim.execute(design, new String[] { "print", "twice" }));
  }


  @Test
  public void testTokenPrinter() {
    var tokens = List.<DisplayToken>of(
        new DisplayToken.Variable("a", false, false, false),
        new DisplayToken.Space(1),
        new DisplayToken.Operator("="),
        new DisplayToken.Space(1),
        new DisplayToken.Variable("b", true, true, true),
        new DisplayToken.Punctuation(";"),
        new DisplayToken.LineBreak());
    assertEquals("a:0 = ~b:0;\n", new TokenPrinter(false).toText(tokens));
  }

}
