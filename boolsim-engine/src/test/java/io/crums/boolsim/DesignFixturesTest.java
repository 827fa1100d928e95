/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.boolsim.stmt.DisplayToken;

/**
 * Runs the design files under this package's test resources.
 */
public class DesignFixturesTest {

  /** 2-bit adder, instantiating {@code FullAdder} (which instantiates {@code Half}). */
  public final static String RIPPLE = "Ripple.vbi";


  private File resource(String name) throws Exception {
    return new File(getClass().getResource(name).toURI());
  }


  @Test
  public void testRippleAdder() throws Exception {
    var design = Design.load(resource(RIPPLE), Config.DEFAULT);
    assertEquals("Ripple", design.name());

    var result = design.run();
    assertTrue(result.ok(), () -> result.diagnostics().toString());
    var formatters = DesignTest.formatters(result);
    assertEquals(3, formatters.size());
    assertEquals("3", formatters.get(0).text());
    assertEquals("0", formatters.get(1).text());
    assertEquals("3", formatters.get(2).text());
    assertEquals("00", formatters.get(0).nextValue().get());
    assertTrue(formatters.get(2).nextValue().isEmpty());

    var b = formatters.get(1);
    var next = design.click(b.variables(), b.nextValue().get());
    assertEquals("4", DesignTest.formatters(next).get(2).text());

    next = design.click(List.of("a1", "a0", "b1", "b0"), "1111");
    assertEquals("6", DesignTest.formatters(next).get(2).text());
  }


  @Test
  public void testHiddenCommentNotRendered() throws Exception {
    var result = Design.load(resource(RIPPLE), Config.DEFAULT).run();
    var comments = result.tokens().stream().filter(t -> t instanceof DisplayToken.Comment).toList();
    assertEquals(List.of(new DisplayToken.Comment("2-bit ripple carry adder")), comments);
  }


  @Test
  public void testNestedInstances() throws Exception {
    var design = Design.load(resource(RIPPLE), Config.DEFAULT);
    design.run();
    var instances = design.circuit().get().instances();
    assertEquals(2, instances.size());
    for (var instance : instances) {
      assertEquals("FullAdder", instance.child().name());
      assertEquals(2, instance.child().instances().size());
    }
  }

}
