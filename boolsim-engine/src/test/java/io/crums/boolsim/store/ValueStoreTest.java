/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.store;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.boolsim.DiagnosticLog;

/**
 *
 */
public class ValueStoreTest {

  /** Copies {@code from} to {@code to}, optionally inverted. */
  record CopyNode(String from, String to, boolean invert) implements Node {

    @Override
    public List<String> inputs() {
      return List.of(from);
    }

    @Override
    public List<String> update(ValueStore store) {
      boolean value = store.value(from) ^ invert;
      return store.assign(to, value) ? List.of(to) : List.of();
    }
  }


  @Test
  public void testAddVariable() {
    var store = new ValueStore();
    assertTrue(store.addVariable("a", true, true));
    assertFalse(store.addVariable("a", false, false));
    assertTrue(store.value("a"));
    assertTrue(store.isIndependent("a"));
    assertEquals(1, store.getValue("a"));
    assertEquals(ValueStore.UNKNOWN, store.getValue("b"));
    assertThrows(IllegalArgumentException.class, () -> store.value("b"));
  }


  @Test
  public void testMakeDependent() {
    var store = new ValueStore();
    store.addVariable("a", true, true);
    store.makeDependent("a");
    assertTrue(store.isDependent("a"));
    assertFalse(store.isIndependent("a"));
    assertTrue(store.value("a"));
  }


  @Test
  public void testNamespaceConflicts() {
    var store = new ValueStore();
    var log = new DiagnosticLog();
    assertTrue(store.updateNamespace("a", 3, 1, log));
    assertTrue(store.updateNamespace("a", 0, 1, log));
    assertFalse(store.updateNamespace("a", -1, 2, log));
    assertTrue(store.updateNamespace("s", -1, 3, log));
    assertTrue(store.updateNamespace("s", -1, 4, log));
    assertFalse(store.updateNamespace("s", 1, 5, log));
    assertFalse(store.updateNamespace("x", 32, 6, log));

    assertEquals(3, log.size());
    assertEquals(List.of("a3", "a2", "a1", "a0"), store.components("a"));
    assertEquals(4, store.namespace("a").get().width());
    assertEquals(List.of(), store.components("s"));
  }


  @Test
  public void testCycleDetection() {
    var store = new ValueStore();
    assertTrue(store.tryAddDependencyList("a", List.of("b", "c"), "b c"));
    assertTrue(store.tryAddDependencyList("b", List.of("d"), "d"));
    assertFalse(store.tryAddDependencyList("d", List.of("a"), "a"));
    assertFalse(store.tryAddDependencyList("e", List.of("e"), "e"));
    assertFalse(store.hasDependencyList("d"));
    assertTrue(store.hasDependencyList("b"));
    assertThrows(
        IllegalStateException.class,
        () -> store.tryAddDependencyList("a", List.of("x"), "x"));
  }


  @Test
  public void testPropagate() {
    var store = new ValueStore();
    store.addVariable("a", false, true);
    store.addVariable("b", false, false);
    store.addVariable("c", false, false);
    store.register(new CopyNode("a", "b", true));
    store.register(new CopyNode("b", "c", false));

    // nodes only run when a change reaches them
    assertFalse(store.value("b"));
    assertEquals(0, store.propagate(List.of()));

    assertTrue(store.setValue("a", true));
    assertFalse(store.value("b"));
    assertFalse(store.value("c"));

    assertTrue(store.setValue("a", false));
    assertTrue(store.value("b"));
    assertTrue(store.value("c"));
    assertFalse(store.setValue("a", false));
  }


  @Test
  public void testOscillationHalts() {
    var store = new ValueStore(100);
    store.addVariable("a", false, false);
    store.register(new CopyNode("a", "a", true));
    assertThrows(PropagationException.class, () -> store.propagate(List.of("a")));
  }


  @Test
  public void testRisingEdge() {
    var store = new ValueStore();
    store.addVariable("clk", false, true);
    store.addAltClock("clk");
    assertFalse(store.risingEdge("clk"));
    store.assign("clk", true);
    assertTrue(store.risingEdge("clk"));
    assertFalse(store.risingEdge("clk"));
    store.assign("clk", false);
    assertFalse(store.risingEdge("clk"));

    store.assign("clk", true);
    store.resetAltClocks();
    assertFalse(store.risingEdge("clk"));
    assertThrows(IllegalArgumentException.class, () -> store.risingEdge("nope"));
  }

}
