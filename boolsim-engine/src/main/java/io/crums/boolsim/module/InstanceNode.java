/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.module;


import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.Circuit;
import io.crums.boolsim.lex.Lexemes;
import io.crums.boolsim.store.Node;
import io.crums.boolsim.store.ValueStore;

/**
 * A sub-design instantiation wired into its parent's value store. Each
 * instance owns its child {@linkplain Circuit} (and hence the child's
 * state). Input bits are read from the parent (constants and {@code ~}
 * prefixes honored) and written to the child's input ports; the child's
 * output ports are copied back to the parent (skipping {@code NC}
 * placeholders).
 * <p>
 * The last input bits seen are cached: if they haven't changed, the child
 * is not re-evaluated.
 * </p>
 */
public class InstanceNode implements Node {
  
  private final String instance;
  private final Circuit child;
  private final List<String> parentInputs;
  private final List<String> parentOutputs;
  private final List<String> childInputs;
  private final List<String> childOutputs;
  private final List<String> inputs;
  
  private boolean[] lastInputs;
  
  
  /**
   * @param instance  the instance name
   * @param ports     the instantiation's port list (its slot widths must
   *                  match the child's header)
   * @param child     the child circuit (valid, with a module declaration)
   */
  public InstanceNode(String instance, ModuleHeader ports, Circuit child) {
    this.instance = Objects.requireNonNull(instance, "null instance");
    this.child = Objects.requireNonNull(child, "null child");
    var header = child.header().orElseThrow(
        () -> new IllegalArgumentException("child has no module declaration: " + child.name()));
    this.parentInputs = ports.inputBits();
    this.parentOutputs = ports.outputBits();
    this.childInputs = header.inputBits();
    this.childOutputs = header.outputBits();
    if (parentInputs.size() != childInputs.size() || parentOutputs.size() != childOutputs.size())
      throw new IllegalArgumentException(
          "port widths of instance '" + instance + "' do not match design " + child.name());
    
    var names = new LinkedHashSet<String>();
    for (var text : parentInputs) {
      String body = text.replaceFirst("^~+", "");
      if (!Lexemes.isConstant(body))
        names.add(body);
    }
    this.inputs = List.copyOf(names);
  }
  
  
  public String instance() {
    return instance;
  }
  
  
  public Circuit child() {
    return child;
  }
  
  
  /** Returns the parent variables written (sans {@code NC} placeholders). */
  public List<String> outputs() {
    return parentOutputs.stream().filter(n -> !n.equals(BoolsimConstants.NO_CONTACT)).toList();
  }
  

  /**
   * Returns the parent variables the given output bit reads combinationally.
   * These are found by walking the child's dependency records back to its
   * input ports. A registered (clocked) output has no dependency record, so
   * the walk stops there.
   *
   * @param output  index into the flattened output bits
   */
  public List<String> reads(int output) {
    var childStore = child.store();
    var reads = new LinkedHashSet<String>();
    Set<String> visited = new HashSet<>();
    var stack = new ArrayDeque<String>();
    stack.push(childOutputs.get(output));
    while (!stack.isEmpty()) {
      String name = stack.pop();
      if (!visited.add(name))
        continue;
      int port = childInputs.indexOf(name);
      if (port != -1) {
        String body = parentInputs.get(port).replaceFirst("^~+", "");
        if (!Lexemes.isConstant(body))
          reads.add(body);
      }
      childStore.dependency(name).ifPresent(r -> r.reads().forEach(stack::push));
    }
    return List.copyOf(reads);
  }


  /** Returns the parent variable written by the given output bit ({@code NC} included). */
  public String output(int output) {
    return parentOutputs.get(output);
  }


  /** Returns the number of output bits (including {@code NC} placeholders). */
  public int outputCount() {
    return parentOutputs.size();
  }
  

  @Override
  public List<String> inputs() {
    return inputs;
  }
  

  @Override
  public List<String> update(ValueStore store) {
    boolean[] bits = readInputs(store);
    if (!Arrays.equals(bits, lastInputs)) {
      lastInputs = bits;
      var childStore = child.store();
      List<String> changed = new ArrayList<>();
      for (int index = 0; index < bits.length; ++index) {
        String port = childInputs.get(index);
        if (childStore.assign(port, bits[index]))
          changed.add(port);
      }
      childStore.propagate(changed);
      child.checkAltClocks();
    }
    return writeOutputs(store);
  }
  
  
  /**
   * Ticks the child circuit and copies its outputs to the parent, without
   * propagating.
   * 
   * @return the parent variables that changed
   */
  public List<String> tick(ValueStore store) {
    child.tick();
    return writeOutputs(store);
  }
  
  
  private boolean[] readInputs(ValueStore store) {
    boolean[] bits = new boolean[parentInputs.size()];
    for (int index = 0; index < bits.length; ++index) {
      String text = parentInputs.get(index);
      String body = text.replaceFirst("^~+", "");
      boolean negated = ((text.length() - body.length()) & 1) == 1;
      boolean value =
          Lexemes.isConstant(body) ?
              Lexemes.constant(body).get().value() != 0 :
                store.getValue(body) == 1;
      bits[index] = value ^ negated;
    }
    return bits;
  }
  
  
  private List<String> writeOutputs(ValueStore store) {
    List<String> changed = new ArrayList<>(2);
    var childStore = child.store();
    for (int index = 0; index < parentOutputs.size(); ++index) {
      String name = parentOutputs.get(index);
      if (name.equals(BoolsimConstants.NO_CONTACT))
        continue;
      if (store.assign(name, childStore.getValue(childOutputs.get(index)) == 1))
        changed.add(name);
    }
    return changed;
  }
  
  
  @Override
  public String toString() {
    return child.name() + "." + instance;
  }

}
