/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.crums.boolsim.module.InstanceNode;
import io.crums.boolsim.module.ModuleHeader;
import io.crums.boolsim.stmt.DisplayToken;
import io.crums.boolsim.stmt.Statement;
import io.crums.boolsim.stmt.StatementBuilder;
import io.crums.boolsim.stmt.StatementRenderer;
import io.crums.boolsim.store.ValueStore;

/**
 * The product of a single parse pass over a design: its statements, value
 * store, header, and sub-design instances. The value store is live: clicks
 * and ticks mutate it in place. Any change to the source text calls for a
 * new instance.
 * <p>
 * If the parse failed ({@linkplain #isValid()} returns {@code false}), the
 * instance carries its diagnostics and nothing else is meaningful.
 * </p>
 *
 * @see Parser#parse(DesignSource)
 */
public class Circuit {

  private final DesignSource source;
  private final ValueStore store;
  private final List<Statement> statements;
  private final Optional<ModuleHeader> header;
  private final List<InstanceNode> instances;
  private final List<Statement.ClockAssignment> clocked;
  private final List<Diagnostic> diagnostics;


  Circuit(
      DesignSource source,
      ValueStore store,
      List<Statement> statements,
      Optional<ModuleHeader> header,
      List<InstanceNode> instances,
      List<Diagnostic> diagnostics) {

    this.source = Objects.requireNonNull(source, "null source");
    this.store = Objects.requireNonNull(store, "null store");
    this.statements = List.copyOf(statements);
    this.header = Objects.requireNonNull(header, "null header");
    this.instances = List.copyOf(instances);
    this.diagnostics = List.copyOf(diagnostics);

    List<Statement.ClockAssignment> clocked = new ArrayList<>();
    for (var s : this.statements)
      if (s instanceof Statement.ClockAssignment c)
        clocked.add(c);
    this.clocked = List.copyOf(clocked);
  }


  /** Returns the design name. */
  public String name() {
    return source.name();
  }


  public Optional<File> file() {
    return source.file();
  }


  public DesignSource source() {
    return source;
  }


  /** Returns the live value store. */
  public ValueStore store() {
    return store;
  }


  public List<Statement> statements() {
    return statements;
  }


  /** Returns the module declaration's port list, if the design has one. */
  public Optional<ModuleHeader> header() {
    return header;
  }


  public List<InstanceNode> instances() {
    return instances;
  }


  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }


  /** Returns {@code true} iff the parse produced no diagnostics. */
  public boolean isValid() {
    return diagnostics.isEmpty();
  }


  private void checkValid() {
    if (!isValid())
      throw new IllegalStateException("design '" + name() + "' failed to parse");
  }


  /** Renders the statements using the current values. */
  public List<DisplayToken> render() {
    checkValid();
    return new StatementRenderer(store).render(statements);
  }


  /** Returns the current value of every independent variable, in order of declaration. */
  public Map<String, Boolean> independentValues() {
    var values = new LinkedHashMap<String, Boolean>();
    for (var v : store.variables())
      if (v.isIndependent())
        values.put(v.name(), v.value());
    return values;
  }


  /**
   * Sets the named independent variable and propagates the change, then
   * fires any alternate clock that rose as a result.
   *
   * @return {@code true} iff the value changed
   * @throws IllegalArgumentException if the variable doesn't exist or is not
   *         independent
   */
  public boolean setValue(String name, boolean value) {
    checkValid();
    if (!store.isIndependent(name))
      throw new IllegalArgumentException("not an independent variable: " + name);
    if (!store.setValue(name, value))
      return false;
    checkAltClocks();
    return true;
  }


  /**
   * Sets the given independent variables together: every value is written
   * first, then the changes are propagated once, and only then are the
   * alternate clocks checked. A clock in the group thus sees the rest of
   * the group's new values.
   *
   * @param values  independent variable values, by name
   * @return the names whose values changed
   * @throws IllegalArgumentException if a variable doesn't exist or is not
   *         independent (no value is then set)
   */
  public List<String> setValues(Map<String, Boolean> values) {
    checkValid();
    for (var name : values.keySet())
      if (!store.isIndependent(name))
        throw new IllegalArgumentException("not an independent variable: " + name);
    List<String> changed = new ArrayList<>();
    for (var entry : values.entrySet())
      if (store.assign(entry.getKey(), entry.getValue()))
        changed.add(entry.getKey());
    if (!changed.isEmpty()) {
      store.propagate(changed);
      checkAltClocks();
    }
    return changed;
  }


  /**
   * Advances the clock one step. Every clocked assignment without an
   * alternate clock commits the next value computed before the tick;
   * sub-design instances tick along. Changes are then propagated, and any
   * alternate clock that rose as a result fires.
   */
  public void tick() {
    checkValid();
    var next = new LinkedHashMap<String, Boolean>();
    for (var c : clocked) {
      if (c.altClock().isPresent())
        continue;
      for (var dep : c.dependents())
        next.put(dep, store.value(StatementBuilder.delaySlot(dep)));
    }

    Set<String> changed = new LinkedHashSet<>();
    for (var instance : instances)
      changed.addAll(instance.tick(store));
    for (var entry : next.entrySet())
      if (store.assign(entry.getKey(), entry.getValue()))
        changed.add(entry.getKey());

    store.propagate(changed);
    checkAltClocks();
  }


  /**
   * Fires every alternate clock that went from 0 to 1 since it was last
   * checked, committing the clocked assignments it gates. Each clock fires
   * at most once per call.
   */
  public void checkAltClocks() {
    for (var clock : List.copyOf(store.altClocks())) {
      if (!store.risingEdge(clock))
        continue;
      BoolsimConstants.logDebug(name() + ": rising edge on " + clock);
      List<String> changed = new ArrayList<>();
      for (var c : clocked) {
        if (!c.altClock().filter(clock::equals).isPresent())
          continue;
        for (var dep : c.dependents())
          if (store.assign(dep, store.value(StatementBuilder.delaySlot(dep))))
            changed.add(dep);
      }
      store.propagate(changed);
    }
  }


  @Override
  public String toString() {
    return "Circuit[" + name() + (isValid() ? "" : ", invalid") + "]";
  }

}
