/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.io.File;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A design open for simulation: the shell-facing entry point. Holds the
 * design's source and its current {@linkplain Circuit} (the product of the
 * last run). Every run or edit re-parses the source from scratch; clicks
 * and ticks work on the current circuit in place.
 * <p>
 * Instances are not thread-safe: each operation runs to completion before
 * the next should be issued.
 * </p>
 */
public class Design {

  /**
   * Loads the given design file.
   *
   * @throws java.io.UncheckedIOException on I/O error
   */
  public static Design load(File file, Config config) {
    return new Design(DesignSource.load(file), config);
  }


  private final Parser parser;
  private DesignSource source;
  private Circuit circuit;


  public Design(DesignSource source) {
    this(source, Config.DEFAULT);
  }


  public Design(DesignSource source, Config config) {
    this.source = Objects.requireNonNull(source, "null source");
    this.parser = new Parser(config);
  }


  public String name() {
    return source.name();
  }


  public DesignSource source() {
    return source;
  }


  /** Returns the circuit of the last run, if any. */
  public Optional<Circuit> circuit() {
    return Optional.ofNullable(circuit);
  }


  /** Parses the design and returns its output. */
  public ParseResult run() {
    return run(Map.of());
  }


  /**
   * Parses the design, setting the given independent variables once
   * parsed, and returns its output.
   */
  public ParseResult run(Map<String, Boolean> overrides) {
    circuit = parser.parse(source, overrides);
    return output();
  }


  /**
   * Re-parses the design, keeping the current values of its independent
   * variables. Same as {@linkplain #run()}, if not yet run.
   */
  public ParseResult rerun() {
    if (circuit == null || !circuit.isValid())
      return run();
    return run(circuit.independentValues());
  }


  /** Replaces the source text and re-parses, keeping independent values. */
  public ParseResult edit(String text) {
    source = source.withText(text);
    return rerun();
  }


  /** Renders the current circuit. */
  public ParseResult output() {
    if (circuit == null)
      return ParseResult.misuse("Design '%s' has not been run.".formatted(name()));
    if (!circuit.isValid())
      return ParseResult.failure(circuit.diagnostics());
    return ParseResult.success(circuit.render());
  }


  /** Toggles the named independent variable. */
  public ParseResult click(String name) {
    var bad = checkRunning();
    if (bad.isPresent())
      return bad.get();
    var store = circuit.store();
    if (!store.contains(name))
      return ParseResult.misuse("Unknown variable '%s'.".formatted(name));
    if (!store.isIndependent(name))
      return ParseResult.misuse("'%s' is not an independent variable.".formatted(name));
    circuit.setValue(name, !store.value(name));
    return output();
  }


  /**
   * Sets a display group to the given value.
   *
   * @param variables the group's variables, most significant first
   * @param nextValue binary string, one digit per variable
   */
  public ParseResult click(List<String> variables, String nextValue) {
    var bad = checkRunning();
    if (bad.isPresent())
      return bad.get();
    if (variables.isEmpty() || variables.size() != nextValue.length() ||
        !nextValue.matches("[01]+"))
      return ParseResult.misuse(
          "Value '%s' does not match the %d variable(s) clicked."
          .formatted(nextValue, variables.size()));
    var store = circuit.store();
    for (var name : variables)
      if (!store.isIndependent(name))
        return ParseResult.misuse("'%s' is not an independent variable.".formatted(name));
    var values = new LinkedHashMap<String, Boolean>();
    for (int index = 0; index < variables.size(); ++index)
      values.put(variables.get(index), nextValue.charAt(index) == '1');
    circuit.setValues(values);
    return output();
  }


  /** Advances the clock one step. */
  public ParseResult tick() {
    return tick(1);
  }


  /**
   * Advances the clock the given number of steps.
   *
   * @param count &ge; 0
   */
  public ParseResult tick(int count) {
    if (count < 0)
      throw new IllegalArgumentException("negative tick count: " + count);
    var bad = checkRunning();
    if (bad.isPresent())
      return bad.get();
    while (count-- > 0)
      circuit.tick();
    return output();
  }


  private Optional<ParseResult> checkRunning() {
    if (circuit == null || !circuit.isValid())
      return Optional.of(output());
    return Optional.empty();
  }

}
