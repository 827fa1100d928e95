/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.store;


import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.Config;
import io.crums.boolsim.DiagnosticLog;
import io.crums.boolsim.store.Variable.Kind;

/**
 * The symbol table of a single parse generation: named binary variables,
 * vector-namespace metadata, dependency records, and alternate-clock
 * state.
 * 
 * <h2>Propagation</h2>
 * <p>
 * Re-evaluation is driven by an explicit worklist over registered
 * {@linkplain Node}s. When a variable changes, every node that reads it is
 * queued; each node's update may in turn change other variables, queuing
 * their readers. The worklist stops when no further change occurs. Since
 * the combinational dependency graph is kept acyclic (instance outputs
 * included), this terminates; the
 * {@linkplain Config#propagationLimit() propagation limit} is a backstop.
 * </p>
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
public class ValueStore {
  
  /** Value returned by {@linkplain #getValue(String)} for an unknown name. */
  public final static int UNKNOWN = -1;
  
  
  private final Map<String, Variable> variables = new LinkedHashMap<>();
  private final Map<String, Namespace> namespaces = new LinkedHashMap<>();
  private final Map<String, DependencyRecord> dependencies = new LinkedHashMap<>();
  private final Map<String, List<Node>> readers = new HashMap<>();
  private final Map<String, Boolean> altClocks = new LinkedHashMap<>();
  
  private final int propagationLimit;
  
  
  
  /** Creates an empty instance with the default propagation limit. */
  public ValueStore() {
    this(Config.DEFAULT_PROPAGATION_LIMIT);
  }
  
  
  /**
   * @param propagationLimit  maximum node evaluations per propagation (&gt; 0)
   */
  public ValueStore(int propagationLimit) {
    if (propagationLimit <= 0)
      throw new IllegalArgumentException("propagationLimit: " + propagationLimit);
    this.propagationLimit = propagationLimit;
  }
  
  
  
  //   - -   V A R I A B L E S   - -
  
  
  /**
   * Adds the named variable, if it doesn't already exist. If a variable
   * by that name already exists, this is a no-op; in particular, its kind
   * is not changed.
   * 
   * @return {@code true} iff the variable was added
   * @see #makeDependent(String)
   */
  public boolean addVariable(String name, boolean value, boolean independent) {
    if (variables.containsKey(name))
      return false;
    variables.put(
        name,
        new Variable(name, value, independent ? Kind.INDEPENDENT : Kind.DEPENDENT));
    return true;
  }
  
  
  public boolean contains(String name) {
    return variables.containsKey(name);
  }
  
  
  public Optional<Variable> variable(String name) {
    return Optional.ofNullable(variables.get(name));
  }
  
  
  /** Returns the variables in the order they were added (read-only). */
  public Collection<Variable> variables() {
    return Collections.unmodifiableCollection(variables.values());
  }
  
  
  /**
   * Returns the value of the named variable as {@code 0} or {@code 1}, or
   * {@linkplain #UNKNOWN} if there's no such variable.
   */
  public int getValue(String name) {
    var v = variables.get(name);
    return v == null ? UNKNOWN : v.bit();
  }
  
  
  /**
   * Returns the boolean value of the named variable.
   * 
   * @throws IllegalArgumentException if there is no such variable
   */
  public boolean value(String name) {
    return getVariable(name).value();
  }
  
  
  public boolean isIndependent(String name) {
    var v = variables.get(name);
    return v != null && v.isIndependent();
  }
  
  
  public boolean isDependent(String name) {
    var v = variables.get(name);
    return v != null && v.isDependent();
  }
  
  
  private Variable getVariable(String name) {
    var v = variables.get(name);
    if (v == null)
      throw new IllegalArgumentException("unknown variable: " + name);
    return v;
  }
  
  
  /**
   * Converts the named variable to a dependent one, in place, preserving
   * its current value. No-op if already dependent.
   * 
   * @throws IllegalArgumentException if there is no such variable
   */
  public void makeDependent(String name) {
    getVariable(name).makeDependent();
  }
  
  
  /**
   * Sets the value of the named variable, without propagating the change.
   * Used by {@linkplain Node}s writing their outputs.
   * 
   * @return {@code true} iff the value changed
   * @throws IllegalArgumentException if there is no such variable
   */
  public boolean assign(String name, boolean value) {
    return getVariable(name).set(value);
  }
  
  
  /**
   * Sets the value of the named variable and, if it changed, re-evaluates
   * every node that (transitively) reads it.
   * 
   * @return {@code true} iff the value changed
   * @throws IllegalArgumentException if there is no such variable
   * @throws PropagationException if propagation does not converge
   */
  public boolean setValue(String name, boolean value) {
    if (!assign(name, value))
      return false;
    propagate(List.of(name));
    return true;
  }
  
  
  
  //   - -   N A M E S P A C E S   - -
  
  
  /**
   * Records the use of a scalar ({@code bit == -1}) or vector component
   * ({@code bit} 0..31) in the given namespace.
   * 
   * @param name    the namespace (base name)
   * @param bit     -1 for a scalar; o.w. the bit index
   * @param lineNo  line no. reported on failure
   * @param log     diagnostics are logged here
   * 
   * @return {@code false} (and a diagnostic is logged) on a scalar/vector
   *         conflict or an out-of-range bit
   */
  public boolean updateNamespace(String name, int bit, int lineNo, DiagnosticLog log) {
    if (bit > BoolsimConstants.MAX_BIT_INDEX || bit < -1) {
      log.semantic(lineNo,
          "Bit of '%s' must be between 0 and %d.".formatted(name, BoolsimConstants.MAX_BIT_INDEX));
      return false;
    }
    var ns = namespaces.get(name);
    if (ns == null) {
      ns = new Namespace(name, bit != -1);
      namespaces.put(name, ns);
    } else if (ns.isVector() && bit == -1) {
      log.semantic(lineNo, "Namespace '%s' is already being used by a vector.".formatted(name));
      return false;
    } else if (ns.isScalar() && bit != -1) {
      log.semantic(lineNo, "Namespace '%s' is already being used by a scalar.".formatted(name));
      return false;
    }
    if (bit != -1)
      ns.addBit(bit);
    return true;
  }
  
  
  public boolean hasNamespace(String name) {
    return namespaces.containsKey(name);
  }
  
  
  public Optional<Namespace> namespace(String name) {
    return Optional.ofNullable(namespaces.get(name));
  }
  
  
  /**
   * Returns the components of the named vector namespace, most significant
   * first; empty if there is no such vector namespace.
   */
  public List<String> components(String name) {
    var ns = namespaces.get(name);
    return ns == null || ns.isScalar() ? List.of() : ns.components();
  }
  
  
  
  //   - -   D E P E N D E N C I E S   - -
  
  
  /**
   * Records the dependency list of the given dependent, unless doing so
   * would introduce a cycle.
   * 
   * @param dependent   the variable being defined
   * @param reads       the variables its expression reads, in order
   * @param expression  raw expression text
   * 
   * @return {@code false} if {@code dependent} is reachable from
   *         {@code reads} (directly or through other dependency records);
   *         {@code true} if the record was added
   * @throws IllegalStateException if {@code dependent} already has a record
   */
  public boolean tryAddDependencyList(String dependent, List<String> reads, String expression) {
    if (dependencies.containsKey(dependent))
      throw new IllegalStateException("dependency list already recorded for " + dependent);
    if (reaches(reads, dependent))
      return false;
    dependencies.put(dependent, new DependencyRecord(dependent, reads, expression));
    return true;
  }
  
  
  private boolean reaches(List<String> from, String target) {
    var stack = new ArrayDeque<String>(from);
    Set<String> visited = new HashSet<>();
    while (!stack.isEmpty()) {
      String name = stack.pop();
      if (name.equals(target))
        return true;
      if (!visited.add(name))
        continue;
      var record = dependencies.get(name);
      if (record != null)
        stack.addAll(record.reads());
    }
    return false;
  }
  
  
  public boolean hasDependencyList(String dependent) {
    return dependencies.containsKey(dependent);
  }
  
  
  public Optional<DependencyRecord> dependency(String dependent) {
    return Optional.ofNullable(dependencies.get(dependent));
  }
  
  
  
  //   - -   P R O P A G A T I O N   - -
  
  
  /**
   * Registers the given node as a reader of each of its inputs.
   */
  public void register(Node node) {
    for (var input : new LinkedHashSet<>(node.inputs()))
      readers.computeIfAbsent(input, n -> new ArrayList<>()).add(node);
  }
  
  
  /** Returns the nodes registered as readers of the named variable. */
  public List<Node> readers(String name) {
    var list = readers.get(name);
    return list == null ? List.of() : Collections.unmodifiableList(list);
  }
  
  
  /**
   * Re-evaluates the readers of the given (changed) variables, and their
   * readers, and so on, until no further change occurs.
   * 
   * @return the number of node evaluations performed
   * @throws PropagationException if the propagation limit is reached
   */
  public int propagate(Collection<String> changed) {
    var worklist = new LinkedHashSet<Node>();
    for (var name : changed)
      worklist.addAll(readers(name));
    
    int steps = 0;
    while (!worklist.isEmpty()) {
      if (++steps > propagationLimit)
        throw new PropagationException(propagationLimit);
      var iter = worklist.iterator();
      Node node = iter.next();
      iter.remove();
      for (var name : node.update(this))
        worklist.addAll(readers(name));
    }
    return steps;
  }
  
  
  
  //   - -   A L T E R N A T E   C L O C K S   - -
  
  
  /**
   * Registers the named variable as an alternate clock. Its current value
   * is taken as its last-seen value.
   */
  public void addAltClock(String name) {
    altClocks.putIfAbsent(name, getValue(name) == 1);
  }
  
  
  /** Returns the alternate clock names, in order of registration. */
  public Set<String> altClocks() {
    return Collections.unmodifiableSet(altClocks.keySet());
  }
  
  
  /** Takes each alternate clock's current value as its last-seen value. */
  public void resetAltClocks() {
    for (var entry : altClocks.entrySet())
      entry.setValue(getValue(entry.getKey()) == 1);
  }
  
  
  /**
   * Compares the named alternate clock's current value with its last-seen
   * value, and records the current one.
   * 
   * @return {@code true} iff the clock went from 0 to 1
   * @throws IllegalArgumentException if not a registered alternate clock
   */
  public boolean risingEdge(String name) {
    Boolean last = altClocks.get(name);
    if (last == null)
      throw new IllegalArgumentException("not an alternate clock: " + name);
    boolean now = getValue(name) == 1;
    altClocks.put(name, now);
    return now && !last;
  }

}
