/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.store;


import java.util.Objects;

/**
 * A named binary variable. A variable is either freely settable
 * ({@linkplain Kind#INDEPENDENT independent}) or computed from an
 * expression ({@linkplain Kind#DEPENDENT dependent}). An independent
 * variable may be converted to a dependent one (once), but not the
 * other way around.
 * 
 * @see ValueStore#makeDependent(String)
 */
public final class Variable {
  
  public enum Kind {
    INDEPENDENT,
    DEPENDENT;
  }
  
  
  private final String name;
  private boolean value;
  private Kind kind;
  
  
  Variable(String name, boolean value, Kind kind) {
    this.name = Objects.requireNonNull(name, "null name");
    this.value = value;
    this.kind = Objects.requireNonNull(kind, "null kind");
  }
  
  
  public String name() {
    return name;
  }
  
  public boolean value() {
    return value;
  }
  
  /** Returns the value as {@code 0} or {@code 1}. */
  public int bit() {
    return value ? 1 : 0;
  }
  
  public Kind kind() {
    return kind;
  }
  
  public boolean isIndependent() {
    return kind == Kind.INDEPENDENT;
  }
  
  public boolean isDependent() {
    return kind == Kind.DEPENDENT;
  }
  
  
  /** @return {@code true} iff the value changed */
  boolean set(boolean value) {
    if (this.value == value)
      return false;
    this.value = value;
    return true;
  }
  
  
  void makeDependent() {
    kind = Kind.DEPENDENT;
  }
  
  
  @Override
  public String toString() {
    return name + "=" + bit() + (isIndependent() ? "" : " (dep)");
  }

}
