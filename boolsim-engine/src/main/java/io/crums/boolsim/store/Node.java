/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.store;


import java.util.List;

/**
 * A unit of re-evaluation in the propagation worklist: a combinational
 * assignment, a clocked assignment's next-value slot, or a sub-design
 * instantiation.
 * 
 * @see ValueStore#register(Node)
 */
public interface Node {
  
  /** Returns the names of the variables this node reads. */
  List<String> inputs();
  
  
  /**
   * Re-evaluates the node against the given store, writing its outputs
   * without triggering propagation.
   * 
   * @return the names of the variables whose values changed (possibly empty)
   * 
   * @see ValueStore#assign(String, boolean)
   */
  List<String> update(ValueStore store);

}
