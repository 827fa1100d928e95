/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.store;


import io.crums.boolsim.BoolsimException;

/**
 * Thrown when propagation reaches its step limit without settling.
 */
@SuppressWarnings("serial")
public class PropagationException extends BoolsimException {

  private final int steps;

  public PropagationException(int steps) {
    super("propagation did not converge after " + steps + " steps");
    this.steps = steps;
  }


  /** Returns the propagation limit that was reached. */
  public int steps() {
    return steps;
  }

}
