/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


/**
 * Signals an unexpected internal condition (as opposed to a problem
 * with the design's source text, which is reported as a
 * {@linkplain Diagnostic}).
 *
 * @see io.crums.boolsim.store.PropagationException
 */
@SuppressWarnings("serial")
public class BoolsimException extends RuntimeException {

  public BoolsimException() {
  }

  public BoolsimException(String message) {
    super(message);
  }

  public BoolsimException(Throwable cause) {
    super(cause);
  }

  public BoolsimException(String message, Throwable cause) {
    super(message, cause);
  }

}
