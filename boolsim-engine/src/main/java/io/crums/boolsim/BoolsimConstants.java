/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Library-wide constants and logging shortcuts.
 */
public class BoolsimConstants {
  // no-one calls
  private BoolsimConstants() {  }
  
  
  public final static String LOG_NAME = "io.crums.boolsim";
  
  /** Maximum number of bits in a vector namespace, constant, or concatenation. */
  public final static int MAX_BITS = 32;
  
  /** Maximum bit index (inclusive). */
  public final static int MAX_BIT_INDEX = MAX_BITS - 1;
  
  /** Default design file extension. */
  public final static String DESIGN_EXT = ".vbi";
  
  /**
   * Suffix appended to a clocked dependent's name to form the name
   * of its next-value ("delay") slot.
   */
  public final static String DELAY_SUFFIX = ".d";
  
  /** Placeholder name for an unconnected submodule output. */
  public final static String NO_CONTACT = "NC";
  
  
  
  public static Logger logger() {
    return System.getLogger(LOG_NAME);
  }
  
  
  public static void logDebug(String message) {
    logger().log(Level.DEBUG, message);
  }
  
  public static void logWarning(String message) {
    logger().log(Level.WARNING, message);
  }

}
