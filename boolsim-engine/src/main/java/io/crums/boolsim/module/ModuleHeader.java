/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.module;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.crums.boolsim.lex.Token;
import io.crums.boolsim.lex.TokenType;

/**
 * Port list of a module declaration or submodule instantiation. Each slot
 * (comma-separated position) is a list of bit names, most significant
 * first. Inputs precede the {@code :}; outputs follow it.
 * 
 * @param name    design name (for an instantiation, the sub-design's)
 * @param inputs  input slots
 * @param outputs output slots
 */
public record ModuleHeader(String name, List<List<String>> inputs, List<List<String>> outputs) {
  
  public ModuleHeader {
    Objects.requireNonNull(name, "null name");
    inputs = copy(inputs);
    outputs = copy(outputs);
  }
  
  
  private static List<List<String>> copy(List<List<String>> slots) {
    return slots.stream().map(List::copyOf).toList();
  }
  
  
  /**
   * Parses the port list from the significant tokens of an <em>expanded</em>
   * module or submodule statement (vectors already expanded into their
   * components, constants into bits). Operand text is kept as written
   * (including any {@code ~} prefix); concatenation braces are dropped.
   * 
   * @param name  the design name
   * @param sig   significant tokens, starting with the name (or instance)
   *              token
   */
  public static ModuleHeader parse(String name, List<Token> sig) {
    List<List<String>> inputs = new ArrayList<>();
    List<List<String>> outputs = new ArrayList<>();
    List<List<String>> side = inputs;
    List<String> slot = new ArrayList<>();
    
    for (var token : sig) {
      switch (token.type()) {
      case SCALAR:
      case CONSTANT:
        slot.add(token.text());
        break;
      case COMMA:
      case COLON:
      case RPAREN:
        if (!slot.isEmpty())
          side.add(slot);
        slot = new ArrayList<>();
        if (token.is(TokenType.COLON))
          side = outputs;
        break;
      default:
      }
    }
    return new ModuleHeader(name, inputs, outputs);
  }
  
  
  /** Returns the bit width of each input slot. */
  public List<Integer> inputWidths() {
    return inputs.stream().map(List::size).toList();
  }
  
  /** Returns the bit width of each output slot. */
  public List<Integer> outputWidths() {
    return outputs.stream().map(List::size).toList();
  }
  
  
  /** Returns all input bit names, in order. */
  public List<String> inputBits() {
    return inputs.stream().flatMap(List::stream).toList();
  }
  
  /** Returns all output bit names, in order. */
  public List<String> outputBits() {
    return outputs.stream().flatMap(List::stream).toList();
  }

}
