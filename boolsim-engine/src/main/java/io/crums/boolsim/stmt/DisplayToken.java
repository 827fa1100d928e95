/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.stmt;


import java.util.List;
import java.util.Optional;

/**
 * Typed output element of an evaluated design. A rendered design is an
 * ordered list of these, one statement after another, each statement
 * ending in a {@linkplain LineBreak}.
 */
public sealed interface DisplayToken {
  
  /** Returns the literal text of this token (as it would be printed). */
  String text();
  
  
  /**
   * A variable with its current value.
   * 
   * @param name        the variable's name
   * @param value       its current value
   * @param independent if {@code true}, the variable can be clicked (toggled)
   * @param negated     if {@code true}, the variable is read negated at this
   *                    position ({@code value} is still the variable's own)
   */
  record Variable(String name, boolean value, boolean independent, boolean negated)
      implements DisplayToken {
    @Override
    public String text() {
      return negated ? "~" + name : name;
    }
  }
  
  
  /** An operator ({@code =}, {@code |}, {@code ^}, {@code ==}, {@code +}, {@code -}, {@code ~}). */
  record Operator(String text) implements DisplayToken {  }
  
  
  /**
   * A clock-assignment operator ({@code <=} or {@code <=@clk}).
   * 
   * @param pending {@code true} if the next tick (or clock edge) will change
   *                the dependent's value
   */
  record Clock(String text, boolean pending) implements DisplayToken {  }
  
  
  /** A numeric constant, with its unsigned value. */
  record Constant(String text, long value) implements DisplayToken {  }
  
  
  /** Comment text (sans quotes). */
  record Comment(String text) implements DisplayToken {  }
  
  
  /**
   * A formatted group of values.
   * 
   * @param text      the formatted value, left-padded with spaces to the
   *                  format's width
   * @param format    format character ({@code b}, {@code h}, {@code d}, {@code u})
   * @param variables the variables in the group, most significant first
   * @param nextValue the group's next binary value (current + 1, wrapping
   *                  within the width); present only if the group is
   *                  clickable (all members independent variables)
   */
  record Formatter(String text, char format, List<String> variables, Optional<String> nextValue)
      implements DisplayToken {
    public Formatter {
      variables = List.copyOf(variables);
    }
  }
  
  
  /**
   * A parenthesis. The value is that of the enclosed sub-expression (after
   * any {@code ~} on the opening one).
   */
  record Paren(String text, boolean value) implements DisplayToken {  }
  
  
  /** A sub-design instantiation ({@code Design.instance}). */
  record Instance(String design, String instance) implements DisplayToken {
    @Override
    public String text() {
      return design + "." + instance;
    }
  }
  
  
  /** Punctuation ({@code ; , : { }}), module names, and {@code NC} placeholders. */
  record Punctuation(String text) implements DisplayToken {  }
  
  
  /** One or more spaces. */
  record Space(int count) implements DisplayToken {
    public Space {
      if (count < 1)
        throw new IllegalArgumentException("count: " + count);
    }
    @Override
    public String text() {
      return " ".repeat(count);
    }
  }
  
  
  /** End of a statement. */
  record LineBreak() implements DisplayToken {
    @Override
    public String text() {
      return "\n";
    }
  }

}
