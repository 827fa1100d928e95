/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.stmt;


import java.util.List;
import java.util.Optional;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.eval.Expression;
import io.crums.boolsim.lex.StatementType;
import io.crums.boolsim.lex.Token;
import io.crums.boolsim.module.ModuleHeader;
import io.crums.boolsim.store.ValueStore;

/**
 * A built (expanded, validated and registered) statement of a design.
 * Statements produced by expanding a single source line share that line's
 * number.
 * 
 * @see StatementBuilder
 * @see StatementRenderer
 */
public sealed interface Statement {
  
  StatementType kind();
  
  /** 1-based source line number. */
  int lineNo();
  
  /** Statement text (post expansion). */
  String text();
  
  
  
  record Empty(int lineNo, String text) implements Statement {
    @Override
    public StatementType kind() {
      return StatementType.EMPTY;
    }
  }
  
  
  /**
   * @param indent  leading whitespace count
   * @param comment the text between the quotes
   * @param shown   whether the comment is rendered
   */
  record Comment(int lineNo, String text, int indent, String comment, boolean shown)
      implements Statement {
    @Override
    public StatementType kind() {
      return StatementType.COMMENT;
    }
  }
  
  
  /** Variable list or format-specifier statement. */
  record Display(int lineNo, String text, List<Token> tokens) implements Statement {
    public Display {
      tokens = List.copyOf(tokens);
    }
    @Override
    public StatementType kind() {
      return StatementType.DISPLAY;
    }
  }
  
  
  /**
   * Combinational assignment.
   * 
   * @param dependents  scalar names, most significant first
   */
  record BooleanAssignment(
      int lineNo, String text, List<Token> tokens, List<String> dependents, Expression expression)
      implements Statement {
    public BooleanAssignment {
      tokens = List.copyOf(tokens);
      dependents = List.copyOf(dependents);
    }
    @Override
    public StatementType kind() {
      return StatementType.BOOLEAN;
    }
  }
  
  
  /**
   * Clocked assignment. The expression is continuously evaluated into the
   * dependents' {@code .d} (next-value) slots; these are committed on a
   * clock tick, or on a rising edge of the alternate clock, if any.
   * 
   * @param dependents  scalar names, most significant first
   * @param altClock    alternate clock variable ({@code <=@clk}), if any
   */
  record ClockAssignment(
      int lineNo, String text, List<Token> tokens, List<String> dependents,
      Expression expression, Optional<String> altClock)
      implements Statement {
    public ClockAssignment {
      tokens = List.copyOf(tokens);
      dependents = List.copyOf(dependents);
    }
    @Override
    public StatementType kind() {
      return StatementType.CLOCK;
    }
    
    /** Returns the next-value slot names, in dependent order. */
    public List<String> delaySlots() {
      return dependents.stream().map(StatementBuilder::delaySlot).toList();
    }
    
    /** Returns {@code true} if any dependent differs from its next value. */
    public boolean pending(ValueStore store) {
      for (var dep : dependents)
        if (store.getValue(dep) != store.getValue(dep + BoolsimConstants.DELAY_SUFFIX))
          return true;
      return false;
    }
  }
  
  
  record ModuleDeclaration(int lineNo, String text, List<Token> tokens, ModuleHeader header)
      implements Statement {
    public ModuleDeclaration {
      tokens = List.copyOf(tokens);
    }
    @Override
    public StatementType kind() {
      return StatementType.MODULE;
    }
  }
  
  
  /**
   * @param instance  the instance name
   * @param ports     the port list; its name is the sub-design's
   */
  record SubmoduleInstantiation(
      int lineNo, String text, List<Token> tokens, String instance, ModuleHeader ports)
      implements Statement {
    public SubmoduleInstantiation {
      tokens = List.copyOf(tokens);
    }
    @Override
    public StatementType kind() {
      return StatementType.SUBMODULE;
    }
    
    public String design() {
      return ports.name();
    }
  }

}
