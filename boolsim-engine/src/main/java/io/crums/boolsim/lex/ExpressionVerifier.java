/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural checks on the right-hand side of an assignment, applied per
 * parenthesis level:
 * <ul>
 * <li>no empty {@code ()};</li>
 * <li>no operator missing an operand;</li>
 * <li>{@code ^} and {@code ==} must be the only operator in their level;</li>
 * <li>{@code +} and {@code -} (math mode) can't be mixed with boolean
 * operators anywhere in the expression.</li>
 * </ul>
 * Juxtaposition (AND) counts as an operator. Grouping balance is assumed
 * (already enforced by the {@linkplain Lexer}).
 */
final class ExpressionVerifier {
  
  private ExpressionVerifier() {  }
  
  
  /** Stands in for the implicit AND between juxtaposed operands. */
  private final static TokenType AND = TokenType.SPACE;
  /** Stands in for any operand (scalar, vector, constant, concatenation). */
  private final static TokenType OPERAND = TokenType.SCALAR;
  
  
  private static class Level {
    boolean empty = true;
    final List<TokenType> ops = new ArrayList<>();
    TokenType exclusive;
  }
  
  
  /**
   * @param rhs tokens following the assignment operator, sans the
   *            terminating {@code ;}
   * @return an error message, if the expression is malformed
   */
  static Optional<String> verify(List<Token> rhs) {
    var units = units(rhs);
    if (units.isEmpty())
      return Optional.of("Missing expression after the assignment operator.");
    
    var levels = new ArrayDeque<Level>();
    levels.push(new Level());
    boolean wasOperator = true;
    boolean mathSeen = false;
    boolean booleanSeen = false;
    
    for (var unit : units) {
      switch (unit) {
      case LPAREN:
        levels.peek().empty = false;
        levels.push(new Level());
        wasOperator = true;
        break;
      
      case RPAREN:
        if (levels.peek().empty)
          return Optional.of("Empty ().");
        if (wasOperator)
          return Optional.of("An operator is missing its operands.");
        levels.pop();
        wasOperator = false;
        break;
      
      case SCALAR:
        levels.peek().empty = false;
        wasOperator = false;
        break;
      
      default:
        // binary operator (including implicit AND)
        if (wasOperator)
          return Optional.of("An operator is missing its operands.");
        
        if (unit.isMath()) {
          if (booleanSeen)
            return Optional.of("'+' and '-' can't appear with boolean operators.");
          mathSeen = true;
        } else {
          if (mathSeen)
            return Optional.of("'+' and '-' can't appear with boolean operators.");
          booleanSeen = true;
          var level = levels.peek();
          if (level.exclusive != null) {
            if (unit != level.exclusive)
              return Optional.of(
                  "'%s' must be the only operator in its parentheses level."
                  .formatted(symbol(level.exclusive)));
          } else if (unit == TokenType.XOR || unit == TokenType.EQUALS) {
            if (level.ops.stream().anyMatch(op -> op != unit))
              return Optional.of(
                  "'%s' must be the only operator in its parentheses level."
                  .formatted(symbol(unit)));
            level.exclusive = unit;
          }
          level.ops.add(unit);
        }
        wasOperator = true;
      }
    }
    
    if (wasOperator)
      return Optional.of("An operator is missing its operands.");
    
    return Optional.empty();
  }
  
  
  private static String symbol(TokenType op) {
    return op == TokenType.XOR ? "^" : "==";
  }
  
  
  /**
   * Reduces the tokens to a sequence of operand, parenthesis and operator
   * units, inserting the implicit AND between juxtaposed operands.
   */
  static List<TokenType> units(List<Token> rhs) {
    List<TokenType> out = new ArrayList<>();
    for (int index = 0; index < rhs.size(); ++index) {
      var token = rhs.get(index);
      TokenType unit;
      switch (token.type()) {
      case SPACE:
      case NOT:
        continue;
      case LBRACE:
        while (!rhs.get(index).is(TokenType.RBRACE))
          ++index;
        unit = OPERAND;
        break;
      case LPAREN:
      case RPAREN:
        unit = token.type();
        break;
      default:
        unit = token.type().isOperand() ? OPERAND : token.type();
      }
      
      boolean startsOperand = unit == OPERAND || unit == TokenType.LPAREN;
      if (startsOperand && !out.isEmpty()) {
        var last = out.get(out.size() - 1);
        if (last == OPERAND || last == TokenType.RPAREN)
          out.add(AND);
      }
      out.add(unit);
    }
    return out;
  }

}
