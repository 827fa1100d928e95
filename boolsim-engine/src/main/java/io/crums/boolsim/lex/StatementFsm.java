/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Statement-type inference as a finite-state machine over token categories.
 * Starting {@linkplain State#UNDETERMINED undetermined}, the first
 * statement-defining token commits the machine to a state; every subsequent
 * token (and separator) is checked for legality in that state.
 * 
 * <pre>
 *   UNDETERMINED --%x--------&gt; FORMAT
 *   UNDETERMINED --=---------&gt; BOOLEAN
 *   UNDETERMINED --&lt;=--------&gt; CLOCK
 *   UNDETERMINED --Name(-----&gt; MODULE
 *   UNDETERMINED --D.inst(---&gt; SUBMODULE
 *   UNDETERMINED --;---------&gt; (variable list)
 * </pre>
 * Transition methods return an error message on an illegal token.
 */
final class StatementFsm {
  
  enum State {
    UNDETERMINED,
    FORMAT,
    BOOLEAN,
    CLOCK,
    MODULE,
    SUBMODULE;
  }
  
  
  private State state = State.UNDETERMINED;
  private boolean colonSeen;
  private boolean semicolonSeen;
  
  
  State state() {
    return state;
  }
  
  
  /** Returns the inferred statement type. Only meaningful once input is exhausted. */
  StatementType result() {
    return switch (state) {
    case UNDETERMINED, FORMAT -> StatementType.DISPLAY;
    case BOOLEAN -> StatementType.BOOLEAN;
    case CLOCK -> StatementType.CLOCK;
    case MODULE -> StatementType.MODULE;
    case SUBMODULE -> StatementType.SUBMODULE;
    };
  }
  
  
  private boolean inExpression() {
    return state == State.BOOLEAN || state == State.CLOCK;
  }
  
  private static boolean inBraces(Deque<Character> groupings) {
    return !groupings.isEmpty() && groupings.peek() == '{';
  }
  
  private static boolean inParens(Deque<Character> groupings) {
    return !groupings.isEmpty() && groupings.peek() == '(';
  }
  
  
  
  /**
   * Advances the machine over a non-separator token.
   * 
   * @param token     the token
   * @param previous  tokens preceding it
   * @param groupings open groupings, innermost on top
   * @param next      the separator character that ended the token
   */
  Optional<String> onToken(
      Token token, List<Token> previous, Deque<Character> groupings, char next) {
    
    switch (token.type()) {
    
    case ASSIGN:
    case CLOCK_ASSIGN: {
      String kind = token.is(TokenType.ASSIGN) ? "boolean" : "clock";
      if (state != State.UNDETERMINED)
        return error(
            "'%s' can only be used after the dependent in a %s statement."
            .formatted(token.text(), kind));
      if (!groupings.isEmpty())
        return error("'%s' can't be used inside a grouping.".formatted(token.text()));
      if (previous.stream().anyMatch(Token::starred))
        return error("'*' can only be used in a variable list statement.");
      if (previous.stream().anyMatch(t -> t.is(TokenType.CONSTANT)))
        return error(
            "Constants can't be used on the left side of a %s statement.".formatted(kind));
      state = token.is(TokenType.ASSIGN) ? State.BOOLEAN : State.CLOCK;
      return ok();
    }
    
    case OR:
    case XOR:
    case EQUALS:
    case PLUS:
    case MINUS:
      if (!inExpression())
        return error(
            "'%s' operator can only be used in a boolean or clock statement."
            .formatted(token.text()));
      if (inBraces(groupings))
        return error("'%s' can't be used inside a concatenation.".formatted(token.text()));
      return ok();
    
    case NOT:
      if (next != '(' && next != '{')
        return error(
            "'~' must be attached to a scalar, vector, constant, parenthesis or concatenation.");
      return checkNegation(groupings);
    
    case FORMATTER:
      if (state != State.UNDETERMINED && state != State.FORMAT)
        return error(
            "'%s' can only be used in a format specifier statement.".formatted(token.text()));
      if (next != '{' || !groupings.isEmpty())
        return error("Invalid format specifier.");
      state = State.FORMAT;
      return ok();
    
    case MODULE_NAME:
    case INSTANCE:
      if (state != State.UNDETERMINED || !previous.stream().allMatch(t -> t.is(TokenType.SPACE)))
        return error("'%s' must begin its statement.".formatted(token.text()));
      state = token.is(TokenType.MODULE_NAME) ? State.MODULE : State.SUBMODULE;
      return ok();
    
    case SCALAR:
    case VECTOR:
    case CONSTANT:
      if (token.tildes() > 0) {
        var err = checkNegation(groupings);
        if (err.isPresent())
          return err;
      }
      if (token.starred() && state != State.UNDETERMINED)
        return error("'*' can only be used in a variable list statement.");
      return ok();
    
    default:
      throw new IllegalArgumentException("not a lexeme token: " + token);
    }
  }
  
  
  private Optional<String> checkNegation(Deque<Character> groupings) {
    if (!inExpression())
      return error("'~' can only be used on the right side of a boolean or clock statement.");
    if (inBraces(groupings))
      return error("'~' can't be used inside a concatenation field.");
    return ok();
  }
  
  
  
  /**
   * Advances the machine over a separator character (before grouping
   * bookkeeping).
   * 
   * @param c         the separator
   * @param previous  tokens preceding it
   * @param groupings open groupings, innermost on top
   */
  Optional<String> onSeparator(char c, List<Token> previous, Deque<Character> groupings) {
    if (semicolonSeen && !Character.isWhitespace(c))
      return error("';' can only be used to end a statement.");
    
    switch (c) {
    case '{':
      if (inBraces(groupings))
        return error("Concatenations can't be used inside of other concatenations.");
      return ok();
    
    case '}':
      return ok();
    
    case '(':
    case ')':
      if (inBraces(groupings))
        return error("'%c' can't be used in a concatenation.".formatted(c));
      if (state == State.UNDETERMINED || state == State.FORMAT)
        return error(
            "'%c' can't be used in a format specifier or variable list statement.".formatted(c));
      return ok();
    
    case ';':
      if (previous.stream().allMatch(t -> t.is(TokenType.SPACE)))
        return error("';' can only be used to end a statement.");
      semicolonSeen = true;
      return ok();
    
    case ',':
      if (!inParens(groupings) || !(state == State.MODULE || state == State.SUBMODULE))
        return error("',' can only be used inside the () in a submodule or module statement.");
      return ok();
    
    case ':':
      if (!inParens(groupings) || !(state == State.MODULE || state == State.SUBMODULE))
        return error(
            "':' can only be used to separate input and output variables " +
            "in a module or submodule statement.");
      if (colonSeen)
        return error("':' can only be used once in a module or submodule statement.");
      colonSeen = true;
      return ok();
    
    default:
      return ok();
    }
  }
  
  
  private static Optional<String> ok() {
    return Optional.empty();
  }
  
  private static Optional<String> error(String message) {
    return Optional.of(message);
  }

}
