/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.stmt;


import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.eval.ExpressionSolver;
import io.crums.boolsim.eval.Solution;
import io.crums.boolsim.lex.Lexemes;
import io.crums.boolsim.lex.Token;
import io.crums.boolsim.lex.TokenType;
import io.crums.boolsim.store.ValueStore;

/**
 * Renders statements as ordered {@linkplain DisplayToken}s, using the
 * current values in the store. Every rendered statement ends with a
 * {@linkplain DisplayToken.LineBreak LineBreak}; hidden comments render
 * nothing.
 */
public class StatementRenderer {

  private final ValueStore store;


  public StatementRenderer(ValueStore store) {
    this.store = Objects.requireNonNull(store, "null store");
  }


  /** Renders the given statements, in order. */
  public List<DisplayToken> render(List<? extends Statement> statements) {
    List<DisplayToken> out = new ArrayList<>();
    for (var s : statements)
      render(s, out);
    return out;
  }


  /** Renders a single statement. */
  public List<DisplayToken> render(Statement statement) {
    List<DisplayToken> out = new ArrayList<>();
    render(statement, out);
    return out;
  }


  private void render(Statement statement, List<DisplayToken> out) {
    switch (statement.kind()) {
    case EMPTY:
      break;
    case COMMENT:
      var comment = (Statement.Comment) statement;
      if (!comment.shown())
        return;
      if (comment.indent() > 0)
        out.add(new DisplayToken.Space(comment.indent()));
      out.add(new DisplayToken.Comment(comment.comment()));
      break;
    case DISPLAY:
      renderDisplay(((Statement.Display) statement).tokens(), out);
      break;
    case BOOLEAN:
      var assignment = (Statement.BooleanAssignment) statement;
      renderAssignment(
          assignment.tokens(),
          ExpressionSolver.solve(assignment.expression(), store),
          false,
          out);
      break;
    case CLOCK:
      var clocked = (Statement.ClockAssignment) statement;
      renderAssignment(
          clocked.tokens(),
          ExpressionSolver.solve(clocked.expression(), store),
          clocked.pending(store),
          out);
      break;
    case MODULE:
      renderPorts(((Statement.ModuleDeclaration) statement).tokens(), out);
      break;
    case SUBMODULE:
      renderPorts(((Statement.SubmoduleInstantiation) statement).tokens(), out);
      break;
    case LIBRARY:
      throw new IllegalArgumentException("not a statement: " + statement);
    }
    out.add(new DisplayToken.LineBreak());
  }


  private DisplayToken variable(Token token, boolean clickable) {
    String name = token.body();
    return new DisplayToken.Variable(
        name,
        store.getValue(name) == 1,
        clickable && store.isIndependent(name),
        token.negated());
  }


  private static DisplayToken constant(Token token) {
    return new DisplayToken.Constant(
        token.text(),
        Lexemes.constant(token.body()).get().value());
  }


  /** Spaces and punctuation common to every statement kind. */
  private static boolean renderCommon(Token token, List<DisplayToken> out) {
    switch (token.type()) {
    case SPACE:
      out.add(new DisplayToken.Space(token.text().length()));
      return true;
    case LBRACE:
    case RBRACE:
    case COMMA:
    case COLON:
    case SEMICOLON:
      out.add(new DisplayToken.Punctuation(token.text()));
      return true;
    default:
      return false;
    }
  }



  private void renderAssignment(
      List<Token> tokens, Solution solution, boolean pending, List<DisplayToken> out) {

    var opens = new ArrayDeque<Integer>();
    int parens = 0;
    boolean rhs = false;
    String not = "";

    for (int index = 0; index < tokens.size(); ++index) {
      var token = tokens.get(index);
      if (renderCommon(token, out))
        continue;

      switch (token.type()) {
      case ASSIGN:
        rhs = true;
        out.add(new DisplayToken.Operator(token.text()));
        break;
      case CLOCK_ASSIGN:
        rhs = true;
        out.add(new DisplayToken.Clock(token.text(), pending));
        break;
      case SCALAR:
        out.add(variable(token, rhs));
        break;
      case CONSTANT:
        out.add(constant(token));
        break;
      case NOT:
        if (index + 1 < tokens.size() && tokens.get(index + 1).is(TokenType.LPAREN))
          not = token.text();
        else
          out.add(new DisplayToken.Operator(token.text()));
        break;
      case LPAREN:
        opens.push(parens);
        out.add(new DisplayToken.Paren(not + "(", solution.paren(parens++) != 0));
        not = "";
        break;
      case RPAREN:
        out.add(new DisplayToken.Paren(")", solution.paren(opens.pop()) != 0));
        break;
      default:
        out.add(new DisplayToken.Operator(token.text()));
      }
    }
  }



  private void renderDisplay(List<Token> tokens, List<DisplayToken> out) {
    for (int index = 0; index < tokens.size(); ++index) {
      var token = tokens.get(index);
      switch (token.type()) {
      case SEMICOLON:
        break;
      case SPACE:
        out.add(new DisplayToken.Space(token.text().length()));
        break;
      case SCALAR:
        out.add(variable(token, true));
        break;
      case CONSTANT:
        out.add(constant(token));
        break;
      case FORMATTER:
        index = renderFormatter(tokens, index, out);
        break;
      default:
        out.add(new DisplayToken.Punctuation(token.text()));
      }
    }
  }


  /**
   * Renders the format specifier at {@code index} and its group.
   *
   * @return the index of the group's closing brace
   */
  private int renderFormatter(List<Token> tokens, int index, List<DisplayToken> out) {
    char format = Lexemes.formatter(tokens.get(index).text()).get();
    StringBuilder binary = new StringBuilder();
    List<String> variables = new ArrayList<>();
    boolean clickable = true;

    for (++index; !tokens.get(index).is(TokenType.RBRACE); ++index) {
      var member = tokens.get(index);
      if (member.is(TokenType.SCALAR)) {
        String name = member.body();
        variables.add(name);
        binary.append(store.getValue(name) == 1 ^ member.negated() ? '1' : '0');
        clickable &= store.isIndependent(name) && !member.negated();
      } else if (member.is(TokenType.CONSTANT)) {
        Lexemes.constant(member.body()).get().bits().forEach(binary::append);
        clickable = false;
      }
    }

    String bits = binary.toString();
    if (bits.isEmpty() || bits.length() > BoolsimConstants.MAX_BITS)
      throw new IllegalStateException("unchecked format group width: " + bits.length());

    Optional<String> next = clickable ? Optional.of(Formats.nextValue(bits)) : Optional.empty();
    out.add(new DisplayToken.Formatter(Formats.format(format, bits), format, variables, next));
    return index;
  }



  private void renderPorts(List<Token> tokens, List<DisplayToken> out) {
    for (var token : tokens) {
      if (renderCommon(token, out))
        continue;
      switch (token.type()) {
      case MODULE_NAME:
        out.add(new DisplayToken.Punctuation(token.text()));
        break;
      case INSTANCE:
        String[] names = Lexemes.instance(token.text()).get();
        out.add(new DisplayToken.Instance(names[0], names[1]));
        break;
      case SCALAR:
        if (token.text().equals(BoolsimConstants.NO_CONTACT))
          out.add(new DisplayToken.Punctuation(token.text()));
        else
          out.add(variable(token, true));
        break;
      case CONSTANT:
        out.add(constant(token));
        break;
      default:
        out.add(new DisplayToken.Punctuation(token.text()));
      }
    }
  }

}
