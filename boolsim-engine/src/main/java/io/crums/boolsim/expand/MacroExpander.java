/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.expand;


import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.DiagnosticLog;
import io.crums.boolsim.lex.LexedStatement;
import io.crums.boolsim.lex.Lexemes;
import io.crums.boolsim.lex.StatementType;
import io.crums.boolsim.lex.Token;
import io.crums.boolsim.lex.TokenType;
import io.crums.boolsim.store.ValueStore;

/**
 * Expands vectors, stepped vectors, numeric constants and concatenations
 * into flat lists of scalars and bits.
 * 
 * <h2>Horizontal Expansion</h2>
 * <p>
 * Display, module and submodule statements expand in place: each vector or
 * concatenation is replaced by its space-separated components. A
 * concatenation following a format specifier keeps its braces.
 * </p>
 * <h2>Vertical Expansion</h2>
 * <p>
 * An assignment whose dependent expands to N &gt; 1 scalars is replaced by
 * N statements, the i'th one substituting the i'th component of every
 * vector, concatenation and constant in the expression. Vectors and
 * concatenations must expand to exactly N components; constants are
 * zero-padded (on the left) to N bits.
 * </p>
 * <h3>Exceptions</h3>
 * <ol>
 * <li>Math ({@code +}, {@code -}) and single-bit comparison ({@code ==}
 * with a 1-bit dependent) expressions stay on one line: vectors become
 * concatenations, evaluated as unsigned integers.</li>
 * <li>A right-hand side consisting of a single constant is wrapped into one
 * concatenation assigned to the (concatenated) dependent, since it already
 * supplies the full bit pattern.</li>
 * </ol>
 * <p>
 * Expansions of explicitly-bounded vectors and of constants are memoized by
 * their literal text for the lifetime of the instance (one parse pass).
 * The {@code name[]} form is not memoized since the namespace may grow.
 * </p>
 */
public class MacroExpander {
  
  private final ValueStore store;
  private final DiagnosticLog log;
  private final Map<String, List<String>> memo = new HashMap<>();
  
  
  /**
   * @param store   namespaces (for {@code name[]} vectors) are looked up here
   * @param log     diagnostics are logged here
   */
  public MacroExpander(ValueStore store, DiagnosticLog log) {
    this.store = Objects.requireNonNull(store, "null store");
    this.log = Objects.requireNonNull(log, "null log");
  }
  
  
  
  /**
   * Returns {@code true} if the statement contains anything to expand
   * (vectors, concatenations, or constants in an assignment).
   */
  public boolean needsExpansion(LexedStatement statement) {
    for (var token : statement.tokens()) {
      switch (token.type()) {
      case VECTOR:
        return true;
      case LBRACE:
        if (statement.type() != StatementType.DISPLAY)
          return true;
        break;
      case CONSTANT:
        if (statement.type().isAssignment() || statement.type() == StatementType.SUBMODULE)
          return true;
        break;
      default:
      }
    }
    return false;
  }
  
  
  /**
   * Expands the given statement.
   * 
   * @return the expanded statement text(s), in order; empty on error (a
   *         diagnostic is logged)
   */
  public Optional<List<String>> expand(LexedStatement statement) {
    return switch (statement.type()) {
    case EMPTY, COMMENT, LIBRARY -> Optional.of(List.of(statement.text()));
    case DISPLAY, MODULE, SUBMODULE -> Optional.of(List.of(expandHorizontally(statement)));
    case BOOLEAN, CLOCK -> expandAssignment(statement);
    };
  }
  
  
  
  //   - -   P I E C E S   - -
  
  /** Segment of a statement's token stream. */
  private sealed interface Piece permits Text, Operand, Concat {  }
  
  /** Passed through verbatim (separators, operators, formatters, ..). */
  private record Text(Token token) implements Piece {  }
  
  /** Scalar, vector or constant. */
  private record Operand(Token token) implements Piece {  }
  
  /** Concatenation, possibly negated by a preceding free-standing {@code ~}. */
  private record Concat(String notText, List<Token> members) implements Piece {
    boolean negated() {
      return (notText.length() & 1) == 1;
    }
  }
  
  
  private static List<Piece> segment(List<Token> tokens) {
    List<Piece> pieces = new ArrayList<>();
    for (int index = 0; index < tokens.size(); ++index) {
      var token = tokens.get(index);
      if (token.is(TokenType.NOT) && index + 1 < tokens.size() &&
          tokens.get(index + 1).is(TokenType.LBRACE)) {
        index = collectConcat(tokens, index + 1, token.text(), pieces);
      } else if (token.is(TokenType.LBRACE)) {
        index = collectConcat(tokens, index, "", pieces);
      } else if (token.type().isOperand()) {
        pieces.add(new Operand(token));
      } else {
        pieces.add(new Text(token));
      }
    }
    return pieces;
  }
  
  
  /** @return the index of the closing brace */
  private static int collectConcat(List<Token> tokens, int lbrace, String notText, List<Piece> pieces) {
    List<Token> members = new ArrayList<>();
    int index = lbrace + 1;
    for (; !tokens.get(index).is(TokenType.RBRACE); ++index) {
      var token = tokens.get(index);
      if (token.type().isOperand())
        members.add(token);
    }
    pieces.add(new Concat(notText, members));
    return index;
  }
  
  
  
  //   - -   O P E R A N D S   - -
  
  
  /**
   * Returns the components of a single operand, sans prefixes. Scalars
   * expand to themselves; constants, to their bits.
   */
  List<String> components(Token operand) {
    String body = operand.body();
    switch (operand.type()) {
    case SCALAR:
      return List.of(body);
    case VECTOR: {
      var ref = Lexemes.vector(body).get();
      if (ref.isImplicit())
        return store.components(ref.namespace());
      return memo.computeIfAbsent(body, b -> List.copyOf(ref.components()));
    }
    case CONSTANT:
      return memo.computeIfAbsent(body, b -> List.copyOf(Lexemes.constant(b).get().bits()));
    default:
      throw new IllegalArgumentException("not an operand: " + operand);
    }
  }
  
  
  /** Returns the flattened components of a concatenation's members. */
  List<String> components(Concat concat) {
    List<String> out = new ArrayList<>();
    for (var member : concat.members())
      out.addAll(components(member));
    return out;
  }
  
  
  private static String prefix(Token operand) {
    return (operand.starred() ? "*" : "") + (operand.negated() ? "~" : "");
  }
  
  
  private static String join(String prefix, List<String> names) {
    var out = new StringBuilder();
    for (var name : names) {
      if (out.length() > 0)
        out.append(' ');
      out.append(prefix).append(name);
    }
    return out.toString();
  }
  
  
  
  //   - -   H O R I Z O N T A L   - -
  
  
  private String expandHorizontally(LexedStatement statement) {
    final boolean bitsForConstants = statement.type() == StatementType.SUBMODULE;
    var out = new StringBuilder();
    Piece previous = null;
    for (var piece : segment(statement.tokens())) {
      if (piece instanceof Text text) {
        out.append(text.token().text());
      
      } else if (piece instanceof Operand op) {
        var token = op.token();
        if (token.is(TokenType.VECTOR) || (bitsForConstants && token.is(TokenType.CONSTANT)))
          out.append(join(prefix(token), components(token)));
        else
          out.append(token.text());
      
      } else if (piece instanceof Concat concat) {
        boolean formatted =
            previous instanceof Text t && t.token().is(TokenType.FORMATTER);
        var members = new StringBuilder();
        for (var member : concat.members()) {
          if (members.length() > 0)
            members.append(' ');
          members.append(join(prefix(member), components(member)));
        }
        out.append(formatted ? "{" + members + "}" : members);
      }
      previous = piece;
    }
    return out.toString();
  }
  
  
  
  //   - -   A S S I G N M E N T S   - -
  
  
  private Optional<List<String>> expandAssignment(LexedStatement statement) {
    final int lineNo = statement.lineNo();
    var pieces = segment(statement.tokens());
    
    int assign = 0;
    while (!(pieces.get(assign) instanceof Text t && t.token().type().isAssignment()))
      ++assign;
    
    // dependent
    int depIndex = 0;
    while (pieces.get(depIndex) instanceof Text)
      ++depIndex;
    var depPiece = pieces.get(depIndex);
    List<String> dependent =
        depPiece instanceof Operand op ? components(op.token()) : components((Concat) depPiece);
    final int width = dependent.size();
    if (width > BoolsimConstants.MAX_BITS) {
      log.semantic(lineNo,
          "A dependent can have at most %d bits.".formatted(BoolsimConstants.MAX_BITS));
      return Optional.empty();
    }
    
    var rhs = pieces.subList(assign + 1, pieces.size());
    
    boolean math = rhs.stream().anyMatch(p -> isText(p, TokenType.PLUS) || isText(p, TokenType.MINUS));
    boolean compare = width == 1 && rhs.stream().anyMatch(p -> isText(p, TokenType.EQUALS));
    
    if (math || compare)
      return integerForm(lineNo, pieces, depIndex, dependent, assign);
    
    var operands = rhs.stream().filter(p -> !(p instanceof Text)).toList();
    if (width > 1 && operands.size() == 1 &&
        operands.get(0) instanceof Operand op && op.token().is(TokenType.CONSTANT))
      return wrapConstant(lineNo, pieces, depIndex, dependent, op.token());
    
    return vertical(lineNo, statement, pieces, depIndex, dependent, assign);
  }
  
  
  private static boolean isText(Piece piece, TokenType type) {
    return piece instanceof Text t && t.token().is(type);
  }
  
  
  private static String concatText(List<String> names) {
    return "{" + join("", names) + "}";
  }
  
  
  private static String dependentText(List<String> dependent) {
    return dependent.size() == 1 ? dependent.get(0) : concatText(dependent);
  }
  
  
  /**
   * Single line; vectors become concatenations so the evaluator sees them
   * as unsigned integers.
   */
  private Optional<List<String>> integerForm(
      int lineNo, List<Piece> pieces, int depIndex, List<String> dependent, int assign) {
    
    var out = new StringBuilder();
    for (int index = 0; index < pieces.size(); ++index) {
      var piece = pieces.get(index);
      if (index == depIndex) {
        out.append(dependentText(dependent));
      } else if (piece instanceof Text text) {
        out.append(text.token().text());
      } else if (piece instanceof Operand op) {
        var token = op.token();
        if (token.is(TokenType.VECTOR)) {
          var comps = components(token);
          if (!checkIntegerWidth(lineNo, comps))
            return Optional.empty();
          out.append(token.negated() ? "~" : "").append(concatText(comps));
        } else
          out.append(token.text());
      } else {
        var concat = (Concat) piece;
        var comps = components(concat);
        if (!checkIntegerWidth(lineNo, comps))
          return Optional.empty();
        out.append(concat.notText()).append(concatText(comps));
      }
    }
    return Optional.of(List.of(out.toString()));
  }
  
  
  private boolean checkIntegerWidth(int lineNo, List<String> comps) {
    if (comps.size() <= BoolsimConstants.MAX_BITS)
      return true;
    log.semantic(lineNo,
        "Concatenations can have at most %d bits.".formatted(BoolsimConstants.MAX_BITS));
    return false;
  }
  
  
  private Optional<List<String>> wrapConstant(
      int lineNo, List<Piece> pieces, int depIndex, List<String> dependent, Token constant) {
    
    var bits = components(constant);
    if (bits.size() > dependent.size()) {
      log.semantic(lineNo,
          "%s has more bits than its %d-bit dependent."
          .formatted(constant.body(), dependent.size()));
      return Optional.empty();
    }
    var out = new StringBuilder();
    for (int index = 0; index < pieces.size(); ++index) {
      var piece = pieces.get(index);
      if (index == depIndex)
        out.append(dependentText(dependent));
      else if (piece instanceof Text text)
        out.append(text.token().text());
      else
        out.append(constant.negated() ? "~" : "").append(concatText(pad(bits, dependent.size())));
    }
    return Optional.of(List.of(out.toString()));
  }
  
  
  private static List<String> pad(List<String> bits, int width) {
    if (bits.size() >= width)
      return bits;
    List<String> out = new ArrayList<>(width);
    for (int count = width - bits.size(); count-- > 0; )
      out.add("0");
    out.addAll(bits);
    return out;
  }
  
  
  private Optional<List<String>> vertical(
      int lineNo, LexedStatement statement,
      List<Piece> pieces, int depIndex, List<String> dependent, int assign) {
    
    final int width = dependent.size();
    final String mismatch =
        "Vector and/or concatenation element counts must be consistent " +
        "across the entire expression.";
    
    // per-piece expansions (null for pieces substituted verbatim)
    List<List<String>> expansions = new ArrayList<>(pieces.size());
    boolean any = width > 1;
    for (int index = 0; index < pieces.size(); ++index) {
      var piece = pieces.get(index);
      List<String> expansion = null;
      if (index > assign) {
        if (piece instanceof Operand op && !op.token().is(TokenType.SCALAR)) {
          var token = op.token();
          var comps = components(token);
          if (token.is(TokenType.CONSTANT)) {
            if (comps.size() > width) {
              log.semantic(lineNo, mismatch);
              return Optional.empty();
            }
            comps = pad(comps, width);
          } else if (comps.size() != width) {
            log.semantic(lineNo, mismatch);
            return Optional.empty();
          }
          expansion = prefixed(token.negated() ? "~" : "", comps);
        } else if (piece instanceof Concat concat) {
          var comps = components(concat);
          if (comps.size() != width) {
            log.semantic(lineNo, mismatch);
            return Optional.empty();
          }
          expansion = prefixed(concat.negated() ? "~" : "", comps);
        }
      }
      any |= expansion != null;
      expansions.add(expansion);
    }
    
    if (!any)
      return Optional.of(List.of(statement.text()));
    
    List<String> lines = new ArrayList<>(width);
    for (int i = 0; i < width; ++i) {
      var out = new StringBuilder();
      for (int index = 0; index < pieces.size(); ++index) {
        var piece = pieces.get(index);
        if (index == depIndex)
          out.append(dependent.get(i));
        else if (expansions.get(index) != null)
          out.append(expansions.get(index).get(i));
        else if (piece instanceof Text text)
          out.append(text.token().text());
        else
          out.append(((Operand) piece).token().text());
      }
      lines.add(out.toString());
    }
    return Optional.of(lines);
  }
  
  
  private static List<String> prefixed(String prefix, List<String> names) {
    if (prefix.isEmpty())
      return names;
    return names.stream().map(n -> prefix + n).toList();
  }

}
