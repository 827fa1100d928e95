/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.DiagnosticLog;
import io.crums.boolsim.store.ValueStore;

/**
 * Converts a statement's text into typed tokens, inferring the statement's
 * type and validating the grammar as it goes. Scalars and vectors are
 * registered in the value store's namespaces as they're encountered.
 * <p>
 * An instance is used for a single parse pass (it tracks the instance names
 * already used in the design). Problems are logged to the
 * {@linkplain DiagnosticLog}; {@linkplain #lex(int, String)} then returns
 * empty, but the caller is free to continue with the next line so that all
 * diagnostics surface together.
 * </p>
 * 
 * @see StatementFsm
 */
public class Lexer {
  
  private final String designName;
  private final ValueStore store;
  private final DiagnosticLog log;
  
  private final Set<String> instanceNames = new HashSet<>();
  
  private boolean relexing;
  
  
  /**
   * @param designName  the name of the design being parsed (its file name,
   *                    sans extension)
   * @param store       namespaces are registered here
   * @param log         diagnostics are logged here
   */
  public Lexer(String designName, ValueStore store, DiagnosticLog log) {
    this.designName = Objects.requireNonNull(designName, "null designName");
    this.store = Objects.requireNonNull(store, "null store");
    this.log = Objects.requireNonNull(log, "null log");
  }
  
  
  public String designName() {
    return designName;
  }
  
  
  /**
   * Lexes and validates the given statement.
   * 
   * @param lineNo  1-based line number (for diagnostics)
   * @param line    the statement text: tabs expanded, trailing whitespace
   *                trimmed
   * 
   * @return empty, if invalid (in which case a diagnostic has been logged)
   */
  public Optional<LexedStatement> lex(int lineNo, String line) {
    
    if (line.isBlank())
      return statement(lineNo, line, StatementType.EMPTY, List.of());
    if (Lexemes.COMMENT.matcher(line).matches())
      return statement(lineNo, line, StatementType.COMMENT, List.of());
    if (line.startsWith("#")) {
      if (Lexemes.LIBRARY.matcher(line).matches())
        return statement(lineNo, line, StatementType.LIBRARY, List.of());
      log.lexical(lineNo, "Invalid library statement.");
      return Optional.empty();
    }
    if (line.charAt(line.length() - 1) != ';') {
      log.lexical(lineNo, "Missing ';'.");
      return Optional.empty();
    }
    
    var fsm = new StatementFsm();
    List<Token> tokens = new ArrayList<>();
    Deque<Character> groupings = new ArrayDeque<>();
    StringBuilder lexeme = new StringBuilder();
    
    for (int index = 0; index < line.length(); ++index) {
      final char c = line.charAt(index);
      
      if (Lexemes.isInvalid(c)) {
        log.lexical(lineNo, "Invalid character '%c'.".formatted(c));
        return Optional.empty();
      }
      
      if (!Lexemes.isSeparator(c)) {
        if (c == '\'' && !groupings.isEmpty() && groupings.peek() == '{' &&
            !isAllDigits(lexeme)) {
          log.semantic(lineNo, "Constants in concatenation fields must specify bit count.");
          return Optional.empty();
        }
        lexeme.append(c);
        continue;
      }
      
      // c is a separator
      if (lexeme.length() > 0) {
        var token = classify(lineNo, lexeme.toString(), c);
        if (token.isEmpty())
          return Optional.empty();
        var err = fsm.onToken(token.get(), tokens, groupings, c);
        if (err.isPresent()) {
          log.lexical(lineNo, err.get());
          return Optional.empty();
        }
        if (!register(lineNo, token.get()))
          return Optional.empty();
        tokens.add(token.get());
        lexeme.setLength(0);
      }
      
      var err = fsm.onSeparator(c, tokens, groupings);
      if (err.isPresent()) {
        log.lexical(lineNo, err.get());
        return Optional.empty();
      }
      
      if (Character.isWhitespace(c)) {
        appendSpace(tokens, c);
        continue;
      }
      
      if (c == '{' || c == '(') {
        groupings.push(c);
      } else if (c == '}' || c == ')') {
        if (groupings.isEmpty()) {
          log.lexical(lineNo, "Unmatched '%c'.".formatted(c));
          return Optional.empty();
        }
        char top = groupings.peek();
        if ((c == ')' && top == '(') || (c == '}' && top == '{'))
          groupings.pop();
        else {
          log.lexical(lineNo, "'%c' must be matched first.".formatted(top));
          return Optional.empty();
        }
      }
      tokens.add(new Token(separatorType(c), String.valueOf(c)));
    }
    
    if (!groupings.isEmpty()) {
      log.lexical(lineNo, "'%c' is not matched.".formatted(groupings.peek()));
      return Optional.empty();
    }
    
    var type = fsm.result();
    if (!verify(lineNo, type, tokens))
      return Optional.empty();
    
    return statement(lineNo, line, type, tokens);
  }
  
  
  /**
   * Lexes a line produced by expanding a statement already lexed by this
   * instance. Same as {@linkplain #lex(int, String)}, except the
   * instantiation name (already claimed by the original line) is not
   * checked for reuse.
   */
  public Optional<LexedStatement> relex(int lineNo, String line) {
    relexing = true;
    try {
      return lex(lineNo, line);
    } finally {
      relexing = false;
    }
  }
  
  
  private Optional<LexedStatement> statement(
      int lineNo, String line, StatementType type, List<Token> tokens) {
    return Optional.of(new LexedStatement(lineNo, line, type, tokens));
  }
  
  
  private static boolean isAllDigits(CharSequence chars) {
    if (chars.length() == 0)
      return false;
    for (int index = 0; index < chars.length(); ++index)
      if (!Character.isDigit(chars.charAt(index)))
        return false;
    return true;
  }
  
  
  private static void appendSpace(List<Token> tokens, char c) {
    int last = tokens.size() - 1;
    if (last >= 0 && tokens.get(last).is(TokenType.SPACE))
      tokens.set(last, new Token(TokenType.SPACE, tokens.get(last).text() + c));
    else
      tokens.add(new Token(TokenType.SPACE, String.valueOf(c)));
  }
  
  
  private static TokenType separatorType(char c) {
    return switch (c) {
    case '{' -> TokenType.LBRACE;
    case '}' -> TokenType.RBRACE;
    case '(' -> TokenType.LPAREN;
    case ')' -> TokenType.RPAREN;
    case ',' -> TokenType.COMMA;
    case ':' -> TokenType.COLON;
    case ';' -> TokenType.SEMICOLON;
    default -> throw new IllegalArgumentException("not a separator: '" + c + "'");
    };
  }
  
  
  
  /**
   * Classifies a lexeme. The order matters: the design's own name (before a
   * '(') trumps a scalar of the same name; an instantiation is only
   * recognized before a '('.
   */
  private Optional<Token> classify(int lineNo, String lexeme, char next) {
    if (next == '(' && lexeme.equals(designName))
      return Optional.of(new Token(TokenType.MODULE_NAME, lexeme));
    
    var scalar = Lexemes.scalar(lexeme);
    if (scalar.isPresent()) {
      var ref = scalar.get();
      if (!ref.namespace().chars().anyMatch(Character::isLetter)) {
        log.lexical(lineNo,
            "Scalar name '%s' must contain at least one letter.".formatted(ref.namespace()));
        return Optional.empty();
      }
      if (ref.bit() > BoolsimConstants.MAX_BIT_INDEX) {
        log.semantic(lineNo,
            "Bit count of '%s' must be between 0 and %d."
            .formatted(ref.namespace(), BoolsimConstants.MAX_BIT_INDEX));
        return Optional.empty();
      }
      return Optional.of(new Token(TokenType.SCALAR, lexeme));
    }
    
    var vector = Lexemes.vector(lexeme);
    if (vector.isPresent())
      return checkVector(lineNo, lexeme, vector.get());
    
    var op = Lexemes.operator(lexeme);
    if (op.isPresent())
      return Optional.of(new Token(op.get(), lexeme));
    
    var constant = Lexemes.constant(lexeme);
    if (constant.isPresent()) {
      var c = constant.get();
      if (c.bitCount() > BoolsimConstants.MAX_BITS ||
          c.value() == -1 ||
          c.naturalBits().length() > BoolsimConstants.MAX_BITS) {
        log.semantic(lineNo,
            "Constant can have at most %d bits.".formatted(BoolsimConstants.MAX_BITS));
        return Optional.empty();
      }
      if (!c.fits()) {
        log.semantic(lineNo, "%s doesn't specify enough bits.".formatted(c.text()));
        return Optional.empty();
      }
      if (c.width() == 0) {
        log.semantic(lineNo, "%s must have at least one bit.".formatted(c.text()));
        return Optional.empty();
      }
      return Optional.of(new Token(TokenType.CONSTANT, lexeme));
    }
    
    if (Lexemes.formatter(lexeme).isPresent())
      return Optional.of(new Token(TokenType.FORMATTER, lexeme));
    
    if (next == '(') {
      var instance = Lexemes.instance(lexeme);
      if (instance.isPresent())
        return checkInstance(lineNo, lexeme, instance.get()[0], instance.get()[1]);
    }
    
    log.lexical(lineNo, "Invalid token '%s'.".formatted(lexeme));
    return Optional.empty();
  }
  
  
  private Optional<Token> checkVector(int lineNo, String lexeme, VectorRef ref) {
    String body = lexeme.replaceFirst("^[~*]+", "");
    if (!ref.isImplicit()) {
      if (ref.left() > BoolsimConstants.MAX_BIT_INDEX || ref.right() > BoolsimConstants.MAX_BIT_INDEX) {
        log.semantic(lineNo,
            "Vector bounds of '%s' must be between 0 and %d."
            .formatted(body, BoolsimConstants.MAX_BIT_INDEX));
        return Optional.empty();
      }
      if (ref.step() < 1 || ref.step() > BoolsimConstants.MAX_BIT_INDEX) {
        log.semantic(lineNo,
            "Vector step of '%s' must be between 1 and %d."
            .formatted(body, BoolsimConstants.MAX_BIT_INDEX));
        return Optional.empty();
      }
    }
    return Optional.of(new Token(TokenType.VECTOR, lexeme));
  }
  
  
  private Optional<Token> checkInstance(
      int lineNo, String lexeme, String design, String instance) {
    
    if (design.equals(designName)) {
      log.semantic(lineNo, "You cannot instantiate from the current design.");
      return Optional.empty();
    }
    if (!relexing && !instanceNames.add(instance)) {
      log.semantic(lineNo, "Instantiation name '%s' is already being used.".formatted(instance));
      return Optional.empty();
    }
    return Optional.of(new Token(TokenType.INSTANCE, lexeme));
  }
  
  
  /**
   * Registers the namespace of scalar and vector tokens.
   */
  private boolean register(int lineNo, Token token) {
    if (token.is(TokenType.SCALAR)) {
      var ref = Lexemes.scalar(token.body()).get();
      return store.updateNamespace(ref.namespace(), ref.bit(), lineNo, log);
    }
    if (token.is(TokenType.VECTOR)) {
      var ref = Lexemes.vector(token.body()).get();
      if (ref.isImplicit()) {
        var ns = store.namespace(ref.namespace());
        if (ns.isEmpty()) {
          log.semantic(lineNo,
              "'%s[]' cannot be used without an explicit dimension somewhere."
              .formatted(ref.namespace()));
          return false;
        }
        if (ns.get().isScalar()) {
          log.semantic(lineNo,
              "Namespace '%s' is already being used by a scalar.".formatted(ref.namespace()));
          return false;
        }
        return true;
      }
      return
          store.updateNamespace(ref.namespace(), ref.msb(), lineNo, log) &&
          store.updateNamespace(ref.namespace(), ref.lsb(), lineNo, log);
    }
    return true;
  }
  
  
  
  //   - -   P E R - T Y P E   V E R I F I C A T I O N   - -
  
  
  private boolean verify(int lineNo, StatementType type, List<Token> tokens) {
    var sig = tokens.stream().filter(t -> !t.is(TokenType.SPACE)).toList();
    Optional<String> err = switch (type) {
    case BOOLEAN, CLOCK -> verifyAssignment(tokens, sig);
    case DISPLAY -> verifyDisplay(sig);
    case MODULE -> verifyPorts(sig, true);
    case SUBMODULE -> verifyPorts(sig, false);
    default -> Optional.empty();
    };
    if (err.isPresent()) {
      log.lexical(lineNo, err.get());
      return false;
    }
    return true;
  }
  
  
  private Optional<String> verifyAssignment(List<Token> tokens, List<Token> sig) {
    int assign = 0;
    while (!sig.get(assign).type().isAssignment())
      ++assign;
    
    var lhs = sig.subList(0, assign);
    boolean validLhs;
    if (lhs.size() == 1)
      validLhs = lhs.get(0).type().isVariable();
    else
      validLhs =
          lhs.size() > 2 &&
          lhs.get(0).is(TokenType.LBRACE) &&
          lhs.get(lhs.size() - 1).is(TokenType.RBRACE) &&
          lhs.subList(1, lhs.size() - 1).stream().allMatch(t -> t.type().isVariable());
    if (!validLhs)
      return Optional.of(
          "The dependent of an assignment must be a scalar, vector or concatenation.");
    
    int start = tokens.indexOf(sig.get(assign)) + 1;
    int end = tokens.size() - 1;    // the ';'
    return ExpressionVerifier.verify(tokens.subList(start, end));
  }
  
  
  private Optional<String> verifyDisplay(List<Token> sig) {
    boolean formatted = sig.stream().anyMatch(t -> t.is(TokenType.FORMATTER));
    if (!formatted)
      return Optional.empty();
    boolean inBraces = false;
    Token previous = null;
    for (var token : sig) {
      switch (token.type()) {
      case LBRACE:
        if (previous == null || !previous.is(TokenType.FORMATTER))
          return Optional.of("Invalid format specifier.");
        inBraces = true;
        break;
      case RBRACE:
        if (previous.is(TokenType.LBRACE))
          return Optional.of("Invalid format specifier.");
        inBraces = false;
        break;
      case SCALAR:
      case VECTOR:
      case CONSTANT:
        if (!inBraces)
          return Optional.of(
              "Scalars and vectors in a format specifier statement must be " +
              "inside a format specifier.");
        break;
      default:
      }
      previous = token;
    }
    return Optional.empty();
  }
  
  
  /**
   * {@code Name ( slot [, slot]* : slot [, slot]* ) ;} where a slot is one
   * or more operands or concatenations (expanded vectors yield several).
   */
  private Optional<String> verifyPorts(List<Token> sig, boolean header) {
    final String invalid =
        header ? "Invalid module declaration." : "Invalid submodule instantiation.";
    
    int index = 1;
    if (sig.size() < 2 || !sig.get(index++).is(TokenType.LPAREN))
      return Optional.of(invalid);
    
    boolean colon = false;
    while (true) {
      // slot: one or more operands and/or concatenations
      int items = 0;
      while (index < sig.size()) {
        var token = sig.get(index);
        if (token.is(TokenType.LBRACE)) {
          ++index;
          int members = 0;
          while (index < sig.size() && sig.get(index).type().isOperand()) {
            if (!checkPort(sig.get(index), header))
              return Optional.of(portError(header));
            ++index;
            ++members;
          }
          if (members == 0 || index >= sig.size() || !sig.get(index++).is(TokenType.RBRACE))
            return Optional.of(invalid);
        } else if (token.type().isOperand()) {
          if (!checkPort(token, header))
            return Optional.of(portError(header));
          ++index;
        } else
          break;
        ++items;
      }
      if (items == 0)
        return Optional.of(invalid);
      
      if (index >= sig.size())
        return Optional.of(invalid);
      var sep = sig.get(index++);
      if (sep.is(TokenType.COMMA))
        continue;
      if (sep.is(TokenType.COLON) && !colon) {
        colon = true;
        continue;
      }
      if (sep.is(TokenType.RPAREN) && colon)
        break;
      return Optional.of(invalid);
    }
    
    if (index != sig.size() - 1 || !sig.get(index).is(TokenType.SEMICOLON))
      return Optional.of(invalid);
    return Optional.empty();
  }
  
  
  private static boolean checkPort(Token token, boolean header) {
    return !header || token.type().isVariable();
  }
  
  private static String portError(boolean header) {
    return header ?
        "Module ports must be scalars, vectors or concatenations of them." :
          "Invalid submodule instantiation.";
  }

}
