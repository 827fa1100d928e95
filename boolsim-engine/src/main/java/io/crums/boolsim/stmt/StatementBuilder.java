/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.stmt;


import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.DiagnosticLog;
import io.crums.boolsim.eval.Expression;
import io.crums.boolsim.lex.LexedStatement;
import io.crums.boolsim.lex.Lexemes;
import io.crums.boolsim.lex.Token;
import io.crums.boolsim.lex.TokenType;
import io.crums.boolsim.module.ModuleHeader;
import io.crums.boolsim.store.ValueStore;

/**
 * Builds {@linkplain Statement}s from expanded, lexed statements,
 * registering their variables, dependency records and evaluation nodes in
 * the value store as it goes. Assignments are evaluated (and their effects
 * propagated) as soon as they're built.
 * <p>
 * One instance per parse pass: it tracks which variables have already been
 * assigned.
 * </p>
 */
public class StatementBuilder {

  /** Returns the name of the next-value slot of the given clocked variable. */
  public static String delaySlot(String name) {
    return name + BoolsimConstants.DELAY_SUFFIX;
  }


  private final ValueStore store;
  private final DiagnosticLog log;
  private final boolean showComments;

  private final Set<String> assigned = new HashSet<>();


  /**
   * @param store         variables and nodes are registered here
   * @param log           diagnostics are logged here
   * @param showComments  whether unflagged comments are rendered
   */
  public StatementBuilder(ValueStore store, DiagnosticLog log, boolean showComments) {
    this.store = Objects.requireNonNull(store, "null store");
    this.log = Objects.requireNonNull(log, "null log");
    this.showComments = showComments;
  }


  /**
   * Claims the named variable as the target of an assignment (or a
   * submodule output).
   *
   * @return {@code false} if it was already claimed (a diagnostic is logged)
   */
  public boolean claim(int lineNo, String name) {
    if (assigned.add(name))
      return true;
    log.dependency(lineNo, "'%s' has already been assigned.".formatted(name));
    return false;
  }


  /** Returns {@code true} if the named variable has been assigned. */
  public boolean isAssigned(String name) {
    return assigned.contains(name);
  }


  /**
   * Builds the given statement. Library directives are not statements:
   * passing one is an error.
   *
   * @param lexed an expanded statement
   *
   * @return empty on error (a diagnostic has been logged)
   */
  public Optional<Statement> build(LexedStatement lexed) {
    return switch (lexed.type()) {
    case EMPTY -> Optional.of(new Statement.Empty(lexed.lineNo(), lexed.text()));
    case COMMENT -> Optional.of(comment(lexed));
    case DISPLAY -> display(lexed);
    case BOOLEAN -> booleanAssignment(lexed);
    case CLOCK -> clockAssignment(lexed);
    case MODULE -> Optional.of(moduleDeclaration(lexed));
    case SUBMODULE -> submodule(lexed);
    case LIBRARY -> throw new IllegalArgumentException(
        "library directive is not a statement: " + lexed.text());
    };
  }


  private Statement comment(LexedStatement lexed) {
    var m = Lexemes.COMMENT.matcher(lexed.text());
    if (!m.matches())
      throw new IllegalArgumentException("not a comment: " + lexed.text());
    String flag = m.group(2);
    boolean shown = flag == null ? showComments : flag.equals("+");
    return new Statement.Comment(
        lexed.lineNo(), lexed.text(), m.group(1).length(), m.group(3), shown);
  }


  private Optional<Statement> display(LexedStatement lexed) {
    int groupBits = -1;
    for (var token : lexed.tokens()) {
      switch (token.type()) {
      case LBRACE:
        groupBits = 0;
        break;
      case RBRACE:
        if (groupBits > BoolsimConstants.MAX_BITS) {
          log.semantic(lexed.lineNo(),
              "Format specifiers can have at most %d bits.".formatted(BoolsimConstants.MAX_BITS));
          return Optional.empty();
        }
        groupBits = -1;
        break;
      case CONSTANT:
        if (groupBits != -1)
          groupBits += Lexemes.constant(token.body()).get().width();
        break;
      case SCALAR:
        if (groupBits != -1)
          ++groupBits;
        break;
      default:
      }
      if (!token.is(TokenType.SCALAR))
        continue;
      String name = token.body();
      if (token.starred()) {
        if (!store.addVariable(name, true, true)) {
          log.semantic(lexed.lineNo(), "'%s' has already been declared.".formatted(name));
          return Optional.empty();
        }
      } else
        store.addVariable(name, false, true);
    }
    return Optional.of(new Statement.Display(lexed.lineNo(), lexed.text(), lexed.tokens()));
  }



  /** Assignment parts. */
  private record Parts(Token operator, List<String> dependents, Expression expression) {  }


  private Parts parts(LexedStatement lexed) {
    var tokens = lexed.tokens();
    int assign = 0;
    while (!tokens.get(assign).type().isAssignment())
      ++assign;
    List<String> dependents = new ArrayList<>();
    for (var token : tokens.subList(0, assign))
      if (token.is(TokenType.SCALAR))
        dependents.add(token.body());

    int end = tokens.size() - 1;    // the ';'
    var expression = Expression.parse(tokens.subList(assign + 1, end));
    return new Parts(tokens.get(assign), dependents, expression);
  }


  private boolean claimDependents(int lineNo, List<String> dependents) {
    for (var dep : dependents) {
      if (!claim(lineNo, dep))
        return false;
      if (!store.addVariable(dep, false, false))
        store.makeDependent(dep);
    }
    return true;
  }


  private void addReads(Expression expression) {
    for (var name : expression.reads())
      store.addVariable(name, false, true);
  }


  private boolean recordDependencies(int lineNo, List<String> targets, Expression expression) {
    var reads = expression.reads();
    for (var target : targets) {
      if (!store.tryAddDependencyList(target, reads, expression.text())) {
        log.dependency(lineNo, "Circular dependency found for '%s'.".formatted(target));
        return false;
      }
    }
    return true;
  }


  private void activate(AssignmentNode node) {
    store.register(node);
    store.propagate(node.update(store));
  }


  private Optional<Statement> booleanAssignment(LexedStatement lexed) {
    final int lineNo = lexed.lineNo();
    var parts = parts(lexed);
    if (!claimDependents(lineNo, parts.dependents()))
      return Optional.empty();
    addReads(parts.expression());
    if (!recordDependencies(lineNo, parts.dependents(), parts.expression()))
      return Optional.empty();

    activate(new AssignmentNode(parts.dependents(), parts.expression()));
    return Optional.of(
        new Statement.BooleanAssignment(
            lineNo, lexed.text(), lexed.tokens(), parts.dependents(), parts.expression()));
  }


  private Optional<Statement> clockAssignment(LexedStatement lexed) {
    final int lineNo = lexed.lineNo();
    var parts = parts(lexed);
    if (!claimDependents(lineNo, parts.dependents()))
      return Optional.empty();

    List<String> slots = new ArrayList<>(parts.dependents().size());
    for (var dep : parts.dependents()) {
      String slot = delaySlot(dep);
      store.addVariable(slot, false, false);
      slots.add(slot);
    }
    addReads(parts.expression());
    if (!recordDependencies(lineNo, slots, parts.expression()))
      return Optional.empty();

    var altClock = Lexemes.altClock(parts.operator().text());
    if (altClock.isPresent()) {
      String clock = altClock.get();
      var ref = Lexemes.scalar(clock);
      if (ref.isEmpty()) {
        log.lexical(lineNo, "Invalid clock '%s'.".formatted(clock));
        return Optional.empty();
      }
      if (!store.updateNamespace(ref.get().namespace(), ref.get().bit(), lineNo, log))
        return Optional.empty();
      store.addVariable(clock, false, true);
      store.addAltClock(clock);
    }

    activate(new AssignmentNode(slots, parts.expression()));
    return Optional.of(
        new Statement.ClockAssignment(
            lineNo, lexed.text(), lexed.tokens(), parts.dependents(),
            parts.expression(), altClock));
  }


  private Statement moduleDeclaration(LexedStatement lexed) {
    var sig = lexed.significantTokens();
    var header = ModuleHeader.parse(sig.get(0).text(), sig);
    for (var slot : header.inputs())
      for (var name : slot)
        store.addVariable(name, false, true);
    for (var slot : header.outputs())
      for (var name : slot)
        store.addVariable(name, false, true);
    return new Statement.ModuleDeclaration(lexed.lineNo(), lexed.text(), lexed.tokens(), header);
  }


  /**
   * Registers the instantiation's input variables and claims its outputs.
   * Resolving the sub-design and wiring the instance is left to the caller.
   */
  private Optional<Statement> submodule(LexedStatement lexed) {
    final int lineNo = lexed.lineNo();
    var sig = lexed.significantTokens();
    String[] names = Lexemes.instance(sig.get(0).text()).get();
    var ports = ModuleHeader.parse(names[0], sig);

    for (var slot : ports.inputs()) {
      for (var text : slot) {
        String body = text.replaceFirst("^~+", "");
        if (!Lexemes.isConstant(body))
          store.addVariable(body, false, true);
      }
    }
    for (var slot : ports.outputs()) {
      for (var text : slot) {
        if (text.equals(BoolsimConstants.NO_CONTACT))
          continue;
        if (Lexemes.isConstant(text) || text.startsWith("~")) {
          log.semantic(lineNo,
              "Instantiation outputs must be scalars, vectors or concatenations of them.");
          return Optional.empty();
        }
        if (!claim(lineNo, text))
          return Optional.empty();
        if (!store.addVariable(text, false, false))
          store.makeDependent(text);
      }
    }
    return Optional.of(
        new Statement.SubmoduleInstantiation(lineNo, lexed.text(), lexed.tokens(), names[1], ports));
  }

}
