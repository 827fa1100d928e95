/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.boolsim.expand.MacroExpander;
import io.crums.boolsim.lex.LexedStatement;
import io.crums.boolsim.lex.Lexemes;
import io.crums.boolsim.lex.Lexer;
import io.crums.boolsim.lex.StatementType;
import io.crums.boolsim.module.DesignLocator;
import io.crums.boolsim.module.InstanceNode;
import io.crums.boolsim.module.ModuleHeader;
import io.crums.boolsim.stmt.Statement;
import io.crums.boolsim.stmt.StatementBuilder;
import io.crums.boolsim.store.PropagationException;
import io.crums.boolsim.store.ValueStore;

/**
 * Turns design source text into a {@linkplain Circuit}.
 *
 * <h2>Passes</h2>
 * <ol>
 * <li>Every line is lexed, registering vector namespaces as they appear.
 * A {@code name[]} reference must come after an explicit dimension of
 * {@code name}. {@code #library} directives are resolved here.</li>
 * <li>Each line that lexed cleanly is macro-expanded; each expanded line is
 * lexed again and built into a {@linkplain Statement}, registering its
 * variables, dependencies and evaluation nodes. Sub-design instantiations
 * are resolved and parsed (recursively) here. Each instance output is
 * recorded as depending on the parent inputs it reaches combinationally
 * inside the sub-design, so loops through instances are rejected like any
 * other circular dependency.</li>
 * <li>Module header semantics are checked: inputs may not be assigned;
 * outputs must be.</li>
 * </ol>
 * <p>
 * Scanning continues past bad lines so that every diagnostic surfaces in a
 * single pass. Instances are stateless (apart from configuration) and may
 * be reused.
 * </p>
 */
public class Parser {

  /** Tabs are expanded to this many spaces. */
  public final static int TAB_WIDTH = 4;


  private final Config config;
  private final DesignLocator locator;


  public Parser() {
    this(Config.DEFAULT);
  }


  public Parser(Config config) {
    this.config = Objects.requireNonNull(config, "null config");
    this.locator = new DesignLocator(config);
  }


  public Config config() {
    return config;
  }


  /** Parses the given design, with no overrides. */
  public Circuit parse(DesignSource source) {
    return parse(source, Map.of());
  }


  /**
   * Parses the given design.
   *
   * @param overrides   initial values of independent variables, applied
   *                    after the parse (names that are not independent
   *                    variables of the design are ignored)
   *
   * @throws java.io.UncheckedIOException if a sub-design file cannot be read
   * @throws PropagationException if applying the overrides fails to converge
   */
  public Circuit parse(DesignSource source, Map<String, Boolean> overrides) {
    var circuit = new Pass(source, List.of()).run();
    if (circuit.isValid() && !overrides.isEmpty()) {
      var store = circuit.store();
      for (var entry : overrides.entrySet())
        if (store.isIndependent(entry.getKey()))
          store.setValue(entry.getKey(), entry.getValue());
    }
    circuit.store().resetAltClocks();
    return circuit;
  }


  /** Splits the text into lines: tabs expanded, trailing whitespace trimmed. */
  static List<String> lines(String text) {
    String[] raw = text.split("\r?\n", -1);
    int count = raw.length;
    if (count > 0 && raw[count - 1].isEmpty())
      --count;
    List<String> lines = new ArrayList<>(count);
    for (int index = 0; index < count; ++index)
      lines.add(raw[index].replace("\t", " ".repeat(TAB_WIDTH)).stripTrailing());
    return lines;
  }



  /** A single parse pass over one design. */
  private class Pass {

    private final DesignSource source;
    /** Names of the designs instantiating this one, outermost first. */
    private final List<String> chain;

    private final DiagnosticLog log = new DiagnosticLog();
    private final ValueStore store = new ValueStore(config.propagationLimit());
    private final Lexer lexer;
    private final MacroExpander expander;
    private final StatementBuilder builder;

    private final List<File> libraries = new ArrayList<>();
    private final List<Statement> statements = new ArrayList<>();
    private final List<InstanceNode> instances = new ArrayList<>();
    private Statement.ModuleDeclaration header;


    Pass(DesignSource source, List<String> chain) {
      this.source = source;
      this.chain = chain;
      this.lexer = new Lexer(source.name(), store, log);
      this.expander = new MacroExpander(store, log);
      this.builder = new StatementBuilder(store, log, config.showComments());
    }


    Circuit run() {
      var lines = lines(source.text());
      List<LexedStatement> lexed = new ArrayList<>(lines.size());

      boolean statementSeen = false;
      boolean moduleSeen = false;
      for (int index = 0; index < lines.size(); ++index) {
        final int lineNo = index + 1;
        var statement = lexer.lex(lineNo, lines.get(index));
        if (statement.isEmpty())
          continue;
        var type = statement.get().type();
        switch (type) {
        case EMPTY:
        case COMMENT:
          break;
        case LIBRARY:
          if (statementSeen)
            log.lexical(lineNo, "Library statements must come before all other statements.");
          else
            addLibrary(lineNo, statement.get().text());
          continue;
        case MODULE:
          if (moduleSeen) {
            log.semantic(lineNo, "A module declaration already exists.");
            continue;
          }
          moduleSeen = true;
          statementSeen = true;
          break;
        default:
          statementSeen = true;
        }
        lexed.add(statement.get());
      }

      for (var statement : lexed) {
        try {
          build(statement);
        } catch (PropagationException px) {
          log.dependency(
              statement.lineNo(),
              "Values do not settle (%s).".formatted(px.getMessage()));
        }
      }

      checkHeader();

      BoolsimConstants.logDebug(
          "parsed '%s': %d statements, %d variables, %d instances, %d diagnostics"
          .formatted(
              source.name(), statements.size(), store.variables().size(),
              instances.size(), log.size()));

      return new Circuit(
          source,
          store,
          statements,
          Optional.ofNullable(header).map(Statement.ModuleDeclaration::header),
          instances,
          log.diagnostics());
    }


    private void addLibrary(int lineNo, String line) {
      var m = Lexemes.LIBRARY.matcher(line);
      if (!m.matches())
        throw new IllegalArgumentException("not a library directive: " + line);
      String path = m.group(1).trim();
      File dir = new File(path);
      if (!dir.isAbsolute())
        dir = new File(source.directory(config), path);
      if (dir.isDirectory())
        libraries.add(dir);
      else
        log.resolution(lineNo, "Library '%s' is not a directory.".formatted(path));
    }


    private void build(LexedStatement lexed) {
      if (!expander.needsExpansion(lexed)) {
        add(builder.build(lexed));
        return;
      }
      var texts = expander.expand(lexed);
      if (texts.isEmpty())
        return;
      for (var text : texts.get()) {
        var expanded = lexer.relex(lexed.lineNo(), text);
        if (expanded.isEmpty())
          return;
        if (expanded.get().type() != lexed.type())
          throw new BoolsimException(
              "line %d: expansion changed statement type from %s to %s: %s"
              .formatted(lexed.lineNo(), lexed.type(), expanded.get().type(), text));
        if (!add(builder.build(expanded.get())))
          return;
      }
    }


    private boolean add(Optional<Statement> statement) {
      if (statement.isEmpty())
        return false;
      var s = statement.get();
      if (s.kind() == StatementType.MODULE)
        header = (Statement.ModuleDeclaration) s;
      else if (s.kind() == StatementType.SUBMODULE && !instantiate((Statement.SubmoduleInstantiation) s))
        return false;
      statements.add(s);
      return true;
    }


    /**
     * Resolves, parses and wires the given instantiation.
     */
    private boolean instantiate(Statement.SubmoduleInstantiation s) {
      final int lineNo = s.lineNo();
      final String design = s.design();

      if (chain.contains(design) || design.equals(source.name())) {
        List<String> cycle = new ArrayList<>(chain);
        cycle.add(source.name());
        cycle.add(design);
        cycle = cycle.subList(cycle.indexOf(design), cycle.size());
        log.resolution(lineNo, "Cyclic instantiation: " + String.join(" -> ", cycle) + ".");
        return false;
      }

      var file = locator.locate(design, source.directory(config), libraries);
      if (file.isEmpty()) {
        log.resolution(lineNo,
            "Unable to find a design named '%s' with a module declaration.".formatted(design));
        return false;
      }

      List<String> childChain = new ArrayList<>(chain);
      childChain.add(source.name());
      var child = new Pass(DesignSource.load(file.get()), List.copyOf(childChain)).run();
      child.store().resetAltClocks();
      if (!child.isValid()) {
        for (var d : child.diagnostics())
          log.resolution(lineNo,
              "Error in design '%s' (%s).".formatted(design, d));
        return false;
      }
      var childHeader = child.header().get();
      if (!checkPorts(lineNo, s, childHeader))
        return false;

      var node = new InstanceNode(s.instance(), s.ports(), child);
      for (int index = 0; index < node.outputCount(); ++index) {
        String output = node.output(index);
        if (output.equals(BoolsimConstants.NO_CONTACT))
          continue;
        if (!store.tryAddDependencyList(output, node.reads(index), s.text())) {
          log.dependency(lineNo, "Circular dependency found for '%s'.".formatted(output));
          return false;
        }
      }
      store.register(node);
      store.propagate(node.update(store));
      instances.add(node);
      return true;
    }


    private boolean checkPorts(int lineNo, Statement.SubmoduleInstantiation s, ModuleHeader childHeader) {
      var ports = s.ports();
      boolean ok =
          checkSlots(lineNo, s, "input", ports.inputWidths(), childHeader.inputWidths());
      ok &= checkSlots(lineNo, s, "output", ports.outputWidths(), childHeader.outputWidths());
      return ok;
    }


    private boolean checkSlots(
        int lineNo, Statement.SubmoduleInstantiation s, String side,
        List<Integer> widths, List<Integer> expected) {

      if (widths.size() != expected.size()) {
        log.semantic(lineNo,
            "Instantiation '%s' has %d %s(s), but design '%s' declares %d."
            .formatted(s.instance(), widths.size(), side, s.design(), expected.size()));
        return false;
      }
      for (int index = 0; index < widths.size(); ++index) {
        if (!widths.get(index).equals(expected.get(index))) {
          log.semantic(lineNo,
              "%s %d of instantiation '%s' has %d bit(s), but design '%s' expects %d."
              .formatted(
                  side.equals("input") ? "Input" : "Output",
                  index + 1, s.instance(), widths.get(index), s.design(), expected.get(index)));
          return false;
        }
      }
      return true;
    }


    private void checkHeader() {
      if (header == null)
        return;
      final int lineNo = header.lineNo();
      for (var name : header.header().inputBits())
        if (builder.isAssigned(name))
          log.semantic(lineNo, "Module input '%s' can't be assigned.".formatted(name));
      for (var name : header.header().outputBits())
        if (!builder.isAssigned(name))
          log.semantic(lineNo, "Module output '%s' must be assigned.".formatted(name));
    }
  }

}
