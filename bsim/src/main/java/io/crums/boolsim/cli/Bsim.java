/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.cli;


import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import io.crums.boolsim.BoolsimException;
import io.crums.boolsim.Config;
import io.crums.boolsim.Design;
import io.crums.boolsim.ParseResult;
import io.crums.boolsim.json.ParseResultWriter;
import io.crums.boolsim.stmt.DisplayToken;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Validates and simulates boolean logic designs.
 */
@Command(
    name = "bsim",
    mixinStandardHelpOptions = true,
    version = "bsim 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "",
        "Boolean logic design validator and simulator.",
        "",
        "Usage: @|bold bsim|@ [@|fg(yellow) --config|@=FILE] COMMAND @|fg(yellow) DESIGN|@",
        "       @|bold bsim help|@ COMMAND",
        "       @|bold bsim|@ [@|fg(yellow) -hV|@]",
        "",
    },
    subcommands = {
        HelpCommand.class,
        Check.class,
        Run.class,
        Sim.class,
    })
public class Bsim {


  public static void main(String[] args) {
    int exitCode;
    try {

      exitCode = new CommandLine(new Bsim()).execute(args);

    } catch (Exception x) {
      if (Thread.interrupted())
        exitCode = INTERRUPT;
      else {
        System.err.printf("Unhandled exception: %s%n", x.toString());
        x.printStackTrace();
        exitCode = ERR_SOFT;
      }
    }
    System.exit(exitCode);
  }


  final static int ERR_SOFT = 1;
  final static int ERR_USER = 2;
  final static int INTERRUPT = 3;
  final static int ERR_IO = 4;



  @Spec
  private CommandSpec spec;


  private Config config = Config.DEFAULT;


  @Option(
      names = "--config",
      paramLabel = "FILE",
      description = {
          "Properties file (library paths, comment display, ..)",
          "Default: none"
      })
  public void setConfig(File configFile) {
    if (!configFile.isFile())
      throw new ParameterException(spec.commandLine(), "not a file: " + configFile);
    try {
      this.config = new Config(configFile);
    } catch (IllegalArgumentException iax) {
      throw new ParameterException(spec.commandLine(), iax.getMessage());
    }
  }


  public Config getConfig() {
    return config;
  }


  /**
   * Loads the given design file.
   *
   * @throws ParameterException if the file does not exist or cannot be read
   */
  Design loadDesign(CommandSpec cmdSpec, File file) {
    if (!file.isFile())
      throw new ParameterException(cmdSpec.commandLine(), "not a file: " + file);
    try {
      return Design.load(file, config);
    } catch (UncheckedIOException uiox) {
      throw new ParameterException(
          cmdSpec.commandLine(), "failed to read " + file + ": " + uiox.getCause().getMessage());
    }
  }


  /**
   * Prints the given result: its tokens, or its diagnostics (in red).
   *
   * @return exit code
   */
  int print(ParseResult result, boolean json) {
    if (json) {
      System.out.println(ParseResultWriter.INSTANCE.toJsonObject(result).toJSONString());
      return result.ok() ? 0 : ERR_USER;
    }
    if (result.ok()) {
      System.out.print(new TokenPrinter(Ansi.AUTO.enabled()).toText(result.tokens()));
      return 0;
    }
    for (var diagnostic : result.diagnostics())
      printfError("%s", diagnostic.toString());
    return ERR_USER;
  }


  /**
   * Invokes {@code System.out.printf(format, args)} after pre-processing
   * any Jansi-encoded strings.
   *
   * @see Ansi#string(String)
   * @see Ansi#AUTO
   */
  public void printf(String format, Object... args) {
    System.out.printf(format, jansify(args));
  }


  private Object[] jansify(Object[] args) {
    for (int index = args.length; index-- > 0; ) {
      if (args[index] instanceof String arg)
        args[index] = Ansi.AUTO.string(arg);
    }
    return args;
  }


  /**
   * Prints a line of error message in red.
   */
  public void printfError(String format, Object... args) {
    var formatted = format.formatted(jansify(args));
    var inRed = Ansi.AUTO.string("@|red " + formatted + "|@");
    System.err.println(inRed);
  }

}


@Command(
    name = Check.NAME,
    description = {
        "Validate a design (and the sub-designs it instantiates)",
        "Prints every diagnostic found, one per line"
    })
class Check implements Callable<Integer> {

  public final static String NAME = "check";

  @ParentCommand
  private Bsim bsim;

  @Spec
  private CommandSpec spec;

  @Parameters(paramLabel = "DESIGN", arity = "1", description = "Design file")
  private File file;


  @Override
  public Integer call() {
    var design = bsim.loadDesign(spec, file);
    var result = design.run();
    if (!result.ok())
      return bsim.print(result, false);
    bsim.printf("%s: @|bold,green OK|@%n", design.name());
    return 0;
  }

}


@Command(
    name = Run.NAME,
    description = {
        "Run a design and print its evaluated output",
    })
class Run implements Callable<Integer> {

  public final static String NAME = "run";

  @ParentCommand
  private Bsim bsim;

  @Spec
  private CommandSpec spec;

  @Parameters(paramLabel = "DESIGN", arity = "1", description = "Design file")
  private File file;


  private final Map<String, Boolean> overrides = new LinkedHashMap<>();

  @Option(
      names = { "-s", "--set" },
      paramLabel = "NAME=0|1",
      description = "Set an independent variable's initial value (repeatable)")
  public void setValue(String assignment) {
    int eq = assignment.indexOf('=');
    String value = eq == -1 ? "" : assignment.substring(eq + 1).trim();
    if (eq < 1 || !(value.equals("0") || value.equals("1")))
      throw new ParameterException(
          spec.commandLine(), "expected NAME=0 or NAME=1: '" + assignment + "'");
    overrides.put(assignment.substring(0, eq).trim(), value.equals("1"));
  }


  private int ticks;

  @Option(
      names = { "-t", "--ticks" },
      paramLabel = "COUNT",
      description = "Number of clock ticks to advance before printing (default 0)")
  public void setTicks(int ticks) {
    if (ticks < 0)
      throw new ParameterException(spec.commandLine(), "negative COUNT: " + ticks);
    this.ticks = ticks;
  }


  @Option(names = "--json", description = "Print output as JSON")
  private boolean json;


  @Override
  public Integer call() {
    var design = bsim.loadDesign(spec, file);
    var result = design.run(overrides);
    if (result.ok() && ticks > 0)
      result = design.tick(ticks);
    return bsim.print(result, json);
  }

}


@Command(
    name = Sim.NAME,
    description = {
        "Interactively simulate a design",
        "",
        "Commands are read from standard input, one per line:",
        "  @|bold click|@ NAME           toggle an independent variable",
        "  @|bold click|@ NAME,NAME.. BITS  set a group of variables",
        "  @|bold tick|@ [COUNT]         advance the clock",
        "  @|bold print|@                print the design's output",
        "  @|bold rerun|@                re-parse, keeping independent values",
        "  @|bold quit|@",
    })
class Sim implements Callable<Integer> {

  public final static String NAME = "sim";

  @ParentCommand
  private Bsim bsim;

  @Spec
  private CommandSpec spec;

  @Parameters(paramLabel = "DESIGN", arity = "1", description = "Design file")
  private File file;


  @Override
  public Integer call() {
    var design = bsim.loadDesign(spec, file);
    var result = design.run();
    bsim.print(result, false);
    if (!result.ok())
      return Bsim.ERR_USER;

    var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    try {
      for (String line = in.readLine(); line != null; line = in.readLine()) {
        var args = line.trim().split("\\s+");
        if (args[0].isEmpty())
          continue;
        if (args[0].equals("quit"))
          break;
        var next = execute(design, args);
        if (next == null)
          bsim.printfError("unknown command: %s", line.trim());
        else
          bsim.print(next, false);
      }
    } catch (IOException iox) {
      bsim.printfError("error reading input: %s", iox.getMessage());
      return Bsim.ERR_IO;
    } catch (BoolsimException bx) {
      bsim.printfError("simulation halted: %s", bx.getMessage());
      return Bsim.ERR_SOFT;
    }
    return 0;
  }


  /** Returns {@code null} if the command is not recognized. */
  static ParseResult execute(Design design, String[] args) {
    switch (args[0]) {
    case "click":
      if (args.length == 2)
        return design.click(args[1]);
      if (args.length == 3)
        return design.click(Arrays.asList(args[1].split(",")), args[2]);
      return null;
    case "tick":
      if (args.length == 1)
        return design.tick();
      if (args.length == 2 && args[1].matches("\\d{1,9}"))
        return design.tick(Integer.parseInt(args[1]));
      return null;
    case "print":
      return args.length == 1 ? design.output() : null;
    case "rerun":
      return args.length == 1 ? design.rerun() : null;
    default:
      return null;
    }
  }

}


/** Renders display tokens as terminal text. */
class TokenPrinter {

  private final boolean color;

  /**
   * @param color if {@code true}, values are shown with ANSI color (green 1,
   *              red 0); otherwise, variables are suffixed with {@code :1}
   *              or {@code :0}.
   */
  TokenPrinter(boolean color) {
    this.color = color;
  }


  String toText(List<DisplayToken> tokens) {
    var out = new StringBuilder();
    for (var token : tokens) {
      if (token instanceof DisplayToken.Variable v)
        out.append(value(v.text(), v.value() ^ v.negated()));
      else if (token instanceof DisplayToken.Paren p)
        out.append(color ? value(p.text(), p.value()) : p.text());
      else
        out.append(token.text());
    }
    return out.toString();
  }


  private String value(String text, boolean value) {
    if (!color)
      return text + (value ? ":1" : ":0");
    return Ansi.ON.string((value ? "@|bold,green " : "@|red ") + text + "|@");
  }

}
