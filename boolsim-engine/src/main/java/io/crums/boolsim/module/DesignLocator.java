/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.module;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import io.crums.boolsim.BoolsimConstants;
import io.crums.boolsim.Config;

/**
 * Finds sub-design files by name. A file qualifies only if it contains a
 * module declaration for the design (a line of the form
 * {@code Name(ins : outs);}). Search order:
 * <ol>
 * <li>the instantiating design's own directory,</li>
 * <li>the directories named by its {@code #library} directives, in order,</li>
 * <li>the configured {@linkplain Config#libraryPaths() library paths}.</li>
 * </ol>
 */
public class DesignLocator {
  
  private final Config config;
  
  
  public DesignLocator(Config config) {
    this.config = Objects.requireNonNull(config, "null config");
  }
  
  
  /** Returns the directories searched, in order. */
  public List<File> searchPath(File designDir, List<File> libraries) {
    List<File> dirs = new ArrayList<>(2 + libraries.size() + config.libraryPaths().size());
    if (designDir != null)
      dirs.add(designDir);
    dirs.addAll(libraries);
    dirs.addAll(config.libraryPaths());
    return dirs;
  }
  
  
  /**
   * Locates the named design.
   * 
   * @param name      design name (file name sans extension)
   * @param designDir the instantiating design's directory (may be {@code null})
   * @param libraries the instantiating design's {@code #library} directories
   * 
   * @return the first qualifying file on the search path, if any
   * @throws UncheckedIOException if a candidate file cannot be read
   */
  public Optional<File> locate(String name, File designDir, List<File> libraries) {
    for (var dir : searchPath(designDir, libraries)) {
      File file = new File(dir, name + config.designExt());
      if (!file.isFile())
        continue;
      if (declaresModule(file, name)) {
        BoolsimConstants.logDebug("resolved design '" + name + "' to " + file);
        return Optional.of(file);
      }
      BoolsimConstants.logDebug("skipping " + file + ": no module declaration");
    }
    return Optional.empty();
  }
  
  
  static boolean declaresModule(File file, String name) {
    var header = Pattern.compile("^\\s*" + Pattern.quote(name) + "\\s*\\(.*:.*\\)\\s*;\\s*$");
    try {
      for (var line : Files.readAllLines(file.toPath(), StandardCharsets.UTF_8))
        if (header.matcher(line).matches())
          return true;
      return false;
    } catch (IOException iox) {
      throw new UncheckedIOException("failed to read " + file, iox);
    }
  }

}
