/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;
import java.util.Optional;

/**
 * Source text of a design, with its name and (if loaded from disk) its file.
 *
 * @param name  design name: the file name sans extension
 * @param text  the source text
 * @param file  the file it was loaded from, if any
 */
public record DesignSource(String name, String text, Optional<File> file) {

  public DesignSource {
    Objects.requireNonNull(name, "null name");
    Objects.requireNonNull(text, "null text");
    Objects.requireNonNull(file, "null file");
    if (name.isBlank())
      throw new IllegalArgumentException("blank name");
  }


  /** Creates an in-memory instance. */
  public DesignSource(String name, String text) {
    this(name, text, Optional.empty());
  }


  /**
   * Loads the given design file (UTF-8). The name is the file name up to
   * its last dot.
   *
   * @throws UncheckedIOException on I/O error
   */
  public static DesignSource load(File file) {
    String filename = file.getName();
    int dot = filename.lastIndexOf('.');
    String name = dot > 0 ? filename.substring(0, dot) : filename;
    try {
      String text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
      return new DesignSource(name, text, Optional.of(file));
    } catch (IOException iox) {
      throw new UncheckedIOException("failed to read design file " + file, iox);
    }
  }


  /** Returns a copy with the given text. */
  public DesignSource withText(String text) {
    return new DesignSource(name, text, file);
  }


  /**
   * Returns the directory relative {@code #library} paths and sub-designs are
   * resolved against: the file's parent, if loaded from disk; the configured
   * base directory, otherwise.
   */
  public File directory(Config config) {
    return file.map(f -> f.getAbsoluteFile().getParentFile()).orElse(config.baseDir());
  }

}
