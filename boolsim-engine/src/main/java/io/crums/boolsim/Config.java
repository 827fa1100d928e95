/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Simulator configuration.
 * 
 * <h2>Quirks and Features</h2>
 * <p>
 * A simple properties file is used to store configuration. Every property is
 * optional.
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * Library paths may be specified in either absolute or relative form. For
 * relative paths, <em>paths are resolved relative to the location of the
 * configuration file.</em>
 * </p>
 */
public class Config {
  
  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "boolsim.";
  
  /**
   * The name of the base directory path. <em>This value should not be set in
   * the properties file.</em> It is set dynamically to the parent directory of
   * the configuration file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";
  
  /**
   * Comma-separated list of library directories searched for sub-designs,
   * after the directories named by a design's own {@code #library} directives.
   */
  public final static String LIBRARY_PATHS = ROOT + "library.paths";
  
  /**
   * Whether unflagged comments are rendered: {@code show} (default) or
   * {@code hide}. Comments flagged {@code +} are always rendered; those
   * flagged {@code -}, never.
   */
  public final static String COMMENTS = ROOT + "comments";
  
  /** Design file extension. Defaults to {@code .vbi}. */
  public final static String DESIGN_EXT = ROOT + "design.ext";
  
  /**
   * Maximum number of node evaluations a single propagation may take before
   * it is abandoned as non-convergent.
   */
  public final static String PROPAGATION_LIMIT = ROOT + "propagation.limit";
  
  
  public final static String COMMENTS_SHOW = "show";
  public final static String COMMENTS_HIDE = "hide";
  
  public final static int DEFAULT_PROPAGATION_LIMIT = 1_000_000;
  
  
  public final static List<String> PROP_NAMES = List.of(
      BASE_DIR,
      LIBRARY_PATHS,
      COMMENTS,
      DESIGN_EXT,
      PROPAGATION_LIMIT);
  
  
  /** Default configuration. No extra library paths. */
  public final static Config DEFAULT = new Config(new Properties());
  
  
  
  
  static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getPath());
    return props;
  }
  
  
  
  private final File baseDir;
  private final List<File> libraryPaths;
  private final boolean showComments;
  private final String designExt;
  private final int propagationLimit;
  
  
  
  
  public Config(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }
  
  
  public Config(Properties props) {
    this.baseDir = getBaseDir(props);
    this.libraryPaths = parseLibraryPaths(props.getProperty(LIBRARY_PATHS), baseDir);
    this.showComments = parseComments(props.getProperty(COMMENTS));
    this.designExt = parseDesignExt(props.getProperty(DESIGN_EXT));
    this.propagationLimit = parseLimit(props.getProperty(PROPAGATION_LIMIT));
  }
  
  
  private static File getBaseDir(Properties props) {
    String path = props.getProperty(BASE_DIR);
    return path == null ? new File(".").getAbsoluteFile() : new File(path);
  }
  
  
  private static List<File> parseLibraryPaths(String value, File baseDir) {
    if (value == null || value.isBlank())
      return List.of();
    List<File> paths = new ArrayList<>();
    for (String path : value.split(",")) {
      path = path.trim();
      if (path.isEmpty())
        continue;
      File dir = new File(path);
      if (!dir.isAbsolute())
        dir = new File(baseDir, path);
      if (dir.isDirectory())
        paths.add(dir);
      else
        BoolsimConstants.logWarning(
            "Ignoring library path in property " + LIBRARY_PATHS + "=" + value +
            " Resolves to " + dir + " (using base dir " + baseDir + ")" +
            " which is not a directory.");
    }
    return List.copyOf(paths);
  }
  
  
  private static boolean parseComments(String value) {
    if (value == null || value.isBlank())
      return true;
    value = value.trim().toLowerCase();
    if (value.equals(COMMENTS_SHOW))
      return true;
    if (value.equals(COMMENTS_HIDE))
      return false;
    BoolsimConstants.logWarning(
        "Ignoring improper value in property " + COMMENTS + "=" + value +
        " (expected '" + COMMENTS_SHOW + "' or '" + COMMENTS_HIDE + "')");
    return true;
  }
  
  
  private static String parseDesignExt(String value) {
    if (value == null || value.isBlank())
      return BoolsimConstants.DESIGN_EXT;
    value = value.trim();
    return value.startsWith(".") ? value : "." + value;
  }
  
  
  private static int parseLimit(String value) {
    if (value == null || value.isBlank())
      return DEFAULT_PROPAGATION_LIMIT;
    int limit;
    try {
      limit = Integer.parseInt(value.trim());
    } catch (NumberFormatException nfx) {
      limit = 0;
    }
    if (limit > 0)
      return limit;
    BoolsimConstants.logWarning(
        "Ignoring improper value in property " + PROPAGATION_LIMIT + "=" + value +
        "; using default " + DEFAULT_PROPAGATION_LIMIT);
    return DEFAULT_PROPAGATION_LIMIT;
  }
  
  
  
  
  /** Returns the base directory relative paths are resolved against. */
  public File baseDir() {
    return baseDir;
  }
  
  
  /** Returns the extra library directories (existing ones only). */
  public List<File> libraryPaths() {
    return libraryPaths;
  }
  
  
  /** Returns {@code true} if unflagged comments are rendered. */
  public boolean showComments() {
    return showComments;
  }
  
  
  /** Returns the design file extension, including the leading dot. */
  public String designExt() {
    return designExt;
  }
  
  
  public int propagationLimit() {
    return propagationLimit;
  }

}
