/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 *
 */
public class ConfigTest {

  @TempDir
  Path dir;


  @Test
  public void testDefaults() {
    var config = Config.DEFAULT;
    assertTrue(config.showComments());
    assertEquals(".vbi", config.designExt());
    assertEquals(Config.DEFAULT_PROPAGATION_LIMIT, config.propagationLimit());
    assertEquals(List.of(), config.libraryPaths());
  }


  @Test
  public void testProperties() throws Exception {
    Files.createDirectories(dir.resolve("lib"));
    var props = new Properties();
    props.setProperty(Config.BASE_DIR, dir.toString());
    props.setProperty(Config.COMMENTS, " HIDE ");
    props.setProperty(Config.DESIGN_EXT, "txt");
    props.setProperty(Config.PROPAGATION_LIMIT, "50");
    props.setProperty(Config.LIBRARY_PATHS, "lib, missing,");

    var config = new Config(props);
    assertFalse(config.showComments());
    assertEquals(".txt", config.designExt());
    assertEquals(50, config.propagationLimit());
    assertEquals(List.of(new File(dir.toFile(), "lib")), config.libraryPaths());
  }


  @Test
  public void testImproperValuesIgnored() {
    var props = new Properties();
    props.setProperty(Config.COMMENTS, "sometimes");
    props.setProperty(Config.PROPAGATION_LIMIT, "-3");
    var config = new Config(props);
    assertTrue(config.showComments());
    assertEquals(Config.DEFAULT_PROPAGATION_LIMIT, config.propagationLimit());

    props.setProperty(Config.PROPAGATION_LIMIT, "lots");
    assertEquals(Config.DEFAULT_PROPAGATION_LIMIT, new Config(props).propagationLimit());
  }


  @Test
  public void testPropertiesFile() throws Exception {
    Files.createDirectories(dir.resolve("parts"));
    var file = dir.resolve("bsim.properties");
    Files.writeString(file, Config.LIBRARY_PATHS + "=parts\n" + Config.COMMENTS + "=hide\n");

    var config = new Config(file.toFile());
    assertEquals(dir.toFile().getAbsoluteFile(), config.baseDir());
    assertEquals(List.of(new File(config.baseDir(), "parts")), config.libraryPaths());
    assertFalse(config.showComments());
  }


  @Test
  public void testMissingFile() {
    var file = dir.resolve("nope.properties").toFile();
    assertThrows(IllegalArgumentException.class, () -> new Config(file));
  }

}
