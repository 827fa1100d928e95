/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.json;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Test;

import io.crums.boolsim.Design;
import io.crums.boolsim.DesignSource;
import io.crums.boolsim.stmt.DisplayToken;

/**
 *
 */
public class ParseResultWriterTest {


  private static JSONObject reparse(JSONObject jObj) throws Exception {
    return (JSONObject) new JSONParser().parse(jObj.toJSONString());
  }


  @Test
  public void testSuccess() throws Exception {
    var design = new Design(new DesignSource("Top", "a = b;"));
    var jObj = reparse(ParseResultWriter.INSTANCE.toJsonObject(design.run(Map.of("b", true))));

    assertEquals(Boolean.TRUE, jObj.get(ParseResultWriter.OK));
    assertNull(jObj.get(ParseResultWriter.DIAGNOSTICS));
    var tokens = (JSONArray) jObj.get(ParseResultWriter.TOKENS);
    assertEquals(7, tokens.size());

    var a = (JSONObject) tokens.get(0);
    assertEquals("variable", a.get(DisplayTokenWriter.TYPE));
    assertEquals("a", a.get(DisplayTokenWriter.NAME));
    assertEquals(1L, a.get(DisplayTokenWriter.VALUE));
    assertEquals(Boolean.FALSE, a.get(DisplayTokenWriter.INDEPENDENT));

    var eq = (JSONObject) tokens.get(2);
    assertEquals("operator", eq.get(DisplayTokenWriter.TYPE));
    assertEquals("=", eq.get(DisplayTokenWriter.TEXT));

    var b = (JSONObject) tokens.get(4);
    assertEquals(Boolean.TRUE, b.get(DisplayTokenWriter.INDEPENDENT));
    assertEquals("linebreak", ((JSONObject) tokens.get(6)).get(DisplayTokenWriter.TYPE));
  }


  @Test
  public void testFailure() throws Exception {
    var design = new Design(new DesignSource("Top", "a = a;"));
    var jObj = reparse(ParseResultWriter.INSTANCE.toJsonObject(design.run()));

    assertEquals(Boolean.FALSE, jObj.get(ParseResultWriter.OK));
    assertNull(jObj.get(ParseResultWriter.TOKENS));
    var diagnostics = (JSONArray) jObj.get(ParseResultWriter.DIAGNOSTICS);
    assertEquals(1, diagnostics.size());
    var d = (JSONObject) diagnostics.get(0);
    assertEquals(1L, d.get(DiagnosticWriter.LINE));
    assertEquals("dependency", d.get(DiagnosticWriter.CATEGORY));
    assertEquals("Circular dependency found for 'a'.", d.get(DiagnosticWriter.MESSAGE));
  }


  @Test
  public void testFormatter() {
    var token = new DisplayToken.Formatter(" 3", 'u', List.of("x1", "x0"), Optional.of("00"));
    var jObj = DisplayTokenWriter.INSTANCE.toJsonObject(token);
    assertEquals("formatter", jObj.get(DisplayTokenWriter.TYPE));
    assertEquals(" 3", jObj.get(DisplayTokenWriter.TEXT));
    assertEquals("u", jObj.get(DisplayTokenWriter.FORMAT));
    assertEquals(List.of("x1", "x0"), jObj.get(DisplayTokenWriter.VARS));
    assertEquals("00", jObj.get(DisplayTokenWriter.NEXT));

    token = new DisplayToken.Formatter("3", 'u', List.of("x1"), Optional.empty());
    assertFalse(DisplayTokenWriter.INSTANCE.toJsonObject(token).containsKey(DisplayTokenWriter.NEXT));
  }


  @Test
  public void testInstance() {
    var jObj = DisplayTokenWriter.INSTANCE.toJsonObject(new DisplayToken.Instance("Half", "h1"));
    assertEquals("instance", jObj.get(DisplayTokenWriter.TYPE));
    assertEquals("Half.h1", jObj.get(DisplayTokenWriter.TEXT));
    assertEquals("Half", jObj.get(DisplayTokenWriter.DESIGN));
    assertEquals("h1", jObj.get(DisplayTokenWriter.INSTANCE_NAME));
  }

}
