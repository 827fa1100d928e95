/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.json;


import org.json.simple.JSONObject;

import io.crums.boolsim.ParseResult;

/**
 * Writes a {@linkplain ParseResult} as
 * {@code {"ok": true, "tokens": [..]}} or
 * {@code {"ok": false, "diagnostics": [..]}}.
 */
public class ParseResultWriter implements JsonEntityWriter<ParseResult> {
  
  public final static ParseResultWriter INSTANCE = new ParseResultWriter();
  
  public final static String OK = "ok";
  public final static String TOKENS = "tokens";
  public final static String DIAGNOSTICS = "diagnostics";
  

  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(ParseResult result, JSONObject jObj) {
    jObj.put(OK, result.ok());
    if (result.ok())
      jObj.put(TOKENS, DisplayTokenWriter.INSTANCE.toJsonArray(result.tokens()));
    else
      jObj.put(DIAGNOSTICS, DiagnosticWriter.INSTANCE.toJsonArray(result.diagnostics()));
    return jObj;
  }

}
