/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.json;


import org.json.simple.JSONObject;

import io.crums.boolsim.Diagnostic;

/**
 * Writes a {@linkplain Diagnostic} as {@code {"line": N, "category": "..", "message": ".."}}.
 */
public class DiagnosticWriter implements JsonEntityWriter<Diagnostic> {
  
  public final static DiagnosticWriter INSTANCE = new DiagnosticWriter();
  
  public final static String LINE = "line";
  public final static String CATEGORY = "category";
  public final static String MESSAGE = "message";
  

  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(Diagnostic diagnostic, JSONObject jObj) {
    jObj.put(LINE, diagnostic.lineNo());
    jObj.put(CATEGORY, diagnostic.category().name().toLowerCase());
    jObj.put(MESSAGE, diagnostic.message());
    return jObj;
  }

}
