/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.json;


import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.boolsim.stmt.DisplayToken;

/**
 * Writes {@linkplain DisplayToken}s. Every token carries a {@code "type"}
 * and its {@code "text"}; the rest depends on the type.
 */
public class DisplayTokenWriter implements JsonEntityWriter<DisplayToken> {
  
  public final static DisplayTokenWriter INSTANCE = new DisplayTokenWriter();
  
  public final static String TYPE = "type";
  public final static String TEXT = "text";
  public final static String NAME = "name";
  public final static String VALUE = "value";
  public final static String INDEPENDENT = "independent";
  public final static String NEGATED = "negated";
  public final static String PENDING = "pending";
  public final static String FORMAT = "format";
  public final static String VARS = "vars";
  public final static String NEXT = "next";
  public final static String DESIGN = "design";
  public final static String INSTANCE_NAME = "instance";
  
  
  /** Returns the JSON type name of the given token. */
  public static String typeName(DisplayToken token) {
    return token.getClass().getSimpleName().toLowerCase();
  }
  

  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(DisplayToken token, JSONObject jObj) {
    jObj.put(TYPE, typeName(token));
    jObj.put(TEXT, token.text());
    
    if (token instanceof DisplayToken.Variable v) {
      jObj.put(NAME, v.name());
      jObj.put(VALUE, v.value() ? 1 : 0);
      jObj.put(INDEPENDENT, v.independent());
      jObj.put(NEGATED, v.negated());
    
    } else if (token instanceof DisplayToken.Clock c) {
      jObj.put(PENDING, c.pending());
    
    } else if (token instanceof DisplayToken.Constant c) {
      jObj.put(VALUE, c.value());
    
    } else if (token instanceof DisplayToken.Paren p) {
      jObj.put(VALUE, p.value() ? 1 : 0);
    
    } else if (token instanceof DisplayToken.Formatter f) {
      jObj.put(FORMAT, String.valueOf(f.format()));
      JSONArray vars = new JSONArray();
      vars.addAll(f.variables());
      jObj.put(VARS, vars);
      f.nextValue().ifPresent(next -> jObj.put(NEXT, next));
    
    } else if (token instanceof DisplayToken.Instance i) {
      jObj.put(DESIGN, i.design());
      jObj.put(INSTANCE_NAME, i.instance());
    }
    return jObj;
  }

}
