/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.json;

import java.util.Collection;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Writes simulator output ({@linkplain io.crums.boolsim.ParseResult parse
 * results}, display tokens, diagnostics) as json-simple objects.
 * Implementations only need to fill in an object's fields.
 * 
 * @param <E> the type written
 */
public interface JsonEntityWriter<E> {
  
  
  /** Returns a new JSON object with the given element's fields. */
  default JSONObject toJsonObject(E element) {
    return injectEntity(element, new JSONObject());
  }
  
  
  /**
   * Puts the given element's fields into {@code jObj} and returns it.
   */
  JSONObject injectEntity(E element, JSONObject jObj);
  
  
  /**
   * Returns the elements as a JSON array of objects, in iteration order.
   */
  @SuppressWarnings("unchecked")
  default JSONArray toJsonArray(Collection<? extends E> elements) {
    JSONArray jArray = new JSONArray();
    elements.forEach(e -> jArray.add(toJsonObject(e)));
    return jArray;
  }

}
