/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.tidelake.serializer.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JSON array, org.json compatible API over a GSON {@link JsonArray}.
 */
public class JSONArray {
  private final JsonArray array;

  public JSONArray() {
    this.array = new JsonArray();
  }

  public JSONArray(final JsonArray input) {
    this.array = input;
  }

  public JSONArray(final String input) {
    try {
      this.array = JsonParser.parseString(input).getAsJsonArray();
    } catch (final Exception e) {
      throw new JSONException("Invalid JSON array format: " + input, e);
    }
  }

  public JSONArray(final Collection<?> input) {
    this.array = new JsonArray();
    if (input != null)
      for (final Object o : input)
        put(o);
  }

  public JSONArray put(final Object value) {
    array.add(JSONObject.objectToElement(value));
    return this;
  }

  public int length() {
    return array.size();
  }

  public Object get(final int index) {
    return JSONObject.elementToObject(array.get(index));
  }

  public String getString(final int index) {
    return array.get(index).getAsString();
  }

  public long getLong(final int index) {
    return array.get(index).getAsLong();
  }

  public JSONObject getJSONObject(final int index) {
    return new JSONObject(array.get(index).getAsJsonObject());
  }

  public List<Object> toList() {
    final List<Object> result = new ArrayList<>(array.size());
    for (final JsonElement element : array) {
      Object value = JSONObject.elementToObject(element);
      if (value instanceof JSONObject nObject)
        value = nObject.toMap();
      else if (value instanceof JSONArray nArray)
        value = nArray.toList();
      result.add(value);
    }
    return result;
  }

  public List<String> toStringList() {
    final List<String> result = new ArrayList<>(array.size());
    for (final JsonElement element : array)
      result.add(element.isJsonNull() ? null : element.getAsString());
    return result;
  }

  public JsonElement getInternal() {
    return array;
  }

  @Override
  public String toString() {
    return JSONFactory.INSTANCE.getGson().toJson(array);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof JSONArray && array.equals(((JSONArray) o).array);
  }

  @Override
  public int hashCode() {
    return array.hashCode();
  }
}
