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
package com.tidelake;

import com.tidelake.serializer.json.JSONObject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a context configuration where custom setting could be defined for the context only. If not defined, globals
 * will be taken.
 */
public class ContextConfiguration {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  /**
   * Empty constructor to create just a proxy for the GlobalConfiguration. No values are set.
   */
  public ContextConfiguration() {
  }

  public ContextConfiguration(final Map<String, Object> config) {
    this.config.putAll(config);
  }

  public ContextConfiguration(final ContextConfiguration parent) {
    if (parent != null)
      config.putAll(parent.config);
  }

  public void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject cfg = new JSONObject(input).getJSONObject("configuration");
    for (final String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = GlobalConfiguration.findByKey(GlobalConfiguration.PREFIX + k);
      if (cfgEntry != null)
        setValue(cfgEntry, cfg.get(k));
    }
  }

  public String toJSON() {
    final JSONObject cfg = new JSONObject();
    for (final Map.Entry<String, Object> entry : config.entrySet())
      cfg.put(entry.getKey().substring(GlobalConfiguration.PREFIX.length()), entry.getValue());
    return new JSONObject().put("configuration", cfg).toString();
  }

  public ContextConfiguration setValue(final GlobalConfiguration setting, final Object value) {
    if (value == null)
      config.remove(setting.getKey());
    else
      config.put(setting.getKey(), setting.convert(value));
    return this;
  }

  public Object getValue(final GlobalConfiguration setting) {
    final Object local = config.get(setting.getKey());
    return local != null ? local : setting.getValue();
  }

  public boolean getValueAsBoolean(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(String.valueOf(v));
  }

  public String getValueAsString(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public int getContextSize() {
    return config.size();
  }
}
