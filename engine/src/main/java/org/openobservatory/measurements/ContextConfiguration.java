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
package org.openobservatory.measurements;

import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a context configuration where custom setting could be defined for the context only. If not defined, globals will be
 * taken.
 **/
public class ContextConfiguration {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  /**
   * Empty constructor to create just a proxy for the GlobalConfiguration. No values are set.
   */
  public ContextConfiguration() {
  }

  /**
   * Initializes the context with custom parameters. Keys are setting keys or enum names.
   */
  public ContextConfiguration(final Map<String, Object> values) {
    for (final Map.Entry<String, Object> entry : values.entrySet())
      setValue(entry.getKey(), entry.getValue());
  }

  public ContextConfiguration(final ContextConfiguration parent) {
    if (parent != null)
      config.putAll(parent.config);
  }

  /**
   * Loads settings from a JSON document shaped as {@code {"configuration": {"query.maxDimensions": 3, ...}}}, keys without the
   * {@value GlobalConfiguration#PREFIX} prefix. Unknown keys are rejected.
   */
  public ContextConfiguration fromJSON(final String input) {
    if (input == null)
      return this;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (final String k : cfg.keySet())
      setValue(GlobalConfiguration.PREFIX + k, cfg.get(k));
    return this;
  }

  public String toJSON() {
    final JSONObject cfg = new JSONObject();
    for (final Map.Entry<String, Object> entry : config.entrySet())
      cfg.put(entry.getKey().substring(GlobalConfiguration.PREFIX.length()), entry.getValue().toString());

    final JSONObject json = new JSONObject();
    json.put("configuration", cfg);
    return json.toString();
  }

  public ContextConfiguration setValue(final GlobalConfiguration setting, final Object value) {
    if (value == null)
      config.remove(setting.getKey());
    else
      config.put(setting.getKey(), setting.convert(value));
    return this;
  }

  public ContextConfiguration setValue(final String name, final Object value) {
    final GlobalConfiguration setting = GlobalConfiguration.findByKey(name);
    if (setting == null)
      throw new IllegalArgumentException("Unknown setting '" + name + "'");
    return setValue(setting, value);
  }

  public Object getValue(final GlobalConfiguration setting) {
    final Object v = config.get(setting.getKey());
    return v != null ? v : setting.getValue();
  }

  public boolean hasValue(final GlobalConfiguration setting) {
    return config.containsKey(setting.getKey());
  }

  public String getValueAsString(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger(final GlobalConfiguration setting) {
    return ((Number) getValue(setting)).intValue();
  }

  public long getValueAsLong(final GlobalConfiguration setting) {
    return ((Number) getValue(setting)).longValue();
  }

  public Duration getValueAsDuration(final GlobalConfiguration setting) {
    return GlobalConfiguration.toDuration(getValue(setting));
  }

  public Instant getValueAsInstant(final GlobalConfiguration setting) {
    return GlobalConfiguration.toInstant(getValue(setting));
  }

  public int getContextSize() {
    return config.size();
  }
}
