/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cqptree.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Property. */
public enum Prop {
  /**
   * String property "span" is the structural attribute that delimits the span
   * that anchored tokens are anchored to. Default is "s" (sentence).
   */
  SPAN("span", String.class, "s"),

  /**
   * Integer property "maxTokens" is the largest number of tokens that a query
   * received by the translation server may have. Default is 5.
   */
  MAX_TOKENS("maxTokens", Integer.class, 5),

  /**
   * Integer property "timeoutMillis" is how long the translation server waits
   * for a translation, in milliseconds. Default is 5,000.
   */
  TIMEOUT_MILLIS("timeoutMillis", Integer.class, 5_000),

  /** Integer property "port" is the port of the translation server. */
  PORT("port", Integer.class, 8080);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Sets the value of a property, allowing strings for integer types. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Integer.class && value instanceof String) {
      final int i;
      try {
        i = Integer.parseInt((String) value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must be an integer", e);
      }
      set(map, i);
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property, or resets it to its default if the value
   * is null. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
