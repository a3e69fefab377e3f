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
package net.hydromatic.equate.simplify;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls the extraction of conditional equations.
 *
 * @see Ceqs#toCeqs(net.hydromatic.equate.env.Environment,
 *     net.hydromatic.equate.ast.Term.Exp, net.hydromatic.equate.ast.Term.Exp,
 *     Map, Tracer)
 */
public enum Prop {
  /**
   * String property "hypothesisName" is the name of the hypotheses that are
   * introduced when a conditional is split into its branches. The first
   * hypothesis in a call has this name, and subsequent ones have a numeric
   * suffix. Default is "Hc".
   */
  HYPOTHESIS_NAME("hypothesisName", String.class, true, "Hc"),

  /**
   * String property "conditionalModule" is the module that defines the
   * axioms of "if-then-else". Conditionals are split into their branches only
   * if the environment has imported this module. Default is "if_then_else".
   */
  CONDITIONAL_MODULE("conditionalModule", String.class, true, "if_then_else");

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
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
      throw new RuntimeException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkArgument(
        type == String.class,
        "invalid type %s for property %s",
        type,
        camelName);
    return (String) get(map);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new RuntimeException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
