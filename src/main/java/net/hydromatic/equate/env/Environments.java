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
package net.hydromatic.equate.env;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.equate.ast.BuiltIn;
import net.hydromatic.equate.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  private static final Environment EMPTY = builder().build();

  /**
   * Returns an environment that contains the built-in constants (see {@link
   * BuiltIn}) and no imported modules.
   */
  public static Environment empty() {
    return EMPTY;
  }

  /** Creates a builder whose declarations start with the built-ins. */
  public static Builder builder() {
    return new Builder();
  }

  /** Environment that looks up declarations in a map. */
  static class MapEnvironment extends Environment {
    private final ImmutableMap<String, Term.Exp> types;
    private final ImmutableSet<String> modules;

    MapEnvironment(ImmutableMap<String, Term.Exp> types,
        ImmutableSet<String> modules) {
      this.types = requireNonNull(types);
      this.modules = requireNonNull(modules);
    }

    @Override
    public boolean imported(String module) {
      return modules.contains(module);
    }

    @Override
    public Term.@Nullable Exp getType(String name) {
      return types.get(name);
    }

    @Override
    public String toString() {
      return "MapEnvironment{modules=" + modules
          + ", constants=" + types.keySet() + "}";
    }
  }

  /** Builds an environment. */
  public static class Builder {
    private final Map<String, Term.Exp> types = new LinkedHashMap<>();
    private final Set<String> modules = new LinkedHashSet<>();

    Builder() {
      for (BuiltIn builtIn : BuiltIn.values()) {
        final Term.@Nullable Exp type = builtIn.type();
        if (type != null) {
          types.put(builtIn.name, type);
        }
      }
    }

    /** Declares a constant of a given type, replacing any previous
     * declaration of the same name. */
    public Builder declare(String name, Term.Exp type) {
      types.put(requireNonNull(name, "name"), requireNonNull(type, "type"));
      return this;
    }

    /** Records that a module has been imported. */
    public Builder imported(String module) {
      modules.add(requireNonNull(module, "module"));
      return this;
    }

    public Environment build() {
      return new MapEnvironment(ImmutableMap.copyOf(types),
          ImmutableSet.copyOf(modules));
    }
  }
}

// End Environments.java
