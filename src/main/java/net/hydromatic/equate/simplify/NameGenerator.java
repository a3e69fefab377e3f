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
import static java.util.Objects.requireNonNull;

/**
 * Generates names for hypotheses.
 *
 * <p>The first name is the base name, say "Hc"; subsequent names are "Hc.1",
 * "Hc.2", and so forth. Every name returned by a given generator is distinct.
 *
 * <p>Not thread-safe. Each extraction creates its own generator.
 */
class NameGenerator {
  private final String base;
  private int id = 0;

  NameGenerator(String base) {
    this.base = requireNonNull(base, "base");
    checkArgument(!base.isEmpty(), "empty base name");
  }

  /** Generates a name that is unique in this generator. */
  String get() {
    final int i = id++;
    return i == 0 ? base : base + "." + i;
  }
}

// End NameGenerator.java
