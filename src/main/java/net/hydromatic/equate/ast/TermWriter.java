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
package net.hydromatic.equate.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints terms.
 *
 * <p>Keeps a stack of the names of the binders that enclose the current
 * point, so that a bound variable prints as the name of its binder. A free
 * variable prints as "{@code #k}", where {@code k} is its index relative to
 * the outermost printed binder.
 */
public class TermWriter {
  private final StringBuilder b = new StringBuilder();
  private final List<String> names = new ArrayList<>();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public TermWriter append(String s) {
    b.append(s);
    return this;
  }

  /**
   * Appends a child term, enclosing it in parentheses if its operator binds
   * less tightly than {@code prec}.
   */
  public TermWriter append(Term.Exp exp, int prec) {
    if (exp.op.prec < prec) {
      b.append('(');
      exp.unparse(this, 0);
      b.append(')');
      return this;
    }
    return exp.unparse(this, prec);
  }

  /** Appends a reference to the variable with a given de Bruijn index. */
  public TermWriter var(int index) {
    if (index < names.size()) {
      b.append(names.get(names.size() - 1 - index));
    } else {
      b.append('#').append(index - names.size());
    }
    return this;
  }

  /** Runs an action inside the scope of a binder called {@code name}. */
  TermWriter binder(String name, Runnable action) {
    names.add(name);
    try {
      action.run();
    } finally {
      names.remove(names.size() - 1);
    }
    return this;
  }
}

// End TermWriter.java
