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

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

import net.hydromatic.equate.ast.FreeVars;
import net.hydromatic.equate.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sequence of variable bindings that enclose a point in a term.
 *
 * <p>Every context is immutable; when you call {@link #extend}, a new context
 * is created whose innermost binding is the new one, and the old context is
 * unchanged.
 *
 * <p>The binding of de Bruijn index 0 is the innermost (most recently added)
 * binding.
 */
public class Context {
  private static final Context EMPTY = new Context(null, null);

  private final @Nullable Context parent;
  private final @Nullable Binding binding;
  private final int size;

  private Context(@Nullable Context parent, @Nullable Binding binding) {
    this.parent = parent;
    this.binding = binding;
    this.size = parent == null ? 0 : parent.size + 1;
  }

  /** Returns the empty context. */
  public static Context empty() {
    return EMPTY;
  }

  /** Creates a context that is this context plus one more binding. The type
   * must be valid in this context. */
  public Context extend(String name, Term.Exp type) {
    return new Context(this, new Binding(name, type));
  }

  /** Returns the number of bindings. */
  public int size() {
    return size;
  }

  /**
   * Returns the binding of the variable with a given de Bruijn index.
   *
   * <p>The binding's type is valid in the context outside that binding, not
   * in this context; see {@link #typeOf(int)}.
   *
   * @throws IndexOutOfBoundsException if there is no such binding
   */
  public Binding lookup(int index) {
    checkElementIndex(index, size, "variable index");
    Context c = this;
    for (int i = 0; i < index; i++) {
      c = requireNonNull(c.parent);
    }
    return requireNonNull(c.binding);
  }

  /**
   * Returns the type of the variable with a given de Bruijn index, lifted so
   * that it is valid in this context.
   *
   * @throws IndexOutOfBoundsException if there is no such binding
   */
  public Term.Exp typeOf(int index) {
    return FreeVars.lift(lookup(index).type, index + 1);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("[");
    append(b);
    return b.append("]").toString();
  }

  private void append(StringBuilder b) {
    if (parent == null || binding == null) {
      return;
    }
    parent.append(b);
    if (parent.size > 0) {
      b.append(", ");
    }
    b.append(binding.name).append(" : ").append(binding.type);
  }

  /** Binding of a variable name to its type. */
  public static class Binding {
    public final String name;
    public final Term.Exp type;

    Binding(String name, Term.Exp type) {
      this.name = requireNonNull(name, "name");
      this.type = requireNonNull(type, "type");
    }

    @Override
    public String toString() {
      return name + " : " + type;
    }
  }
}

// End Context.java
