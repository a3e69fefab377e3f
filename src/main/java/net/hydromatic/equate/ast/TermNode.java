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

import static java.util.Objects.requireNonNull;

/** Term tree node. */
public abstract class TermNode {
  public final Op op;

  protected TermNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging. Bound variables are printed
   * using the names of their binders, which are not necessarily unique, so
   * the string cannot always be converted back into the same term.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new TermWriter());
  }

  /** Converts this node into a string, with a given writer. */
  final String unparse(TermWriter w) {
    return unparse(w, 0).toString();
  }

  /**
   * Writes this node to a writer.
   *
   * @param w Writer
   * @param prec Minimum precedence required by the context; if this node's
   *     operator binds less tightly, it must be enclosed in parentheses
   */
  abstract TermWriter unparse(TermWriter w, int prec);
}

// End TermNode.java
