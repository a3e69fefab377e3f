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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.equate.ast.TermBuilder.term;

/** Operations on the free variables of terms. */
public abstract class FreeVars {
  private FreeVars() {}

  /**
   * Returns a term with the index of every free variable increased by {@code
   * n}.
   *
   * <p>Use this when moving a term under {@code n} new binders. Variables
   * bound inside the term are unchanged. If {@code n} is zero, or the term
   * has no free variables, returns the term itself.
   */
  public static Term.Exp lift(Term.Exp exp, int n) {
    checkArgument(n >= 0, "negative shift %s", n);
    if (n == 0) {
      return exp;
    }
    return exp.accept(
        new TermShuttle() {
          @Override
          protected Term.Exp visit(Term.Var var) {
            return var.index >= offset ? term.var(var.index + n) : var;
          }
        });
  }

  /**
   * Substitutes {@code arg} for variable 0 in the body of a binder.
   *
   * <p>{@code arg} must be valid in the context outside the binder. Other
   * free variables of {@code body} are lowered by one, because the binder
   * has gone.
   */
  public static Term.Exp instantiate(Term.Exp body, Term.Exp arg) {
    return body.accept(
        new TermShuttle() {
          @Override
          protected Term.Exp visit(Term.Var var) {
            if (var.index < offset) {
              return var;
            } else if (var.index == offset) {
              return lift(arg, offset);
            } else {
              return term.var(var.index - 1);
            }
          }
        });
  }
}

// End FreeVars.java
