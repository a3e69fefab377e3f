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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.equate.ast.Term;
import net.hydromatic.equate.ast.TermVisitor;
import net.hydromatic.equate.env.Context;
import net.hydromatic.equate.env.Environment;

/**
 * Conditional equations.
 *
 * <p>A conditional equation is a proved equation "{@code lhs = rhs}",
 * possibly under universal quantifiers, that a simplifier uses as a rewrite
 * rule. For example,
 *
 * <blockquote>
 *
 * <pre>forall (x : Nat) (H : x &gt; 0), f x = g x</pre>
 *
 * </blockquote>
 *
 * <p>rewrites "{@code f 3}" to "{@code g 3}" once the simplifier has proved
 * "{@code 3 > 0}".
 */
public abstract class Ceqs {
  private Ceqs() {}

  /**
   * Converts a proposition {@code e}, with proof {@code h}, into a list of
   * conditional equations, each with a proof.
   *
   * <p>Conjunctions are split, and quantifiers and conditionals become
   * hypotheses of the equations derived from their bodies. A negation "{@code
   * not a}" becomes "{@code a = false}", and any other proposition {@code a}
   * that is not an equation becomes "{@code a = true}". Every result satisfies
   * {@link #isCeq}; candidates that do not are discarded.
   *
   * @param env Environment
   * @param e Proposition
   * @param h Proof of {@code e}; not checked
   * @return Conditional equations, in order
   */
  public static List<CondEq> toCeqs(Environment env, Term.Exp e, Term.Exp h) {
    return toCeqs(env, e, h, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Converts a proposition into a list of conditional equations, with given
   * properties and tracer.
   *
   * @see #toCeqs(Environment, Term.Exp, Term.Exp)
   * @see Prop
   */
  public static List<CondEq> toCeqs(Environment env, Term.Exp e, Term.Exp h,
      Map<Prop, Object> propMap, Tracer tracer) {
    final String hypothesisName = Prop.HYPOTHESIS_NAME.stringValue(propMap);
    final boolean splitConditionals =
        env.imported(Prop.CONDITIONAL_MODULE.stringValue(propMap));
    return new CeqExtractor(env, hypothesisName, splitConditionals, tracer)
        .extract(e, h);
  }

  /**
   * Returns whether a term is a valid conditional equation.
   *
   * <p>It must be an equation, possibly under universal quantifiers, and every
   * quantified variable must occur in the left-hand side, unless the
   * variable's type is a proposition. A variable that does not occur in the
   * left-hand side would not be bound when the simplifier matches the
   * left-hand side against a term, so the rule could never be instantiated.
   * Variables whose type is a proposition are hypotheses, and the simplifier
   * proves them separately.
   */
  public static boolean isCeq(Environment env, Term.Exp e) {
    final List<Boolean> inLhs = new ArrayList<>();
    Context context = Context.empty();
    while (e instanceof Term.Pi) {
      final Term.Pi pi = (Term.Pi) e;
      // A hypothesis does not need to occur in the left-hand side.
      inLhs.add(env.isProposition(pi.domain, context));
      context = context.extend(pi.name, pi.domain);
      e = pi.body;
    }
    if (!(e instanceof Term.Eq)) {
      return false;
    }
    final Term.Exp lhs = ((Term.Eq) e).lhs;
    final int n = inLhs.size();
    TermVisitor.forEach(lhs, (e2, offset) -> {
      if (e2 instanceof Term.Var) {
        final int index = ((Term.Var) e2).index;
        // Variables below "offset" are bound within the left-hand side;
        // indices beyond the quantifiers are free in the whole equation.
        if (index >= offset && index - offset < n) {
          inLhs.set(n - (index - offset) - 1, true);
        }
      }
    });
    return !inLhs.contains(false);
  }
}

// End Ceqs.java
