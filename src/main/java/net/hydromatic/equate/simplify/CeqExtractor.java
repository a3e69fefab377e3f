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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.equate.ast.FreeVars.lift;
import static net.hydromatic.equate.ast.TermBuilder.term;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.equate.ast.Term;
import net.hydromatic.equate.env.Environment;

/**
 * Converts a proposition, and a proof of it, into conditional equations.
 *
 * <p>An extractor is used for one call, because it owns the generator of
 * hypothesis names. See {@link Ceqs#toCeqs}.
 */
class CeqExtractor {
  private final Environment env;
  private final Tracer tracer;
  private final NameGenerator nameGenerator;
  private final boolean splitConditionals;

  CeqExtractor(Environment env, String hypothesisName,
      boolean splitConditionals, Tracer tracer) {
    this.env = requireNonNull(env);
    this.tracer = requireNonNull(tracer);
    this.nameGenerator = new NameGenerator(hypothesisName);
    this.splitConditionals = splitConditionals;
  }

  /**
   * Returns the conditional equations derived from proposition {@code e}
   * with proof {@code h}, discarding candidates that are not valid
   * conditional equations.
   */
  ImmutableList<CondEq> extract(Term.Exp e, Term.Exp h) {
    final ImmutableList.Builder<CondEq> list = ImmutableList.builder();
    for (CondEq ceq : apply(e, h)) {
      if (Ceqs.isCeq(env, ceq.equation)) {
        tracer.onAccept(ceq);
        list.add(ceq);
      } else {
        tracer.onReject(ceq);
      }
    }
    return list.build();
  }

  /** Converts a proposition into candidate conditional equations. */
  private List<CondEq> apply(Term.Exp e, Term.Exp h) {
    switch (e.op) {
    case EQ:
      return ImmutableList.of(CondEq.of(e, h));

    case NOT:
      final Term.Exp a = ((Term.Not) e).arg;
      return ImmutableList.of(
          CondEq.of(term.boolEq(a, term.falseLiteral()),
              Theorems.eqfIntro(a, h)));

    case AND:
      final Term.And and = (Term.And) e;
      final List<CondEq> list = new ArrayList<>();
      list.addAll(
          apply(and.left, Theorems.andElimLeft(and.left, and.right, h)));
      list.addAll(
          apply(and.right, Theorems.andElimRight(and.left, and.right, h)));
      return list;

    case PI:
      return applyPi((Term.Pi) e, h);

    case IF:
      if (splitConditionals) {
        return applyIf((Term.If) e, h);
      }
      return applyDefault(e, h);

    default:
      return applyDefault(e, h);
    }
  }

  /** Converts "{@code forall (x : D), body}" by converting {@code body} with
   * proof "{@code h x}", then quantifying each result over {@code x}. */
  private List<CondEq> applyPi(Term.Pi pi, Term.Exp h) {
    final Term.Exp h2 = term.apply(lift(h, 1), term.var(0));
    final List<CondEq> ceqs = apply(pi.body, h2);
    if (ceqs.size() == 1 && ceqs.get(0).equation.equals(pi.body)) {
      // The body was already an equation. Keep the original proof rather
      // than "fun (x : D), h x".
      return ImmutableList.of(CondEq.of(pi, h));
    }
    final List<CondEq> list = new ArrayList<>();
    for (CondEq ceq : ceqs) {
      list.add(
          CondEq.of(term.pi(pi.name, pi.domain, ceq.equation),
              term.lambda(pi.name, pi.domain, ceq.proof)));
    }
    return list;
  }

  /** Converts "{@code if c then a else b}" into equations derived from
   * {@code a} under hypothesis {@code c}, followed by equations derived from
   * {@code b} under hypothesis {@code not c}. */
  private List<CondEq> applyIf(Term.If anIf, Term.Exp h) {
    final Term.Exp c = anIf.condition;
    final Term.Exp notC = term.not(c);

    // Each branch is converted under a new hypothesis, variable 0.
    final Term.Exp c1 = lift(c, 1);
    final Term.Exp a1 = lift(anIf.ifTrue, 1);
    final Term.Exp b1 = lift(anIf.ifFalse, 1);
    final Term.Exp h1 = lift(h, 1);
    final String thenName = nameGenerator.get();
    final String elseName = nameGenerator.get();

    final List<CondEq> thenCeqs =
        apply(a1, Theorems.ifImpThen(c1, a1, b1, h1, term.var(0)));
    final List<CondEq> elseCeqs =
        apply(b1, Theorems.ifImpElse(c1, a1, b1, h1, term.var(0)));

    final List<CondEq> list = new ArrayList<>();
    for (CondEq ceq : thenCeqs) {
      list.add(
          CondEq.of(term.pi(thenName, c, ceq.equation),
              term.lambda(thenName, c, ceq.proof)));
    }
    for (CondEq ceq : elseCeqs) {
      list.add(
          CondEq.of(term.pi(elseName, notC, ceq.equation),
              term.lambda(elseName, notC, ceq.proof)));
    }
    return list;
  }

  /** Converts proposition {@code e} into "{@code e = true}". */
  private static List<CondEq> applyDefault(Term.Exp e, Term.Exp h) {
    return ImmutableList.of(
        CondEq.of(term.boolEq(e, term.trueLiteral()),
            Theorems.eqtIntro(e, h)));
  }
}

// End CeqExtractor.java
