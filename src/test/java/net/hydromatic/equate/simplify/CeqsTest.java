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

import static net.hydromatic.equate.ast.TermBuilder.term;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.equate.ast.BuiltIn;
import net.hydromatic.equate.ast.Term;
import net.hydromatic.equate.env.Context;
import net.hydromatic.equate.env.Environment;
import net.hydromatic.equate.env.Environments;
import org.junit.jupiter.api.Test;

/** Tests for {@link Ceqs}. */
public class CeqsTest {
  /** Constants, and environments that declare them. */
  private static class Fixture {
    final Term.Constant nat = term.constant("Nat");
    final Term.Constant zero = term.constant("0");
    final Term.Constant f = term.constant("f");
    final Term.Constant g = term.constant("g");
    final Term.Constant g2 = term.constant("g2");
    final Term.Constant p = term.constant("p");
    final Term.Constant bigP = term.constant("P");
    final Term.Constant q = term.constant("Q");
    final Term.Constant c = term.constant("C");
    final Term.Constant d = term.constant("D");
    final Term.Constant h = term.constant("H");

    final Environment env = builder().build();

    /** Returns a builder whose environment declares the fixture's
     * constants. */
    Environments.Builder builder() {
      return Environments.builder()
          .declare("Nat", BuiltIn.TYPE.constant)
          .declare("0", nat)
          .declare("f", term.pi("x", nat, nat))
          .declare("g", term.pi("x", nat, nat))
          .declare("g2", term.pi("x", nat, term.pi("y", nat, nat)))
          .declare("p", term.pi("x", nat, term.bool()))
          .declare("P", term.bool())
          .declare("Q", term.bool())
          .declare("C", term.bool())
          .declare("D", term.bool());
    }

    /** Returns an environment in which "H" is a proof of {@code e}. */
    Environment env(Term.Exp e, boolean conditionals) {
      final Environments.Builder builder = builder().declare("H", e);
      if (conditionals) {
        builder.imported("if_then_else");
      }
      return builder.build();
    }

    /** "f a = 0". */
    Term.Eq fEqZero(Term.Exp a) {
      return term.eq(nat, term.apply(f, a), zero);
    }

    /** "g a = 0". */
    Term.Eq gEqZero(Term.Exp a) {
      return term.eq(nat, term.apply(g, a), zero);
    }

    /** Converts {@code e}, whose proof is "H", and checks the results. */
    List<CondEq> toCeqs(Term.Exp e) {
      return toCeqs(e, false);
    }

    List<CondEq> toCeqs(Term.Exp e, boolean conditionals) {
      final Environment env = env(e, conditionals);
      return check(env, Ceqs.toCeqs(env, e, h));
    }

    /** Checks that each result is a valid conditional equation, and that
     * its proof proves it. */
    List<CondEq> check(Environment env, List<CondEq> ceqs) {
      for (CondEq ceq : ceqs) {
        assertThat(ceq.toString(), Ceqs.isCeq(env, ceq.equation), is(true));
        assertThat(ceq.toString(),
            env.inferType(ceq.proof, Context.empty()), is(ceq.equation));
      }
      return ceqs;
    }
  }

  private static List<String> equations(List<CondEq> ceqs) {
    final List<String> list = new ArrayList<>();
    for (CondEq ceq : ceqs) {
      list.add(ceq.equation.toString());
    }
    return list;
  }

  @Test
  void testEquation() {
    final Fixture f = new Fixture();
    final List<CondEq> ceqs = f.toCeqs(f.fEqZero(f.zero));
    assertThat(ceqs, hasToString("[(f 0 = 0, H)]"));
    assertThat(ceqs.get(0).proof, sameInstance((Term.Exp) f.h));
  }

  @Test
  void testNot() {
    final Fixture f = new Fixture();
    assertThat(f.toCeqs(term.not(f.bigP)),
        hasToString("[(P = false, eqf_intro P H)]"));
  }

  /** Tests that a proposition that is neither an equation nor a
   * negation becomes an equation with "true". */
  @Test
  void testProposition() {
    final Fixture f = new Fixture();
    assertThat(f.toCeqs(f.bigP), hasToString("[(P = true, eqt_intro P H)]"));
    assertThat(f.toCeqs(term.apply(f.p, f.zero)),
        hasToString("[(p 0 = true, eqt_intro (p 0) H)]"));
  }

  @Test
  void testAnd() {
    final Fixture f = new Fixture();
    final List<CondEq> ceqs =
        f.toCeqs(term.and(f.fEqZero(f.zero), f.bigP));
    assertThat(ceqs,
        hasToString("[(f 0 = 0, and_eliml (f 0 = 0) P H), "
            + "(P = true, eqt_intro P (and_elimr (f 0 = 0) P H))]"));

    // Left before right, recursively.
    final List<CondEq> ceqs2 =
        f.toCeqs(term.and(term.and(f.bigP, f.q), term.not(f.c)));
    assertThat(equations(ceqs2),
        hasToString("[P = true, Q = true, C = false]"));
    assertThat(ceqs2.get(0).proof,
        hasToString("eqt_intro P (and_eliml P Q (and_eliml (P /\\ Q) "
            + "(not C) H))"));
    assertThat(ceqs2.get(2).proof,
        hasToString("eqf_intro C (and_elimr (P /\\ Q) (not C) H)"));
  }

  /** Tests that a quantified equation is returned with its original
   * proof. */
  @Test
  void testForallEquation() {
    final Fixture f = new Fixture();
    final Term.Pi e = term.pi("x", f.nat, f.fEqZero(term.var(0)));
    final List<CondEq> ceqs = f.toCeqs(e);
    assertThat(ceqs, hasToString("[(forall (x : Nat), f x = 0, H)]"));
    assertThat(ceqs.get(0).equation, sameInstance((Term.Exp) e));
    assertThat(ceqs.get(0).proof, sameInstance((Term.Exp) f.h));
    checkIdempotent(f, e, ceqs);

    // Same for nested quantifiers, one of which is a hypothesis.
    final Term.Pi e2 =
        term.pi("x", f.nat,
            term.pi("h", f.fEqZero(term.var(0)), f.gEqZero(term.var(1))));
    final List<CondEq> ceqs2 = f.toCeqs(e2);
    assertThat(ceqs2,
        hasToString("[(forall (x : Nat), forall (h : f x = 0), g x = 0, "
            + "H)]"));
    checkIdempotent(f, e2, ceqs2);

    // Two quantified variables, both in the left-hand side.
    final Term.Pi e3 =
        term.pi("x", f.nat,
            term.pi("y", f.nat,
                term.eq(f.nat, term.apply(f.g2, term.var(1), term.var(0)),
                    f.zero)));
    final List<CondEq> ceqs3 = f.toCeqs(e3);
    assertThat(ceqs3,
        hasToString("[(forall (x : Nat), forall (y : Nat), g2 x y = 0, "
            + "H)]"));
    checkIdempotent(f, e3, ceqs3);
  }

  /** Checks that converting the single conditional equation derived from
   * {@code e} yields the same single conditional equation. */
  private static void checkIdempotent(Fixture f, Term.Exp e,
      List<CondEq> ceqs) {
    assertThat(ceqs, hasSize(1));
    final Environment env = f.env(e, false);
    final List<CondEq> ceqs2 =
        f.check(env,
            Ceqs.toCeqs(env, ceqs.get(0).equation, ceqs.get(0).proof));
    assertThat(ceqs2, is(ceqs));
    assertThat(ceqs2.get(0).proof, sameInstance(ceqs.get(0).proof));
  }

  @Test
  void testForallConjunction() {
    final Fixture f = new Fixture();
    final Term.Pi e =
        term.pi("x", f.nat,
            term.and(f.fEqZero(term.var(0)), f.gEqZero(term.var(0))));
    final List<CondEq> ceqs = f.toCeqs(e);
    assertThat(ceqs, hasSize(2));
    assertThat(ceqs.get(0),
        hasToString("(forall (x : Nat), f x = 0, "
            + "fun (x : Nat), and_eliml (f x = 0) (g x = 0) (H x))"));
    assertThat(ceqs.get(1),
        hasToString("(forall (x : Nat), g x = 0, "
            + "fun (x : Nat), and_elimr (f x = 0) (g x = 0) (H x))"));
  }

  @Test
  void testForallProposition() {
    final Fixture f = new Fixture();
    final Term.Pi e = term.pi("x", f.nat, term.apply(f.p, term.var(0)));
    assertThat(f.toCeqs(e),
        hasToString("[(forall (x : Nat), p x = true, "
            + "fun (x : Nat), eqt_intro (p x) (H x))]"));
  }

  /** Tests that a candidate whose quantified variable does not occur in its
   * left-hand side is discarded, and reported to the tracer. */
  @Test
  void testRejected() {
    final Fixture f = new Fixture();
    final Term.Pi e =
        term.pi("x", f.nat, term.and(f.fEqZero(term.var(0)), f.bigP));
    final Environment env = f.env(e, false);
    final List<CondEq> accepted = new ArrayList<>();
    final List<CondEq> rejected = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnReject(
            Tracers.withOnAccept(Tracers.empty(), accepted::add),
            rejected::add);
    final List<CondEq> ceqs =
        f.check(env, Ceqs.toCeqs(env, e, f.h, ImmutableMap.of(), tracer));
    assertThat(equations(ceqs), hasToString("[forall (x : Nat), f x = 0]"));
    assertThat(accepted, is(ceqs));
    assertThat(rejected, hasSize(1));
    assertThat(rejected.get(0),
        hasToString("(forall (x : Nat), P = true, fun (x : Nat), "
            + "eqt_intro P (and_elimr (f x = 0) P (H x)))"));
    assertThat(Ceqs.isCeq(env, rejected.get(0).equation), is(false));

    // Nothing survives from "forall (x : Nat), P".
    final Term.Pi e2 = term.pi("x", f.nat, f.bigP);
    rejected.clear();
    final Environment env2 = f.env(e2, false);
    assertThat(
        Ceqs.toCeqs(env2, e2, f.h, ImmutableMap.of(),
            Tracers.withOnReject(Tracers.empty(), rejected::add)),
        empty());
    assertThat(rejected, hasSize(1));
    assertThat(rejected.get(0).equation,
        hasToString("forall (x : Nat), P = true"));
  }

  @Test
  void testConditional() {
    final Fixture f = new Fixture();
    final Term.If e =
        term.ifThenElse(term.bool(), f.c, f.fEqZero(f.zero), f.q);
    final List<CondEq> ceqs = f.toCeqs(e, true);
    assertThat(ceqs, hasSize(2));
    assertThat(ceqs.get(0),
        hasToString("(forall (Hc : C), f 0 = 0, "
            + "fun (Hc : C), if_imp_then C (f 0 = 0) Q H Hc)"));
    assertThat(ceqs.get(1),
        hasToString("(forall (Hc.1 : not C), Q = true, "
            + "fun (Hc.1 : not C), "
            + "eqt_intro Q (if_imp_else C (f 0 = 0) Q H Hc.1))"));
  }

  /** Tests that a conditional is treated as an ordinary proposition if the
   * module that defines its axioms has not been imported. */
  @Test
  void testConditionalNotImported() {
    final Fixture f = new Fixture();
    final Term.If e =
        term.ifThenElse(term.bool(), f.c, f.fEqZero(f.zero), f.q);
    assertThat(f.toCeqs(e, false),
        hasToString("[((if C then f 0 = 0 else Q) = true, "
            + "eqt_intro (if C then f 0 = 0 else Q) H)]"));
  }

  /** Tests that each hypothesis introduced by a call has a distinct
   * name. */
  @Test
  void testNestedConditional() {
    final Fixture f = new Fixture();
    final Term.If inner =
        term.ifThenElse(term.bool(), f.d, f.fEqZero(f.zero), f.bigP);
    final Term.If e = term.ifThenElse(term.bool(), f.c, inner, f.q);
    final List<CondEq> ceqs = f.toCeqs(e, true);
    assertThat(equations(ceqs),
        hasToString("[forall (Hc : C), forall (Hc.2 : D), f 0 = 0, "
            + "forall (Hc : C), forall (Hc.3 : not D), P = true, "
            + "forall (Hc.1 : not C), Q = true]"));

    // Names start again in each call.
    assertThat(f.toCeqs(e, true), is(ceqs));
    assertThat(equations(f.toCeqs(e, true)).get(2),
        is("forall (Hc.1 : not C), Q = true"));
  }

  @Test
  void testConditionalUnderQuantifier() {
    final Fixture f = new Fixture();
    final Term.Pi e =
        term.pi("x", f.nat,
            term.ifThenElse(term.bool(), term.apply(f.p, term.var(0)),
                f.fEqZero(term.var(0)), f.gEqZero(term.var(0))));
    final List<CondEq> ceqs = f.toCeqs(e, true);
    assertThat(ceqs, hasSize(2));
    assertThat(ceqs.get(0),
        hasToString("(forall (x : Nat), forall (Hc : p x), f x = 0, "
            + "fun (x : Nat), fun (Hc : p x), "
            + "if_imp_then (p x) (f x = 0) (g x = 0) (H x) Hc)"));
    assertThat(ceqs.get(1),
        hasToString("(forall (x : Nat), forall (Hc.1 : not (p x)), g x = 0, "
            + "fun (x : Nat), fun (Hc.1 : not (p x)), "
            + "if_imp_else (p x) (f x = 0) (g x = 0) (H x) Hc.1)"));
  }

  @Test
  void testHypothesisNameProperty() {
    final Fixture f = new Fixture();
    final Term.If e =
        term.ifThenElse(term.bool(), f.c, f.fEqZero(f.zero), f.q);
    final Environment env = f.env(e, true);
    final Map<Prop, Object> map = new HashMap<>();
    Prop.HYPOTHESIS_NAME.set(map, "h");
    final List<CondEq> ceqs =
        f.check(env, Ceqs.toCeqs(env, e, f.h, map, Tracers.empty()));
    assertThat(equations(ceqs),
        hasToString("[forall (h : C), f 0 = 0, "
            + "forall (h.1 : not C), Q = true]"));
  }

  @Test
  void testConditionalModuleProperty() {
    final Fixture f = new Fixture();
    final Term.If e =
        term.ifThenElse(term.bool(), f.c, f.fEqZero(f.zero), f.q);
    final Environment env =
        f.builder().declare("H", e).imported("cond").build();

    // With the default module name, the conditional is not split.
    assertThat(Ceqs.toCeqs(env, e, f.h), hasSize(1));

    final Map<Prop, Object> map = new HashMap<>();
    Prop.CONDITIONAL_MODULE.set(map, "cond");
    final List<CondEq> ceqs =
        f.check(env, Ceqs.toCeqs(env, e, f.h, map, Tracers.empty()));
    assertThat(equations(ceqs),
        hasToString("[forall (Hc : C), f 0 = 0, "
            + "forall (Hc.1 : not C), Q = true]"));
  }

  /** Tests that the proof is not checked. */
  @Test
  void testProofNotChecked() {
    final Fixture f = new Fixture();
    final Term.Exp proof = term.constant("bogus");
    final List<CondEq> ceqs =
        Ceqs.toCeqs(f.env, term.not(f.bigP), proof);
    assertThat(ceqs, hasToString("[(P = false, eqf_intro P bogus)]"));
  }

  @Test
  void testIsCeq() {
    final Fixture f = new Fixture();
    final Environment env = f.env;
    final Term.Var x = term.var(0);

    // Not an equation.
    assertThat(Ceqs.isCeq(env, f.bigP), is(false));
    assertThat(Ceqs.isCeq(env, term.pi("x", f.nat, term.apply(f.p, x))),
        is(false));

    // An equation with no quantifiers.
    assertThat(Ceqs.isCeq(env, f.fEqZero(f.zero)), is(true));

    // "x" occurs in the left-hand side.
    assertThat(Ceqs.isCeq(env, term.pi("x", f.nat, f.fEqZero(x))),
        is(true));

    // "x" occurs only in the right-hand side.
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat, term.eq(f.nat, f.zero, term.apply(f.f, x)))),
        is(false));

    // "x" does not occur at all.
    assertThat(Ceqs.isCeq(env, term.pi("x", f.nat, f.fEqZero(f.zero))),
        is(false));

    // A hypothesis need not occur in the left-hand side.
    assertThat(
        Ceqs.isCeq(env,
            term.pi("h", term.eq(f.nat, f.zero, f.zero), f.fEqZero(f.zero))),
        is(true));
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat,
                term.pi("h", term.apply(f.p, x),
                    f.fEqZero(term.var(1))))),
        is(true));
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat,
                term.pi("h", term.apply(f.p, x), f.fEqZero(f.zero)))),
        is(false));
  }

  /** Tests that variables bound inside the left-hand side, and free
   * variables, are not mistaken for quantified variables. */
  @Test
  void testIsCeqVariables() {
    final Fixture f = new Fixture();
    final Environment env = f.env;
    final Term.Exp natToNat = term.pi("y", f.nat, f.nat);

    // In "fun (y : Nat), g2 y x", variable 1 is "x".
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat,
                term.eq(natToNat,
                    term.lambda("y", f.nat,
                        term.apply(f.g2, term.var(0), term.var(1))),
                    f.f))),
        is(true));

    // In "fun (y : Nat), f y", variable 0 is "y", not "x".
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat,
                term.eq(natToNat,
                    term.lambda("y", f.nat, term.apply(f.f, term.var(0))),
                    f.f))),
        is(false));

    // A free variable is ignored.
    assertThat(Ceqs.isCeq(env, f.fEqZero(term.var(0))), is(true));
    assertThat(Ceqs.isCeq(env, term.pi("x", f.nat, f.fEqZero(term.var(1)))),
        is(false));
  }

  @Test
  void testIsCeqBinderOrder() {
    final Fixture f = new Fixture();
    final Environment env = f.env;

    // "forall x y, f x = g y": "y" is not in the left-hand side.
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat,
                term.pi("y", f.nat,
                    term.eq(f.nat, term.apply(f.f, term.var(1)),
                        term.apply(f.g, term.var(0)))))),
        is(false));

    // "forall x y, f y = g x": "x" is not in the left-hand side.
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat,
                term.pi("y", f.nat,
                    term.eq(f.nat, term.apply(f.f, term.var(0)),
                        term.apply(f.g, term.var(1)))))),
        is(false));

    // "forall x y, g2 x y = 0".
    assertThat(
        Ceqs.isCeq(env,
            term.pi("x", f.nat,
                term.pi("y", f.nat,
                    term.eq(f.nat,
                        term.apply(f.g2, term.var(1), term.var(0)),
                        f.zero)))),
        is(true));
  }

  /** Tests a hypothesis whose type is a variable. A variable of type
   * {@code Bool} is not a proof, so it must occur in the left-hand side. */
  @Test
  void testIsCeqPropositionVariable() {
    final Fixture f = new Fixture();
    final Environment env = f.env;
    assertThat(Ceqs.isCeq(env, BuiltIn.EQT_INTRO.type()), is(true));
    assertThat(Ceqs.isCeq(env, BuiltIn.EQF_INTRO.type()), is(true));
    assertThat(Ceqs.isCeq(env, BuiltIn.AND_ELIML.type()), is(false));
    assertThat(
        Ceqs.isCeq(env,
            term.pi("q", term.bool(),
                term.pi("h", term.var(0),
                    term.boolEq(f.bigP, term.trueLiteral())))),
        is(false));
  }

  /** Tests that each built-in inference rule's type says what
   * {@link Theorems} assumes it says. */
  @Test
  void testTheorems() {
    final Fixture f = new Fixture();
    final Environment env =
        f.builder()
            .declare("hp", f.bigP)
            .declare("hnp", term.not(f.bigP))
            .declare("hpq", term.and(f.bigP, f.q))
            .build();
    final Context empty = Context.empty();
    final Term.Constant hp = term.constant("hp");
    final Term.Constant hnp = term.constant("hnp");
    final Term.Constant hpq = term.constant("hpq");
    assertThat(env.inferType(Theorems.eqtIntro(f.bigP, hp), empty),
        hasToString("P = true"));
    assertThat(env.inferType(Theorems.eqfIntro(f.bigP, hnp), empty),
        hasToString("P = false"));
    assertThat(env.inferType(Theorems.andElimLeft(f.bigP, f.q, hpq), empty),
        is((Term.Exp) f.bigP));
    assertThat(env.inferType(Theorems.andElimRight(f.bigP, f.q, hpq), empty),
        is((Term.Exp) f.q));
    assertThat(
        env.inferType(
            Theorems.ifImpThen(f.c, f.bigP, f.q, hpq, hp), empty),
        is((Term.Exp) f.bigP));
    assertThat(
        env.inferType(
            Theorems.ifImpElse(f.c, f.bigP, f.q, hpq, hp), empty),
        is((Term.Exp) f.q));
    assertThat(
        ImmutableList.of(Theorems.andElimLeft(f.bigP, f.q, hpq)),
        hasToString("[and_eliml P Q hpq]"));
  }
}

// End CeqsTest.java
