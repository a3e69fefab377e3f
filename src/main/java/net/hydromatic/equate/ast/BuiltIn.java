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

import static net.hydromatic.equate.ast.TermBuilder.term;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in constants.
 *
 * <p>Besides the sorts and the boolean literals, there is one constant for
 * each inference rule that conditional-equation extraction uses to build
 * proofs. A rule's type is a universally quantified implication; applying the
 * rule's constant to arguments yields a proof of the conclusion.
 */
public enum BuiltIn {
  /** The sort of types. It has no type. */
  TYPE("Type"),

  /** The type of propositions. */
  BOOL("Bool"),

  TRUE("true"),

  FALSE("false"),

  /** "{@code eqt_intro : forall (a : Bool) (H : a), a = true}". */
  EQT_INTRO("eqt_intro"),

  /** "{@code eqf_intro : forall (a : Bool) (H : not a), a = false}". */
  EQF_INTRO("eqf_intro"),

  /** "{@code and_eliml : forall (a b : Bool) (H : a /\ b), a}". */
  AND_ELIML("and_eliml"),

  /** "{@code and_elimr : forall (a b : Bool) (H : a /\ b), b}". */
  AND_ELIMR("and_elimr"),

  /** "{@code if_imp_then : forall (c a b : Bool)
   * (H : if c then a else b) (Hc : c), a}". */
  IF_IMP_THEN("if_imp_then"),

  /** "{@code if_imp_else : forall (c a b : Bool)
   * (H : if c then a else b) (Hc : not c), b}". */
  IF_IMP_ELSE("if_imp_else");

  public final String name;
  public final Term.Constant constant;

  BuiltIn(String name) {
    this.name = name;
    this.constant = new Term.Constant(name);
  }

  /** Returns the declared type of this built-in, or null if it has none. */
  public Term.@Nullable Exp type() {
    final Term.Exp bool = BOOL.constant;
    switch (this) {
    case TYPE:
      return null;
    case BOOL:
      return TYPE.constant;
    case TRUE:
    case FALSE:
      return bool;
    case EQT_INTRO:
      return term.pi("a", bool,
          term.pi("H", term.var(0),
              term.boolEq(term.var(1), term.trueLiteral())));
    case EQF_INTRO:
      return term.pi("a", bool,
          term.pi("H", term.not(term.var(0)),
              term.boolEq(term.var(1), term.falseLiteral())));
    case AND_ELIML:
    case AND_ELIMR:
      return term.pi("a", bool,
          term.pi("b", bool,
              term.pi("H", term.and(term.var(1), term.var(0)),
                  term.var(this == AND_ELIML ? 2 : 1))));
    case IF_IMP_THEN:
    case IF_IMP_ELSE:
      // Inside "Hc", the indices are Hc = 0, H = 1, b = 2, a = 3, c = 4;
      // its domain sees H = 0, b = 1, a = 2, c = 3.
      final Term.Exp c = term.var(3);
      return term.pi("c", bool,
          term.pi("a", bool,
              term.pi("b", bool,
                  term.pi("H",
                      term.ifThenElse(bool, term.var(2), term.var(1),
                          term.var(0)),
                      this == IF_IMP_THEN
                          ? term.pi("Hc", c, term.var(3))
                          : term.pi("Hc", term.not(c), term.var(2))))));
    default:
      throw new AssertionError(this);
    }
  }
}

// End BuiltIn.java
