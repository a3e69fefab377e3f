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

import net.hydromatic.equate.ast.BuiltIn;
import net.hydromatic.equate.ast.Term;

/**
 * Builds proof terms.
 *
 * <p>Each method applies one inference rule (see {@link BuiltIn}) to the
 * propositions it concerns and to proofs of its premises.
 */
public abstract class Theorems {
  private Theorems() {}

  /** Given {@code h : a}, returns a proof of "{@code a = true}". */
  public static Term.Exp eqtIntro(Term.Exp a, Term.Exp h) {
    return term.apply(BuiltIn.EQT_INTRO.constant, a, h);
  }

  /** Given {@code h : not a}, returns a proof of "{@code a = false}". */
  public static Term.Exp eqfIntro(Term.Exp a, Term.Exp h) {
    return term.apply(BuiltIn.EQF_INTRO.constant, a, h);
  }

  /** Given {@code h : a /\ b}, returns a proof of {@code a}. */
  public static Term.Exp andElimLeft(Term.Exp a, Term.Exp b, Term.Exp h) {
    return term.apply(BuiltIn.AND_ELIML.constant, a, b, h);
  }

  /** Given {@code h : a /\ b}, returns a proof of {@code b}. */
  public static Term.Exp andElimRight(Term.Exp a, Term.Exp b, Term.Exp h) {
    return term.apply(BuiltIn.AND_ELIMR.constant, a, b, h);
  }

  /** Given {@code h : if c then a else b} and {@code hc : c}, returns a proof
   * of {@code a}. */
  public static Term.Exp ifImpThen(Term.Exp c, Term.Exp a, Term.Exp b,
      Term.Exp h, Term.Exp hc) {
    return term.apply(BuiltIn.IF_IMP_THEN.constant, c, a, b, h, hc);
  }

  /** Given {@code h : if c then a else b} and {@code hc : not c}, returns a
   * proof of {@code b}. */
  public static Term.Exp ifImpElse(Term.Exp c, Term.Exp a, Term.Exp b,
      Term.Exp h, Term.Exp hc) {
    return term.apply(BuiltIn.IF_IMP_ELSE.constant, c, a, b, h, hc);
  }
}

// End Theorems.java
