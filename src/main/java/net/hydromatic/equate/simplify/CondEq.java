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

import java.util.Objects;
import net.hydromatic.equate.ast.Term;

/**
 * Conditional equation, and a proof of it.
 *
 * <p>The equation has the form "{@code lhs = rhs}", possibly under one or
 * more universal quantifiers, and is used by a simplifier as a rewrite rule
 * from {@code lhs} to {@code rhs}. Quantified variables whose type is a
 * proposition are hypotheses, which the simplifier must discharge before it
 * applies the rule.
 */
public class CondEq {
  public final Term.Exp equation;
  public final Term.Exp proof;

  CondEq(Term.Exp equation, Term.Exp proof) {
    this.equation = requireNonNull(equation, "equation");
    this.proof = requireNonNull(proof, "proof");
  }

  /** Creates a conditional equation. */
  public static CondEq of(Term.Exp equation, Term.Exp proof) {
    return new CondEq(equation, proof);
  }

  @Override
  public int hashCode() {
    return Objects.hash(equation, proof);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof CondEq
            && ((CondEq) o).equation.equals(equation)
            && ((CondEq) o).proof.equals(proof);
  }

  @Override
  public String toString() {
    return "(" + equation + ", " + proof + ")";
  }
}

// End CondEq.java
