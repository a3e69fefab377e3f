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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/** Builds terms. */
public enum TermBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  term;

  /** Variables with small indices, which occur very often. */
  private final Term.Var[] vars = new Term.Var[16];

  {
    for (int i = 0; i < vars.length; i++) {
      vars[i] = new Term.Var(i);
    }
  }

  /** Creates a reference to the variable with a given de Bruijn index. */
  public Term.Var var(int index) {
    checkArgument(index >= 0, "negative index %s", index);
    return index < vars.length ? vars[index] : new Term.Var(index);
  }

  /** Creates a constant. */
  public Term.Constant constant(String name) {
    return new Term.Constant(name);
  }

  /** Returns the type of propositions, "{@code Bool}". */
  public Term.Constant bool() {
    return BuiltIn.BOOL.constant;
  }

  /** Returns the literal "{@code true}". */
  public Term.Constant trueLiteral() {
    return BuiltIn.TRUE.constant;
  }

  /** Returns the literal "{@code false}". */
  public Term.Constant falseLiteral() {
    return BuiltIn.FALSE.constant;
  }

  /** Applies a function to arguments; returns the function if there are no
   * arguments. */
  public Term.Exp apply(Term.Exp fn, Term.Exp... args) {
    return apply(fn, Arrays.asList(args));
  }

  /** Applies a function to a list of arguments.
   *
   * <p>If the function is itself an application, its arguments come first;
   * for example, applying "{@code f a}" to "{@code b}" yields
   * "{@code f a b}". */
  public Term.Exp apply(Term.Exp fn, List<? extends Term.Exp> args) {
    if (args.isEmpty()) {
      return fn;
    }
    if (fn instanceof Term.Apply) {
      final Term.Apply apply = (Term.Apply) fn;
      return new Term.Apply(apply.fn,
          ImmutableList.<Term.Exp>builder().addAll(apply.args).addAll(args)
              .build());
    }
    return new Term.Apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates an equality "{@code lhs = rhs}" between terms of a given type. */
  public Term.Eq eq(Term.Exp type, Term.Exp lhs, Term.Exp rhs) {
    return new Term.Eq(type, lhs, rhs);
  }

  /** Creates an equality between two propositions. */
  public Term.Eq boolEq(Term.Exp lhs, Term.Exp rhs) {
    return eq(bool(), lhs, rhs);
  }

  /** Creates a negation. */
  public Term.Not not(Term.Exp arg) {
    return new Term.Not(arg);
  }

  /** Creates a conjunction. */
  public Term.And and(Term.Exp left, Term.Exp right) {
    return new Term.And(left, right);
  }

  /** Creates a universal quantifier, "{@code forall (name : domain), body}".
   * The body references the new variable as index 0. */
  public Term.Pi pi(String name, Term.Exp domain, Term.Exp body) {
    return new Term.Pi(name, domain, body);
  }

  /** Creates a function abstraction, "{@code fun (name : domain), body}". */
  public Term.Lambda lambda(String name, Term.Exp domain, Term.Exp body) {
    return new Term.Lambda(name, domain, body);
  }

  /** Creates a conditional, "{@code if condition then ifTrue else
   * ifFalse}". */
  public Term.If ifThenElse(Term.Exp type, Term.Exp condition,
      Term.Exp ifTrue, Term.Exp ifFalse) {
    return new Term.If(type, condition, ifTrue, ifFalse);
  }
}

// End TermBuilder.java
