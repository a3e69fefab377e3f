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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms terms.
 *
 * <p>Like {@link TermVisitor}, keeps track of {@link #offset}, the number of
 * binders entered since the traversal started. If a sub-term is not changed,
 * the same instance is returned, so a shuttle that changes nothing returns
 * its input.
 */
public class TermShuttle {
  /** Number of binders entered since the traversal started. */
  protected int offset;

  protected List<Term.Exp> visitList(List<Term.Exp> exps) {
    final List<Term.Exp> list = new ArrayList<>();
    for (Term.Exp exp : exps) {
      list.add(exp.accept(this));
    }
    return list;
  }

  protected Term.Exp visit(Term.Var var) {
    return var; // leaf
  }

  protected Term.Exp visit(Term.Constant constant) {
    return constant; // leaf
  }

  protected Term.Exp visit(Term.Apply apply) {
    return apply.copy(apply.fn.accept(this), visitList(apply.args));
  }

  protected Term.Exp visit(Term.Eq eq) {
    return eq.copy(eq.type.accept(this), eq.lhs.accept(this),
        eq.rhs.accept(this));
  }

  protected Term.Exp visit(Term.Not not) {
    return not.copy(not.arg.accept(this));
  }

  protected Term.Exp visit(Term.And and) {
    return and.copy(and.left.accept(this), and.right.accept(this));
  }

  protected Term.Exp visit(Term.Pi pi) {
    return pi.copy(pi.domain.accept(this), visitBody(pi.body));
  }

  protected Term.Exp visit(Term.Lambda lambda) {
    return lambda.copy(lambda.domain.accept(this), visitBody(lambda.body));
  }

  protected Term.Exp visit(Term.If anIf) {
    return anIf.copy(anIf.type.accept(this), anIf.condition.accept(this),
        anIf.ifTrue.accept(this), anIf.ifFalse.accept(this));
  }

  /** Visits the body of a binder, one level deeper. */
  protected Term.Exp visitBody(Term.Exp body) {
    ++offset;
    try {
      return body.accept(this);
    } finally {
      --offset;
    }
  }
}

// End TermShuttle.java
