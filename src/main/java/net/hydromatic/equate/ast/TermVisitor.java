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

import java.util.function.ObjIntConsumer;

/**
 * Visits terms.
 *
 * <p>Keeps track of {@link #offset}, the number of binders that have been
 * entered since the traversal started. A binder's domain is visited at the
 * binder's own offset, and its body at one more. A variable whose index is
 * at least {@code offset} is free in the term where the traversal started.
 */
public class TermVisitor {
  /** Number of binders entered since the traversal started. */
  protected int offset;

  /**
   * Calls a consumer for each sub-term of a term, including the term itself,
   * in pre-order, with the number of binders that enclose that sub-term
   * within {@code exp}.
   */
  public static void forEach(Term.Exp exp,
      ObjIntConsumer<Term.Exp> consumer) {
    final TermVisitor visitor =
        new TermVisitor() {
          @Override
          protected void enter(Term.Exp e) {
            consumer.accept(e, offset);
          }
        };
    visitor.accept(exp);
  }

  /** Visits a term. Also for use as a method reference. */
  public void accept(Term.Exp exp) {
    enter(exp);
    exp.accept(this);
  }

  /** Called on each term before it is visited. */
  protected void enter(Term.Exp exp) {}

  protected void visit(Term.Var var) {}

  protected void visit(Term.Constant constant) {}

  protected void visit(Term.Apply apply) {
    accept(apply.fn);
    apply.args.forEach(this::accept);
  }

  protected void visit(Term.Eq eq) {
    accept(eq.type);
    accept(eq.lhs);
    accept(eq.rhs);
  }

  protected void visit(Term.Not not) {
    accept(not.arg);
  }

  protected void visit(Term.And and) {
    accept(and.left);
    accept(and.right);
  }

  protected void visit(Term.Pi pi) {
    visitBinder(pi);
  }

  protected void visit(Term.Lambda lambda) {
    visitBinder(lambda);
  }

  protected void visit(Term.If anIf) {
    accept(anIf.type);
    accept(anIf.condition);
    accept(anIf.ifTrue);
    accept(anIf.ifFalse);
  }

  /** Visits the domain of a binder, then its body one level deeper. */
  protected void visitBinder(Term.Binder binder) {
    accept(binder.domain);
    ++offset;
    try {
      accept(binder.body);
    } finally {
      --offset;
    }
  }
}

// End TermVisitor.java
