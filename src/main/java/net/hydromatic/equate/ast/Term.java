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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.equate.ast.TermBuilder.term;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Terms.
 *
 * <p>Formulas and proofs are both terms; a proof is a term whose type is the
 * proposition that it proves. This class functions as a namespace, so that we
 * can keep the class names short.
 *
 * <p>Variables are de Bruijn indices. Every term is immutable; to create a
 * term, use {@link TermBuilder#term}.
 */
public class Term {
  private Term() {}

  /** Abstract base class of term expressions. */
  public abstract static class Exp extends TermNode {
    Exp(Op op) {
      super(op);
    }

    /**
     * Accepts a shuttle, calling the {@link TermShuttle#visit} method
     * appropriate to the type of this node, and returning the result.
     */
    public abstract Exp accept(TermShuttle shuttle);

    /**
     * Accepts a visitor, calling the {@link TermVisitor#visit} method
     * appropriate to the type of this node.
     */
    public abstract void accept(TermVisitor visitor);
  }

  /**
   * Reference to a bound or free variable.
   *
   * <p>{@code index} counts enclosing binders from the innermost outwards. At a
   * point enclosed by {@code n} binders, an index of {@code n} or more denotes
   * a free variable.
   */
  public static class Var extends Exp {
    public final int index;

    Var(int index) {
      super(Op.VAR);
      checkArgument(index >= 0, "negative index %s", index);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return index + 5501;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).index == index;
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      return w.var(index);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** Named constant, such as a declared function, type or axiom. */
  public static class Constant extends Exp {
    public final String name;

    Constant(String name) {
      super(Op.CONSTANT);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant && ((Constant) o).name.equals(name);
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      return w.append(name);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Application of a function to one or more arguments.
   *
   * <p>The function is never itself an {@code Apply}; {@link
   * TermBuilder#apply} flattens nested applications.
   */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Exp fn, ImmutableList<Exp> args) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      checkArgument(fn.op != Op.APPLY, "nested apply");
      checkArgument(!args.isEmpty(), "no arguments");
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && ((Apply) o).fn.equals(fn)
              && ((Apply) o).args.equals(args);
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      w.append(fn, op.prec);
      for (Exp arg : args) {
        w.append(op.padded).append(arg, op.prec + 1);
      }
      return w;
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Apply} with given components, or returns
     * this {@code Apply} if the components are the same.
     */
    public Exp copy(Exp fn, List<Exp> args) {
      if (fn == this.fn && sameElements(args, this.args)) {
        return this;
      }
      return term.apply(fn, args);
    }
  }

  /** Equality between two terms of a given type. */
  public static class Eq extends Exp {
    public final Exp type;
    public final Exp lhs;
    public final Exp rhs;

    Eq(Exp type, Exp lhs, Exp rhs) {
      super(Op.EQ);
      this.type = requireNonNull(type);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Eq
              && ((Eq) o).type.equals(type)
              && ((Eq) o).lhs.equals(lhs)
              && ((Eq) o).rhs.equals(rhs);
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      return w.append(lhs, op.prec + 1)
          .append(op.padded)
          .append(rhs, op.prec + 1);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }

    public Eq copy(Exp type, Exp lhs, Exp rhs) {
      return type == this.type && lhs == this.lhs && rhs == this.rhs
          ? this
          : term.eq(type, lhs, rhs);
    }
  }

  /** Negation. */
  public static class Not extends Exp {
    public final Exp arg;

    Not(Exp arg) {
      super(Op.NOT);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return arg.hashCode() * 31 + 7;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Not && ((Not) o).arg.equals(arg);
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      return w.append(op.padded).append(arg, Op.APPLY.prec + 1);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }

    public Not copy(Exp arg) {
      return arg == this.arg ? this : term.not(arg);
    }
  }

  /** Conjunction. */
  public static class And extends Exp {
    public final Exp left;
    public final Exp right;

    And(Exp left, Exp right) {
      super(Op.AND);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof And
              && ((And) o).left.equals(left)
              && ((And) o).right.equals(right);
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      return w.append(left, op.prec + 1)
          .append(op.padded)
          .append(right, op.prec + 1);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }

    public And copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : term.and(left, right);
    }
  }

  /**
   * Abstract base class of terms that bind a variable ({@link Pi} and {@link
   * Lambda}).
   *
   * <p>The body is in a context extended by one variable, of type {@code
   * domain}, that the body references as index 0.
   *
   * <p>The name is only for printing. Two binders that differ only in their
   * names are equal.
   */
  public abstract static class Binder extends Exp {
    public final String name;
    public final Exp domain;
    public final Exp body;

    Binder(Op op, String name, Exp domain, Exp body) {
      super(op);
      this.name = requireNonNull(name, "name");
      this.domain = requireNonNull(domain);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, domain, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binder
              && ((Binder) o).op == op
              && ((Binder) o).domain.equals(domain)
              && ((Binder) o).body.equals(body);
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      w.append(op.padded)
          .append("(")
          .append(name)
          .append(" : ")
          .append(domain, 0)
          .append("), ");
      return w.binder(name, () -> w.append(body, 0));
    }

    /**
     * Creates a copy of this binder with given components, or returns this
     * binder if the components are the same.
     */
    public abstract Binder copy(Exp domain, Exp body);
  }

  /** Universal quantifier (dependent product), "forall (x : D), body". */
  public static class Pi extends Binder {
    Pi(String name, Exp domain, Exp body) {
      super(Op.PI, name, domain, body);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Pi copy(Exp domain, Exp body) {
      return domain == this.domain && body == this.body
          ? this
          : term.pi(name, domain, body);
    }
  }

  /** Function abstraction, "fun (x : D), body". */
  public static class Lambda extends Binder {
    Lambda(String name, Exp domain, Exp body) {
      super(Op.LAMBDA, name, domain, body);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Lambda copy(Exp domain, Exp body) {
      return domain == this.domain && body == this.body
          ? this
          : term.lambda(name, domain, body);
    }
  }

  /** Conditional, "if c then a else b", whose branches have a given type. */
  public static class If extends Exp {
    public final Exp type;
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp type, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF);
      this.type = requireNonNull(type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof If
              && ((If) o).type.equals(type)
              && ((If) o).condition.equals(condition)
              && ((If) o).ifTrue.equals(ifTrue)
              && ((If) o).ifFalse.equals(ifFalse);
    }

    @Override
    TermWriter unparse(TermWriter w, int prec) {
      return w.append("if ")
          .append(condition, 0)
          .append(" then ")
          .append(ifTrue, 0)
          .append(" else ")
          .append(ifFalse, 0);
    }

    @Override
    public Exp accept(TermShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(TermVisitor visitor) {
      visitor.visit(this);
    }

    public If copy(Exp type, Exp condition, Exp ifTrue, Exp ifFalse) {
      return type == this.type
              && condition == this.condition
              && ifTrue == this.ifTrue
              && ifFalse == this.ifFalse
          ? this
          : term.ifThenElse(type, condition, ifTrue, ifFalse);
    }
  }

  /** Returns whether two lists contain the same instances. */
  private static <E> boolean sameElements(List<E> list0, List<E> list1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }
}

// End Term.java
