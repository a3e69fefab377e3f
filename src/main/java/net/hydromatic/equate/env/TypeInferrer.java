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
package net.hydromatic.equate.env;

import static net.hydromatic.equate.ast.TermBuilder.term;

import net.hydromatic.equate.ast.BuiltIn;
import net.hydromatic.equate.ast.FreeVars;
import net.hydromatic.equate.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the types of terms.
 *
 * <p>Inference is best-effort: it trusts that the term is well-formed, and
 * returns null rather than throwing if it cannot find a type.
 */
class TypeInferrer {
  private final Environment env;

  TypeInferrer(Environment env) {
    this.env = env;
  }

  Term.@Nullable Exp infer(Term.Exp exp, Context context) {
    switch (exp.op) {
    case VAR:
      final Term.Var variable = (Term.Var) exp;
      return variable.index < context.size()
          ? context.typeOf(variable.index)
          : null;

    case CONSTANT:
      return env.getType(((Term.Constant) exp).name);

    case EQ:
    case NOT:
    case AND:
      return term.bool();

    case IF:
      return ((Term.If) exp).type;

    case PI:
      final Term.Pi pi = (Term.Pi) exp;
      final Term.@Nullable Exp bodyType =
          infer(pi.body, context.extend(pi.name, pi.domain));
      if (bodyType == null) {
        return null;
      }
      // A quantified proposition is a proposition; otherwise, a type.
      return bodyType.equals(term.bool())
          ? term.bool()
          : BuiltIn.TYPE.constant;

    case LAMBDA:
      final Term.Lambda lambda = (Term.Lambda) exp;
      final Term.@Nullable Exp resultType =
          infer(lambda.body, context.extend(lambda.name, lambda.domain));
      return resultType == null
          ? null
          : term.pi(lambda.name, lambda.domain, resultType);

    case APPLY:
      final Term.Apply apply = (Term.Apply) exp;
      Term.@Nullable Exp type = infer(apply.fn, context);
      for (Term.Exp arg : apply.args) {
        if (!(type instanceof Term.Pi)) {
          return null;
        }
        type = FreeVars.instantiate(((Term.Pi) type).body, arg);
      }
      return type;

    default:
      return null;
    }
  }
}

// End TypeInferrer.java
