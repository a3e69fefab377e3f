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

import net.hydromatic.equate.ast.BuiltIn;
import net.hydromatic.equate.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment of declared constants and imported modules.
 *
 * <p>Every environment is read-only, and therefore may be shared by any number
 * of threads.
 *
 * <p>To create an environment, call {@link Environments#empty()} or {@link
 * Environments#builder()}.
 */
public abstract class Environment {
  /** Returns whether a module has been imported. Some transformations are
   * only available if the module that defines their axioms is present. */
  public abstract boolean imported(String module);

  /** Returns the declared type of a constant, or null if not declared. */
  public abstract Term.@Nullable Exp getType(String name);

  /**
   * Infers the type of a term in a given context, or returns null if the type
   * cannot be determined.
   *
   * <p>Inference assumes that the term is well-formed; it does not check the
   * types of arguments.
   */
  public Term.@Nullable Exp inferType(Term.Exp exp, Context context) {
    return new TypeInferrer(this).infer(exp, context);
  }

  /**
   * Returns whether a term is a proposition in a given context; that is,
   * whether its type is {@code Bool}.
   *
   * <p>A variable whose type is a proposition stands for a proof. Returns false
   * if the type of {@code type} cannot be determined.
   */
  public boolean isProposition(Term.Exp type, Context context) {
    return BuiltIn.BOOL.constant.equals(inferType(type, context));
  }
}

// End Environment.java
