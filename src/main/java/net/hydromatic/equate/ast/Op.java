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

/** Sub-types of {@link TermNode}. */
public enum Op {
  // atoms
  VAR(10),
  CONSTANT(10),

  APPLY(" ", 8),
  NOT("not ", 7),
  EQ(" = ", 4),
  AND(" /\\ ", 3),

  // constructs that extend as far to the right as possible
  IF(0),
  PI("forall ", 0),
  LAMBDA("fun ", 0);

  /** Text that separates the operands, or precedes the operand of a prefix
   * operator. */
  public final String padded;

  /** Precedence. A child whose precedence is lower than its context requires
   * is printed in parentheses. */
  public final int prec;

  Op(int prec) {
    this("", prec);
  }

  Op(String padded, int prec) {
    this.padded = padded;
    this.prec = prec;
  }
}

// End Op.java
