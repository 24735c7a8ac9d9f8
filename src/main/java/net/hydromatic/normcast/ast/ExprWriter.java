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
package net.hydromatic.normcast.ast;

import net.hydromatic.normcast.compile.BuiltIn;

/** Context for writing an expression out as a string. */
public class ExprWriter {
  /** Left precedence of function application. */
  static final int APPLY_LEFT = 16;
  /** Right precedence of function application. */
  static final int APPLY_RIGHT = 17;

  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression, in a context of given precedence. */
  public ExprWriter append(Expr.Exp e, int left, int right) {
    return e.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public ExprWriter infix(int left, Expr.Exp a0, BuiltIn op, Expr.Exp a1,
      int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(" ").append(op.opName).append(" ");
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends the application of a function to an argument. */
  public ExprWriter apply(int left, Expr.Exp fn, Expr.Exp arg, int right) {
    if (left > APPLY_LEFT || APPLY_RIGHT < right) {
      return append("(").apply(0, fn, arg, 0).append(")");
    }
    fn.unparse(this, left, APPLY_LEFT);
    append(" ");
    arg.unparse(this, APPLY_RIGHT, right);
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End ExprWriter.java
