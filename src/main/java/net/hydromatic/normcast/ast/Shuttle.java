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

import static java.util.Objects.requireNonNull;

import net.hydromatic.normcast.type.BaseType;
import net.hydromatic.normcast.type.TypeSystem;

/**
 * Visits and transforms expressions.
 *
 * <p>Each method returns the original node if nothing beneath it changed.
 */
public class Shuttle {
  protected final TypeSystem typeSystem;

  /** Creates a Shuttle. */
  public Shuttle(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  protected Expr.Exp visit(Expr.Var var) {
    return var; // leaf
  }

  protected Expr.Exp visit(Expr.Const constant) {
    return constant; // leaf
  }

  protected Expr.Exp visit(Expr.Literal literal) {
    return literal; // leaf
  }

  protected Expr.Exp visit(Expr.NumVar numVar) {
    return numVar; // leaf
  }

  protected Expr.Exp visit(Expr.Apply apply) {
    return apply.copy(apply.fn.accept(this), apply.arg.accept(this));
  }

  /**
   * Visits a variable at the point where it is bound, in a {@link
   * Expr.Binder} or {@link Expr.Let}. Returns the variable by default.
   */
  protected Expr.Var visitBound(Expr.Var var) {
    return var;
  }

  protected Expr.Exp visit(Expr.Binder binder) {
    final Expr.Var var = visitBound(binder.var);
    final Expr.Exp body = binder.body.accept(this);
    if (var.equals(binder.var)) {
      return binder.copy(body);
    }
    return binder.op == Op.LAMBDA
        ? new Expr.Binder(Op.LAMBDA, var, body,
            typeSystem.fnType(var.type, body.type))
        : new Expr.Binder(Op.PI, var, body, BaseType.PROP);
  }

  protected Expr.Exp visit(Expr.Let let) {
    final Expr.Var var = visitBound(let.var);
    final Expr.Exp value = let.value.accept(this);
    final Expr.Exp body = let.body.accept(this);
    if (var.equals(let.var)) {
      return let.copy(value, body);
    }
    return new Expr.Let(var, value, body);
  }
}

// End Shuttle.java
