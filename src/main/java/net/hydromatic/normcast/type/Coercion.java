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
package net.hydromatic.normcast.type;

import static java.util.Objects.requireNonNull;

import net.hydromatic.normcast.ast.Expr;

/**
 * Application of a coercion function to a value, as recognized by {@link
 * TypeSystem#coercionOf(Expr.Exp)}.
 *
 * <p>In "{@code intOfNat n}", {@link #exp} is the whole application, {@link
 * #arg} is "{@code n}", the source type is {@code nat} and the target type is
 * {@code int}.
 */
public class Coercion {
  public final Expr.Apply exp;
  public final Expr.Exp arg;

  Coercion(Expr.Apply exp) {
    this.exp = requireNonNull(exp);
    this.arg = exp.arg;
  }

  /** Returns the coercion function, applied to its implicit arguments. */
  public Expr.Exp fn() {
    return exp.fn;
  }

  public Type source() {
    return arg.type;
  }

  public Type target() {
    return exp.type;
  }

  @Override
  public String toString() {
    return exp + " : " + source() + " -> " + target();
  }
}

// End Coercion.java
