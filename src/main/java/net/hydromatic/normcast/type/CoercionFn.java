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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.normcast.ast.ExprBuilder.expr;

import net.hydromatic.normcast.ast.Expr;

/**
 * Function that embeds values of a source type into a target type, as
 * registered in a {@link TypeSystem}.
 *
 * <p>{@link #fn} is the function partially applied to its implicit arguments
 * (often none), so that {@code fn x} is the coercion of {@code x}.
 */
public class CoercionFn {
  public final String name;
  public final Expr.Exp fn;
  public final BaseType source;
  public final BaseType target;
  /** Number of implicit arguments that precede the coerced value. */
  public final int implicitArgCount;

  CoercionFn(String name, Expr.Exp fn, BaseType source, BaseType target,
      int implicitArgCount) {
    this.name = requireNonNull(name);
    this.fn = requireNonNull(fn);
    this.source = requireNonNull(source);
    this.target = requireNonNull(target);
    this.implicitArgCount = implicitArgCount;
    checkArgument(!source.equals(target), "coercion to same type: %s", name);
  }

  /** Applies this coercion to a value of its source type. */
  public Expr.Apply apply(Expr.Exp arg) {
    checkArgument(arg.type.equals(source),
        "%s expects %s, got %s", name, source, arg.type);
    return expr.apply(fn, arg);
  }

  @Override
  public String toString() {
    return name + ": " + source + " -> " + target;
  }
}

// End CoercionFn.java
