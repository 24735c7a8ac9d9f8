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
package net.hydromatic.normcast.compile;

import static net.hydromatic.normcast.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.ast.Op;
import net.hydromatic.normcast.type.TypeSystem;

/** Implementations of {@link Discharger}. */
public abstract class Dischargers {
  private Dischargers() {}

  /** Returns a discharger that never succeeds. */
  public static Discharger none() {
    return sideCondition -> false;
  }

  /** Returns a discharger that succeeds if a predicate holds. */
  public static Discharger of(Predicate<Expr.Exp> predicate) {
    return predicate::test;
  }

  /**
   * Returns a discharger that succeeds if the side condition is one of the
   * given assumptions.
   *
   * <p>"{@code a >= b}" and "{@code b <= a}" are regarded as the same
   * assumption, as are "{@code a > b}" and "{@code b < a}".
   */
  public static Discharger assumptions(TypeSystem typeSystem,
      Iterable<? extends Expr.Exp> assumptions) {
    final ImmutableSet.Builder<Expr.Exp> b = ImmutableSet.builder();
    for (Expr.Exp assumption : assumptions) {
      b.add(canonize(typeSystem, assumption));
    }
    final ImmutableSet<Expr.Exp> set = b.build();
    return sideCondition -> set.contains(canonize(typeSystem, sideCondition));
  }

  /**
   * Returns a discharger that tries each of a list of dischargers in turn,
   * and succeeds if any of them succeeds.
   */
  public static Discharger or(Discharger... dischargers) {
    final List<Discharger> list = ImmutableList.copyOf(dischargers);
    return sideCondition -> {
      for (Discharger discharger : list) {
        if (discharger.attempt(sideCondition)) {
          return true;
        }
      }
      return false;
    };
  }

  /** Converts "{@code a >= b}" to "{@code b <= a}", and so forth. */
  private static Expr.Exp canonize(TypeSystem typeSystem, Expr.Exp e) {
    if (e.op == Op.APPLY) {
      final Expr.Apply apply = (Expr.Apply) e;
      if (apply.isCallTo(BuiltIn.GE) || apply.isCallTo(BuiltIn.GT)) {
        final List<Expr.Exp> args = apply.args();
        return expr.call(typeSystem,
            apply.isCallTo(BuiltIn.GE) ? BuiltIn.LE : BuiltIn.LT,
            args.get(1), args.get(0));
      }
    }
    return e;
  }
}

// End Dischargers.java
