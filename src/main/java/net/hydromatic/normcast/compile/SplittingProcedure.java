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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.normcast.ast.ExprBuilder.expr;

import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.ast.Op;
import net.hydromatic.normcast.proof.Certificate;
import net.hydromatic.normcast.type.Coercion;
import net.hydromatic.normcast.type.Type;
import net.hydromatic.normcast.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Inserts coercions into a binary operation "{@code op x y}" so that both
 * operands are coerced from the same type, and an elim rule can then remove
 * the coercions.
 *
 * <p>For example, given "{@code ratOfInt p < ratOfNat n}" there is no rule
 * that relates the operands directly, but "{@code ratOfNat n}" equals
 * "{@code ratOfInt (intOfNat n)}", and after that rewrite the rule
 * "{@code ratOfInt a < ratOfInt b <-> a < b}" applies.
 *
 * <p>The cases are:
 *
 * <ol>
 *   <li>Both operands are coercions, from different types &alpha; and
 *       &beta;, to the same type. If there is a coercion from &alpha; to
 *       &beta;, the first operand is coerced via &beta;; otherwise, if there
 *       is a coercion from &beta; to &alpha;, the second operand is coerced
 *       via &alpha;.
 *   <li>One operand is a coercion from &alpha;, and the other is the literal
 *       1, and &alpha; has a 1. The literal is replaced by the coercion of
 *       1 in &alpha;.
 *   <li>As 2, but for 0.
 * </ol>
 *
 * <p>Each replacement is proved by simplifying both sides with the
 * {@code down} rules.
 */
class SplittingProcedure {
  private final TypeSystem typeSystem;
  private final Prover prover;
  private final Tracer tracer;

  SplittingProcedure(TypeSystem typeSystem, Prover prover, Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.prover = requireNonNull(prover);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Inserts coercions into an expression, if it is a binary operation whose
   * operands have mismatched coercions.
   *
   * @return Certificate that the expression equals the rewritten expression,
   * or null if the expression is not changed
   */
  @Nullable Certificate split(Expr.Exp e) {
    if (e.op != Op.APPLY
        || ((Expr.Apply) e).fn.op != Op.APPLY
        || typeSystem.isCoercion(e)) {
      return null;
    }
    final Expr.Apply apply = (Expr.Apply) e;
    final Expr.Exp op = ((Expr.Apply) apply.fn).fn;
    final Expr.Exp x = ((Expr.Apply) apply.fn).arg;
    final Expr.Exp y = apply.arg;
    final Coercion cx = typeSystem.coercionOf(x);
    final Coercion cy = typeSystem.coercionOf(y);
    final @Nullable Certificate c;
    if (cx != null && cy != null) {
      if (cx.source().equals(cy.source())
          || !cx.target().equals(cy.target())) {
        return null;
      }
      c = splitCoercions(op, x, cx, y, cy);
    } else if (cx != null && y.op == Op.LITERAL) {
      final Expr.Exp y2 = coerceLiteral((Expr.Literal) y, cx.source());
      if (y2 == null) {
        return null;
      }
      c = secondArg(op, x, prover.proveEq(y, y2));
    } else if (cy != null && x.op == Op.LITERAL) {
      final Expr.Exp x2 = coerceLiteral((Expr.Literal) x, cy.source());
      if (x2 == null) {
        return null;
      }
      c = firstArg(op, prover.proveEq(x, x2), y);
    } else {
      return null;
    }
    if (c == null) {
      tracer.onInsertionImpossible(e);
      return null;
    }
    tracer.onSplit(e, c.rhs());
    return c;
  }

  /** Handles the case where both operands are coercions. */
  private @Nullable Certificate splitCoercions(Expr.Exp op, Expr.Exp x,
      Coercion cx, Expr.Exp y, Coercion cy) {
    final Expr.Exp x2 = coerceVia(cx.arg, cy.source(), cx.target());
    if (x2 != null) {
      return firstArg(op, prover.proveEq(x, x2), y);
    }
    final Expr.Exp y2 = coerceVia(cy.arg, cx.source(), cy.target());
    if (y2 != null) {
      return secondArg(op, x, prover.proveEq(y, y2));
    }
    return null;
  }

  /**
   * Coerces an expression to {@code target} via {@code via}, or returns null
   * if either coercion does not exist.
   */
  private Expr.@Nullable Exp coerceVia(Expr.Exp e, Type via, Type target) {
    final Expr.Exp e2 = typeSystem.coerce(e, via);
    return e2 == null ? null : typeSystem.coerce(e2, target);
  }

  /**
   * If a literal is 0 or 1, returns the coercion of the same literal in
   * another type, provided that the other type has that literal.
   */
  private Expr.@Nullable Exp coerceLiteral(Expr.Literal literal, Type type) {
    if (literal.is(1) && typeSystem.hasOne(type)
        || literal.is(0) && typeSystem.hasZero(type)) {
      return typeSystem.coerce(expr.literal(literal.value, type),
          literal.type);
    }
    return null;
  }

  /** Given that {@code x = x2}, proves {@code op x y = op x2 y}. */
  private static @Nullable Certificate firstArg(Expr.Exp op,
      @Nullable Certificate c, Expr.Exp y) {
    return c == null
        ? null
        : Certificate.congFun(Certificate.congArg(op, c), y);
  }

  /** Given that {@code y = y2}, proves {@code op x y = op x y2}. */
  private static @Nullable Certificate secondArg(Expr.Exp op, Expr.Exp x,
      @Nullable Certificate c) {
    return c == null ? null : Certificate.congArg(expr.apply(op, x), c);
  }

  /** Proves that two expressions are equal, or returns null. */
  @FunctionalInterface
  interface Prover {
    @Nullable Certificate proveEq(Expr.Exp a, Expr.Exp b);
  }
}

// End SplittingProcedure.java
