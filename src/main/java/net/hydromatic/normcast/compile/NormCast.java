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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.ast.Op;
import net.hydromatic.normcast.proof.Certificate;
import net.hydromatic.normcast.type.BaseType;
import net.hydromatic.normcast.type.Coercion;
import net.hydromatic.normcast.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Normalizes the coercions in an expression.
 *
 * <p>Normalization has four phases:
 *
 * <ol>
 *   <li>{@link Phase#NUMERALS_TO_COES}: each numeral of a type other than the
 *       numeral type becomes the coercion of a numeral, for example
 *       "{@code 10 : rat}" becomes "{@code ratOfNat 10}";
 *   <li>{@link Phase#UP}: bottom-up, coercions are moved towards the root
 *       and eliminated, inserting coercions where operands do not match;
 *   <li>{@link Phase#SQUASH}: chains of coercions are collapsed;
 *   <li>{@link Phase#COES_TO_NUMERALS}: coerced numerals become numerals
 *       again.
 * </ol>
 *
 * <p>For example, if {@code a} and {@code b} are integers, "{@code 10 >
 * ratOfInt a + ratOfInt b}" becomes "{@code a + b < 10}".
 */
public class NormCast {
  private final NormalizationCache cache;
  private final TypeSystem typeSystem;
  private final Discharger discharger;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;
  private final SplittingProcedure splittingProcedure;

  /** Creates a NormCast. */
  public NormCast(NormalizationCache cache, Discharger discharger,
      Map<Prop, Object> propMap, Tracer tracer) {
    this.cache = requireNonNull(cache);
    this.typeSystem = cache.typeSystem;
    this.discharger = requireNonNull(discharger);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
    this.splittingProcedure =
        new SplittingProcedure(typeSystem, this::proveEqUsingDown, tracer);
  }

  /**
   * Normalizes the coercions in an expression, with default properties and
   * no tracing.
   *
   * @throws NoProgressException if the expression does not change
   */
  public static Derivation derive(Expr.Exp exp, NormalizationCache cache,
      Discharger discharger) {
    return new NormCast(cache, discharger, ImmutableMap.of(), Tracers.empty())
        .derive(exp);
  }

  /**
   * Normalizes the coercions in an expression.
   *
   * @throws NoProgressException if the expression does not change
   */
  public Derivation derive(Expr.Exp exp) {
    final boolean numerals = Prop.NUMERALS.booleanValue(propMap);
    Certificate c = Certificate.refl(exp);
    if (numerals) {
      c = run(c, Phase.NUMERALS_TO_COES, this::numeralToCoe);
    }
    c = run(c, Phase.UP, this::upwardAndElim);
    c = run(c, Phase.SQUASH, e -> Simplifier.Step.visit(
        cache.squash.rewrite(typeSystem, e, discharger, tracer)));
    if (numerals) {
      c = run(c, Phase.COES_TO_NUMERALS, this::coeToNumeral);
    }
    if (c.rhs().equals(exp)) {
      throw new NoProgressException(exp);
    }
    return new Derivation(c.rhs(), c);
  }

  private Certificate run(Certificate c, Phase phase,
      Simplifier.Rewriter rewriter) {
    final Certificate c2 =
        new Simplifier(rewriter, propMap, tracer).simplify(c.rhs());
    tracer.onPhase(phase, c2);
    return Certificate.trans(c, c2);
  }

  /**
   * Rewrites a numeral such as "{@code 10 : rat}" to the coercion of a
   * numeral, "{@code ratOfNat (10 : nat)}".
   */
  private Simplifier.@Nullable Step numeralToCoe(Expr.Exp e) {
    final BaseType numeralType = typeSystem.numeralType();
    if (e.op != Op.LITERAL
        || numeralType == null
        || e.type.equals(numeralType)) {
      return null;
    }
    final Expr.Exp e2 =
        typeSystem.coerce(expr.literal(((Expr.Literal) e).value, numeralType),
            e.type);
    if (e2 == null) {
      return null;
    }
    return Simplifier.Step.done(proveEqUsingDown(e, e2));
  }

  /**
   * Rewrites a coerced numeral such as "{@code ratOfNat (10 : nat)}" to a
   * numeral, "{@code 10 : rat}".
   */
  private Simplifier.@Nullable Step coeToNumeral(Expr.Exp e) {
    final Coercion coercion = typeSystem.coercionOf(e);
    if (coercion == null
        || coercion.arg.op != Op.LITERAL
        || !coercion.source().equals(typeSystem.numeralType())) {
      return null;
    }
    final Expr.Exp e2 =
        expr.literal(((Expr.Literal) coercion.arg).value, coercion.target());
    return Simplifier.Step.done(proveEqUsingDown(e, e2));
  }

  /**
   * Rewrites an expression once using the {@code up} rules, then inserts
   * coercions if its operands do not match. If anything changed, the result
   * is simplified again.
   */
  private Simplifier.@Nullable Step upwardAndElim(Expr.Exp e) {
    final Certificate c =
        cache.up.rewrite(typeSystem, e, discharger, tracer);
    Certificate c2 = c == null ? Certificate.refl(e) : c;
    if (Prop.SPLIT.booleanValue(propMap)) {
      final Certificate c3 = splittingProcedure.split(c2.rhs());
      if (c3 != null) {
        c2 = Certificate.trans(c2, c3);
      }
    }
    return c2.isRefl() ? null : Simplifier.Step.visit(c2);
  }

  /**
   * Proves that two expressions are equal by simplifying both with the
   * {@code down} rules; returns null if the results differ.
   */
  @Nullable Certificate proveEqUsingDown(Expr.Exp a, Expr.Exp b) {
    final Simplifier.Rewriter rewriter = e -> Simplifier.Step.visit(
        cache.down.rewrite(typeSystem, e, discharger, tracer));
    final Certificate ca =
        new Simplifier(rewriter, propMap, tracer).simplify(a);
    final Certificate cb =
        new Simplifier(rewriter, propMap, tracer).simplify(b);
    if (!ca.rhs().equals(cb.rhs())) {
      return null;
    }
    return Certificate.trans(ca, Certificate.symm(cb));
  }

  /** Phase of normalization. */
  public enum Phase {
    NUMERALS_TO_COES,
    UP,
    SQUASH,
    COES_TO_NUMERALS
  }

  /**
   * Result of normalization: an expression, and a certificate that the
   * original expression equals it.
   */
  public static class Derivation {
    public final Expr.Exp exp;
    public final Certificate certificate;

    Derivation(Expr.Exp exp, Certificate certificate) {
      this.exp = requireNonNull(exp);
      this.certificate = requireNonNull(certificate);
    }

    @Override
    public String toString() {
      return exp.toString();
    }
  }
}

// End NormCast.java
