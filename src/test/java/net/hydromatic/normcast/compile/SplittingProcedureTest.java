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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.normcast.Tower;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.proof.Certificate;
import net.hydromatic.normcast.proof.CertificateChecker;
import net.hydromatic.normcast.type.BaseType;
import net.hydromatic.normcast.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link SplittingProcedure}. */
public class SplittingProcedureTest {
  final Tower t = new Tower();
  final NormalizationCache cache = t.cache();
  final List<String> splits = new ArrayList<>();
  final List<String> failures = new ArrayList<>();
  final Tracer tracer =
      Tracers.withOnInsertionImpossible(
          Tracers.withOnSplit(Tracers.empty(),
              (before, after) -> splits.add(before + " ~> " + after)),
          e -> failures.add(e.toString()));

  final Expr.Var p = t.var("p", t.intType);
  final Expr.Var q = t.var("q", t.intType);
  final Expr.Var n = t.var("n", t.natType);

  private SplittingProcedure splitter(NormalizationCache cache) {
    final NormCast normCast =
        new NormCast(cache, Dischargers.none(), ImmutableMap.of(), tracer);
    return new SplittingProcedure(cache.typeSystem,
        normCast::proveEqUsingDown, tracer);
  }

  /**
   * Splits an expression, checks the certificate, and returns the
   * result.
   */
  private Expr.Exp split(Expr.Exp e) {
    final Certificate c = splitter(cache).split(e);
    assertThat(c, notNullValue());
    CertificateChecker.of(cache, Dischargers.none()).check(c, e, c.rhs());
    return c.rhs();
  }

  /**
   * Tests the case where the second operand is coerced via the source type
   * of the first.
   */
  @Test
  void testSplitSecond() {
    final Expr.Exp e =
        t.call(BuiltIn.LT, t.coe(p, t.ratType), t.coe(n, t.ratType));
    assertThat(split(e), hasToString("ratOfInt p < ratOfInt (intOfNat n)"));
    assertThat(splits,
        hasToString("[ratOfInt p < ratOfNat n ~> "
            + "ratOfInt p < ratOfInt (intOfNat n)]"));
    assertThat(failures, hasSize(0));
  }

  @Test
  void testSplitFirst() {
    final Expr.Exp e =
        t.call(BuiltIn.LT, t.coe(n, t.ratType), t.coe(p, t.ratType));
    assertThat(split(e), hasToString("ratOfInt (intOfNat n) < ratOfInt p"));
  }

  /**
   * Tests that the literals 1 and 0 are coerced from the type of the other
   * operand.
   */
  @Test
  void testSplitLiteral() {
    final Expr.Exp e =
        t.call(BuiltIn.LT, t.coe(p, t.ratType), t.lit(1, t.ratType));
    assertThat(split(e), hasToString("ratOfInt p < ratOfInt 1"));

    final Expr.Exp e2 =
        t.call(BuiltIn.LT, t.lit(0, t.ratType), t.coe(p, t.ratType));
    assertThat(split(e2), hasToString("ratOfInt 0 < ratOfInt p"));
    assertThat(splits, hasSize(2));
  }

  /** Tests expressions that are left alone. */
  @Test
  void testNoSplit() {
    final SplittingProcedure splitter = splitter(cache);

    // Other literals
    assertThat(
        splitter.split(
            t.call(BuiltIn.LT, t.coe(p, t.ratType), t.lit(2, t.ratType))),
        nullValue());

    // Coercions from the same type
    assertThat(
        splitter.split(
            t.call(BuiltIn.PLUS, t.coe(p, t.ratType), t.coe(q, t.ratType))),
        nullValue());

    // Not a binary operation
    assertThat(splitter.split(t.coe(p, t.ratType)), nullValue());
    assertThat(splitter.split(t.call(BuiltIn.NEGATE, p)), nullValue());
    assertThat(splitter.split(p), nullValue());

    assertThat(splits, hasSize(0));
    assertThat(failures, hasSize(0));
  }

  /**
   * Tests that the tracer is told when neither operand can be coerced to
   * the source of the other.
   */
  @Test
  void testInsertionImpossible() {
    final TypeSystem typeSystem = new TypeSystem();
    final BaseType a = typeSystem.baseType("a");
    final BaseType b = typeSystem.baseType("b");
    final BaseType c = typeSystem.baseType("c");
    typeSystem.coercion("aToC", a, c);
    typeSystem.coercion("bToC", b, c);
    final NormalizationCache emptyCache =
        NormalizationCache.build(typeSystem, ImmutableList.of(), 0,
            Tracers.empty());
    final Expr.Exp x =
        typeSystem.coerce(expr.var("x", a), c);
    final Expr.Exp y =
        typeSystem.coerce(expr.var("y", b), c);
    assertThat(x, notNullValue());
    assertThat(y, notNullValue());
    final Expr.Exp e = expr.call(typeSystem, BuiltIn.LT, x, y);
    assertThat(splitter(emptyCache).split(e), nullValue());
    assertThat(failures, hasToString("[aToC x < bToC y]"));
    assertThat(splits.isEmpty(), is(true));
  }
}

// End SplittingProcedureTest.java
