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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.normcast.Tower;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.proof.Certificate;
import net.hydromatic.normcast.proof.CertificateChecker;
import net.hydromatic.normcast.proof.Relation;
import org.junit.jupiter.api.Test;

/** Tests for {@link NormCast}. */
public class NormCastTest {
  final Tower t = new Tower();
  final NormalizationCache cache = t.cache();

  final Expr.Var a = t.var("a", t.natType);
  final Expr.Var b = t.var("b", t.natType);
  final Expr.Var c = t.var("c", t.natType);
  final Expr.Var p = t.var("p", t.intType);
  final Expr.Var q = t.var("q", t.intType);

  /** Normalizes an expression and checks the certificate. */
  private NormCast.Derivation derive(Expr.Exp e, Discharger discharger,
      Map<Prop, Object> propMap, Tracer tracer) {
    final NormCast.Derivation d =
        new NormCast(cache, discharger, propMap, tracer).derive(e);
    CertificateChecker.of(cache, discharger).check(d.certificate, e, d.exp);
    return d;
  }

  private NormCast.Derivation derive(Expr.Exp e) {
    return derive(e, Dischargers.none(), ImmutableMap.of(), Tracers.empty());
  }

  /** Tests "10 > ratOfInt p + ratOfInt q", where p and q are integers. */
  @Test
  void testSum() {
    final Expr.Exp e =
        t.call(BuiltIn.GT, t.lit(10, t.ratType),
            t.call(BuiltIn.PLUS, t.coe(p, t.ratType), t.coe(q, t.ratType)));
    assertThat(e, hasToString("10 > ratOfInt p + ratOfInt q"));
    final NormCast.Derivation d = derive(e);
    assertThat(d, hasToString("p + q < 10"));
    assertThat(((Expr.Apply) d.exp).arg.type, is(t.intType));
    assertThat(d.certificate.relation(), is(Relation.IFF));
    assertThat(d.certificate.ruleNames(),
        hasToString(containsString("gt_iff_lt")));

    // Normalizing again makes no progress
    final NoProgressException e2 =
        assertThrows(NoProgressException.class, () -> derive(d.exp));
    assertThat(e2.getMessage(), is("norm_cast failed to simplify p + q < 10"));
  }

  /** Tests a sum of naturals, coerced via the integers. */
  @Test
  void testSumOfNaturals() {
    final Expr.Exp e =
        t.call(BuiltIn.LT,
            t.coe(
                t.call(BuiltIn.PLUS, t.coe(a, t.intType), t.coe(b, t.intType)),
                t.ratType),
            t.lit(10, t.ratType));
    final NormCast.Derivation d = derive(e);
    assertThat(d, hasToString("a + b < 10"));
    assertThat(((Expr.Apply) d.exp).arg.type, is(t.natType));
  }

  @Test
  void testSquash() {
    final Expr.Exp e = t.coe(t.coe(a, t.intType), t.ratType);
    final NormCast.Derivation d = derive(e);
    assertThat(d, hasToString("ratOfNat a"));
    assertThat(d.certificate.relation(), is(Relation.EQ));
    assertThat(d.certificate.ruleNames(),
        hasToString("[ratOfInt.cast_intOfNat]"));
  }

  /** Tests that a coercion is inserted to compare with a numeral. */
  @Test
  void testNumeral() {
    final Expr.Exp e =
        t.call(BuiltIn.LT, t.coe(p, t.ratType), t.lit(1, t.ratType));
    assertThat(derive(e), hasToString("p < 1"));

    // Without numeral conversion, the literal 1 is handled by splitting
    final NormCast.Derivation d =
        derive(e, Dischargers.none(),
            ImmutableMap.<Prop, Object>of(Prop.NUMERALS, false),
            Tracers.empty());
    assertThat(d, hasToString("p < 1"));

    // Without splitting, nothing can be done
    assertThrows(NoProgressException.class, () ->
        derive(e, Dischargers.none(),
            ImmutableMap.<Prop, Object>of(Prop.NUMERALS, false, Prop.SPLIT,
                false),
            Tracers.empty()));
  }

  /** Tests a rule with a hypothesis, "b <= a -> intOfNat (a - b) = ...". */
  @Test
  void testSubtraction() {
    final Expr.Exp e =
        t.call(BuiltIn.MINUS, t.coe(a, t.intType), t.coe(b, t.intType));
    final List<String> failures = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnDischargeFailure(Tracers.empty(),
            (rule, sideCondition) -> failures.add(sideCondition.toString()));
    final NoProgressException e2 =
        assertThrows(NoProgressException.class, () ->
            derive(e, Dischargers.none(), ImmutableMap.of(), tracer));
    assertThat(e2.exp, is(e));
    assertThat(failures.isEmpty(), is(false));
    assertThat(failures.get(0), is("b <= a"));

    final Discharger discharger =
        Dischargers.assumptions(t.typeSystem,
            ImmutableList.of(t.call(BuiltIn.LE, b, a)));
    final NormCast.Derivation d =
        derive(e, discharger, ImmutableMap.of(), Tracers.empty());
    assertThat(d, hasToString("intOfNat (a - b)"));
  }

  @Test
  void testRelations() {
    final Expr.Exp ge =
        t.call(BuiltIn.GE, t.coe(a, t.intType), t.coe(b, t.intType));
    assertThat(derive(ge), hasToString("b <= a"));

    final Expr.Exp ne =
        t.call(BuiltIn.NE, t.coe(a, t.intType), t.coe(b, t.intType));
    assertThat(derive(ne), hasToString("not (a = b)"));
  }

  /** Tests that casts are moved under a binder. */
  @Test
  void testLambda() {
    final Expr.Var x = t.var("x", t.natType);
    final Expr.Exp e =
        expr.lambda(t.typeSystem, x,
            t.call(BuiltIn.PLUS, t.coe(x, t.intType), t.coe(x, t.intType)));
    assertThat(derive(e), hasToString("fn x : nat => intOfNat (x + x)"));
  }

  @Test
  void testLet() {
    final Expr.Var y = t.var("y", t.intType);
    final Expr.Exp e =
        expr.let(y,
            t.call(BuiltIn.PLUS, t.coe(a, t.intType), t.coe(b, t.intType)),
            t.call(BuiltIn.LT, y, t.coe(c, t.intType)));
    assertThat(derive(e),
        hasToString("let y = intOfNat (a + b) in y < intOfNat c"));
  }

  /** Tests that an expression without coercions makes no progress. */
  @Test
  void testNoProgress() {
    final Expr.Exp e = t.call(BuiltIn.PLUS, a, b);
    assertThrows(NoProgressException.class,
        () -> NormCast.derive(e, cache, Dischargers.none()));
  }

  /**
   * Tests that the step limit stops simplification with a warning. The
   * limit applies to each phase, and to each side of an equality proved
   * while inserting coercions.
   */
  @Test
  void testMaxSteps() {
    final Expr.Exp e =
        t.call(BuiltIn.GT, t.lit(10, t.ratType),
            t.call(BuiltIn.PLUS, t.coe(p, t.ratType), t.coe(q, t.ratType)));
    final List<String> warnings = new ArrayList<>();
    final List<Certificate> ups = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPhase(
            Tracers.withOnWarning(Tracers.empty(), warnings::add),
            NormCast.Phase.UP, ups::add);
    final NormCast.Derivation d =
        derive(e, Dischargers.none(),
            ImmutableMap.<Prop, Object>of(Prop.MAX_STEPS, 1), tracer);
    assertThat(d, hasToString("10 > ratOfInt (p + q)"));
    assertThat(ups, hasSize(1));
    assertThat(ups.get(0).ruleNames(), hasToString("[ratOfInt.cast_add]"));
    assertThat(warnings,
        hasToString("[maximum number of steps (1) exceeded while "
            + "simplifying ratOfInt (intOfNat 10), "
            + "maximum number of steps (1) exceeded while "
            + "simplifying ratOfNat 10 > ratOfInt p + ratOfInt q]"));
  }

  /**
   * Tests that the step limit holds however deep the expression is, and
   * that only one warning is traced.
   */
  @Test
  void testMaxStepsDeep() {
    final List<Expr.Exp> terms = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      terms.add(t.coe(t.var("p" + i, t.intType), t.ratType));
    }
    // ratOfInt p5 + (ratOfInt p4 + ... + (ratOfInt p1 + ratOfInt p0))
    Expr.Exp e = terms.get(0);
    for (int i = 1; i < 6; i++) {
      e = t.call(BuiltIn.PLUS, terms.get(i), e);
    }
    final List<String> warnings = new ArrayList<>();
    final List<Certificate> ups = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPhase(
            Tracers.withOnWarning(Tracers.empty(), warnings::add),
            NormCast.Phase.UP, ups::add);
    final NormCast.Derivation d =
        derive(e, Dischargers.none(),
            ImmutableMap.<Prop, Object>of(Prop.MAX_STEPS, 1), tracer);
    assertThat(ups.get(0).ruleNames(), hasToString("[ratOfInt.cast_add]"));
    assertThat(warnings, hasSize(1));

    // Only the innermost sum has moved
    Expr.Exp expected =
        t.coe(
            t.call(BuiltIn.PLUS, t.var("p1", t.intType),
                t.var("p0", t.intType)),
            t.ratType);
    for (int i = 2; i < 6; i++) {
      expected = t.call(BuiltIn.PLUS, terms.get(i), expected);
    }
    assertThat(d.exp, is(expected));

    // Without a tight limit, all of the casts move
    final NormCast.Derivation d2 = derive(e);
    assertThat(d2,
        hasToString("ratOfInt (p5 + (p4 + (p3 + (p2 + (p1 + p0)))))"));
  }

  /**
   * Tests that a chain of coercions is squashed, using fewer steps than
   * there are coercions.
   */
  @Test
  void testSquashChain() {
    final Expr.Exp e =
        t.coe(t.coe(t.coe(a, t.intType), t.ratType), t.realType);
    assertThat(e, hasToString("realOfRat (ratOfInt (intOfNat a))"));
    final int headCoes = new Classifier(t.typeSystem).countHeadCoes(e);
    assertThat(headCoes, is(3));
    final NormCast.Derivation d = derive(e);
    assertThat(d, hasToString("realOfNat a"));
    assertThat(d.certificate.ruleNames(),
        hasToString("[ratOfInt.cast_intOfNat, realOfRat.cast_ratOfNat]"));
    assertThat(d.certificate.ruleNames().size(),
        lessThanOrEqualTo(headCoes - 1));
  }

  /** Tests that normalizing a normalized expression makes no progress. */
  @Test
  void testIdempotent() {
    final Discharger discharger =
        Dischargers.assumptions(t.typeSystem,
            ImmutableList.of(t.call(BuiltIn.LE, b, a)));
    final List<Expr.Exp> list =
        ImmutableList.of(
            t.call(BuiltIn.GT, t.lit(10, t.ratType),
                t.call(BuiltIn.PLUS, t.coe(p, t.ratType),
                    t.coe(q, t.ratType))),
            t.call(BuiltIn.LT,
                t.coe(
                    t.call(BuiltIn.PLUS, t.coe(a, t.intType),
                        t.coe(b, t.intType)),
                    t.ratType),
                t.lit(10, t.ratType)),
            t.coe(t.coe(a, t.intType), t.ratType),
            t.coe(t.coe(t.coe(a, t.intType), t.ratType), t.realType),
            t.call(BuiltIn.LT, t.coe(p, t.ratType), t.lit(1, t.ratType)),
            t.call(BuiltIn.LT, t.coe(p, t.ratType),
                t.coe(t.call(BuiltIn.PLUS, a, b), t.ratType)),
            t.call(BuiltIn.MINUS, t.coe(a, t.intType), t.coe(b, t.intType)),
            t.call(BuiltIn.TIMES, t.coe(a, t.ratType), t.coe(b, t.ratType)),
            t.call(BuiltIn.GE, t.coe(a, t.intType), t.coe(b, t.intType)),
            t.call(BuiltIn.NE, t.coe(a, t.intType), t.coe(b, t.intType)));
    final List<String> results = new ArrayList<>();
    for (Expr.Exp e : list) {
      final NormCast.Derivation d =
          derive(e, discharger, ImmutableMap.of(), Tracers.empty());
      results.add(d.toString());
      final NoProgressException e2 =
          assertThrows(NoProgressException.class, () ->
              derive(d.exp, discharger, ImmutableMap.of(), Tracers.empty()));
      assertThat(e2.exp, is(d.exp));
    }
    assertThat(results,
        hasToString("[p + q < 10, a + b < 10, ratOfNat a, realOfNat a, "
            + "p < 1, p < intOfNat (a + b), intOfNat (a - b), "
            + "ratOfNat (a * b), b <= a, not (a = b)]"));
  }

  /**
   * Tests that rewrites and warnings while proving an inserted coercion are
   * reported to the same tracer as the rest of normalization.
   */
  @Test
  void testProofTracing() {
    final Expr.Exp e =
        t.call(BuiltIn.LT, t.coe(p, t.ratType),
            t.coe(t.call(BuiltIn.PLUS, a, b), t.ratType));
    final List<String> rules = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnRewrite(Tracers.empty(), rule -> rules.add(rule.name));
    final NormCast.Derivation d =
        derive(e, Dischargers.none(), ImmutableMap.of(), tracer);
    assertThat(d, hasToString("p < intOfNat (a + b)"));
    assertThat(rules.contains("ratOfNat.cast_add"), is(true));

    // With a tight limit, the proof is cut short, so nothing changes
    final List<String> warnings = new ArrayList<>();
    final List<String> failures = new ArrayList<>();
    final Tracer tracer2 =
        Tracers.withOnInsertionImpossible(
            Tracers.withOnWarning(Tracers.empty(), warnings::add),
            e3 -> failures.add(e3.toString()));
    assertThrows(NoProgressException.class, () ->
        derive(e, Dischargers.none(),
            ImmutableMap.<Prop, Object>of(Prop.MAX_STEPS, 1), tracer2));
    assertThat(warnings,
        hasToString("[maximum number of steps (1) exceeded while "
            + "simplifying ratOfInt (intOfNat (a + b))]"));
    assertThat(failures, hasToString("[ratOfInt p < ratOfNat (a + b)]"));
  }

  /** Tests that the tracer sees each phase. */
  @Test
  void testPhases() {
    final Expr.Exp e = t.coe(t.coe(a, t.intType), t.ratType);
    final List<Certificate> squashes = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPhase(Tracers.empty(), NormCast.Phase.SQUASH,
            squashes::add);
    derive(e, Dischargers.none(), ImmutableMap.of(), tracer);
    assertThat(squashes, hasSize(1));
    assertThat(squashes.get(0).lhs(), is(e));
    assertThat(squashes.get(0).rhs(), hasToString("ratOfNat a"));

    final StringWriter sw = new StringWriter();
    final PrintWriter pw = new PrintWriter(sw);
    derive(e, Dischargers.none(), ImmutableMap.of(), Tracers.printTracer(pw));
    pw.flush();
    assertThat(sw.toString(),
        containsString("SQUASH: ratOfInt (intOfNat a) ~> ratOfNat a"));
  }
}

// End NormCastTest.java
