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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.normcast.Tower;
import net.hydromatic.normcast.ast.Expr;
import org.junit.jupiter.api.Test;

/** Tests for {@link Classifier}. */
public class ClassifierTest {
  final Tower t = new Tower();
  final Classifier classifier = new Classifier(t.typeSystem);
  final Expr.Var a = t.var("a", t.natType);
  final Expr.Var b = t.var("b", t.natType);
  final Expr.Var p = t.var("p", t.intType);

  private Expr.Exp i(Expr.Exp e) {
    return t.coe(e, t.intType);
  }

  @Test
  void testCount() {
    final Expr.Exp e = t.coe(i(t.call(BuiltIn.PLUS, a, b)), t.ratType);
    assertThat(classifier.countHeadCoes(e), is(2));
    assertThat(classifier.countCoes(e), is(2));
    assertThat(classifier.countInternalCoes(e), is(0));

    final Expr.Exp sum = t.call(BuiltIn.PLUS, i(a), i(b));
    assertThat(classifier.countHeadCoes(sum), is(0));
    assertThat(classifier.countCoes(sum), is(2));
    assertThat(classifier.countInternalCoes(sum), is(2));

    final Expr.Exp mixed = t.coe(t.call(BuiltIn.PLUS, i(a), p), t.ratType);
    assertThat(classifier.countHeadCoes(mixed), is(1));
    assertThat(classifier.countCoes(mixed), is(2));
    assertThat(classifier.countInternalCoes(mixed), is(1));

    assertThat(classifier.countCoes(p), is(0));
    assertThat(classifier.countCoes(t.lit(3, t.ratType)), is(0));
  }

  /** Tests that coercions under binders are counted. */
  @Test
  void testCountUnderBinder() {
    final Expr.Exp lambda =
        expr.lambda(t.typeSystem, a, t.call(BuiltIn.PLUS, i(a), i(b)));
    assertThat(classifier.countCoes(lambda), is(2));
    assertThat(classifier.countHeadCoes(lambda), is(0));
  }

  @Test
  void testClassify() {
    // intOfNat (a + b) = intOfNat a + intOfNat b
    assertThat(
        classifier.classify(i(t.call(BuiltIn.PLUS, a, b)),
            t.call(BuiltIn.PLUS, i(a), i(b))),
        is(Label.MOVE));

    // intOfNat a < intOfNat b <-> a < b
    assertThat(
        classifier.classify(t.call(BuiltIn.LT, i(a), i(b)),
            t.call(BuiltIn.LT, a, b)),
        is(Label.ELIM));

    // intOfNat 0 = 0
    assertThat(
        classifier.classify(i(t.lit(0, t.natType)), t.lit(0, t.intType)),
        is(Label.SQUASH));

    // ratOfInt (intOfNat a) = ratOfNat a
    assertThat(
        classifier.classify(t.coe(i(a), t.ratType), t.coe(a, t.ratType)),
        is(Label.SQUASH));

    // intOfNat #n = #n
    assertThat(
        classifier.classify(i(expr.numVar("n", t.natType)),
            expr.numVar("n", t.intType)),
        is(Label.SQUASH));
  }

  @Test
  void testClassifyBadShape() {
    // a + b = b + a
    final RuleException e0 =
        assertThrows(RuleException.class,
            () -> classifier.classify(t.call(BuiltIn.PLUS, a, b),
                t.call(BuiltIn.PLUS, b, a)));
    assertThat(e0.kind, is(RuleException.Kind.BAD_SHAPE));
    assertThat(e0.ruleName, nullValue());
    assertThat(e0.getMessage(),
        containsString("lhs must contain at least one coe"));

    // intOfNat a + intOfNat b = intOfNat (a + b)
    final RuleException e1 =
        assertThrows(RuleException.class,
            () -> classifier.classify(t.call(BuiltIn.PLUS, i(a), i(b)),
                i(t.call(BuiltIn.PLUS, a, b))));
    assertThat(e1.getMessage(), containsString("rhs can't start with coe"));

    // ratOfInt (intOfNat a) = ratOfInt (intOfNat b)
    final RuleException e2 =
        assertThrows(RuleException.class,
            () -> classifier.classify(t.coe(i(a), t.ratType),
                t.coe(i(b), t.ratType)));
    assertThat(e2.getMessage(),
        containsString("no valid reduction in coercion count"));
  }

  /**
   * Tests that each standard rule is classified as declared, and that
   * classification does not change when the rules are registered again.
   */
  @Test
  void testStandardRules() {
    final RuleRegistry registry = t.registry();
    for (RuleDeclaration declaration
        : StandardRules.declarations(t.typeSystem)) {
      final RewriteRule rule = registry.rule(declaration.name);
      assertThat(declaration.name, rule == null, is(false));
      assertThat(declaration.name, classifier.classify(rule),
          is(declaration.label));
      assertThat(declaration.name, rule.overridden, is(false));
    }
    final NormalizationCache cache0 = registry.cache();
    final RuleRegistry registry2 = t.registry();
    final NormalizationCache cache1 = registry2.cache();
    assertThat(cache1.up.size(), is(cache0.up.size()));
    for (RewriteRule rule : registry.rules()) {
      final RewriteRule rule2 = registry2.rule(rule.name);
      assertThat(rule.name, rule2 == null ? null : rule2.label,
          is(rule.label));
    }
  }
}

// End ClassifierTest.java
