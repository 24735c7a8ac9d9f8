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
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.normcast.Tower;
import net.hydromatic.normcast.ast.Expr;
import org.junit.jupiter.api.Test;

/** Tests for {@link RuleRegistry}. */
public class RuleRegistryTest {
  final Tower t = new Tower();
  final Expr.Var a = t.var("a", t.natType);
  final Expr.Var b = t.var("b", t.natType);

  /** "forall a b, intOfNat (a + b) = intOfNat a + intOfNat b". */
  private Expr.Exp castAdd() {
    return expr.forall(ImmutableList.of(a, b),
        expr.eq(t.typeSystem,
            t.coe(t.call(BuiltIn.PLUS, a, b), t.intType),
            t.call(BuiltIn.PLUS, t.coe(a, t.intType), t.coe(b, t.intType))));
  }

  /** "forall a b, a + b = b + a". */
  private Expr.Exp comm() {
    return expr.forall(ImmutableList.of(a, b),
        expr.eq(t.typeSystem, t.call(BuiltIn.PLUS, a, b),
            t.call(BuiltIn.PLUS, b, a)));
  }

  @Test
  void testRegister() {
    final RuleRegistry registry = new RuleRegistry(t.typeSystem);
    assertThat(registry.version(), is(0));
    final RewriteRule rule = registry.register("cast_add", castAdd(), null);
    assertThat(rule.label, is(Label.MOVE));
    assertThat(rule.overridden, is(false));
    assertThat(rule.params, hasToString("[a, b]"));
    assertThat(rule.hypotheses, hasSize(0));
    assertThat(rule.lhs, hasToString("intOfNat (a + b)"));
    assertThat(rule.rhs, hasToString("intOfNat a + intOfNat b"));
    assertThat(rule,
        hasToString("cast_add [MOVE]: forall a : nat, forall b : nat, "
            + "intOfNat (a + b) = intOfNat a + intOfNat b"));
    assertThat(registry.version(), is(1));
    assertThat(registry.rules(), hasSize(1));

    // Registering the same rule again changes nothing
    assertThat(registry.register("cast_add", castAdd(), null),
        sameInstance(rule));
    assertThat(registry.version(), is(1));
  }

  /** Tests that the cache is rebuilt only when the rules change. */
  @Test
  void testCacheLifecycle() {
    final RuleRegistry registry = new RuleRegistry(t.typeSystem);
    final NormalizationCache cache0 = registry.cache();
    assertThat(cache0.version, is(0));
    assertThat(registry.cache(), sameInstance(cache0));

    registry.register("cast_add", castAdd(), null);
    final NormalizationCache cache1 = registry.cache();
    assertThat(cache1, not(sameInstance(cache0)));
    assertThat(cache1.version, is(1));
    assertThat(cache1.down.contains("cast_add"), is(true));
    assertThat(cache0.down.contains("cast_add"), is(false));
    assertThat(registry.cache(), sameInstance(cache1));
  }

  @Test
  void testBadShape() {
    final List<String> errors = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnRegistrationError(Tracers.empty(),
            (name, e) -> errors.add(name + ": " + e.getMessage()));
    final RuleRegistry registry =
        new RuleRegistry(t.typeSystem, ImmutableMap.of(), tracer);
    final RuleException e =
        assertThrows(RuleException.class,
            () -> registry.register("add_comm", comm(), null));
    assertThat(e.kind, is(RuleException.Kind.BAD_SHAPE));
    assertThat(e.ruleName, is("add_comm"));
    assertThat(registry.rules(), hasSize(0));
    assertThat(registry.version(), is(0));
    assertThat(errors,
        hasToString("[add_comm: norm_cast: badly shaped lemma, "
            + "lhs must contain at least one coe]"));

    // A conclusion that is not an equation
    final RuleException e2 =
        assertThrows(RuleException.class,
            () -> registry.register("lt",
                expr.forall(a, t.call(BuiltIn.LT, a, t.lit(1, t.natType))),
                Label.ELIM));
    assertThat(e2.kind, is(RuleException.Kind.BAD_SHAPE));
    assertThat(e2.getMessage(),
        containsString("conclusion must be an equation or an equivalence"));
  }

  /** Tests that a declared label is accepted even if the shape is bad. */
  @Test
  void testOverrideBadShape() {
    final RuleRegistry registry = new RuleRegistry(t.typeSystem);
    final RewriteRule rule = registry.register("add_comm", comm(), Label.ELIM);
    assertThat(rule.label, is(Label.ELIM));
    assertThat(rule.overridden, is(true));
  }

  /** Tests a declared label that conflicts with the shape; lenient mode. */
  @Test
  void testOverrideConflictLenient() {
    final List<String> warnings = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnWarning(Tracers.empty(), warnings::add);
    final RuleRegistry registry =
        new RuleRegistry(t.typeSystem, ImmutableMap.of(), tracer);
    final RewriteRule rule =
        registry.register("cast_add", castAdd(), Label.SQUASH);
    assertThat(rule.label, is(Label.SQUASH));
    assertThat(rule.overridden, is(true));
    assertThat(warnings,
        hasToString("[rule cast_add is declared SQUASH but its shape is "
            + "MOVE]"));
  }

  /** Tests a declared label that conflicts with the shape; strict mode. */
  @Test
  void testOverrideConflictStrict() {
    final RuleRegistry registry =
        new RuleRegistry(t.typeSystem,
            ImmutableMap.<Prop, Object>of(Prop.STRICT_OVERRIDES, true),
            Tracers.empty());
    final RuleException e =
        assertThrows(RuleException.class,
            () -> registry.register("cast_add", castAdd(), Label.SQUASH));
    assertThat(e.kind, is(RuleException.Kind.CONFLICTING_LABEL));
    assertThat(registry.rules(), hasSize(0));

    // A declared label that agrees is fine
    final RewriteRule rule =
        registry.register("cast_add", castAdd(), Label.MOVE);
    assertThat(rule.overridden, is(false));
  }

  /** Tests that a name cannot be registered again with another label. */
  @Test
  void testReRegisterConflict() {
    final RuleRegistry registry = new RuleRegistry(t.typeSystem);
    registry.register("cast_add", castAdd(), null);
    final RuleException e =
        assertThrows(RuleException.class,
            () -> registry.register("cast_add", castAdd(), Label.ELIM));
    assertThat(e.kind, is(RuleException.Kind.CONFLICTING_LABEL));
    assertThat(registry.rule("cast_add").label, is(Label.MOVE));
  }

  /** Tests that one bad rule does not prevent others from registering. */
  @Test
  void testRegisterAll() {
    final RuleRegistry registry = new RuleRegistry(t.typeSystem);
    final List<RuleException> errors =
        registry.registerAll(
            ImmutableList.of(new RuleDeclaration("cast_add", castAdd(), null),
                new RuleDeclaration("add_comm", comm(), null),
                new RuleDeclaration("cast_add2", castAdd(), Label.MOVE)));
    assertThat(errors, hasSize(1));
    assertThat(errors.get(0).ruleName, is("add_comm"));
    assertThat(registry.rules(), hasSize(2));
    assertThat(registry.version(), is(2));
  }

  /** Tests registering the standard rules of the numeric tower. */
  @Test
  void testStandardRules() {
    final RuleRegistry registry = new RuleRegistry(t.typeSystem);
    final List<RuleException> errors =
        registry.registerAll(StandardRules.declarations(t.typeSystem));
    assertThat(errors, hasSize(0));
    assertThat(registry.rules(), hasSize(61));
    assertThat(registry.rule("intOfNat.cast_sub"),
        hasToString("intOfNat.cast_sub [MOVE]: forall a : nat, "
            + "forall b : nat, b <= a -> "
            + "intOfNat (a - b) = intOfNat a - intOfNat b"));
    assertThat(registry.rule("ratOfInt.cast_sub").hypotheses, hasSize(0));
    assertThat(registry.rule("ratOfInt.cast_neg").label, is(Label.MOVE));
    assertThat(registry.rule("intOfNat.cast_neg") == null, is(true));
    assertThat(registry.rule("realOfRat.cast_ofNat"),
        hasToString("realOfRat.cast_ofNat [SQUASH]: realOfRat #n = #n"));
    assertThat(registry.rule("ratOfInt.cast_intOfNat"),
        hasToString("ratOfInt.cast_intOfNat [SQUASH]: forall a : nat, "
            + "ratOfInt (intOfNat a) = ratOfNat a"));
  }
}

// End RuleRegistryTest.java
