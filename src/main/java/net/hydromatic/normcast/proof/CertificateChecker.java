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
package net.hydromatic.normcast.proof;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.function.Function;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.compile.Discharger;
import net.hydromatic.normcast.compile.NormalizationCache;
import net.hydromatic.normcast.compile.RewriteRule;
import net.hydromatic.normcast.compile.Substitution;
import net.hydromatic.normcast.type.BaseType;
import net.hydromatic.normcast.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replays a {@link Certificate}, checking each step.
 *
 * <p>The checker does not trust the expressions recorded in a rule
 * application; it instantiates the rule again and compares. Chains must
 * link up, both sides of every step must have the same type, and only
 * propositions may be related by {@link Relation#IFF}.
 */
public class CertificateChecker {
  private final TypeSystem typeSystem;
  private final Function<String, @Nullable RewriteRule> ruleLookup;
  private final @Nullable Discharger discharger;

  /**
   * Creates a CertificateChecker.
   *
   * @param typeSystem Type system
   * @param ruleLookup Looks up a rule by name, returning null if not found
   * @param discharger If not null, used to check again that the hypotheses
   *                   of each rule application hold
   */
  public CertificateChecker(TypeSystem typeSystem,
      Function<String, @Nullable RewriteRule> ruleLookup,
      @Nullable Discharger discharger) {
    this.typeSystem = requireNonNull(typeSystem);
    this.ruleLookup = requireNonNull(ruleLookup);
    this.discharger = discharger;
  }

  /** Creates a checker that looks up rules in a cache. */
  public static CertificateChecker of(NormalizationCache cache,
      @Nullable Discharger discharger) {
    return new CertificateChecker(cache.typeSystem, cache::rule, discharger);
  }

  /**
   * Checks that a certificate proves a relation between two given
   * expressions.
   *
   * @throws CertificateException if it does not
   */
  public void check(Certificate c, Expr.Exp lhs, Expr.Exp rhs) {
    if (!c.lhs().equals(lhs)) {
      throw new CertificateException("proves " + c.lhs() + ", expected "
          + lhs, c);
    }
    if (!c.rhs().equals(rhs)) {
      throw new CertificateException("proves " + c.rhs() + ", expected "
          + rhs, c);
    }
    check(c);
  }

  /**
   * Checks that a certificate is valid.
   *
   * @throws CertificateException if it is not
   */
  public void check(Certificate c) {
    if (!c.lhs().type.equals(c.rhs().type)) {
      throw new CertificateException("type mismatch: " + c.lhs().type
          + " vs " + c.rhs().type, c);
    }
    if (c.relation() == Relation.IFF
        && !c.lhs().type.equals(BaseType.PROP)) {
      throw new CertificateException("equivalence between non-propositions",
          c);
    }
    switch (c.kind) {
      case REFL:
        return;

      case SYMM:
        check(((Certificate.Symm) c).c);
        return;

      case TRANS:
        final Certificate.Trans trans = (Certificate.Trans) c;
        check(trans.c0);
        check(trans.c1);
        if (!trans.c0.rhs().equals(trans.c1.lhs())) {
          throw new CertificateException("broken chain: " + trans.c0.rhs()
              + " is not " + trans.c1.lhs(), c);
        }
        return;

      case CONG_ARG:
        check(((Certificate.CongArg) c).c);
        return;

      case CONG_FUN:
        check(((Certificate.CongFun) c).c);
        return;

      case CONG_BINDER:
        check(((Certificate.CongBinder) c).body);
        return;

      case CONG_LET:
        check(((Certificate.CongLet) c).value);
        check(((Certificate.CongLet) c).body);
        return;

      case RULE_APP:
        checkRuleApp((Certificate.RuleApp) c);
        return;

      default:
        throw new AssertionError(c.kind);
    }
  }

  private void checkRuleApp(Certificate.RuleApp app) {
    final RewriteRule rule = ruleLookup.apply(app.ruleName);
    if (rule == null) {
      throw new CertificateException("unknown rule " + app.ruleName, app);
    }
    if (rule.relation != app.relation()) {
      throw new CertificateException("rule " + rule.name + " is "
          + rule.relation + ", not " + app.relation(), app);
    }
    final Substitution substitution = app.substitution;
    for (String name : rule.paramNames()) {
      if (!substitution.terms.containsKey(name)
          && !substitution.numerals.containsKey(name)) {
        throw new CertificateException("parameter " + name + " of rule "
            + rule.name + " is not instantiated", app);
      }
    }
    final Expr.Exp lhs = substitution.apply(typeSystem, rule.lhs);
    final Expr.Exp rhs = substitution.apply(typeSystem, rule.rhs);
    if (!lhs.equals(app.lhs()) || !rhs.equals(app.rhs())) {
      throw new CertificateException("rule " + rule.name + " instantiates to "
          + lhs + " and " + rhs, app);
    }
    final List<Expr.Exp> hypotheses =
        substitution.apply(typeSystem, rule.hypotheses);
    if (!hypotheses.equals(app.hypotheses)) {
      throw new CertificateException("hypotheses of rule " + rule.name
          + " instantiate to " + hypotheses, app);
    }
    if (discharger != null) {
      for (Expr.Exp hypothesis : hypotheses) {
        if (!discharger.attempt(hypothesis)) {
          throw new CertificateException("hypothesis " + hypothesis
              + " of rule " + rule.name + " does not hold", app);
        }
      }
    }
  }
}

// End CertificateChecker.java
