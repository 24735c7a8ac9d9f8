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

import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.proof.Certificate;

/** Called on various events while registering rules and normalizing. */
public interface Tracer {
  /** Called when a rule has been classified and registered. */
  void onRegister(RewriteRule rule);

  /** Called when a rule cannot be registered. */
  void onRegistrationError(String ruleName, RuleException e);

  /** Called with a warning that does not prevent further work. */
  void onWarning(String message);

  /** Called when the rule databases have been built. */
  void onCacheBuilt(NormalizationCache cache);

  /** Called when a phase of normalization has finished. */
  void onPhase(NormCast.Phase phase, Certificate certificate);

  /** Called when a rule from a database rewrites an expression. */
  void onRewrite(String database, RewriteRule rule, Expr.Exp before,
      Expr.Exp after);

  /**
   * Called when a rule matches but one of its hypotheses cannot be
   * discharged; the rule is skipped.
   */
  void onDischargeFailure(RewriteRule rule, Expr.Exp sideCondition);

  /**
   * Called when the splitting procedure inserts a coercion into a binary
   * operation.
   */
  void onSplit(Expr.Exp before, Expr.Exp after);

  /**
   * Called when the splitting procedure finds mismatched coercions in a
   * binary operation but cannot reconcile them.
   */
  void onInsertionImpossible(Expr.Exp e);
}

// End Tracer.java
