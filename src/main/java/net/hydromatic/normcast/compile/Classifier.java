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

import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.ast.Visitor;
import net.hydromatic.normcast.type.Coercion;
import net.hydromatic.normcast.type.TypeSystem;

/**
 * Classifies rewrite rules by counting the coercions on each side.
 *
 * <p>A rule "{@code lhs = rhs}" is
 *
 * <ul>
 *   <li>{@link Label#ELIM} if neither side starts with a coercion, and the
 *       left-hand side contains at least one;
 *   <li>{@link Label#MOVE} if the left-hand side starts with exactly one
 *       coercion, the right-hand side starts with none, and contains some;
 *   <li>{@link Label#SQUASH} if the right-hand side starts with fewer
 *       coercions than the left-hand side, and (when the left starts with
 *       exactly one) contains none.
 * </ul>
 *
 * <p>Any other rule is badly shaped.
 */
public class Classifier {
  private final TypeSystem typeSystem;

  public Classifier(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  /**
   * Returns the number of coercions at the head of an expression; for
   * example 2 for "{@code ratOfInt (intOfNat (a + b))}".
   */
  public int countHeadCoes(Expr.Exp e) {
    int n = 0;
    for (Coercion coercion = typeSystem.coercionOf(e); coercion != null;
         coercion = typeSystem.coercionOf(coercion.arg)) {
      ++n;
    }
    return n;
  }

  /** Returns the number of coercions anywhere in an expression. */
  public int countCoes(Expr.Exp e) {
    final int[] count = {0};
    e.accept(
        new Visitor() {
          @Override
          protected void visit(Expr.Apply apply) {
            final Coercion coercion = typeSystem.coercionOf(apply);
            if (coercion != null) {
              ++count[0];
              coercion.arg.accept(this);
            } else {
              super.visit(apply);
            }
          }
        });
    return count[0];
  }

  /** Returns the number of coercions that are not at the head. */
  public int countInternalCoes(Expr.Exp e) {
    return countCoes(e) - countHeadCoes(e);
  }

  /**
   * Classifies a rule by the coercions on its left- and right-hand sides.
   *
   * @throws RuleException if the rule is badly shaped
   */
  public Label classify(Expr.Exp lhs, Expr.Exp rhs) {
    if (countCoes(lhs) == 0) {
      throw badShape("lhs must contain at least one coe");
    }
    final int lhsHeadCoes = countHeadCoes(lhs);
    final int rhsHeadCoes = countHeadCoes(rhs);
    if (lhsHeadCoes == 0) {
      if (rhsHeadCoes != 0) {
        throw badShape("rhs can't start with coe");
      }
      return Label.ELIM;
    }
    if (lhsHeadCoes == 1) {
      if (rhsHeadCoes != 0) {
        throw badShape("rhs can't start with coe");
      }
      return countInternalCoes(rhs) == 0 ? Label.SQUASH : Label.MOVE;
    }
    if (rhsHeadCoes < lhsHeadCoes) {
      return Label.SQUASH;
    }
    throw badShape("no valid reduction in coercion count; "
        + "rhs must have fewer head coes than lhs");
  }

  /** Classifies a rule; convenient as a {@link ClassifierFunction}. */
  public Label classify(RewriteRule rule) {
    try {
      return classify(rule.lhs, rule.rhs);
    } catch (RuleException e) {
      throw e.withRuleName(rule.name);
    }
  }

  private static RuleException badShape(String message) {
    return new RuleException(RuleException.Kind.BAD_SHAPE, null,
        "norm_cast: badly shaped lemma, " + message);
  }
}

// End Classifier.java
