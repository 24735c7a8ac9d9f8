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
import java.util.List;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.type.CoercionFn;
import net.hydromatic.normcast.type.TypeSystem;

/**
 * Generates the standard cast rules for the coercions registered in a
 * {@link TypeSystem}.
 *
 * <p>For each coercion {@code c} from &alpha; to &beta;, the rules are named
 * after the coercion, for example "{@code intOfNat.cast_add}":
 *
 * <ul>
 *   <li>cast_add, "{@code c (a + b) = c a + c b}" (move);
 *   <li>cast_mul, "{@code c (a * b) = c a * c b}" (move);
 *   <li>cast_sub, "{@code c (a - b) = c a - c b}" (move), with hypothesis
 *       "{@code b <= a}" if &alpha; is not a ring;
 *   <li>cast_neg, "{@code c (~ a) = ~ (c a)}" (move), if &alpha; is a ring;
 *   <li>cast_lt, "{@code c a < c b <-> a < b}" (elim);
 *   <li>cast_le, "{@code c a <= c b <-> a <= b}" (elim);
 *   <li>cast_inj, "{@code c a = c b <-> a = b}" (elim);
 *   <li>cast_zero, "{@code c 0 = 0}" (squash), if both types have 0;
 *   <li>cast_one, "{@code c 1 = 1}" (squash), if both types have 1;
 *   <li>cast_ofNat, "{@code c #n = #n}" (squash), if &alpha; has numerals.
 * </ul>
 *
 * <p>In addition, for each pair of coercions {@code c1} from &alpha; to
 * &beta; and {@code c2} from &beta; to &gamma; such that there is a coercion
 * {@code c3} from &alpha; to &gamma;, there is a rule
 * "{@code c2 (c1 a) = c3 a}" (squash) named "{@code c2.cast_c1}".
 */
public abstract class StandardRules {
  private StandardRules() {}

  /** Returns the declarations of the standard rules, with their labels. */
  public static List<RuleDeclaration> declarations(TypeSystem typeSystem) {
    final ImmutableList.Builder<RuleDeclaration> b = ImmutableList.builder();
    for (CoercionFn c : typeSystem.coercionFns()) {
      new Generator(typeSystem, c, b).generate();
    }
    for (CoercionFn c1 : typeSystem.coercionFns()) {
      for (CoercionFn c2 : typeSystem.coercionFns()) {
        if (!c1.target.equals(c2.source)) {
          continue;
        }
        final CoercionFn c3 = typeSystem.coercionFn(c1.source, c2.target);
        if (c3 == null) {
          continue;
        }
        final Expr.Var a = expr.var("a", c1.source);
        b.add(
            new RuleDeclaration(c2.name + ".cast_" + c1.name,
                expr.forall(a,
                    expr.eq(typeSystem, c2.apply(c1.apply(a)), c3.apply(a))),
                Label.SQUASH));
      }
    }
    return b.build();
  }

  /**
   * Creates a registry containing the standard rules.
   *
   * @throws RuleException if a rule cannot be registered
   */
  public static RuleRegistry registry(TypeSystem typeSystem) {
    final RuleRegistry registry = new RuleRegistry(typeSystem);
    for (RuleDeclaration declaration : declarations(typeSystem)) {
      registry.register(declaration.name, declaration.exp, declaration.label);
    }
    return registry;
  }

  /** Generates the rules for one coercion. */
  private static class Generator {
    final TypeSystem typeSystem;
    final CoercionFn c;
    final ImmutableList.Builder<RuleDeclaration> b;
    final Expr.Var a;
    final Expr.Var b2;

    Generator(TypeSystem typeSystem, CoercionFn c,
        ImmutableList.Builder<RuleDeclaration> b) {
      this.typeSystem = typeSystem;
      this.c = c;
      this.b = b;
      this.a = expr.var("a", c.source);
      this.b2 = expr.var("b", c.source);
    }

    void generate() {
      move("cast_add", BuiltIn.PLUS);
      move("cast_mul", BuiltIn.TIMES);
      if (typeSystem.isRing(c.source)) {
        move("cast_sub", BuiltIn.MINUS);
        add("cast_neg", ImmutableList.of(a),
            expr.eq(typeSystem,
                c.apply(expr.call(typeSystem, BuiltIn.NEGATE, a)),
                expr.call(typeSystem, BuiltIn.NEGATE, c.apply(a))),
            Label.MOVE);
      } else {
        add("cast_sub", ImmutableList.of(a, b2),
            expr.implies(typeSystem,
                expr.call(typeSystem, BuiltIn.LE, b2, a),
                moveEquation(BuiltIn.MINUS)),
            Label.MOVE);
      }
      elim("cast_lt", BuiltIn.LT);
      elim("cast_le", BuiltIn.LE);
      elim("cast_inj", BuiltIn.EQ);
      if (typeSystem.hasZero(c.source) && typeSystem.hasZero(c.target)) {
        literal("cast_zero", 0);
      }
      if (typeSystem.hasOne(c.source) && typeSystem.hasOne(c.target)) {
        literal("cast_one", 1);
      }
      if (typeSystem.hasNumerals(c.source)) {
        add("cast_ofNat", ImmutableList.of(),
            expr.eq(typeSystem, c.apply(expr.numVar("n", c.source)),
                expr.numVar("n", c.target)),
            Label.SQUASH);
      }
    }

    /** Adds "{@code c (a op b) = c a op c b}". */
    private void move(String name, BuiltIn op) {
      add(name, ImmutableList.of(a, b2), moveEquation(op), Label.MOVE);
    }

    private Expr.Exp moveEquation(BuiltIn op) {
      return expr.eq(typeSystem,
          c.apply(expr.call(typeSystem, op, a, b2)),
          expr.call(typeSystem, op, c.apply(a), c.apply(b2)));
    }

    /** Adds "{@code c a op c b <-> a op b}". */
    private void elim(String name, BuiltIn op) {
      add(name, ImmutableList.of(a, b2),
          expr.iff(typeSystem,
              expr.call(typeSystem, op, c.apply(a), c.apply(b2)),
              expr.call(typeSystem, op, a, b2)),
          Label.ELIM);
    }

    /** Adds "{@code c n = n}" for a literal {@code n}. */
    private void literal(String name, int value) {
      add(name, ImmutableList.of(),
          expr.eq(typeSystem, c.apply(expr.literal(value, c.source)),
              expr.literal(value, c.target)),
          Label.SQUASH);
    }

    private void add(String name, List<Expr.Var> params, Expr.Exp statement,
        Label label) {
      b.add(
          new RuleDeclaration(c.name + "." + name,
              expr.forall(params, statement), label));
    }
  }
}

// End StandardRules.java
