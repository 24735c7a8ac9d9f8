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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.type.TypeSystem;
import net.hydromatic.normcast.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The three rule databases used by {@link NormCast}.
 *
 * <ul>
 *   <li>{@link #up} moves coercions towards the root and eliminates them: it
 *       contains elim rules, move rules reversed, and the relational rules
 *       that turn "{@code >=}", "{@code >}" and "{@code <>}" into
 *       "{@code <=}", "{@code <}" and "{@code not =}";
 *   <li>{@link #down} moves coercions towards the leaves: it contains move
 *       rules and squash rules;
 *   <li>{@link #squash} contains squash rules.
 * </ul>
 *
 * <p>A cache is immutable. {@link RuleRegistry} builds a new one when rules
 * have been registered since the last build.
 */
public class NormalizationCache {
  public final TypeSystem typeSystem;
  /** Version of the registry that this cache was built from. */
  public final int version;
  public final RuleDatabase up;
  public final RuleDatabase down;
  public final RuleDatabase squash;
  private final ImmutableMap<String, RewriteRule> ruleByName;

  private NormalizationCache(TypeSystem typeSystem, int version,
      RuleDatabase up, RuleDatabase down, RuleDatabase squash,
      Map<String, RewriteRule> ruleByName) {
    this.typeSystem = requireNonNull(typeSystem);
    this.version = version;
    this.up = requireNonNull(up);
    this.down = requireNonNull(down);
    this.squash = requireNonNull(squash);
    this.ruleByName = ImmutableMap.copyOf(ruleByName);
  }

  /**
   * Builds a cache from a list of classified rules.
   *
   * <p>A rule that cannot be used in the direction its label requires,
   * because its pattern does not bind every parameter of the rest of the
   * rule, is reported to the tracer and left out of that database.
   */
  public static NormalizationCache build(TypeSystem typeSystem,
      Iterable<RewriteRule> rules, int version, Tracer tracer) {
    final DatabaseBuilder up = new DatabaseBuilder("up", tracer);
    final DatabaseBuilder down = new DatabaseBuilder("down", tracer);
    final DatabaseBuilder squash = new DatabaseBuilder("squash", tracer);
    final Map<String, RewriteRule> ruleByName = new LinkedHashMap<>();
    for (RewriteRule rule : relationalRules(typeSystem)) {
      up.add(rule, false);
      ruleByName.put(rule.name, rule);
    }
    for (RewriteRule rule : rules) {
      ruleByName.put(rule.name, rule);
      switch (rule.label) {
        case ELIM:
          up.add(rule, false);
          break;
        case MOVE:
          up.add(rule, true);
          down.add(rule, false);
          break;
        case SQUASH:
          squash.add(rule, false);
          down.add(rule, false);
          break;
        default:
          throw new AssertionError(rule.label);
      }
    }
    final NormalizationCache cache =
        new NormalizationCache(typeSystem, version, up.build(), down.build(),
            squash.build(), ruleByName);
    tracer.onCacheBuilt(cache);
    return cache;
  }

  /**
   * Returns the rules that rewrite "{@code a >= b}" to "{@code b <= a}",
   * "{@code a > b}" to "{@code b < a}", and "{@code a <> b}" to
   * "{@code not (a = b)}", at any type.
   */
  public static List<RewriteRule> relationalRules(TypeSystem typeSystem) {
    final TypeVar alpha = new TypeVar("'a");
    final Expr.Var a = expr.var("a", alpha);
    final Expr.Var b = expr.var("b", alpha);
    return ImmutableList.of(
        relationalRule(typeSystem, "ge_iff_le", a, b,
            expr.iff(typeSystem,
                expr.call(typeSystem, BuiltIn.GE, a, b),
                expr.call(typeSystem, BuiltIn.LE, b, a))),
        relationalRule(typeSystem, "gt_iff_lt", a, b,
            expr.iff(typeSystem,
                expr.call(typeSystem, BuiltIn.GT, a, b),
                expr.call(typeSystem, BuiltIn.LT, b, a))),
        relationalRule(typeSystem, "ne_eq", a, b,
            expr.eq(typeSystem,
                expr.call(typeSystem, BuiltIn.NE, a, b),
                expr.call(typeSystem, BuiltIn.NOT,
                    expr.eq(typeSystem, a, b)))));
  }

  private static RewriteRule relationalRule(TypeSystem typeSystem,
      String name, Expr.Var a, Expr.Var b, Expr.Exp statement) {
    final Expr.Exp exp = expr.forall(ImmutableList.of(a, b), statement);
    return new RewriteRule(name, exp, RewriteRule.decompose(name, exp),
        Label.ELIM, true);
  }

  /** Looks up a rule by name; returns null if not found. */
  public @Nullable RewriteRule rule(String name) {
    return ruleByName.get(name);
  }

  @Override
  public String toString() {
    return "NormalizationCache(version " + version + ": " + up + ", " + down
        + ", " + squash + ")";
  }

  /** Builds a database, leaving out entries that cannot be instantiated. */
  private static class DatabaseBuilder {
    final RuleDatabase.Builder builder;
    final Tracer tracer;

    DatabaseBuilder(String name, Tracer tracer) {
      this.builder = RuleDatabase.builder(name);
      this.tracer = tracer;
    }

    void add(RewriteRule rule, boolean reversed) {
      final Expr.Exp pattern = reversed ? rule.rhs : rule.lhs;
      final Expr.Exp result = reversed ? rule.lhs : rule.rhs;
      final Set<String> bound = rule.paramsIn(pattern);
      for (Expr.Exp e : ImmutableList.<Expr.Exp>builder().add(result)
          .addAll(rule.hypotheses).build()) {
        for (String param : rule.paramsIn(e)) {
          if (!bound.contains(param)) {
            tracer.onWarning("rule " + rule.name + " cannot be used "
                + (reversed ? "right-to-left" : "left-to-right")
                + " because its pattern does not bind " + param);
            return;
          }
        }
      }
      builder.add(rule, reversed);
    }

    RuleDatabase build() {
      return builder.build();
    }
  }
}

// End NormalizationCache.java
