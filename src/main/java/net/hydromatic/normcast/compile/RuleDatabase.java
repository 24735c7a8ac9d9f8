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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.proof.Certificate;
import net.hydromatic.normcast.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set of rewrite rules, each used in one direction, indexed by the head
 * symbol of the pattern it matches.
 *
 * <p>Instances are immutable; create them using a {@link Builder}.
 */
public class RuleDatabase {
  /** Key of patterns that are literals or numeral metavariables. */
  private static final String LITERAL_KEY = "#literal";

  public final String name;
  public final List<Entry> entries;
  private final ImmutableListMultimap<String, Entry> entriesByKey;
  /** Entries whose pattern may match an expression with any head. */
  private final List<Entry> wildcardEntries;

  private RuleDatabase(String name, List<Entry> entries) {
    this.name = requireNonNull(name);
    this.entries = ImmutableList.copyOf(entries);
    final ImmutableListMultimap.Builder<String, Entry> byKey =
        ImmutableListMultimap.builder();
    final ImmutableList.Builder<Entry> wildcards = ImmutableList.builder();
    for (Entry entry : entries) {
      final String key = key(entry.pattern());
      if (key == null) {
        wildcards.add(entry);
      } else {
        byKey.put(key, entry);
      }
    }
    this.entriesByKey = byKey.build();
    this.wildcardEntries = wildcards.build();
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String toString() {
    return name + "(" + entries.size() + " rules)";
  }

  /** Returns the number of entries. */
  public int size() {
    return entries.size();
  }

  /** Returns whether this database contains a given rule. */
  public boolean contains(String ruleName) {
    return entries.stream().anyMatch(entry -> entry.rule.name.equals(ruleName));
  }

  /**
   * Returns the key by which an expression (or pattern) is indexed, or null
   * if it can match (or be matched by) anything.
   */
  static @Nullable String key(Expr.Exp e) {
    switch (e.op) {
      case CONST:
        return ((Expr.Const) e).name;
      case APPLY:
        return key(((Expr.Apply) e).head());
      case LITERAL:
      case NUM_VAR:
        return LITERAL_KEY;
      case LAMBDA:
        return "fn";
      case PI:
        return "forall";
      case LET:
        return "let";
      default:
        return null;
    }
  }

  /**
   * Returns the entries whose pattern might match an expression, in the order
   * they were added to the database.
   */
  public List<Entry> candidates(Expr.Exp e) {
    final String key = key(e);
    if (key == null) {
      return wildcardEntries;
    }
    final List<Entry> keyed = entriesByKey.get(key);
    if (wildcardEntries.isEmpty()) {
      return keyed;
    }
    final List<Entry> list = new ArrayList<>(keyed);
    list.addAll(wildcardEntries);
    list.sort(Comparator.comparingInt(entry -> entry.ordinal));
    return list;
  }

  /**
   * Rewrites an expression using the first applicable entry.
   *
   * <p>An entry applies if its pattern matches, each of its hypotheses can be
   * discharged, and the result differs from the expression. If a hypothesis
   * cannot be discharged, the tracer is told, and the next entry is tried.
   *
   * @return Certificate that the expression equals the rewritten expression,
   * or null if no entry applies
   */
  public @Nullable Certificate rewrite(TypeSystem typeSystem, Expr.Exp e,
      Discharger discharger, Tracer tracer) {
    for (Entry entry : candidates(e)) {
      final Substitution substitution =
          Substitution.match(entry.pattern(), e, entry.paramNames);
      if (substitution == null) {
        continue;
      }
      final RewriteRule rule = entry.rule;
      final List<Expr.Exp> hypotheses =
          substitution.apply(typeSystem, rule.hypotheses);
      if (!discharge(rule, hypotheses, discharger, tracer)) {
        continue;
      }
      final Certificate c =
          Certificate.ruleApp(rule.name, rule.relation, substitution,
              substitution.apply(typeSystem, rule.lhs),
              substitution.apply(typeSystem, rule.rhs), hypotheses);
      final Certificate c2 = entry.reversed ? Certificate.symm(c) : c;
      if (c2.rhs().equals(e)) {
        continue;
      }
      tracer.onRewrite(name, rule, e, c2.rhs());
      return c2;
    }
    return null;
  }

  private static boolean discharge(RewriteRule rule,
      List<Expr.Exp> hypotheses, Discharger discharger, Tracer tracer) {
    for (Expr.Exp hypothesis : hypotheses) {
      if (!discharger.attempt(hypothesis)) {
        tracer.onDischargeFailure(rule, hypothesis);
        return false;
      }
    }
    return true;
  }

  /** Rule, and the direction in which it is used. */
  public static class Entry {
    public final RewriteRule rule;
    /** Whether the rule rewrites its right-hand side to its left. */
    public final boolean reversed;
    final int ordinal;
    final Set<String> paramNames;

    Entry(RewriteRule rule, boolean reversed, int ordinal) {
      this.rule = requireNonNull(rule);
      this.reversed = reversed;
      this.ordinal = ordinal;
      this.paramNames = rule.paramNames();
    }

    /** Returns the side of the rule that is matched. */
    public Expr.Exp pattern() {
      return reversed ? rule.rhs : rule.lhs;
    }

    /** Returns the side of the rule that replaces the matched expression. */
    public Expr.Exp result() {
      return reversed ? rule.lhs : rule.rhs;
    }

    @Override
    public String toString() {
      return (reversed ? "<- " : "") + rule.name;
    }
  }

  /** Builds a {@link RuleDatabase}. */
  public static class Builder {
    private final String name;
    private final List<Entry> entries = new ArrayList<>();

    Builder(String name) {
      this.name = requireNonNull(name);
    }

    /** Adds a rule, used in a given direction. */
    public Builder add(RewriteRule rule, boolean reversed) {
      entries.add(new Entry(rule, reversed, entries.size()));
      return this;
    }

    public RuleDatabase build() {
      return new RuleDatabase(name, entries);
    }
  }
}

// End RuleDatabase.java
