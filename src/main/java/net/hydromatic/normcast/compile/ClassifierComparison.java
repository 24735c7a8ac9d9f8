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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compares two ways of classifying rewrite rules.
 *
 * <p>Used to check a new classifier against an existing one, or a
 * classifier against the labels that rules were declared with.
 */
public abstract class ClassifierComparison {
  private ClassifierComparison() {}

  /**
   * Classifies each rule using two functions, and reports where they agree.
   *
   * <p>A rule is in {@link Outcome#AGREE} if both functions return the same
   * label, or if both fail; the rules on which both fail are also listed in
   * {@link Report#bothFail}.
   */
  public static Report compare(ClassifierFunction f, ClassifierFunction g,
      Iterable<RewriteRule> rules) {
    final ImmutableListMultimap.Builder<Outcome, String> b =
        ImmutableListMultimap.builder();
    final ImmutableList.Builder<String> bothFail = ImmutableList.builder();
    for (RewriteRule rule : rules) {
      final Label label0 = tryClassify(f, rule);
      final Label label1 = tryClassify(g, rule);
      final Outcome outcome;
      if (label0 == label1) {
        outcome = Outcome.AGREE;
        if (label0 == null) {
          bothFail.add(rule.name);
        }
      } else if (label0 == null) {
        outcome = Outcome.FIRST_FAILS;
      } else if (label1 == null) {
        outcome = Outcome.SECOND_FAILS;
      } else {
        outcome = Outcome.DISAGREE;
      }
      b.put(outcome, rule.name);
    }
    return new Report(b.build(), bothFail.build());
  }

  private static @Nullable Label tryClassify(ClassifierFunction f,
      RewriteRule rule) {
    try {
      return f.classify(rule);
    } catch (RuleException e) {
      return null;
    }
  }

  /** Outcome of classifying a rule two ways. */
  public enum Outcome {
    /** Both functions return the same label, or both fail. */
    AGREE,
    DISAGREE,
    FIRST_FAILS,
    SECOND_FAILS
  }

  /** Result of a comparison. */
  public static class Report {
    public final ImmutableListMultimap<Outcome, String> ruleNames;
    /** Names of the rules that neither function can classify. */
    public final ImmutableList<String> bothFail;

    Report(ImmutableListMultimap<Outcome, String> ruleNames,
        ImmutableList<String> bothFail) {
      this.ruleNames = requireNonNull(ruleNames);
      this.bothFail = requireNonNull(bothFail);
    }

    /** Returns the number of rules with a given outcome. */
    public int count(Outcome outcome) {
      return ruleNames.get(outcome).size();
    }

    /** Returns the names of the rules with a given outcome. */
    public List<String> names(Outcome outcome) {
      return ruleNames.get(outcome);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      for (Outcome outcome : Outcome.values()) {
        b.append(outcome).append(": ").append(count(outcome));
        if (outcome != Outcome.AGREE && count(outcome) > 0) {
          b.append(" ").append(names(outcome));
        }
        if (outcome == Outcome.AGREE && !bothFail.isEmpty()) {
          b.append(" (both fail: ").append(bothFail).append(")");
        }
        b.append("\n");
      }
      return b.toString();
    }
  }
}

// End ClassifierComparison.java
