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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set of registered rewrite rules, and the {@link NormalizationCache} built
 * from them.
 *
 * <p>Each rule is classified once, when it is registered. Registration
 * bumps the version; the next call to {@link #cache()} rebuilds the cache.
 * Registration and rebuilding are serialized; readers see an immutable
 * snapshot, possibly a stale one.
 */
public class RuleRegistry {
  private final TypeSystem typeSystem;
  private final Classifier classifier;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  private volatile ImmutableList<RewriteRule> rules = ImmutableList.of();
  private volatile int version;
  private volatile @Nullable NormalizationCache cache;

  /** Creates a RuleRegistry with default properties and no tracing. */
  public RuleRegistry(TypeSystem typeSystem) {
    this(typeSystem, ImmutableMap.of(), Tracers.empty());
  }

  /** Creates a RuleRegistry. */
  public RuleRegistry(TypeSystem typeSystem, Map<Prop, Object> propMap,
      Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.classifier = new Classifier(typeSystem);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  public TypeSystem typeSystem() {
    return typeSystem;
  }

  /** Returns the registered rules, in order of registration. */
  public List<RewriteRule> rules() {
    return rules;
  }

  /** Returns the number of times the set of rules has changed. */
  public int version() {
    return version;
  }

  /** Looks up a rule by name; returns null if not found. */
  public @Nullable RewriteRule rule(String name) {
    for (RewriteRule rule : rules) {
      if (rule.name.equals(name)) {
        return rule;
      }
    }
    return null;
  }

  /**
   * Classifies and registers a rule.
   *
   * <p>If {@code override} is not null, it is used as the rule's label, and
   * the shape of the rule is not required to be valid. If the shape is valid
   * but implies a different label, then registration fails if
   * {@link Prop#STRICT_OVERRIDES} is set, and otherwise a warning is traced.
   *
   * <p>Registering a rule under the name of an existing rule replaces it,
   * unless the labels differ.
   *
   * @param name     Name of the rule
   * @param exp      Statement of the rule
   * @param override Label that overrides the label inferred from the shape,
   *                 or null
   * @return Registered rule
   * @throws RuleException if the rule is badly shaped, or its label conflicts
   */
  public synchronized RewriteRule register(String name, Expr.Exp exp,
      @Nullable Label override) {
    try {
      final RewriteRule rule = classify(name, exp, override);
      final List<RewriteRule> list = new ArrayList<>(rules);
      final RewriteRule existing = rule(name);
      if (existing != null) {
        if (existing.label != rule.label) {
          throw new RuleException(RuleException.Kind.CONFLICTING_LABEL, name,
              "rule " + name + " is already registered as " + existing.label
                  + ", cannot re-register as " + rule.label);
        }
        if (existing.exp.equals(exp)) {
          return existing;
        }
        list.set(list.indexOf(existing), rule);
      } else {
        list.add(rule);
      }
      rules = ImmutableList.copyOf(list);
      ++version;
      tracer.onRegister(rule);
      return rule;
    } catch (RuleException e) {
      tracer.onRegistrationError(name, e);
      throw e;
    }
  }

  /**
   * Registers several rules. A rule that cannot be registered does not
   * prevent the others from being registered.
   *
   * @return Errors, one for each rule that could not be registered
   */
  public List<RuleException> registerAll(
      Iterable<RuleDeclaration> declarations) {
    final ImmutableList.Builder<RuleException> errors = ImmutableList.builder();
    for (RuleDeclaration declaration : declarations) {
      try {
        register(declaration.name, declaration.exp, declaration.label);
      } catch (RuleException e) {
        errors.add(e);
      }
    }
    return errors.build();
  }

  private RewriteRule classify(String name, Expr.Exp exp,
      @Nullable Label override) {
    final RewriteRule.Statement statement = RewriteRule.decompose(name, exp);
    @Nullable Label inferred = null;
    @Nullable RuleException error = null;
    try {
      inferred = classifier.classify(statement.lhs, statement.rhs);
    } catch (RuleException e) {
      error = e.withRuleName(name);
    }
    if (override == null) {
      if (error != null) {
        throw error;
      }
      return new RewriteRule(name, exp, statement, requireNonNull(inferred),
          false);
    }
    if (inferred != null && inferred != override) {
      final String message = "rule " + name + " is declared " + override
          + " but its shape is " + inferred;
      if (Prop.STRICT_OVERRIDES.booleanValue(propMap)) {
        throw new RuleException(RuleException.Kind.CONFLICTING_LABEL, name,
            message);
      }
      tracer.onWarning(message);
    }
    return new RewriteRule(name, exp, statement, override,
        inferred != override);
  }

  /**
   * Returns the cache for the current set of rules, building it if the rules
   * have changed since it was last built.
   */
  public NormalizationCache cache() {
    NormalizationCache c = cache;
    if (c != null && c.version == version) {
      return c;
    }
    synchronized (this) {
      c = cache;
      if (c == null || c.version != version) {
        c = NormalizationCache.build(typeSystem, rules, version, tracer);
        cache = c;
      }
      return c;
    }
  }
}

// End RuleRegistry.java
