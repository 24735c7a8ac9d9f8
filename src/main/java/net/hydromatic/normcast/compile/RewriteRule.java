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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.ast.Op;
import net.hydromatic.normcast.ast.Visitor;
import net.hydromatic.normcast.proof.Relation;

/**
 * Rewrite rule, "{@code forall params, h1 -> ... -> lhs = rhs}" (or
 * "{@code <->}"), with its classification.
 *
 * <p>Rules are created by {@link RuleRegistry#register}, which classifies
 * them, and by {@link NormalizationCache} for the relational rules that are
 * always present.
 */
public class RewriteRule {
  public final String name;
  /** The statement of the rule, as declared. */
  public final Expr.Exp exp;
  public final List<Expr.Var> params;
  public final List<Expr.Exp> hypotheses;
  public final Expr.Exp lhs;
  public final Expr.Exp rhs;
  public final Relation relation;
  public final Label label;
  /** Whether the label was declared rather than inferred from the shape. */
  public final boolean overridden;

  RewriteRule(String name, Expr.Exp exp, Statement statement, Label label,
      boolean overridden) {
    this.name = requireNonNull(name);
    this.exp = requireNonNull(exp);
    this.params = statement.params;
    this.hypotheses = statement.hypotheses;
    this.lhs = statement.lhs;
    this.rhs = statement.rhs;
    this.relation = statement.relation;
    this.label = requireNonNull(label);
    this.overridden = overridden;
  }

  @Override
  public String toString() {
    return name + " [" + label + (overridden ? ", overridden" : "") + "]: "
        + exp;
  }

  /**
   * Splits the statement of a rule into its parameters, hypotheses and
   * conclusion.
   *
   * @throws RuleException if the conclusion is not an equation or
   * equivalence
   */
  public static Statement decompose(String name, Expr.Exp exp) {
    final List<Expr.Var> params = new ArrayList<>();
    Expr.Exp e = exp;
    while (e.op == Op.PI) {
      params.add(((Expr.Binder) e).var);
      e = ((Expr.Binder) e).body;
    }
    final List<Expr.Exp> hypotheses = new ArrayList<>();
    while (e.op == Op.APPLY && ((Expr.Apply) e).isCallTo(BuiltIn.IMPLIES)) {
      hypotheses.add(((Expr.Apply) ((Expr.Apply) e).fn).arg);
      e = ((Expr.Apply) e).arg;
    }
    final Relation relation;
    if (e.op == Op.APPLY && ((Expr.Apply) e).isCallTo(BuiltIn.EQ)) {
      relation = Relation.EQ;
    } else if (e.op == Op.APPLY && ((Expr.Apply) e).isCallTo(BuiltIn.IFF)) {
      relation = Relation.IFF;
    } else {
      throw new RuleException(RuleException.Kind.BAD_SHAPE, name,
          "norm_cast: badly shaped lemma, conclusion must be an equation or "
              + "an equivalence: " + e);
    }
    final Expr.Exp lhs = ((Expr.Apply) ((Expr.Apply) e).fn).arg;
    final Expr.Exp rhs = ((Expr.Apply) e).arg;
    return new Statement(params, hypotheses, lhs, rhs, relation);
  }

  /** Returns the names of all parameters and numeral metavariables. */
  public Set<String> paramNames() {
    final Set<String> names = new LinkedHashSet<>();
    params.forEach(p -> names.add(p.name));
    final ParamFinder finder = new ParamFinder(names, new LinkedHashSet<>());
    lhs.accept(finder);
    rhs.accept(finder);
    hypotheses.forEach(h -> h.accept(finder));
    names.addAll(finder.found);
    return ImmutableSet.copyOf(names);
  }

  /**
   * Returns the names of the parameters and numeral metavariables that occur
   * in an expression.
   */
  public Set<String> paramsIn(Expr.Exp e) {
    final Set<String> paramNames = new LinkedHashSet<>();
    params.forEach(p -> paramNames.add(p.name));
    final Set<String> found = new LinkedHashSet<>();
    e.accept(new ParamFinder(paramNames, found));
    return ImmutableSet.copyOf(found);
  }

  /** Parts of a rule's statement. */
  public static class Statement {
    public final List<Expr.Var> params;
    public final List<Expr.Exp> hypotheses;
    public final Expr.Exp lhs;
    public final Expr.Exp rhs;
    public final Relation relation;

    Statement(List<Expr.Var> params, List<Expr.Exp> hypotheses, Expr.Exp lhs,
        Expr.Exp rhs, Relation relation) {
      this.params = ImmutableList.copyOf(params);
      this.hypotheses = ImmutableList.copyOf(hypotheses);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.relation = requireNonNull(relation);
    }
  }

  /** Collects parameters and numeral metavariables. */
  private static class ParamFinder extends Visitor {
    final Set<String> paramNames;
    final Set<String> found;

    ParamFinder(Set<String> paramNames, Set<String> found) {
      this.paramNames = paramNames;
      this.found = found;
    }

    @Override
    protected void visit(Expr.Var var) {
      if (paramNames.contains(var.name)) {
        found.add(var.name);
      }
    }

    @Override
    protected void visit(Expr.NumVar numVar) {
      found.add(numVar.name);
    }
  }
}

// End RewriteRule.java
