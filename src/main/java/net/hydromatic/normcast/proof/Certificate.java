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
import static net.hydromatic.normcast.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.compile.Substitution;

/**
 * Certificate that two expressions are equal (or, if they are propositions,
 * equivalent).
 *
 * <p>A certificate is a tree of steps: reflexivity, symmetry, transitivity,
 * congruence, and applications of rewrite rules. It is built by the engine as
 * it rewrites, and can be replayed by {@link CertificateChecker}.
 *
 * <p>Use the static factory methods, such as {@link #trans}, rather than the
 * constructors; they remove trivial steps.
 */
public abstract class Certificate {
  public final Kind kind;

  private Certificate(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns the expression on the left of the relation. */
  public abstract Expr.Exp lhs();

  /** Returns the expression on the right of the relation. */
  public abstract Expr.Exp rhs();

  /** Returns the relation established between the two sides. */
  public abstract Relation relation();

  /** Returns whether this certificate is trivial. */
  public boolean isRefl() {
    return kind == Kind.REFL;
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  abstract StringBuilder describe(StringBuilder buf);

  /** Returns the names of the rules applied, in the order they occur. */
  public List<String> ruleNames() {
    final List<String> names = new ArrayList<>();
    collectRuleNames(names);
    return ImmutableList.copyOf(names);
  }

  abstract void collectRuleNames(List<String> names);

  /** Creates a certificate that an expression equals itself. */
  public static Certificate refl(Expr.Exp e) {
    return new Refl(e);
  }

  /** Creates a certificate that reverses another. */
  public static Certificate symm(Certificate c) {
    switch (c.kind) {
      case REFL:
        return c;
      case SYMM:
        return ((Symm) c).c;
      default:
        return new Symm(c);
    }
  }

  /**
   * Creates a certificate that chains two certificates; the right-hand side
   * of the first must be the left-hand side of the second.
   */
  public static Certificate trans(Certificate c0, Certificate c1) {
    if (c0.isRefl()) {
      return c1;
    }
    if (c1.isRefl()) {
      return c0;
    }
    return new Trans(c0, c1);
  }

  /** Creates a certificate that {@code fn a = fn b} given {@code a = b}. */
  public static Certificate congArg(Expr.Exp fn, Certificate c) {
    if (c.isRefl()) {
      return refl(expr.apply(fn, c.lhs()));
    }
    return new CongArg(fn, c);
  }

  /** Creates a certificate that {@code f x = g x} given {@code f = g}. */
  public static Certificate congFun(Certificate c, Expr.Exp arg) {
    if (c.isRefl()) {
      return refl(expr.apply(c.lhs(), arg));
    }
    return new CongFun(c, arg);
  }

  /**
   * Creates a certificate that two lambdas (or two universal
   * quantifications) are equal given that their bodies are equal.
   */
  public static Certificate congBinder(Expr.Binder binder, Certificate body) {
    if (body.isRefl()) {
      return refl(binder.copy(body.lhs()));
    }
    return new CongBinder(binder, body);
  }

  /**
   * Creates a certificate that two let expressions are equal given that their
   * values are equal and their bodies are equal.
   */
  public static Certificate congLet(Expr.Var var, Certificate value,
      Certificate body) {
    if (value.isRefl() && body.isRefl()) {
      return refl(expr.let(var, value.lhs(), body.lhs()));
    }
    return new CongLet(var, value, body);
  }

  /**
   * Creates a certificate that is an instance of a rewrite rule.
   *
   * @param ruleName     Name of the rule
   * @param relation     Relation of the rule
   * @param substitution Values of the rule's parameters
   * @param lhs          Instantiated left-hand side
   * @param rhs          Instantiated right-hand side
   * @param hypotheses   Instantiated hypotheses, each of which was discharged
   */
  public static Certificate ruleApp(String ruleName, Relation relation,
      Substitution substitution, Expr.Exp lhs, Expr.Exp rhs,
      List<? extends Expr.Exp> hypotheses) {
    return new RuleApp(ruleName, relation, substitution, lhs, rhs,
        ImmutableList.copyOf(hypotheses));
  }

  /** Kinds of certificate. */
  public enum Kind {
    REFL, SYMM, TRANS, CONG_ARG, CONG_FUN, CONG_BINDER, CONG_LET, RULE_APP
  }

  /** Certificate that an expression equals itself. */
  public static class Refl extends Certificate {
    public final Expr.Exp e;

    Refl(Expr.Exp e) {
      super(Kind.REFL);
      this.e = requireNonNull(e);
    }

    @Override
    public Expr.Exp lhs() {
      return e;
    }

    @Override
    public Expr.Exp rhs() {
      return e;
    }

    @Override
    public Relation relation() {
      return Relation.EQ;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return buf.append("refl");
    }

    @Override
    void collectRuleNames(List<String> names) {
    }
  }

  /** Certificate that {@code b = a} given {@code a = b}. */
  public static class Symm extends Certificate {
    public final Certificate c;

    Symm(Certificate c) {
      super(Kind.SYMM);
      this.c = requireNonNull(c);
    }

    @Override
    public Expr.Exp lhs() {
      return c.rhs();
    }

    @Override
    public Expr.Exp rhs() {
      return c.lhs();
    }

    @Override
    public Relation relation() {
      return c.relation();
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return c.describe(buf.append("symm(")).append(")");
    }

    @Override
    void collectRuleNames(List<String> names) {
      c.collectRuleNames(names);
    }
  }

  /** Certificate that {@code a = c} given {@code a = b} and {@code b = c}. */
  public static class Trans extends Certificate {
    public final Certificate c0;
    public final Certificate c1;

    Trans(Certificate c0, Certificate c1) {
      super(Kind.TRANS);
      this.c0 = requireNonNull(c0);
      this.c1 = requireNonNull(c1);
    }

    @Override
    public Expr.Exp lhs() {
      return c0.lhs();
    }

    @Override
    public Expr.Exp rhs() {
      return c1.rhs();
    }

    @Override
    public Relation relation() {
      return c0.relation().compose(c1.relation());
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      c0.describe(buf.append("trans("));
      return c1.describe(buf.append(", ")).append(")");
    }

    @Override
    void collectRuleNames(List<String> names) {
      c0.collectRuleNames(names);
      c1.collectRuleNames(names);
    }
  }

  /** Certificate that {@code fn a = fn b} given {@code a = b}. */
  public static class CongArg extends Certificate {
    public final Expr.Exp fn;
    public final Certificate c;
    private final Expr.Exp lhs;
    private final Expr.Exp rhs;

    CongArg(Expr.Exp fn, Certificate c) {
      super(Kind.CONG_ARG);
      this.fn = requireNonNull(fn);
      this.c = requireNonNull(c);
      this.lhs = expr.apply(fn, c.lhs());
      this.rhs = expr.apply(fn, c.rhs());
    }

    @Override
    public Expr.Exp lhs() {
      return lhs;
    }

    @Override
    public Expr.Exp rhs() {
      return rhs;
    }

    @Override
    public Relation relation() {
      return Relation.EQ;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return c.describe(buf.append("congArg(")).append(")");
    }

    @Override
    void collectRuleNames(List<String> names) {
      c.collectRuleNames(names);
    }
  }

  /** Certificate that {@code f x = g x} given {@code f = g}. */
  public static class CongFun extends Certificate {
    public final Certificate c;
    public final Expr.Exp arg;
    private final Expr.Exp lhs;
    private final Expr.Exp rhs;

    CongFun(Certificate c, Expr.Exp arg) {
      super(Kind.CONG_FUN);
      this.c = requireNonNull(c);
      this.arg = requireNonNull(arg);
      this.lhs = expr.apply(c.lhs(), arg);
      this.rhs = expr.apply(c.rhs(), arg);
    }

    @Override
    public Expr.Exp lhs() {
      return lhs;
    }

    @Override
    public Expr.Exp rhs() {
      return rhs;
    }

    @Override
    public Relation relation() {
      return Relation.EQ;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return c.describe(buf.append("congFun(")).append(")");
    }

    @Override
    void collectRuleNames(List<String> names) {
      c.collectRuleNames(names);
    }
  }

  /** Certificate that two binders are equal given that their bodies are. */
  public static class CongBinder extends Certificate {
    public final Expr.Binder binder;
    public final Certificate body;
    private final Expr.Exp lhs;
    private final Expr.Exp rhs;

    CongBinder(Expr.Binder binder, Certificate body) {
      super(Kind.CONG_BINDER);
      this.binder = requireNonNull(binder);
      this.body = requireNonNull(body);
      this.lhs = binder.copy(body.lhs());
      this.rhs = binder.copy(body.rhs());
    }

    @Override
    public Expr.Exp lhs() {
      return lhs;
    }

    @Override
    public Expr.Exp rhs() {
      return rhs;
    }

    @Override
    public Relation relation() {
      return Relation.EQ;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return body.describe(buf.append("congBinder(")).append(")");
    }

    @Override
    void collectRuleNames(List<String> names) {
      body.collectRuleNames(names);
    }
  }

  /** Certificate that two let expressions are equal. */
  public static class CongLet extends Certificate {
    public final Expr.Var var;
    public final Certificate value;
    public final Certificate body;
    private final Expr.Exp lhs;
    private final Expr.Exp rhs;

    CongLet(Expr.Var var, Certificate value, Certificate body) {
      super(Kind.CONG_LET);
      this.var = requireNonNull(var);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
      this.lhs = expr.let(var, value.lhs(), body.lhs());
      this.rhs = expr.let(var, value.rhs(), body.rhs());
    }

    @Override
    public Expr.Exp lhs() {
      return lhs;
    }

    @Override
    public Expr.Exp rhs() {
      return rhs;
    }

    @Override
    public Relation relation() {
      return Relation.EQ;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      value.describe(buf.append("congLet("));
      return body.describe(buf.append(", ")).append(")");
    }

    @Override
    void collectRuleNames(List<String> names) {
      value.collectRuleNames(names);
      body.collectRuleNames(names);
    }
  }

  /** Certificate that is an instance of a rewrite rule. */
  public static class RuleApp extends Certificate {
    public final String ruleName;
    private final Relation relation;
    public final Substitution substitution;
    private final Expr.Exp lhs;
    private final Expr.Exp rhs;
    public final List<Expr.Exp> hypotheses;

    RuleApp(String ruleName, Relation relation, Substitution substitution,
        Expr.Exp lhs, Expr.Exp rhs, ImmutableList<Expr.Exp> hypotheses) {
      super(Kind.RULE_APP);
      this.ruleName = requireNonNull(ruleName);
      this.relation = requireNonNull(relation);
      this.substitution = requireNonNull(substitution);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.hypotheses = requireNonNull(hypotheses);
    }

    @Override
    public Expr.Exp lhs() {
      return lhs;
    }

    @Override
    public Expr.Exp rhs() {
      return rhs;
    }

    @Override
    public Relation relation() {
      return relation;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return buf.append(ruleName);
    }

    @Override
    void collectRuleNames(List<String> names) {
      names.add(ruleName);
    }
  }
}

// End Certificate.java
