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

import java.util.Map;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.proof.Certificate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifier of expressions.
 *
 * <p>Visits an expression bottom-up. Each node, after its children have been
 * simplified, is offered to a {@link Rewriter}; if the rewriter changes it
 * and asks for the result to be revisited, the result is simplified again.
 *
 * <p>Returns a certificate that the original expression equals the
 * simplified expression. The number of rewrite steps is bounded by
 * {@link Prop#MAX_STEPS}; the first step beyond the bound is not applied,
 * a warning is traced, and simplification stops at the current expression.
 */
class Simplifier {
  private final Rewriter rewriter;
  private final int maxSteps;
  private final Tracer tracer;
  private int stepCount;
  /** Whether a step has been refused because the bound was reached. */
  private boolean exhausted;

  Simplifier(Rewriter rewriter, Map<Prop, Object> propMap, Tracer tracer) {
    this.rewriter = requireNonNull(rewriter);
    this.maxSteps = Prop.MAX_STEPS.intValue(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Simplifies an expression. */
  Certificate simplify(Expr.Exp exp) {
    stepCount = 0;
    exhausted = false;
    return visit(exp);
  }

  private Certificate visit(Expr.Exp exp) {
    if (exhausted) {
      return Certificate.refl(exp);
    }
    final Certificate c = visitChildren(exp);
    if (exhausted) {
      return c;
    }
    final Step step = rewriter.post(c.rhs());
    if (step == null || step.certificate.rhs().equals(c.rhs())) {
      return c;
    }
    if (stepCount >= maxSteps) {
      exhausted = true;
      tracer.onWarning("maximum number of steps (" + maxSteps
          + ") exceeded while simplifying " + exp);
      return c;
    }
    ++stepCount;
    final Certificate c2 = Certificate.trans(c, step.certificate);
    if (!step.revisit) {
      return c2;
    }
    return Certificate.trans(c2, visit(c2.rhs()));
  }

  /**
   * Simplifies the children of an expression, and returns a certificate
   * that the expression equals the expression with simplified children.
   */
  private Certificate visitChildren(Expr.Exp exp) {
    switch (exp.op) {
      case APPLY:
        return visitSpine((Expr.Apply) exp);

      case LAMBDA:
      case PI:
        final Expr.Binder binder = (Expr.Binder) exp;
        return Certificate.congBinder(binder, visit(binder.body));

      case LET:
        final Expr.Let let = (Expr.Let) exp;
        return Certificate.congLet(let.var, visit(let.value),
            visit(let.body));

      default:
        return Certificate.refl(exp);
    }
  }

  /**
   * Simplifies the arguments of an application. Partial applications along
   * the spine are not offered to the rewriter, nor is a constant or variable
   * at the head.
   */
  private Certificate visitSpine(Expr.Apply apply) {
    final Certificate fn;
    switch (apply.fn.op) {
      case APPLY:
        fn = visitSpine((Expr.Apply) apply.fn);
        break;
      case CONST:
      case VAR:
        fn = Certificate.refl(apply.fn);
        break;
      default:
        fn = visit(apply.fn);
    }
    final Certificate arg = visit(apply.arg);
    if (fn.isRefl() && arg.isRefl()) {
      return Certificate.refl(apply);
    }
    if (fn.isRefl()) {
      return Certificate.congArg(apply.fn, arg);
    }
    if (arg.isRefl()) {
      return Certificate.congFun(fn, apply.arg);
    }
    return Certificate.trans(Certificate.congFun(fn, apply.arg),
        Certificate.congArg(fn.rhs(), arg));
  }

  /** Rewrites an expression whose children have been simplified. */
  @FunctionalInterface
  interface Rewriter {
    /** Returns a rewrite step, or null if the expression is final. */
    @Nullable Step post(Expr.Exp exp);
  }

  /** Result of {@link Rewriter#post}. */
  static class Step {
    final Certificate certificate;
    /** Whether to simplify the result again. */
    final boolean revisit;

    private Step(Certificate certificate, boolean revisit) {
      this.certificate = requireNonNull(certificate);
      this.revisit = revisit;
    }

    /** Creates a step whose result is simplified again. */
    static @Nullable Step visit(@Nullable Certificate certificate) {
      return certificate == null ? null : new Step(certificate, true);
    }

    /** Creates a step whose result is final. */
    static @Nullable Step done(@Nullable Certificate certificate) {
      return certificate == null ? null : new Step(certificate, false);
    }
  }
}

// End Simplifier.java
