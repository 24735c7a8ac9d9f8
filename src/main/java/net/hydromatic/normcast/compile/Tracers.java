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

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.proof.Certificate;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that prints every event to a writer. */
  public static Tracer printTracer(PrintWriter pw) {
    return new PrintTracer(pw);
  }

  /**
   * Returns a tracer that performs the given action on a registration error,
   * then calls the underlying tracer.
   */
  public static Tracer withOnRegistrationError(Tracer tracer,
      BiConsumer<String, RuleException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRegistrationError(String ruleName, RuleException e) {
        consumer.accept(ruleName, e);
        super.onRegistrationError(ruleName, e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a warning, then calls
   * the underlying tracer.
   */
  public static Tracer withOnWarning(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onWarning(String message) {
        consumer.accept(message);
        super.onWarning(message);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the certificate of a
   * phase, then calls the underlying tracer.
   */
  public static Tracer withOnPhase(Tracer tracer, NormCast.Phase phase,
      Consumer<Certificate> consumer) {
    final NormCast.Phase expectedPhase = phase;
    return new DelegatingTracer(tracer) {
      @Override
      public void onPhase(NormCast.Phase phase, Certificate certificate) {
        if (phase == expectedPhase) {
          consumer.accept(certificate);
        }
        super.onPhase(phase, certificate);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each rule that
   * rewrites an expression, then calls the underlying tracer.
   */
  public static Tracer withOnRewrite(Tracer tracer,
      Consumer<RewriteRule> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRewrite(String database, RewriteRule rule,
          Expr.Exp before, Expr.Exp after) {
        consumer.accept(rule);
        super.onRewrite(database, rule, before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each side condition
   * that cannot be discharged, then calls the underlying tracer.
   */
  public static Tracer withOnDischargeFailure(Tracer tracer,
      BiConsumer<RewriteRule, Expr.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDischargeFailure(RewriteRule rule,
          Expr.Exp sideCondition) {
        consumer.accept(rule, sideCondition);
        super.onDischargeFailure(rule, sideCondition);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each expression where
   * a coercion is inserted, then calls the underlying tracer.
   */
  public static Tracer withOnSplit(Tracer tracer,
      BiConsumer<Expr.Exp, Expr.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSplit(Expr.Exp before, Expr.Exp after) {
        consumer.accept(before, after);
        super.onSplit(before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each expression where
   * a coercion cannot be inserted, then calls the underlying tracer.
   */
  public static Tracer withOnInsertionImpossible(Tracer tracer,
      Consumer<Expr.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInsertionImpossible(Expr.Exp e) {
        consumer.accept(e);
        super.onInsertionImpossible(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onRegister(RewriteRule rule) {}

    @Override
    public void onRegistrationError(String ruleName, RuleException e) {}

    @Override
    public void onWarning(String message) {}

    @Override
    public void onCacheBuilt(NormalizationCache cache) {}

    @Override
    public void onPhase(NormCast.Phase phase, Certificate certificate) {}

    @Override
    public void onRewrite(String database, RewriteRule rule, Expr.Exp before,
        Expr.Exp after) {}

    @Override
    public void onDischargeFailure(RewriteRule rule, Expr.Exp sideCondition) {}

    @Override
    public void onSplit(Expr.Exp before, Expr.Exp after) {}

    @Override
    public void onInsertionImpossible(Expr.Exp e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onRegister(RewriteRule rule) {
      tracer.onRegister(rule);
    }

    @Override
    public void onRegistrationError(String ruleName, RuleException e) {
      tracer.onRegistrationError(ruleName, e);
    }

    @Override
    public void onWarning(String message) {
      tracer.onWarning(message);
    }

    @Override
    public void onCacheBuilt(NormalizationCache cache) {
      tracer.onCacheBuilt(cache);
    }

    @Override
    public void onPhase(NormCast.Phase phase, Certificate certificate) {
      tracer.onPhase(phase, certificate);
    }

    @Override
    public void onRewrite(String database, RewriteRule rule, Expr.Exp before,
        Expr.Exp after) {
      tracer.onRewrite(database, rule, before, after);
    }

    @Override
    public void onDischargeFailure(RewriteRule rule, Expr.Exp sideCondition) {
      tracer.onDischargeFailure(rule, sideCondition);
    }

    @Override
    public void onSplit(Expr.Exp before, Expr.Exp after) {
      tracer.onSplit(before, after);
    }

    @Override
    public void onInsertionImpossible(Expr.Exp e) {
      tracer.onInsertionImpossible(e);
    }
  }

  /** Tracer that prints each event on a line. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter pw;

    PrintTracer(PrintWriter pw) {
      this.pw = pw;
    }

    @Override
    public void onRegister(RewriteRule rule) {
      pw.println("register " + rule);
      pw.flush();
    }

    @Override
    public void onRegistrationError(String ruleName, RuleException e) {
      pw.println("error in rule " + ruleName + ": " + e.getMessage());
      pw.flush();
    }

    @Override
    public void onWarning(String message) {
      pw.println("warning: " + message);
      pw.flush();
    }

    @Override
    public void onCacheBuilt(NormalizationCache cache) {
      pw.println("built " + cache);
      pw.flush();
    }

    @Override
    public void onPhase(NormCast.Phase phase, Certificate certificate) {
      pw.println(phase + ": " + certificate.lhs() + " ~> "
          + certificate.rhs());
      pw.flush();
    }

    @Override
    public void onRewrite(String database, RewriteRule rule, Expr.Exp before,
        Expr.Exp after) {
      pw.println("  " + database + " " + rule.name + ": " + before + " ~> "
          + after);
      pw.flush();
    }

    @Override
    public void onDischargeFailure(RewriteRule rule, Expr.Exp sideCondition) {
      pw.println("  cannot discharge " + sideCondition + " for " + rule.name);
      pw.flush();
    }

    @Override
    public void onSplit(Expr.Exp before, Expr.Exp after) {
      pw.println("  split: " + before + " ~> " + after);
      pw.flush();
    }

    @Override
    public void onInsertionImpossible(Expr.Exp e) {
      pw.println("  cannot insert coercion in " + e);
      pw.flush();
    }
  }
}

// End Tracers.java
