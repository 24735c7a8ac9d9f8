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
package net.hydromatic.normcast.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.normcast.compile.BuiltIn;
import net.hydromatic.normcast.type.BaseType;
import net.hydromatic.normcast.type.FnType;
import net.hydromatic.normcast.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expressions.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Every expression is immutable, carries its {@link Type}, and is
 * compared structurally by {@link Object#equals(Object)}.
 *
 * <p>Use {@link ExprBuilder#expr} to create expressions.
 */
public class Expr {
  private Expr() {}

  /** Base class of expressions. */
  public abstract static class Exp {
    public final Op op;
    public final Type type;

    Exp(Op op, Type type) {
      this.op = requireNonNull(op);
      this.type = requireNonNull(type);
    }

    /**
     * Converts this expression into a string.
     *
     * <p>Derived classes override {@link #unparse}, not this method.
     */
    @Override
    public final String toString() {
      return unparse(new ExprWriter(), 0, 0).toString();
    }

    abstract ExprWriter unparse(ExprWriter w, int left, int right);

    /**
     * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
     * to the type of this expression, and returning the result.
     */
    public abstract Exp accept(Shuttle shuttle);

    /**
     * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
     * to the type of this expression.
     */
    public abstract void accept(Visitor visitor);
  }

  /** Reference to a variable, either free or bound by a {@link Binder}. */
  public static class Var extends Exp {
    public final String name;

    Var(String name, Type type) {
      super(Op.VAR, type);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + type.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Var
              && name.equals(((Var) obj).name)
              && type.equals(((Var) obj).type);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Constant, such as a coercion function or an operator.
   *
   * <p>The type arguments instantiate a polymorphic constant; for example the
   * constant "{@code <}" that compares integers has type arguments {@code
   * [int]} and type "{@code int -> int -> Prop}".
   */
  public static class Const extends Exp {
    public final String name;
    public final List<Type> typeArgs;

    Const(String name, List<Type> typeArgs, Type type) {
      super(Op.CONST, type);
      this.name = requireNonNull(name);
      this.typeArgs = ImmutableList.copyOf(typeArgs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, typeArgs, type);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Const
              && name.equals(((Const) obj).name)
              && typeArgs.equals(((Const) obj).typeArgs)
              && type.equals(((Const) obj).type);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Application of a function to an argument.
   *
   * <p>Functions are curried; "{@code a + b}" is {@code Apply(Apply(+, a),
   * b)}. The chain of applications whose innermost function is {@link
   * #head()} is called the spine, and its arguments are {@link #args()}.
   */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Exp fn, Exp arg, Type type) {
      super(Op.APPLY, type);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Apply
              && fn.equals(((Apply) obj).fn)
              && arg.equals(((Apply) obj).arg);
    }

    /** Returns the function at the head of the spine. */
    public Exp head() {
      Exp e = fn;
      while (e.op == Op.APPLY) {
        e = ((Apply) e).fn;
      }
      return e;
    }

    /** Returns the arguments of the spine, outermost last. */
    public List<Exp> args() {
      final List<Exp> args = new ArrayList<>();
      Exp e = this;
      while (e.op == Op.APPLY) {
        args.add(((Apply) e).arg);
        e = ((Apply) e).fn;
      }
      return ImmutableList.copyOf(args).reverse();
    }

    /** Returns the number of arguments in the spine. */
    public int argCount() {
      int n = 1;
      for (Exp e = fn; e.op == Op.APPLY; e = ((Apply) e).fn) {
        ++n;
      }
      return n;
    }

    /** If the head of this application is a built-in, returns it. */
    public @Nullable BuiltIn builtIn() {
      final Exp head = head();
      return head.op == Op.CONST
          ? BuiltIn.BY_OP_NAME.get(((Const) head).name)
          : null;
    }

    /** Returns whether this is a call to a given built-in operator. */
    public boolean isCallTo(BuiltIn builtIn) {
      return builtIn() == builtIn && argCount() == builtIn.arity;
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      final BuiltIn builtIn = builtIn();
      if (builtIn != null && builtIn.isInfix() && argCount() == 2) {
        return w.infix(left, ((Apply) fn).arg, builtIn, arg, right);
      }
      return w.apply(left, fn, arg, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Apply} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Apply copy(Exp fn, Exp arg) {
      return this.fn.equals(fn) && this.arg.equals(arg)
          ? this
          : ExprBuilder.expr.apply(fn, arg);
    }
  }

  /**
   * Lambda abstraction ("{@code fn x : t => e}") or universal quantification
   * ("{@code forall x : t, e}").
   */
  public static class Binder extends Exp {
    public final Var var;
    public final Exp body;

    Binder(Op op, Var var, Exp body, Type type) {
      super(op, type);
      this.var = requireNonNull(var);
      this.body = requireNonNull(body);
      checkArgument(op.isBinder());
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, var, body);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Binder
              && op == ((Binder) obj).op
              && var.equals(((Binder) obj).var)
              && body.equals(((Binder) obj).body);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op == Op.LAMBDA ? "fn " : "forall ")
          .append(var.name)
          .append(" : ")
          .append(var.type.toString())
          .append(op == Op.LAMBDA ? " => " : ", ")
          .append(body, 0, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Binder} with a given body, or {@code this}
     * if the body is the same.
     */
    public Binder copy(Exp body) {
      return this.body.equals(body)
          ? this
          : new Binder(op, var, body, type);
    }
  }

  /** Let expression, "{@code let x = value in body}". */
  public static class Let extends Exp {
    public final Var var;
    public final Exp value;
    public final Exp body;

    Let(Var var, Exp value, Exp body) {
      super(Op.LET, body.type);
      this.var = requireNonNull(var);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(var, value, body);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Let
              && var.equals(((Let) obj).var)
              && value.equals(((Let) obj).value)
              && body.equals(((Let) obj).body);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("let ")
          .append(var.name)
          .append(" = ")
          .append(value, 0, 0)
          .append(" in ")
          .append(body, 0, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Let} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Let copy(Exp value, Exp body) {
      return this.value.equals(value) && this.body.equals(body)
          ? this
          : new Let(var, value, body);
    }
  }

  /** Numeral literal, such as "{@code 10}" of type {@code rat}. */
  public static class Literal extends Exp {
    public final BigInteger value;

    Literal(BigInteger value, Type type) {
      super(Op.LITERAL, type);
      this.value = requireNonNull(value);
      checkArgument(value.signum() >= 0, "negative numeral: %s", value);
      checkArgument(!(type instanceof FnType) && !BaseType.PROP.equals(type),
          "numeral of type %s", type);
    }

    /** Returns whether this literal has a given value. */
    public boolean is(int value) {
      return this.value.equals(BigInteger.valueOf(value));
    }

    @Override
    public int hashCode() {
      return value.hashCode() * 31 + type.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Literal
              && value.equals(((Literal) obj).value)
              && type.equals(((Literal) obj).type);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(value.toString());
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Numeral metavariable, such as "{@code #n}" in the rule "{@code intOfNat #n
   * = #n}".
   *
   * <p>Occurs only in rule patterns. When a pattern is matched, it matches any
   * {@link Literal} of its type, and binds the literal's value; when a pattern
   * is instantiated, it becomes a literal of its (instantiated) type.
   */
  public static class NumVar extends Exp {
    public final String name;

    NumVar(String name, Type type) {
      super(Op.NUM_VAR, type);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + type.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof NumVar
              && name.equals(((NumVar) obj).name)
              && type.equals(((NumVar) obj).type);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append("#").append(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Expr.java
