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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.normcast.compile.BuiltIn;
import net.hydromatic.normcast.type.BaseType;
import net.hydromatic.normcast.type.FnType;
import net.hydromatic.normcast.type.Type;
import net.hydromatic.normcast.type.TypeSystem;

/** Builds expressions. */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  /** Creates a reference to a variable. */
  public Expr.Var var(String name, Type type) {
    return new Expr.Var(name, type);
  }

  /** Creates a monomorphic constant. */
  public Expr.Const constant(String name, Type type) {
    return new Expr.Const(name, ImmutableList.of(), type);
  }

  /** Creates a constant, instantiated with type arguments. */
  public Expr.Const constant(String name, List<? extends Type> typeArgs,
      Type type) {
    return new Expr.Const(name, ImmutableList.copyOf(typeArgs), type);
  }

  /** Creates an application of a function to an argument. */
  public Expr.Apply apply(Expr.Exp fn, Expr.Exp arg) {
    checkArgument(fn.type instanceof FnType, "not a function: %s : %s", fn,
        fn.type);
    final FnType fnType = (FnType) fn.type;
    checkArgument(fnType.paramType.equals(arg.type),
        "%s expects %s, got %s : %s", fn, fnType.paramType, arg, arg.type);
    return new Expr.Apply(fn, arg, fnType.resultType);
  }

  /** Creates an application of a curried function to several arguments. */
  public Expr.Exp apply(Expr.Exp fn, List<? extends Expr.Exp> args) {
    Expr.Exp e = fn;
    for (Expr.Exp arg : args) {
      e = apply(e, arg);
    }
    return e;
  }

  /**
   * Creates a call to a built-in operator.
   *
   * <p>If the operator is polymorphic, the type of the first argument
   * instantiates it; for example, {@code call(ts, LT, a, b)} with {@code a}
   * and {@code b} of type {@code int} calls "{@code <}" on integers.
   */
  public Expr.Exp call(TypeSystem typeSystem, BuiltIn builtIn,
      Expr.Exp... args) {
    checkArgument(args.length == builtIn.arity,
        "%s expects %s arguments", builtIn, builtIn.arity);
    return apply(builtIn.constant(typeSystem, args[0].type),
        ImmutableList.copyOf(args));
  }

  /** Creates a numeral literal. */
  public Expr.Literal literal(long value, Type type) {
    return literal(BigInteger.valueOf(value), type);
  }

  /** Creates a numeral literal. */
  public Expr.Literal literal(BigInteger value, Type type) {
    return new Expr.Literal(value, type);
  }

  /** Creates a numeral metavariable, for use in rule patterns. */
  public Expr.NumVar numVar(String name, Type type) {
    return new Expr.NumVar(name, type);
  }

  /** Creates a lambda, "{@code fn var => body}". */
  public Expr.Binder lambda(TypeSystem typeSystem, Expr.Var var,
      Expr.Exp body) {
    return new Expr.Binder(Op.LAMBDA, var, body,
        typeSystem.fnType(var.type, body.type));
  }

  /** Creates a universal quantification, "{@code forall var, body}". */
  public Expr.Binder forall(Expr.Var var, Expr.Exp body) {
    checkArgument(body.type.equals(BaseType.PROP),
        "body of forall must be a proposition: %s", body);
    return new Expr.Binder(Op.PI, var, body, BaseType.PROP);
  }

  /**
   * Creates a nested universal quantification, binding variables from first
   * to last.
   */
  public Expr.Exp forall(List<Expr.Var> vars, Expr.Exp body) {
    Expr.Exp e = body;
    for (Expr.Var var : ImmutableList.copyOf(vars).reverse()) {
      e = forall(var, e);
    }
    return e;
  }

  /** Creates a let expression, "{@code let var = value in body}". */
  public Expr.Let let(Expr.Var var, Expr.Exp value, Expr.Exp body) {
    checkArgument(var.type.equals(value.type),
        "type mismatch in let: %s vs %s", var.type, value.type);
    return new Expr.Let(var, value, body);
  }

  /** Creates an equation, "{@code left = right}". */
  public Expr.Exp eq(TypeSystem typeSystem, Expr.Exp left, Expr.Exp right) {
    return call(typeSystem, BuiltIn.EQ, left, right);
  }

  /** Creates a biconditional, "{@code left <-> right}". */
  public Expr.Exp iff(TypeSystem typeSystem, Expr.Exp left, Expr.Exp right) {
    return call(typeSystem, BuiltIn.IFF, left, right);
  }

  /** Creates an implication, "{@code hypothesis -> conclusion}". */
  public Expr.Exp implies(TypeSystem typeSystem, Expr.Exp hypothesis,
      Expr.Exp conclusion) {
    return call(typeSystem, BuiltIn.IMPLIES, hypothesis, conclusion);
  }
}

// End ExprBuilder.java
