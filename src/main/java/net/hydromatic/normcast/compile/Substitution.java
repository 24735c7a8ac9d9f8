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
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.ast.Op;
import net.hydromatic.normcast.ast.Shuttle;
import net.hydromatic.normcast.type.FnType;
import net.hydromatic.normcast.type.Type;
import net.hydromatic.normcast.type.TypeSystem;
import net.hydromatic.normcast.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Assignment of values to the parameters of a rewrite rule.
 *
 * <p>Term parameters are mapped to expressions, numeral metavariables to
 * numbers, and type variables to types. A substitution is created by
 * {@link #match matching} a pattern against an expression, and is used to
 * {@link #apply instantiate} the other parts of the rule.
 */
public class Substitution {
  /** Substitution that maps nothing. */
  public static final Substitution EMPTY =
      new Substitution(ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of());

  public final ImmutableMap<String, Expr.Exp> terms;
  public final ImmutableMap<String, BigInteger> numerals;
  public final ImmutableMap<String, Type> types;

  Substitution(Map<String, Expr.Exp> terms, Map<String, BigInteger> numerals,
      Map<String, Type> types) {
    this.terms = ImmutableMap.copyOf(terms);
    this.numerals = ImmutableMap.copyOf(numerals);
    this.types = ImmutableMap.copyOf(types);
  }

  /**
   * Matches a pattern against an expression.
   *
   * <p>Variables in the pattern whose names are in {@code params} match any
   * expression of the right type (the same expression, if the variable occurs
   * more than once); numeral metavariables match any literal; type variables
   * match any type. Everything else must be equal.
   *
   * @param pattern Pattern
   * @param exp     Expression
   * @param params  Names of the pattern's parameters
   * @return Substitution that makes the pattern equal to the expression, or
   * null if there is none
   */
  public static @Nullable Substitution match(Expr.Exp pattern, Expr.Exp exp,
      Set<String> params) {
    final Matcher matcher = new Matcher(params);
    if (!matcher.match(pattern, exp)) {
      return null;
    }
    return new Substitution(matcher.terms, matcher.numerals, matcher.types);
  }

  @Override
  public int hashCode() {
    return terms.hashCode() * 37 + numerals.hashCode() * 31 + types.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Substitution
            && terms.equals(((Substitution) obj).terms)
            && numerals.equals(((Substitution) obj).numerals)
            && types.equals(((Substitution) obj).types);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes this substitution as "[term/var, ...]". */
  public StringBuilder describe(StringBuilder buf) {
    buf.append("[");
    final int start = buf.length();
    types.forEach((name, type) ->
        sep(buf, start).append(type).append("/").append(name));
    terms.forEach((name, term) ->
        sep(buf, start).append(term).append("/").append(name));
    numerals.forEach((name, value) ->
        sep(buf, start).append(value).append("/#").append(name));
    return buf.append("]");
  }

  private static StringBuilder sep(StringBuilder buf, int start) {
    return buf.length() > start ? buf.append(", ") : buf;
  }

  /** Applies this substitution to a type. */
  public Type apply(Type type) {
    return types.isEmpty() ? type : type.substitute(types);
  }

  /** Applies this substitution to an expression. */
  public Expr.Exp apply(TypeSystem typeSystem, Expr.Exp exp) {
    return exp.accept(new Instantiator(typeSystem));
  }

  /** Applies this substitution to each of a list of expressions. */
  public List<Expr.Exp> apply(TypeSystem typeSystem,
      List<? extends Expr.Exp> exps) {
    final Instantiator instantiator = new Instantiator(typeSystem);
    final ImmutableList.Builder<Expr.Exp> list = ImmutableList.builder();
    exps.forEach(exp -> list.add(exp.accept(instantiator)));
    return list.build();
  }

  /** Shuttle that replaces parameters with their values. */
  private class Instantiator extends Shuttle {
    Instantiator(TypeSystem typeSystem) {
      super(typeSystem);
    }

    @Override
    protected Expr.Exp visit(Expr.Var var) {
      final Expr.Exp term = terms.get(var.name);
      if (term != null) {
        return term;
      }
      return visitBound(var);
    }

    @Override
    protected Expr.Var visitBound(Expr.Var var) {
      final Type type = apply(var.type);
      return type.equals(var.type) ? var : expr.var(var.name, type);
    }

    @Override
    protected Expr.Exp visit(Expr.Const constant) {
      if (types.isEmpty()) {
        return constant;
      }
      final ImmutableList.Builder<Type> typeArgs = ImmutableList.builder();
      constant.typeArgs.forEach(t -> typeArgs.add(apply(t)));
      final Expr.Const constant2 =
          expr.constant(constant.name, typeArgs.build(), apply(constant.type));
      return constant2.equals(constant) ? constant : constant2;
    }

    @Override
    protected Expr.Exp visit(Expr.Literal literal) {
      final Type type = apply(literal.type);
      return type.equals(literal.type)
          ? literal
          : expr.literal(literal.value, type);
    }

    @Override
    protected Expr.Exp visit(Expr.NumVar numVar) {
      final BigInteger value = numerals.get(numVar.name);
      final Type type = apply(numVar.type);
      if (value != null) {
        return expr.literal(value, type);
      }
      return type.equals(numVar.type) ? numVar : expr.numVar(numVar.name, type);
    }
  }

  /** Accumulates bindings while matching a pattern. */
  private static class Matcher {
    final Set<String> params;
    final Map<String, Expr.Exp> terms = new LinkedHashMap<>();
    final Map<String, BigInteger> numerals = new LinkedHashMap<>();
    final Map<String, Type> types = new LinkedHashMap<>();

    Matcher(Set<String> params) {
      this.params = requireNonNull(params);
    }

    boolean match(Expr.Exp pattern, Expr.Exp exp) {
      switch (pattern.op) {
        case VAR:
          final Expr.Var var = (Expr.Var) pattern;
          if (!matchType(var.type, exp.type)) {
            return false;
          }
          if (params.contains(var.name)) {
            final Expr.Exp bound = terms.putIfAbsent(var.name, exp);
            return bound == null || bound.equals(exp);
          }
          return exp.op == Op.VAR && ((Expr.Var) exp).name.equals(var.name);

        case CONST:
          if (exp.op != Op.CONST) {
            return false;
          }
          final Expr.Const constant = (Expr.Const) pattern;
          final Expr.Const constant2 = (Expr.Const) exp;
          if (!constant.name.equals(constant2.name)
              || constant.typeArgs.size() != constant2.typeArgs.size()) {
            return false;
          }
          for (int i = 0; i < constant.typeArgs.size(); i++) {
            if (!matchType(constant.typeArgs.get(i),
                constant2.typeArgs.get(i))) {
              return false;
            }
          }
          return matchType(constant.type, constant2.type);

        case APPLY:
          return exp.op == Op.APPLY
              && match(((Expr.Apply) pattern).fn, ((Expr.Apply) exp).fn)
              && match(((Expr.Apply) pattern).arg, ((Expr.Apply) exp).arg);

        case LITERAL:
          return exp.op == Op.LITERAL
              && ((Expr.Literal) pattern).value
                  .equals(((Expr.Literal) exp).value)
              && matchType(pattern.type, exp.type);

        case NUM_VAR:
          if (exp.op != Op.LITERAL || !matchType(pattern.type, exp.type)) {
            return false;
          }
          final BigInteger value = ((Expr.Literal) exp).value;
          final BigInteger boundValue =
              numerals.putIfAbsent(((Expr.NumVar) pattern).name, value);
          return boundValue == null || boundValue.equals(value);

        case LAMBDA:
        case PI:
          if (exp.op != pattern.op) {
            return false;
          }
          final Expr.Binder binder = (Expr.Binder) pattern;
          final Expr.Binder binder2 = (Expr.Binder) exp;
          return binder.var.name.equals(binder2.var.name)
              && matchType(binder.var.type, binder2.var.type)
              && match(binder.body, binder2.body);

        case LET:
          if (exp.op != Op.LET) {
            return false;
          }
          final Expr.Let let = (Expr.Let) pattern;
          final Expr.Let let2 = (Expr.Let) exp;
          return let.var.name.equals(let2.var.name)
              && match(let.value, let2.value)
              && match(let.body, let2.body);

        default:
          throw new AssertionError("unexpected " + pattern.op);
      }
    }

    boolean matchType(Type pattern, Type type) {
      if (pattern instanceof TypeVar) {
        final Type bound =
            types.putIfAbsent(((TypeVar) pattern).name, type);
        return bound == null || bound.equals(type);
      }
      if (pattern instanceof FnType) {
        return type instanceof FnType
            && matchType(((FnType) pattern).paramType,
                ((FnType) type).paramType)
            && matchType(((FnType) pattern).resultType,
                ((FnType) type).resultType);
      }
      return pattern.equals(type);
    }
  }
}

// End Substitution.java
