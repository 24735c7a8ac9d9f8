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
package net.hydromatic.normcast.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.normcast.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A collection of types, the coercion functions between them, and the
 * algebraic structure (zero, one, numerals, negation) each of them has.
 *
 * <p>A type system is populated once, before any rule is registered, and is
 * read-only afterwards.
 */
public class TypeSystem {
  private final Map<String, BaseType> typeByName = new LinkedHashMap<>();

  /** Coercion functions, keyed by (source, target). */
  private final Map<List<BaseType>, CoercionFn> coercionFns =
      new LinkedHashMap<>();

  /**
   * Number of implicit arguments of each coercion function, keyed by the name
   * of the constant at the head of the function.
   */
  private final Map<String, Integer> implicitArgCounts = new HashMap<>();

  private final Set<BaseType> zeroTypes = new LinkedHashSet<>();
  private final Set<BaseType> oneTypes = new LinkedHashSet<>();
  private final Set<BaseType> ringTypes = new LinkedHashSet<>();
  private @Nullable BaseType numeralType;

  /** Creates an empty TypeSystem. It contains only {@link BaseType#PROP}. */
  public TypeSystem() {
    typeByName.put(BaseType.PROP.name, BaseType.PROP);
  }

  /** Creates a base type, or returns the existing type with that name. */
  public BaseType baseType(String name) {
    return typeByName.computeIfAbsent(name, BaseType::new);
  }

  /** Looks up a base type by name. Throws if not found; never returns null. */
  public BaseType lookup(String name) {
    final BaseType type = typeByName.get(name);
    if (type == null) {
      throw new IllegalArgumentException("type " + name + " not found");
    }
    return type;
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(paramType, resultType);
  }

  /**
   * Creates a curried function type; {@code fnType(a, b, c)} is
   * "{@code a -> b -> c}".
   */
  public FnType fnType(Type type0, Type type1, Type... moreTypes) {
    final List<Type> types =
        ImmutableList.<Type>builder().add(type0, type1).add(moreTypes).build();
    Type type = types.get(types.size() - 1);
    for (int i = types.size() - 2; i >= 0; i--) {
      type = fnType(types.get(i), type);
    }
    return (FnType) type;
  }

  /** Declares that a type has an additive identity, "0". */
  public TypeSystem declareZero(BaseType type) {
    zeroTypes.add(type);
    return this;
  }

  /** Declares that a type has a multiplicative identity, "1". */
  public TypeSystem declareOne(BaseType type) {
    oneTypes.add(type);
    return this;
  }

  /** Declares that a type has negation and total subtraction. */
  public TypeSystem declareRing(BaseType type) {
    ringTypes.add(type);
    return this;
  }

  /**
   * Declares the base type of numerals. Numeral literals of other types are
   * temporarily expressed as coercions from this type while casts are being
   * normalized.
   */
  public TypeSystem declareNumeralType(BaseType type) {
    this.numeralType = requireNonNull(type);
    return this;
  }

  public boolean hasZero(Type type) {
    return zeroTypes.contains(type);
  }

  public boolean hasOne(Type type) {
    return oneTypes.contains(type);
  }

  public boolean isRing(Type type) {
    return ringTypes.contains(type);
  }

  /** Returns the base type of numerals, or null if none is declared. */
  public @Nullable BaseType numeralType() {
    return numeralType;
  }

  /**
   * Returns whether numeral literals of a given type make sense: the type is
   * the numeral type, or the numeral type can be coerced to it.
   */
  public boolean hasNumerals(Type type) {
    return numeralType != null
        && (type.equals(numeralType) || coercionFn(numeralType, type) != null);
  }

  /**
   * Registers a coercion function that is a constant of type
   * "{@code source -> target}".
   */
  public CoercionFn coercion(String name, BaseType source, BaseType target) {
    return coercion(expr.constant(name, fnType(source, target)));
  }

  /**
   * Registers a coercion function.
   *
   * <p>The function must have type "{@code source -> target}" and must be a
   * constant, possibly applied to implicit arguments; for example "{@code
   * cast inst}" is a coercion function with one implicit argument.
   */
  public CoercionFn coercion(Expr.Exp fn) {
    checkArgument(fn.type instanceof FnType, "not a function: %s", fn);
    final FnType fnType = (FnType) fn.type;
    checkArgument(fnType.paramType instanceof BaseType
            && fnType.resultType instanceof BaseType,
        "coercion must be between base types: %s", fnType);
    final Expr.Exp head;
    final int implicitArgCount;
    if (fn.op == Op.APPLY) {
      head = ((Expr.Apply) fn).head();
      implicitArgCount = ((Expr.Apply) fn).argCount();
    } else {
      head = fn;
      implicitArgCount = 0;
    }
    checkArgument(head.op == Op.CONST, "head must be a constant: %s", fn);
    final String name = ((Expr.Const) head).name;
    final Integer previous = implicitArgCounts.put(name, implicitArgCount);
    checkArgument(previous == null || previous == implicitArgCount,
        "coercion %s has inconsistent implicit arguments", name);
    final BaseType source = (BaseType) fnType.paramType;
    final BaseType target = (BaseType) fnType.resultType;
    final CoercionFn coercionFn =
        new CoercionFn(name, fn, source, target, implicitArgCount);
    coercionFns.put(ImmutableList.of(source, target), coercionFn);
    return coercionFn;
  }

  /** Returns the coercion function from one type to another, or null. */
  public @Nullable CoercionFn coercionFn(Type source, Type target) {
    //noinspection SuspiciousMethodCalls
    return coercionFns.get(ImmutableList.of(source, target));
  }

  /** Returns all registered coercion functions, in order of registration. */
  public List<CoercionFn> coercionFns() {
    return ImmutableList.copyOf(coercionFns.values());
  }

  /**
   * If an expression is the application of a coercion function, returns the
   * coercion; otherwise returns null.
   *
   * <p>Leading implicit arguments are stripped: if "{@code cast}" is
   * registered with one implicit argument, then "{@code cast inst x}" is a
   * coercion of "{@code x}", and "{@code cast inst}" is not a coercion.
   */
  public @Nullable Coercion coercionOf(Expr.Exp exp) {
    if (exp.op != Op.APPLY) {
      return null;
    }
    final Expr.Apply apply = (Expr.Apply) exp;
    final Expr.Exp head = apply.head();
    if (head.op != Op.CONST) {
      return null;
    }
    final Integer implicitArgCount =
        implicitArgCounts.get(((Expr.Const) head).name);
    if (implicitArgCount == null
        || apply.argCount() != implicitArgCount + 1) {
      return null;
    }
    return new Coercion(apply);
  }

  /** Returns whether an expression is the application of a coercion. */
  public boolean isCoercion(Expr.Exp exp) {
    return coercionOf(exp) != null;
  }

  /**
   * Coerces an expression to a target type, or returns null if there is no
   * coercion from the expression's type to the target type.
   */
  public Expr.@Nullable Apply coerce(Expr.Exp exp, Type target) {
    final CoercionFn coercionFn = coercionFn(exp.type, target);
    return coercionFn == null ? null : coercionFn.apply(exp);
  }
}

// End TypeSystem.java
