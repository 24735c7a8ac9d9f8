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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.normcast.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.function.BiFunction;
import net.hydromatic.normcast.ast.Expr;
import net.hydromatic.normcast.type.BaseType;
import net.hydromatic.normcast.type.Type;
import net.hydromatic.normcast.type.TypeSystem;

/**
 * Built-in operators.
 *
 * <p>Each operator is a constant whose name is its {@link #opName}. Polymorphic
 * operators, such as "{@code +}" and "{@code <}", are instantiated with the
 * type of their operands; see {@link #constant(TypeSystem, Type)}.
 */
public enum BuiltIn {
  /** Infix operator "+", of type "&alpha; &rarr; &alpha; &rarr; &alpha;". */
  PLUS("+", Kind.ARITHMETIC, 6),

  /** Infix operator "-", of type "&alpha; &rarr; &alpha; &rarr; &alpha;". */
  MINUS("-", Kind.ARITHMETIC, 6),

  /** Infix operator "*", of type "&alpha; &rarr; &alpha; &rarr; &alpha;". */
  TIMES("*", Kind.ARITHMETIC, 7),

  /** Prefix operator "~", negation, of type "&alpha; &rarr; &alpha;". */
  NEGATE("~", Kind.UNARY, -1),

  /** Infix operator "<", of type "&alpha; &rarr; &alpha; &rarr; Prop". */
  LT("<", Kind.RELATION, 4),

  /** Infix operator "<=", of type "&alpha; &rarr; &alpha; &rarr; Prop". */
  LE("<=", Kind.RELATION, 4),

  /** Infix operator ">", of type "&alpha; &rarr; &alpha; &rarr; Prop". */
  GT(">", Kind.RELATION, 4),

  /** Infix operator ">=", of type "&alpha; &rarr; &alpha; &rarr; Prop". */
  GE(">=", Kind.RELATION, 4),

  /** Infix operator "=", of type "&alpha; &rarr; &alpha; &rarr; Prop". */
  EQ("=", Kind.RELATION, 4),

  /**
   * Infix operator "&lt;&gt;", of type "&alpha; &rarr; &alpha; &rarr; Prop".
   */
  NE("<>", Kind.RELATION, 4),

  /** Function "not", of type "Prop &rarr; Prop". */
  NOT("not", Kind.NEGATION, -1),

  /** Infix operator "&lt;-&gt;", of type "Prop &rarr; Prop &rarr; Prop". */
  IFF("<->", Kind.CONNECTIVE, 1),

  /**
   * Infix operator "-&gt;", implication, of type "Prop &rarr; Prop &rarr;
   * Prop". Right-associative.
   */
  IMPLIES("->", Kind.CONNECTIVE, -2);

  /** Name of the operator, and of the constant that implements it. */
  public final String opName;
  /** Number of arguments. */
  public final int arity;
  /** Left precedence, if infix. */
  public final int left;
  /** Right precedence, if infix. */
  public final int right;
  public final Kind kind;

  /** Map of all operators, keyed by {@link #opName}. */
  public static final ImmutableMap<String, BuiltIn> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.opName, builtIn);
    }
    BY_OP_NAME = b.build();
  }

  /**
   * Creates a BuiltIn.
   *
   * <p>Precedence {@code p >= 0} makes a left-associative infix operator,
   * {@code p < -1} a right-associative infix operator of precedence {@code
   * -p - 2}, and {@code -1} a prefix function.
   */
  BuiltIn(String opName, Kind kind, int precedence) {
    this.opName = requireNonNull(opName);
    this.kind = requireNonNull(kind);
    this.arity = kind.arity;
    if (precedence >= 0) {
      this.left = precedence * 2;
      this.right = precedence * 2 + 1;
    } else if (precedence < -1) {
      final int p = -precedence - 2;
      this.left = p * 2 + 1;
      this.right = p * 2;
    } else {
      this.left = -1;
      this.right = -1;
    }
    checkArgument(precedence == -1 || arity == 2,
        "infix operator must be binary: %s", opName);
  }

  /** Returns whether this operator is written between its two arguments. */
  public boolean isInfix() {
    return left >= 0;
  }

  /** Returns whether this operator is a relation between two values. */
  public boolean isRelation() {
    return kind == Kind.RELATION;
  }

  /**
   * Returns the constant that implements this operator.
   *
   * @param typeSystem Type system
   * @param typeArg    Type of the operands; ignored if the operator is not
   *                   polymorphic
   */
  public Expr.Const constant(TypeSystem typeSystem, Type typeArg) {
    if (kind.polymorphic) {
      return expr.constant(opName, ImmutableList.of(typeArg),
          kind.typeFunction.apply(typeSystem, typeArg));
    }
    return expr.constant(opName,
        kind.typeFunction.apply(typeSystem, BaseType.PROP));
  }

  /** Shape of the type of an operator. */
  public enum Kind {
    /** "&alpha; &rarr; &alpha; &rarr; &alpha;". */
    ARITHMETIC(2, true, (ts, t) -> ts.fnType(t, t, t)),
    /** "&alpha; &rarr; &alpha;". */
    UNARY(1, true, (ts, t) -> ts.fnType(t, t)),
    /** "&alpha; &rarr; &alpha; &rarr; Prop". */
    RELATION(2, true, (ts, t) -> ts.fnType(t, t, BaseType.PROP)),
    /** "Prop &rarr; Prop &rarr; Prop". */
    CONNECTIVE(2, false, (ts, t) -> ts.fnType(t, t, t)),
    /** "Prop &rarr; Prop". */
    NEGATION(1, false, (ts, t) -> ts.fnType(t, t));

    final int arity;
    final boolean polymorphic;
    final BiFunction<TypeSystem, Type, Type> typeFunction;

    Kind(int arity, boolean polymorphic,
        BiFunction<TypeSystem, Type, Type> typeFunction) {
      this.arity = arity;
      this.polymorphic = polymorphic;
      this.typeFunction = typeFunction;
    }
  }
}

// End BuiltIn.java
