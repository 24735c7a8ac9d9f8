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

/**
 * Sub-types of {@link Expr.Exp} and of {@link
 * net.hydromatic.normcast.type.Type}.
 */
public enum Op {
  // expressions
  VAR,
  CONST,
  APPLY,
  LAMBDA,
  PI,
  LET,
  LITERAL,
  /** Numeral metavariable; occurs in rule patterns, not in expressions. */
  NUM_VAR,

  // types
  BASE_TYPE,
  FUNCTION_TYPE,
  TY_VAR;

  /** Returns whether this is a binder, {@link #LAMBDA} or {@link #PI}. */
  public boolean isBinder() {
    return this == LAMBDA || this == PI;
  }
}

// End Op.java
