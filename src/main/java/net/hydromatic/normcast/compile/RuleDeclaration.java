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

import net.hydromatic.normcast.ast.Expr;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declaration of a rewrite rule: a name, a statement, and optionally a label
 * that overrides the label inferred from the statement's shape.
 *
 * @see RuleRegistry#registerAll
 */
public class RuleDeclaration {
  public final String name;
  public final Expr.Exp exp;
  public final @Nullable Label label;

  public RuleDeclaration(String name, Expr.Exp exp, @Nullable Label label) {
    this.name = requireNonNull(name);
    this.exp = requireNonNull(exp);
    this.label = label;
  }

  @Override
  public String toString() {
    return name + (label == null ? "" : " [" + label + "]") + ": " + exp;
  }
}

// End RuleDeclaration.java
