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

/**
 * Thrown by {@link NormCast#derive} when normalization leaves an expression
 * unchanged.
 *
 * <p>This is not a malfunction; the caller usually reports it to the user
 * and leaves the goal as it was.
 */
public class NoProgressException extends RuntimeException {
  public final Expr.Exp exp;

  public NoProgressException(Expr.Exp exp) {
    super("norm_cast failed to simplify " + exp);
    this.exp = requireNonNull(exp);
  }
}

// End NoProgressException.java
