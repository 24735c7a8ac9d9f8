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

import net.hydromatic.normcast.ast.Expr;

/**
 * Solver for the side conditions of conditional rewrite rules.
 *
 * <p>When a rule such as "{@code b <= a -> intOfNat (a - b) = intOfNat a -
 * intOfNat b}" matches, its instantiated hypothesis is passed to the
 * discharger; if the discharger fails, the rule is skipped.
 *
 * @see Dischargers
 */
@FunctionalInterface
public interface Discharger {
  /** Attempts to prove a side condition; returns whether it succeeded. */
  boolean attempt(Expr.Exp sideCondition);
}

// End Discharger.java
