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

/**
 * Classification of a rewrite rule by the way it moves coercions.
 *
 * @see Classifier#classify
 */
public enum Label {
  /**
   * Elimination rule: the left-hand side has no head coercion, and the
   * right-hand side has none either, but has fewer coercions inside; for
   * example "{@code intOfNat a < intOfNat b <-> a < b}".
   */
  ELIM,

  /**
   * Move rule: the left-hand side is a coercion of an operator application,
   * and the right-hand side pushes the coercion towards the leaves; for
   * example "{@code intOfNat (a + b) = intOfNat a + intOfNat b}".
   */
  MOVE,

  /**
   * Squash rule: the left-hand side has more head coercions than the
   * right-hand side, and the right-hand side has nothing else; for example
   * "{@code ratOfInt (intOfNat a) = ratOfNat a}".
   */
  SQUASH
}

// End Label.java
