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
package net.hydromatic.normcast.proof;

import net.hydromatic.normcast.compile.BuiltIn;

/** Relation that a certificate establishes between two expressions. */
public enum Relation {
  /** Equality, "{@code =}". */
  EQ(BuiltIn.EQ),

  /** Equivalence of propositions, "{@code <->}". */
  IFF(BuiltIn.IFF);

  public final BuiltIn builtIn;

  Relation(BuiltIn builtIn) {
    this.builtIn = builtIn;
  }

  /**
   * Returns the relation established by chaining two certificates. Equal
   * propositions are equivalent, so a chain that contains an equivalence is
   * an equivalence.
   */
  public Relation compose(Relation other) {
    return this == EQ && other == EQ ? EQ : IFF;
  }
}

// End Relation.java
