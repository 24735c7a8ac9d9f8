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

/**
 * The tower of numeric types: natural numbers, integers, rationals and reals,
 * with a coercion from each type to every type above it.
 *
 * <p>Coercion functions are named after their source and target, for example
 * "{@code ratOfInt}" embeds integers into rationals.
 */
public class NumericTower {
  public final TypeSystem typeSystem;
  public final BaseType natType;
  public final BaseType intType;
  public final BaseType ratType;
  public final BaseType realType;

  public final CoercionFn intOfNat;
  public final CoercionFn ratOfNat;
  public final CoercionFn realOfNat;
  public final CoercionFn ratOfInt;
  public final CoercionFn realOfInt;
  public final CoercionFn realOfRat;

  private NumericTower(TypeSystem typeSystem) {
    this.typeSystem = typeSystem;
    natType = typeSystem.baseType("nat");
    intType = typeSystem.baseType("int");
    ratType = typeSystem.baseType("rat");
    realType = typeSystem.baseType("real");
    typeSystem.declareNumeralType(natType);
    for (BaseType type : new BaseType[] {natType, intType, ratType, realType}) {
      typeSystem.declareZero(type).declareOne(type);
      if (type != natType) {
        typeSystem.declareRing(type);
      }
    }
    intOfNat = typeSystem.coercion("intOfNat", natType, intType);
    ratOfNat = typeSystem.coercion("ratOfNat", natType, ratType);
    realOfNat = typeSystem.coercion("realOfNat", natType, realType);
    ratOfInt = typeSystem.coercion("ratOfInt", intType, ratType);
    realOfInt = typeSystem.coercion("realOfInt", intType, realType);
    realOfRat = typeSystem.coercion("realOfRat", ratType, realType);
  }

  /** Creates a numeric tower in a new type system. */
  public static NumericTower create() {
    return new NumericTower(new TypeSystem());
  }
}

// End NumericTower.java
