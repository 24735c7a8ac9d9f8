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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.normcast.Tower;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeSystem}. */
public class TypeSystemTest {
  final Tower t = new Tower();

  @Test
  void testLookup() {
    assertThat(t.typeSystem.lookup("int"), is(t.intType));
    assertThat(t.typeSystem.lookup("real"), is(t.realType));
    assertThat(t.typeSystem.lookup("Prop"), is(BaseType.PROP));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> t.typeSystem.lookup("complex"));
    assertThat(e.getMessage(), is("type complex not found"));

    // baseType creates a type, or returns the one already there
    final TypeSystem typeSystem = new TypeSystem();
    final BaseType complexType = typeSystem.baseType("complex");
    assertThat(typeSystem.baseType("complex"), is(complexType));
    assertThat(typeSystem.lookup("complex"), is(complexType));
  }

  /** Tests that function types are curried and print right-associatively. */
  @Test
  void testFnType() {
    final TypeSystem ts = t.typeSystem;
    final FnType f = ts.fnType(t.natType, t.intType, t.ratType);
    assertThat(f, hasToString("nat -> int -> rat"));
    assertThat(f, is(ts.fnType(t.natType, ts.fnType(t.intType, t.ratType))));
    assertThat(f.paramType, is(t.natType));

    final FnType g = ts.fnType(ts.fnType(t.natType, t.intType), t.ratType);
    assertThat(g, hasToString("(nat -> int) -> rat"));
    assertThat(g.equals(f), is(false));

    assertThat(ts.fnType(t.natType, t.intType, t.ratType, t.realType),
        hasToString("nat -> int -> rat -> real"));
  }

  @Test
  void testCoercions() {
    final TypeSystem ts = t.typeSystem;
    assertThat(ts.coercionFn(t.natType, t.realType),
        hasToString("realOfNat: nat -> real"));
    assertThat(ts.coercionFn(t.realType, t.natType), nullValue());
    assertThat(ts.coerce(t.var("x", t.ratType), t.realType),
        hasToString("realOfRat x"));
    assertThat(ts.coerce(t.var("x", t.realType), t.ratType), nullValue());
    assertThat(ts.hasNumerals(t.realType), is(true));
    assertThat(ts.hasNumerals(BaseType.PROP), is(false));
  }
}

// End TypeSystemTest.java
