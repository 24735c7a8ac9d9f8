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
package net.hydromatic.normcast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Main}. */
public class MainTest {
  private static final String REPORT = "rules: 64 (42 up, 43 down, "
      + "22 squash)\n"
      + "AGREE: 61\n"
      + "DISAGREE: 0\n"
      + "FIRST_FAILS: 3 [ge_iff_le, gt_iff_lt, ne_eq]\n"
      + "SECOND_FAILS: 0\n";

  private static String run(List<String> args) {
    final StringWriter sw = new StringWriter();
    new Main(args, sw).run();
    return sw.toString();
  }

  @Test
  void testRun() {
    assertThat(run(ImmutableList.of()), is(REPORT));
  }

  /**
   * Tests that the standard rules register without conflict even when
   * declared labels must agree with inferred labels.
   */
  @Test
  void testStrict() {
    assertThat(run(ImmutableList.of("--strict")), is(REPORT));
  }

  @Test
  void testTrace() {
    final String out = run(ImmutableList.of("--trace"));
    assertThat(out,
        startsWith("register intOfNat.cast_add [MOVE]: forall a : nat, "
            + "forall b : nat, "
            + "intOfNat (a + b) = intOfNat a + intOfNat b\n"));
    assertThat(out,
        containsString("built NormalizationCache(version 61: "
            + "up(42 rules), down(43 rules), squash(22 rules))\n"));
    assertThat(out, containsString(REPORT));
    assertThat(out, not(containsString("warning")));
  }

  @Test
  void testBadArgument() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> new Main(ImmutableList.of("--verbose"), new StringWriter()));
    assertThat(e.getMessage(), is("unknown argument --verbose"));
  }
}

// End MainTest.java
