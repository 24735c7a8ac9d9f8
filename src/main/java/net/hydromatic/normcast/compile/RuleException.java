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

import org.checkerframework.checker.nullness.qual.Nullable;

/** An error occurred while classifying or registering a rewrite rule. */
public class RuleException extends RuntimeException {
  public final Kind kind;
  /**
   * Name of the rule, or null if the error was found before the rule was
   * named, for example while classifying a bare equation.
   */
  public final @Nullable String ruleName;

  public RuleException(Kind kind, @Nullable String ruleName, String message) {
    super(message);
    this.kind = requireNonNull(kind);
    this.ruleName = ruleName;
  }

  /** Returns a copy of this exception, attributed to a given rule. */
  public RuleException withRuleName(String ruleName) {
    return ruleName.equals(this.ruleName)
        ? this
        : new RuleException(kind, ruleName, requireNonNull(getMessage()));
  }

  @Override
  public String toString() {
    return ruleName == null
        ? super.toString()
        : super.toString() + " in rule " + ruleName;
  }

  /** Kinds of rule error. */
  public enum Kind {
    /** The rule does not have a shape that moves coercions. */
    BAD_SHAPE,
    /** The rule was declared with a label that contradicts another label. */
    CONFLICTING_LABEL
  }
}

// End RuleException.java
