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
 * Function that assigns a label to a rewrite rule.
 *
 * <p>Throws {@link RuleException} if it cannot classify the rule.
 *
 * @see ClassifierComparison
 */
@FunctionalInterface
public interface ClassifierFunction {
  Label classify(RewriteRule rule);

  /** Returns a function that returns each rule's registered label. */
  static ClassifierFunction declared() {
    return rule -> rule.label;
  }
}

// End ClassifierFunction.java
