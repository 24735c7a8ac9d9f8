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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import net.hydromatic.normcast.ast.Op;

/**
 * Named type without parameters, such as "{@code nat}", "{@code int}" or the
 * type of propositions, {@link #PROP}.
 *
 * <p>Instances other than {@link #PROP} are created by {@link
 * TypeSystem#baseType(String)}.
 */
public class BaseType implements Type {
  /** The type of propositions. */
  public static final BaseType PROP = new BaseType("Prop");

  public final String name;

  BaseType(String name) {
    this.name = requireNonNull(name);
  }

  @Override
  public Op op() {
    return Op.BASE_TYPE;
  }

  @Override
  public Type substitute(Map<String, Type> map) {
    return this;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof BaseType && name.equals(((BaseType) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End BaseType.java
