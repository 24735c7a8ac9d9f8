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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Map;
import net.hydromatic.normcast.ast.Op;

/**
 * Type variable (e.g. {@code 'a}).
 *
 * <p>Type variables occur only in the patterns of polymorphic rules, such as
 * "{@code a > b <-> b < a}", and are bound when a pattern is matched.
 */
public class TypeVar implements Type {
  public final String name;

  /** Creates a type variable; the name must start with a quote. */
  public TypeVar(String name) {
    checkArgument(name.length() > 1 && name.charAt(0) == '\'',
        "type variable must start with quote: %s", name);
    this.name = name;
  }

  @Override
  public Op op() {
    return Op.TY_VAR;
  }

  @Override
  public Type substitute(Map<String, Type> map) {
    return map.getOrDefault(name, this);
  }

  @Override
  public boolean isPolymorphic() {
    return true;
  }

  @Override
  public int hashCode() {
    return name.hashCode() + 6563;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeVar && name.equals(((TypeVar) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End TypeVar.java
