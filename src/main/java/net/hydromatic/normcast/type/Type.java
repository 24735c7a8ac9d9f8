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

import java.util.Map;
import net.hydromatic.normcast.ast.Op;

/** Type. */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Returns a copy of this type with type variables replaced by the types
   * they map to, or this type if there is nothing to replace.
   */
  Type substitute(Map<String, Type> map);

  /** Returns whether this type contains a type variable. */
  default boolean isPolymorphic() {
    return false;
  }
}

// End Type.java
