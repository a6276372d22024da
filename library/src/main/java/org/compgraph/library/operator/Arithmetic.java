/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.compgraph.library.operator;

import org.compgraph.api.Value;

/**
 * Arithmetic over numeric values: INTEGER op INTEGER stays INTEGER, anything involving a FLOAT is FLOAT.
 */
final class Arithmetic
{
  static final Value ZERO = Value.of(0);
  static final Value ONE = Value.of(1);

  private Arithmetic()
  {
  }

  static Value add(Value left, Value right)
  {
    if (isInteger(left, right)) {
      return Value.of(Math.addExact(left.asLong(), right.asLong()));
    }
    return Value.of(left.asDouble() + right.asDouble());
  }

  static Value multiply(Value left, Value right)
  {
    if (isInteger(left, right)) {
      return Value.of(Math.multiplyExact(left.asLong(), right.asLong()));
    }
    return Value.of(left.asDouble() * right.asDouble());
  }

  private static boolean isInteger(Value left, Value right)
  {
    return left.getKind() == Value.Kind.INTEGER && right.getKind() == Value.Kind.INTEGER;
  }
}
