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
package org.compgraph.api;

/**
 * Decides for which keys a {@link Joiner} gets invoked during a sorted merge-join.
 *
 * @since 1.0.0
 */
public enum JoinMode
{
  /**
   * Only keys present on both sides.
   */
  INNER(false, false),
  /**
   * All keys of the left side; the right group is empty when the key is absent on the right.
   */
  LEFT(true, false),
  /**
   * All keys of the right side; the left group is empty when the key is absent on the left.
   */
  RIGHT(false, true),
  /**
   * The union of the keys of both sides.
   */
  OUTER(true, true);

  private final boolean leftOnlyKeys;
  private final boolean rightOnlyKeys;

  JoinMode(boolean leftOnlyKeys, boolean rightOnlyKeys)
  {
    this.leftOnlyKeys = leftOnlyKeys;
    this.rightOnlyKeys = rightOnlyKeys;
  }

  public boolean includesLeftOnlyKeys()
  {
    return leftOnlyKeys;
  }

  public boolean includesRightOnlyKeys()
  {
    return rightOnlyKeys;
  }
}
