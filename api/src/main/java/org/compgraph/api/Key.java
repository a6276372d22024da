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

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The tuple of key column values of a row, compared lexicographically by the {@link Value} order.
 * The empty key compares equal to itself, so a key-less reduce or join treats the whole stream as one group.
 *
 * @since 1.0.0
 */
public final class Key implements Comparable<Key>, Serializable
{
  public static final Key EMPTY = new Key(new Value[0]);

  private final Value[] values;

  private Key(Value[] values)
  {
    this.values = values;
  }

  public static Key of(Value... values)
  {
    return values.length == 0 ? EMPTY : new Key(values.clone());
  }

  public int size()
  {
    return values.length;
  }

  public Value get(int index)
  {
    return values[index];
  }

  public List<Value> getValues()
  {
    return ImmutableList.copyOf(values);
  }

  @Override
  public int compareTo(Key other)
  {
    int size = Math.min(values.length, other.values.length);
    for (int i = 0; i < size; i++) {
      int ret = values[i].compareTo(other.values[i]);
      if (ret != 0) {
        return ret;
      }
    }
    return Integer.compare(values.length, other.values.length);
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Key)) {
      return false;
    }
    return Arrays.equals(values, ((Key)obj).values);
  }

  @Override
  public int hashCode()
  {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString()
  {
    return Arrays.toString(values);
  }

  private static final long serialVersionUID = 201910190003L;
}
