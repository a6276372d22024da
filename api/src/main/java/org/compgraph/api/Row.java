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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * An immutable record mapping column names to {@link Value}s.
 * <p>
 * Column order is the insertion order and is kept by every derivation method, so that output formatting is
 * deterministic. Equality ignores the column order. Operators never mutate a row; they derive new ones with
 * {@link #with(String, Value)}, {@link #without(String...)}, {@link #project(List)} or {@link #toBuilder()}.
 *
 * @since 1.0.0
 */
public final class Row implements Serializable
{
  public static final Row EMPTY = new Row(ImmutableMap.<String, Value>of());

  private final ImmutableMap<String, Value> columns;

  private Row(ImmutableMap<String, Value> columns)
  {
    this.columns = columns;
  }

  /**
   * Creates a row from alternating column names and values; values are adapted with {@link Value#from(Object)}.
   *
   * @param namesAndValues name1, value1, name2, value2, ...
   * @return the row
   */
  public static Row of(Object... namesAndValues)
  {
    Preconditions.checkArgument(namesAndValues.length % 2 == 0, "Expected name/value pairs but got %s arguments",
        namesAndValues.length);
    Builder builder = builder();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      builder.put((String)namesAndValues[i], namesAndValues[i + 1]);
    }
    return builder.build();
  }

  public static Row fromMap(Map<String, ?> map)
  {
    Builder builder = builder();
    for (Map.Entry<String, ?> entry : map.entrySet()) {
      builder.put(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  public static Builder builder()
  {
    return new Builder();
  }

  /**
   * @param column column name
   * @return the value stored under the column
   * @throws MissingColumnException if the row has no such column
   */
  public Value get(String column)
  {
    Value value = columns.get(column);
    if (value == null) {
      throw new MissingColumnException(column, this);
    }
    return value;
  }

  public boolean contains(String column)
  {
    return columns.containsKey(column);
  }

  public String getText(String column)
  {
    return get(column).asText();
  }

  public long getLong(String column)
  {
    return get(column).asLong();
  }

  public double getDouble(String column)
  {
    return get(column).asDouble();
  }

  public boolean getBoolean(String column)
  {
    return get(column).asBoolean();
  }

  public Set<String> getColumns()
  {
    return columns.keySet();
  }

  public int size()
  {
    return columns.size();
  }

  public Map<String, Value> asMap()
  {
    return columns;
  }

  /**
   * Extracts the values of the given columns in order.
   *
   * @param keyColumns ordered key column names
   * @return the key of this row
   * @throws MissingColumnException if one of the columns is absent
   */
  public Key key(List<String> keyColumns)
  {
    Value[] values = new Value[keyColumns.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = get(keyColumns.get(i));
    }
    return Key.of(values);
  }

  public Row with(String column, Value value)
  {
    return toBuilder().put(column, value).build();
  }

  public Row with(String column, Object value)
  {
    return with(column, Value.from(value));
  }

  public Row without(String... removed)
  {
    Builder builder = toBuilder();
    for (String column : removed) {
      builder.remove(column);
    }
    return builder.build();
  }

  /**
   * @param projected columns to keep, in output order
   * @return a row holding only the projected columns
   * @throws MissingColumnException if one of the columns is absent
   */
  public Row project(Collection<String> projected)
  {
    Builder builder = builder();
    for (String column : projected) {
      builder.put(column, get(column));
    }
    return builder.build();
  }

  public Row rename(String from, String to)
  {
    Builder builder = builder();
    for (Map.Entry<String, Value> entry : columns.entrySet()) {
      builder.put(entry.getKey().equals(from) ? to : entry.getKey(), entry.getValue());
    }
    if (!columns.containsKey(from)) {
      throw new MissingColumnException(from, this);
    }
    return builder.build();
  }

  public Builder toBuilder()
  {
    return new Builder().putAll(this);
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Row)) {
      return false;
    }
    return columns.equals(((Row)obj).columns);
  }

  @Override
  public int hashCode()
  {
    return columns.hashCode();
  }

  @Override
  public String toString()
  {
    return "{" + Joiner.on(", ").withKeyValueSeparator("=").join(columns) + "}";
  }

  /**
   * Accumulates columns for a new row. Putting an existing column replaces its value in place.
   */
  public static final class Builder
  {
    private final LinkedHashMap<String, Value> columns = new LinkedHashMap<>();

    private Builder()
    {
    }

    public Builder put(String column, Value value)
    {
      columns.put(Preconditions.checkNotNull(column, "column"), value == null ? Value.NULL : value);
      return this;
    }

    public Builder put(String column, Object value)
    {
      return put(column, Value.from(value));
    }

    public Builder putAll(Row row)
    {
      columns.putAll(row.columns);
      return this;
    }

    public Builder remove(String column)
    {
      columns.remove(column);
      return this;
    }

    public boolean contains(String column)
    {
      return columns.containsKey(column);
    }

    public Row build()
    {
      return columns.isEmpty() ? EMPTY : new Row(ImmutableMap.copyOf(columns));
    }
  }

  private static final long serialVersionUID = 201910190002L;
}
