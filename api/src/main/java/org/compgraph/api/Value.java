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
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Booleans;

/**
 * A single cell of a {@link Row}: a closed tagged union over the payload kinds the engine knows how to
 * order and spill.
 * <p>
 * Values are totally ordered. The order first compares the rank of the kind
 * ({@code NULL < BOOLEAN < numbers < TEXT < LIST}), then the payload. INTEGER and FLOAT share a rank and
 * are compared numerically; when an INTEGER and a FLOAT are numerically equal the INTEGER sorts first, so
 * {@link #compareTo(Value)} returns zero exactly when {@link #equals(Object)} is true. Among floats
 * {@code -0.0} sorts before {@code 0.0} and {@code NaN} sorts after every other number.
 *
 * @since 1.0.0
 */
public final class Value implements Comparable<Value>, Serializable
{
  public enum Kind
  {
    NULL(0), BOOLEAN(1), INTEGER(2), FLOAT(2), TEXT(3), LIST(4);

    private final int rank;

    Kind(int rank)
    {
      this.rank = rank;
    }

    public boolean isNumeric()
    {
      return rank == 2;
    }
  }

  public static final Value NULL = new Value(Kind.NULL, null);
  public static final Value TRUE = new Value(Kind.BOOLEAN, Boolean.TRUE);
  public static final Value FALSE = new Value(Kind.BOOLEAN, Boolean.FALSE);

  private final Kind kind;
  private final Object payload;

  private Value(Kind kind, Object payload)
  {
    this.kind = kind;
    this.payload = payload;
  }

  public static Value of(String text)
  {
    return text == null ? NULL : new Value(Kind.TEXT, text);
  }

  public static Value of(long number)
  {
    return new Value(Kind.INTEGER, number);
  }

  public static Value of(double number)
  {
    return new Value(Kind.FLOAT, number);
  }

  public static Value of(boolean flag)
  {
    return flag ? TRUE : FALSE;
  }

  public static Value of(List<Value> elements)
  {
    return elements == null ? NULL : new Value(Kind.LIST, ImmutableList.copyOf(elements));
  }

  public static Value list(Value... elements)
  {
    return new Value(Kind.LIST, ImmutableList.copyOf(elements));
  }

  /**
   * Adapts a plain Java object. Integral boxes become INTEGER, floating point boxes become FLOAT,
   * collections become LIST (element by element) and a Value is returned as is.
   *
   * @param object object to adapt, may be null
   * @return the adapted value
   * @throws IllegalArgumentException if the object has no Value representation
   */
  public static Value from(Object object)
  {
    if (object == null) {
      return NULL;
    } else if (object instanceof Value) {
      return (Value)object;
    } else if (object instanceof String) {
      return of((String)object);
    } else if (object instanceof Long || object instanceof Integer || object instanceof Short || object instanceof Byte) {
      return of(((Number)object).longValue());
    } else if (object instanceof Double || object instanceof Float) {
      return of(((Number)object).doubleValue());
    } else if (object instanceof Boolean) {
      return of(((Boolean)object).booleanValue());
    } else if (object instanceof Collection) {
      List<Value> elements = new ArrayList<>(((Collection<?>)object).size());
      for (Object element : (Collection<?>)object) {
        elements.add(from(element));
      }
      return of(elements);
    } else if (object instanceof Object[]) {
      List<Value> elements = new ArrayList<>();
      for (Object element : (Object[])object) {
        elements.add(from(element));
      }
      return of(elements);
    }
    throw new IllegalArgumentException("No value representation for " + object.getClass().getName());
  }

  public Kind getKind()
  {
    return kind;
  }

  public boolean isNull()
  {
    return kind == Kind.NULL;
  }

  public String asText()
  {
    return (String)expect(Kind.TEXT);
  }

  public long asLong()
  {
    return (Long)expect(Kind.INTEGER);
  }

  /**
   * @return the numeric payload as a double, widening INTEGER values
   */
  public double asDouble()
  {
    if (kind == Kind.INTEGER) {
      return (Long)payload;
    }
    return (Double)expect(Kind.FLOAT);
  }

  public boolean asBoolean()
  {
    return (Boolean)expect(Kind.BOOLEAN);
  }

  @SuppressWarnings("unchecked")
  public List<Value> asList()
  {
    return (List<Value>)expect(Kind.LIST);
  }

  /**
   * @return the payload as a plain Java object (String, Long, Double, Boolean, List of Java objects or null)
   */
  public Object toJava()
  {
    if (kind != Kind.LIST) {
      return payload;
    }
    List<Object> objects = new ArrayList<>();
    for (Value element : asList()) {
      objects.add(element.toJava());
    }
    return Collections.unmodifiableList(objects);
  }

  private Object expect(Kind expected)
  {
    if (kind != expected) {
      throw new IllegalStateException("Value " + this + " of kind " + kind + " is not " + expected);
    }
    return payload;
  }

  @Override
  public int compareTo(Value other)
  {
    if (kind.rank != other.kind.rank) {
      return Integer.compare(kind.rank, other.kind.rank);
    }

    switch (kind) {
      case NULL:
        return 0;
      case BOOLEAN:
        return Booleans.compare((Boolean)payload, (Boolean)other.payload);
      case TEXT:
        return ((String)payload).compareTo((String)other.payload);
      case LIST:
        return compareLists(asList(), other.asList());
      default:
        int ret = compareNumbers(this, other);
        if (ret == 0) {
          ret = Integer.compare(kind.ordinal(), other.kind.ordinal());
        }
        return ret;
    }
  }

  private static int compareLists(List<Value> left, List<Value> right)
  {
    int size = Math.min(left.size(), right.size());
    for (int i = 0; i < size; i++) {
      int ret = left.get(i).compareTo(right.get(i));
      if (ret != 0) {
        return ret;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  private static int compareNumbers(Value left, Value right)
  {
    if (left.kind == Kind.INTEGER && right.kind == Kind.INTEGER) {
      return Long.compare((Long)left.payload, (Long)right.payload);
    }
    if (left.kind == Kind.FLOAT && right.kind == Kind.FLOAT) {
      return Double.compare((Double)left.payload, (Double)right.payload);
    }
    if (left.kind == Kind.INTEGER) {
      return -compareFloatToLong((Double)right.payload, (Long)left.payload);
    }
    return compareFloatToLong((Double)left.payload, (Long)right.payload);
  }

  /* exact comparison; a long does not always fit into a double */
  private static int compareFloatToLong(double d, long l)
  {
    if (Double.isNaN(d) || d == Double.POSITIVE_INFINITY) {
      return 1;
    }
    if (d == Double.NEGATIVE_INFINITY) {
      return -1;
    }
    return new BigDecimal(d).compareTo(BigDecimal.valueOf(l));
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Value)) {
      return false;
    }
    final Value other = (Value)obj;
    return kind == other.kind && compareTo(other) == 0;
  }

  @Override
  public int hashCode()
  {
    int hash = 7;
    hash = 41 * hash + kind.hashCode();
    hash = 41 * hash + (payload != null ? payload.hashCode() : 0);
    return hash;
  }

  @Override
  public String toString()
  {
    switch (kind) {
      case NULL:
        return "null";
      case TEXT:
        return '"' + (String)payload + '"';
      default:
        return String.valueOf(payload);
    }
  }

  private static final long serialVersionUID = 201910190001L;
}
