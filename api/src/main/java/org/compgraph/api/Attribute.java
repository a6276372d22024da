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
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * Typed setting of a graph run with a default value and the codec that reads it from properties.
 * <p>
 * Attributes are declared as static fields of a context interface that calls
 * {@link AttributeMap.AttributeInitializer#initialize(Class)} from its last field. The initializer names every
 * attribute after its declaring interface and field, and derives the codec from the default value when the
 * declaration gave none.
 *
 * @param <T> type of the value
 * @since 1.0.0
 */
public class Attribute<T> implements Serializable
{
  public static final String PREFIX = "compgraph.attr.";

  private final T defaultValue;
  private String name;
  private StringCodec<T> codec;

  public Attribute(T defaultValue)
  {
    this.defaultValue = defaultValue;
  }

  /**
   * For attributes without a default value.
   */
  public Attribute(StringCodec<T> codec)
  {
    this.defaultValue = null;
    this.codec = codec;
  }

  public T getDefaultValue()
  {
    return defaultValue;
  }

  /**
   * @return qualified name, e.g. {@code org.compgraph.api.Context.ExecutionContext.SORT_CHUNK_SIZE}; null until
   * the declaring interface is initialized
   */
  public String getName()
  {
    return name;
  }

  public String getSimpleName()
  {
    return name.substring(name.lastIndexOf('.') + 1);
  }

  /**
   * @return the property key, e.g. {@code compgraph.attr.sort.chunk.size} for SORT_CHUNK_SIZE
   */
  public String getLongName()
  {
    return PREFIX + getSimpleName().replace('_', '.').toLowerCase(Locale.ROOT);
  }

  /**
   * @param text property value
   * @return the decoded value
   * @throws IllegalArgumentException if the text is not a valid value of this attribute
   */
  public T parse(String text)
  {
    Preconditions.checkState(codec != null, "No codec for %s", name);
    return codec.fromString(text);
  }

  @SuppressWarnings("unchecked")
  private void bind(String name)
  {
    this.name = name;
    if (codec == null && defaultValue != null) {
      codec = (StringCodec<T>)StringCodec.Factory.getInstance(defaultValue.getClass());
    }
  }

  @Override
  public boolean equals(Object obj)
  {
    return obj instanceof Attribute && name != null && name.equals(((Attribute<?>)obj).name);
  }

  @Override
  public int hashCode()
  {
    return name == null ? 0 : name.hashCode();
  }

  @Override
  public String toString()
  {
    return name == null ? "Attribute{" + defaultValue + '}' : getSimpleName();
  }

  private static final long serialVersionUID = 201910190020L;

  /**
   * Attribute values explicitly set on a context.
   */
  public interface AttributeMap
  {
    /**
     * @return the value set for the attribute, or null
     */
    <T> T get(Attribute<T> key);

    /**
     * @return the value previously set for the attribute, or null
     */
    <T> T put(Attribute<T> key, T value);

    class DefaultAttributeMap implements AttributeMap, Serializable
    {
      private final HashMap<Attribute<?>, Object> values = new HashMap<>();

      @Override
      @SuppressWarnings("unchecked")
      public <T> T get(Attribute<T> key)
      {
        return (T)values.get(key);
      }

      @Override
      @SuppressWarnings("unchecked")
      public <T> T put(Attribute<T> key, T value)
      {
        return (T)values.put(Preconditions.checkNotNull(key, "key"), value);
      }

      @Override
      public String toString()
      {
        return values.toString();
      }

      private static final long serialVersionUID = 201910190021L;
    }

    /**
     * Binds the static attributes of context interfaces to their names.
     */
    class AttributeInitializer
    {
      private static final Map<Class<?>, Set<Attribute<Object>>> declared = Maps.newHashMap();

      private AttributeInitializer()
      {
      }

      /**
       * @return attributes declared by the class in declaration order, empty if it was not initialized
       */
      public static synchronized Set<Attribute<Object>> getAttributes(Class<?> clazz)
      {
        Set<Attribute<Object>> attributes = declared.get(clazz);
        return attributes == null ? ImmutableSet.<Attribute<Object>>of() : attributes;
      }

      /**
       * @param clazz class declaring attributes as static fields
       * @return a value for the serialVersionUID field of the declaring interface
       */
      @SuppressWarnings("unchecked")
      public static synchronized long initialize(Class<?> clazz)
      {
        ImmutableSet.Builder<Attribute<Object>> attributes = ImmutableSet.builder();
        for (Field field : clazz.getDeclaredFields()) {
          if (!Modifier.isStatic(field.getModifiers()) || !Attribute.class.isAssignableFrom(field.getType())) {
            continue;
          }
          Attribute<Object> attribute;
          try {
            attribute = (Attribute<Object>)field.get(null);
          } catch (IllegalAccessException ex) {
            throw new IllegalStateException("Cannot read attribute " + field, ex);
          }
          if (attribute.name == null) {
            attribute.bind(clazz.getCanonicalName() + '.' + field.getName());
          }
          attributes.add(attribute);
        }
        declared.put(clazz, attributes.build());
        return clazz.getCanonicalName().hashCode();
      }
    }
  }

}
