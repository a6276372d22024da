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
package org.compgraph.engine;

import java.io.Serializable;

import org.compgraph.api.Attribute;
import org.compgraph.api.Attribute.AttributeMap;
import org.compgraph.api.Attribute.AttributeMap.DefaultAttributeMap;
import org.compgraph.api.Context.ExecutionContext;

/**
 * Execution context holding its own attribute values. Unset attributes read as their defaults.
 *
 * @since 1.0.0
 */
public class DefaultExecutionContext implements ExecutionContext, Serializable
{
  private final AttributeMap attributes = new DefaultAttributeMap();

  /**
   * Sets an attribute, returning this context for chaining.
   */
  public <T> DefaultExecutionContext with(Attribute<T> key, T value)
  {
    attributes.put(key, value);
    return this;
  }

  @Override
  public AttributeMap getAttributes()
  {
    return attributes;
  }

  @Override
  public <T> T getValue(Attribute<T> key)
  {
    T value = attributes.get(key);
    return value == null ? key.getDefaultValue() : value;
  }

  @Override
  public String toString()
  {
    return "DefaultExecutionContext{" + "attributes=" + attributes + '}';
  }

  private static final long serialVersionUID = 201910190101L;
}
