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

import org.compgraph.api.Attribute.AttributeMap;

/**
 * The base interface for the configuration context of a graph run.
 *
 * @since 1.0.0
 */
public interface Context
{
  /**
   * @return attributes explicitly set on this context
   */
  AttributeMap getAttributes();

  /**
   * Get the value of the attribute, falling back to the attribute's default value when it was not set.
   *
   * @param <T> type of the value stored against the attribute
   * @param key the attribute
   * @return the configured or the default value
   */
  <T> T getValue(Attribute<T> key);

  interface ExecutionContext extends Context
  {
    /**
     * Maximum number of rows an external sort holds in memory at once. Must be at least 1.
     */
    Attribute<Integer> SORT_CHUNK_SIZE = new Attribute<>(65536);
    /**
     * Maximum number of sorted runs merged at the same time. Passes over more runs first merge them into
     * fewer, larger spilled runs. Must be at least 2.
     */
    Attribute<Integer> SORT_MERGE_FAN_IN = new Attribute<>(64);
    /**
     * Parent directory under which every sort pass creates its private scratch directory.
     * The JVM temporary directory is used when unset.
     */
    Attribute<String> SPILL_DIRECTORY = new Attribute<>(StringCodec.String2String.getInstance());
    /**
     * When set, reduce and join fail with {@link UnsortedInputException} on input that is not sorted by their keys.
     */
    Attribute<Boolean> VERIFY_SORTED_INPUT = new Attribute<>(false);
    /**
     * Charset used to decode file sources.
     */
    Attribute<String> FILE_CHARSET = new Attribute<>("UTF-8");

    @SuppressWarnings("FieldNameHidesFieldInSuperclass")
    long serialVersionUID = AttributeMap.AttributeInitializer.initialize(ExecutionContext.class);
  }

}
