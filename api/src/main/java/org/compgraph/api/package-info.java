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
/**
 * Data model and operator contracts of computation graphs.<p>
 * <br>
 * A graph pulls {@link org.compgraph.api.Row}s through a chain of operators:<br>
 * - {@link org.compgraph.api.Mapper} transforms one row into zero or more rows<br>
 * - {@link org.compgraph.api.Reducer} aggregates each group of equal-key rows of a sorted stream<br>
 * - {@link org.compgraph.api.Folder} accumulates the whole stream into one row<br>
 * - {@link org.compgraph.api.Joiner} combines the equal-key groups of two sorted streams<br>
 * <br>
 * Configuration of a run is expressed with {@link org.compgraph.api.Attribute}s of
 * {@link org.compgraph.api.Context.ExecutionContext}.
 */
package org.compgraph.api;
