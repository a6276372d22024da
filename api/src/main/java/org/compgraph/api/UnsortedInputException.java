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
 * Raised by reduce and join when input sortedness verification is enabled and a group key arrives out of order.
 *
 * @see Context.ExecutionContext#VERIFY_SORTED_INPUT
 * @since 1.0.0
 */
public class UnsortedInputException extends GraphExecutionException
{
  public UnsortedInputException(String node, Key previous, Key current)
  {
    super("Input of " + node + " is not sorted: key " + current + " follows " + previous);
  }

  private static final long serialVersionUID = 201910190015L;
}
