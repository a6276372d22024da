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
 * A {@link LineParser} could not turn raw input into a well formed row. The engine never swallows it.
 *
 * @since 1.0.0
 */
public class MalformedInputException extends GraphExecutionException
{
  private final String line;

  public MalformedInputException(String message, String line)
  {
    super(message);
    this.line = line;
  }

  public MalformedInputException(String message, String line, Throwable cause)
  {
    super(message, cause);
    this.line = line;
  }

  /**
   * @return the raw input that failed to parse
   */
  public String getLine()
  {
    return line;
  }

  private static final long serialVersionUID = 201910190013L;
}
