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
 * A row reaching an operator lacks a column the operator needs. Raised at the point of first access.
 *
 * @since 1.0.0
 */
public class MissingColumnException extends GraphExecutionException
{
  private final String column;

  public MissingColumnException(String column, Row row)
  {
    super("Column \"" + column + "\" is missing in row " + row);
    this.column = column;
  }

  public String getColumn()
  {
    return column;
  }

  private static final long serialVersionUID = 201910190011L;
}
