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

import java.io.Closeable;
import java.util.Iterator;

/**
 * A lazily produced, ordered sequence of rows.
 * <p>
 * Streams are pulled with {@link #hasNext()}/{@link #next()}; no work is done until they are. A stream owns
 * the streams it reads from and closes them when it is closed. A stream releases its scoped resources, like
 * the scratch storage of an external sort, once it is exhausted or closed, whichever comes first. A consumer
 * that stops pulling early must close the stream; closing twice is harmless.
 *
 * @since 1.0.0
 */
public interface RowStream extends Iterator<Row>, Closeable
{
  @Override
  void close();

}
