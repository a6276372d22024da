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
package org.compgraph.engine.sort;

import java.io.File;

import org.compgraph.api.Row;
import org.compgraph.engine.codec.RowCodec;

/**
 * A sorted run written to a file of the spill scope.
 *
 * @since 1.0.0
 */
class SpilledRun implements SortedRun
{
  private final SpillScope scope;
  private final File file;
  private final long count;

  SpilledRun(SpillScope scope, File file, long count)
  {
    this.scope = scope;
    this.file = file;
    this.count = count;
  }

  /**
   * Writes the rows to a new file of the scope.
   */
  static SpilledRun write(SpillScope scope, Iterable<Row> rows)
  {
    File file = scope.newRunFile();
    RowCodec.Writer writer = scope.getCodec().openWriter(file);
    try {
      for (Row row : rows) {
        writer.write(row);
      }
    } finally {
      writer.close();
    }
    return new SpilledRun(scope, file, writer.getCount());
  }

  static SpilledRun write(SpillScope scope, SortedRun.Cursor cursor)
  {
    File file = scope.newRunFile();
    RowCodec.Writer writer = scope.getCodec().openWriter(file);
    try {
      for (Row row = cursor.read(); row != null; row = cursor.read()) {
        writer.write(row);
      }
    } finally {
      writer.close();
    }
    return new SpilledRun(scope, file, writer.getCount());
  }

  File getFile()
  {
    return file;
  }

  @Override
  public long size()
  {
    return count;
  }

  @Override
  public Cursor open()
  {
    final RowCodec.Reader reader = scope.getCodec().openReader(file, count);
    return new Cursor()
    {
      @Override
      public Row read()
      {
        return reader.read();
      }

      @Override
      public void close()
      {
        reader.close();
      }
    };
  }

  @Override
  public void discard()
  {
    scope.delete(file);
  }

  @Override
  public String toString()
  {
    return "SpilledRun{" + "file=" + file.getName() + ", rows=" + count + '}';
  }
}
