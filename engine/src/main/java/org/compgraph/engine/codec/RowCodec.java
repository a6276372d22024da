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
package org.compgraph.engine.codec;

import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import org.compgraph.api.ResourceException;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Kryo based codec of the files a sort pass spills rows to. An instance is not thread safe; every sort
 * pass creates its own.
 *
 * @since 1.0.0
 */
public class RowCodec
{
  public static final int BUFFER_SIZE = 64 * 1024;
  private final Kryo kryo;

  public RowCodec()
  {
    kryo = new Kryo();
    kryo.setReferences(false);
    kryo.register(Row.class, new RowSerializer());
    kryo.register(Value.class, new ValueSerializer());
  }

  public Writer openWriter(File file)
  {
    try {
      return new Writer(file, new Output(new FileOutputStream(file), BUFFER_SIZE));
    } catch (IOException ex) {
      throw new ResourceException("Cannot create spill file " + file, ex);
    }
  }

  public Reader openReader(File file, long count)
  {
    try {
      return new Reader(file, new Input(new FileInputStream(file), BUFFER_SIZE), count);
    } catch (IOException ex) {
      throw new ResourceException("Cannot open spill file " + file, ex);
    }
  }

  /**
   * Appends rows to a spill file.
   */
  public class Writer implements Closeable
  {
    private final File file;
    private final Output output;
    private long count;

    Writer(File file, Output output)
    {
      this.file = file;
      this.output = output;
    }

    public void write(Row row)
    {
      try {
        kryo.writeObject(output, row);
      } catch (KryoException ex) {
        throw new ResourceException("Cannot write spill file " + file, asIOException(ex));
      }
      count++;
    }

    public long getCount()
    {
      return count;
    }

    @Override
    public void close()
    {
      try {
        output.close();
      } catch (KryoException ex) {
        throw new ResourceException("Cannot write spill file " + file, asIOException(ex));
      }
    }
  }

  /**
   * Reads back the given number of rows from a spill file.
   */
  public class Reader implements Closeable
  {
    private final File file;
    private final Input input;
    private long remaining;

    Reader(File file, Input input, long count)
    {
      this.file = file;
      this.input = input;
      this.remaining = count;
    }

    /**
     * @return the next row or null after the last one
     */
    public Row read()
    {
      if (remaining == 0) {
        return null;
      }
      try {
        Row row = kryo.readObject(input, Row.class);
        remaining--;
        return row;
      } catch (KryoException ex) {
        throw new ResourceException("Cannot read spill file " + file, asIOException(ex));
      }
    }

    @Override
    public void close()
    {
      try {
        input.close();
      } catch (KryoException ex) {
        throw new ResourceException("Cannot close spill file " + file, asIOException(ex));
      }
    }
  }

  private static IOException asIOException(KryoException ex)
  {
    return ex.getCause() instanceof IOException ? (IOException)ex.getCause() : new IOException(ex);
  }
}
