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

import java.util.Map;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Writes a {@link Row} as its column count followed by name / value pairs in column order.
 *
 * @since 1.0.0
 */
public class RowSerializer extends Serializer<Row>
{
  public RowSerializer()
  {
    setImmutable(true);
  }

  @Override
  public void write(Kryo kryo, Output output, Row row)
  {
    output.writeVarInt(row.size(), true);
    for (Map.Entry<String, Value> entry : row.asMap().entrySet()) {
      output.writeString(entry.getKey());
      ValueSerializer.writeValue(output, entry.getValue());
    }
  }

  @Override
  public Row read(Kryo kryo, Input input, Class<Row> type)
  {
    int size = input.readVarInt(true);
    Row.Builder builder = Row.builder();
    for (int i = 0; i < size; i++) {
      String column = input.readString();
      builder.put(column, ValueSerializer.readValue(input));
    }
    return builder.build();
  }
}
