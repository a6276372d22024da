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

import java.util.ArrayList;
import java.util.List;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import org.compgraph.api.Value;

/**
 * Writes a {@link Value} as its kind ordinal followed by the payload. Lists are written recursively.
 *
 * @since 1.0.0
 */
public class ValueSerializer extends Serializer<Value>
{
  private static final Value.Kind[] KINDS = Value.Kind.values();

  public ValueSerializer()
  {
    setImmutable(true);
  }

  @Override
  public void write(Kryo kryo, Output output, Value value)
  {
    writeValue(output, value);
  }

  @Override
  public Value read(Kryo kryo, Input input, Class<Value> type)
  {
    return readValue(input);
  }

  static void writeValue(Output output, Value value)
  {
    Value.Kind kind = value.getKind();
    output.writeByte(kind.ordinal());
    switch (kind) {
      case NULL:
        break;
      case BOOLEAN:
        output.writeBoolean(value.asBoolean());
        break;
      case INTEGER:
        output.writeVarLong(value.asLong(), false);
        break;
      case FLOAT:
        output.writeDouble(value.asDouble());
        break;
      case TEXT:
        output.writeString(value.asText());
        break;
      case LIST:
        List<Value> elements = value.asList();
        output.writeVarInt(elements.size(), true);
        for (Value element : elements) {
          writeValue(output, element);
        }
        break;
      default:
        throw new IllegalStateException("Unhandled kind " + kind);
    }
  }

  static Value readValue(Input input)
  {
    int ordinal = input.readByte();
    if (ordinal < 0 || ordinal >= KINDS.length) {
      throw new KryoException("Invalid value kind " + ordinal);
    }
    switch (KINDS[ordinal]) {
      case NULL:
        return Value.NULL;
      case BOOLEAN:
        return Value.of(input.readBoolean());
      case INTEGER:
        return Value.of(input.readVarLong(false));
      case FLOAT:
        return Value.of(input.readDouble());
      case TEXT:
        return Value.of(input.readString());
      case LIST:
        int size = input.readVarInt(true);
        List<Value> elements = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
          elements.add(readValue(input));
        }
        return Value.of(elements);
      default:
        throw new IllegalStateException("Unhandled kind " + KINDS[ordinal]);
    }
  }
}
