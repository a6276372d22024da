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
package org.compgraph.library.io;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.map.ObjectMapper;

import com.google.common.collect.Lists;

import org.compgraph.api.LineParser;
import org.compgraph.api.MalformedInputException;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Parses one JSON object per line into a {@link Row}. Strings, integers, floating point numbers, booleans,
 * nulls and arrays of those map to the matching {@link Value} kinds; nested objects and integers outside the
 * signed 64-bit range are rejected.
 *
 * @since 1.0.0
 */
public class JsonLineParser implements LineParser
{
  private final ObjectMapper mapper;

  public JsonLineParser()
  {
    this(new ObjectMapper());
  }

  public JsonLineParser(ObjectMapper mapper)
  {
    this.mapper = mapper;
  }

  @Override
  public Row parse(String line)
  {
    JsonNode node;
    try {
      node = mapper.readTree(line);
    } catch (IOException ex) {
      throw new MalformedInputException("Invalid JSON: " + ex.getMessage(), line, ex);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedInputException("Expected a JSON object", line);
    }
    Row.Builder builder = Row.builder();
    for (Iterator<Map.Entry<String, JsonNode>> fields = node.getFields(); fields.hasNext(); ) {
      Map.Entry<String, JsonNode> field = fields.next();
      builder.put(field.getKey(), toValue(field.getKey(), field.getValue(), line));
    }
    return builder.build();
  }

  private static Value toValue(String column, JsonNode node, String line)
  {
    if (node.isNull()) {
      return Value.NULL;
    }
    if (node.isTextual()) {
      return Value.of(node.getTextValue());
    }
    if (node.isBoolean()) {
      return Value.of(node.getBooleanValue());
    }
    if (node.isBigInteger()) {
      throw new MalformedInputException("Integer out of range in column " + column, line);
    }
    if (node.isIntegralNumber()) {
      return Value.of(node.getLongValue());
    }
    if (node.isFloatingPointNumber()) {
      return Value.of(node.getDoubleValue());
    }
    if (node.isArray()) {
      List<Value> elements = Lists.newArrayListWithCapacity(node.size());
      for (JsonNode element : node) {
        elements.add(toValue(column, element, line));
      }
      return Value.of(elements);
    }
    throw new MalformedInputException("Unsupported value in column " + column + ": " + node, line);
  }
}
