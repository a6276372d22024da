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
package org.compgraph.engine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import org.compgraph.api.Attribute;
import org.compgraph.api.Attribute.AttributeMap.AttributeInitializer;
import org.compgraph.api.Context;
import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.common.util.PropertiesHelper;

/**
 * Builds {@link ExecutionContext}s from properties.
 * <p>
 * Every attribute of {@link ExecutionContext} is set through the property named by
 * {@link Attribute#getLongName()}, for example {@code compgraph.attr.sort.chunk.size=10000}. Other keys with the
 * {@value Attribute#PREFIX} prefix are ignored with a warning.
 *
 * @since 1.0.0
 */
public class ExecutionConfiguration
{
  /**
   * Classpath resource read by {@link #load()}.
   */
  public static final String SITE_RESOURCE = "compgraph-site.properties";

  private ExecutionConfiguration()
  {
  }

  /**
   * Reads {@value #SITE_RESOURCE} from the classpath and overrides it with the system properties.
   *
   * @return the validated context
   */
  public static DefaultExecutionContext load()
  {
    Properties site;
    try {
      site = PropertiesHelper.loadResource(SITE_RESOURCE);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot read " + SITE_RESOURCE, ex);
    }
    return fromProperties(PropertiesHelper.merge(site, System.getProperties()));
  }

  /**
   * @param properties configuration, keys without the {@value Attribute#PREFIX} prefix are skipped
   * @return the validated context
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static DefaultExecutionContext fromProperties(Properties properties)
  {
    Map<String, Attribute<Object>> attributes = attributesByName();
    DefaultExecutionContext context = new DefaultExecutionContext();
    Properties relevant = PropertiesHelper.withPrefix(properties, Attribute.PREFIX);
    for (String name : relevant.stringPropertyNames()) {
      Attribute<Object> attribute = attributes.get(name);
      if (attribute == null) {
        logger.warn("Ignoring unknown attribute {}", name);
        continue;
      }
      String text = relevant.getProperty(name);
      Object value;
      try {
        value = attribute.parse(text);
      } catch (RuntimeException ex) {
        throw new IllegalArgumentException("Invalid value '" + text + "' for " + name, ex);
      }
      context.getAttributes().put(attribute, value);
    }
    validate(context);
    logger.debug("Configured {}", context);
    return context;
  }

  /**
   * @param context context to check
   * @throws IllegalArgumentException when a value is out of range
   */
  public static void validate(Context context)
  {
    int chunkSize = context.getValue(ExecutionContext.SORT_CHUNK_SIZE);
    Preconditions.checkArgument(chunkSize >= 1, "%s must be at least 1 but is %s",
        ExecutionContext.SORT_CHUNK_SIZE.getLongName(), chunkSize);
    int fanIn = context.getValue(ExecutionContext.SORT_MERGE_FAN_IN);
    Preconditions.checkArgument(fanIn >= 2, "%s must be at least 2 but is %s",
        ExecutionContext.SORT_MERGE_FAN_IN.getLongName(), fanIn);
    String charset = context.getValue(ExecutionContext.FILE_CHARSET);
    Preconditions.checkArgument(charset != null && Charset.isSupported(charset), "Unsupported %s %s",
        ExecutionContext.FILE_CHARSET.getLongName(), charset);
  }

  private static Map<String, Attribute<Object>> attributesByName()
  {
    // touching a field runs the attribute initialization of the interface
    Preconditions.checkState(ExecutionContext.SORT_CHUNK_SIZE.getName() != null);
    Map<String, Attribute<Object>> map = new HashMap<>();
    for (Attribute<Object> attribute : AttributeInitializer.getAttributes(ExecutionContext.class)) {
      map.put(attribute.getLongName(), attribute);
    }
    return map;
  }

  private static final Logger logger = LoggerFactory.getLogger(ExecutionConfiguration.class);
}
