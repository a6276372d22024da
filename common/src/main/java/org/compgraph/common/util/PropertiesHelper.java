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
package org.compgraph.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers to collect configuration properties from system properties and classpath resources.
 *
 * @since 1.0.0
 */
public class PropertiesHelper
{
  /**
   * Copies the entries whose key starts with the prefix.
   *
   * @param properties source properties
   * @param prefix key prefix
   * @return the matching entries, keys unchanged
   */
  public static Properties withPrefix(Properties properties, String prefix)
  {
    Properties result = new Properties();
    for (String name : properties.stringPropertyNames()) {
      if (name.startsWith(prefix)) {
        result.setProperty(name, properties.getProperty(name));
      }
    }
    return result;
  }

  /**
   * Loads a properties resource from the context class loader.
   *
   * @param resource resource name
   * @return the loaded properties, empty when the resource does not exist
   * @throws IOException if the resource exists but cannot be read
   */
  public static Properties loadResource(String resource) throws IOException
  {
    Properties properties = new Properties();
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = PropertiesHelper.class.getClassLoader();
    }
    try (InputStream stream = classLoader.getResourceAsStream(resource)) {
      if (stream == null) {
        logger.debug("Resource {} not found on the classpath", resource);
        return properties;
      }
      properties.load(stream);
    }
    logger.debug("Loaded {} properties from resource {}", properties.size(), resource);
    return properties;
  }

  /**
   * @param layers property sets, later ones override earlier ones
   * @return the merged properties
   */
  public static Properties merge(Properties... layers)
  {
    Properties result = new Properties();
    for (Properties layer : layers) {
      for (Map.Entry<Object, Object> entry : layer.entrySet()) {
        result.put(entry.getKey(), entry.getValue());
      }
    }
    return result;
  }

  private static final Logger logger = LoggerFactory.getLogger(PropertiesHelper.class);
}
