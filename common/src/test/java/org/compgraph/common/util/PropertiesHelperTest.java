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
import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

public class PropertiesHelperTest
{
  @Test
  public void testLoadResource() throws IOException
  {
    Properties properties = PropertiesHelper.loadResource("compgraph-test.properties");
    Assert.assertEquals("128", properties.getProperty("compgraph.attr.sort.chunk.size"));
    Assert.assertEquals(1, PropertiesHelper.withPrefix(properties, "compgraph.").size());
  }

  @Test
  public void testMissingResourceIsEmpty() throws IOException
  {
    Assert.assertTrue(PropertiesHelper.loadResource("no-such-resource.properties").isEmpty());
  }

  @Test
  public void testMergeLaterLayersWin()
  {
    Properties first = new Properties();
    first.setProperty("a", "1");
    first.setProperty("b", "1");
    Properties second = new Properties();
    second.setProperty("b", "2");
    Properties merged = PropertiesHelper.merge(first, second);
    Assert.assertEquals("1", merged.getProperty("a"));
    Assert.assertEquals("2", merged.getProperty("b"));
  }
}
