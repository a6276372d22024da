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

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

import org.compgraph.api.Context.ExecutionContext;

public class ExecutionConfigurationTest
{
  @Test
  public void testDefaults()
  {
    DefaultExecutionContext context = ExecutionConfiguration.fromProperties(new Properties());
    Assert.assertEquals(Integer.valueOf(65536), context.getValue(ExecutionContext.SORT_CHUNK_SIZE));
    Assert.assertEquals(Integer.valueOf(64), context.getValue(ExecutionContext.SORT_MERGE_FAN_IN));
    Assert.assertNull(context.getValue(ExecutionContext.SPILL_DIRECTORY));
    Assert.assertFalse(context.getValue(ExecutionContext.VERIFY_SORTED_INPUT));
    Assert.assertEquals("UTF-8", context.getValue(ExecutionContext.FILE_CHARSET));
  }

  @Test
  public void testProperties()
  {
    Properties properties = new Properties();
    properties.setProperty("compgraph.attr.sort.chunk.size", " 1000 ");
    properties.setProperty("compgraph.attr.sort.merge.fan.in", "8");
    properties.setProperty("compgraph.attr.spill.directory", "/var/tmp/spill");
    properties.setProperty("compgraph.attr.verify.sorted.input", "true");
    properties.setProperty("compgraph.attr.file.charset", "ISO-8859-1");
    properties.setProperty("compgraph.attr.no.such.attribute", "x");
    properties.setProperty("unrelated", "y");

    DefaultExecutionContext context = ExecutionConfiguration.fromProperties(properties);
    Assert.assertEquals(Integer.valueOf(1000), context.getValue(ExecutionContext.SORT_CHUNK_SIZE));
    Assert.assertEquals(Integer.valueOf(8), context.getValue(ExecutionContext.SORT_MERGE_FAN_IN));
    Assert.assertEquals("/var/tmp/spill", context.getValue(ExecutionContext.SPILL_DIRECTORY));
    Assert.assertTrue(context.getValue(ExecutionContext.VERIFY_SORTED_INPUT));
    Assert.assertEquals("ISO-8859-1", context.getValue(ExecutionContext.FILE_CHARSET));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnparsableValue()
  {
    Properties properties = new Properties();
    properties.setProperty("compgraph.attr.sort.chunk.size", "many");
    ExecutionConfiguration.fromProperties(properties);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFanInOutOfRange()
  {
    Properties properties = new Properties();
    properties.setProperty("compgraph.attr.sort.merge.fan.in", "1");
    ExecutionConfiguration.fromProperties(properties);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testChunkSizeOutOfRangeAtRun()
  {
    DefaultExecutionContext context = new DefaultExecutionContext().with(ExecutionContext.SORT_CHUNK_SIZE, 0);
    ExecutionConfiguration.validate(context);
  }

  @Test
  public void testSiteResourceAndSystemProperties()
  {
    // compgraph-site.properties on the test classpath sets the fan-in to 16
    Assert.assertEquals(Integer.valueOf(16), ExecutionConfiguration.load().getValue(ExecutionContext.SORT_MERGE_FAN_IN));
    System.setProperty("compgraph.attr.sort.merge.fan.in", "4");
    try {
      Assert.assertEquals(Integer.valueOf(4), ExecutionConfiguration.load().getValue(
          ExecutionContext.SORT_MERGE_FAN_IN));
    } finally {
      System.clearProperty("compgraph.attr.sort.merge.fan.in");
    }
  }

  @Test
  public void testAttributeNames()
  {
    Assert.assertEquals("compgraph.attr.sort.chunk.size", ExecutionContext.SORT_CHUNK_SIZE.getLongName());
    Assert.assertEquals("SORT_CHUNK_SIZE", ExecutionContext.SORT_CHUNK_SIZE.getSimpleName());
  }
}
