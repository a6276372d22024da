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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;

import org.apache.commons.io.FileUtils;

import com.google.common.collect.ImmutableList;

import org.compgraph.api.ResourceException;
import org.compgraph.api.Row;
import org.compgraph.api.Value;
import org.compgraph.engine.support.EngineTestSupport.TestMeta;

public class RowCodecTest
{
  @Rule
  public TestMeta testMeta = new TestMeta();

  private static final List<Row> ROWS = ImmutableList.of(
      Row.of("text", "héllo wörld", "count", Long.MAX_VALUE, "ratio", -0.0, "flag", true, "missing", Value.NULL),
      Row.of("nested", Value.list(Value.of(1), Value.list(Value.of("a"), Value.NULL), Value.of(Double.NaN))),
      Row.EMPTY);

  @Test
  public void testSpillFileKeepsRowsAndColumnOrder()
  {
    RowCodec codec = new RowCodec();
    File file = new File(testMeta.getDir(), "run.bin");
    try (RowCodec.Writer writer = codec.openWriter(file)) {
      for (Row row : ROWS) {
        writer.write(row);
      }
      Assert.assertEquals(ROWS.size(), writer.getCount());
    }

    try (RowCodec.Reader reader = codec.openReader(file, ROWS.size())) {
      for (Row expected : ROWS) {
        Row actual = reader.read();
        Assert.assertEquals(expected, actual);
        Assert.assertEquals(ImmutableList.copyOf(expected.getColumns()), ImmutableList.copyOf(actual.getColumns()));
      }
      Assert.assertNull(reader.read());
    }
  }

  @Test
  public void testTruncatedFile() throws IOException
  {
    RowCodec codec = new RowCodec();
    File file = new File(testMeta.getDir(), "run.bin");
    try (RowCodec.Writer writer = codec.openWriter(file)) {
      writer.write(ROWS.get(0));
    }
    byte[] bytes = FileUtils.readFileToByteArray(file);
    FileUtils.writeByteArrayToFile(file, Arrays.copyOf(bytes, bytes.length / 2));

    try (RowCodec.Reader reader = codec.openReader(file, 1)) {
      reader.read();
      Assert.fail("truncated spill file must not be readable");
    } catch (ResourceException ex) {
      Assert.assertNotNull(ex.getCause());
    }
  }

  @Test(expected = ResourceException.class)
  public void testMissingFile()
  {
    new RowCodec().openReader(new File(testMeta.getDir(), "absent.bin"), 1);
  }
}
