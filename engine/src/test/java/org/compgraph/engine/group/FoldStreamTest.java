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
package org.compgraph.engine.group;

import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import com.google.common.collect.ImmutableList;

import org.compgraph.api.Folder;
import org.compgraph.api.Row;
import org.compgraph.common.util.RowStreams;
import org.compgraph.engine.support.EngineTestSupport;

public class FoldStreamTest
{
  private static final Folder SUM = new Folder()
  {
    @Override
    public Row fold(Row accumulator, Row row)
    {
      return accumulator.with("x", accumulator.getLong("x") + row.getLong("x"));
    }
  };

  @Test
  public void testTotal()
  {
    FoldStream stream = new FoldStream(RowStreams.of(EngineTestSupport.numbered("x", 1, 2, 3)), SUM, Row.of("x", 0));
    Assert.assertEquals(ImmutableList.of(Row.of("x", 6)), RowStreams.toList(stream));
  }

  @Test
  public void testEmptyInputEmitsInitialRow()
  {
    Folder folder = Mockito.mock(Folder.class);
    FoldStream stream = new FoldStream(RowStreams.empty(), folder, Row.of("x", 0));
    Assert.assertEquals(ImmutableList.of(Row.of("x", 0)), RowStreams.toList(stream));
    Mockito.verifyNoInteractions(folder);
  }
}
