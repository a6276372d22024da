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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import org.compgraph.api.Key;
import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.api.UnsortedInputException;
import org.compgraph.common.util.RowStreams;
import org.compgraph.engine.support.EngineTestSupport;
import org.compgraph.engine.support.EngineTestSupport.BoundedWindowSource;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;

public class ReduceStreamTest
{
  private static final List<String> KEYS = ImmutableList.of("k");

  /**
   * Emits {k, n} where n is the number of rows in the group.
   */
  private static final Reducer COUNT = new Reducer()
  {
    @Override
    public Iterator<Row> reduce(Key key, List<String> keyColumns, Iterator<Row> group)
    {
      return Iterators.singletonIterator(Row.of("k", key.get(0), "n", Iterators.size(group)));
    }
  };

  private static ReduceStream reduce(RowStream parent, Reducer reducer, boolean verify)
  {
    return new ReduceStream(parent, new GroupedInput(parent, KEYS, new KeyOrderVerifier("test", verify)), reducer);
  }

  @Test
  public void testMaximalRunsOfEqualKeys()
  {
    RowStream parent = RowStreams.of(EngineTestSupport.numbered("k", 1, 1, 2, 3, 3, 3, 1));
    List<Row> expected = ImmutableList.of(Row.of("k", 1, "n", 2), Row.of("k", 2, "n", 1), Row.of("k", 3, "n", 3),
        Row.of("k", 1, "n", 1));
    Assert.assertEquals(expected, RowStreams.toList(reduce(parent, COUNT, false)));
  }

  @Test
  public void testReducerCalledOncePerGroup()
  {
    Reducer reducer = Mockito.mock(Reducer.class);
    Mockito.when(reducer.reduce(any(Key.class), anyList(), any())).thenReturn(Collections.<Row>emptyIterator());
    RowStream parent = RowStreams.of(EngineTestSupport.numbered("k", 1, 1, 2, 2, 2));
    Assert.assertTrue(RowStreams.toList(reduce(parent, reducer, false)).isEmpty());

    ArgumentCaptor<Key> keys = ArgumentCaptor.forClass(Key.class);
    Mockito.verify(reducer, Mockito.times(2)).reduce(keys.capture(), Mockito.eq(KEYS), any());
    Assert.assertEquals(ImmutableList.of(EngineTestSupport.key(1), EngineTestSupport.key(2)), keys.getAllValues());
  }

  @Test
  public void testUnreadRowsAreSkipped()
  {
    Reducer first = new Reducer()
    {
      @Override
      public Iterator<Row> reduce(Key key, List<String> keyColumns, Iterator<Row> group)
      {
        return Iterators.singletonIterator(group.next());
      }
    };
    List<Row> input = ImmutableList.of(Row.of("k", 1, "v", "a"), Row.of("k", 1, "v", "b"), Row.of("k", 2, "v", "c"));
    List<Row> expected = ImmutableList.of(Row.of("k", 1, "v", "a"), Row.of("k", 2, "v", "c"));
    Assert.assertEquals(expected, RowStreams.toList(reduce(RowStreams.of(input), first, false)));
  }

  @Test
  public void testEmptyKeyListMakesOneGroup()
  {
    RowStream parent = RowStreams.of(EngineTestSupport.numbered("x", 3, 1, 2));
    Reducer sum = new Reducer()
    {
      @Override
      public Iterator<Row> reduce(Key key, List<String> keyColumns, Iterator<Row> group)
      {
        Assert.assertEquals(0, key.size());
        long total = 0;
        while (group.hasNext()) {
          total += group.next().getLong("x");
        }
        return Iterators.singletonIterator(Row.of("x", total));
      }
    };
    ReduceStream stream = new ReduceStream(parent, new GroupedInput(parent, ImmutableList.<String>of(),
        new KeyOrderVerifier("test", true)), sum);
    Assert.assertEquals(ImmutableList.of(Row.of("x", 6)), RowStreams.toList(stream));
  }

  @Test
  public void testEmptyInput()
  {
    Reducer reducer = Mockito.mock(Reducer.class);
    Assert.assertFalse(reduce(RowStreams.empty(), reducer, false).hasNext());
    Mockito.verifyNoInteractions(reducer);
  }

  @Test
  public void testReadsAtMostOneRowAhead()
  {
    List<Row> rows = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      rows.add(Row.of("k", i / 7, "seq", i));
    }
    final BoundedWindowSource source = new BoundedWindowSource(rows.iterator(), 2);
    Reducer acknowledging = new Reducer()
    {
      @Override
      public Iterator<Row> reduce(Key key, final List<String> keyColumns, final Iterator<Row> group)
      {
        return new Iterator<Row>()
        {
          @Override
          public boolean hasNext()
          {
            return group.hasNext();
          }

          @Override
          public Row next()
          {
            Row row = group.next();
            source.acknowledge();
            return row;
          }
        };
      }
    };
    Assert.assertEquals(rows, RowStreams.toList(reduce(RowStreams.of(source), acknowledging, false)));
    Assert.assertEquals(100, source.getProduced());
  }

  @Test
  public void testUnsortedInputDetected()
  {
    ReduceStream stream = reduce(RowStreams.of(EngineTestSupport.numbered("k", 1, 2, 1)), COUNT, true);
    Assert.assertEquals(Row.of("k", 1, "n", 1), stream.next());
    Assert.assertEquals(Row.of("k", 2, "n", 1), stream.next());
    try {
      stream.next();
      Assert.fail("key 1 after key 2 must be rejected");
    } catch (UnsortedInputException ex) {
      Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("test"));
    }
    Assert.assertTrue(stream.isClosed());
  }

  @Test
  public void testUnsortedInputIgnoredByDefault()
  {
    RowStream parent = RowStreams.of(EngineTestSupport.numbered("k", 1, 2, 1));
    Assert.assertEquals(3, RowStreams.toList(reduce(parent, COUNT, false)).size());
  }
}
