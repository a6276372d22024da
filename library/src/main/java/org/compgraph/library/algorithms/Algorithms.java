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
package org.compgraph.library.algorithms;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.compgraph.engine.Graph;
import org.compgraph.library.operator.Count;
import org.compgraph.library.operator.Filter;
import org.compgraph.library.operator.FilterPunctuation;
import org.compgraph.library.operator.FirstReducer;
import org.compgraph.library.operator.HaversineLength;
import org.compgraph.library.operator.Idf;
import org.compgraph.library.operator.InnerJoiner;
import org.compgraph.library.operator.LowerCase;
import org.compgraph.library.operator.MultipleSum;
import org.compgraph.library.operator.Pmi;
import org.compgraph.library.operator.ProcessSpeed;
import org.compgraph.library.operator.ProcessTime;
import org.compgraph.library.operator.Product;
import org.compgraph.library.operator.Project;
import org.compgraph.library.operator.SafeCount;
import org.compgraph.library.operator.Split;
import org.compgraph.library.operator.TermFrequency;
import org.compgraph.library.operator.TopN;

/**
 * Ready-made graphs over text documents and road traversal logs.
 * <p>
 * Every graph has a variant taking the source names and one taking already built input graphs, the latter
 * for reading the inputs from files with {@link Graph#fromFile}.
 *
 * @since 1.0.0
 */
public final class Algorithms
{
  private static final List<String> NO_KEYS = Collections.emptyList();

  private Algorithms()
  {
  }

  public static Graph wordCount(String source)
  {
    return wordCount(Graph.fromIterator(source), "text", "count");
  }

  /**
   * Counts the words of a text column over all rows.
   *
   * @return rows {text, count} ordered by count, then word
   */
  public static Graph wordCount(Graph input, String textColumn, String countColumn)
  {
    return words(input, textColumn)
        .sort(textColumn)
        .reduce(new Count(countColumn), Collections.singletonList(textColumn))
        .sort(countColumn, textColumn);
  }

  public static Graph invertedIndex(String source)
  {
    return invertedIndex(Graph.fromIterator(source), "doc_id", "text", "tf_idf");
  }

  /**
   * For every word the three documents with the highest tf-idf.
   *
   * @return rows {doc_id, text, tf_idf}, grouped by word, highest tf-idf first within a word
   */
  public static Graph invertedIndex(Graph input, String docColumn, String textColumn, String resultColumn)
  {
    List<String> text = Collections.singletonList(textColumn);
    Graph words = words(input, textColumn);

    Graph documentCount = input.reduce(new Count("doc_count"), NO_KEYS);

    Graph idf = words
        .sort(docColumn, textColumn)
        .reduce(new FirstReducer(), Arrays.asList(docColumn, textColumn))
        .sort(textColumn)
        .reduce(new Count("num_word_entries"), text)
        .join(new InnerJoiner(), documentCount, NO_KEYS)
        .map(new Idf("doc_count", "num_word_entries", textColumn, "idf"))
        .sort(textColumn);

    return words
        .sort(docColumn)
        .reduce(new TermFrequency(textColumn, "tf"), Collections.singletonList(docColumn))
        .sort(textColumn)
        .join(new InnerJoiner(), idf, text)
        .map(new Product(Arrays.asList("tf", "idf"), resultColumn))
        .map(new Project(Arrays.asList(resultColumn, docColumn, textColumn)))
        .sort(textColumn)
        .reduce(new TopN(resultColumn, 3), text);
  }

  public static Graph pmi(String source)
  {
    return pmi(Graph.fromIterator(source), "doc_id", "text", "pmi");
  }

  /**
   * For every document the ten words with the highest pointwise mutual information. Only words longer than four
   * characters that occur at least twice in a document are considered.
   *
   * @return rows {doc_id, text, pmi}, grouped by document, highest pmi first within a document
   */
  public static Graph pmi(Graph input, String docColumn, final String textColumn, String resultColumn)
  {
    List<String> text = Collections.singletonList(textColumn);
    Graph frequentWords = words(input, textColumn)
        .map(new Filter(row -> row.getText(textColumn).length() > 4))
        .sort(docColumn, textColumn)
        .reduce(new SafeCount("num_entries"), Arrays.asList(docColumn, textColumn))
        .map(new Filter(row -> row.getLong("num_entries") >= 2));

    Graph total = frequentWords
        .reduce(new TermFrequency(textColumn, "tf_total"), NO_KEYS)
        .sort(textColumn);

    return frequentWords
        .sort(docColumn)
        .reduce(new TermFrequency(textColumn, "tf"), Collections.singletonList(docColumn))
        .sort(textColumn)
        .join(new InnerJoiner(), total, text)
        .map(new Pmi("tf", "tf_total", resultColumn))
        .map(new Project(Arrays.asList(docColumn, textColumn, resultColumn)))
        .sort(docColumn)
        .reduce(new TopN(resultColumn, 10), Collections.singletonList(docColumn));
  }

  public static Graph roadSpeed(String timeSource, String lengthSource)
  {
    return roadSpeed(Graph.fromIterator(timeSource), Graph.fromIterator(lengthSource));
  }

  /**
   * Average speed in km/h by weekday and hour.
   *
   * @param times rows {edge_id, enter_time, leave_time}
   * @param lengths rows {edge_id, start, end} with [longitude, latitude] coordinates
   * @return rows {weekday, hour, speed} ordered by weekday name, then hour
   */
  public static Graph roadSpeed(Graph times, Graph lengths)
  {
    List<String> weekdayHour = Arrays.asList("weekday", "hour");
    Graph edges = lengths
        .map(new HaversineLength("start", "end", "length"))
        .sort("edge_id");

    return times
        .map(new ProcessTime("enter_time", "leave_time", "time", "weekday", "hour"))
        .sort("edge_id")
        .join(new InnerJoiner(), edges, Collections.singletonList("edge_id"))
        .sort(weekdayHour)
        .reduce(new MultipleSum(Arrays.asList("time", "length")), weekdayHour)
        .map(new ProcessSpeed("length", "time", "speed"))
        .map(new Project(Arrays.asList("weekday", "hour", "speed")))
        .sort(weekdayHour);
  }

  private static Graph words(Graph input, String textColumn)
  {
    return input
        .map(new FilterPunctuation(textColumn))
        .map(new LowerCase(textColumn))
        .map(new Split(textColumn));
  }
}
