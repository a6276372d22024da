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
package org.compgraph.library.operator;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.Iterator;
import java.util.Locale;

import com.google.common.collect.Iterators;

import org.compgraph.api.MalformedInputException;
import org.compgraph.api.Mapper;
import org.compgraph.api.Row;

/**
 * Derives the traversal time in seconds, the weekday ({@code Mon} .. {@code Sun}) and the hour of day of the
 * entry from a pair of timestamps like {@code 20171020T112237.427000}. The fraction of the second is optional.
 *
 * @since 1.0.0
 */
public class ProcessTime implements Mapper
{
  public static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
      .appendPattern("uuuuMMdd'T'HHmmss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .toFormatter(Locale.ROOT);

  private final String enterTimeColumn;
  private final String leaveTimeColumn;
  private final String timeColumn;
  private final String weekdayColumn;
  private final String hourColumn;

  public ProcessTime(String enterTimeColumn, String leaveTimeColumn, String timeColumn, String weekdayColumn,
      String hourColumn)
  {
    this.enterTimeColumn = enterTimeColumn;
    this.leaveTimeColumn = leaveTimeColumn;
    this.timeColumn = timeColumn;
    this.weekdayColumn = weekdayColumn;
    this.hourColumn = hourColumn;
  }

  @Override
  public Iterator<Row> map(Row row)
  {
    LocalDateTime enter = parse(row.getText(enterTimeColumn));
    LocalDateTime leave = parse(row.getText(leaveTimeColumn));
    double seconds = Duration.between(enter, leave).toNanos() / 1e9;
    return Iterators.singletonIterator(row.toBuilder()
        .put(weekdayColumn, enter.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
        .put(hourColumn, enter.getHour())
        .put(timeColumn, seconds)
        .build());
  }

  static LocalDateTime parse(String timestamp)
  {
    try {
      return LocalDateTime.parse(timestamp, TIMESTAMP_FORMAT);
    } catch (DateTimeParseException ex) {
      throw new MalformedInputException("Invalid timestamp", timestamp, ex);
    }
  }
}
