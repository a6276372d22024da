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

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

import org.compgraph.api.Mapper;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Great circle distance in kilometers between two points given as {@code [longitude, latitude]} lists of degrees.
 *
 * @since 1.0.0
 */
public class HaversineLength implements Mapper
{
  public static final double EARTH_RADIUS_KM = 6371;

  private final String startColumn;
  private final String endColumn;
  private final String lengthColumn;

  public HaversineLength(String startColumn, String endColumn, String lengthColumn)
  {
    this.startColumn = startColumn;
    this.endColumn = endColumn;
    this.lengthColumn = lengthColumn;
  }

  @Override
  public Iterator<Row> map(Row row)
  {
    List<Value> start = row.get(startColumn).asList();
    List<Value> end = row.get(endColumn).asList();
    Preconditions.checkArgument(start.size() == 2 && end.size() == 2, "Expected [longitude, latitude] in %s", row);
    return Iterators.singletonIterator(row.with(lengthColumn, distance(start.get(0).asDouble(),
        start.get(1).asDouble(), end.get(0).asDouble(), end.get(1).asDouble())));
  }

  static double distance(double startLongitude, double startLatitude, double endLongitude, double endLatitude)
  {
    double l1 = Math.toRadians(startLongitude);
    double l2 = Math.toRadians(endLongitude);
    double f1 = Math.toRadians(startLatitude);
    double f2 = Math.toRadians(endLatitude);
    double sinLatitude = Math.sin(f2 / 2 - f1 / 2);
    double sinLongitude = Math.sin(l2 / 2 - l1 / 2);
    return EARTH_RADIUS_KM * 2 * Math.asin(Math.sqrt(sinLatitude * sinLatitude
        + Math.cos(f1) * Math.cos(f2) * sinLongitude * sinLongitude));
  }
}
