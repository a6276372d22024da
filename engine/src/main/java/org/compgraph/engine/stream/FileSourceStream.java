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
package org.compgraph.engine.stream;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.compgraph.api.LineParser;
import org.compgraph.api.Row;
import org.compgraph.common.util.AbstractRowStream;

/**
 * Parses a text file line by line. The file is opened on the first pull and closed with the stream.
 *
 * @since 1.0.0
 */
public class FileSourceStream extends AbstractRowStream
{
  private final File file;
  private final LineParser parser;
  private final Charset charset;
  private BufferedReader reader;
  private long lineNumber;

  public FileSourceStream(File file, LineParser parser, Charset charset)
  {
    this.file = file;
    this.parser = parser;
    this.charset = charset;
  }

  @Override
  protected Row computeNext()
  {
    try {
      if (reader == null) {
        logger.debug("Reading {} as {}", file, charset);
        reader = Files.newBufferedReader(file.toPath(), charset);
      }
      String line = reader.readLine();
      if (line == null) {
        logger.debug("Read {} lines from {}", lineNumber, file);
        return null;
      }
      lineNumber++;
      return parser.parse(line);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot read " + file + " after line " + lineNumber, ex);
    }
  }

  @Override
  protected void release()
  {
    if (reader != null) {
      try {
        reader.close();
      } catch (IOException ex) {
        throw new UncheckedIOException("Cannot close " + file, ex);
      }
    }
  }

  private static final Logger logger = LoggerFactory.getLogger(FileSourceStream.class);
}
