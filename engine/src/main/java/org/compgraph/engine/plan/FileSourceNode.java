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
package org.compgraph.engine.plan;

import java.io.File;
import java.nio.charset.Charset;

import com.google.common.base.Preconditions;

import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.api.LineParser;
import org.compgraph.api.RowStream;
import org.compgraph.engine.stream.FileSourceStream;

/**
 * Entry point parsing the lines of a file.
 *
 * @since 1.0.0
 */
public class FileSourceNode extends GraphNode
{
  private final File file;
  private final LineParser parser;

  public FileSourceNode(File file, LineParser parser)
  {
    this.file = Preconditions.checkNotNull(file, "file");
    this.parser = Preconditions.checkNotNull(parser, "parser");
  }

  public File getFile()
  {
    return file;
  }

  @Override
  public RowStream open(ExecutionScope scope, int nodeId)
  {
    Charset charset = Charset.forName(scope.getContext().getValue(ExecutionContext.FILE_CHARSET));
    return new FileSourceStream(file, parser, charset);
  }

  @Override
  public GraphNode relocate(int offset)
  {
    return this;
  }

  @Override
  public String describe()
  {
    return "file(" + file + ")";
  }
}
