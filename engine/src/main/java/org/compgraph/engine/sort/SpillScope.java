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
package org.compgraph.engine.sort;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.commons.io.FileUtils;

import org.compgraph.api.ResourceException;
import org.compgraph.engine.codec.RowCodec;

/**
 * Private scratch directory of one sort pass.
 * <p>
 * The directory is created under the configured parent on the first call to {@link #newRunFile()}, so a sort
 * that never spills touches no disk at all. {@link #close()} deletes the directory with everything left in it.
 *
 * @since 1.0.0
 */
public class SpillScope implements Closeable
{
  private final File parent;
  private final RowCodec codec = new RowCodec();
  private File directory;
  private int sequence;
  private boolean closed;

  public SpillScope(File parent)
  {
    this.parent = parent;
  }

  public RowCodec getCodec()
  {
    return codec;
  }

  /**
   * @return the scratch directory, or null when nothing was spilled yet
   */
  public File getDirectory()
  {
    return directory;
  }

  public File newRunFile()
  {
    if (closed) {
      throw new IllegalStateException("Spill scope " + directory + " is already released");
    }
    if (directory == null) {
      try {
        FileUtils.forceMkdir(parent);
        directory = Files.createTempDirectory(parent.toPath(), "compgraph-sort-").toFile();
      } catch (IOException ex) {
        throw new ResourceException("Cannot create spill directory under " + parent, ex);
      }
      logger.debug("Created spill scope {}", directory);
    }
    return new File(directory, String.format("run-%05d.bin", sequence++));
  }

  public void delete(File runFile)
  {
    try {
      Files.deleteIfExists(runFile.toPath());
    } catch (IOException ex) {
      throw new ResourceException("Cannot delete spill file " + runFile, ex);
    }
  }

  @Override
  public void close()
  {
    if (closed) {
      return;
    }
    closed = true;
    if (directory != null) {
      try {
        FileUtils.deleteDirectory(directory);
      } catch (IOException ex) {
        throw new ResourceException("Cannot delete spill directory " + directory, ex);
      }
      logger.debug("Released spill scope {}", directory);
    }
  }

  private static final Logger logger = LoggerFactory.getLogger(SpillScope.class);
}
