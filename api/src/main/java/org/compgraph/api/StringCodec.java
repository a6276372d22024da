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
package org.compgraph.api;

import java.io.Serializable;

/**
 * Reads attribute values from their String representation in properties.
 *
 * @param <T> type of the decoded value
 * @since 1.0.0
 */
public interface StringCodec<T>
{
  /**
   * @param string property value
   * @return the parsed object
   * @throws IllegalArgumentException if the string does not represent a valid value
   */
  T fromString(String string);

  class Factory
  {
    public static StringCodec<?> getInstance(Class<?> cls)
    {
      if (cls == String.class) {
        return String2String.getInstance();
      } else if (cls == Integer.class) {
        return Integer2String.getInstance();
      } else if (cls == Boolean.class) {
        return Boolean2String.getInstance();
      } else {
        return null;
      }
    }
  }

  class String2String implements StringCodec<String>, Serializable
  {
    private static final String2String instance = new String2String();

    public static StringCodec<String> getInstance()
    {
      return instance;
    }

    @Override
    public String fromString(String string)
    {
      return string;
    }

    private static final long serialVersionUID = 201910190022L;
  }

  class Integer2String implements StringCodec<Integer>, Serializable
  {
    private static final Integer2String instance = new Integer2String();

    public static StringCodec<Integer> getInstance()
    {
      return instance;
    }

    @Override
    public Integer fromString(String string)
    {
      return Integer.valueOf(string.trim());
    }

    private static final long serialVersionUID = 201910190023L;
  }

  class Boolean2String implements StringCodec<Boolean>, Serializable
  {
    private static final Boolean2String instance = new Boolean2String();

    public static StringCodec<Boolean> getInstance()
    {
      return instance;
    }

    @Override
    public Boolean fromString(String string)
    {
      String trimmed = string.trim();
      if ("true".equalsIgnoreCase(trimmed)) {
        return Boolean.TRUE;
      } else if ("false".equalsIgnoreCase(trimmed)) {
        return Boolean.FALSE;
      }
      throw new IllegalArgumentException("Not a boolean: " + string);
    }

    private static final long serialVersionUID = 201910190024L;
  }

}
