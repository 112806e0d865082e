/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.econgraph.edgar.storage;

/**
 * How a document's bytes are persisted.
 */
public enum StorageMethod {
  /** Content lives in its own object, referenced from the record. */
  LARGE_OBJECT("large_object"),
  /** Content is held inline alongside the record's metadata. */
  INLINE("bytea");

  private final String value;

  StorageMethod(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Looks up a method by its persisted tag.
   *
   * @throws IllegalArgumentException if the tag is unknown
   */
  public static StorageMethod fromValue(String value) {
    for (StorageMethod method : values()) {
      if (method.value.equals(value)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown storage method: " + value);
  }
}
