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

import java.io.IOException;
import java.util.Optional;

/**
 * Persistence for raw filing documents. The crawler depends only on this
 * interface; backends and test doubles implement it.
 *
 * <p>Implementations must be safe for concurrent {@link #store} calls with
 * distinct documents, and each store must be atomic: a failed call leaves no
 * partially recorded document behind.
 */
public interface XbrlDocumentStore {

  /**
   * Stores a document.
   *
   * @throws IOException if the backend fails; nothing is recorded in that case
   */
  StoredDocumentRecord store(byte[] content, DocumentMetadata metadata) throws IOException;

  /** Computes statistics over all stored documents. */
  StorageStats getStorageStats() throws IOException;

  /** Returns the original, uncompressed bytes of a stored document. */
  Optional<byte[]> retrieve(String id) throws IOException;

  /** Removes a stored document; returns false when it did not exist. */
  boolean delete(String id) throws IOException;
}
