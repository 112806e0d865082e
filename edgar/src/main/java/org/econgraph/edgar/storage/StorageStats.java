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

import java.util.Locale;

/**
 * Aggregate counts over every stored document.
 *
 * <p>Each document falls in exactly one storage-method bucket and exactly
 * one compression bucket, so both partitions sum to {@link #getTotalFiles()}.
 * Byte totals use original, uncompressed sizes.
 */
public class StorageStats {
  private final long totalFiles;
  private final long totalBytes;
  private final long totalStoredBytes;
  private final long largeObjectFiles;
  private final long byteaFiles;
  private final long compressedFiles;
  private final long uncompressedFiles;

  private StorageStats(long totalFiles, long totalBytes, long totalStoredBytes,
      long largeObjectFiles, long byteaFiles, long compressedFiles, long uncompressedFiles) {
    this.totalFiles = totalFiles;
    this.totalBytes = totalBytes;
    this.totalStoredBytes = totalStoredBytes;
    this.largeObjectFiles = largeObjectFiles;
    this.byteaFiles = byteaFiles;
    this.compressedFiles = compressedFiles;
    this.uncompressedFiles = uncompressedFiles;
  }

  public static StorageStats empty() {
    return new StorageStats(0, 0, 0, 0, 0, 0, 0);
  }

  /** Computes statistics over a set of records. */
  public static StorageStats of(Iterable<StoredDocumentRecord> records) {
    long total = 0;
    long bytes = 0;
    long storedBytes = 0;
    long largeObjects = 0;
    long compressed = 0;
    for (StoredDocumentRecord record : records) {
      total++;
      bytes += record.getOriginalSize();
      storedBytes += record.getStoredSize();
      if (record.getStorageMethod() == StorageMethod.LARGE_OBJECT) {
        largeObjects++;
      }
      if (record.isCompressed()) {
        compressed++;
      }
    }
    return new StorageStats(total, bytes, storedBytes, largeObjects, total - largeObjects,
        compressed, total - compressed);
  }

  public long getTotalFiles() {
    return totalFiles;
  }

  /** Sum of original document sizes. */
  public long getTotalBytes() {
    return totalBytes;
  }

  /** Sum of bytes actually written. */
  public long getTotalStoredBytes() {
    return totalStoredBytes;
  }

  public long getLargeObjectFiles() {
    return largeObjectFiles;
  }

  public long getByteaFiles() {
    return byteaFiles;
  }

  public long getCompressedFiles() {
    return compressedFiles;
  }

  public long getUncompressedFiles() {
    return uncompressedFiles;
  }

  /** Stored bytes divided by original bytes; 1.0 when nothing is stored. */
  public double getCompressionRatio() {
    return totalBytes == 0 ? 1.0 : (double) totalStoredBytes / totalBytes;
  }

  @Override public String toString() {
    return String.format(Locale.ROOT,
        "StorageStats{files=%d, bytes=%d, stored=%d, largeObject=%d, bytea=%d,"
            + " compressed=%d, uncompressed=%d, ratio=%.3f}",
        totalFiles, totalBytes, totalStoredBytes, largeObjectFiles, byteaFiles,
        compressedFiles, uncompressedFiles, getCompressionRatio());
  }
}
