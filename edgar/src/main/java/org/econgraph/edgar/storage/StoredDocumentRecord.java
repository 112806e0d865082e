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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persisted description of a stored filing document.
 *
 * <p>{@code originalSize} is always the uncompressed size of the document as
 * downloaded, whatever the storage method or compression. {@code storedSize}
 * is the number of bytes actually written.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredDocumentRecord {
  public static final String COMPRESSION_NONE = "none";
  public static final String COMPRESSION_GZIP = "gzip";

  private final String id;
  private final String accessionNumber;
  private final @Nullable String cik;
  private final @Nullable String filingType;
  private final @Nullable LocalDate filingDate;
  private final @Nullable LocalDate periodEndDate;
  private final @Nullable Integer fiscalYear;
  private final @Nullable Integer fiscalQuarter;
  private final @Nullable String sourceUrl;
  private final StorageMethod storageMethod;
  private final boolean compressed;
  private final String compressionType;
  private final long originalSize;
  private final long storedSize;
  private final String sha256;
  private final @Nullable String contentReference;
  private final Instant storedAt;

  @JsonCreator
  public StoredDocumentRecord(
      @JsonProperty("id") String id,
      @JsonProperty("accessionNumber") String accessionNumber,
      @JsonProperty("cik") @Nullable String cik,
      @JsonProperty("filingType") @Nullable String filingType,
      @JsonProperty("filingDate") @Nullable LocalDate filingDate,
      @JsonProperty("periodEndDate") @Nullable LocalDate periodEndDate,
      @JsonProperty("fiscalYear") @Nullable Integer fiscalYear,
      @JsonProperty("fiscalQuarter") @Nullable Integer fiscalQuarter,
      @JsonProperty("sourceUrl") @Nullable String sourceUrl,
      @JsonProperty("storageMethod") StorageMethod storageMethod,
      @JsonProperty("compressed") boolean compressed,
      @JsonProperty("compressionType") String compressionType,
      @JsonProperty("originalSize") long originalSize,
      @JsonProperty("storedSize") long storedSize,
      @JsonProperty("sha256") String sha256,
      @JsonProperty("contentReference") @Nullable String contentReference,
      @JsonProperty("storedAt") Instant storedAt) {
    this.id = id;
    this.accessionNumber = accessionNumber;
    this.cik = cik;
    this.filingType = filingType;
    this.filingDate = filingDate;
    this.periodEndDate = periodEndDate;
    this.fiscalYear = fiscalYear;
    this.fiscalQuarter = fiscalQuarter;
    this.sourceUrl = sourceUrl;
    this.storageMethod = storageMethod;
    this.compressed = compressed;
    this.compressionType = compressionType;
    this.originalSize = originalSize;
    this.storedSize = storedSize;
    this.sha256 = sha256;
    this.contentReference = contentReference;
    this.storedAt = storedAt;
  }

  /** Creates a record from metadata plus the facts of how it was stored. */
  public static StoredDocumentRecord of(String id, DocumentMetadata metadata,
      StorageMethod storageMethod, boolean compressed, long originalSize, long storedSize,
      String sha256, @Nullable String contentReference) {
    return new StoredDocumentRecord(id, metadata.getAccessionNumber(), metadata.getCik(),
        metadata.getFilingType(), metadata.getFilingDate(), metadata.getPeriodEndDate(),
        metadata.getFiscalYear(), metadata.getFiscalQuarter(), metadata.getSourceUrl(),
        storageMethod, compressed, compressed ? COMPRESSION_GZIP : COMPRESSION_NONE,
        originalSize, storedSize, sha256, contentReference, Instant.now());
  }

  public String getId() {
    return id;
  }

  public String getAccessionNumber() {
    return accessionNumber;
  }

  public @Nullable String getCik() {
    return cik;
  }

  public @Nullable String getFilingType() {
    return filingType;
  }

  public @Nullable LocalDate getFilingDate() {
    return filingDate;
  }

  public @Nullable LocalDate getPeriodEndDate() {
    return periodEndDate;
  }

  public @Nullable Integer getFiscalYear() {
    return fiscalYear;
  }

  public @Nullable Integer getFiscalQuarter() {
    return fiscalQuarter;
  }

  public @Nullable String getSourceUrl() {
    return sourceUrl;
  }

  public StorageMethod getStorageMethod() {
    return storageMethod;
  }

  public boolean isCompressed() {
    return compressed;
  }

  public String getCompressionType() {
    return compressionType;
  }

  /** Uncompressed size of the document in bytes. */
  public long getOriginalSize() {
    return originalSize;
  }

  /** Bytes actually written, after compression if any. */
  public long getStoredSize() {
    return storedSize;
  }

  public String getSha256() {
    return sha256;
  }

  /** Name of the large object holding the content; null for inline storage. */
  public @Nullable String getContentReference() {
    return contentReference;
  }

  public Instant getStoredAt() {
    return storedAt;
  }

  @Override public String toString() {
    return "StoredDocumentRecord{id=" + id + ", accession=" + accessionNumber
        + ", method=" + storageMethod.getValue() + ", compressed=" + compressed
        + ", originalSize=" + originalSize + ", storedSize=" + storedSize + "}";
  }
}
