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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.hash.Hashing;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * File-system backed {@link XbrlDocumentStore} with size-gated storage.
 *
 * <p>Layout under the base directory:
 * <pre>
 *   records/&lt;id&gt;.json   metadata, plus the content itself for inline documents
 *   objects/&lt;id&gt;.bin    content of large-object documents
 * </pre>
 *
 * <p>A record file holds a {@code record} object followed, for inline
 * documents, by a base64 {@code inlineContent} field. Listing and statistics
 * read the record alone.
 *
 * <p>Every file is written to a temporary name and renamed into place, and
 * a document exists only once its record file does. A large object is
 * written before its record and removed again if the record cannot be
 * written, so a failed {@link #store} leaves nothing behind.
 */
public class XbrlStorage implements XbrlDocumentStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlStorage.class);

  static final String RECORDS_DIR = "records";
  static final String OBJECTS_DIR = "objects";
  private static final String RECORD_SUFFIX = ".json";
  private static final String OBJECT_SUFFIX = ".bin";
  private static final String RECORD_FIELD = "record";
  private static final String INLINE_CONTENT_FIELD = "inlineContent";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private final XbrlStorageConfig config;
  private final Path recordsDir;
  private final Path objectsDir;

  public XbrlStorage(XbrlStorageConfig config) throws IOException {
    this.config = config;
    this.recordsDir = config.getBaseDirectory().resolve(RECORDS_DIR);
    this.objectsDir = config.getBaseDirectory().resolve(OBJECTS_DIR);
    Files.createDirectories(recordsDir);
    Files.createDirectories(objectsDir);
  }

  public XbrlStorageConfig getConfig() {
    return config;
  }

  @Override public StoredDocumentRecord store(byte[] content, DocumentMetadata metadata)
      throws IOException {
    String id = UUID.randomUUID().toString();
    long originalSize = content.length;
    String sha256 = Hashing.sha256().hashBytes(content).toString();

    byte[] payload = content;
    boolean compressed = false;
    if (config.isCompressionEnabled() && originalSize >= config.getMinCompressionSizeBytes()) {
      byte[] candidate = compress(content, config.getCompressionLevel());
      if (candidate.length < content.length) {
        payload = candidate;
        compressed = true;
      }
    }

    StorageMethod method = originalSize > config.getLargeObjectThresholdBytes()
        ? StorageMethod.LARGE_OBJECT
        : StorageMethod.INLINE;

    Path objectFile = null;
    String contentReference = null;
    if (method == StorageMethod.LARGE_OBJECT) {
      contentReference = id + OBJECT_SUFFIX;
      objectFile = objectsDir.resolve(contentReference);
      writeAtomically(objectFile, payload);
    }

    StoredDocumentRecord record = StoredDocumentRecord.of(id, metadata, method, compressed,
        originalSize, payload.length, sha256, contentReference);
    ObjectNode envelope = MAPPER.createObjectNode();
    envelope.set(RECORD_FIELD, MAPPER.valueToTree(record));
    if (method == StorageMethod.INLINE) {
      envelope.put(INLINE_CONTENT_FIELD, payload);
    }

    try {
      writeAtomically(recordFile(id), MAPPER.writeValueAsBytes(envelope));
    } catch (IOException e) {
      if (objectFile != null) {
        deleteQuietly(objectFile);
      }
      throw new IOException("Failed to store document " + metadata.getAccessionNumber()
          + ": " + e.getMessage(), e);
    }

    LOGGER.debug("Stored {} as {} ({} bytes, {} stored, compressed={})",
        metadata.getAccessionNumber(), method.getValue(), originalSize, payload.length,
        compressed);
    return record;
  }

  @Override public StorageStats getStorageStats() throws IOException {
    return StorageStats.of(listRecords());
  }

  /** Reads every stored record. */
  public List<StoredDocumentRecord> listRecords() throws IOException {
    List<StoredDocumentRecord> records = new ArrayList<StoredDocumentRecord>();
    try (DirectoryStream<Path> stream =
             Files.newDirectoryStream(recordsDir, "*" + RECORD_SUFFIX)) {
      for (Path file : stream) {
        StoredDocumentRecord record = readRecord(file);
        if (record != null) {
          records.add(record);
        }
      }
    }
    return records;
  }

  /** Reads a single record by id. */
  public Optional<StoredDocumentRecord> getRecord(String id) throws IOException {
    return Optional.ofNullable(readRecord(recordFile(id)));
  }

  @Override public Optional<byte[]> retrieve(String id) throws IOException {
    JsonNode envelope = readEnvelope(recordFile(id));
    if (envelope == null) {
      return Optional.empty();
    }
    StoredDocumentRecord record =
        MAPPER.treeToValue(envelope.get(RECORD_FIELD), StoredDocumentRecord.class);
    byte[] payload;
    if (record.getStorageMethod() == StorageMethod.LARGE_OBJECT) {
      payload = Files.readAllBytes(objectsDir.resolve(record.getContentReference()));
    } else {
      payload = envelope.get(INLINE_CONTENT_FIELD).binaryValue();
    }
    byte[] content = record.isCompressed() ? decompress(payload) : payload;
    String actualHash = Hashing.sha256().hashBytes(content).toString();
    if (!actualHash.equals(record.getSha256())) {
      throw new IOException("Content hash mismatch for document " + id);
    }
    return Optional.of(content);
  }

  @Override public boolean delete(String id) throws IOException {
    Path recordFile = recordFile(id);
    StoredDocumentRecord record = readRecord(recordFile);
    if (record == null) {
      return false;
    }
    Files.delete(recordFile);
    if (record.getContentReference() != null) {
      Files.deleteIfExists(objectsDir.resolve(record.getContentReference()));
    }
    LOGGER.debug("Deleted document {}", id);
    return true;
  }

  /**
   * Writes bytes to a temporary sibling and renames it over the target.
   */
  protected void writeAtomically(Path target, byte[] bytes) throws IOException {
    Path tempFile = target.resolveSibling(target.getFileName() + ".tmp."
        + Thread.currentThread().getId());
    try {
      Files.write(tempFile, bytes);
      try {
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        LOGGER.debug("Atomic move not supported for {}, using plain rename", target);
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tempFile);
    }
  }

  private Path recordFile(String id) {
    return recordsDir.resolve(id + RECORD_SUFFIX);
  }

  private @Nullable JsonNode readEnvelope(Path file) throws IOException {
    try {
      return MAPPER.readTree(Files.readAllBytes(file));
    } catch (NoSuchFileException e) {
      return null;
    }
  }

  /**
   * Reads only the {@code record} field of a record file. The field is written
   * first, so parsing stops before any inline content.
   */
  private @Nullable StoredDocumentRecord readRecord(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file);
         JsonParser parser = MAPPER.createParser(in)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("Malformed record file " + file);
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        parser.nextToken();
        if (RECORD_FIELD.equals(field)) {
          return parser.readValueAs(StoredDocumentRecord.class);
        }
        parser.skipChildren();
      }
      throw new IOException("Record file " + file + " has no " + RECORD_FIELD + " field");
    } catch (NoSuchFileException e) {
      return null;
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Could not remove orphaned object {}: {}", file, e.getMessage());
    }
  }

  static byte[] compress(byte[] content, int level) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, content.length / 4));
    try (GZIPOutputStream gzip = new LevelledGzipOutputStream(buffer, level)) {
      gzip.write(content);
    }
    return buffer.toByteArray();
  }

  static byte[] decompress(byte[] payload) throws IOException {
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(payload))) {
      return in.readAllBytes();
    }
  }

  /** GZIP stream with a configurable deflate level. */
  private static final class LevelledGzipOutputStream extends GZIPOutputStream {
    LevelledGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
      super(out);
      def.setLevel(level);
    }
  }
}
