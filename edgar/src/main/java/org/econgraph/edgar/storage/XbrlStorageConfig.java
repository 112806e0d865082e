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

import org.econgraph.edgar.ConfigurationException;
import org.econgraph.edgar.YamlUtils;
import org.econgraph.edgar.util.SecUtils;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Settings for {@link XbrlStorage}.
 *
 * <p>Documents larger than {@code largeObjectThresholdBytes} are written as
 * separate large objects; the rest are kept inline with their record.
 * Compression is attempted for documents of at least
 * {@code minCompressionSizeBytes} and kept only when it saves space.
 */
public class XbrlStorageConfig {
  public static final long DEFAULT_LARGE_OBJECT_THRESHOLD = 100L * 1024 * 1024;
  public static final int DEFAULT_COMPRESSION_LEVEL = 6;
  public static final long DEFAULT_MIN_COMPRESSION_SIZE = 1024;
  public static final String DEFAULT_BASE_DIRECTORY = "xbrl-store";

  private final Path baseDirectory;
  private final long largeObjectThresholdBytes;
  private final boolean compressionEnabled;
  private final int compressionLevel;
  private final long minCompressionSizeBytes;

  private XbrlStorageConfig(Builder builder) {
    this.baseDirectory = builder.baseDirectory;
    this.largeObjectThresholdBytes = builder.largeObjectThresholdBytes;
    this.compressionEnabled = builder.compressionEnabled;
    this.compressionLevel = builder.compressionLevel;
    this.minCompressionSizeBytes = builder.minCompressionSizeBytes;
  }

  public static Builder builder(Path baseDirectory) {
    return new Builder().baseDirectory(baseDirectory);
  }

  public static XbrlStorageConfig defaults(Path baseDirectory) {
    return builder(baseDirectory).build();
  }

  public Path getBaseDirectory() {
    return baseDirectory;
  }

  public long getLargeObjectThresholdBytes() {
    return largeObjectThresholdBytes;
  }

  public boolean isCompressionEnabled() {
    return compressionEnabled;
  }

  public int getCompressionLevel() {
    return compressionLevel;
  }

  public long getMinCompressionSizeBytes() {
    return minCompressionSizeBytes;
  }

  /**
   * Builds a configuration from a property map. The base directory falls back
   * to {@code defaultDirectory} when the map has none.
   */
  public static XbrlStorageConfig fromMap(@Nullable Map<String, Object> map,
      Path defaultDirectory) {
    Builder builder = builder(defaultDirectory);
    if (map == null) {
      return builder.build();
    }
    Object directory = map.get("directory");
    if (directory != null) {
      builder.baseDirectory(Paths.get(YamlUtils.resolvePlaceholders(directory.toString())));
    }
    Object threshold = map.get("largeObjectThreshold");
    if (threshold instanceof Number) {
      builder.largeObjectThresholdBytes(((Number) threshold).longValue());
    } else if (threshold != null) {
      try {
        builder.largeObjectThresholdBytes(SecUtils.parseFileSize(threshold.toString()));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid largeObjectThreshold: " + threshold, e);
      }
    }
    Object enabled = map.get("compressionEnabled");
    if (enabled instanceof Boolean) {
      builder.compressionEnabled((Boolean) enabled);
    }
    Object level = map.get("compressionLevel");
    if (level instanceof Number) {
      builder.compressionLevel(((Number) level).intValue());
    }
    Object minSize = map.get("minCompressionSize");
    if (minSize instanceof Number) {
      builder.minCompressionSizeBytes(((Number) minSize).longValue());
    }
    return builder.build();
  }

  /**
   * Builder for XbrlStorageConfig.
   */
  public static class Builder {
    private Path baseDirectory = Paths.get(DEFAULT_BASE_DIRECTORY);
    private long largeObjectThresholdBytes = DEFAULT_LARGE_OBJECT_THRESHOLD;
    private boolean compressionEnabled = true;
    private int compressionLevel = DEFAULT_COMPRESSION_LEVEL;
    private long minCompressionSizeBytes = DEFAULT_MIN_COMPRESSION_SIZE;

    public Builder baseDirectory(Path baseDirectory) {
      this.baseDirectory = baseDirectory;
      return this;
    }

    public Builder largeObjectThresholdBytes(long largeObjectThresholdBytes) {
      this.largeObjectThresholdBytes = largeObjectThresholdBytes;
      return this;
    }

    public Builder compressionEnabled(boolean compressionEnabled) {
      this.compressionEnabled = compressionEnabled;
      return this;
    }

    public Builder compressionLevel(int compressionLevel) {
      this.compressionLevel = compressionLevel;
      return this;
    }

    public Builder minCompressionSizeBytes(long minCompressionSizeBytes) {
      this.minCompressionSizeBytes = minCompressionSizeBytes;
      return this;
    }

    public XbrlStorageConfig build() {
      if (baseDirectory == null) {
        throw new ConfigurationException("Storage base directory is required");
      }
      if (largeObjectThresholdBytes < 0) {
        throw new ConfigurationException(
            "largeObjectThreshold must not be negative: " + largeObjectThresholdBytes);
      }
      if (compressionLevel < 1 || compressionLevel > 9) {
        throw new ConfigurationException(
            "compressionLevel must be between 1 and 9: " + compressionLevel);
      }
      if (minCompressionSizeBytes < 0) {
        throw new ConfigurationException(
            "minCompressionSize must not be negative: " + minCompressionSizeBytes);
      }
      return new XbrlStorageConfig(this);
    }
  }
}
