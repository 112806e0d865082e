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
package org.econgraph.edgar.crawler;

import org.econgraph.edgar.ConfigurationException;
import org.econgraph.edgar.YamlUtils;
import org.econgraph.edgar.util.SecUtils;

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable settings for one crawl run.
 *
 * <p>Built through {@link #builder()}, {@link #fromMap(Map)} or
 * {@link #load(Path)}. Every path validates eagerly and throws
 * {@link ConfigurationException}, so a bad value stops the run before any
 * request is sent.
 *
 * <p>Configuration in YAML:
 * <pre>{@code
 * maxRequestsPerSecond: 10
 * maxRetries: 3
 * retryDelaySeconds: 5
 * maxFileSizeBytes: 50MB
 * startDate: "2020-01-01"
 * formTypes: ["10-K", "10-Q"]
 * excludeAmended: true
 * userAgent: "${SEC_USER_AGENT:EconGraph-SEC-Crawler/1.0 (contact@econgraph.org)}"
 * }</pre>
 */
public class CrawlConfig {

  public static final double DEFAULT_MAX_REQUESTS_PER_SECOND = 10;
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final long DEFAULT_RETRY_DELAY_SECONDS = 5;
  public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 50L * 1024 * 1024;
  public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
  public static final String DEFAULT_USER_AGENT =
      "EconGraph-SEC-Crawler/1.0 (contact@econgraph.org)";

  private final double maxRequestsPerSecond;
  private final int maxRetries;
  private final long retryDelaySeconds;
  private final long maxFileSizeBytes;
  private final @Nullable LocalDate startDate;
  private final @Nullable LocalDate endDate;
  private final @Nullable Set<String> formTypes;
  private final boolean excludeAmended;
  private final boolean excludeRestated;
  private final String userAgent;
  private final Duration requestTimeout;

  private CrawlConfig(Builder builder) {
    this.maxRequestsPerSecond = builder.maxRequestsPerSecond;
    this.maxRetries = builder.maxRetries;
    this.retryDelaySeconds = builder.retryDelaySeconds;
    this.maxFileSizeBytes = builder.maxFileSizeBytes;
    this.startDate = builder.startDate;
    this.endDate = builder.endDate;
    this.formTypes = builder.formTypes == null ? null : ImmutableSet.copyOf(builder.formTypes);
    this.excludeAmended = builder.excludeAmended;
    this.excludeRestated = builder.excludeRestated;
    this.userAgent = builder.userAgent;
    this.requestTimeout = builder.requestTimeout;
  }

  public static CrawlConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder pre-populated with this configuration's values. */
  public Builder toBuilder() {
    Builder builder = new Builder()
        .maxRequestsPerSecond(maxRequestsPerSecond)
        .maxRetries(maxRetries)
        .retryDelaySeconds(retryDelaySeconds)
        .maxFileSizeBytes(maxFileSizeBytes)
        .startDate(startDate)
        .endDate(endDate)
        .excludeAmended(excludeAmended)
        .excludeRestated(excludeRestated)
        .userAgent(userAgent)
        .requestTimeout(requestTimeout);
    builder.formTypes = formTypes;
    return builder;
  }

  public double getMaxRequestsPerSecond() {
    return maxRequestsPerSecond;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public long getRetryDelaySeconds() {
    return retryDelaySeconds;
  }

  public long getMaxFileSizeBytes() {
    return maxFileSizeBytes;
  }

  public @Nullable LocalDate getStartDate() {
    return startDate;
  }

  public @Nullable LocalDate getEndDate() {
    return endDate;
  }

  /** Allowed form types, or null when every form type is allowed. */
  public @Nullable Set<String> getFormTypes() {
    return formTypes;
  }

  public boolean isExcludeAmended() {
    return excludeAmended;
  }

  public boolean isExcludeRestated() {
    return excludeRestated;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  /** Retry policy derived from {@link #getMaxRetries()} and the retry delay. */
  public RetryPolicy retryPolicy(Sleeper sleeper) {
    return new RetryPolicy(maxRetries, Duration.ofSeconds(retryDelaySeconds), sleeper);
  }

  /**
   * Loads configuration from a YAML or JSON file.
   *
   * @throws ConfigurationException if the file cannot be read or holds invalid values
   */
  public static CrawlConfig load(Path file) {
    try {
      return fromMap(YamlUtils.readMap(file));
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read crawl configuration " + file, e);
    }
  }

  /**
   * Builds a configuration from a map of property values, as produced by
   * parsing YAML or JSON. Absent keys keep their defaults.
   */
  public static CrawlConfig fromMap(@Nullable Map<String, Object> map) {
    return populate(builder(), map).build();
  }

  /** Applies the values of a property map on top of an existing builder. */
  public static Builder populate(Builder builder, @Nullable Map<String, Object> map) {
    if (map == null) {
      return builder;
    }
    Object rps = map.get("maxRequestsPerSecond");
    if (rps != null) {
      builder.maxRequestsPerSecond(toDouble("maxRequestsPerSecond", rps));
    }
    Object retries = map.get("maxRetries");
    if (retries != null) {
      builder.maxRetries(toInt("maxRetries", retries));
    }
    Object delay = map.get("retryDelaySeconds");
    if (delay != null) {
      builder.retryDelaySeconds(toLong("retryDelaySeconds", delay));
    }
    Object maxSize = map.get("maxFileSizeBytes");
    if (maxSize != null) {
      builder.maxFileSizeBytes(toSize("maxFileSizeBytes", maxSize));
    }
    Object start = map.get("startDate");
    if (start != null) {
      builder.startDate(toDate("startDate", start));
    }
    Object end = map.get("endDate");
    if (end != null) {
      builder.endDate(toDate("endDate", end));
    }
    Object forms = map.get("formTypes");
    if (forms instanceof Collection) {
      List<String> list = new ArrayList<String>();
      for (Object form : (Collection<?>) forms) {
        list.add(YamlUtils.resolvePlaceholders(form.toString()).trim());
      }
      builder.formTypes(list);
    } else if (forms != null) {
      builder.formTypes(parseList(YamlUtils.resolvePlaceholders(forms.toString())));
    }
    Object amended = map.get("excludeAmended");
    if (amended != null) {
      builder.excludeAmended(toBoolean(amended));
    }
    Object restated = map.get("excludeRestated");
    if (restated != null) {
      builder.excludeRestated(toBoolean(restated));
    }
    Object userAgent = map.get("userAgent");
    if (userAgent != null) {
      builder.userAgent(YamlUtils.resolvePlaceholders(userAgent.toString()));
    }
    Object timeout = map.get("requestTimeoutSeconds");
    if (timeout != null) {
      builder.requestTimeout(Duration.ofSeconds(toLong("requestTimeoutSeconds", timeout)));
    }
    return builder;
  }

  /** Splits a comma-separated list, dropping blanks. */
  public static List<String> parseList(String value) {
    List<String> result = new ArrayList<String>();
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        result.add(trimmed);
      }
    }
    return result;
  }

  private static double toDouble(String key, Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(YamlUtils.resolvePlaceholders(value.toString()).trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid number for " + key + ": " + value, e);
    }
  }

  private static int toInt(String key, Object value) {
    long number = toLong(key, value);
    if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
      throw new ConfigurationException("Value for " + key + " is out of range: " + value);
    }
    return (int) number;
  }

  private static long toLong(String key, Object value) {
    if (value instanceof BigInteger) {
      if (((BigInteger) value).bitLength() > 63) {
        throw new ConfigurationException("Value for " + key + " is out of range: " + value);
      }
      return ((BigInteger) value).longValue();
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return Long.parseLong(YamlUtils.resolvePlaceholders(value.toString()).trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
    }
  }

  private static long toSize(String key, Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return SecUtils.parseFileSize(YamlUtils.resolvePlaceholders(value.toString()));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid size for " + key + ": " + value, e);
    }
  }

  private static LocalDate toDate(String key, Object value) {
    if (value instanceof Number) {
      // unquoted YAML dates arrive as epoch milliseconds (UTC)
      return Instant.ofEpochMilli(((Number) value).longValue())
          .atZone(ZoneOffset.UTC).toLocalDate();
    }
    try {
      return SecUtils.parseSecDate(YamlUtils.resolvePlaceholders(value.toString()));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid date for " + key + ": " + value, e);
    }
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return Boolean.parseBoolean(YamlUtils.resolvePlaceholders(value.toString()).trim());
  }

  @Override public String toString() {
    return "CrawlConfig{maxRequestsPerSecond=" + maxRequestsPerSecond
        + ", maxRetries=" + maxRetries
        + ", retryDelaySeconds=" + retryDelaySeconds
        + ", maxFileSizeBytes=" + maxFileSizeBytes
        + ", startDate=" + startDate
        + ", endDate=" + endDate
        + ", formTypes=" + formTypes
        + ", excludeAmended=" + excludeAmended
        + ", excludeRestated=" + excludeRestated
        + ", userAgent='" + userAgent + "'"
        + ", requestTimeout=" + requestTimeout
        + "}";
  }

  /**
   * Builder for CrawlConfig.
   */
  public static class Builder {
    private double maxRequestsPerSecond = DEFAULT_MAX_REQUESTS_PER_SECOND;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private long retryDelaySeconds = DEFAULT_RETRY_DELAY_SECONDS;
    private long maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE_BYTES;
    private @Nullable LocalDate startDate;
    private @Nullable LocalDate endDate;
    private @Nullable Set<String> formTypes;
    private boolean excludeAmended;
    private boolean excludeRestated;
    private String userAgent = DEFAULT_USER_AGENT;
    private Duration requestTimeout = Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);

    public Builder maxRequestsPerSecond(double maxRequestsPerSecond) {
      this.maxRequestsPerSecond = maxRequestsPerSecond;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryDelaySeconds(long retryDelaySeconds) {
      this.retryDelaySeconds = retryDelaySeconds;
      return this;
    }

    public Builder maxFileSizeBytes(long maxFileSizeBytes) {
      this.maxFileSizeBytes = maxFileSizeBytes;
      return this;
    }

    public Builder startDate(@Nullable LocalDate startDate) {
      this.startDate = startDate;
      return this;
    }

    public Builder endDate(@Nullable LocalDate endDate) {
      this.endDate = endDate;
      return this;
    }

    /** Restricts the crawl to these form types; null or empty allows all. */
    public Builder formTypes(@Nullable Collection<String> formTypes) {
      if (formTypes == null || formTypes.isEmpty()) {
        this.formTypes = null;
      } else {
        ImmutableSet.Builder<String> normalized = ImmutableSet.builder();
        for (String formType : formTypes) {
          normalized.add(formType.trim().toUpperCase(Locale.ROOT));
        }
        this.formTypes = normalized.build();
      }
      return this;
    }

    public Builder excludeAmended(boolean excludeAmended) {
      this.excludeAmended = excludeAmended;
      return this;
    }

    public Builder excludeRestated(boolean excludeRestated) {
      this.excludeRestated = excludeRestated;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Validates and builds the configuration.
     *
     * @throws ConfigurationException if any value is out of range
     */
    public CrawlConfig build() {
      if (!(maxRequestsPerSecond > 0)) {
        throw new ConfigurationException(
            "maxRequestsPerSecond must be positive: " + maxRequestsPerSecond);
      }
      if (maxRetries < 0) {
        throw new ConfigurationException("maxRetries must not be negative: " + maxRetries);
      }
      if (retryDelaySeconds < 0) {
        throw new ConfigurationException(
            "retryDelaySeconds must not be negative: " + retryDelaySeconds);
      }
      if (maxFileSizeBytes <= 0) {
        throw new ConfigurationException("maxFileSizeBytes must be positive: " + maxFileSizeBytes);
      }
      if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
        throw new ConfigurationException(
            "startDate " + startDate + " is after endDate " + endDate);
      }
      if (userAgent == null || userAgent.trim().isEmpty()) {
        throw new ConfigurationException("userAgent must not be empty");
      }
      if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
        throw new ConfigurationException("requestTimeout must be positive: " + requestTimeout);
      }
      return new CrawlConfig(this);
    }
  }
}
