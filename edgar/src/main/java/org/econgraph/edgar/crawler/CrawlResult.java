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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one crawl operation (a company's filings or a single document).
 *
 * <p>{@code success} says whether the operation could run at all: it is
 * false only when enumeration failed or the operation raised. The counters
 * say how well it went; per-filing failures leave {@code success} true.
 *
 * <p>Instances are immutable. A crawl in progress accumulates into a
 * {@link Tracker}, which stamps the end time exactly once when finished.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CrawlResult result = crawler.crawlCompanyFilings("320193");
 * if (result.isSuccess()) {
 *   System.out.println(result.getFilingsDownloaded() + " filings stored");
 * }
 * for (String error : result.getErrors()) {
 *   System.err.println("  - " + error);
 * }
 * }</pre>
 */
@JsonPropertyOrder({"operationId", "companyCik", "operationType", "startTime", "endTime",
    "totalFilingsFound", "filingsDownloaded", "filingsFailed", "totalBytesDownloaded",
    "success", "errors"})
public class CrawlResult {

  public static final String COMPANY_FILINGS = "company_filings";
  public static final String SINGLE_DOCUMENT = "single_document";

  private final UUID operationId;
  private final @Nullable String companyCik;
  private final String operationType;
  private final Instant startTime;
  private final Instant endTime;
  private final int totalFilingsFound;
  private final int filingsDownloaded;
  private final int filingsFailed;
  private final long totalBytesDownloaded;
  private final List<String> errors;
  private final boolean success;

  private CrawlResult(Tracker tracker, Instant endTime, boolean success) {
    this.operationId = tracker.operationId;
    this.companyCik = tracker.companyCik;
    this.operationType = tracker.operationType;
    this.startTime = tracker.startTime;
    this.endTime = endTime;
    this.totalFilingsFound = tracker.totalFilingsFound;
    this.filingsDownloaded = tracker.filingsDownloaded;
    this.filingsFailed = tracker.filingsFailed;
    this.totalBytesDownloaded = tracker.totalBytesDownloaded;
    this.errors = Collections.unmodifiableList(new ArrayList<String>(tracker.errors));
    this.success = success;
  }

  /**
   * Starts tracking a new operation at the current instant.
   */
  public static Tracker start(@Nullable String companyCik, String operationType) {
    return new Tracker(companyCik, operationType, Instant.now());
  }

  /**
   * Creates a failed result for an operation that raised instead of
   * returning, with zero counts and the error recorded.
   */
  public static CrawlResult failure(@Nullable String companyCik, String errorMessage) {
    Tracker tracker = start(companyCik, COMPANY_FILINGS);
    tracker.addError(errorMessage);
    return tracker.fail();
  }

  public UUID getOperationId() {
    return operationId;
  }

  public @Nullable String getCompanyCik() {
    return companyCik;
  }

  public String getOperationType() {
    return operationType;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Instant getEndTime() {
    return endTime;
  }

  /** Number of filings that passed filtering. */
  public int getTotalFilingsFound() {
    return totalFilingsFound;
  }

  public int getFilingsDownloaded() {
    return filingsDownloaded;
  }

  public int getFilingsFailed() {
    return filingsFailed;
  }

  public long getTotalBytesDownloaded() {
    return totalBytesDownloaded;
  }

  public List<String> getErrors() {
    return errors;
  }

  public boolean isSuccess() {
    return success;
  }

  /** Whether the operation ran and every filing was stored. */
  @JsonIgnore
  public boolean isCompleteSuccess() {
    return success && filingsFailed == 0;
  }

  @JsonIgnore
  public Duration getDuration() {
    return Duration.between(startTime, endTime);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("CrawlResult{cik=").append(companyCik);
    sb.append(", type=").append(operationType);
    if (success) {
      sb.append(", filings=").append(filingsDownloaded).append("/").append(totalFilingsFound);
      if (filingsFailed > 0) {
        sb.append(" (").append(filingsFailed).append(" failed)");
      }
      sb.append(", bytes=").append(totalBytesDownloaded);
    } else {
      sb.append(", FAILED");
      if (!errors.isEmpty()) {
        sb.append(": ").append(errors.get(errors.size() - 1));
      }
    }
    sb.append(", elapsed=").append(getDuration().toMillis()).append("ms");
    sb.append("}");
    return sb.toString();
  }

  /**
   * Mutable accumulator for a crawl in progress. Owned by the single task
   * running the operation and not shared.
   */
  public static class Tracker {
    private final UUID operationId = UUID.randomUUID();
    private final @Nullable String companyCik;
    private final String operationType;
    private final Instant startTime;
    private int totalFilingsFound;
    private int filingsDownloaded;
    private int filingsFailed;
    private long totalBytesDownloaded;
    private final List<String> errors = new ArrayList<String>();
    private @Nullable CrawlResult finished;

    Tracker(@Nullable String companyCik, String operationType, Instant startTime) {
      this.companyCik = companyCik;
      this.operationType = operationType;
      this.startTime = startTime;
    }

    public Tracker totalFilingsFound(int totalFilingsFound) {
      checkOpen();
      this.totalFilingsFound = totalFilingsFound;
      return this;
    }

    /** Records a filing that was downloaded and stored. */
    public Tracker recordDownloaded(long bytes) {
      checkOpen();
      filingsDownloaded++;
      totalBytesDownloaded += bytes;
      return this;
    }

    /** Records a filing that failed, with the reason. */
    public Tracker recordFailed(String error) {
      checkOpen();
      filingsFailed++;
      errors.add(error);
      return this;
    }

    /** Records an error that is not tied to a filing count. */
    public Tracker addError(String error) {
      checkOpen();
      errors.add(error);
      return this;
    }

    public int getFilingsDownloaded() {
      return filingsDownloaded;
    }

    public int getFilingsFailed() {
      return filingsFailed;
    }

    /** Finishes the operation as having run to completion. */
    public CrawlResult complete() {
      return finish(true);
    }

    /** Finishes the operation as unable to run. */
    public CrawlResult fail() {
      return finish(false);
    }

    private CrawlResult finish(boolean success) {
      checkOpen();
      finished = new CrawlResult(this, Instant.now(), success);
      return finished;
    }

    private void checkOpen() {
      if (finished != null) {
        throw new IllegalStateException("Operation " + operationId + " already finished");
      }
    }
  }
}
