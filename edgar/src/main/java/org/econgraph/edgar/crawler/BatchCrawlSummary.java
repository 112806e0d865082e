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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-company results of a batch crawl, in request order.
 */
public class BatchCrawlSummary {
  private final Map<String, CrawlResult> results;
  private final Duration elapsed;

  public BatchCrawlSummary(Map<String, CrawlResult> results, Duration elapsed) {
    this.results = Collections.unmodifiableMap(new LinkedHashMap<String, CrawlResult>(results));
    this.elapsed = elapsed;
  }

  public Map<String, CrawlResult> getResults() {
    return results;
  }

  @JsonIgnore
  public Duration getElapsed() {
    return elapsed;
  }

  public long getElapsedMs() {
    return elapsed.toMillis();
  }

  public int getTotalCompanies() {
    return results.size();
  }

  @JsonIgnore
  public List<String> getSuccessfulCompanies() {
    List<String> successful = new ArrayList<String>();
    for (Map.Entry<String, CrawlResult> entry : results.entrySet()) {
      if (entry.getValue().isSuccess()) {
        successful.add(entry.getKey());
      }
    }
    return successful;
  }

  public List<String> getFailedCompanies() {
    return BatchCrawlOrchestrator.failedCiks(results);
  }

  public long getTotalFilingsDownloaded() {
    long total = 0;
    for (CrawlResult result : results.values()) {
      total += result.getFilingsDownloaded();
    }
    return total;
  }

  public long getTotalFilingsFailed() {
    long total = 0;
    for (CrawlResult result : results.values()) {
      total += result.getFilingsFailed();
    }
    return total;
  }

  public long getTotalBytesDownloaded() {
    long total = 0;
    for (CrawlResult result : results.values()) {
      total += result.getTotalBytesDownloaded();
    }
    return total;
  }

  /**
   * Renders the human-readable report printed by the batch command.
   */
  public String formatReport() {
    StringBuilder sb = new StringBuilder();
    sb.append("=========================================\n");
    sb.append("BATCH CRAWL SUMMARY\n");
    sb.append("=========================================\n");
    sb.append(String.format(Locale.ROOT, "Companies:          %d%n", getTotalCompanies()));
    sb.append(String.format(Locale.ROOT, "Successful:         %d%n",
        getSuccessfulCompanies().size()));
    sb.append(String.format(Locale.ROOT, "Failed:             %d%n", getFailedCompanies().size()));
    sb.append(String.format(Locale.ROOT, "Filings downloaded: %d%n", getTotalFilingsDownloaded()));
    sb.append(String.format(Locale.ROOT, "Filings failed:     %d%n", getTotalFilingsFailed()));
    sb.append(String.format(Locale.ROOT, "Bytes downloaded:   %d%n", getTotalBytesDownloaded()));
    sb.append(String.format(Locale.ROOT, "Elapsed:            %.1f s%n",
        elapsed.toMillis() / 1000.0));

    List<String> failed = getFailedCompanies();
    if (!failed.isEmpty()) {
      sb.append("\nFAILED COMPANIES\n");
      for (String cik : failed) {
        List<String> errors = results.get(cik).getErrors();
        sb.append("  ").append(cik).append(": ")
            .append(errors.isEmpty() ? "unknown error" : errors.get(errors.size() - 1))
            .append('\n');
      }
    }

    sb.append("\nCOMPANY DETAILS\n");
    sb.append(String.format(Locale.ROOT, "  %-12s %-8s %8s %10s %8s %14s%n",
        "CIK", "STATUS", "FOUND", "DOWNLOADED", "FAILED", "BYTES"));
    for (Map.Entry<String, CrawlResult> entry : results.entrySet()) {
      CrawlResult result = entry.getValue();
      sb.append(String.format(Locale.ROOT, "  %-12s %-8s %8d %10d %8d %14d%n",
          entry.getKey(), result.isSuccess() ? "OK" : "FAILED",
          result.getTotalFilingsFound(), result.getFilingsDownloaded(),
          result.getFilingsFailed(), result.getTotalBytesDownloaded()));
      for (String error : result.getErrors()) {
        if (result.isSuccess()) {
          sb.append("      - ").append(error).append('\n');
        }
      }
    }
    return sb.toString();
  }
}
