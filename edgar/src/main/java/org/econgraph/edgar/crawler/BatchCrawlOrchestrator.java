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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Crawls many companies with at most {@code maxConcurrent} in flight.
 *
 * <p>Admission is controlled by a semaphore with {@code maxConcurrent}
 * permits; finishing one company admits the next. Each company's outcome
 * is captured on its own. A crawl that raises instead of returning is
 * turned into a failed {@link CrawlResult}, so the summary always holds
 * exactly one entry per requested company.
 */
public class BatchCrawlOrchestrator {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchCrawlOrchestrator.class);

  public static final int DEFAULT_MAX_CONCURRENT = 3;

  private final Function<String, CrawlResult> companyCrawl;
  private final int maxConcurrent;

  public BatchCrawlOrchestrator(SecEdgarCrawler crawler, int maxConcurrent) {
    this(crawler::crawlCompanyFilings, maxConcurrent);
  }

  public BatchCrawlOrchestrator(Function<String, CrawlResult> companyCrawl, int maxConcurrent) {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be at least 1: " + maxConcurrent);
    }
    this.companyCrawl = companyCrawl;
    this.maxConcurrent = maxConcurrent;
  }

  public int getMaxConcurrent() {
    return maxConcurrent;
  }

  /**
   * Crawls every company and waits for all of them.
   *
   * @param ciks company identifiers; duplicates are crawled once
   */
  public BatchCrawlSummary crawlCompanies(List<String> ciks) {
    Set<String> unique = new LinkedHashSet<String>();
    for (String cik : ciks) {
      if (!unique.add(cik.trim())) {
        LOGGER.warn("Ignoring duplicate CIK {}", cik);
      }
    }
    Instant start = Instant.now();
    LOGGER.info("Starting batch crawl of {} companies, max {} concurrent", unique.size(),
        maxConcurrent);

    Semaphore permits = new Semaphore(maxConcurrent, true);
    ExecutorService executor =
        Executors.newFixedThreadPool(Math.max(1, Math.min(maxConcurrent, unique.size())));
    Map<String, CompletableFuture<CrawlResult>> futures =
        new LinkedHashMap<String, CompletableFuture<CrawlResult>>();
    try {
      for (final String cik : unique) {
        CompletableFuture<CrawlResult> future = CompletableFuture
            .supplyAsync(() -> crawlWithPermit(permits, cik), executor)
            .handle((result, error) -> {
              if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
                LOGGER.error("Crawl for CIK {} raised {}", cik, cause.toString());
                return CrawlResult.failure(cik, describe(cause));
              }
              if (result == null) {
                return CrawlResult.failure(cik, "Crawl returned no result");
              }
              return result;
            });
        futures.put(cik, future);
      }
      CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
    } finally {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
          LOGGER.warn("Batch executor did not terminate in time");
        }
      } catch (InterruptedException e) {
        LOGGER.warn("Batch executor interrupted: {}", e.getMessage());
        Thread.currentThread().interrupt();
      }
    }

    Map<String, CrawlResult> results = new LinkedHashMap<String, CrawlResult>();
    for (Map.Entry<String, CompletableFuture<CrawlResult>> entry : futures.entrySet()) {
      results.put(entry.getKey(), entry.getValue().join());
    }
    BatchCrawlSummary summary =
        new BatchCrawlSummary(results, Duration.between(start, Instant.now()));
    LOGGER.info("Batch crawl finished: {} succeeded, {} failed",
        summary.getSuccessfulCompanies().size(), summary.getFailedCompanies().size());
    return summary;
  }

  private CrawlResult crawlWithPermit(Semaphore permits, String cik) {
    permits.acquireUninterruptibly();
    try {
      LOGGER.debug("Admitted CIK {} ({} permits left)", cik, permits.availablePermits());
      return companyCrawl.apply(cik);
    } finally {
      permits.release();
    }
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message != null
        ? error.getClass().getSimpleName() + ": " + message
        : error.getClass().getSimpleName();
  }

  /** Lists the CIKs whose result is not successful. */
  static List<String> failedCiks(Map<String, CrawlResult> results) {
    List<String> failed = new ArrayList<String>();
    for (Map.Entry<String, CrawlResult> entry : results.entrySet()) {
      if (!entry.getValue().isSuccess()) {
        failed.add(entry.getKey());
      }
    }
    return failed;
  }
}
