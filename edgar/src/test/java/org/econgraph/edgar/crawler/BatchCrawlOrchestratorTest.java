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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ticker;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link BatchCrawlOrchestrator} and {@link BatchCrawlSummary}. */
@Tag("unit")
class BatchCrawlOrchestratorTest {

  @Test void testConcurrencyIsBounded() {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxSeen = new AtomicInteger();
    BatchCrawlOrchestrator orchestrator = new BatchCrawlOrchestrator(cik -> {
      int now = inFlight.incrementAndGet();
      maxSeen.accumulateAndGet(now, Math::max);
      try {
        TimeUnit.MILLISECONDS.sleep(50);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      inFlight.decrementAndGet();
      return CrawlResult.start(cik, CrawlResult.COMPANY_FILINGS)
          .totalFilingsFound(1)
          .recordDownloaded(10)
          .complete();
    }, 2);

    BatchCrawlSummary summary =
        orchestrator.crawlCompanies(Arrays.asList("1", "2", "3", "4", "5"));

    assertTrue(maxSeen.get() <= 2, "max in flight " + maxSeen.get());
    assertEquals(5, summary.getTotalCompanies());
    assertEquals(Arrays.asList("1", "2", "3", "4", "5"),
        List.copyOf(summary.getResults().keySet()));
    assertEquals(5, summary.getTotalFilingsDownloaded());
    assertEquals(50, summary.getTotalBytesDownloaded());
    assertTrue(summary.getFailedCompanies().isEmpty());
  }

  @Test void testRaisingCrawlBecomesFailedResult() {
    BatchCrawlOrchestrator orchestrator = new BatchCrawlOrchestrator(cik -> {
      if (cik.equals("2")) {
        throw new IllegalStateException("database unavailable");
      }
      if (cik.equals("3")) {
        return CrawlResult.failure(cik, "Failed to enumerate filings for CIK 3");
      }
      return CrawlResult.start(cik, CrawlResult.COMPANY_FILINGS).complete();
    }, BatchCrawlOrchestrator.DEFAULT_MAX_CONCURRENT);

    BatchCrawlSummary summary = orchestrator.crawlCompanies(Arrays.asList("1", "2", "3", "1"));

    assertEquals(3, summary.getTotalCompanies());
    assertEquals(Arrays.asList("1"), summary.getSuccessfulCompanies());
    assertEquals(Arrays.asList("2", "3"), summary.getFailedCompanies());
    CrawlResult raised = summary.getResults().get("2");
    assertFalse(raised.isSuccess());
    assertEquals("IllegalStateException: database unavailable", raised.getErrors().get(0));
    String report = summary.formatReport();
    assertTrue(report.contains("BATCH CRAWL SUMMARY"));
    assertTrue(report.contains("  2: IllegalStateException: database unavailable"));
    assertTrue(report.contains("Failed:             2"));
  }

  @Test void testDuplicateCiksAreCrawledOnce() {
    List<String> crawled = Collections.synchronizedList(new ArrayList<String>());
    BatchCrawlOrchestrator orchestrator = new BatchCrawlOrchestrator(cik -> {
      crawled.add(cik);
      return CrawlResult.start(cik, CrawlResult.COMPANY_FILINGS).complete();
    }, 1);

    BatchCrawlSummary summary =
        orchestrator.crawlCompanies(Arrays.asList("320193", " 320193", "789019", "320193 "));

    assertEquals(Arrays.asList("320193", "789019"), crawled);
    assertEquals(2, summary.getTotalCompanies());
    assertEquals(Arrays.asList("320193", "789019"),
        List.copyOf(summary.getResults().keySet()));
  }

  @Test void testSharedCrawler() {
    ScriptedFilingSource source = new ScriptedFilingSource();
    InMemoryXbrlDocumentStore store = new InMemoryXbrlDocumentStore();
    for (int i = 1; i <= 4; i++) {
      String cik = String.format(Locale.ROOT, "%010d", i);
      FilingInfo filing = FilingInfo.builder()
          .cik(cik)
          .accessionNumber(cik + "-23-000001")
          .formType("10-K")
          .filingDate(LocalDate.of(2023, 3, i))
          .build();
      source.listing(cik, Arrays.asList(filing))
          .document(filing.getAccessionNumber(), new byte[] {1, 2, 3});
    }
    SecEdgarCrawler crawler = new SecEdgarCrawler(CrawlConfig.defaults(), source, store,
        new RateLimiter(1000, Ticker.systemTicker(), d -> { }), d -> { }, CrawlListener.NONE);

    BatchCrawlSummary summary = new BatchCrawlOrchestrator(crawler, 2).crawlCompanies(
        Arrays.asList("0000000001", "0000000002", "0000000003", "0000000004"));

    assertEquals(4, summary.getSuccessfulCompanies().size());
    assertEquals(4, store.getRecords().size());
    assertEquals(12, summary.getTotalBytesDownloaded());
  }

  @Test void testSummaryJson() {
    CrawlResult ok = CrawlResult.start("1", CrawlResult.COMPANY_FILINGS).complete();
    Map<String, CrawlResult> results = new LinkedHashMap<String, CrawlResult>();
    results.put("1", ok);
    BatchCrawlSummary summary = new BatchCrawlSummary(results, Duration.ofMillis(1500));
    JsonNode json = new ObjectMapper().findAndRegisterModules().valueToTree(summary);
    assertEquals(1500, json.path("elapsedMs").asLong());
    assertEquals(1, json.path("totalCompanies").asInt());
    assertTrue(json.path("results").has("1"));
    assertFalse(json.has("elapsed"));
  }

  @Test void testRejectsZeroConcurrency() {
    assertThrows(IllegalArgumentException.class,
        () -> new BatchCrawlOrchestrator(cik -> null, 0));
  }
}
