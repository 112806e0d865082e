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

import org.econgraph.edgar.DataFetchException;
import org.econgraph.edgar.storage.StoredDocumentRecord;

import com.google.common.base.Ticker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link SecEdgarCrawler}. */
@Tag("unit")
class SecEdgarCrawlerTest {
  private static final String CIK = "0000320193";

  private ScriptedFilingSource source;
  private InMemoryXbrlDocumentStore store;
  private List<Duration> sleeps;
  private List<String> transitions;

  @BeforeEach void setUp() {
    source = new ScriptedFilingSource();
    store = new InMemoryXbrlDocumentStore();
    sleeps = Collections.synchronizedList(new ArrayList<Duration>());
    transitions = Collections.synchronizedList(new ArrayList<String>());
  }

  private SecEdgarCrawler crawler(CrawlConfig config) {
    RateLimiter limiter = new RateLimiter(1000, Ticker.systemTicker(), d -> { });
    return new SecEdgarCrawler(config, source, store, limiter, sleeps::add,
        (cik, from, to) -> transitions.add(from + "->" + to));
  }

  private static FilingInfo filing(String accession, String form, String filed,
      String period) {
    return FilingInfo.builder()
        .cik(CIK)
        .accessionNumber(accession)
        .formType(form)
        .filingDate(LocalDate.parse(filed))
        .reportDate(LocalDate.parse(period))
        .inlineXbrl(true)
        .build();
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Test void testCrawlStoresEveryFiling() {
    FilingInfo annual = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    FilingInfo quarter = filing("0000320193-24-000006", "10-Q", "2024-02-02", "2023-12-30");
    source.listing(CIK, Arrays.asList(quarter, annual))
        .document(quarter.getAccessionNumber(), bytes("<xbrl>q1</xbrl>"))
        .document(annual.getAccessionNumber(), bytes("<xbrl>annual</xbrl>"));

    CrawlResult result = crawler(CrawlConfig.defaults()).crawlCompanyFilings(CIK);

    assertTrue(result.isSuccess());
    assertTrue(result.isCompleteSuccess());
    assertEquals(2, result.getTotalFilingsFound());
    assertEquals(2, result.getFilingsDownloaded());
    assertEquals(15 + 19, result.getTotalBytesDownloaded());
    List<StoredDocumentRecord> records = store.getRecords();
    assertEquals(2, records.size());
    StoredDocumentRecord first = records.get(0);
    assertEquals("0000320193-24-000006", first.getAccessionNumber());
    assertEquals("10-Q", first.getFilingType());
    assertEquals(LocalDate.of(2023, 12, 30), first.getPeriodEndDate());
    assertEquals(2023, first.getFiscalYear());
    assertEquals(4, first.getFiscalQuarter());
    assertEquals("memory://" + CIK + "/0000320193-24-000006", first.getSourceUrl());
    assertNull(records.get(1).getFiscalQuarter());
    assertEquals(Arrays.asList("IDLE->ENUMERATING", "ENUMERATING->FILTERING",
        "FILTERING->DOWNLOADING", "DOWNLOADING->STORING", "STORING->DOWNLOADING",
        "DOWNLOADING->STORING", "STORING->COMPLETED"), transitions);
  }

  @Test void testTransientDownloadErrorsAreRetried() {
    FilingInfo annual = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    source.listing(CIK, Arrays.asList(annual))
        .document(annual.getAccessionNumber(),
            DataFetchException.forStatus("memory://doc", 503),
            new IOException("connection reset"),
            bytes("<xbrl/>"));

    CrawlResult result = crawler(CrawlConfig.defaults()).crawlCompanyFilings(CIK);

    assertEquals(1, result.getFilingsDownloaded());
    assertEquals(0, result.getFilingsFailed());
    assertEquals(Arrays.asList(Duration.ofSeconds(5), Duration.ofSeconds(5)), sleeps);
  }

  @Test void testPermanentDownloadErrorIsNotRetried() {
    FilingInfo missing = filing("0000320193-23-000077", "10-Q", "2023-08-04", "2023-07-01");
    FilingInfo annual = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    source.listing(CIK, Arrays.asList(missing, annual))
        .document(annual.getAccessionNumber(), bytes("<xbrl/>"));

    CrawlResult result = crawler(CrawlConfig.defaults()).crawlCompanyFilings(CIK);

    assertTrue(result.isSuccess());
    assertFalse(result.isCompleteSuccess());
    assertEquals(1, result.getFilingsDownloaded());
    assertEquals(1, result.getFilingsFailed());
    assertTrue(sleeps.isEmpty());
    assertEquals(1, result.getErrors().size());
    assertTrue(result.getErrors().get(0).startsWith(
        "Failed to download filing 0000320193-23-000077 after 1 attempt(s): HTTP 404"));
  }

  @Test void testOversizedDocumentsAreNotStored() {
    FilingInfo declaredLarge = FilingInfo.builder()
        .cik(CIK)
        .accessionNumber("0000320193-23-000001")
        .formType("10-K")
        .filingDate(LocalDate.of(2023, 3, 1))
        .declaredSize(2048)
        .build();
    FilingInfo actualLarge = filing("0000320193-23-000002", "10-Q", "2023-05-01", "2023-03-31");
    FilingInfo small = filing("0000320193-23-000003", "10-Q", "2023-08-01", "2023-06-30");
    source.listing(CIK, Arrays.asList(declaredLarge, actualLarge, small))
        .document(actualLarge.getAccessionNumber(), new byte[1025])
        .document(small.getAccessionNumber(), new byte[1024]);
    CrawlConfig config = CrawlConfig.builder().maxFileSizeBytes(1024).build();

    CrawlResult result = crawler(config).crawlCompanyFilings(CIK);

    assertEquals(3, result.getTotalFilingsFound());
    assertEquals(1, result.getFilingsDownloaded());
    assertEquals(2, result.getFilingsFailed());
    assertEquals(1, store.getRecords().size());
    assertEquals("0000320193-23-000003", store.getRecords().get(0).getAccessionNumber());
    assertFalse(source.getCalls().contains("fetch 0000320193-23-000001"));
    assertEquals("Document 0000320193-23-000002 is 1025 bytes, exceeding the limit of 1024 bytes",
        result.getErrors().get(1));
  }

  @Test void testStorageFailureDoesNotStopCrawl() {
    FilingInfo first = filing("0000320193-23-000077", "10-Q", "2023-08-04", "2023-07-01");
    FilingInfo second = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    source.listing(CIK, Arrays.asList(first, second))
        .document(first.getAccessionNumber(), bytes("<a/>"))
        .document(second.getAccessionNumber(), bytes("<b/>"));
    store.failOn(first.getAccessionNumber());

    CrawlResult result = crawler(CrawlConfig.defaults()).crawlCompanyFilings(CIK);

    assertTrue(result.isSuccess());
    assertEquals(1, result.getFilingsDownloaded());
    assertEquals(1, result.getFilingsFailed());
    assertEquals("Failed to store filing 0000320193-23-000077: disk full",
        result.getErrors().get(0));
    assertTrue(transitions.contains("STORING->DOWNLOADING"));
    assertEquals("STORING->COMPLETED", transitions.get(transitions.size() - 1));
  }

  @Test void testEnumerationFailureFailsCrawl() {
    source.listing(CIK, DataFetchException.forStatus("memory://index", 503));

    CrawlResult result = crawler(CrawlConfig.builder().maxRetries(2).build())
        .crawlCompanyFilings(CIK);

    assertFalse(result.isSuccess());
    assertEquals(0, result.getTotalFilingsFound());
    assertEquals(3, source.getCalls().size());
    assertEquals(2, sleeps.size());
    assertTrue(result.getErrors().get(0)
        .startsWith("Failed to enumerate filings for CIK 0000320193 after 3 attempt(s)"));
    assertEquals("ENUMERATING->FAILED", transitions.get(transitions.size() - 1));
  }

  @Test void testEnumerationNotFoundIsNotRetried() {
    CrawlResult result = crawler(CrawlConfig.defaults()).crawlCompanyFilings("0000000001");
    assertFalse(result.isSuccess());
    assertEquals(1, source.getCalls().size());
  }

  @Test void testEmptyIndexCompletes() {
    source.listing(CIK, Collections.<FilingInfo>emptyList());
    CrawlResult result = crawler(CrawlConfig.defaults()).crawlCompanyFilings(CIK);
    assertTrue(result.isSuccess());
    assertEquals(0, result.getTotalFilingsFound());
    assertEquals("FILTERING->COMPLETED", transitions.get(transitions.size() - 1));
  }

  @Test void testEveryFilingFailingFailsCrawl() {
    FilingInfo missing = filing("0000320193-23-000077", "10-Q", "2023-08-04", "2023-07-01");
    FilingInfo broken = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    source.listing(CIK, Arrays.asList(missing, broken))
        .document(broken.getAccessionNumber(), bytes("<b/>"));
    store.failOn(broken.getAccessionNumber());

    CrawlResult result = crawler(CrawlConfig.defaults()).crawlCompanyFilings(CIK);

    assertFalse(result.isSuccess());
    assertEquals(2, result.getTotalFilingsFound());
    assertEquals(0, result.getFilingsDownloaded());
    assertEquals(2, result.getFilingsFailed());
    assertEquals(3, result.getErrors().size());
    assertEquals("All 2 filing(s) failed for CIK 0000320193", result.getErrors().get(2));
    assertEquals("STORING->FAILED", transitions.get(transitions.size() - 1));
  }

  @Test void testAmendedAndUnrequestedFormsAreNeverFetched() {
    FilingInfo annual = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    FilingInfo quarter = filing("0000320193-24-000006", "10-Q", "2024-02-02", "2023-12-30");
    FilingInfo amended = filing("0000320193-24-000010", "10-K/A", "2024-03-01", "2023-09-30");
    source.listing(CIK, Arrays.asList(annual, quarter, amended))
        .document(annual.getAccessionNumber(), bytes("<xbrl>annual</xbrl>"))
        .document(quarter.getAccessionNumber(), bytes("<xbrl>q1</xbrl>"))
        .document(amended.getAccessionNumber(), bytes("<xbrl>amended</xbrl>"));
    CrawlConfig config = CrawlConfig.builder()
        .formTypes(Arrays.asList("10-K", "10-Q"))
        .excludeAmended(true)
        .build();

    CrawlResult result = crawler(config).crawlCompanyFilings(CIK);

    assertTrue(result.isCompleteSuccess());
    assertEquals(2, result.getTotalFilingsFound());
    assertEquals(2, result.getFilingsDownloaded());
    assertEquals(Arrays.asList("list " + CIK, "fetch 0000320193-23-000106",
        "fetch 0000320193-24-000006"), source.getCalls());
    assertFalse(source.getCalls().contains("fetch 0000320193-24-000010"));
    assertEquals(2, store.getRecords().size());
  }

  @Test void testFilterFilings() {
    FilingInfo annual = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    FilingInfo amended = filing("0000320193-23-000110", "10-K/A", "2023-12-01", "2023-09-30");
    FilingInfo old = filing("0000320193-19-000010", "10-Q", "2019-05-01", "2019-03-30");
    FilingInfo late = filing("0000320193-25-000001", "10-Q", "2025-02-01", "2024-12-28");
    FilingInfo current = FilingInfo.builder()
        .cik(CIK)
        .accessionNumber("0000320193-23-000200")
        .formType("8-K")
        .filingDate(LocalDate.of(2023, 6, 1))
        .xbrl(false)
        .build();
    FilingInfo restated = FilingInfo.builder()
        .cik(CIK)
        .accessionNumber("0000320193-23-000300")
        .formType("10-Q")
        .filingDate(LocalDate.of(2023, 8, 1))
        .restated(true)
        .build();
    List<FilingInfo> all = Arrays.asList(annual, amended, old, late, current, restated);

    assertEquals(Arrays.asList(annual, amended, old, late, restated),
        crawler(CrawlConfig.defaults()).filterFilings(all));

    CrawlConfig config = CrawlConfig.builder()
        .formTypes(Arrays.asList("10-K", "10-Q"))
        .startDate(LocalDate.of(2020, 1, 1))
        .endDate(LocalDate.of(2024, 12, 31))
        .excludeAmended(true)
        .excludeRestated(true)
        .build();
    assertEquals(Arrays.asList(annual), crawler(config).filterFilings(all));
  }

  @Test void testCrawlDocument() {
    FilingInfo annual = filing("0000320193-23-000106", "10-K", "2023-11-03", "2023-09-30");
    source.document(annual.getAccessionNumber(), bytes("<xbrl/>"));

    CrawlResult result = crawler(CrawlConfig.defaults()).crawlDocument(annual);

    assertTrue(result.isSuccess());
    assertEquals(CrawlResult.SINGLE_DOCUMENT, result.getOperationType());
    assertEquals(1, result.getTotalFilingsFound());
    assertEquals(1, result.getFilingsDownloaded());
    assertEquals(1, store.getRecords().size());
  }

  @Test void testCrawlDocumentFailure() {
    FilingInfo missing = filing("0000320193-23-000077", "10-Q", "2023-08-04", "2023-07-01");

    CrawlResult result = crawler(CrawlConfig.defaults()).crawlDocument(missing);

    assertFalse(result.isSuccess());
    assertEquals(1, result.getFilingsFailed());
    assertEquals("All 1 filing(s) failed for CIK 0000320193",
        result.getErrors().get(result.getErrors().size() - 1));
    assertEquals("DOWNLOADING->FAILED", transitions.get(transitions.size() - 1));
  }
}
