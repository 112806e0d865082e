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
import org.econgraph.edgar.FileSizeExceededException;
import org.econgraph.edgar.storage.DocumentMetadata;
import org.econgraph.edgar.storage.StorageStats;
import org.econgraph.edgar.storage.StoredDocumentRecord;
import org.econgraph.edgar.storage.XbrlDocumentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Crawls one company's filings from the filing source into the document store.
 *
 * <p>A crawl moves through the states of {@link CrawlState}. The filing
 * index is fetched with retries; if it cannot be fetched the crawl fails.
 * Otherwise every filing that passes the configured filters is downloaded
 * and stored in index order. A filing that cannot be downloaded, is too
 * large or cannot be stored is counted as failed and the crawl moves on.
 *
 * <p>One crawler may run several companies concurrently; its collaborators,
 * in particular the {@link RateLimiter}, are shared by all of them.
 */
public class SecEdgarCrawler {
  private static final Logger LOGGER = LoggerFactory.getLogger(SecEdgarCrawler.class);

  private final CrawlConfig config;
  private final FilingSource source;
  private final XbrlDocumentStore store;
  private final RateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final CrawlListener listener;

  public SecEdgarCrawler(CrawlConfig config, XbrlDocumentStore store) {
    this(config, new EdgarFilingSource(config), store,
        new RateLimiter(config.getMaxRequestsPerSecond()), Sleeper.SYSTEM, CrawlListener.NONE);
  }

  public SecEdgarCrawler(CrawlConfig config, FilingSource source, XbrlDocumentStore store,
      RateLimiter rateLimiter, Sleeper sleeper, CrawlListener listener) {
    this.config = config;
    this.source = source;
    this.store = store;
    this.rateLimiter = rateLimiter;
    this.retryPolicy = config.retryPolicy(sleeper);
    this.listener = listener;
  }

  public CrawlConfig getConfig() {
    return config;
  }

  public RateLimiter getRateLimiter() {
    return rateLimiter;
  }

  /**
   * Crawls every matching filing of one company.
   *
   * @param cik company identifier
   * @return the result; {@code success} is false only if the index could not
   *     be fetched or the crawl was interrupted
   */
  public CrawlResult crawlCompanyFilings(String cik) {
    CrawlResult.Tracker tracker = CrawlResult.start(cik, CrawlResult.COMPANY_FILINGS);
    StateHolder state = new StateHolder(cik);
    LOGGER.info("Starting crawl for company CIK: {}", cik);

    state.moveTo(CrawlState.ENUMERATING);
    RetryPolicy.Outcome<List<FilingInfo>> listing = retryPolicy.execute(
        "List filings for CIK " + cik,
        () -> {
          rateLimiter.acquire();
          return source.listFilings(cik);
        },
        SecEdgarCrawler::isTransient);
    if (!listing.isSuccess()) {
      String error = "Failed to enumerate filings for CIK " + cik + " after "
          + listing.getAttempts() + " attempt(s): " + listing.getFailureMessage();
      LOGGER.error(error);
      tracker.addError(error);
      state.moveTo(CrawlState.FAILED);
      return tracker.fail();
    }

    state.moveTo(CrawlState.FILTERING);
    List<FilingInfo> filings = filterFilings(listing.getValue());
    tracker.totalFilingsFound(filings.size());
    LOGGER.info("CIK {}: {} of {} filings selected for download", cik, filings.size(),
        listing.getValue().size());

    for (FilingInfo filing : filings) {
      state.moveTo(CrawlState.DOWNLOADING);
      if (!processFiling(filing, tracker, state)) {
        tracker.addError("Crawl for CIK " + cik + " interrupted");
        state.moveTo(CrawlState.FAILED);
        return tracker.fail();
      }
    }

    CrawlResult result = finish(filings.size(), tracker, state);
    LOGGER.info("Crawl {} for CIK {}: {} downloaded, {} failed",
        result.isSuccess() ? "completed" : "failed", cik,
        result.getFilingsDownloaded(), result.getFilingsFailed());
    return result;
  }

  /**
   * Downloads and stores a single known filing, without enumeration or filtering.
   */
  public CrawlResult crawlDocument(FilingInfo filing) {
    CrawlResult.Tracker tracker =
        CrawlResult.start(filing.getCik(), CrawlResult.SINGLE_DOCUMENT).totalFilingsFound(1);
    StateHolder state = new StateHolder(filing.getCik());
    state.moveTo(CrawlState.ENUMERATING);
    state.moveTo(CrawlState.FILTERING);
    state.moveTo(CrawlState.DOWNLOADING);
    if (!processFiling(filing, tracker, state)) {
      state.moveTo(CrawlState.FAILED);
      return tracker.fail();
    }
    return finish(1, tracker, state);
  }

  /**
   * Ends a crawl whose downloads have all been attempted. The crawl fails when
   * filings were selected and none of them could be stored; an empty selection
   * still completes.
   */
  private static CrawlResult finish(int selected, CrawlResult.Tracker tracker,
      StateHolder state) {
    if (selected > 0 && tracker.getFilingsDownloaded() == 0) {
      tracker.addError("All " + selected + " filing(s) failed for CIK " + state.cik);
      state.moveTo(CrawlState.FAILED);
      return tracker.fail();
    }
    state.moveTo(CrawlState.COMPLETED);
    return tracker.complete();
  }

  public StorageStats getStorageStats() throws IOException {
    return store.getStorageStats();
  }

  /**
   * Applies the configured filters, keeping index order. Filings without
   * XBRL data are always dropped.
   */
  public List<FilingInfo> filterFilings(List<FilingInfo> filings) {
    Set<String> formTypes = config.getFormTypes();
    List<FilingInfo> selected = new ArrayList<FilingInfo>();
    for (FilingInfo filing : filings) {
      String reason = null;
      if (!filing.hasFinancialData()) {
        reason = "no XBRL data";
      } else if (formTypes != null
          && !formTypes.contains(filing.getFormType().toUpperCase(Locale.ROOT))) {
        reason = "form type " + filing.getFormType() + " not requested";
      } else if (config.getStartDate() != null
          && filing.getFilingDate().isBefore(config.getStartDate())) {
        reason = "filed before " + config.getStartDate();
      } else if (config.getEndDate() != null
          && filing.getFilingDate().isAfter(config.getEndDate())) {
        reason = "filed after " + config.getEndDate();
      } else if (config.isExcludeAmended() && filing.isAmendment()) {
        reason = "amended filing";
      } else if (config.isExcludeRestated() && filing.isRestated()) {
        reason = "restated filing";
      }
      if (reason == null) {
        selected.add(filing);
      } else {
        LOGGER.debug("Skipping filing {}: {}", filing.getAccessionNumber(), reason);
      }
    }
    return selected;
  }

  /**
   * Downloads and stores one filing, recording the outcome on the tracker.
   *
   * @return false if the thread was interrupted and the crawl must stop
   */
  private boolean processFiling(FilingInfo filing, CrawlResult.Tracker tracker,
      StateHolder state) {
    String accession = filing.getAccessionNumber();
    long maxSize = config.getMaxFileSizeBytes();

    if (filing.getDeclaredSize() > maxSize) {
      recordFailure(tracker, accession,
          new FileSizeExceededException(accession, filing.getDeclaredSize(), maxSize)
              .getMessage());
      return true;
    }

    RetryPolicy.Outcome<byte[]> download = retryPolicy.execute(
        "Download filing " + accession,
        () -> {
          rateLimiter.acquire();
          return source.fetchDocument(filing);
        },
        SecEdgarCrawler::isTransient);
    if (Thread.currentThread().isInterrupted()) {
      return false;
    }
    if (!download.isSuccess()) {
      recordFailure(tracker, accession, "Failed to download filing " + accession + " after "
          + download.getAttempts() + " attempt(s): " + download.getFailureMessage());
      return true;
    }

    byte[] content = download.getValue();
    if (content.length > maxSize) {
      recordFailure(tracker, accession,
          new FileSizeExceededException(accession, content.length, maxSize).getMessage());
      return true;
    }

    state.moveTo(CrawlState.STORING);
    FilingDocument document = new FilingDocument(filing, content, source.documentUrl(filing));
    try {
      StoredDocumentRecord record = store.store(document.getContent(), metadataOf(document));
      tracker.recordDownloaded(document.getMeasuredSize());
      LOGGER.debug("Stored filing {} ({} bytes, method={}, compressed={})", accession,
          record.getOriginalSize(), record.getStorageMethod().getValue(), record.isCompressed());
    } catch (IOException | RuntimeException e) {
      recordFailure(tracker, accession,
          "Failed to store filing " + accession + ": " + e.getMessage());
    }
    return true;
  }

  private static void recordFailure(CrawlResult.Tracker tracker, String accession,
      String error) {
    LOGGER.warn("Filing {} failed: {}", accession, error);
    tracker.recordFailed(error);
  }

  static DocumentMetadata metadataOf(FilingDocument document) {
    return DocumentMetadata.builder(document.getAccessionNumber())
        .cik(document.getCik())
        .filingType(document.getFilingType())
        .filingDate(document.getFilingDate())
        .periodEndDate(document.getPeriodEndDate())
        .fiscalYear(document.getFiscalYear())
        .fiscalQuarter(document.getFiscalQuarter())
        .sourceUrl(document.getSourceUrl())
        .build();
  }

  /** Network errors and retryable HTTP statuses are transient; nothing else is. */
  static boolean isTransient(Exception e) {
    if (e instanceof DataFetchException) {
      return ((DataFetchException) e).isTransient();
    }
    return e instanceof IOException;
  }

  /** Current state of one crawl, validated on every transition. */
  private final class StateHolder {
    private final String cik;
    private CrawlState current = CrawlState.IDLE;

    StateHolder(String cik) {
      this.cik = cik;
    }

    void moveTo(CrawlState next) {
      if (!current.canTransitionTo(next)) {
        throw new IllegalStateException("Illegal crawl transition " + current + " -> " + next);
      }
      CrawlState previous = current;
      current = next;
      listener.onStateChange(cik, previous, next);
    }
  }
}
