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
import org.econgraph.edgar.util.SecUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link FilingSource} backed by the SEC EDGAR HTTP endpoints.
 *
 * <p>The filing index comes from the submissions API
 * ({@code https://data.sec.gov/submissions/CIK##########.json}), whose
 * {@code filings.recent} block holds parallel arrays, one element per filing.
 * Documents come from the archives tree. Every request carries the
 * configured User-Agent, which SEC requires for fair-access compliance.
 */
public class EdgarFilingSource implements FilingSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(EdgarFilingSource.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final HttpClient httpClient;
  private final String userAgent;
  private final Duration requestTimeout;
  private final String submissionsBaseUrl;
  private final String archivesBaseUrl;

  public EdgarFilingSource(CrawlConfig config) {
    this(config, SecUtils.SUBMISSIONS_BASE_URL, SecUtils.ARCHIVES_BASE_URL);
  }

  public EdgarFilingSource(CrawlConfig config, String submissionsBaseUrl,
      String archivesBaseUrl) {
    this.userAgent = config.getUserAgent();
    this.requestTimeout = config.getRequestTimeout();
    this.submissionsBaseUrl = stripTrailingSlash(submissionsBaseUrl);
    this.archivesBaseUrl = stripTrailingSlash(archivesBaseUrl);
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(requestTimeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Override public List<FilingInfo> listFilings(String cik)
      throws IOException, InterruptedException {
    String paddedCik = SecUtils.padCik(cik);
    String url = submissionsBaseUrl + "/CIK" + paddedCik + ".json";
    HttpResponse<byte[]> response = send(url, "application/json");
    JsonNode submissions = MAPPER.readTree(response.body());
    List<FilingInfo> filings = parseSubmissions(paddedCik, submissions);
    LOGGER.debug("CIK {} ({}): {} filings in index", paddedCik,
        submissions.path("name").asText("unknown"), filings.size());
    return filings;
  }

  @Override public byte[] fetchDocument(FilingInfo filing)
      throws IOException, InterruptedException {
    return send(documentUrl(filing), "*/*").body();
  }

  @Override public String documentUrl(FilingInfo filing) {
    String accession = filing.getAccessionNumber();
    String folder = archivesBaseUrl + "/" + SecUtils.unpadCik(filing.getCik()) + "/"
        + accession.replace("-", "") + "/";
    String primary = filing.getPrimaryDocument();
    if (primary != null && !primary.isEmpty()) {
      return folder + primary;
    }
    return folder + accession + ".xbrl";
  }

  /**
   * Turns a submissions response into filing entries, skipping entries with
   * no accession number or an unparsable filing date.
   */
  static List<FilingInfo> parseSubmissions(String paddedCik, JsonNode submissions) {
    List<FilingInfo> filings = new ArrayList<FilingInfo>();
    JsonNode recent = submissions.path("filings").path("recent");
    JsonNode forms = recent.path("form");
    if (!forms.isArray()) {
      LOGGER.warn("No recent filings found for CIK {}", paddedCik);
      return filings;
    }
    JsonNode accessionNumbers = recent.path("accessionNumber");
    JsonNode filingDates = recent.path("filingDate");
    JsonNode reportDates = recent.path("reportDate");
    JsonNode primaryDocuments = recent.path("primaryDocument");
    JsonNode sizes = recent.path("size");
    JsonNode xbrlFlags = recent.path("isXBRL");
    JsonNode inlineFlags = recent.path("isInlineXBRL");

    for (int i = 0; i < forms.size(); i++) {
      String accession = text(accessionNumbers.get(i));
      String filingDateText = text(filingDates.get(i));
      if (accession == null || filingDateText == null) {
        continue;
      }
      LocalDate filingDate;
      try {
        filingDate = SecUtils.parseSecDate(filingDateText);
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Skipping filing {} with bad filing date '{}'", accession, filingDateText);
        continue;
      }
      filings.add(FilingInfo.builder()
          .cik(paddedCik)
          .accessionNumber(accession)
          .formType(forms.get(i).asText())
          .filingDate(filingDate)
          .reportDate(optionalDate(reportDates.get(i)))
          .primaryDocument(text(primaryDocuments.get(i)))
          .declaredSize(sizes.has(i) ? sizes.get(i).asLong(0) : 0)
          .xbrl(xbrlFlags.has(i) ? xbrlFlags.get(i).asInt(0) != 0 : true)
          .inlineXbrl(inlineFlags.has(i) && inlineFlags.get(i).asInt(0) != 0)
          .build());
    }
    return filings;
  }

  private HttpResponse<byte[]> send(String url, String accept)
      throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(requestTimeout)
        .header("User-Agent", userAgent)
        .header("Accept", accept)
        .GET()
        .build();
    HttpResponse<byte[]> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw DataFetchException.forStatus(url, response.statusCode());
    }
    return response;
  }

  private static @Nullable LocalDate optionalDate(@Nullable JsonNode node) {
    String value = text(node);
    if (value == null) {
      return null;
    }
    try {
      return SecUtils.parseSecDate(value);
    } catch (IllegalArgumentException e) {
      LOGGER.debug("Ignoring unparsable report date '{}'", value);
      return null;
    }
  }

  private static @Nullable String text(@Nullable JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    String value = node.asText("").trim();
    return value.isEmpty() ? null : value;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
