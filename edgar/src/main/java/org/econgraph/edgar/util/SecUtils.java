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
package org.econgraph.edgar.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static helpers for SEC EDGAR identifiers, URLs, dates and sizes.
 */
public final class SecUtils {

  public static final String SUBMISSIONS_BASE_URL = "https://data.sec.gov/submissions";
  public static final String COMPANY_FACTS_BASE_URL = "https://data.sec.gov/api/xbrl/companyfacts";
  public static final String ARCHIVES_BASE_URL = "https://www.sec.gov/Archives/edgar/data";

  /** Upper bound for exponential back-off, in seconds. */
  public static final long MAX_BACKOFF_SECONDS = 300;

  private static final Pattern CIK_PATTERN = Pattern.compile("\\d{1,10}");
  private static final Pattern ACCESSION_PATTERN =
      Pattern.compile("(\\d{10})-(\\d{2})-(\\d{6})");

  private static final List<DateTimeFormatter> DATE_FORMATS = ImmutableList.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.BASIC_ISO_DATE,
      DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT),
      DateTimeFormatter.ofPattern("MM-dd-yyyy", Locale.ROOT));

  private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

  private static final ImmutableSet<String> FORM_TYPES = ImmutableSet.of(
      "10-K", "10-Q", "8-K", "20-F", "40-F", "6-K", "11-K", "10-KT", "10-QT",
      "DEF 14A", "PRE 14A", "3", "4", "5", "144",
      "S-1", "S-3", "S-4", "S-8", "F-1", "F-3", "F-4",
      "POS AM", "POS EX", "POS PRE", "POS UPD", "POS ASR", "POS COR");

  private SecUtils() {
  }

  /** Left-pads a CIK with zeros to 10 digits. */
  public static String padCik(String cik) {
    String trimmed = requireValidCik(cik);
    return String.format(Locale.ROOT, "%010d", Long.parseLong(trimmed));
  }

  /** Removes leading zeros from a CIK, keeping at least one digit. */
  public static String unpadCik(String cik) {
    String trimmed = requireValidCik(cik);
    return Long.toString(Long.parseLong(trimmed));
  }

  public static boolean isValidCik(String cik) {
    return cik != null && CIK_PATTERN.matcher(cik.trim()).matches();
  }

  private static String requireValidCik(String cik) {
    if (!isValidCik(cik)) {
      throw new IllegalArgumentException("Invalid CIK: " + cik);
    }
    return cik.trim();
  }

  /**
   * Splits an accession number such as {@code 0000320193-23-000006} into its
   * filer CIK, two-digit year and sequence.
   */
  public static AccessionNumber parseAccessionNumber(String accession) {
    if (accession == null) {
      throw new IllegalArgumentException("Accession number is null");
    }
    Matcher matcher = ACCESSION_PATTERN.matcher(accession.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid accession number format: " + accession);
    }
    return new AccessionNumber(matcher.group(1), matcher.group(2), matcher.group(3));
  }

  public static String buildAccessionNumber(String cik, String year, String sequence) {
    return padCik(cik) + "-" + year + "-" + sequence;
  }

  public static String buildSubmissionsUrl(String cik) {
    return SUBMISSIONS_BASE_URL + "/CIK" + padCik(cik) + ".json";
  }

  public static String buildCompanyFactsUrl(String cik) {
    return COMPANY_FACTS_BASE_URL + "/CIK" + padCik(cik) + ".json";
  }

  /** URL of the XBRL instance document named after the accession number. */
  public static String buildXbrlUrl(String accession) {
    AccessionNumber parts = parseAccessionNumber(accession);
    return ARCHIVES_BASE_URL + "/" + unpadCik(parts.getCik()) + "/"
        + accession.replace("-", "") + "/" + accession + ".xbrl";
  }

  /** URL of a named document inside a filing's archive folder. */
  public static String buildDocumentUrl(String cik, String accession, String document) {
    return ARCHIVES_BASE_URL + "/" + unpadCik(cik) + "/"
        + accession.replace("-", "") + "/" + document;
  }

  /**
   * Parses a date in any of the formats EDGAR uses: {@code yyyy-MM-dd},
   * {@code yyyyMMdd}, {@code MM/dd/yyyy} or {@code MM-dd-yyyy}.
   *
   * @throws IllegalArgumentException if no format matches
   */
  public static LocalDate parseSecDate(String value) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException("Date is empty");
    }
    String trimmed = value.trim();
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return LocalDate.parse(trimmed, format);
      } catch (DateTimeParseException e) {
        // try the next format
        continue;
      }
    }
    throw new IllegalArgumentException("Unable to parse date: " + value);
  }

  /** Formats a byte count such as {@code 1536} as {@code "1.5 KB"}. */
  public static String formatFileSize(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    double size = bytes;
    int unit = 0;
    while (size >= 1024 && unit < SIZE_UNITS.length - 1) {
      size /= 1024;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", size, SIZE_UNITS[unit]);
  }

  /**
   * Parses a size such as {@code "50MB"}, {@code "1.5 gb"} or {@code "1024"}.
   *
   * @throws IllegalArgumentException if the text is not a size
   */
  public static long parseFileSize(String text) {
    if (text == null || text.trim().isEmpty()) {
      throw new IllegalArgumentException("File size is empty");
    }
    String normalized = text.trim().toUpperCase(Locale.ROOT).replace(" ", "");
    int unitIndex = 0;
    String number = normalized;
    for (int i = SIZE_UNITS.length - 1; i >= 0; i--) {
      if (normalized.endsWith(SIZE_UNITS[i])) {
        unitIndex = i;
        number = normalized.substring(0, normalized.length() - SIZE_UNITS[i].length());
        break;
      }
    }
    try {
      double value = Double.parseDouble(number);
      if (value < 0) {
        throw new IllegalArgumentException("File size is negative: " + text);
      }
      return (long) (value * Math.pow(1024, unitIndex));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid file size: " + text, e);
    }
  }

  /** Exponential back-off in seconds, capped at {@link #MAX_BACKOFF_SECONDS}. */
  public static long backoffDelaySeconds(int attempt, long baseDelaySeconds) {
    if (attempt >= 31) {
      return MAX_BACKOFF_SECONDS;
    }
    long delay = baseDelaySeconds * (1L << Math.max(0, attempt));
    return Math.min(delay, MAX_BACKOFF_SECONDS);
  }

  /** Whether the form type is a known SEC form, optionally amended. */
  public static boolean isValidFormType(String formType) {
    if (formType == null) {
      return false;
    }
    String base = isAmendment(formType)
        ? formType.substring(0, formType.length() - 2)
        : formType;
    return FORM_TYPES.contains(base);
  }

  public static boolean isAmendment(String formType) {
    return formType != null && formType.endsWith("/A");
  }

  public static boolean isValidFiscalYear(int year) {
    return year >= 1900 && year <= 2100;
  }

  public static boolean isValidFiscalQuarter(int quarter) {
    return quarter >= 1 && quarter <= 4;
  }

  /** Calendar quarter (1..4) containing the date. */
  public static int fiscalQuarterOf(LocalDate date) {
    return (date.getMonthValue() - 1) / 3 + 1;
  }

  /**
   * Components of an accession number.
   */
  public static final class AccessionNumber {
    private final String cik;
    private final String year;
    private final String sequence;

    AccessionNumber(String cik, String year, String sequence) {
      this.cik = cik;
      this.year = year;
      this.sequence = sequence;
    }

    public String getCik() {
      return cik;
    }

    public String getYear() {
      return year;
    }

    public String getSequence() {
      return sequence;
    }

    @Override public String toString() {
      return cik + "-" + year + "-" + sequence;
    }
  }
}
