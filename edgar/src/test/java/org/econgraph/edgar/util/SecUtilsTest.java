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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link SecUtils}. */
@Tag("unit")
class SecUtilsTest {

  @Test void testPadAndUnpadCik() {
    assertEquals("0000320193", SecUtils.padCik("320193"));
    assertEquals("0000320193", SecUtils.padCik(" 0000320193 "));
    assertEquals("320193", SecUtils.unpadCik("0000320193"));
    assertEquals("0", SecUtils.unpadCik("0000000000"));
    assertThrows(IllegalArgumentException.class, () -> SecUtils.padCik("AAPL"));
    assertThrows(IllegalArgumentException.class, () -> SecUtils.padCik("12345678901"));
  }

  @Test void testAccessionNumber() {
    SecUtils.AccessionNumber parts = SecUtils.parseAccessionNumber("0000320193-23-000106");
    assertEquals("0000320193", parts.getCik());
    assertEquals("23", parts.getYear());
    assertEquals("000106", parts.getSequence());
    assertEquals("0000320193-23-000106", parts.toString());
    assertEquals("0000320193-23-000106", SecUtils.buildAccessionNumber("320193", "23", "000106"));
    assertThrows(IllegalArgumentException.class,
        () -> SecUtils.parseAccessionNumber("320193-23-106"));
  }

  @Test void testUrls() {
    assertEquals("https://data.sec.gov/submissions/CIK0000320193.json",
        SecUtils.buildSubmissionsUrl("320193"));
    assertEquals("https://data.sec.gov/api/xbrl/companyfacts/CIK0000320193.json",
        SecUtils.buildCompanyFactsUrl("320193"));
    assertEquals("https://www.sec.gov/Archives/edgar/data/320193/000032019323000106/"
            + "0000320193-23-000106.xbrl",
        SecUtils.buildXbrlUrl("0000320193-23-000106"));
    assertEquals("https://www.sec.gov/Archives/edgar/data/320193/000032019323000106/"
            + "aapl-20230930.htm",
        SecUtils.buildDocumentUrl("0000320193", "0000320193-23-000106", "aapl-20230930.htm"));
  }

  @Test void testParseSecDate() {
    LocalDate expected = LocalDate.of(2023, 9, 30);
    assertEquals(expected, SecUtils.parseSecDate("2023-09-30"));
    assertEquals(expected, SecUtils.parseSecDate("20230930"));
    assertEquals(expected, SecUtils.parseSecDate("09/30/2023"));
    assertEquals(expected, SecUtils.parseSecDate("09-30-2023"));
    assertThrows(IllegalArgumentException.class, () -> SecUtils.parseSecDate(""));
    assertThrows(IllegalArgumentException.class, () -> SecUtils.parseSecDate("30.09.2023"));
  }

  @Test void testFileSizes() {
    assertEquals("512 B", SecUtils.formatFileSize(512));
    assertEquals("1.5 KB", SecUtils.formatFileSize(1536));
    assertEquals("50.0 MB", SecUtils.formatFileSize(50L * 1024 * 1024));
    assertEquals(1024L, SecUtils.parseFileSize("1024"));
    assertEquals(50L * 1024 * 1024, SecUtils.parseFileSize("50MB"));
    assertEquals(1610612736L, SecUtils.parseFileSize("1.5 gb"));
    assertThrows(IllegalArgumentException.class, () -> SecUtils.parseFileSize("lots"));
    assertThrows(IllegalArgumentException.class, () -> SecUtils.parseFileSize("-1KB"));
  }

  @Test void testBackoff() {
    assertEquals(2, SecUtils.backoffDelaySeconds(0, 2));
    assertEquals(8, SecUtils.backoffDelaySeconds(2, 2));
    assertEquals(SecUtils.MAX_BACKOFF_SECONDS, SecUtils.backoffDelaySeconds(12, 2));
    assertEquals(SecUtils.MAX_BACKOFF_SECONDS, SecUtils.backoffDelaySeconds(40, 2));
  }

  @Test void testFormTypesAndPeriods() {
    assertTrue(SecUtils.isValidFormType("10-K"));
    assertTrue(SecUtils.isValidFormType("10-Q/A"));
    assertFalse(SecUtils.isValidFormType("10-X"));
    assertFalse(SecUtils.isValidFormType(null));
    assertTrue(SecUtils.isAmendment("10-K/A"));
    assertFalse(SecUtils.isAmendment("10-K"));
    assertTrue(SecUtils.isValidFiscalYear(2023));
    assertFalse(SecUtils.isValidFiscalYear(1899));
    assertTrue(SecUtils.isValidFiscalQuarter(4));
    assertFalse(SecUtils.isValidFiscalQuarter(5));
    assertEquals(3, SecUtils.fiscalQuarterOf(LocalDate.of(2024, 9, 28)));
    assertEquals(1, SecUtils.fiscalQuarterOf(LocalDate.of(2024, 1, 1)));
  }
}
