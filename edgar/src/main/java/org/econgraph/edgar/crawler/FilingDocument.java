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

import org.econgraph.edgar.util.SecUtils;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;

/**
 * A downloaded filing document held in memory between download and storage.
 */
public class FilingDocument {
  private final String cik;
  private final String accessionNumber;
  private final String filingType;
  private final LocalDate filingDate;
  private final LocalDate periodEndDate;
  private final int fiscalYear;
  private final @Nullable Integer fiscalQuarter;
  private final byte[] content;
  private final long declaredSize;
  private final @Nullable String sourceUrl;

  public FilingDocument(FilingInfo filing, byte[] content, @Nullable String sourceUrl) {
    this.cik = filing.getCik();
    this.accessionNumber = filing.getAccessionNumber();
    this.filingType = filing.getFormType();
    this.filingDate = filing.getFilingDate();
    this.periodEndDate = filing.getPeriodEndDate();
    this.fiscalYear = periodEndDate.getYear();
    this.fiscalQuarter = filing.getFormType().startsWith("10-K")
        ? null
        : Integer.valueOf(SecUtils.fiscalQuarterOf(periodEndDate));
    this.content = content;
    this.declaredSize = filing.getDeclaredSize();
    this.sourceUrl = sourceUrl;
  }

  public String getCik() {
    return cik;
  }

  public String getAccessionNumber() {
    return accessionNumber;
  }

  public String getFilingType() {
    return filingType;
  }

  public LocalDate getFilingDate() {
    return filingDate;
  }

  public LocalDate getPeriodEndDate() {
    return periodEndDate;
  }

  public int getFiscalYear() {
    return fiscalYear;
  }

  /** Quarter of the reporting period; null for annual reports. */
  public @Nullable Integer getFiscalQuarter() {
    return fiscalQuarter;
  }

  public byte[] getContent() {
    return content;
  }

  /** Size in bytes of the downloaded content. */
  public long getMeasuredSize() {
    return content.length;
  }

  /** Size announced by the filing index, or 0 when unknown. */
  public long getDeclaredSize() {
    return declaredSize;
  }

  public @Nullable String getSourceUrl() {
    return sourceUrl;
  }
}
