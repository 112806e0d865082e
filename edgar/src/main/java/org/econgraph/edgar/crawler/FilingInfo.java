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
import java.util.Objects;

/**
 * One entry of a company's filing index, before its document is fetched.
 */
public class FilingInfo {
  private final String cik;
  private final String accessionNumber;
  private final String formType;
  private final LocalDate filingDate;
  private final @Nullable LocalDate reportDate;
  private final @Nullable String primaryDocument;
  private final long declaredSize;
  private final boolean xbrl;
  private final boolean inlineXbrl;
  private final boolean restated;

  private FilingInfo(Builder builder) {
    this.cik = Objects.requireNonNull(builder.cik, "cik");
    this.accessionNumber = Objects.requireNonNull(builder.accessionNumber, "accessionNumber");
    this.formType = Objects.requireNonNull(builder.formType, "formType");
    this.filingDate = Objects.requireNonNull(builder.filingDate, "filingDate");
    this.reportDate = builder.reportDate;
    this.primaryDocument = builder.primaryDocument;
    this.declaredSize = builder.declaredSize;
    this.xbrl = builder.xbrl;
    this.inlineXbrl = builder.inlineXbrl;
    this.restated = builder.restated;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getCik() {
    return cik;
  }

  public String getAccessionNumber() {
    return accessionNumber;
  }

  public String getFormType() {
    return formType;
  }

  public LocalDate getFilingDate() {
    return filingDate;
  }

  public @Nullable LocalDate getReportDate() {
    return reportDate;
  }

  /** Period the filing reports on; falls back to the filing date. */
  public LocalDate getPeriodEndDate() {
    return reportDate != null ? reportDate : filingDate;
  }

  public @Nullable String getPrimaryDocument() {
    return primaryDocument;
  }

  /** Size reported by the index, or 0 when unknown. */
  public long getDeclaredSize() {
    return declaredSize;
  }

  public boolean isXbrl() {
    return xbrl;
  }

  public boolean isInlineXbrl() {
    return inlineXbrl;
  }

  /** Whether the filing has machine-readable financial data of either kind. */
  public boolean hasFinancialData() {
    return xbrl || inlineXbrl;
  }

  public boolean isAmendment() {
    return SecUtils.isAmendment(formType);
  }

  public boolean isRestated() {
    return restated;
  }

  @Override public String toString() {
    return "FilingInfo{" + accessionNumber + ", form=" + formType
        + ", filed=" + filingDate + ", period=" + reportDate + "}";
  }

  /**
   * Builder for FilingInfo.
   */
  public static class Builder {
    private String cik;
    private String accessionNumber;
    private String formType;
    private LocalDate filingDate;
    private @Nullable LocalDate reportDate;
    private @Nullable String primaryDocument;
    private long declaredSize;
    private boolean xbrl = true;
    private boolean inlineXbrl;
    private boolean restated;

    public Builder cik(String cik) {
      this.cik = cik;
      return this;
    }

    public Builder accessionNumber(String accessionNumber) {
      this.accessionNumber = accessionNumber;
      return this;
    }

    public Builder formType(String formType) {
      this.formType = formType;
      return this;
    }

    public Builder filingDate(LocalDate filingDate) {
      this.filingDate = filingDate;
      return this;
    }

    public Builder reportDate(@Nullable LocalDate reportDate) {
      this.reportDate = reportDate;
      return this;
    }

    public Builder primaryDocument(@Nullable String primaryDocument) {
      this.primaryDocument = primaryDocument;
      return this;
    }

    public Builder declaredSize(long declaredSize) {
      this.declaredSize = declaredSize;
      return this;
    }

    public Builder xbrl(boolean xbrl) {
      this.xbrl = xbrl;
      return this;
    }

    public Builder inlineXbrl(boolean inlineXbrl) {
      this.inlineXbrl = inlineXbrl;
      return this;
    }

    public Builder restated(boolean restated) {
      this.restated = restated;
      return this;
    }

    public FilingInfo build() {
      return new FilingInfo(this);
    }
  }
}
