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
package org.econgraph.edgar.storage;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Descriptive fields stored with a filing document.
 */
public class DocumentMetadata {
  private final String accessionNumber;
  private final @Nullable String cik;
  private final @Nullable String filingType;
  private final @Nullable LocalDate filingDate;
  private final @Nullable LocalDate periodEndDate;
  private final @Nullable Integer fiscalYear;
  private final @Nullable Integer fiscalQuarter;
  private final @Nullable String sourceUrl;

  private DocumentMetadata(Builder builder) {
    this.accessionNumber = Objects.requireNonNull(builder.accessionNumber, "accessionNumber");
    this.cik = builder.cik;
    this.filingType = builder.filingType;
    this.filingDate = builder.filingDate;
    this.periodEndDate = builder.periodEndDate;
    this.fiscalYear = builder.fiscalYear;
    this.fiscalQuarter = builder.fiscalQuarter;
    this.sourceUrl = builder.sourceUrl;
  }

  public static Builder builder(String accessionNumber) {
    return new Builder().accessionNumber(accessionNumber);
  }

  public String getAccessionNumber() {
    return accessionNumber;
  }

  public @Nullable String getCik() {
    return cik;
  }

  public @Nullable String getFilingType() {
    return filingType;
  }

  public @Nullable LocalDate getFilingDate() {
    return filingDate;
  }

  public @Nullable LocalDate getPeriodEndDate() {
    return periodEndDate;
  }

  public @Nullable Integer getFiscalYear() {
    return fiscalYear;
  }

  public @Nullable Integer getFiscalQuarter() {
    return fiscalQuarter;
  }

  public @Nullable String getSourceUrl() {
    return sourceUrl;
  }

  /**
   * Builder for DocumentMetadata.
   */
  public static class Builder {
    private String accessionNumber;
    private @Nullable String cik;
    private @Nullable String filingType;
    private @Nullable LocalDate filingDate;
    private @Nullable LocalDate periodEndDate;
    private @Nullable Integer fiscalYear;
    private @Nullable Integer fiscalQuarter;
    private @Nullable String sourceUrl;

    public Builder accessionNumber(String accessionNumber) {
      this.accessionNumber = accessionNumber;
      return this;
    }

    public Builder cik(@Nullable String cik) {
      this.cik = cik;
      return this;
    }

    public Builder filingType(@Nullable String filingType) {
      this.filingType = filingType;
      return this;
    }

    public Builder filingDate(@Nullable LocalDate filingDate) {
      this.filingDate = filingDate;
      return this;
    }

    public Builder periodEndDate(@Nullable LocalDate periodEndDate) {
      this.periodEndDate = periodEndDate;
      return this;
    }

    public Builder fiscalYear(@Nullable Integer fiscalYear) {
      this.fiscalYear = fiscalYear;
      return this;
    }

    public Builder fiscalQuarter(@Nullable Integer fiscalQuarter) {
      this.fiscalQuarter = fiscalQuarter;
      return this;
    }

    public Builder sourceUrl(@Nullable String sourceUrl) {
      this.sourceUrl = sourceUrl;
      return this;
    }

    public DocumentMetadata build() {
      return new DocumentMetadata(this);
    }
  }
}
