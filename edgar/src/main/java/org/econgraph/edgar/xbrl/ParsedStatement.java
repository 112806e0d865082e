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
package org.econgraph.edgar.xbrl;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Financial data extracted from one filing document.
 *
 * <p>{@link #getConcepts()} holds one authoritative value per concept, taken
 * from the filing's primary reporting period. Values reported for other
 * periods or breakdowns are kept in {@link #getAlternates()}.
 *
 * <p>Instances are immutable.
 */
@JsonPropertyOrder({"id", "companyCik", "filingType", "periodEndDate", "fiscalYear",
    "fiscalQuarter", "documentType", "concepts", "alternates", "warnings"})
public class ParsedStatement {
  private final UUID id;
  private final @Nullable String companyCik;
  private final @Nullable String filingType;
  private final @Nullable LocalDate periodEndDate;
  private final @Nullable Integer fiscalYear;
  private final @Nullable Integer fiscalQuarter;
  private final DocumentType documentType;
  private final ImmutableList<TaxonomyConcept> concepts;
  private final ImmutableList<TaxonomyConcept> alternates;
  private final ImmutableList<String> warnings;

  public ParsedStatement(UUID id, @Nullable String companyCik, @Nullable String filingType,
      @Nullable LocalDate periodEndDate, @Nullable Integer fiscalYear,
      @Nullable Integer fiscalQuarter, DocumentType documentType,
      List<TaxonomyConcept> concepts, List<TaxonomyConcept> alternates, List<String> warnings) {
    this.id = id;
    this.companyCik = companyCik;
    this.filingType = filingType;
    this.periodEndDate = periodEndDate;
    this.fiscalYear = fiscalYear;
    this.fiscalQuarter = fiscalQuarter;
    this.documentType = documentType;
    this.concepts = ImmutableList.copyOf(concepts);
    this.alternates = ImmutableList.copyOf(alternates);
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public UUID getId() {
    return id;
  }

  /** Ten-digit CIK, or null if the document does not identify the company. */
  public @Nullable String getCompanyCik() {
    return companyCik;
  }

  public @Nullable String getFilingType() {
    return filingType;
  }

  public @Nullable LocalDate getPeriodEndDate() {
    return periodEndDate;
  }

  public @Nullable Integer getFiscalYear() {
    return fiscalYear;
  }

  /** 1 to 4, or null for annual reports. */
  public @Nullable Integer getFiscalQuarter() {
    return fiscalQuarter;
  }

  public DocumentType getDocumentType() {
    return documentType;
  }

  public List<TaxonomyConcept> getConcepts() {
    return concepts;
  }

  public List<TaxonomyConcept> getAlternates() {
    return alternates;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  /**
   * Finds the authoritative concept by local name ({@code Assets}) or
   * qualified name ({@code us-gaap:Assets}).
   */
  public Optional<TaxonomyConcept> findConcept(String name) {
    for (TaxonomyConcept concept : concepts) {
      if (concept.getName().equals(name) || concept.getQualifiedName().equals(name)) {
        return Optional.of(concept);
      }
    }
    return Optional.empty();
  }

  public Optional<BigDecimal> findValue(String name) {
    return findConcept(name).map(TaxonomyConcept::getValue);
  }

  @Override public String toString() {
    return "ParsedStatement{" + companyCik + " " + filingType + " " + periodEndDate
        + ", concepts=" + concepts.size() + ", alternates=" + alternates.size()
        + ", warnings=" + warnings.size() + "}";
  }
}
