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
package org.econgraph.edgar.ratio;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A ratio computed from one statement (or two, for growth rates).
 *
 * <p>The value is null whenever the ratio could not be computed;
 * {@link #getStatus()} and {@link #getNote()} say why.
 */
@JsonPropertyOrder({"id", "statementId", "name", "displayName", "category", "value",
    "status", "note", "formula", "inputConcepts", "inputValues", "interpretation",
    "benchmarkPercentile", "dataQualityScore", "periodEndDate", "fiscalYear", "fiscalQuarter"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalculatedRatio {
  private final UUID id = UUID.randomUUID();
  private final UUID statementId;
  private final String name;
  private final String displayName;
  private final String category;
  private final @Nullable BigDecimal value;
  private final RatioStatus status;
  private final @Nullable String note;
  private final String formula;
  private final ImmutableList<String> inputConcepts;
  private final ImmutableMap<String, BigDecimal> inputValues;
  private final @Nullable String interpretation;
  private final @Nullable Integer benchmarkPercentile;
  private final double dataQualityScore;
  private final @Nullable LocalDate periodEndDate;
  private final @Nullable Integer fiscalYear;
  private final @Nullable Integer fiscalQuarter;

  CalculatedRatio(UUID statementId, String name, String displayName, String category,
      @Nullable BigDecimal value, RatioStatus status, @Nullable String note, String formula,
      List<String> inputConcepts, Map<String, BigDecimal> inputValues,
      @Nullable String interpretation, @Nullable Integer benchmarkPercentile,
      double dataQualityScore, @Nullable LocalDate periodEndDate,
      @Nullable Integer fiscalYear, @Nullable Integer fiscalQuarter) {
    this.statementId = statementId;
    this.name = name;
    this.displayName = displayName;
    this.category = category;
    this.value = value;
    this.status = status;
    this.note = note;
    this.formula = formula;
    this.inputConcepts = ImmutableList.copyOf(inputConcepts);
    this.inputValues = ImmutableMap.copyOf(inputValues);
    this.interpretation = interpretation;
    this.benchmarkPercentile = benchmarkPercentile;
    this.dataQualityScore = dataQualityScore;
    this.periodEndDate = periodEndDate;
    this.fiscalYear = fiscalYear;
    this.fiscalQuarter = fiscalQuarter;
  }

  public UUID getId() {
    return id;
  }

  public UUID getStatementId() {
    return statementId;
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getCategory() {
    return category;
  }

  @JsonFormat(shape = JsonFormat.Shape.STRING)
  public @Nullable BigDecimal getValue() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  public RatioStatus getStatus() {
    return status;
  }

  /** Names the missing inputs or the zero denominator. */
  public @Nullable String getNote() {
    return note;
  }

  public String getFormula() {
    return formula;
  }

  /** Concepts the formula refers to. */
  public List<String> getInputConcepts() {
    return inputConcepts;
  }

  /** Values found for the inputs, keyed by formula concept name. */
  public Map<String, BigDecimal> getInputValues() {
    return inputValues;
  }

  public @Nullable String getInterpretation() {
    return interpretation;
  }

  public @Nullable Integer getBenchmarkPercentile() {
    return benchmarkPercentile;
  }

  /** Share of inputs with a non-zero value, 0.0 to 1.0. */
  public double getDataQualityScore() {
    return dataQualityScore;
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

  @Override public String toString() {
    return name + "=" + (value != null ? value.toPlainString() : "null")
        + " (" + status + (note != null ? ": " + note : "") + ")";
  }
}
