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

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A reported numeric value for one concept in one context.
 */
@JsonPropertyOrder({"name", "prefix", "label", "value", "unit", "contextRef", "periodType",
    "periodStart", "periodEnd", "statementType", "section", "decimals", "alternate", "note"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaxonomyConcept {
  private final String name;
  private final @Nullable String prefix;
  private final String label;
  private final BigDecimal value;
  private final @Nullable String unit;
  private final String contextRef;
  private final PeriodType periodType;
  private final @Nullable LocalDate periodStart;
  private final @Nullable LocalDate periodEnd;
  private final String statementType;
  private final String section;
  private final @Nullable String decimals;
  private final boolean alternate;
  private final @Nullable String note;

  private TaxonomyConcept(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.prefix = builder.prefix;
    this.value = Objects.requireNonNull(builder.value, "value");
    this.unit = builder.unit;
    this.contextRef = Objects.requireNonNull(builder.contextRef, "contextRef");
    this.periodType = builder.periodType;
    this.periodStart = builder.periodStart;
    this.periodEnd = builder.periodEnd;
    this.decimals = builder.decimals;
    this.alternate = builder.alternate;
    this.note = builder.note;
    ConceptDefinition definition = ConceptClassifier.classify(name);
    this.label = definition.getLabel();
    this.statementType = definition.getStatementType();
    this.section = definition.getSection();
  }

  public static Builder builder(String name, BigDecimal value, String contextRef) {
    return new Builder(name, value, contextRef);
  }

  public String getName() {
    return name;
  }

  public @Nullable String getPrefix() {
    return prefix;
  }

  public String getQualifiedName() {
    return prefix == null ? name : prefix + ":" + name;
  }

  public String getLabel() {
    return label;
  }

  /** Value exactly as reported, after inline scale and sign are applied. */
  @JsonFormat(shape = JsonFormat.Shape.STRING)
  public BigDecimal getValue() {
    return value;
  }

  public @Nullable String getUnit() {
    return unit;
  }

  public String getContextRef() {
    return contextRef;
  }

  public PeriodType getPeriodType() {
    return periodType;
  }

  public @Nullable LocalDate getPeriodStart() {
    return periodStart;
  }

  public @Nullable LocalDate getPeriodEnd() {
    return periodEnd;
  }

  public String getStatementType() {
    return statementType;
  }

  public String getSection() {
    return section;
  }

  public @Nullable String getDecimals() {
    return decimals;
  }

  /** True when another fact was selected as the authoritative value. */
  public boolean isAlternate() {
    return alternate;
  }

  /** Why an alternate was not selected. */
  public @Nullable String getNote() {
    return note;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaxonomyConcept)) {
      return false;
    }
    TaxonomyConcept that = (TaxonomyConcept) o;
    return alternate == that.alternate
        && name.equals(that.name)
        && Objects.equals(prefix, that.prefix)
        && value.equals(that.value)
        && Objects.equals(unit, that.unit)
        && contextRef.equals(that.contextRef)
        && periodType == that.periodType
        && Objects.equals(periodStart, that.periodStart)
        && Objects.equals(periodEnd, that.periodEnd)
        && Objects.equals(decimals, that.decimals)
        && Objects.equals(note, that.note);
  }

  @Override public int hashCode() {
    return Objects.hash(name, prefix, value, unit, contextRef, periodType, periodStart,
        periodEnd, decimals, alternate, note);
  }

  @Override public String toString() {
    return getQualifiedName() + "=" + value.toPlainString()
        + (unit != null ? " " + unit : "") + " [" + contextRef + "]"
        + (alternate ? " (alternate)" : "");
  }

  /** Builder for {@link TaxonomyConcept}. */
  public static class Builder {
    private final String name;
    private final BigDecimal value;
    private final String contextRef;
    private @Nullable String prefix;
    private @Nullable String unit;
    private PeriodType periodType = PeriodType.DURATION;
    private @Nullable LocalDate periodStart;
    private @Nullable LocalDate periodEnd;
    private @Nullable String decimals;
    private boolean alternate;
    private @Nullable String note;

    Builder(String name, BigDecimal value, String contextRef) {
      this.name = name;
      this.value = value;
      this.contextRef = contextRef;
    }

    public Builder prefix(@Nullable String prefix) {
      this.prefix = prefix;
      return this;
    }

    public Builder unit(@Nullable String unit) {
      this.unit = unit;
      return this;
    }

    public Builder periodType(PeriodType periodType) {
      this.periodType = periodType;
      return this;
    }

    public Builder period(@Nullable LocalDate start, @Nullable LocalDate end) {
      this.periodStart = start;
      this.periodEnd = end;
      return this;
    }

    public Builder decimals(@Nullable String decimals) {
      this.decimals = decimals;
      return this;
    }

    public Builder alternate(@Nullable String note) {
      this.alternate = true;
      this.note = note;
      return this;
    }

    public TaxonomyConcept build() {
      return new TaxonomyConcept(this);
    }
  }
}
