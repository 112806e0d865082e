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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Descriptive attributes of a taxonomy concept, independent of any value.
 */
public class ConceptDefinition {
  private final String name;
  private final String label;
  private final String dataType;
  private final PeriodType periodType;
  private final @Nullable String balanceType;
  private final String statementType;
  private final String section;

  public ConceptDefinition(String name, String label, String dataType, PeriodType periodType,
      @Nullable String balanceType, String statementType, String section) {
    this.name = name;
    this.label = label;
    this.dataType = dataType;
    this.periodType = periodType;
    this.balanceType = balanceType;
    this.statementType = statementType;
    this.section = section;
  }

  public String getName() {
    return name;
  }

  public String getLabel() {
    return label;
  }

  /** XBRL item type, for example {@code monetaryItemType}. */
  public String getDataType() {
    return dataType;
  }

  public PeriodType getPeriodType() {
    return periodType;
  }

  /** {@code debit}, {@code credit}, or null when not applicable. */
  public @Nullable String getBalanceType() {
    return balanceType;
  }

  /**
   * {@code balance_sheet}, {@code income_statement},
   * {@code cash_flow_statement} or {@code other}.
   */
  public String getStatementType() {
    return statementType;
  }

  public String getSection() {
    return section;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConceptDefinition)) {
      return false;
    }
    ConceptDefinition that = (ConceptDefinition) o;
    return name.equals(that.name) && label.equals(that.label)
        && dataType.equals(that.dataType) && periodType == that.periodType
        && Objects.equals(balanceType, that.balanceType)
        && statementType.equals(that.statementType) && section.equals(that.section);
  }

  @Override public int hashCode() {
    return Objects.hash(name, label, dataType, periodType, balanceType, statementType, section);
  }

  @Override public String toString() {
    return "ConceptDefinition{" + name + ", " + statementType + "/" + section + "}";
  }
}
