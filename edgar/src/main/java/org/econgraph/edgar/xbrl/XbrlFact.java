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

import java.math.BigDecimal;

/**
 * A single tagged fact as it appears in the document.
 */
public class XbrlFact {
  private final String concept;
  private final @Nullable String prefix;
  private final String rawValue;
  private final @Nullable BigDecimal numericValue;
  private final @Nullable String contextRef;
  private final @Nullable String unitRef;
  private final @Nullable String decimals;
  private final int position;

  public XbrlFact(String concept, @Nullable String prefix, String rawValue,
      @Nullable BigDecimal numericValue, @Nullable String contextRef,
      @Nullable String unitRef, @Nullable String decimals, int position) {
    this.concept = concept;
    this.prefix = prefix;
    this.rawValue = rawValue;
    this.numericValue = numericValue;
    this.contextRef = contextRef;
    this.unitRef = unitRef;
    this.decimals = decimals;
    this.position = position;
  }

  /** Concept local name, for example {@code AssetsCurrent}. */
  public String getConcept() {
    return concept;
  }

  /** Namespace prefix the document used, for example {@code us-gaap}. */
  public @Nullable String getPrefix() {
    return prefix;
  }

  public String getRawValue() {
    return rawValue;
  }

  /** Exact numeric value, or null for non-numeric facts. */
  public @Nullable BigDecimal getNumericValue() {
    return numericValue;
  }

  public @Nullable String getContextRef() {
    return contextRef;
  }

  public @Nullable String getUnitRef() {
    return unitRef;
  }

  public @Nullable String getDecimals() {
    return decimals;
  }

  /** Order of the fact in the document, starting at 0. */
  public int getPosition() {
    return position;
  }

  public boolean isNumeric() {
    return numericValue != null;
  }

  public String getQualifiedName() {
    return prefix == null ? concept : prefix + ":" + concept;
  }

  @Override public String toString() {
    return getQualifiedName() + "[" + contextRef + "]=" + rawValue;
  }
}
