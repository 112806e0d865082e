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

import java.time.LocalDate;

/**
 * Reporting context: the entity and the period a fact applies to.
 *
 * <p>A context has either an instant or a start and end date. Contexts with
 * segment dimensions describe a breakdown (a segment, a class of stock) rather
 * than the entity as a whole.
 */
public class XbrlContext {
  private final String id;
  private final @Nullable String entityIdentifier;
  private final @Nullable String entityScheme;
  private final @Nullable LocalDate startDate;
  private final @Nullable LocalDate endDate;
  private final @Nullable LocalDate instant;
  private final boolean dimensional;

  public XbrlContext(String id, @Nullable String entityIdentifier,
      @Nullable String entityScheme, @Nullable LocalDate startDate,
      @Nullable LocalDate endDate, @Nullable LocalDate instant, boolean dimensional) {
    this.id = id;
    this.entityIdentifier = entityIdentifier;
    this.entityScheme = entityScheme;
    this.startDate = startDate;
    this.endDate = endDate;
    this.instant = instant;
    this.dimensional = dimensional;
  }

  public String getId() {
    return id;
  }

  public @Nullable String getEntityIdentifier() {
    return entityIdentifier;
  }

  public @Nullable String getEntityScheme() {
    return entityScheme;
  }

  public @Nullable LocalDate getStartDate() {
    return startDate;
  }

  public @Nullable LocalDate getEndDate() {
    return endDate;
  }

  public @Nullable LocalDate getInstant() {
    return instant;
  }

  public boolean isDimensional() {
    return dimensional;
  }

  public boolean hasPeriod() {
    return instant != null || endDate != null;
  }

  public PeriodType getPeriodType() {
    return instant != null ? PeriodType.INSTANT : PeriodType.DURATION;
  }

  /** Instant date, or end date for durations; null if the context has no period. */
  public @Nullable LocalDate getPeriodEnd() {
    return instant != null ? instant : endDate;
  }

  @Override public String toString() {
    return "XbrlContext{" + id + ", "
        + (instant != null ? "instant=" + instant : startDate + ".." + endDate)
        + (dimensional ? ", dimensional" : "") + "}";
  }
}
