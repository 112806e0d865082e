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

import org.econgraph.edgar.ConfigurationException;

import java.util.Objects;

/**
 * One concept in a ratio's numerator or denominator.
 *
 * <p>Written in configuration as the concept name, with a leading {@code -}
 * to subtract it and a trailing {@code ?} when the concept may be absent
 * (and then counts as zero). For example {@code "-InventoryNet"} or
 * {@code "ShortTermDebt?"}.
 */
public class RatioTerm {
  private final String concept;
  private final boolean negative;
  private final boolean optional;

  public RatioTerm(String concept, boolean negative, boolean optional) {
    this.concept = Objects.requireNonNull(concept, "concept");
    this.negative = negative;
    this.optional = optional;
  }

  public static RatioTerm of(String concept) {
    return new RatioTerm(concept, false, false);
  }

  public static RatioTerm parse(String text) {
    String value = text.trim();
    boolean negative = value.startsWith("-");
    if (negative || value.startsWith("+")) {
      value = value.substring(1).trim();
    }
    boolean optional = value.endsWith("?");
    if (optional) {
      value = value.substring(0, value.length() - 1).trim();
    }
    if (value.isEmpty()) {
      throw new ConfigurationException("Empty ratio term: '" + text + "'");
    }
    return new RatioTerm(value, negative, optional);
  }

  public String getConcept() {
    return concept;
  }

  public boolean isNegative() {
    return negative;
  }

  public boolean isOptional() {
    return optional;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RatioTerm)) {
      return false;
    }
    RatioTerm that = (RatioTerm) o;
    return negative == that.negative && optional == that.optional
        && concept.equals(that.concept);
  }

  @Override public int hashCode() {
    return Objects.hash(concept, negative, optional);
  }

  @Override public String toString() {
    return (negative ? "-" : "") + concept + (optional ? "?" : "");
  }
}
