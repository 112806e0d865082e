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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * How to compute one ratio: sums of concepts over sums of concepts.
 */
public class RatioDefinition {
  private final String name;
  private final String displayName;
  private final String category;
  private final ImmutableList<RatioTerm> numerator;
  private final ImmutableList<RatioTerm> denominator;
  private final String formula;
  private final @Nullable RatioBenchmark benchmark;
  private final @Nullable RatioInterpretation interpretation;

  private RatioDefinition(Builder builder) {
    if (builder.numerator.isEmpty() || builder.denominator.isEmpty()) {
      throw new ConfigurationException("Ratio " + builder.name
          + " needs at least one numerator and one denominator term");
    }
    this.name = builder.name;
    this.displayName = builder.displayName != null ? builder.displayName : builder.name;
    this.category = builder.category;
    this.numerator = ImmutableList.copyOf(builder.numerator);
    this.denominator = ImmutableList.copyOf(builder.denominator);
    this.formula = builder.formula != null ? builder.formula
        : describe(numerator) + " / " + describe(denominator);
    this.benchmark = builder.benchmark;
    this.interpretation = builder.interpretation;
  }

  public static Builder builder(String name, String category) {
    return new Builder(name, category);
  }

  /** Shorthand for a plain {@code numerator / denominator} ratio. */
  public static RatioDefinition simple(String name, String category, String numerator,
      String denominator) {
    return builder(name, category).numerator(numerator).denominator(denominator).build();
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

  public List<RatioTerm> getNumerator() {
    return numerator;
  }

  public List<RatioTerm> getDenominator() {
    return denominator;
  }

  public String getFormula() {
    return formula;
  }

  public @Nullable RatioBenchmark getBenchmark() {
    return benchmark;
  }

  public @Nullable RatioInterpretation getInterpretation() {
    return interpretation;
  }

  /** Concepts in the order they appear in the formula. */
  public List<String> inputConcepts() {
    List<String> concepts = new ArrayList<String>();
    for (RatioTerm term : numerator) {
      concepts.add(term.getConcept());
    }
    for (RatioTerm term : denominator) {
      if (!concepts.contains(term.getConcept())) {
        concepts.add(term.getConcept());
      }
    }
    return concepts;
  }

  private static String describe(List<RatioTerm> terms) {
    StringBuilder sb = new StringBuilder();
    for (RatioTerm term : terms) {
      if (sb.length() > 0) {
        sb.append(term.isNegative() ? " - " : " + ");
      } else if (term.isNegative()) {
        sb.append("-");
      }
      sb.append(term.getConcept());
    }
    return terms.size() > 1 ? "(" + sb + ")" : sb.toString();
  }

  @Override public String toString() {
    return name + " = " + formula;
  }

  /** Builder for {@link RatioDefinition}. */
  public static class Builder {
    private final String name;
    private final String category;
    private @Nullable String displayName;
    private final List<RatioTerm> numerator = new ArrayList<RatioTerm>();
    private final List<RatioTerm> denominator = new ArrayList<RatioTerm>();
    private @Nullable String formula;
    private @Nullable RatioBenchmark benchmark;
    private @Nullable RatioInterpretation interpretation;

    Builder(String name, String category) {
      if (name == null || name.trim().isEmpty()) {
        throw new ConfigurationException("Ratio name is required");
      }
      this.name = name;
      this.category = category == null ? "other" : category;
    }

    public Builder displayName(@Nullable String displayName) {
      this.displayName = displayName;
      return this;
    }

    /** Adds numerator terms in {@link RatioTerm#parse} syntax. */
    public Builder numerator(String... terms) {
      for (String term : terms) {
        numerator.add(RatioTerm.parse(term));
      }
      return this;
    }

    public Builder denominator(String... terms) {
      for (String term : terms) {
        denominator.add(RatioTerm.parse(term));
      }
      return this;
    }

    public Builder formula(@Nullable String formula) {
      this.formula = formula;
      return this;
    }

    public Builder benchmark(@Nullable RatioBenchmark benchmark) {
      this.benchmark = benchmark;
      return this;
    }

    public Builder interpretation(@Nullable RatioInterpretation interpretation) {
      this.interpretation = interpretation;
      return this;
    }

    public RatioDefinition build() {
      return new RatioDefinition(this);
    }
  }
}
