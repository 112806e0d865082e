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

import org.econgraph.edgar.xbrl.ParsedStatement;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes financial ratios from parsed statements.
 *
 * <p>Calculation never throws. A ratio whose inputs are missing, or whose
 * denominator is exactly zero, is still returned, with a null value and a
 * status saying why. Arithmetic is done in {@link BigDecimal} with
 * {@link MathContext#DECIMAL64}.
 */
public class FinancialRatioCalculator {
  private static final Logger LOGGER = LoggerFactory.getLogger(FinancialRatioCalculator.class);

  static final MathContext MATH = MathContext.DECIMAL64;

  /** Concepts tracked by {@link #calculateGrowthRates}. */
  public static final List<String> GROWTH_CONCEPTS = ImmutableList.of(
      "Revenue", "NetIncome", "OperatingCashFlow", "StockholdersEquity");

  private final RatioConfig defaultConfig;

  public FinancialRatioCalculator() {
    this(RatioConfig.defaults());
  }

  public FinancialRatioCalculator(RatioConfig defaultConfig) {
    this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
  }

  public List<CalculatedRatio> calculate(ParsedStatement statement) {
    return calculate(statement, defaultConfig);
  }

  /** One result per configured ratio, in configuration order. */
  public List<CalculatedRatio> calculate(ParsedStatement statement, RatioConfig config) {
    List<CalculatedRatio> ratios = new ArrayList<CalculatedRatio>();
    for (RatioDefinition definition : config.getDefinitions()) {
      ratios.add(calculateSafely(statement, definition));
    }
    if (LOGGER.isDebugEnabled()) {
      long computed = ratios.stream().filter(CalculatedRatio::hasValue).count();
      LOGGER.debug("Calculated {}/{} ratios for statement {}", computed, ratios.size(),
          statement.getId());
    }
    return ratios;
  }

  /**
   * Period-over-period growth of one concept: (current - previous) / |previous|.
   * A missing or zero previous value gives a null result.
   */
  public CalculatedRatio calculateGrowth(ParsedStatement current, ParsedStatement previous,
      String concept) {
    String name = concept + "_growth";
    String formula = "(current " + concept + " - previous " + concept + ") / |previous "
        + concept + "|";
    List<String> inputs = ImmutableList.of("current " + concept, "previous " + concept);
    Map<String, BigDecimal> found = new LinkedHashMap<String, BigDecimal>();
    BigDecimal now = lookup(current, concept).orElse(null);
    BigDecimal before = lookup(previous, concept).orElse(null);
    if (now != null) {
      found.put("current " + concept, now);
    }
    if (before != null) {
      found.put("previous " + concept, before);
    }

    BigDecimal value = null;
    RatioStatus status;
    String note = null;
    if (now == null || before == null) {
      status = RatioStatus.MISSING_INPUT;
      note = "Missing " + (now == null ? "current" : "previous") + " value for " + concept;
    } else if (before.signum() == 0) {
      status = RatioStatus.ZERO_DENOMINATOR;
      note = "Previous value of " + concept + " is zero";
    } else {
      value = now.subtract(before, MATH).divide(before.abs(), MATH);
      status = RatioStatus.CALCULATED;
    }
    return new CalculatedRatio(current.getId(), name, concept + " Growth", "growth", value,
        status, note, formula, inputs, found, null, null, qualityScore(found.values(), 2),
        current.getPeriodEndDate(), current.getFiscalYear(), current.getFiscalQuarter());
  }

  /**
   * Growth of the {@link #GROWTH_CONCEPTS} between consecutive statements,
   * ordered by period end date. Statements without a period end are ignored.
   */
  public List<CalculatedRatio> calculateGrowthRates(List<ParsedStatement> statements) {
    List<ParsedStatement> dated = new ArrayList<ParsedStatement>();
    for (ParsedStatement statement : statements) {
      if (statement.getPeriodEndDate() != null) {
        dated.add(statement);
      }
    }
    Collections.sort(dated, Comparator.comparing(ParsedStatement::getPeriodEndDate));
    List<CalculatedRatio> growth = new ArrayList<CalculatedRatio>();
    for (int i = 1; i < dated.size(); i++) {
      for (String concept : GROWTH_CONCEPTS) {
        growth.add(calculateGrowth(dated.get(i), dated.get(i - 1), concept));
      }
    }
    return growth;
  }

  private CalculatedRatio calculateSafely(ParsedStatement statement,
      RatioDefinition definition) {
    try {
      return calculateRatio(statement, definition);
    } catch (RuntimeException e) {
      LOGGER.warn("Ratio {} failed for statement {}: {}", definition.getName(),
          statement.getId(), e.toString());
      return result(statement, definition, null, RatioStatus.ERROR,
          "Calculation failed: " + e.getMessage(), Collections.<String, BigDecimal>emptyMap());
    }
  }

  private CalculatedRatio calculateRatio(ParsedStatement statement, RatioDefinition definition) {
    Map<String, BigDecimal> found = new LinkedHashMap<String, BigDecimal>();
    List<String> missing = new ArrayList<String>();
    BigDecimal numerator = sum(statement, definition.getNumerator(), found, missing);
    BigDecimal denominator = sum(statement, definition.getDenominator(), found, missing);

    if (!missing.isEmpty()) {
      return result(statement, definition, null, RatioStatus.MISSING_INPUT,
          "Missing input: " + String.join(", ", missing), found);
    }
    if (denominator.signum() == 0) {
      return result(statement, definition, null, RatioStatus.ZERO_DENOMINATOR,
          "Denominator is zero", found);
    }
    BigDecimal value = numerator.divide(denominator, MATH);
    return result(statement, definition, value, RatioStatus.CALCULATED, null, found);
  }

  private static BigDecimal sum(ParsedStatement statement, List<RatioTerm> terms,
      Map<String, BigDecimal> found, List<String> missing) {
    BigDecimal total = BigDecimal.ZERO;
    for (RatioTerm term : terms) {
      Optional<BigDecimal> value = lookup(statement, term.getConcept());
      if (value.isPresent()) {
        found.put(term.getConcept(), value.get());
        total = term.isNegative() ? total.subtract(value.get(), MATH)
            : total.add(value.get(), MATH);
      } else if (!term.isOptional() && !missing.contains(term.getConcept())) {
        missing.add(term.getConcept());
      }
    }
    return total;
  }

  /** Exact concept name first, then known US-GAAP aliases. */
  static Optional<BigDecimal> lookup(ParsedStatement statement, String concept) {
    for (String candidate : ConceptAliases.candidates(concept)) {
      Optional<BigDecimal> value = statement.findValue(candidate);
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }

  private static CalculatedRatio result(ParsedStatement statement, RatioDefinition definition,
      @Nullable BigDecimal value, RatioStatus status, @Nullable String note,
      Map<String, BigDecimal> found) {
    String interpretation = null;
    Integer percentile = null;
    if (value != null) {
      if (definition.getInterpretation() != null) {
        interpretation = definition.getInterpretation().interpret(value);
      }
      if (definition.getBenchmark() != null) {
        percentile = definition.getBenchmark().percentileBand(value);
      }
    }
    List<String> inputs = definition.inputConcepts();
    return new CalculatedRatio(statement.getId(), definition.getName(),
        definition.getDisplayName(), definition.getCategory(), value, status, note,
        definition.getFormula(), inputs, found, interpretation, percentile,
        qualityScore(found.values(), inputs.size()), statement.getPeriodEndDate(),
        statement.getFiscalYear(), statement.getFiscalQuarter());
  }

  /** Share of the expected inputs that were found with a non-zero value. */
  static double qualityScore(Iterable<BigDecimal> values, int expected) {
    if (expected == 0) {
      return 0.0;
    }
    int nonZero = 0;
    for (BigDecimal value : values) {
      if (value.signum() != 0) {
        nonZero++;
      }
    }
    return (double) nonZero / expected;
  }
}
