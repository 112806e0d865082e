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

import org.econgraph.edgar.xbrl.DocumentType;
import org.econgraph.edgar.xbrl.ParsedStatement;
import org.econgraph.edgar.xbrl.TaxonomyConcept;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link FinancialRatioCalculator}. */
@Tag("unit")
class FinancialRatioCalculatorTest {
  private FinancialRatioCalculator calculator;

  @BeforeEach void setUp() {
    calculator = new FinancialRatioCalculator();
  }

  static ParsedStatement statement(LocalDate periodEnd, Object... nameValues) {
    List<TaxonomyConcept> concepts = new ArrayList<TaxonomyConcept>();
    for (int i = 0; i < nameValues.length; i += 2) {
      concepts.add(
          TaxonomyConcept.builder((String) nameValues[i],
              new BigDecimal(nameValues[i + 1].toString()), "c-1")
              .prefix("us-gaap")
              .unit("usd")
              .period(null, periodEnd)
              .build());
    }
    return new ParsedStatement(UUID.randomUUID(), "0000320193", "10-K", periodEnd,
        periodEnd.getYear(), null, DocumentType.XBRL, concepts,
        Collections.<TaxonomyConcept>emptyList(), Collections.<String>emptyList());
  }

  private static CalculatedRatio named(List<CalculatedRatio> ratios, String name) {
    for (CalculatedRatio ratio : ratios) {
      if (ratio.getName().equals(name)) {
        return ratio;
      }
    }
    throw new AssertionError("No ratio " + name + " in " + ratios);
  }

  @Test void testCurrentRatioUsesUsGaapAliases() {
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28),
        "AssetsCurrent", "150000", "LiabilitiesCurrent", "75000");
    CalculatedRatio ratio = named(calculator.calculate(statement), "current_ratio");

    assertEquals(RatioStatus.CALCULATED, ratio.getStatus());
    assertEquals(0, new BigDecimal("2").compareTo(ratio.getValue()));
    assertEquals("Excellent - Strong liquidity position", ratio.getInterpretation());
    assertEquals(25, ratio.getBenchmarkPercentile());
    assertEquals(1.0, ratio.getDataQualityScore(), 1e-9);
    assertEquals(statement.getId(), ratio.getStatementId());
    assertEquals(LocalDate.of(2024, 9, 28), ratio.getPeriodEndDate());
    assertEquals(2024, ratio.getFiscalYear());
    assertNull(ratio.getFiscalQuarter());
    assertEquals(Arrays.asList("CurrentAssets", "CurrentLiabilities"),
        ratio.getInputConcepts());
    assertEquals(new BigDecimal("150000"), ratio.getInputValues().get("CurrentAssets"));
  }

  @Test void testOneResultPerConfiguredRatioInOrder() {
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28), "Assets", "100");
    List<CalculatedRatio> ratios = calculator.calculate(statement);
    List<RatioDefinition> definitions = RatioConfig.defaults().getDefinitions();

    assertEquals(definitions.size(), ratios.size());
    for (int i = 0; i < ratios.size(); i++) {
      assertEquals(definitions.get(i).getName(), ratios.get(i).getName());
    }
  }

  @Test void testMissingInputGivesNullValue() {
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28),
        "AssetsCurrent", "150000");
    CalculatedRatio ratio = named(calculator.calculate(statement), "current_ratio");

    assertNull(ratio.getValue());
    assertFalse(ratio.hasValue());
    assertEquals(RatioStatus.MISSING_INPUT, ratio.getStatus());
    assertEquals("Missing input: CurrentLiabilities", ratio.getNote());
    assertNull(ratio.getInterpretation());
    assertNull(ratio.getBenchmarkPercentile());
    assertEquals(0.5, ratio.getDataQualityScore(), 1e-9);
  }

  @Test void testMissingInputsAreListedOnce() {
    RatioConfig config = RatioConfig.of(RatioDefinition.builder("assets_to_assets", "test")
        .numerator("TotalAssets", "Goodwill")
        .denominator("Goodwill")
        .build());
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28), "Cash", "1");
    CalculatedRatio ratio = calculator.calculate(statement, config).get(0);

    assertEquals("Missing input: TotalAssets, Goodwill", ratio.getNote());
    assertEquals(0.0, ratio.getDataQualityScore(), 1e-9);
  }

  @Test void testZeroDenominator() {
    RatioConfig config = RatioConfig.of(
        RatioDefinition.simple("times_interest", "leverage", "NetIncome", "InterestExpense"));
    ParsedStatement statement = statement(LocalDate.of(2024, 6, 29),
        "NetIncomeLoss", "21448000000", "InterestExpense", "0");
    CalculatedRatio ratio = calculator.calculate(statement, config).get(0);

    assertNull(ratio.getValue());
    assertEquals(RatioStatus.ZERO_DENOMINATOR, ratio.getStatus());
    assertEquals("Denominator is zero", ratio.getNote());
    assertEquals(0.5, ratio.getDataQualityScore(), 1e-9);
    assertEquals("NetIncome / InterestExpense", ratio.getFormula());
  }

  @Test void testDivisionUsesDecimal64() {
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28),
        "NetIncomeLoss", "93736000000", "StockholdersEquity", "56950000000");
    CalculatedRatio roe = named(calculator.calculate(statement), "return_on_equity");

    BigDecimal expected = new BigDecimal("93736000000")
        .divide(new BigDecimal("56950000000"), MathContext.DECIMAL64);
    assertEquals(expected, roe.getValue());
    assertEquals("Excellent - Strong profitability", roe.getInterpretation());
    assertEquals(90, roe.getBenchmarkPercentile());
    assertEquals("profitability", roe.getCategory());
    assertEquals("Return on Equity (ROE)", roe.getDisplayName());
  }

  @Test void testLowerIsBetterInterpretation() {
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28),
        "LongTermDebtNoncurrent", "40", "StockholdersEquity", "100");
    CalculatedRatio ratio = named(calculator.calculate(statement), "debt_to_equity");

    assertEquals(0, new BigDecimal("0.4").compareTo(ratio.getValue()));
    assertEquals("Good - Moderate leverage", ratio.getInterpretation());
  }

  @Test void testOptionalAndNegativeTerms() {
    ParsedStatement withoutInventory = statement(LocalDate.of(2024, 9, 28),
        "AssetsCurrent", "300", "LiabilitiesCurrent", "100");
    CalculatedRatio quick = named(calculator.calculate(withoutInventory), "quick_ratio");
    assertEquals(0, new BigDecimal("3").compareTo(quick.getValue()));

    ParsedStatement withInventory = statement(LocalDate.of(2024, 9, 28),
        "AssetsCurrent", "300", "InventoryNet", "100", "LiabilitiesCurrent", "100");
    quick = named(calculator.calculate(withInventory), "quick_ratio");
    assertEquals(0, new BigDecimal("2").compareTo(quick.getValue()));
  }

  @Test void testRequiredNegativeTermMissing() {
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28),
        "NetCashProvidedByUsedInOperatingActivities", "500", "Revenues", "1000");
    CalculatedRatio fcf = named(calculator.calculate(statement), "free_cash_flow_margin");

    assertEquals(RatioStatus.MISSING_INPUT, fcf.getStatus());
    assertEquals("Missing input: CapitalExpenditures", fcf.getNote());
  }

  @Test void testExactNameWinsOverAlias() {
    ParsedStatement statement = statement(LocalDate.of(2024, 9, 28),
        "Revenue", "10", "Revenues", "20");
    assertEquals(new BigDecimal("10"),
        FinancialRatioCalculator.lookup(statement, "Revenue").get());
    assertEquals(new BigDecimal("20"),
        FinancialRatioCalculator.lookup(statement, "Revenues").get());
    assertFalse(FinancialRatioCalculator.lookup(statement, "Goodwill").isPresent());
  }

  @Test void testGrowth() {
    ParsedStatement previous = statement(LocalDate.of(2023, 9, 30), "Revenues", "200");
    ParsedStatement current = statement(LocalDate.of(2024, 9, 28), "Revenues", "250");
    CalculatedRatio growth = calculator.calculateGrowth(current, previous, "Revenue");

    assertEquals("Revenue_growth", growth.getName());
    assertEquals("growth", growth.getCategory());
    assertEquals(RatioStatus.CALCULATED, growth.getStatus());
    assertEquals(0, new BigDecimal("0.25").compareTo(growth.getValue()));
    assertEquals(current.getId(), growth.getStatementId());
  }

  @Test void testGrowthFromNegativeBase() {
    ParsedStatement previous = statement(LocalDate.of(2023, 9, 30), "NetIncomeLoss", "-100");
    ParsedStatement current = statement(LocalDate.of(2024, 9, 28), "NetIncomeLoss", "50");
    CalculatedRatio growth = calculator.calculateGrowth(current, previous, "NetIncome");

    assertEquals(0, new BigDecimal("1.5").compareTo(growth.getValue()));
  }

  @Test void testGrowthWithMissingOrZeroPrevious() {
    ParsedStatement current = statement(LocalDate.of(2024, 9, 28), "Revenues", "250");
    ParsedStatement empty = statement(LocalDate.of(2023, 9, 30));
    ParsedStatement zero = statement(LocalDate.of(2023, 9, 30), "Revenues", "0");

    CalculatedRatio missing = calculator.calculateGrowth(current, empty, "Revenue");
    assertEquals(RatioStatus.MISSING_INPUT, missing.getStatus());
    assertEquals("Missing previous value for Revenue", missing.getNote());
    assertNull(missing.getValue());

    CalculatedRatio zeroBase = calculator.calculateGrowth(current, zero, "Revenue");
    assertEquals(RatioStatus.ZERO_DENOMINATOR, zeroBase.getStatus());
    assertNull(zeroBase.getValue());
  }

  @Test void testGrowthRatesOrderedByPeriod() {
    ParsedStatement y2022 = statement(LocalDate.of(2022, 9, 24), "Revenues", "100");
    ParsedStatement y2023 = statement(LocalDate.of(2023, 9, 30), "Revenues", "110");
    ParsedStatement y2024 = statement(LocalDate.of(2024, 9, 28), "Revenues", "121");
    List<CalculatedRatio> growth =
        calculator.calculateGrowthRates(Arrays.asList(y2024, y2022, y2023));

    assertEquals(2 * FinancialRatioCalculator.GROWTH_CONCEPTS.size(), growth.size());
    CalculatedRatio first = growth.get(0);
    assertEquals("Revenue_growth", first.getName());
    assertEquals(y2023.getId(), first.getStatementId());
    assertEquals(0, new BigDecimal("0.1").compareTo(first.getValue()));
    CalculatedRatio second = growth.get(FinancialRatioCalculator.GROWTH_CONCEPTS.size());
    assertEquals(y2024.getId(), second.getStatementId());
    assertEquals(0, new BigDecimal("0.1").compareTo(second.getValue()));
  }

  @Test void testGrowthRatesNeedTwoStatements() {
    ParsedStatement only = statement(LocalDate.of(2024, 9, 28), "Revenues", "1");
    assertTrue(calculator.calculateGrowthRates(Collections.singletonList(only)).isEmpty());
  }

  @Test void testQualityScore() {
    assertEquals(0.0, FinancialRatioCalculator.qualityScore(
        Collections.<BigDecimal>emptyList(), 0), 1e-9);
    assertEquals(0.5, FinancialRatioCalculator.qualityScore(
        Arrays.asList(BigDecimal.ONE, BigDecimal.ZERO), 2), 1e-9);
    assertEquals(1.0, FinancialRatioCalculator.qualityScore(
        Arrays.asList(BigDecimal.ONE, BigDecimal.TEN), 2), 1e-9);
  }
}
