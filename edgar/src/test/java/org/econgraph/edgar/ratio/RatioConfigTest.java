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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link RatioConfig} and the types it loads. */
@Tag("unit")
class RatioConfigTest {
  private static InputStream yaml(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test void testDefaults() {
    RatioConfig config = RatioConfig.defaults();
    assertEquals(14, config.getDefinitions().size());
    assertEquals("return_on_equity", config.getDefinitions().get(0).getName());

    RatioDefinition quick = config.find("quick_ratio").get();
    assertEquals("liquidity", quick.getCategory());
    assertEquals(Arrays.asList(RatioTerm.of("CurrentAssets"),
        new RatioTerm("Inventory", true, true)), quick.getNumerator());
    assertEquals("(Current Assets - Inventory) / Current Liabilities", quick.getFormula());

    RatioDefinition debt = config.find("debt_to_equity").get();
    assertFalse(debt.getInterpretation().isHigherBetter());
    assertEquals(4, debt.getInterpretation().getBands().size());
    assertNull(debt.getBenchmark());

    assertFalse(config.find("price_to_earnings").isPresent());
  }

  @Test void testFromYaml() throws IOException {
    RatioConfig config = RatioConfig.fromYaml(yaml("ratios:\n"
        + "  - name: asset_turnover\n"
        + "    category: efficiency\n"
        + "    numerator: Revenue\n"
        + "    denominator: [TotalAssets]\n"
        + "    benchmark: {p10: 0.2, p25: 0.4, median: 0.6, p75: 0.9, p90: 1.2}\n"
        + "    interpretation:\n"
        + "      bands:\n"
        + "        - {threshold: 1.0, label: High}\n"
        + "      otherwise: Low\n"));
    RatioDefinition definition = config.getDefinitions().get(0);

    assertEquals("asset_turnover", definition.getDisplayName());
    assertEquals("Revenue / TotalAssets", definition.getFormula());
    assertEquals(Arrays.asList("Revenue", "TotalAssets"), definition.inputConcepts());
    assertEquals(new BigDecimal("0.6"), definition.getBenchmark().getMedian());
    assertTrue(definition.getInterpretation().isHigherBetter());
    assertEquals("High", definition.getInterpretation().interpret(new BigDecimal("1.0")));
    assertEquals("Low", definition.getInterpretation().interpret(new BigDecimal("0.99")));
  }

  @Test void testRejectsBadConfigurations() {
    assertThrows(ConfigurationException.class,
        () -> RatioConfig.fromYaml(yaml("other: []\n")));
    ConfigurationException noDenominator = assertThrows(ConfigurationException.class,
        () -> RatioConfig.fromYaml(yaml("ratios:\n  - name: x\n    numerator: [A]\n")));
    assertEquals("Ratio x has no denominator", noDenominator.getMessage());
    ConfigurationException badThreshold = assertThrows(ConfigurationException.class,
        () -> RatioConfig.fromYaml(yaml("ratios:\n  - name: x\n    numerator: [A]\n"
            + "    denominator: [B]\n"
            + "    interpretation: {bands: [{threshold: high, label: Good}]}\n")));
    assertTrue(badThreshold.getMessage().startsWith("Ratio x has a non-numeric 'threshold'"));
    assertThrows(IOException.class, () -> RatioConfig.fromYaml(yaml("ratios: [\n")));
  }

  @Test void testRejectsDuplicateNames() {
    RatioDefinition first = RatioDefinition.simple("margin", "profitability", "A", "B");
    RatioDefinition second = RatioDefinition.simple("margin", "profitability", "C", "D");
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> RatioConfig.of(first, second));
    assertEquals("Duplicate ratio definition: margin", e.getMessage());
  }

  @Test void testDefinitionValidation() {
    assertThrows(ConfigurationException.class,
        () -> RatioDefinition.builder(" ", "x"));
    assertThrows(ConfigurationException.class,
        () -> RatioDefinition.builder("x", "y").numerator("A").build());
    assertEquals("other", RatioDefinition.builder("x", null)
        .numerator("A").denominator("B").build().getCategory());
    assertEquals("(A + B) / (-C - D)", RatioDefinition.builder("x", "y")
        .numerator("A", "B").denominator("-C", "-D").build().getFormula());
  }

  @Test void testParseTerm() {
    assertEquals(new RatioTerm("Inventory", true, true), RatioTerm.parse(" -Inventory? "));
    assertEquals(RatioTerm.of("Assets"), RatioTerm.parse("+Assets"));
    assertEquals("ShortTermDebt?", RatioTerm.parse("ShortTermDebt?").toString());
    ConfigurationException e =
        assertThrows(ConfigurationException.class, () -> RatioTerm.parse("-?"));
    assertEquals("Empty ratio term: '-?'", e.getMessage());
  }

  @Test void testBenchmarkBands() {
    RatioBenchmark benchmark = new RatioBenchmark(new BigDecimal("1.2"),
        new BigDecimal("1.8"), new BigDecimal("2.5"), new BigDecimal("3.5"),
        new BigDecimal("5.0"));
    assertEquals(0, benchmark.percentileBand(new BigDecimal("1.0")));
    assertEquals(10, benchmark.percentileBand(new BigDecimal("1.2")));
    assertEquals(25, benchmark.percentileBand(new BigDecimal("2.0")));
    assertEquals(50, benchmark.percentileBand(new BigDecimal("2.5")));
    assertEquals(75, benchmark.percentileBand(new BigDecimal("4")));
    assertEquals(90, benchmark.percentileBand(new BigDecimal("7")));

    assertThrows(ConfigurationException.class, () -> new RatioBenchmark(BigDecimal.ONE,
        BigDecimal.ZERO, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE));
  }

  @Test void testInterpretationFallback() {
    RatioInterpretation empty = new RatioInterpretation(true,
        Collections.<RatioInterpretation.Band>emptyList(), "n/a");
    assertEquals("n/a", empty.interpret(BigDecimal.TEN));
    assertNotNull(RatioConfig.defaults().find("return_on_equity").get().getInterpretation());
  }
}
