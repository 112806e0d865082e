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
import org.econgraph.edgar.YamlUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered set of ratios to compute.
 *
 * <p>Definitions are read from YAML shaped as:
 *
 * <pre>{@code
 * ratios:
 *   - name: current_ratio
 *     displayName: Current Ratio
 *     category: liquidity
 *     numerator: [CurrentAssets]
 *     denominator: [CurrentLiabilities]
 *     benchmark: {p10: 1.2, p25: 1.8, median: 2.5, p75: 3.5, p90: 5.0}
 *     interpretation:
 *       direction: higher
 *       bands:
 *         - {threshold: 2.0, label: "Excellent - Strong liquidity position"}
 *       otherwise: "Poor - Very weak liquidity"
 * }</pre>
 */
public class RatioConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(RatioConfig.class);

  public static final String DEFAULT_RESOURCE = "/ratio-definitions.yaml";

  private final ImmutableList<RatioDefinition> definitions;

  public RatioConfig(List<RatioDefinition> definitions) {
    Set<String> names = new HashSet<String>();
    for (RatioDefinition definition : definitions) {
      if (!names.add(definition.getName())) {
        throw new ConfigurationException("Duplicate ratio definition: " + definition.getName());
      }
    }
    this.definitions = ImmutableList.copyOf(definitions);
  }

  public static RatioConfig of(RatioDefinition... definitions) {
    return new RatioConfig(Arrays.asList(definitions));
  }

  /** The bundled ratio set. */
  public static RatioConfig defaults() {
    try (InputStream in = RatioConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new ConfigurationException("Missing resource " + DEFAULT_RESOURCE);
      }
      return fromYaml(in);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read " + DEFAULT_RESOURCE, e);
    }
  }

  public static RatioConfig fromYaml(InputStream in) throws IOException {
    JsonNode root = YamlUtils.parseYamlOrJson(in, "ratios.yaml");
    JsonNode ratios = root == null ? null : root.get("ratios");
    if (ratios == null || !ratios.isArray()) {
      throw new ConfigurationException("Ratio configuration needs a 'ratios' list");
    }
    List<RatioDefinition> definitions = new ArrayList<RatioDefinition>();
    for (JsonNode node : ratios) {
      definitions.add(parseDefinition(node));
    }
    LOGGER.debug("Loaded {} ratio definitions", definitions.size());
    return new RatioConfig(definitions);
  }

  public List<RatioDefinition> getDefinitions() {
    return definitions;
  }

  public Optional<RatioDefinition> find(String name) {
    for (RatioDefinition definition : definitions) {
      if (definition.getName().equals(name)) {
        return Optional.of(definition);
      }
    }
    return Optional.empty();
  }

  private static RatioDefinition parseDefinition(JsonNode node) {
    String name = text(node, "name");
    if (name == null) {
      throw new ConfigurationException("Ratio definition without a name: " + node);
    }
    RatioDefinition.Builder builder = RatioDefinition.builder(name, text(node, "category"))
        .displayName(text(node, "displayName"))
        .formula(text(node, "formula"))
        .numerator(terms(node, "numerator", name))
        .denominator(terms(node, "denominator", name));
    JsonNode benchmark = node.get("benchmark");
    if (benchmark != null && benchmark.isObject()) {
      builder.benchmark(
          new RatioBenchmark(decimal(benchmark, "p10", name), decimal(benchmark, "p25", name),
              decimal(benchmark, "median", name), decimal(benchmark, "p75", name),
              decimal(benchmark, "p90", name)));
    }
    JsonNode interpretation = node.get("interpretation");
    if (interpretation != null && interpretation.isObject()) {
      builder.interpretation(parseInterpretation(interpretation, name));
    }
    return builder.build();
  }

  private static RatioInterpretation parseInterpretation(JsonNode node, String ratio) {
    String direction = text(node, "direction");
    boolean higher = direction == null || !direction.equalsIgnoreCase("lower");
    List<RatioInterpretation.Band> bands = new ArrayList<RatioInterpretation.Band>();
    JsonNode bandNodes = node.get("bands");
    if (bandNodes != null) {
      for (JsonNode band : bandNodes) {
        String label = text(band, "label");
        if (label == null) {
          throw new ConfigurationException("Interpretation band without label in " + ratio);
        }
        bands.add(new RatioInterpretation.Band(decimal(band, "threshold", ratio), label));
      }
    }
    String fallback = text(node, "otherwise");
    return new RatioInterpretation(higher, bands, fallback != null ? fallback : "");
  }

  private static String[] terms(JsonNode node, String field, String ratio) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new ConfigurationException("Ratio " + ratio + " has no " + field);
    }
    List<String> terms = new ArrayList<String>();
    if (value.isArray()) {
      for (JsonNode term : value) {
        terms.add(term.asText());
      }
    } else {
      terms.add(value.asText());
    }
    return terms.toArray(new String[0]);
  }

  private static @Nullable String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static BigDecimal decimal(JsonNode node, String field, String ratio) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new ConfigurationException("Ratio " + ratio + " is missing '" + field + "'");
    }
    try {
      return new BigDecimal(value.asText().trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Ratio " + ratio + " has a non-numeric '" + field
          + "': " + value.asText(), e);
    }
  }
}
