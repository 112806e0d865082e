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
package org.econgraph.edgar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility methods for reading YAML or JSON configuration files.
 *
 * <p>YAML is read with SnakeYAML so anchors and aliases are resolved, then
 * converted to a Jackson tree. String values may contain {@code ${NAME}} or
 * {@code ${NAME:default}} placeholders, resolved against environment
 * variables and then system properties.
 */
public final class YamlUtils {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?}");

  private YamlUtils() {
  }

  /**
   * Parses YAML or JSON, choosing the format by the resource name's extension.
   *
   * @param stream InputStream containing YAML or JSON data
   * @param resourceName Name of resource (used to determine format by extension)
   * @return JsonNode with all YAML anchors/aliases resolved
   * @throws IOException if the stream cannot be read or parsed
   */
  public static JsonNode parseYamlOrJson(InputStream stream, String resourceName)
      throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(500);
      Yaml yaml = new Yaml(loaderOptions);
      Object parsedYaml;
      try {
        parsedYaml = yaml.load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      return JSON_MAPPER.valueToTree(parsedYaml);
    }
    return JSON_MAPPER.readTree(stream);
  }

  /**
   * Reads a YAML or JSON file into a map.
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> readMap(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      JsonNode node = parseYamlOrJson(in, file.getFileName().toString());
      if (node == null || node.isNull() || node.isMissingNode()) {
        return new java.util.LinkedHashMap<String, Object>();
      }
      if (!node.isObject()) {
        throw new IOException("Expected a mapping at the top of " + file);
      }
      return JSON_MAPPER.convertValue(node, Map.class);
    }
  }

  /**
   * Replaces {@code ${VAR:default}} placeholders in a string.
   * Unresolvable placeholders without a default are left empty.
   */
  public static String resolvePlaceholders(String value) {
    if (value == null || !value.contains("${")) {
      return value;
    }
    Matcher matcher = PLACEHOLDER.matcher(value);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String varName = matcher.group(1);
      String defaultValue = matcher.group(2);
      String resolved = System.getenv(varName);
      if (resolved == null) {
        resolved = System.getProperty(varName);
      }
      if (resolved == null) {
        resolved = defaultValue != null ? defaultValue : "";
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}
