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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link YamlUtils}. */
@Tag("unit")
class YamlUtilsTest {
  private static final String PROPERTY = "EDGAR_YAML_UTILS_TEST_VALUE";

  @TempDir
  Path tempDir;

  @AfterEach void tearDown() {
    System.clearProperty(PROPERTY);
  }

  @Test void testParseYamlWithAnchors() throws IOException {
    String yaml = "base: &base\n  rate: 5\nnamed:\n  <<: *base\n  name: slow\n";
    JsonNode node = YamlUtils.parseYamlOrJson(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "config.yaml");
    assertEquals(5, node.path("named").path("rate").asInt());
    assertEquals("slow", node.path("named").path("name").asText());
  }

  @Test void testParseJson() throws IOException {
    JsonNode node = YamlUtils.parseYamlOrJson(
        new ByteArrayInputStream("{\"ciks\": [\"320193\"]}".getBytes(StandardCharsets.UTF_8)),
        "config.json");
    assertEquals("320193", node.path("ciks").get(0).asText());
  }

  @Test void testInvalidYaml() {
    IOException e = assertThrows(IOException.class,
        () -> YamlUtils.parseYamlOrJson(
            new ByteArrayInputStream("a: [1, 2".getBytes(StandardCharsets.UTF_8)), "bad.yml"));
    assertTrue(e.getMessage().startsWith("Invalid YAML in bad.yml"));
  }

  @Test void testReadMap() throws IOException {
    Path file = tempDir.resolve("crawl.yaml");
    Files.write(file, "userAgent: test agent\nformTypes:\n  - 10-K\n  - 10-Q\n"
        .getBytes(StandardCharsets.UTF_8));
    Map<String, Object> map = YamlUtils.readMap(file);
    assertEquals("test agent", map.get("userAgent"));
    assertEquals(List.of("10-K", "10-Q"), map.get("formTypes"));

    Path empty = tempDir.resolve("empty.yaml");
    Files.write(empty, new byte[0]);
    assertTrue(YamlUtils.readMap(empty).isEmpty());

    Path list = tempDir.resolve("list.yaml");
    Files.write(list, "- one\n- two\n".getBytes(StandardCharsets.UTF_8));
    assertThrows(IOException.class, () -> YamlUtils.readMap(list));
  }

  @Test void testResolvePlaceholders() {
    System.setProperty(PROPERTY, "from-property");
    assertEquals("agent from-property",
        YamlUtils.resolvePlaceholders("agent ${" + PROPERTY + "}"));
    assertEquals("fallback",
        YamlUtils.resolvePlaceholders("${EDGAR_YAML_UTILS_UNSET_VALUE:fallback}"));
    assertEquals("[]", YamlUtils.resolvePlaceholders("[${EDGAR_YAML_UTILS_UNSET_VALUE}]"));
    assertEquals("plain", YamlUtils.resolvePlaceholders("plain"));
  }
}
