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

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.opencsv.CSVWriter;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes parsed statements as JSON or CSV.
 *
 * <p>JSON and YAML carry the full statement with ISO dates and decimal values
 * as plain strings. CSV comes in two shapes: one row per statement, or one row
 * per concept.
 */
public final class StatementWriter {
  public static final String[] STATEMENT_HEADER = {
      "id", "company_id", "filing_type", "period_end_date", "fiscal_year", "fiscal_quarter"
  };

  public static final String[] CONCEPT_HEADER = {
      "statement_id", "concept", "prefix", "label", "value", "unit", "context_ref",
      "period_type", "period_start", "period_end", "statement_type", "section", "decimals",
      "alternate"
  };

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .addModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(SerializationFeature.INDENT_OUTPUT)
      .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
      .build();

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private StatementWriter() {
  }

  public static String toJson(ParsedStatement statement) throws IOException {
    return MAPPER.writeValueAsString(statement);
  }

  public static void writeJson(ParsedStatement statement, Writer writer) throws IOException {
    writer.write(toJson(statement));
    writer.flush();
  }

  public static String toYaml(ParsedStatement statement) throws IOException {
    return YAML_MAPPER.writeValueAsString(statement);
  }

  public static void writeStatementsCsv(List<ParsedStatement> statements, Writer writer)
      throws IOException {
    CSVWriter csv = new CSVWriter(writer);
    csv.writeNext(STATEMENT_HEADER, false);
    for (ParsedStatement statement : statements) {
      csv.writeNext(
          new String[] {
              statement.getId().toString(),
              str(statement.getCompanyCik()),
              str(statement.getFilingType()),
              str(statement.getPeriodEndDate()),
              str(statement.getFiscalYear()),
              str(statement.getFiscalQuarter())
          }, false);
    }
    csv.flush();
  }

  /** Authoritative concepts first, then alternates. */
  public static void writeConceptsCsv(ParsedStatement statement, Writer writer)
      throws IOException {
    CSVWriter csv = new CSVWriter(writer);
    csv.writeNext(CONCEPT_HEADER, false);
    String id = statement.getId().toString();
    for (TaxonomyConcept concept : statement.getConcepts()) {
      csv.writeNext(conceptRow(id, concept), false);
    }
    for (TaxonomyConcept concept : statement.getAlternates()) {
      csv.writeNext(conceptRow(id, concept), false);
    }
    csv.flush();
  }

  private static String[] conceptRow(String statementId, TaxonomyConcept concept) {
    return new String[] {
        statementId,
        concept.getName(),
        str(concept.getPrefix()),
        concept.getLabel(),
        concept.getValue().toPlainString(),
        str(concept.getUnit()),
        concept.getContextRef(),
        concept.getPeriodType().getValue(),
        str(concept.getPeriodStart()),
        str(concept.getPeriodEnd()),
        concept.getStatementType(),
        concept.getSection(),
        str(concept.getDecimals()),
        String.valueOf(concept.isAlternate())
    };
  }

  private static String str(@Nullable Object value) {
    return value == null ? "" : value.toString();
  }
}
