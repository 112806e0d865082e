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

import org.econgraph.edgar.util.SecUtils;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Validates and parses XBRL filing documents.
 *
 * <p>{@link #validate} reports structural problems and never throws.
 * {@link #parse} extracts one statement per document, raising
 * {@link XbrlParseException} only when the document cannot be read at all;
 * everything else degrades to warnings on the statement.
 *
 * <p>When a concept is reported in several contexts, the value for the
 * filing's primary reporting period is authoritative. The primary context is
 * the one referenced by {@code dei:DocumentPeriodEndDate} (or
 * {@code dei:DocumentType}); failing that, the non-dimensional context that
 * ends latest. Among facts ending on the primary period end, preference goes
 * to the primary context itself, then an instant on that date, then a
 * duration with the primary start, then any other duration; ties go to
 * document order.
 */
public class XbrlParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlParser.class);

  private static final DateTimeFormatter LONG_DATE =
      DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

  /** Eligible facts rank 0..3; this marks a fact outside the primary period. */
  private static final int NOT_CURRENT = 4;

  public ValidationReport validate(byte[] document) {
    ValidationReport.Builder report = new ValidationReport.Builder();
    if (document == null || document.length == 0) {
      return report.error("Document is empty").build();
    }
    XbrlInstance instance;
    try {
      instance = XbrlInstanceReader.read(document);
    } catch (XbrlParseException e) {
      report.documentType(
          DocumentType.detect(new String(document, StandardCharsets.UTF_8)));
      return report.error(e.getMessage()).build();
    }
    report.documentType(instance.getDocumentType())
        .counts(instance.getContexts().size(), instance.getFacts().size());

    if (!instance.declaresNamespace(XbrlInstance.INSTANCE_NAMESPACE)) {
      report.error("Missing XBRL instance namespace " + XbrlInstance.INSTANCE_NAMESPACE);
    }
    if (!instance.declaresNamespaceContaining("fasb.org/us-gaap")
        && !instance.declaresNamespaceContaining("xbrl.ifrs.org")) {
      report.error("No US-GAAP or IFRS taxonomy namespace declared");
    }
    if (!instance.declaresNamespaceContaining("/dei/")) {
      report.warning("No dei (document and entity information) namespace declared");
    }

    if (instance.getContexts().isEmpty()) {
      report.error("No contexts defined");
    } else {
      boolean anyPeriod = false;
      for (XbrlContext context : instance.getContexts().values()) {
        if (context.hasPeriod()) {
          anyPeriod = true;
        } else {
          report.warning("Context " + context.getId() + " has no valid period");
        }
      }
      if (!anyPeriod) {
        report.error("No context defines a reporting period");
      }
    }

    if (instance.getFacts().isEmpty()) {
      report.warning("No facts found");
    }
    for (XbrlFact fact : instance.getFacts()) {
      if (instance.context(fact.getContextRef()) == null) {
        report.warning("Fact " + fact.getQualifiedName() + " references undefined context "
            + fact.getContextRef());
      }
      if (fact.isNumeric() && fact.getUnitRef() != null
          && !instance.getUnits().containsKey(fact.getUnitRef())) {
        report.warning("Fact " + fact.getQualifiedName() + " references undefined unit "
            + fact.getUnitRef());
      }
    }
    for (String warning : instance.getWarnings()) {
      report.warning(warning);
    }
    return report.build();
  }

  public ParsedStatement parse(byte[] document) throws XbrlParseException {
    XbrlInstance instance = XbrlInstanceReader.read(document);
    List<String> warnings = new ArrayList<String>(instance.getWarnings());

    XbrlContext primary = primaryContext(instance);
    if (primary == null) {
      warnings.add("No reporting period context found; using first reported values");
    }

    // Numeric facts grouped by concept, in order of first appearance
    Map<String, List<XbrlFact>> byConcept = new LinkedHashMap<String, List<XbrlFact>>();
    int nonNumeric = 0;
    for (XbrlFact fact : instance.getFacts()) {
      if ("dei".equals(fact.getPrefix())) {
        continue;
      }
      if (!fact.isNumeric()) {
        nonNumeric++;
        continue;
      }
      if (instance.context(fact.getContextRef()) == null) {
        warnings.add("Skipped " + fact.getQualifiedName() + ": undefined context "
            + fact.getContextRef());
        continue;
      }
      byConcept.computeIfAbsent(fact.getQualifiedName(), k -> new ArrayList<XbrlFact>())
          .add(fact);
    }
    if (nonNumeric > 0) {
      warnings.add("Skipped " + nonNumeric + " non-numeric fact(s)");
    }

    List<TaxonomyConcept> concepts = new ArrayList<TaxonomyConcept>();
    List<TaxonomyConcept> alternates = new ArrayList<TaxonomyConcept>();
    for (Map.Entry<String, List<XbrlFact>> entry : byConcept.entrySet()) {
      List<XbrlFact> facts = entry.getValue();
      XbrlFact selected = select(instance, primary, facts);
      if (selected != null) {
        concepts.add(toConcept(instance, selected, null));
      }
      List<XbrlFact> others = new ArrayList<XbrlFact>();
      for (XbrlFact fact : facts) {
        if (fact != selected && !isDuplicateOf(fact, selected)
            && !containsDuplicate(others, fact)) {
          others.add(fact);
        }
      }
      for (XbrlFact other : others) {
        alternates.add(toConcept(instance, other, alternateNote(instance, primary, other)));
      }
      if (selected == null) {
        warnings.add("No value for " + entry.getKey() + " in the primary period; "
            + others.size() + " alternate(s) retained");
      } else if (!others.isEmpty()) {
        warnings.add(entry.getKey() + " reported in " + (others.size() + 1)
            + " contexts; using " + selected.getContextRef() + ", "
            + others.size() + " alternate(s) retained");
      }
    }

    String cik = companyCik(instance, primary);
    if (cik == null) {
      warnings.add("Company identifier not found");
    }
    String filingType = deiText(instance, "DocumentType");
    LocalDate periodEnd = parseLooseDate(deiText(instance, "DocumentPeriodEndDate"));
    if (periodEnd == null && primary != null) {
      periodEnd = primary.getPeriodEnd();
    }
    if (periodEnd == null) {
      warnings.add("Period end date not found");
    }
    Integer fiscalYear = parseYear(deiText(instance, "DocumentFiscalYearFocus"));
    if (fiscalYear == null && periodEnd != null) {
      fiscalYear = periodEnd.getYear();
    }
    Integer fiscalQuarter = fiscalQuarter(deiText(instance, "DocumentFiscalPeriodFocus"),
        filingType, periodEnd);

    ParsedStatement statement =
        new ParsedStatement(UUID.randomUUID(), cik, filingType, periodEnd, fiscalYear,
            fiscalQuarter, instance.getDocumentType(), concepts, alternates, warnings);
    LOGGER.debug("Parsed {}", statement);
    return statement;
  }

  /** Distinct concept definitions for the facts in a document, in document order. */
  public List<ConceptDefinition> extractTaxonomyConcepts(byte[] document)
      throws XbrlParseException {
    XbrlInstance instance = XbrlInstanceReader.read(document);
    Map<String, ConceptDefinition> definitions = new LinkedHashMap<String, ConceptDefinition>();
    for (XbrlFact fact : instance.getFacts()) {
      if (!definitions.containsKey(fact.getConcept())) {
        definitions.put(fact.getConcept(), ConceptClassifier.classify(fact.getConcept()));
      }
    }
    return new ArrayList<ConceptDefinition>(definitions.values());
  }

  static @Nullable XbrlContext primaryContext(XbrlInstance instance) {
    for (String concept : new String[] {"DocumentPeriodEndDate", "DocumentType"}) {
      XbrlFact fact = instance.deiFact(concept);
      if (fact != null) {
        XbrlContext context = instance.context(fact.getContextRef());
        if (context != null && context.hasPeriod()) {
          return context;
        }
      }
    }
    Map<String, Integer> usage = new LinkedHashMap<String, Integer>();
    for (XbrlFact fact : instance.getFacts()) {
      if (fact.getContextRef() != null) {
        usage.merge(fact.getContextRef(), 1, Integer::sum);
      }
    }
    XbrlContext best = null;
    for (XbrlContext context : instance.getContexts().values()) {
      if (context.isDimensional() || !context.hasPeriod()) {
        continue;
      }
      if (best == null || comparePrimary(context, best, usage) > 0) {
        best = context;
      }
    }
    return best;
  }

  /** Orders candidate primary contexts: later end, then duration, then more facts. */
  private static int comparePrimary(XbrlContext a, XbrlContext b, Map<String, Integer> usage) {
    int byEnd = Objects.requireNonNull(a.getPeriodEnd())
        .compareTo(Objects.requireNonNull(b.getPeriodEnd()));
    if (byEnd != 0) {
      return byEnd;
    }
    int byType = Boolean.compare(a.getPeriodType() == PeriodType.DURATION,
        b.getPeriodType() == PeriodType.DURATION);
    if (byType != 0) {
      return byType;
    }
    return Integer.compare(usage.getOrDefault(a.getId(), 0), usage.getOrDefault(b.getId(), 0));
  }

  private static @Nullable XbrlFact select(XbrlInstance instance,
      @Nullable XbrlContext primary, List<XbrlFact> facts) {
    if (primary == null) {
      for (XbrlFact fact : facts) {
        XbrlContext context = instance.context(fact.getContextRef());
        if (context != null && !context.isDimensional()) {
          return fact;
        }
      }
      return facts.get(0);
    }
    XbrlFact best = null;
    int bestRank = NOT_CURRENT;
    // facts are in document order, so strict comparison keeps the earliest on ties
    for (XbrlFact fact : facts) {
      int rank = rank(instance.context(fact.getContextRef()), primary);
      if (rank < bestRank) {
        best = fact;
        bestRank = rank;
      }
    }
    return best;
  }

  static int rank(@Nullable XbrlContext context, XbrlContext primary) {
    if (context == null || context.isDimensional()
        || !Objects.equals(context.getPeriodEnd(), primary.getPeriodEnd())) {
      return NOT_CURRENT;
    }
    if (context.getId().equals(primary.getId())) {
      return 0;
    }
    if (context.getPeriodType() == PeriodType.INSTANT) {
      return 1;
    }
    if (Objects.equals(context.getStartDate(), primary.getStartDate())) {
      return 2;
    }
    return 3;
  }

  private static String alternateNote(XbrlInstance instance, @Nullable XbrlContext primary,
      XbrlFact fact) {
    XbrlContext context = Objects.requireNonNull(instance.context(fact.getContextRef()));
    if (context.isDimensional()) {
      return "dimensional context";
    }
    if (primary != null && !Objects.equals(context.getPeriodEnd(), primary.getPeriodEnd())) {
      return "other period";
    }
    return "alternate context";
  }

  private static boolean isDuplicateOf(XbrlFact fact, @Nullable XbrlFact other) {
    return other != null
        && Objects.equals(fact.getContextRef(), other.getContextRef())
        && Objects.equals(fact.getUnitRef(), other.getUnitRef())
        && Objects.requireNonNull(fact.getNumericValue())
            .compareTo(Objects.requireNonNull(other.getNumericValue())) == 0;
  }

  private static boolean containsDuplicate(List<XbrlFact> facts, XbrlFact fact) {
    for (XbrlFact other : facts) {
      if (isDuplicateOf(fact, other)) {
        return true;
      }
    }
    return false;
  }

  private static TaxonomyConcept toConcept(XbrlInstance instance, XbrlFact fact,
      @Nullable String alternateNote) {
    XbrlContext context = Objects.requireNonNull(instance.context(fact.getContextRef()));
    TaxonomyConcept.Builder builder =
        TaxonomyConcept.builder(fact.getConcept(),
                Objects.requireNonNull(fact.getNumericValue()), context.getId())
            .prefix(fact.getPrefix())
            .unit(instance.unitMeasure(fact.getUnitRef()))
            .periodType(context.getPeriodType())
            .period(context.getStartDate(), context.getPeriodEnd())
            .decimals(fact.getDecimals());
    if (alternateNote != null) {
      builder.alternate(alternateNote);
    }
    return builder.build();
  }

  private static @Nullable String deiText(XbrlInstance instance, String concept) {
    XbrlFact fact = instance.deiFact(concept);
    if (fact == null || fact.getRawValue().isEmpty()) {
      return null;
    }
    return fact.getRawValue();
  }

  private static @Nullable String companyCik(XbrlInstance instance,
      @Nullable XbrlContext primary) {
    String declared = deiText(instance, "EntityCentralIndexKey");
    if (declared != null && SecUtils.isValidCik(declared.trim())) {
      return SecUtils.padCik(declared.trim());
    }
    if (primary != null && primary.getEntityIdentifier() != null
        && SecUtils.isValidCik(primary.getEntityIdentifier())) {
      return SecUtils.padCik(primary.getEntityIdentifier());
    }
    for (XbrlContext context : instance.getContexts().values()) {
      String identifier = context.getEntityIdentifier();
      if (identifier != null && SecUtils.isValidCik(identifier)) {
        return SecUtils.padCik(identifier);
      }
    }
    return null;
  }

  static @Nullable LocalDate parseLooseDate(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String value = text.trim().replaceAll("\\s+", " ");
    LocalDate iso = XbrlInstanceReader.parseDate(value);
    if (iso != null) {
      return iso;
    }
    try {
      return SecUtils.parseSecDate(value);
    } catch (IllegalArgumentException e) {
      LOGGER.debug("Not an SEC date: '{}'", value);
    }
    try {
      return LocalDate.parse(value, LONG_DATE);
    } catch (DateTimeParseException e) {
      LOGGER.debug("Unreadable period end date '{}'", value);
      return null;
    }
  }

  private static @Nullable Integer parseYear(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String value = text.trim();
    if (value.length() >= 4) {
      try {
        int year = Integer.parseInt(value.substring(0, 4));
        return SecUtils.isValidFiscalYear(year) ? year : null;
      } catch (NumberFormatException e) {
        LOGGER.debug("Unreadable fiscal year '{}'", text);
      }
    }
    return null;
  }

  static @Nullable Integer fiscalQuarter(@Nullable String periodFocus,
      @Nullable String filingType, @Nullable LocalDate periodEnd) {
    if (periodFocus != null) {
      String focus = periodFocus.trim().toUpperCase(Locale.ROOT);
      if (focus.equals("FY")) {
        return null;
      }
      if (focus.length() == 2 && focus.charAt(0) == 'Q'
          && focus.charAt(1) >= '1' && focus.charAt(1) <= '4') {
        return focus.charAt(1) - '0';
      }
    }
    if (filingType != null && filingType.toUpperCase(Locale.ROOT).startsWith("10-Q")
        && periodEnd != null) {
      return SecUtils.fiscalQuarterOf(periodEnd);
    }
    return null;
  }
}
