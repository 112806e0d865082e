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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link XbrlParser}. */
@Tag("unit")
class XbrlParserTest {
  private static final String HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
      + "<xbrli:xbrl xmlns:xbrli=\"http://www.xbrl.org/2003/instance\"\n"
      + "    xmlns:us-gaap=\"http://fasb.org/us-gaap/2023\"\n"
      + "    xmlns:dei=\"http://xbrl.sec.gov/dei/2023\">\n"
      + "  <xbrli:unit id=\"usd\"><xbrli:measure>iso4217:USD</xbrli:measure></xbrli:unit>\n";
  private static final String FOOTER = "</xbrli:xbrl>\n";

  private XbrlParser parser;

  @BeforeEach void setUp() {
    parser = new XbrlParser();
  }

  static byte[] resource(String name) throws IOException {
    try (InputStream in = XbrlParserTest.class.getResourceAsStream("/xbrl/" + name)) {
      assertNotNull(in, "missing test resource " + name);
      return in.readAllBytes();
    }
  }

  private static String duration(String id, String start, String end) {
    return "  <xbrli:context id=\"" + id + "\"><xbrli:entity>"
        + "<xbrli:identifier scheme=\"http://www.sec.gov/CIK\">0000111111</xbrli:identifier>"
        + "</xbrli:entity><xbrli:period><xbrli:startDate>" + start + "</xbrli:startDate>"
        + "<xbrli:endDate>" + end + "</xbrli:endDate></xbrli:period></xbrli:context>\n";
  }

  private static String instant(String id, String date) {
    return "  <xbrli:context id=\"" + id + "\"><xbrli:entity>"
        + "<xbrli:identifier scheme=\"http://www.sec.gov/CIK\">0000111111</xbrli:identifier>"
        + "</xbrli:entity><xbrli:period><xbrli:instant>" + date + "</xbrli:instant>"
        + "</xbrli:period></xbrli:context>\n";
  }

  private static String fact(String concept, String context, String value) {
    return "  <us-gaap:" + concept + " contextRef=\"" + context + "\" unitRef=\"usd\">"
        + value + "</us-gaap:" + concept + ">\n";
  }

  private static byte[] document(String... parts) {
    StringBuilder sb = new StringBuilder(HEADER);
    for (String part : parts) {
      sb.append(part);
    }
    return sb.append(FOOTER).toString().getBytes(StandardCharsets.UTF_8);
  }

  private static BigDecimal value(ParsedStatement statement, String concept) {
    return statement.findValue(concept)
        .orElseThrow(() -> new AssertionError("no value for " + concept));
  }

  private static void assertValue(String expected, BigDecimal actual) {
    assertEquals(0, new BigDecimal(expected).compareTo(actual),
        "expected " + expected + " but was " + actual.toPlainString());
  }

  @Test void testValidateSample10k() throws IOException {
    ValidationReport report = parser.validate(resource("sample-10k.xml"));
    assertTrue(report.isValid(), report.getErrors().toString());
    assertEquals(DocumentType.XBRL, report.getDocumentType());
    assertTrue(report.getWarnings().isEmpty(), report.getWarnings().toString());
    assertEquals(5, report.getContextCount());
    assertEquals(31, report.getFactCount());
  }

  @Test void testValidateIsRepeatable() throws IOException {
    byte[] document = resource("sample-10k.xml");
    assertEquals(parser.validate(document), parser.validate(document));
    byte[] malformed = resource("malformed.xml");
    assertEquals(parser.validate(malformed), parser.validate(malformed));
  }

  @Test void testValidateReportsProblemsWithoutThrowing() throws IOException {
    ValidationReport empty = parser.validate(new byte[0]);
    assertFalse(empty.isValid());
    assertEquals("Document is empty", empty.getErrors().get(0));

    ValidationReport malformed = parser.validate(resource("malformed.xml"));
    assertFalse(malformed.isValid());
    assertEquals(DocumentType.XBRL, malformed.getDocumentType());
    assertTrue(malformed.getErrors().get(0).startsWith("Malformed XML at line"),
        malformed.getErrors().get(0));

    ValidationReport text = parser.validate("just text".getBytes(StandardCharsets.UTF_8));
    assertFalse(text.isValid());
    assertEquals(DocumentType.UNKNOWN, text.getDocumentType());
    assertEquals("Document is neither XBRL nor inline XBRL", text.getErrors().get(0));
  }

  @Test void testValidateStructure() {
    String noTaxonomy = "<xbrli:xbrl xmlns:xbrli=\"http://www.xbrl.org/2003/instance\">"
        + "</xbrli:xbrl>";
    ValidationReport report = parser.validate(noTaxonomy.getBytes(StandardCharsets.UTF_8));
    assertFalse(report.isValid());
    assertTrue(report.getErrors().contains("No US-GAAP or IFRS taxonomy namespace declared"));
    assertTrue(report.getErrors().contains("No contexts defined"));
    assertTrue(report.getWarnings().contains("No facts found"));
    assertTrue(report.getWarnings()
        .contains("No dei (document and entity information) namespace declared"));

    ValidationReport dangling = parser.validate(document(
        instant("I1", "2023-12-31"),
        fact("Assets", "I1", "100"),
        fact("Liabilities", "I9", "50")));
    assertTrue(dangling.isValid());
    assertTrue(dangling.getWarnings()
        .contains("Fact us-gaap:Liabilities references undefined context I9"));
  }

  @Test void testParseSample10k() throws Exception {
    ParsedStatement statement = parser.parse(resource("sample-10k.xml"));

    assertEquals(DocumentType.XBRL, statement.getDocumentType());
    assertEquals("0000320193", statement.getCompanyCik());
    assertEquals("10-K", statement.getFilingType());
    assertEquals(LocalDate.of(2023, 12, 31), statement.getPeriodEndDate());
    assertEquals(2023, statement.getFiscalYear());
    assertNull(statement.getFiscalQuarter());
    assertEquals(17, statement.getConcepts().size());
    assertEquals(5, statement.getAlternates().size());

    assertValue("383285000000", value(statement, "Revenues"));
    assertValue("96995000000", value(statement, "us-gaap:NetIncomeLoss"));
    assertValue("352583000000", value(statement, "Assets"));
    assertValue("62146000000", value(statement, "StockholdersEquity"));
    assertValue("6.16", value(statement, "EarningsPerShareBasic"));
    assertFalse(statement.findConcept("DocumentType").isPresent());
    assertFalse(statement.findConcept("IncomeTaxDisclosureTextBlock").isPresent());

    TaxonomyConcept revenues = statement.findConcept("Revenues").get();
    assertEquals("us-gaap", revenues.getPrefix());
    assertEquals("FY2023", revenues.getContextRef());
    assertEquals("USD", revenues.getUnit());
    assertEquals(PeriodType.DURATION, revenues.getPeriodType());
    assertEquals(LocalDate.of(2023, 1, 1), revenues.getPeriodStart());
    assertEquals("-6", revenues.getDecimals());
    assertEquals("income_statement", revenues.getStatementType());
    assertFalse(revenues.isAlternate());

    TaxonomyConcept assets = statement.findConcept("Assets").get();
    assertEquals("I2023", assets.getContextRef());
    assertEquals(PeriodType.INSTANT, assets.getPeriodType());
    assertEquals("Total Assets", assets.getLabel());
    assertEquals("USD/shares", statement.findConcept("EarningsPerShareDiluted").get().getUnit());
  }

  @Test void testAlternatesAndWarnings() throws Exception {
    ParsedStatement statement = parser.parse(resource("sample-10k.xml"));

    List<String> notes = new ArrayList<String>();
    for (TaxonomyConcept alternate : statement.getAlternates()) {
      assertTrue(alternate.isAlternate());
      notes.add(alternate.getName() + "@" + alternate.getContextRef() + ":" + alternate.getNote());
    }
    assertEquals(List.of(
        "Revenues@FY2022:other period",
        "Revenues@FY2023_Products:dimensional context",
        "NetIncomeLoss@FY2022:other period",
        "Assets@I2022:other period",
        "StockholdersEquity@I2022:other period"), notes);

    List<String> warnings = statement.getWarnings();
    assertEquals(5, warnings.size(), warnings.toString());
    assertEquals("Skipped 2 non-numeric fact(s)", warnings.get(0));
    assertEquals("us-gaap:Revenues reported in 3 contexts; using FY2023, 2 alternate(s) retained",
        warnings.get(1));
    assertEquals("us-gaap:Assets reported in 2 contexts; using I2023, 1 alternate(s) retained",
        warnings.get(3));
  }

  @Test void testParseInlineQuarterly() throws Exception {
    byte[] document = resource("sample-10q.htm");
    ValidationReport report = parser.validate(document);
    assertTrue(report.isValid(), report.getErrors().toString());
    assertEquals(DocumentType.IXBRL, report.getDocumentType());

    ParsedStatement statement = parser.parse(document);
    assertEquals(DocumentType.IXBRL, statement.getDocumentType());
    assertEquals("0000789019", statement.getCompanyCik());
    assertEquals("10-Q", statement.getFilingType());
    assertEquals(LocalDate.of(2024, 9, 28), statement.getPeriodEndDate());
    assertEquals(2024, statement.getFiscalYear());
    assertEquals(3, statement.getFiscalQuarter());
    assertEquals(5, statement.getConcepts().size());
    assertEquals(2, statement.getAlternates().size());

    assertValue("1234500000", value(statement, "Revenues"));
    assertValue("-120000000", value(statement, "NetIncomeLoss"));
    assertValue("0", value(statement, "InterestExpense"));
    assertValue("500000000", value(statement, "AssetsCurrent"));
    assertValue("250000000", value(statement, "LiabilitiesCurrent"));
    assertEquals("c-1", statement.findConcept("Revenues").get().getContextRef());
    assertEquals("c-3", statement.findConcept("AssetsCurrent").get().getContextRef());

    TaxonomyConcept ytd = statement.getAlternates().get(0);
    assertEquals("Revenues", ytd.getName());
    assertEquals("alternate context", ytd.getNote());
    assertValue("3600000000", ytd.getValue());
  }

  @Test void testPrimaryContextWithoutDeiFacts() throws Exception {
    ParsedStatement statement = parser.parse(document(
        duration("D2022", "2022-01-01", "2022-12-31"),
        instant("I2023", "2023-12-31"),
        duration("D2023", "2023-01-01", "2023-12-31"),
        fact("Revenues", "D2022", "90"),
        fact("Revenues", "D2023", "100"),
        fact("Assets", "I2023", "500")));
    assertEquals(LocalDate.of(2023, 12, 31), statement.getPeriodEndDate());
    assertEquals("0000111111", statement.getCompanyCik());
    assertNull(statement.getFilingType());
    assertEquals("D2023", statement.findConcept("Revenues").get().getContextRef());
    assertEquals("I2023", statement.findConcept("Assets").get().getContextRef());
  }

  @Test void testEarliestFactWinsTies() throws Exception {
    ParsedStatement statement = parser.parse(document(
        duration("D1", "2023-01-01", "2023-12-31"),
        duration("H2", "2023-07-01", "2023-12-31"),
        instant("I1", "2023-12-31"),
        "  <dei:DocumentPeriodEndDate contextRef=\"D1\">2023-12-31</dei:DocumentPeriodEndDate>\n",
        fact("Revenues", "D1", "100"),
        fact("Revenues", "D1", "101"),
        fact("Revenues", "D1", "100"),
        fact("CostOfRevenue", "H2", "60"),
        fact("CostOfRevenue", "I1", "70")));
    assertValue("100", value(statement, "Revenues"));
    assertValue("70", value(statement, "CostOfRevenue"));
    assertEquals(2, statement.getAlternates().size());
    assertValue("101", statement.getAlternates().get(0).getValue());
    assertEquals("alternate context", statement.getAlternates().get(0).getNote());
    assertEquals("H2", statement.getAlternates().get(1).getContextRef());
  }

  @Test void testConceptOnlyInOtherPeriods() throws Exception {
    ParsedStatement statement = parser.parse(document(
        duration("D1", "2023-01-01", "2023-12-31"),
        instant("I0", "2022-12-31"),
        "  <dei:DocumentPeriodEndDate contextRef=\"D1\">2023-12-31</dei:DocumentPeriodEndDate>\n",
        fact("Revenues", "D1", "100"),
        fact("Goodwill", "I0", "42")));
    assertFalse(statement.findConcept("Goodwill").isPresent());
    assertEquals(1, statement.getAlternates().size());
    assertTrue(statement.getWarnings().contains(
        "No value for us-gaap:Goodwill in the primary period; 1 alternate(s) retained"));
  }

  @Test void testParseRejectsUnreadableDocuments() throws IOException {
    byte[] malformed = resource("malformed.xml");
    XbrlParseException e =
        assertThrows(XbrlParseException.class, () -> parser.parse(malformed));
    assertTrue(e.getMessage().startsWith("Malformed XML"));
    assertThrows(XbrlParseException.class, () -> parser.parse(new byte[0]));
    assertThrows(XbrlParseException.class,
        () -> parser.parse("<html><body>No data</body></html>".getBytes(StandardCharsets.UTF_8)));
  }

  @Test void testOutOfRangeInlineScaleIsAWarning() throws Exception {
    String html = "<html xmlns:ix=\"http://www.xbrl.org/2013/inlineXBRL\"\n"
        + "    xmlns:xbrli=\"http://www.xbrl.org/2003/instance\"\n"
        + "    xmlns:us-gaap=\"http://fasb.org/us-gaap/2024\"><body>\n"
        + "<ix:header><ix:resources>\n"
        + instant("c1", "2024-03-31")
        + "  <xbrli:unit id=\"usd\"><xbrli:measure>iso4217:USD</xbrli:measure></xbrli:unit>\n"
        + "</ix:resources></ix:header>\n"
        + "<ix:nonFraction name=\"us-gaap:Assets\" contextRef=\"c1\" unitRef=\"usd\""
        + " scale=\"-2147483648\">1</ix:nonFraction>\n"
        + "<ix:nonFraction name=\"us-gaap:Liabilities\" contextRef=\"c1\" unitRef=\"usd\""
        + " scale=\"6\">2.5</ix:nonFraction>\n"
        + "</body></html>\n";
    byte[] document = html.getBytes(StandardCharsets.UTF_8);

    ValidationReport report = parser.validate(document);
    assertEquals(DocumentType.IXBRL, report.getDocumentType());
    assertTrue(report.isValid(), report.getErrors().toString());
    assertTrue(report.getWarnings().contains("Fact us-gaap:Assets has unreadable value '1'"),
        report.getWarnings().toString());

    ParsedStatement statement = parser.parse(document);
    assertFalse(statement.findConcept("Assets").isPresent());
    assertValue("2500000", value(statement, "Liabilities"));
    assertTrue(statement.getWarnings().contains("Fact us-gaap:Assets has unreadable value '1'"));
    assertTrue(statement.getWarnings().contains("Skipped 1 non-numeric fact(s)"));
  }

  @Test void testExtremeExponentIsNotNumeric() throws Exception {
    ParsedStatement statement = parser.parse(document(
        instant("I1", "2023-12-31"),
        fact("Assets", "I1", "1E-999999999"),
        fact("Liabilities", "I1", "40")));
    assertFalse(statement.findConcept("Assets").isPresent());
    assertValue("40", value(statement, "Liabilities"));
    assertTrue(statement.getWarnings().contains(
        "Fact us-gaap:Assets has non-numeric value '1E-999999999'"),
        statement.getWarnings().toString());
  }

  @Test void testHtmlEmbeddedInstance() throws Exception {
    String html = "<html><body><pre>" + new String(document(
        duration("D1", "2023-01-01", "2023-12-31"),
        fact("Revenues", "D1", "100")), StandardCharsets.UTF_8)
        .replace("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n", "")
        + "</pre></body></html>";
    ParsedStatement statement = parser.parse(html.getBytes(StandardCharsets.UTF_8));
    assertEquals(DocumentType.HTML_EMBEDDED, statement.getDocumentType());
    assertValue("100", value(statement, "Revenues"));
  }

  @Test void testExtractTaxonomyConcepts() throws Exception {
    List<ConceptDefinition> definitions =
        parser.extractTaxonomyConcepts(resource("sample-10k.xml"));
    ConceptDefinition assets = null;
    for (ConceptDefinition definition : definitions) {
      if (definition.getName().equals("Assets")) {
        assets = definition;
      }
    }
    assertNotNull(assets);
    assertEquals("Total Assets", assets.getLabel());
    assertEquals(PeriodType.INSTANT, assets.getPeriodType());
    assertEquals("debit", assets.getBalanceType());
    assertEquals(6 + 17 + 2, definitions.size());
  }

  @Test void testFiscalQuarterAndDates() {
    assertNull(XbrlParser.fiscalQuarter("FY", "10-K", LocalDate.of(2023, 12, 31)));
    assertEquals(2, XbrlParser.fiscalQuarter("q2", "10-Q", LocalDate.of(2023, 12, 31)));
    assertEquals(4, XbrlParser.fiscalQuarter(null, "10-Q", LocalDate.of(2023, 12, 30)));
    assertNull(XbrlParser.fiscalQuarter(null, "10-K", LocalDate.of(2023, 12, 30)));
    assertEquals(LocalDate.of(2024, 9, 28), XbrlParser.parseLooseDate("September  28, 2024"));
    assertEquals(LocalDate.of(2024, 9, 28), XbrlParser.parseLooseDate("09/28/2024"));
    assertEquals(LocalDate.of(2024, 9, 28), XbrlParser.parseLooseDate("2024-09-28"));
    assertNull(XbrlParser.parseLooseDate("sometime"));
  }
}
