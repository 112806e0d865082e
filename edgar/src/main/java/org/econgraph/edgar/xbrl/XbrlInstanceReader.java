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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

/**
 * Reads XBRL instance documents with DOM and inline XBRL documents with
 * jsoup's XML parser.
 */
final class XbrlInstanceReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlInstanceReader.class);

  /** Largest power of ten accepted from an inline {@code scale} attribute. */
  static final int MAX_SCALE = 100;

  /** Largest decimal exponent, either sign, accepted in a fact value. */
  static final int MAX_EXPONENT = 200;

  private static final Pattern EMBEDDED_XBRL =
      Pattern.compile("<((?:[\\w.-]+:)?xbrl)[\\s>].*?</\\1\\s*>",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
    @Override public void warning(SAXParseException e) {
      LOGGER.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
    }

    @Override public void error(SAXParseException e) throws SAXException {
      throw e;
    }

    @Override public void fatalError(SAXParseException e) throws SAXException {
      throw e;
    }
  };

  private XbrlInstanceReader() {
  }

  static XbrlInstance read(byte[] document) throws XbrlParseException {
    if (document == null || document.length == 0) {
      throw new XbrlParseException("Document is empty");
    }
    String content = new String(document, StandardCharsets.UTF_8);
    if (content.startsWith("\uFEFF")) {
      content = content.substring(1);
    }
    DocumentType type = DocumentType.detect(content);
    switch (type) {
    case XBRL:
      return readXml(content, type);
    case HTML_EMBEDDED:
      Matcher matcher = EMBEDDED_XBRL.matcher(content);
      if (!matcher.find()) {
        throw new XbrlParseException("HTML document has no complete XBRL block");
      }
      return readXml(matcher.group(), type);
    case IXBRL:
      return readInline(content);
    default:
      throw new XbrlParseException("Document is neither XBRL nor inline XBRL");
    }
  }

  // DOM (XBRL instance)

  private static XbrlInstance readXml(String xml, DocumentType type) throws XbrlParseException {
    Document doc;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(STRICT_ERRORS);
      doc = builder.parse(new InputSource(new StringReader(xml)));
    } catch (SAXParseException e) {
      throw new XbrlParseException("Malformed XML at line " + e.getLineNumber() + ": "
          + e.getMessage(), e);
    } catch (SAXException | IOException | ParserConfigurationException e) {
      throw new XbrlParseException("Unable to read XML: " + e.getMessage(), e);
    }

    Element root = doc.getDocumentElement();
    Map<String, String> namespaces = new LinkedHashMap<String, String>();
    NamedNodeMap attributes = root.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      Node attr = attributes.item(i);
      addNamespace(namespaces, attr.getNodeName(), attr.getNodeValue());
    }

    Map<String, XbrlContext> contexts = new LinkedHashMap<String, XbrlContext>();
    NodeList contextNodes = doc.getElementsByTagNameNS("*", "context");
    for (int i = 0; i < contextNodes.getLength(); i++) {
      Element context = (Element) contextNodes.item(i);
      String id = context.getAttribute("id");
      if (id.isEmpty()) {
        continue;
      }
      Element identifier = firstNs(context, "identifier");
      contexts.put(id,
          new XbrlContext(id,
              identifier != null ? identifier.getTextContent().trim() : null,
              identifier != null ? emptyToNull(identifier.getAttribute("scheme")) : null,
              parseDate(textNs(context, "startDate")),
              parseDate(textNs(context, "endDate")),
              parseDate(textNs(context, "instant")),
              firstNs(context, "segment") != null || firstNs(context, "scenario") != null));
    }

    Map<String, XbrlUnit> units = new LinkedHashMap<String, XbrlUnit>();
    NodeList unitNodes = doc.getElementsByTagNameNS("*", "unit");
    for (int i = 0; i < unitNodes.getLength(); i++) {
      Element unit = (Element) unitNodes.item(i);
      String id = unit.getAttribute("id");
      if (id.isEmpty()) {
        continue;
      }
      Element numerator = firstNs(unit, "unitNumerator");
      Element denominator = firstNs(unit, "unitDenominator");
      String measure;
      if (numerator != null && denominator != null) {
        measure = stripPrefix(textNs(numerator, "measure")) + "/"
            + stripPrefix(textNs(denominator, "measure"));
      } else {
        measure = stripPrefix(textNs(unit, "measure"));
      }
      units.put(id, new XbrlUnit(id, measure));
    }

    List<XbrlFact> facts = new ArrayList<XbrlFact>();
    List<String> warnings = new ArrayList<String>();
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node node = children.item(i);
      if (node.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element element = (Element) node;
      if (!element.hasAttribute("contextRef")) {
        continue;
      }
      String raw = element.getTextContent().trim();
      String unitRef = emptyToNull(element.getAttribute("unitRef"));
      BigDecimal numeric = null;
      if (unitRef != null && !raw.isEmpty()) {
        numeric = parseDecimal(raw);
        if (numeric == null) {
          warnings.add("Fact " + element.getNodeName() + " has non-numeric value '"
              + abbreviate(raw) + "'");
        }
      }
      String localName = element.getLocalName() != null
          ? element.getLocalName() : stripPrefix(element.getNodeName());
      facts.add(
          new XbrlFact(localName, element.getPrefix(), raw, numeric,
              element.getAttribute("contextRef"), unitRef,
              emptyToNull(element.getAttribute("decimals")), facts.size()));
    }
    LOGGER.debug("Read {} facts, {} contexts, {} units", facts.size(), contexts.size(),
        units.size());
    return new XbrlInstance(type, namespaces, contexts, units, facts, warnings);
  }

  private static @Nullable Element firstNs(Element parent, String localName) {
    NodeList nodes = parent.getElementsByTagNameNS("*", localName);
    return nodes.getLength() > 0 ? (Element) nodes.item(0) : null;
  }

  private static @Nullable String textNs(Element parent, String localName) {
    Element element = firstNs(parent, localName);
    return element != null ? element.getTextContent().trim() : null;
  }

  // jsoup (inline XBRL)

  private static XbrlInstance readInline(String html) {
    org.jsoup.nodes.Document doc = Jsoup.parse(html, "", Parser.xmlParser());

    Map<String, String> namespaces = new LinkedHashMap<String, String>();
    Map<String, XbrlContext> contexts = new LinkedHashMap<String, XbrlContext>();
    Map<String, XbrlUnit> units = new LinkedHashMap<String, XbrlUnit>();
    List<XbrlFact> facts = new ArrayList<XbrlFact>();
    List<String> warnings = new ArrayList<String>();

    for (org.jsoup.nodes.Element element : doc.getAllElements()) {
      for (Attribute attribute : element.attributes()) {
        addNamespace(namespaces, attribute.getKey(), attribute.getValue());
      }
      String tag = element.tagName().toLowerCase(Locale.ROOT);
      String local = stripPrefix(tag);
      if ("context".equals(local) && element.hasAttr("id")) {
        org.jsoup.nodes.Element identifier = firstLocal(element, "identifier");
        String id = element.attr("id");
        contexts.put(id,
            new XbrlContext(id,
                identifier != null ? identifier.text().trim() : null,
                identifier != null ? emptyToNull(identifier.attr("scheme")) : null,
                parseDate(textLocal(element, "startdate")),
                parseDate(textLocal(element, "enddate")),
                parseDate(textLocal(element, "instant")),
                firstLocal(element, "segment") != null
                    || firstLocal(element, "scenario") != null));
      } else if ("unit".equals(local) && element.hasAttr("id")) {
        org.jsoup.nodes.Element numerator = firstLocal(element, "unitnumerator");
        org.jsoup.nodes.Element denominator = firstLocal(element, "unitdenominator");
        String measure;
        if (numerator != null && denominator != null) {
          measure = stripPrefix(textLocal(numerator, "measure")) + "/"
              + stripPrefix(textLocal(denominator, "measure"));
        } else {
          measure = stripPrefix(textLocal(element, "measure"));
        }
        units.put(element.attr("id"), new XbrlUnit(element.attr("id"), measure));
      } else if ("ix:nonfraction".equals(tag) || "ix:nonnumeric".equals(tag)) {
        String name = element.attr("name");
        if (name.isEmpty() || !element.hasAttr("contextRef")) {
          continue;
        }
        int colon = name.indexOf(':');
        String prefix = colon >= 0 ? name.substring(0, colon) : null;
        String concept = colon >= 0 ? name.substring(colon + 1) : name;
        String raw = element.text().trim();
        BigDecimal numeric = null;
        String unitRef = null;
        if ("ix:nonfraction".equals(tag)) {
          unitRef = emptyToNull(element.attr("unitRef"));
          if (!"true".equalsIgnoreCase(element.attr("xsi:nil"))) {
            numeric = parseInlineNumber(raw, element.attr("format"), element.attr("scale"),
                element.attr("sign"));
            if (numeric == null) {
              warnings.add("Fact " + name + " has unreadable value '" + abbreviate(raw) + "'");
            }
          }
        }
        facts.add(
            new XbrlFact(concept, prefix, raw, numeric, element.attr("contextRef"), unitRef,
                emptyToNull(element.attr("decimals")), facts.size()));
      }
    }
    LOGGER.debug("Read {} inline facts, {} contexts, {} units", facts.size(), contexts.size(),
        units.size());
    return new XbrlInstance(DocumentType.IXBRL, namespaces, contexts, units, facts, warnings);
  }

  private static org.jsoup.nodes.@Nullable Element firstLocal(org.jsoup.nodes.Element parent,
      String localName) {
    for (org.jsoup.nodes.Element element : parent.getAllElements()) {
      if (element != parent
          && stripPrefix(element.tagName().toLowerCase(Locale.ROOT)).equals(localName)) {
        return element;
      }
    }
    return null;
  }

  private static @Nullable String textLocal(org.jsoup.nodes.Element parent, String localName) {
    org.jsoup.nodes.Element element = firstLocal(parent, localName);
    return element != null ? element.text().trim() : null;
  }

  /**
   * Applies the inline transformation rules: the display format, then
   * {@code scale} (power of ten) and {@code sign}.
   */
  static @Nullable BigDecimal parseInlineNumber(String text, @Nullable String format,
      @Nullable String scale, @Nullable String sign) {
    String fmt = format == null ? "" : format.toLowerCase(Locale.ROOT);
    String digits = text.trim();
    BigDecimal value;
    if (fmt.contains("zero") || digits.equals("-") || digits.equals("\u2014")
        || digits.equals("\u2013")) {
      value = BigDecimal.ZERO;
    } else {
      if (fmt.contains("comma")) {
        // comma is the decimal separator
        digits = digits.replace(".", "").replace(" ", "").replace(",", ".");
      } else {
        digits = digits.replace(",", "").replace(" ", "");
      }
      value = parseDecimal(digits);
      if (value == null) {
        return null;
      }
    }
    if (scale != null && !scale.isEmpty()) {
      int power;
      try {
        power = Integer.parseInt(scale.trim());
      } catch (NumberFormatException e) {
        LOGGER.debug("Ignoring invalid scale '{}'", scale);
        power = 0;
      }
      if (Math.abs(power) > MAX_SCALE) {
        LOGGER.debug("Scale {} out of range", power);
        return null;
      }
      try {
        value = value.movePointRight(power);
      } catch (ArithmeticException e) {
        LOGGER.debug("Cannot apply scale {} to {}", power, digits);
        return null;
      }
    }
    if ("-".equals(sign)) {
      value = value.negate();
    }
    return value;
  }

  static @Nullable BigDecimal parseDecimal(String text) {
    String value = text.trim();
    boolean negative = value.startsWith("(") && value.endsWith(")");
    if (negative) {
      value = value.substring(1, value.length() - 1);
    }
    value = value.replace("$", "").replace("\u00A0", "").replace(" ", "").trim();
    BigDecimal decimal;
    try {
      decimal = new BigDecimal(value);
    } catch (NumberFormatException e) {
      return null;
    }
    long exponent = (long) decimal.precision() - decimal.scale() - 1;
    if (Math.abs(exponent) > MAX_EXPONENT) {
      return null;
    }
    return negative ? decimal.negate() : decimal;
  }

  /** Calendar date from the first ten characters; time parts are ignored. */
  static @Nullable LocalDate parseDate(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String value = text.trim();
    if (value.length() > 10) {
      value = value.substring(0, 10);
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      LOGGER.debug("Unreadable date '{}'", text);
      return null;
    }
  }

  private static void addNamespace(Map<String, String> namespaces, String attrName,
      String uri) {
    if (attrName.startsWith("xmlns:")) {
      namespaces.putIfAbsent(attrName.substring("xmlns:".length()), uri);
    } else if (attrName.equals("xmlns")) {
      namespaces.putIfAbsent("", uri);
    }
  }

  static String stripPrefix(@Nullable String name) {
    if (name == null) {
      return "";
    }
    int colon = name.indexOf(':');
    return colon >= 0 ? name.substring(colon + 1) : name;
  }

  private static @Nullable String emptyToNull(@Nullable String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  private static String abbreviate(String value) {
    return value.length() > 40 ? value.substring(0, 40) + "..." : value;
  }
}
