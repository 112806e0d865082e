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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Raw content of a document: facts, contexts and units as tagged, before
 * any selection of authoritative values.
 */
class XbrlInstance {
  static final String INSTANCE_NAMESPACE = "http://www.xbrl.org/2003/instance";

  private final DocumentType documentType;
  private final ImmutableMap<String, String> namespaces;
  private final ImmutableMap<String, XbrlContext> contexts;
  private final ImmutableMap<String, XbrlUnit> units;
  private final ImmutableList<XbrlFact> facts;
  private final ImmutableList<String> warnings;

  XbrlInstance(DocumentType documentType, Map<String, String> namespaces,
      Map<String, XbrlContext> contexts, Map<String, XbrlUnit> units, List<XbrlFact> facts,
      List<String> warnings) {
    this.documentType = documentType;
    this.namespaces = ImmutableMap.copyOf(namespaces);
    this.contexts = ImmutableMap.copyOf(contexts);
    this.units = ImmutableMap.copyOf(units);
    this.facts = ImmutableList.copyOf(facts);
    this.warnings = ImmutableList.copyOf(warnings);
  }

  DocumentType getDocumentType() {
    return documentType;
  }

  /** Declared namespaces, prefix to URI. */
  Map<String, String> getNamespaces() {
    return namespaces;
  }

  /** Contexts keyed by id, in document order. */
  Map<String, XbrlContext> getContexts() {
    return contexts;
  }

  Map<String, XbrlUnit> getUnits() {
    return units;
  }

  List<XbrlFact> getFacts() {
    return facts;
  }

  /** Problems found while reading individual facts. */
  List<String> getWarnings() {
    return warnings;
  }

  @Nullable XbrlContext context(@Nullable String id) {
    return id == null ? null : contexts.get(id);
  }

  @Nullable String unitMeasure(@Nullable String unitRef) {
    if (unitRef == null) {
      return null;
    }
    XbrlUnit unit = units.get(unitRef);
    return unit != null ? unit.getMeasure() : unitRef;
  }

  boolean declaresNamespace(String uri) {
    return namespaces.containsValue(uri);
  }

  boolean declaresNamespaceContaining(String fragment) {
    for (String uri : namespaces.values()) {
      if (uri.contains(fragment)) {
        return true;
      }
    }
    return false;
  }

  /** First fact with the given concept name and {@code dei} prefix. */
  @Nullable XbrlFact deiFact(String concept) {
    for (XbrlFact fact : facts) {
      if (concept.equals(fact.getConcept()) && "dei".equals(fact.getPrefix())) {
        return fact;
      }
    }
    return null;
  }
}
