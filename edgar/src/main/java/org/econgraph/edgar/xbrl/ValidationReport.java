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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a structural check. A report is valid when it has no errors;
 * warnings never affect validity.
 */
public class ValidationReport {
  private final DocumentType documentType;
  private final ImmutableList<String> errors;
  private final ImmutableList<String> warnings;
  private final int contextCount;
  private final int factCount;

  ValidationReport(DocumentType documentType, List<String> errors, List<String> warnings,
      int contextCount, int factCount) {
    this.documentType = documentType;
    this.errors = ImmutableList.copyOf(errors);
    this.warnings = ImmutableList.copyOf(warnings);
    this.contextCount = contextCount;
    this.factCount = factCount;
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public DocumentType getDocumentType() {
    return documentType;
  }

  public List<String> getErrors() {
    return errors;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public int getContextCount() {
    return contextCount;
  }

  public int getFactCount() {
    return factCount;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ValidationReport)) {
      return false;
    }
    ValidationReport that = (ValidationReport) o;
    return documentType == that.documentType && contextCount == that.contextCount
        && factCount == that.factCount && errors.equals(that.errors)
        && warnings.equals(that.warnings);
  }

  @Override public int hashCode() {
    return Objects.hash(documentType, errors, warnings, contextCount, factCount);
  }

  @Override public String toString() {
    return "ValidationReport{valid=" + isValid() + ", type=" + documentType
        + ", errors=" + errors + ", warnings=" + warnings.size() + "}";
  }

  /** Accumulates findings while a document is checked. */
  static class Builder {
    private DocumentType documentType = DocumentType.UNKNOWN;
    private final List<String> errors = new ArrayList<String>();
    private final List<String> warnings = new ArrayList<String>();
    private int contextCount;
    private int factCount;

    Builder documentType(DocumentType documentType) {
      this.documentType = documentType;
      return this;
    }

    Builder error(String message) {
      errors.add(message);
      return this;
    }

    Builder warning(String message) {
      warnings.add(message);
      return this;
    }

    Builder counts(int contexts, int facts) {
      this.contextCount = contexts;
      this.factCount = facts;
      return this;
    }

    ValidationReport build() {
      return new ValidationReport(documentType, errors, warnings, contextCount, factCount);
    }
  }
}
