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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Physical format of a filing document.
 */
public enum DocumentType {
  /** Standalone XBRL instance document. */
  XBRL,
  /** Inline XBRL: facts tagged inside an XHTML document. */
  IXBRL,
  /** HTML page carrying a complete XBRL instance block. */
  HTML_EMBEDDED,
  UNKNOWN;

  private static final Pattern XBRL_ROOT =
      Pattern.compile("<(?:[\\w.-]+:)?xbrl[\\s>]", Pattern.CASE_INSENSITIVE);

  /**
   * Detects the type from the document text. Only the markup is inspected,
   * never the file name.
   */
  public static DocumentType detect(String content) {
    String lower = content.toLowerCase(Locale.ROOT);
    if (lower.contains("xmlns:ix=") || lower.contains("<ix:")) {
      return IXBRL;
    }
    boolean hasXbrl = XBRL_ROOT.matcher(content).find();
    boolean isHtml = lower.contains("<html");
    if (hasXbrl && isHtml) {
      return HTML_EMBEDDED;
    }
    if (hasXbrl) {
      return XBRL;
    }
    return UNKNOWN;
  }
}
