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

/**
 * Unit of measure declared in a document, such as {@code USD} or
 * {@code USD/shares}.
 */
public class XbrlUnit {
  private final String id;
  private final String measure;

  public XbrlUnit(String id, String measure) {
    this.id = id;
    this.measure = measure;
  }

  public String getId() {
    return id;
  }

  /** Measure with namespace prefixes removed. */
  public String getMeasure() {
    return measure;
  }

  @Override public String toString() {
    return id + "=" + measure;
  }
}
