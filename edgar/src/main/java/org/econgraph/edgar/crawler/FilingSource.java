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
package org.econgraph.edgar.crawler;

import java.io.IOException;
import java.util.List;

/**
 * Upstream provider of filing indexes and filing documents.
 *
 * <p>Implementations signal HTTP failures with
 * {@link org.econgraph.edgar.DataFetchException} and network failures with
 * {@link IOException}; the crawler decides what to retry. Rate limiting is
 * the caller's job.
 */
public interface FilingSource {

  /**
   * Lists a company's filings in the order the source reports them.
   *
   * @param cik company identifier, padded or not
   */
  List<FilingInfo> listFilings(String cik) throws IOException, InterruptedException;

  /** Downloads the document of one filing. */
  byte[] fetchDocument(FilingInfo filing) throws IOException, InterruptedException;

  /** Location the document of a filing is fetched from, for records and logs. */
  String documentUrl(FilingInfo filing);
}
