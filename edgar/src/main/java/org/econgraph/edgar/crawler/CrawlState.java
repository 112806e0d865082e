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

/**
 * Lifecycle of a single company crawl.
 *
 * <pre>
 * IDLE -> ENUMERATING -> FILTERING -> DOWNLOADING -> STORING -> COMPLETED
 *               |                          |            |
 *               +--------------------------+------------+--> FAILED
 * </pre>
 *
 * <p>DOWNLOADING and STORING alternate once per filing.
 */
public enum CrawlState {
  IDLE,
  ENUMERATING,
  FILTERING,
  DOWNLOADING,
  STORING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Whether the state machine permits moving from this state to {@code next}. */
  public boolean canTransitionTo(CrawlState next) {
    switch (this) {
    case IDLE:
      return next == ENUMERATING;
    case ENUMERATING:
      return next == FILTERING || next == FAILED;
    case FILTERING:
      return next == DOWNLOADING || next == COMPLETED;
    case DOWNLOADING:
      return next == STORING || next == DOWNLOADING || next == COMPLETED || next == FAILED;
    case STORING:
      return next == DOWNLOADING || next == COMPLETED || next == FAILED;
    default:
      return false;
    }
  }
}
