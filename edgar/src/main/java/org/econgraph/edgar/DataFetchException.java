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
package org.econgraph.edgar;

/**
 * Exception thrown when a request to the filing source fails.
 *
 * <p>Transient failures (I/O errors, timeouts, HTTP 429 and 5xx) may be
 * retried; permanent ones (any other non-success status) may not.
 */
public class DataFetchException extends EdgarException {

  /** Status code used when no HTTP response was received. */
  public static final int NO_STATUS = -1;

  private final int statusCode;
  private final boolean transientFailure;

  public DataFetchException(String message, int statusCode, boolean transientFailure) {
    super(message);
    this.statusCode = statusCode;
    this.transientFailure = transientFailure;
  }

  public DataFetchException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = NO_STATUS;
    this.transientFailure = true;
  }

  /**
   * Creates an exception for an HTTP status, classifying 429 and 5xx as
   * transient.
   */
  public static DataFetchException forStatus(String url, int statusCode) {
    boolean retryable = statusCode == 429 || statusCode >= 500;
    return new DataFetchException("HTTP " + statusCode + " from " + url, statusCode, retryable);
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
