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
 * Base exception for the EDGAR crawler, storage and parsing components.
 *
 * <p>Unchecked, so per-filing failures can travel through functional
 * interfaces and be recorded on a crawl result by the caller that owns it.
 */
public class EdgarException extends RuntimeException {

  /**
   * Creates a new EdgarException with the specified message.
   */
  public EdgarException(String message) {
    super(message);
  }

  /**
   * Creates a new EdgarException with the specified message and cause.
   */
  public EdgarException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Creates a new EdgarException with the specified cause.
   */
  public EdgarException(Throwable cause) {
    super(cause);
  }
}
