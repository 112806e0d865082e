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
package org.econgraph.edgar.ratio;

import org.econgraph.edgar.ConfigurationException;

import java.math.BigDecimal;

/**
 * Percentile distribution of a ratio across peer companies.
 */
public class RatioBenchmark {
  private final BigDecimal p10;
  private final BigDecimal p25;
  private final BigDecimal median;
  private final BigDecimal p75;
  private final BigDecimal p90;

  public RatioBenchmark(BigDecimal p10, BigDecimal p25, BigDecimal median, BigDecimal p75,
      BigDecimal p90) {
    if (p10.compareTo(p25) > 0 || p25.compareTo(median) > 0 || median.compareTo(p75) > 0
        || p75.compareTo(p90) > 0) {
      throw new ConfigurationException("Benchmark percentiles must be ascending: "
          + p10 + ", " + p25 + ", " + median + ", " + p75 + ", " + p90);
    }
    this.p10 = p10;
    this.p25 = p25;
    this.median = median;
    this.p75 = p75;
    this.p90 = p90;
  }

  public BigDecimal getP10() {
    return p10;
  }

  public BigDecimal getP25() {
    return p25;
  }

  public BigDecimal getMedian() {
    return median;
  }

  public BigDecimal getP75() {
    return p75;
  }

  public BigDecimal getP90() {
    return p90;
  }

  /**
   * Highest benchmark percentile the value reaches: 90, 75, 50, 25, 10, or
   * 0 when it falls below the 10th percentile.
   */
  public int percentileBand(BigDecimal value) {
    if (value.compareTo(p90) >= 0) {
      return 90;
    } else if (value.compareTo(p75) >= 0) {
      return 75;
    } else if (value.compareTo(median) >= 0) {
      return 50;
    } else if (value.compareTo(p25) >= 0) {
      return 25;
    } else if (value.compareTo(p10) >= 0) {
      return 10;
    }
    return 0;
  }
}
