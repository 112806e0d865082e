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

import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.util.List;

/**
 * Maps a ratio value to a qualitative reading using ordered thresholds.
 *
 * <p>When higher values are better, the first band whose threshold the value
 * meets or exceeds applies; when lower is better, the first band whose
 * threshold the value does not exceed. Otherwise the fallback applies.
 */
public class RatioInterpretation {
  private final boolean higherIsBetter;
  private final ImmutableList<Band> bands;
  private final String fallback;

  public RatioInterpretation(boolean higherIsBetter, List<Band> bands, String fallback) {
    this.higherIsBetter = higherIsBetter;
    this.bands = ImmutableList.copyOf(bands);
    this.fallback = fallback;
  }

  public boolean isHigherBetter() {
    return higherIsBetter;
  }

  public List<Band> getBands() {
    return bands;
  }

  public String interpret(BigDecimal value) {
    for (Band band : bands) {
      int cmp = value.compareTo(band.threshold);
      if (higherIsBetter ? cmp >= 0 : cmp <= 0) {
        return band.label;
      }
    }
    return fallback;
  }

  /** A threshold and the reading for values on the good side of it. */
  public static class Band {
    private final BigDecimal threshold;
    private final String label;

    public Band(BigDecimal threshold, String label) {
      this.threshold = threshold;
      this.label = label;
    }

    public BigDecimal getThreshold() {
      return threshold;
    }

    public String getLabel() {
      return label;
    }
  }
}
