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

import com.google.common.base.Ticker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket limiting outbound requests to a fixed number per second.
 *
 * <p>The bucket holds at most {@code maxRequestsPerSecond} tokens and refills
 * continuously, so a burst up to the ceiling is allowed but the sustained
 * rate never exceeds it. One instance is meant to be shared by every crawl
 * that talks to the same origin; the ceiling applies jointly to all callers.
 *
 * <p>{@link #acquire()} reserves a token under the lock and sleeps outside
 * it, so waiting callers do not block each other's bookkeeping.
 */
public class RateLimiter {
  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

  private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

  private final double maxRequestsPerSecond;
  private final Ticker ticker;
  private final Sleeper sleeper;

  private double availableTokens;
  private long lastRefillNanos;

  public RateLimiter(double maxRequestsPerSecond) {
    this(maxRequestsPerSecond, Ticker.systemTicker(), Sleeper.SYSTEM);
  }

  public RateLimiter(double maxRequestsPerSecond, Ticker ticker, Sleeper sleeper) {
    if (!(maxRequestsPerSecond > 0)) {
      throw new IllegalArgumentException(
          "maxRequestsPerSecond must be positive: " + maxRequestsPerSecond);
    }
    this.maxRequestsPerSecond = maxRequestsPerSecond;
    this.ticker = ticker;
    this.sleeper = sleeper;
    this.availableTokens = maxRequestsPerSecond;
    this.lastRefillNanos = ticker.read();
  }

  /** SEC EDGAR fair-access ceiling of 10 requests per second. */
  public static RateLimiter secEdgar() {
    return new RateLimiter(10);
  }

  /** 5 requests per second, for long bulk runs. */
  public static RateLimiter conservative() {
    return new RateLimiter(5);
  }

  /** 20 requests per second; only for local test servers. */
  public static RateLimiter aggressive() {
    return new RateLimiter(20);
  }

  /**
   * Blocks until a request slot is available, then returns. Never gives up.
   */
  public void acquire() {
    long waitNanos;
    synchronized (this) {
      refill();
      availableTokens -= 1;
      waitNanos = availableTokens >= 0
          ? 0
          : (long) Math.ceil(-availableTokens / maxRequestsPerSecond * NANOS_PER_SECOND);
    }
    if (waitNanos > 0) {
      LOGGER.debug("Rate limit reached, waiting {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
      sleeper.sleep(Duration.ofNanos(waitNanos));
    }
  }

  /**
   * Takes a token if one is available right now.
   *
   * @return whether a token was taken
   */
  public synchronized boolean tryAcquire() {
    refill();
    if (availableTokens >= 1) {
      availableTokens -= 1;
      return true;
    }
    return false;
  }

  /** Whether a call to {@link #acquire()} would have to wait. */
  public synchronized boolean isRateLimited() {
    refill();
    return availableTokens < 1;
  }

  /** Time until a whole token is available; zero when one already is. */
  public synchronized Duration timeUntilNextPermit() {
    refill();
    if (availableTokens >= 1) {
      return Duration.ZERO;
    }
    double missing = 1 - availableTokens;
    return Duration.ofNanos((long) Math.ceil(missing / maxRequestsPerSecond * NANOS_PER_SECOND));
  }

  /** Refills the bucket to capacity. Outstanding reservations are forgotten. */
  public synchronized void reset() {
    availableTokens = maxRequestsPerSecond;
    lastRefillNanos = ticker.read();
  }

  public double getMaxRequestsPerSecond() {
    return maxRequestsPerSecond;
  }

  private void refill() {
    long now = ticker.read();
    long elapsed = now - lastRefillNanos;
    if (elapsed > 0) {
      availableTokens = Math.min(maxRequestsPerSecond,
          availableTokens + (double) elapsed / NANOS_PER_SECOND * maxRequestsPerSecond);
      lastRefillNanos = now;
    }
  }
}
