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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Bounded retry with a fixed delay between attempts.
 *
 * <p>An operation runs at most {@code maxRetries + 1} times. Only exceptions
 * accepted by the retryable predicate cause another attempt; anything else
 * ends the loop at once. The caller receives an {@link Outcome} describing
 * what happened rather than an exception.
 */
public class RetryPolicy {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

  private final int maxRetries;
  private final Duration delay;
  private final Sleeper sleeper;

  public RetryPolicy(int maxRetries, Duration delay, Sleeper sleeper) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
    }
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative: " + delay);
    }
    this.maxRetries = maxRetries;
    this.delay = delay;
    this.sleeper = sleeper;
  }

  public static RetryPolicy of(int maxRetries, Duration delay) {
    return new RetryPolicy(maxRetries, delay, Sleeper.SYSTEM);
  }

  /** Policy that makes a single attempt. */
  public static RetryPolicy noRetry() {
    return new RetryPolicy(0, Duration.ZERO, Sleeper.SYSTEM);
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public int getMaxAttempts() {
    return maxRetries + 1;
  }

  public Duration getDelay() {
    return delay;
  }

  /** Runs the operation, retrying every exception. */
  public <T> Outcome<T> execute(String description, Callable<T> operation) {
    return execute(description, operation, e -> true);
  }

  /**
   * Runs the operation, retrying exceptions accepted by {@code retryable}.
   *
   * @param description what is being attempted, for log messages
   * @param operation the work to run
   * @param retryable decides whether an exception is worth another attempt
   */
  public <T> Outcome<T> execute(String description, Callable<T> operation,
      Predicate<? super Exception> retryable) {
    int maxAttempts = getMaxAttempts();
    Exception lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        T value = operation.call();
        if (attempt > 1) {
          LOGGER.debug("{} succeeded on attempt {}/{}", description, attempt, maxAttempts);
        }
        return Outcome.success(value, attempt);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return Outcome.failure(e, attempt);
      } catch (Exception e) {
        lastFailure = e;
        if (!retryable.test(e)) {
          LOGGER.debug("{} failed with non-retryable error: {}", description, e.getMessage());
          return Outcome.failure(e, attempt);
        }
        if (attempt < maxAttempts) {
          LOGGER.warn("Request failed: {} - retrying in {} ms (attempt {}/{})",
              e.getMessage(), delay.toMillis(), attempt, maxAttempts);
          sleeper.sleep(delay);
        }
      }
    }
    LOGGER.warn("{} failed after {} attempts", description, maxAttempts);
    return Outcome.failure(lastFailure, maxAttempts);
  }

  @Override public String toString() {
    return "RetryPolicy{maxRetries=" + maxRetries + ", delay=" + delay + "}";
  }

  /**
   * Result of a retried operation.
   *
   * @param <T> value type
   */
  public static final class Outcome<T> {
    private final @Nullable T value;
    private final @Nullable Exception failure;
    private final int attempts;

    private Outcome(@Nullable T value, @Nullable Exception failure, int attempts) {
      this.value = value;
      this.failure = failure;
      this.attempts = attempts;
    }

    static <T> Outcome<T> success(@Nullable T value, int attempts) {
      return new Outcome<T>(value, null, attempts);
    }

    static <T> Outcome<T> failure(Exception failure, int attempts) {
      return new Outcome<T>(null, failure, attempts);
    }

    public boolean isSuccess() {
      return failure == null;
    }

    public @Nullable T getValue() {
      return value;
    }

    public @Nullable Exception getFailure() {
      return failure;
    }

    public int getAttempts() {
      return attempts;
    }

    /** Failure message suitable for a result's error list. */
    public String getFailureMessage() {
      if (failure == null) {
        return "";
      }
      String message = failure.getMessage();
      return message != null ? message : failure.getClass().getSimpleName();
    }
  }
}
