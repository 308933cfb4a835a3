/*
 * Copyright © Chris Vest (mr.chrisvest@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package pollgate;

import pollgate.internal.SleepingWaitLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * The WaitLoopBuilder is the mutable configuration of a sleeping
 * {@link WaitLoop}. Each call to {@link #build()} produces an immutable wait
 * loop from the current settings, so a builder can be reused and tweaked to
 * produce differently configured loops.
 *
 * The defaults are:
 *
 * * One second of sleep between polls.
 * * A backoff multiplier of 1.0, meaning the sleep never grows.
 * * A max sleep equal to the sleep.
 * * No on-poll hook, and no expected exceptions.
 *
 * @see WaitLoop#builder()
 */
public final class WaitLoopBuilder {
  static final WaitLoop DEFAULT_LOOP = new WaitLoopBuilder().build();

  private Timeout sleep = new Timeout(1, TimeUnit.SECONDS);
  private Timeout maxSleep;
  private double backoffMultiplier = 1.0;
  private Runnable onPoll;
  private final List<Class<? extends RuntimeException>> expectedExceptions = new ArrayList<>();

  WaitLoopBuilder() {
  }

  /**
   * Set the time to sleep after the first unsuccessful poll.
   * @param sleep The initial sleep. Must not be {@code null} or negative.
   * @return This builder.
   */
  public synchronized WaitLoopBuilder setSleep(Timeout sleep) {
    requireNonNull(sleep, "Sleep cannot be null.");
    if (sleep.getTimeoutInNanos() < 0) {
      throw new IllegalArgumentException("Sleep cannot be negative, but was " + sleep + ".");
    }
    this.sleep = sleep;
    return this;
  }

  /**
   * Get the time to sleep after the first unsuccessful poll.
   * @return The initial sleep.
   */
  public synchronized Timeout getSleep() {
    return sleep;
  }

  /**
   * Set the upper bound for the sleep as it grows by the
   * {@link #setBackoffMultiplier(double) backoff multiplier}.
   * @param maxSleep The max sleep, or {@code null} to use the
   * {@link #setSleep(Timeout) initial sleep} as the bound.
   * @return This builder.
   */
  public synchronized WaitLoopBuilder setMaxSleep(Timeout maxSleep) {
    if (maxSleep != null && maxSleep.getTimeoutInNanos() < 0) {
      throw new IllegalArgumentException("Max sleep cannot be negative, but was " + maxSleep + ".");
    }
    this.maxSleep = maxSleep;
    return this;
  }

  /**
   * Get the upper bound for the sleep between polls.
   * @return The max sleep, never less than the initial sleep.
   */
  public synchronized Timeout getMaxSleep() {
    if (maxSleep == null || maxSleep.getTimeoutInNanos() < sleep.getTimeoutInNanos()) {
      return sleep;
    }
    return maxSleep;
  }

  /**
   * Set the factor the sleep is multiplied by after every unsuccessful poll.
   * @param backoffMultiplier The factor. Must be a number no less than 1.0.
   * @return This builder.
   */
  public synchronized WaitLoopBuilder setBackoffMultiplier(double backoffMultiplier) {
    if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
      throw new IllegalArgumentException(
          "Backoff multiplier must be at least 1.0, but was " + backoffMultiplier + ".");
    }
    this.backoffMultiplier = backoffMultiplier;
    return this;
  }

  /**
   * Get the factor the sleep is multiplied by after every unsuccessful poll.
   * @return The backoff multiplier.
   */
  public synchronized double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  /**
   * Set a hook to run after every unsuccessful poll, before sleeping.
   * Exceptions from the hook propagate out of the wait loop.
   * @param onPoll The hook, or {@code null} for none.
   * @return This builder.
   */
  public synchronized WaitLoopBuilder setOnPoll(Runnable onPoll) {
    this.onPoll = onPoll;
    return this;
  }

  /**
   * Get the hook that runs after every unsuccessful poll.
   * @return The hook, or {@code null} if there is none.
   */
  public synchronized Runnable getOnPoll() {
    return onPoll;
  }

  /**
   * Add an exception type that the wait loop treats as an unsuccessful poll,
   * rather than letting it propagate. Sub-classes of the type are also
   * expected.
   * @param type The exception type. Never {@code null}.
   * @return This builder.
   */
  public synchronized WaitLoopBuilder addExpectedException(Class<? extends RuntimeException> type) {
    requireNonNull(type, "Exception type cannot be null.");
    expectedExceptions.add(type);
    return this;
  }

  /**
   * Get the exception types that count as unsuccessful polls.
   * @return An immutable copy of the expected exception types.
   */
  public synchronized List<Class<? extends RuntimeException>> getExpectedExceptions() {
    return List.copyOf(expectedExceptions);
  }

  /**
   * Build a wait loop from the current settings of this builder.
   * @return A new, immutable wait loop.
   */
  public synchronized WaitLoop build() {
    return new SleepingWaitLoop(
        sleep.getTimeoutInNanos(),
        getMaxSleep().getTimeoutInNanos(),
        backoffMultiplier,
        onPoll,
        getExpectedExceptions());
  }
}
