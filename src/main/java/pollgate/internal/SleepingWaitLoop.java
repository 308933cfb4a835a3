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
package pollgate.internal;

import pollgate.DeadlineExceededException;
import pollgate.Timeout;
import pollgate.WaitLoop;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link WaitLoop} that parks the calling thread between polls, for a
 * sleep that optionally grows by a multiplier up to a cap.
 */
public final class SleepingWaitLoop implements WaitLoop {
  private static final Logger LOGGER = Logger.getLogger(SleepingWaitLoop.class.getName());

  private final long sleepNanos;
  private final long maxSleepNanos;
  private final double backoffMultiplier;
  private final Runnable onPoll;
  private final List<Class<? extends RuntimeException>> expectedExceptions;

  /**
   * Create a sleeping wait loop.
   * @param sleepNanos The sleep after the first unsuccessful poll.
   * @param maxSleepNanos The cap on the sleep between polls.
   * @param backoffMultiplier The factor to grow the sleep by after each
   *                          unsuccessful poll.
   * @param onPoll Hook to run after each unsuccessful poll, may be {@code null}.
   * @param expectedExceptions Exception types counted as unsuccessful polls.
   */
  public SleepingWaitLoop(
      long sleepNanos,
      long maxSleepNanos,
      double backoffMultiplier,
      Runnable onPoll,
      List<Class<? extends RuntimeException>> expectedExceptions) {
    this.sleepNanos = sleepNanos;
    this.maxSleepNanos = Math.max(sleepNanos, maxSleepNanos);
    this.backoffMultiplier = backoffMultiplier;
    this.onPoll = onPoll;
    this.expectedExceptions = List.copyOf(expectedExceptions);
  }

  @Override
  public void runUntil(BooleanSupplier step, Timeout timeout, Object waitingFor) throws InterruptedException {
    Objects.requireNonNull(step, "Step cannot be null.");
    long deadline = timeout == null ? 0 : timeout.getDeadline();
    long nextSleep = sleepNanos;
    for (;;) {
      if (Thread.interrupted()) {
        throw new InterruptedException();
      }
      if (attempt(step, waitingFor)) {
        return;
      }
      long sleep = nextSleep;
      if (timeout != null) {
        long timeLeft = timeout.getTimeLeft(deadline);
        if (timeLeft <= 0) {
          throw new DeadlineExceededException(timeout, waitingFor);
        }
        sleep = Math.min(sleep, timeLeft);
      }
      if (onPoll != null) {
        onPoll.run();
      }
      park(sleep);
      nextSleep = grow(nextSleep);
    }
  }

  private boolean attempt(BooleanSupplier step, Object waitingFor) {
    try {
      return step.getAsBoolean();
    } catch (RuntimeException e) {
      if (isExpected(e)) {
        LOGGER.log(Level.FINE, e, () -> "Expected exception while polling " + waitingFor);
        return false;
      }
      throw e;
    }
  }

  private boolean isExpected(RuntimeException exception) {
    for (Class<? extends RuntimeException> type : expectedExceptions) {
      if (type.isInstance(exception)) {
        return true;
      }
    }
    return false;
  }

  private long grow(long sleep) {
    if (backoffMultiplier == 1.0 || sleep >= maxSleepNanos) {
      return sleep;
    }
    double grown = sleep * backoffMultiplier;
    return grown >= maxSleepNanos ? maxSleepNanos : (long) grown;
  }

  private void park(long nanos) throws InterruptedException {
    long wakeup = NanoClock.nanoTime() + nanos;
    while (nanos > 0) {
      LockSupport.parkNanos(this, nanos);
      if (Thread.interrupted()) {
        throw new InterruptedException();
      }
      nanos = NanoClock.until(wakeup);
    }
  }

  @Override
  public String toString() {
    return "SleepingWaitLoop(sleep = " + sleepNanos + " ns, maxSleep = " + maxSleepNanos +
        " ns, backoffMultiplier = " + backoffMultiplier + ")";
  }
}
