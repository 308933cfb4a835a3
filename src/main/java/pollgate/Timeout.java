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

import pollgate.internal.NanoClock;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A Timeout is the maximum amount of time a caller is willing to wait for a
 * {@link Gate} to finish.
 *
 * Timeouts are independent of their units, so two timeouts of equivalent
 * duration but constructed in different units are equal to each other and
 * behave the same.
 *
 * Zero and negative timeouts are allowed. A {@link WaitLoop} given such a
 * timeout still polls once, but will not wait between polls.
 */
public final class Timeout {
  private final long timeout;
  private final TimeUnit unit;
  private final long timeoutNanos;

  /**
   * Construct a new timeout with the given value and unit.
   * @param timeout A numerical value for the timeout. Can be zero or negative.
   * @param unit The unit of the timeout value. Never {@code null}.
   */
  public Timeout(long timeout, TimeUnit unit) {
    Objects.requireNonNull(unit, "The TimeUnit cannot be null.");
    this.timeout = timeout;
    this.unit = unit;
    this.timeoutNanos = unit.toNanos(timeout);
  }

  /**
   * Construct a new timeout of the given duration.
   * @param duration The duration of the timeout. Never {@code null}.
   */
  public Timeout(Duration duration) {
    this(TimeUnit.NANOSECONDS.convert(Objects.requireNonNull(duration, "The Duration cannot be null.")),
        TimeUnit.NANOSECONDS);
  }

  /**
   * Get the timeout value in terms of the {@link #getUnit() unit}.
   * @return A numerical value of the timeout. Possibly zero or negative.
   */
  public long getTimeout() {
    return timeout;
  }

  /**
   * Get the unit for the {@link #getTimeout() timeout value}.
   * @return The {@link TimeUnit} of the timeout value. Never {@code null}.
   */
  public TimeUnit getUnit() {
    return unit;
  }

  /**
   * Get the timeout value in nanoseconds.
   * @return The timeout in nanoseconds. Possibly zero or negative.
   */
  public long getTimeoutInNanos() {
    return timeoutNanos;
  }

  /**
   * Calculate a deadline, as an instant in the future on the
   * {@link NanoClock} time line. Use {@link #getTimeLeft(long)} to find out
   * how much of the timeout remains.
   * @return The instant, in nanoseconds, at which this timeout elapses
   * when counted from now.
   */
  public long getDeadline() {
    return NanoClock.nanoTime() + timeoutNanos;
  }

  /**
   * Calculate the number of nanoseconds left until the given deadline.
   * @param deadline A deadline obtained from {@link #getDeadline()}.
   * @return The remaining nanoseconds. Zero or negative once the deadline
   * has passed.
   */
  public long getTimeLeft(long deadline) {
    return deadline - NanoClock.nanoTime();
  }

  /**
   * Get this timeout as a {@link Duration}.
   * @return An equivalent {@link Duration}.
   */
  public Duration toDuration() {
    return Duration.ofNanos(timeoutNanos);
  }

  @Override
  public int hashCode() {
    return 31 * (1 + Long.hashCode(timeoutNanos));
  }

  /**
   * Timeouts of equivalent duration are equal, even if they were constructed
   * with different units.
   */
  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Timeout)) {
      return false;
    }
    Timeout that = (Timeout) obj;
    return this.timeoutNanos == that.timeoutNanos;
  }

  @Override
  public String toString() {
    return timeout + " " + unit.name().toLowerCase(Locale.ROOT);
  }
}
