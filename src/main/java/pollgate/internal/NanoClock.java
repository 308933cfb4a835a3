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

/**
 * The monotonic clock that wait loops and timeouts measure deadlines against.
 */
public final class NanoClock {
  private NanoClock() {
  }

  /**
   * Equivalent of {@link System#nanoTime()}.
   * @return The current timestamp in nanoseconds.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Compute the number of nanoseconds until the given instant.
   * @param instantNanos An instant on the {@link #nanoTime()} time line.
   * @return The (possibly negative) nanoseconds remaining until the instant.
   */
  public static long until(long instantNanos) {
    return instantNanos - nanoTime();
  }
}
