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

import java.util.function.BooleanSupplier;

/**
 * A WaitLoop repeatedly invokes a step function until it returns
 * {@code true}, or until a timeout elapses. It owns the policy for how long
 * to sleep between the steps.
 *
 * Gates delegate their {@link Gate#await(Timeout) await} to a wait loop,
 * passing their {@link Gate#poll() poll} method as the step.
 */
@FunctionalInterface
public interface WaitLoop {
  /**
   * Get a new {@link WaitLoopBuilder} with default settings: one second of
   * sleep between polls and no backoff.
   * @return A new builder.
   */
  static WaitLoopBuilder builder() {
    return new WaitLoopBuilder();
  }

  /**
   * Get the shared wait loop with default settings. This is the loop gates
   * use, unless they are given another one.
   * @return The default wait loop.
   */
  static WaitLoop defaultLoop() {
    return WaitLoopBuilder.DEFAULT_LOOP;
  }

  /**
   * Invoke the given step until it returns {@code true}.
   * @param step The step function. Exceptions it throws propagate, unless
   * the wait loop is configured to expect them.
   * @param timeout The maximum time to keep trying, or {@code null} to keep
   * trying forever.
   * @param waitingFor A description of what is being waited for, used in
   * diagnostics.
   * @throws InterruptedException if the current thread is interrupted while
   * waiting.
   * @throws DeadlineExceededException if the timeout elapses before the step
   * returned {@code true}.
   */
  void runUntil(BooleanSupplier step, Timeout timeout, Object waitingFor) throws InterruptedException;
}
