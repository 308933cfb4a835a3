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

/**
 * A Gate represents a condition that is going to become true at some point
 * in the future, or maybe already has. Unlike a
 * {@link java.util.concurrent.Future Future}, nobody tells the gate when the
 * condition is met: it finds out by being {@link #poll() polled}.
 *
 * Gates carry no result value and cannot be cancelled.
 * @see CompletionGate
 */
public interface Gate {
  /**
   * Check whether the condition of this gate has been met, running the
   * callbacks that are due.
   *
   * Polling a finished gate is a cheap read that returns {@code true}.
   * @return {@code true} if the gate is finished, otherwise {@code false}.
   */
  boolean poll();

  /**
   * Returns whether a previous {@link #poll()} has observed the condition of
   * this gate to be met. This method has no side effects.
   * @return {@code true} if the gate is finished, otherwise {@code false}.
   */
  boolean isFinished();

  /**
   * Wait for this gate to finish, using its default timeout if it has one,
   * or else waiting for as long as it takes.
   * @throws InterruptedException if the current thread is interrupted while
   * waiting.
   * @throws DeadlineExceededException if the default timeout elapses before
   * the gate finishes, and the gate does not translate it.
   */
  void await() throws InterruptedException;

  /**
   * Wait for this gate to finish, for at most the given timeout.
   *
   * If the timeout elapses, the on-timeout callbacks of the gate are run, and
   * then either the {@link DeadlineExceededException} or a translation of it
   * is thrown.
   * @param timeout The maximum time to wait. If {@code null}, the default
   * timeout of the gate is used instead.
   * @throws InterruptedException if the current thread is interrupted while
   * waiting.
   * @throws DeadlineExceededException if the timeout elapses before the gate
   * finishes, and the gate does not translate it.
   */
  void await(Timeout timeout) throws InterruptedException;

  /**
   * Wait for this gate to finish, for at most the given timeout, polling it
   * with the given wait loop instead of the gate's own.
   * @param timeout The maximum time to wait. If {@code null}, the default
   * timeout of the gate is used instead.
   * @param waitLoop The wait loop to poll the gate with. Never {@code null}.
   * @throws InterruptedException if the current thread is interrupted while
   * waiting.
   * @throws DeadlineExceededException if the timeout elapses before the gate
   * finishes, and the gate does not translate it.
   */
  void await(Timeout timeout, WaitLoop waitLoop) throws InterruptedException;
}
