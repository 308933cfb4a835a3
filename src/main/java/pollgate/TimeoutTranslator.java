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
 * Turns the {@link DeadlineExceededException} of a timed out
 * {@link Gate#await(Timeout) await} into an exception that means something
 * to the caller.
 * @see CompletionGate#setTimeoutTranslator(TimeoutTranslator)
 */
@FunctionalInterface
public interface TimeoutTranslator {
  /**
   * Get a translator that never translates, so the original
   * {@link DeadlineExceededException} is re-thrown as is.
   * @return The identity translator.
   */
  static TimeoutTranslator none() {
    return exception -> null;
  }

  /**
   * Produce the exception to throw in place of the given one.
   * @param exception The exception thrown by the wait loop.
   * @return The exception to throw instead, or {@code null} to re-throw the
   * original exception.
   */
  RuntimeException translate(DeadlineExceededException exception);
}
