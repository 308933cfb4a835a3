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

import pollgate.internal.PredicateGate;

import java.util.function.BooleanSupplier;

/**
 * Factory methods for gates that do not need a class of their own.
 */
public final class Gates {
  private Gates() {
  }

  /**
   * Create a gate that finishes when the given predicate returns
   * {@code true}, and waits with the {@link WaitLoop#defaultLoop() default
   * wait loop}.
   *
   * Example:
   *
   * [source,java]
   * ----
   * Gates.of("marker file", () -> Files.exists(marker))
   *     .then(() -> System.out.println("found it"))
   *     .await(new Timeout(30, TimeUnit.SECONDS));
   * ----
   * @param description The description of the gate, used in diagnostics.
   * @param predicate The condition to poll. Never {@code null}.
   * @return A new, unfinished gate.
   */
  public static CompletionGate of(String description, BooleanSupplier predicate) {
    return of(description, predicate, WaitLoop.defaultLoop());
  }

  /**
   * Create a gate that finishes when the given predicate returns
   * {@code true}, and waits with the given wait loop.
   * @param description The description of the gate, used in diagnostics.
   * @param predicate The condition to poll. Never {@code null}.
   * @param waitLoop The wait loop to await the condition with.
   * @return A new, unfinished gate.
   */
  public static CompletionGate of(String description, BooleanSupplier predicate, WaitLoop waitLoop) {
    return new PredicateGate(description, predicate, waitLoop);
  }
}
