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

import pollgate.CompletionGate;
import pollgate.WaitLoop;

import java.util.function.BooleanSupplier;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CompletionGate} whose condition is a {@link BooleanSupplier}.
 */
public final class PredicateGate extends CompletionGate {
  private final String description;
  private final BooleanSupplier predicate;

  /**
   * Create a gate that finishes once the predicate returns {@code true}.
   * @param description The description returned by {@link #toString()}.
   * @param predicate The condition to poll.
   * @param waitLoop The wait loop to await the condition with.
   */
  public PredicateGate(String description, BooleanSupplier predicate, WaitLoop waitLoop) {
    super(waitLoop);
    this.description = requireNonNull(description, "Description cannot be null.");
    this.predicate = requireNonNull(predicate, "Predicate cannot be null.");
  }

  @Override
  protected boolean isConditionMet() {
    return predicate.getAsBoolean();
  }

  @Override
  public String toString() {
    return description;
  }
}
