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
/**
 * = Pollgate
 *
 * Pollgate is a small library for waiting on conditions that nobody will
 * announce, but that can be checked.
 *
 * A {@link pollgate.Gate} is finished once its condition has been observed to
 * be true by a {@link pollgate.Gate#poll() poll}. The
 * {@link pollgate.CompletionGate} base class runs callbacks on completion, on
 * every poll, and on timeout, and its {@link pollgate.Gate#await(pollgate.Timeout) await}
 * methods hand the polling over to a {@link pollgate.WaitLoop}.
 *
 * Use {@link pollgate.Gates#of(String, java.util.function.BooleanSupplier)}
 * for conditions that fit in a lambda, or extend
 * {@link pollgate.CompletionGate} for anything more involved.
 */
package pollgate;
