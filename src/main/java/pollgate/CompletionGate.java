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

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * The base implementation of {@link Gate}. Sub-classes decide what it means
 * for the gate to be finished, by implementing {@link #isConditionMet()},
 * and describe themselves for diagnostics by implementing
 * {@link #toString()}.
 *
 * A gate has three lists of callbacks, each run in registration order:
 *
 * * {@link #then(Runnable) Completion callbacks} run once, by the first
 *   {@link #poll()} that observes the condition to be met. If some of them
 *   throw, the rest still run, and the first exception is re-thrown from
 *   {@code poll} afterwards.
 * * {@link #during(Runnable) During callbacks} run at the start of every
 *   {@code poll} of an unfinished gate. The first exception stops the poll.
 * * {@link #onTimeout(Runnable) Timeout callbacks} run when an
 *   {@link #await(Timeout) await} times out. The first exception replaces
 *   the timeout.
 *
 * All configuration must happen before the gate finishes; afterwards it is
 * rejected with a {@link GateConfigurationException}.
 *
 * Gates are meant to be driven by one thread at a time. The completion
 * callbacks are guarded so they cannot run twice, but the callback lists
 * themselves are not safe for concurrent modification.
 */
public abstract class CompletionGate implements Gate {
  private static final Logger LOGGER = Logger.getLogger(CompletionGate.class.getName());
  private static final VarHandle FIRED;
  static {
    MethodHandles.Lookup lookup = MethodHandles.lookup();
    try {
      FIRED = lookup.findVarHandle(CompletionGate.class, "fired", boolean.class);
    } catch (Exception e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private final List<Runnable> completionCallbacks = new ArrayList<>();
  private final List<Runnable> duringCallbacks = new ArrayList<>();
  private final List<Runnable> timeoutCallbacks = new ArrayList<>();
  private final WaitLoop waitLoop;
  private volatile boolean completed;
  @SuppressWarnings("unused") // Accessed via VarHandle
  private volatile boolean fired;
  private Timeout defaultTimeout;
  private TimeoutTranslator timeoutTranslator = TimeoutTranslator.none();

  /**
   * Create an unfinished gate that waits with the
   * {@link WaitLoop#defaultLoop() default wait loop}.
   */
  protected CompletionGate() {
    this(WaitLoop.defaultLoop());
  }

  /**
   * Create an unfinished gate that waits with the given wait loop.
   * @param waitLoop The wait loop used by {@link #await(Timeout)}. Never
   *                 {@code null}.
   */
  protected CompletionGate(WaitLoop waitLoop) {
    this.waitLoop = requireNonNull(waitLoop, "WaitLoop cannot be null.");
  }

  /**
   * Check the condition this gate is waiting for. Called by {@link #poll()}
   * until it returns {@code true}, and never again after that.
   *
   * This is called on every poll, so it should be cheap. Exceptions thrown
   * from here propagate out of {@code poll} and {@code await}.
   * @return {@code true} if the condition is met, otherwise {@code false}.
   */
  protected abstract boolean isConditionMet();

  /**
   * Describe this gate, for log messages and
   * {@link DeadlineExceededException timeout messages}.
   * @return A human readable description of what this gate waits for.
   */
  @Override
  public abstract String toString();

  @Override
  public final boolean poll() {
    if (completed) {
      return true;
    }

    for (Runnable callback : duringCallbacks) {
      callback.run();
    }

    if (isConditionMet()) {
      completed = true;
    }

    if (completed && FIRED.compareAndSet(this, false, true)) {
      runCompletionCallbacks();
    }
    return completed;
  }

  private void runCompletionCallbacks() {
    RuntimeException failure = null;
    for (Runnable callback : completionCallbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else if (failure != e) {
          failure.addSuppressed(e);
        }
        LOGGER.log(Level.FINE, e, () -> "Exception thrown from completion callback " + callback + " of " + this);
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public final boolean isFinished() {
    return completed;
  }

  /**
   * Run the given callback when this gate finishes.
   * @param callback The callback. Never {@code null}.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public CompletionGate then(Runnable callback) {
    return register(completionCallbacks, callback, "completion");
  }

  /**
   * Run the given callback, with the given argument, when this gate
   * finishes.
   * @param callback The callback. Never {@code null}.
   * @param argument The argument to pass to the callback.
   * @param <A> The type of the argument.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public <A> CompletionGate then(Consumer<? super A> callback, A argument) {
    return then(bind(callback, argument));
  }

  /**
   * Run the given callback on every poll, before the condition of this gate
   * is checked.
   * @param callback The callback. Never {@code null}.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public CompletionGate during(Runnable callback) {
    return register(duringCallbacks, callback, "during");
  }

  /**
   * Run the given callback, with the given argument, on every poll, before
   * the condition of this gate is checked.
   * @param callback The callback. Never {@code null}.
   * @param argument The argument to pass to the callback.
   * @param <A> The type of the argument.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public <A> CompletionGate during(Consumer<? super A> callback, A argument) {
    return during(bind(callback, argument));
  }

  /**
   * Run the given callback when an {@link #await(Timeout) await} on this
   * gate times out.
   * @param callback The callback. Never {@code null}.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public CompletionGate onTimeout(Runnable callback) {
    return register(timeoutCallbacks, callback, "timeout");
  }

  /**
   * Run the given callback, with the given argument, when an
   * {@link #await(Timeout) await} on this gate times out.
   * @param callback The callback. Never {@code null}.
   * @param argument The argument to pass to the callback.
   * @param <A> The type of the argument.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public <A> CompletionGate onTimeout(Consumer<? super A> callback, A argument) {
    return onTimeout(bind(callback, argument));
  }

  /**
   * Set the timeout used by {@link #await()}, and by
   * {@link #await(Timeout)} when given a {@code null} timeout.
   * Zero and negative timeouts are passed on to the wait loop as is.
   * @param timeout The default timeout, or {@code null} to wait without a
   *                deadline.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public CompletionGate setDefaultTimeout(Timeout timeout) {
    checkNotFinished("default timeout");
    this.defaultTimeout = timeout;
    return this;
  }

  /**
   * Get the timeout used when {@link #await(Timeout)} is not given one.
   * @return The default timeout, or {@code null} if there is none.
   */
  public Timeout getDefaultTimeout() {
    return defaultTimeout;
  }

  /**
   * Set the translator that decides what is thrown when an
   * {@link #await(Timeout) await} times out.
   * @param translator The translator. Never {@code null}; use
   *                   {@link TimeoutTranslator#none()} to re-throw the
   *                   {@link DeadlineExceededException}.
   * @return This gate.
   * @throws GateConfigurationException if this gate is already finished.
   */
  public CompletionGate setTimeoutTranslator(TimeoutTranslator translator) {
    requireNonNull(translator, "TimeoutTranslator cannot be null.");
    checkNotFinished("timeout translator");
    this.timeoutTranslator = translator;
    return this;
  }

  /**
   * Get the exception to throw when an {@link #await(Timeout) await} times
   * out. By default this asks the configured {@link TimeoutTranslator}.
   * @param exception The exception thrown by the wait loop.
   * @return The exception to throw instead, or {@code null} to re-throw the
   * given exception.
   */
  protected RuntimeException getTimeoutException(DeadlineExceededException exception) {
    return timeoutTranslator.translate(exception);
  }

  @Override
  public void await() throws InterruptedException {
    await(null, waitLoop);
  }

  @Override
  public void await(Timeout timeout) throws InterruptedException {
    await(timeout, waitLoop);
  }

  @Override
  public void await(Timeout timeout, WaitLoop waitLoop) throws InterruptedException {
    requireNonNull(waitLoop, "WaitLoop cannot be null.");
    Timeout effectiveTimeout = timeout == null ? defaultTimeout : timeout;

    LOGGER.fine(() -> "Waiting for " + this);
    try {
      waitLoop.runUntil(this::poll, effectiveTimeout, this);
      LOGGER.fine(() -> "Finished waiting for " + this);
    } catch (DeadlineExceededException e) {
      for (Runnable callback : timeoutCallbacks) {
        callback.run();
      }
      RuntimeException translated = getTimeoutException(e);
      if (translated == null) {
        throw e;
      }
      throw translated;
    } catch (RuntimeException | InterruptedException e) {
      LOGGER.log(Level.FINE, e, () -> "Exception was raised while waiting for " + this);
      throw e;
    }
  }

  private CompletionGate register(List<Runnable> callbacks, Runnable callback, String kind) {
    requireNonNull(callback, "Callback cannot be null.");
    checkNotFinished(kind + " callback");
    callbacks.add(callback);
    return this;
  }

  private void checkNotFinished(String setting) {
    if (completed) {
      throw new GateConfigurationException(
          "Cannot add " + setting + " after " + this + " has finished.");
    }
  }

  private static <A> Runnable bind(Consumer<? super A> callback, A argument) {
    requireNonNull(callback, "Callback cannot be null.");
    return () -> callback.accept(argument);
  }
}
