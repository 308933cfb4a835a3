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
package testkits;

import pollgate.Gate;
import pollgate.Timeout;

import java.io.Serial;
import java.lang.Thread.State;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

public class UnitKit {
  public static Thread fork(Callable<?> procedure) {
    Thread thread = new Thread(asRunnable(procedure));
    thread.setUncaughtExceptionHandler(new CatchingExceptionHandler());
    thread.start();
    return thread;
  }

  private static Runnable asRunnable(final Callable<?> procedure) {
    return () -> {
      try {
        procedure.call();
      } catch (Exception e) {
        throw new WrappedException(e);
      }
    };
  }

  private static class WrappedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 8268471823070464895L;

    WrappedException(Throwable cause) {
      super(cause);
    }
  }

  private static class CatchingExceptionHandler
      extends AtomicReference<Throwable>
      implements Thread.UncaughtExceptionHandler {

    @Serial
    private static final long serialVersionUID = 2170391393239672337L;

    @Override
    public void uncaughtException(Thread t, Throwable e) {
      if (e instanceof WrappedException) {
        set(e.getCause());
      } else {
        set(e);
      }
    }
  }

  public static AtomicReference<Throwable> capture(Thread thread) {
    Thread.UncaughtExceptionHandler handler = thread.getUncaughtExceptionHandler();
    if (handler instanceof CatchingExceptionHandler) {
      return (CatchingExceptionHandler) handler;
    }
    return null;
  }

  public static Callable<Gate> $await(final Gate gate, final Timeout timeout) {
    return () -> {
      gate.await(timeout);
      return gate;
    };
  }

  public static void waitForThreadState(Thread thread, Thread.State targetState) {
    AtomicReference<Throwable> capture = capture(thread);
    long start = TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    long check = start + 30;
    State currentState = thread.getState();
    while (currentState != targetState) {
      try {
        assertThat(currentState).isNotEqualTo(State.TERMINATED);
      } catch (Throwable e) {
        Throwable suppressed;
        if (capture != null && (suppressed = capture.get()) != null) {
          e.addSuppressed(suppressed);
        }
        throw e;
      }
      long now = TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
      if (now > check) {
        long elapsed = now - start;
        System.err.println("Warning: Been waiting to observe thread state " +
            targetState + " for " + elapsed + " ms. Current observation: " +
            currentState);
        check = now + 30;
      }
      Thread.yield();
      currentState = thread.getState();
    }
  }

  public static void join(Thread thread) throws ExecutionException, InterruptedException {
    thread.join();
    AtomicReference<Throwable> capture = capture(thread);
    if (capture != null && capture.get() != null) {
      throw new ExecutionException(capture.get());
    }
  }
}
