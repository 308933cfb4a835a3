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

import java.io.Serial;

/**
 * Thrown by a {@link WaitLoop} when its timeout elapses before the polled
 * condition became true.
 *
 * {@link Gate#await(Timeout)} intercepts this exception to run the on-timeout
 * callbacks of the gate, and then either re-throws it or throws the exception
 * produced by the gate's {@link TimeoutTranslator}.
 */
public class DeadlineExceededException extends GateException {
  @Serial
  private static final long serialVersionUID = 5471652306452139285L;

  private final transient Timeout timeout;
  private final String waitingFor;

  /**
   * Construct a new DeadlineExceededException.
   * @param timeout The timeout that elapsed.
   * @param waitingFor The object that was being waited for. Its
   * {@link Object#toString()} is captured for the message.
   */
  public DeadlineExceededException(Timeout timeout, Object waitingFor) {
    super("Timeout of " + timeout + " expired waiting for " + waitingFor);
    this.timeout = timeout;
    this.waitingFor = String.valueOf(waitingFor);
  }

  /**
   * Get the timeout that elapsed.
   * @return The timeout, or {@code null} if this exception was deserialized.
   */
  public Timeout getTimeout() {
    return timeout;
  }

  /**
   * Get the description of what was being waited for.
   * @return The string form of the awaited object.
   */
  public String getWaitingFor() {
    return waitingFor;
  }
}
