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
 * The common super class of the exceptions thrown by gates and wait loops
 * themselves:
 *
 * * {@link GateConfigurationException} if a gate is configured after it
 *   has finished.
 * * {@link DeadlineExceededException} if a {@link WaitLoop} gives up
 *   waiting.
 *
 * Exceptions thrown by predicates and callbacks are never wrapped in a
 * GateException; they propagate as they are.
 */
public class GateException extends RuntimeException {
  @Serial
  private static final long serialVersionUID = 3174026359017723540L;

  /**
   * Construct a new GateException with the given message.
   * @param message A description of the exception to be returned from
   * {@link #getMessage()}.
   */
  public GateException(String message) {
    super(message);
  }

  /**
   * Construct a new GateException with the given message and cause.
   * @param message A description of the exception to be returned from
   * {@link #getMessage()}.
   * @param cause The underlying cause of this exception.
   */
  public GateException(String message, Throwable cause) {
    super(message, cause);
  }
}
