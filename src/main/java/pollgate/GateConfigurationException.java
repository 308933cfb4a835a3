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
 * Thrown when a callback, default timeout or timeout translator is added to a
 * gate that has already {@link Gate#isFinished() finished}.
 */
public class GateConfigurationException extends GateException {
  @Serial
  private static final long serialVersionUID = -6620914482177050193L;

  /**
   * Construct a new GateConfigurationException with the given message.
   * @param message A description of the misconfiguration.
   */
  public GateConfigurationException(String message) {
    super(message);
  }
}
