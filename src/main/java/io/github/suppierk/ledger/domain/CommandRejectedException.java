/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.ledger.domain;

import io.github.suppierk.ledger.LedgerException;
import java.io.Serial;

/**
 * Thrown when an {@link AccountCommand} cannot be applied to the current {@link Account} state,
 * either because the state does not accept such command at all or because a business rule (such
 * as positive amounts or no overdraft) was violated.
 *
 * <p>No events are produced when this exception is raised, therefore the caller may safely correct
 * the command and try again.
 */
public class CommandRejectedException extends LedgerException {
  @Serial private static final long serialVersionUID = 2260381739012458730L;

  /**
   * Constructs a new rejection with the specified reason.
   *
   * @param message the reason of rejection
   */
  public CommandRejectedException(String message) {
    super(message);
  }

  /**
   * Constructs a new rejection with the specified reason and cause.
   *
   * @param message the reason of rejection
   * @param cause which made the command inapplicable, such as an arithmetic overflow
   */
  public CommandRejectedException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/422">422 Unprocessable
   *     Content</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 422;
  }
}
