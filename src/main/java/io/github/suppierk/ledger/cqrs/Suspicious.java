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

package io.github.suppierk.ledger.cqrs;

import java.util.UUID;

/**
 * Defines internal sealed utility shared by the command and the query side.
 *
 * <p>Everything handed to the handlers by consumers - arguments, event logs, process managers and
 * listeners, as well as whatever those return - is treated as suspicious: {@code null}s are
 * blocked as early as possible with a message naming the offending value.
 */
abstract sealed class Suspicious permits AccountCommandHandler, AccountStateReader {
  /**
   * Use for method and constructor arguments.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the argument name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected static <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Use for values returned by collaborators, such as {@link
   * io.github.suppierk.ledger.store.EventLog#readFromStream(String)}.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the value name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * @param accountId of the aggregate
   * @return identifier of the aggregate's stream in the event log
   */
  protected static String streamIdOf(final UUID accountId) {
    return accountId.toString();
  }
}
