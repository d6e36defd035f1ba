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

import io.github.suppierk.ledger.domain.AccountCommand;
import io.github.suppierk.ledger.domain.AccountEvent;
import java.util.List;

/**
 * Abstract contract for an entity which wants to observe the outcome of every command processed by
 * {@link AccountCommandHandler}, including the commands submitted by a {@link ProcessManager}.
 *
 * <p>Callbacks run synchronously on the handling thread, after the append for success and before
 * the failure is returned to the caller. Exceptions thrown by a listener are not caught.
 */
public interface CommandOutcomeListener {
  /**
   * @return an instance of listener which does not perform any operations
   */
  static CommandOutcomeListener empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param streamId events were appended to
   * @param expectedVersion the append was conditioned on
   * @param events appended
   */
  void onEventsAppended(
      final String streamId, final int expectedVersion, final List<AccountEvent> events);

  /**
   * @param streamId the command targeted
   * @param command which failed
   * @param cause of the failure
   */
  void onCommandFailed(final String streamId, final AccountCommand command, final Throwable cause);

  /** Default implementation of the silent listener */
  final class NoOp implements CommandOutcomeListener {
    private static final CommandOutcomeListener INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void onEventsAppended(
        final String streamId, final int expectedVersion, final List<AccountEvent> events) {
      // Do nothing
    }

    @Override
    public void onCommandFailed(
        final String streamId, final AccountCommand command, final Throwable cause) {
      // Do nothing
    }
  }
}
