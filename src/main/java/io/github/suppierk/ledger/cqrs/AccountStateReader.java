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

import io.github.suppierk.java.Try;
import io.github.suppierk.ledger.domain.AccountDomain;
import io.github.suppierk.ledger.domain.ReplayedAccount;
import io.github.suppierk.ledger.store.EventLog;
import java.util.UUID;

/** Query side of the ledger: the current state of an account is a replay of its stream. */
public final class AccountStateReader extends Suspicious {
  private final EventLog eventLog;

  public AccountStateReader(final EventLog eventLog) {
    this.eventLog = throwIllegalArgumentIfNull(eventLog, "Event log");
  }

  /**
   * @param accountId to look up
   * @return replayed state and version, {@link
   *     io.github.suppierk.ledger.domain.Account.Uninitialized} at version {@code -1} for unknown
   *     accounts, or the failure of the event log
   * @throws IllegalArgumentException if the account ID is {@code null}
   */
  public Try<ReplayedAccount> currentState(final UUID accountId) {
    final String streamId = streamIdOf(throwIllegalArgumentIfNull(accountId, "Account ID"));

    return Try.of(
        () ->
            AccountDomain.replay(
                throwIllegalStateIfNull(eventLog.readFromStream(streamId), "Stream events")));
  }
}
