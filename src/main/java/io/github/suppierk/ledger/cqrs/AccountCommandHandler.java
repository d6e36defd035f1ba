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
import io.github.suppierk.ledger.domain.AccountCommand;
import io.github.suppierk.ledger.domain.AccountDomain;
import io.github.suppierk.ledger.domain.AccountEvent;
import io.github.suppierk.ledger.domain.ReplayedAccount;
import io.github.suppierk.ledger.store.EventLog;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command side of the ledger: loads the account's stream, decides, appends with optimistic
 * concurrency control and then drives the reactions of the {@link ProcessManager}.
 *
 * <p>Every command submitted by the process manager is handled the same way on its own stream, each
 * append being a separate atomic step. Reactions are handled depth-first in the order they were
 * returned. The first failure stops the cascade - appends made before it stay committed and are
 * never compensated.
 */
public final class AccountCommandHandler extends Suspicious {
  private static final Logger log = LoggerFactory.getLogger(AccountCommandHandler.class);

  private final EventLog eventLog;
  private final ProcessManager processManager;
  private final CommandOutcomeListener listener;

  public AccountCommandHandler(final EventLog eventLog, final ProcessManager processManager) {
    this(eventLog, processManager, CommandOutcomeListener.empty());
  }

  public AccountCommandHandler(
      final EventLog eventLog,
      final ProcessManager processManager,
      final CommandOutcomeListener listener) {
    this.eventLog = throwIllegalArgumentIfNull(eventLog, "Event log");
    this.processManager = throwIllegalArgumentIfNull(processManager, "Process manager");
    this.listener = throwIllegalArgumentIfNull(listener, "Command outcome listener");
  }

  /**
   * Handles the command and every command it transitively causes.
   *
   * @param accountId whose stream the command targets
   * @param command to handle
   * @return all events appended during this call in append order, or the first failure: {@link
   *     io.github.suppierk.ledger.domain.CommandRejectedException}, {@link
   *     io.github.suppierk.ledger.store.StreamVersionConflictException} or {@link
   *     io.github.suppierk.ledger.store.EventLogException}
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public Try<List<AccountEvent>> handleCommand(final UUID accountId, final AccountCommand command) {
    final Reaction origin =
        new Reaction(
            throwIllegalArgumentIfNull(accountId, "Account ID"),
            throwIllegalArgumentIfNull(command, "Command"));

    return Try.of(() -> cascade(origin));
  }

  private List<AccountEvent> cascade(final Reaction origin) {
    final List<AccountEvent> appended = new ArrayList<>();
    final Deque<Reaction> pending = new ArrayDeque<>();
    pending.push(origin);

    while (!pending.isEmpty()) {
      final List<AccountEvent> events = handleSingle(pending.pop());
      appended.addAll(events);

      final List<Reaction> reactions = new ArrayList<>();
      for (AccountEvent event : events) {
        for (Reaction reaction :
            throwIllegalStateIfNull(processManager.process(event), "Process manager reactions")) {
          reactions.add(throwIllegalStateIfNull(reaction, "Reaction"));
        }
      }

      // Reversed, so that the first reaction is popped first
      final ListIterator<Reaction> iterator = reactions.listIterator(reactions.size());
      while (iterator.hasPrevious()) {
        pending.push(iterator.previous());
      }
    }

    return List.copyOf(appended);
  }

  private List<AccountEvent> handleSingle(final Reaction reaction) {
    final String streamId = streamIdOf(reaction.accountId());
    final AccountCommand command = reaction.command();

    final ReplayedAccount replayed;
    final List<AccountEvent> events;
    try {
      replayed =
          AccountDomain.replay(
              throwIllegalStateIfNull(eventLog.readFromStream(streamId), "Stream events"));
      log.debug("Stream '{}' replayed up to version {}", streamId, replayed.version());

      events = AccountDomain.decideOrThrow(command, replayed.state());
      eventLog.appendToStream(streamId, replayed.version(), events);
    } catch (RuntimeException e) {
      log.warn("Stream '{}': {} failed - {}", streamId, command, e.getMessage());
      listener.onCommandFailed(streamId, command, e);
      throw e;
    }

    log.debug(
        "Stream '{}': appended {} event(s) after version {}",
        streamId,
        events.size(),
        replayed.version());
    listener.onEventsAppended(streamId, replayed.version(), events);
    return events;
  }
}
