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

import io.github.suppierk.java.Try;
import java.util.List;

/**
 * Pure state machine of the account aggregate: no I/O, no shared state, no side effects.
 *
 * <ul>
 *   <li>{@link #apply(Account, AccountEvent)} - how a single event changes the state.
 *   <li>{@link #replay(Account, List)} - how a whole stream folds into the state and its version.
 *   <li>{@link #decide(AccountCommand, Account)} - which events a command results in.
 * </ul>
 */
public final class AccountDomain {
  private AccountDomain() {
    // No instance
  }

  /**
   * Total function describing how one event transforms the state.
   *
   * <p><b>Design note</b>: an event which does not match the state (for example a deposit on an
   * {@link Account.Uninitialized} stream) leaves the state unchanged instead of signaling
   * corruption.
   *
   * @param state before the event
   * @param event to apply
   * @return state after the event
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public static Account apply(final Account state, final AccountEvent event) {
    throwIllegalArgumentIfNull(state, "State");
    throwIllegalArgumentIfNull(event, "Event");

    return event.applyTo(state);
  }

  /**
   * Folds events left-to-right starting from the given state, moving the version once per event.
   *
   * @param initial state to start from, typically {@link Account.Uninitialized}
   * @param events in commit order
   * @return final state and the version of the last applied event
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public static ReplayedAccount replay(
      final Account initial, final List<? extends AccountEvent> events) {
    throwIllegalArgumentIfNull(initial, "Initial state");
    throwIllegalArgumentIfNull(events, "Events");

    ReplayedAccount replayed =
        new ReplayedAccount(initial, ReplayedAccount.EMPTY_STREAM_VERSION);
    for (AccountEvent event : events) {
      replayed = replayed.next(event);
    }

    return replayed;
  }

  /**
   * Same as {@link #replay(Account, List)} starting from {@link Account.Uninitialized}.
   *
   * @param events in commit order
   * @return final state and the version of the last applied event
   */
  public static ReplayedAccount replay(final List<? extends AccountEvent> events) {
    return replay(Account.Uninitialized.getInstance(), events);
  }

  /**
   * Validates the command against the state.
   *
   * @param command to validate
   * @param state replayed from the account's stream
   * @return either events to append or a {@link CommandRejectedException}
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public static Try<List<AccountEvent>> decide(
      final AccountCommand command, final Account state) {
    throwIllegalArgumentIfNull(command, "Command");
    throwIllegalArgumentIfNull(state, "State");

    return Try.of(() -> command.decide(state));
  }

  /**
   * Variant of {@link #decide(AccountCommand, Account)} for callers which already run inside a
   * failure-capturing context.
   *
   * @param command to validate
   * @param state replayed from the account's stream
   * @return events to append
   * @throws CommandRejectedException if the command is not applicable
   */
  public static List<AccountEvent> decideOrThrow(
      final AccountCommand command, final Account state) {
    throwIllegalArgumentIfNull(command, "Command");
    throwIllegalArgumentIfNull(state, "State");

    return command.decide(state);
  }

  static CommandRejectedException invalidOperation(
      final AccountCommand command, final Account state) {
    return new CommandRejectedException(
        "invalid operation %s on current state %s".formatted(command, state));
  }

  static void requirePositive(final Money amount, final String message) {
    if (!amount.isPositive()) {
      throw new CommandRejectedException(message);
    }
  }

  // Same as checking that balance - amount >= 0, without the subtraction overflow
  static void requireNoOverdraft(final OnlineAccount account, final Money amount) {
    if (account.balance().compareTo(amount) < 0) {
      throw new CommandRejectedException("overdraft not allowed");
    }
  }

  // Replay must never overflow, so a credit which does not fit the balance is not accepted
  static void requireNoBalanceOverflow(final OnlineAccount account, final Money amount) {
    try {
      account.credit(amount);
    } catch (ArithmeticException e) {
      throw new CommandRejectedException("balance limit exceeded", e);
    }
  }

  static <T> T throwIllegalArgumentIfNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
