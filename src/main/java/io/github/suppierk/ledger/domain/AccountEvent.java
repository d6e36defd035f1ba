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

import static io.github.suppierk.ledger.domain.AccountDomain.throwIllegalArgumentIfNull;

import java.util.UUID;

/**
 * Represents an immutable fact about an account which has been accepted and appended to the
 * account's stream.
 *
 * <p>Events are produced by {@link AccountCommand#decide(Account)} only, appended once and never
 * mutated or deleted afterwards.
 *
 * <p>Because the set of events is {@code sealed} and every variant must implement {@link
 * #applyTo(Account)}, introducing a new event without describing its effect on the state does not
 * compile.
 */
// @formatter:off
public sealed interface AccountEvent
permits
  AccountEvent.OnlineAccountCreated,
  AccountEvent.DepositMade,
  AccountEvent.MoneyWithdrawn,
  AccountEvent.TransactionAccountDebited,
  AccountEvent.TransactionAccountDeposited
{
// @formatter:on

  /**
   * @return identifier of the account whose stream contains this event
   */
  UUID accountId();

  /**
   * Computes the state after this event, without any validation.
   *
   * <p>Pairs of state and event which are not expected to meet leave the state unchanged.
   *
   * @param state before this event
   * @return state after this event
   */
  Account applyTo(final Account state);

  /**
   * Account was opened with zero balance.
   *
   * @param accountId of the new account
   */
  record OnlineAccountCreated(UUID accountId) implements AccountEvent {
    public OnlineAccountCreated {
      throwIllegalArgumentIfNull(accountId, "Account ID");
    }

    @Override
    public Account applyTo(final Account state) {
      return state instanceof Account.Uninitialized ? OnlineAccount.opened(accountId) : state;
    }
  }

  /**
   * Money was deposited to the account.
   *
   * @param accountId receiving the deposit
   * @param amount deposited
   */
  record DepositMade(UUID accountId, Money amount) implements AccountEvent {
    public DepositMade {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Deposit amount");
    }

    @Override
    public Account applyTo(final Account state) {
      return state instanceof OnlineAccount online ? online.credit(amount) : state;
    }
  }

  /**
   * Money was withdrawn from the account.
   *
   * @param accountId money was taken from
   * @param amount withdrawn
   */
  record MoneyWithdrawn(UUID accountId, Money amount) implements AccountEvent {
    public MoneyWithdrawn {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Withdrawal amount");
    }

    @Override
    public Account applyTo(final Account state) {
      return state instanceof OnlineAccount online ? online.debit(amount) : state;
    }
  }

  /**
   * First step of a transfer: money left the source account.
   *
   * @param accountId of the source account
   * @param amount transferred
   * @param destAccount which is expected to be credited next
   */
  record TransactionAccountDebited(UUID accountId, Money amount, UUID destAccount)
      implements AccountEvent {
    public TransactionAccountDebited {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Transaction amount");
      throwIllegalArgumentIfNull(destAccount, "Destination account ID");
    }

    @Override
    public Account applyTo(final Account state) {
      return state instanceof OnlineAccount online ? online.debit(amount) : state;
    }
  }

  /**
   * Second step of a transfer: money arrived to the destination account.
   *
   * @param accountId of the destination account
   * @param amount transferred
   * @param srcAccount which was debited before
   */
  record TransactionAccountDeposited(UUID accountId, Money amount, UUID srcAccount)
      implements AccountEvent {
    public TransactionAccountDeposited {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Transaction amount");
      throwIllegalArgumentIfNull(srcAccount, "Source account ID");
    }

    @Override
    public Account applyTo(final Account state) {
      return state instanceof OnlineAccount online ? online.credit(amount) : state;
    }
  }
}
