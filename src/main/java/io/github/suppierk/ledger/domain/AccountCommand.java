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

import static io.github.suppierk.ledger.domain.AccountDomain.invalidOperation;
import static io.github.suppierk.ledger.domain.AccountDomain.requireNoBalanceOverflow;
import static io.github.suppierk.ledger.domain.AccountDomain.requireNoOverdraft;
import static io.github.suppierk.ledger.domain.AccountDomain.requirePositive;
import static io.github.suppierk.ledger.domain.AccountDomain.throwIllegalArgumentIfNull;

import java.util.List;
import java.util.UUID;

/**
 * Represents an intent to change an account which was not validated yet.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Make Deposit' instead of 'Set
 * Balance'. Each command knows which state accepts it and which events it results in, see {@link
 * #decide(Account)}.
 *
 * <p>Because the set of commands is {@code sealed} and every variant must implement {@link
 * #decide(Account)}, introducing a new command without its validation rules does not compile.
 */
// @formatter:off
public sealed interface AccountCommand
permits
  AccountCommand.CreateOnlineAccount,
  AccountCommand.MakeDeposit,
  AccountCommand.Withdraw,
  AccountCommand.MakeTransaction,
  AccountCommand.TransactionDepositTargetAccount
{
// @formatter:on
  String TRANSACTION_AMOUNT_MUST_BE_POSITIVE = "transaction amount must be positive";

  /**
   * @return identifier of the account this command targets
   */
  UUID accountId();

  /**
   * Validates this command against the current state. The state is only inspected, never changed.
   *
   * @param state replayed from the account's stream
   * @return events to append, never empty
   * @throws CommandRejectedException if the state does not accept this command or a business rule
   *     is violated
   */
  List<AccountEvent> decide(final Account state) throws CommandRejectedException;

  /**
   * Open a new account, valid only when the stream is empty.
   *
   * @param accountId of the new account
   */
  record CreateOnlineAccount(UUID accountId) implements AccountCommand {
    public CreateOnlineAccount {
      throwIllegalArgumentIfNull(accountId, "Account ID");
    }

    @Override
    public List<AccountEvent> decide(final Account state) {
      if (state instanceof Account.Uninitialized) {
        return List.of(new AccountEvent.OnlineAccountCreated(accountId));
      }

      throw invalidOperation(this, state);
    }
  }

  /**
   * Put money on the account.
   *
   * @param accountId receiving the deposit
   * @param amount to deposit, must be positive
   */
  record MakeDeposit(UUID accountId, Money amount) implements AccountCommand {
    public MakeDeposit {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Deposit amount");
    }

    @Override
    public List<AccountEvent> decide(final Account state) {
      if (state instanceof OnlineAccount online) {
        requirePositive(amount, "deposit amount must be positive");
        requireNoBalanceOverflow(online, amount);
        return List.of(new AccountEvent.DepositMade(online.accountId(), amount));
      }

      throw invalidOperation(this, state);
    }
  }

  /**
   * Take money from the account.
   *
   * @param accountId to withdraw from
   * @param amount to withdraw, must be positive and not exceed the balance
   */
  record Withdraw(UUID accountId, Money amount) implements AccountCommand {
    public Withdraw {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Withdrawal amount");
    }

    @Override
    public List<AccountEvent> decide(final Account state) {
      if (state instanceof OnlineAccount online) {
        requirePositive(amount, "withdrawal amount must be positive");
        requireNoOverdraft(online, amount);
        return List.of(new AccountEvent.MoneyWithdrawn(online.accountId(), amount));
      }

      throw invalidOperation(this, state);
    }
  }

  /**
   * Start a transfer by debiting the source account, the destination is credited by a reaction.
   *
   * @param accountId of the source account
   * @param amount to transfer, must be positive and not exceed the balance
   * @param destAccount to credit
   */
  record MakeTransaction(UUID accountId, Money amount, UUID destAccount)
      implements AccountCommand {
    public MakeTransaction {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Transaction amount");
      throwIllegalArgumentIfNull(destAccount, "Destination account ID");
    }

    @Override
    public List<AccountEvent> decide(final Account state) {
      if (state instanceof OnlineAccount online) {
        requirePositive(amount, TRANSACTION_AMOUNT_MUST_BE_POSITIVE);
        requireNoOverdraft(online, amount);
        return List.of(
            new AccountEvent.TransactionAccountDebited(online.accountId(), amount, destAccount));
      }

      throw invalidOperation(this, state);
    }
  }

  /**
   * Finish a transfer by crediting the destination account. Credits are unconditional, hence no
   * balance checks are made.
   *
   * @param accountId of the destination account
   * @param amount to credit, must be positive
   * @param srcAccount which was debited
   */
  record TransactionDepositTargetAccount(UUID accountId, Money amount, UUID srcAccount)
      implements AccountCommand {
    public TransactionDepositTargetAccount {
      throwIllegalArgumentIfNull(accountId, "Account ID");
      throwIllegalArgumentIfNull(amount, "Transaction amount");
      throwIllegalArgumentIfNull(srcAccount, "Source account ID");
    }

    @Override
    public List<AccountEvent> decide(final Account state) {
      if (state instanceof OnlineAccount online) {
        requirePositive(amount, TRANSACTION_AMOUNT_MUST_BE_POSITIVE);
        requireNoBalanceOverflow(online, amount);
        return List.of(
            new AccountEvent.TransactionAccountDeposited(online.accountId(), amount, srcAccount));
      }

      throw invalidOperation(this, state);
    }
  }
}
