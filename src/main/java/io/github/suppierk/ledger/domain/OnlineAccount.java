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

import java.util.UUID;

/**
 * An opened account with its current balance.
 *
 * <p>Balance is not validated here: replay must reproduce whatever the log contains. Keeping the
 * balance non-negative is the job of {@link AccountCommand#decide(Account)}.
 *
 * @param accountId set once by {@link AccountEvent.OnlineAccountCreated}, never changes afterwards
 * @param balance current balance
 */
public record OnlineAccount(UUID accountId, Money balance) implements Account {
  /**
   * @param accountId of the new account
   * @return a freshly opened account with zero balance
   */
  static OnlineAccount opened(final UUID accountId) {
    return new OnlineAccount(accountId, Money.ZERO);
  }

  /**
   * @param amount to add to the balance
   * @return a new state with increased balance
   */
  public OnlineAccount credit(final Money amount) {
    return new OnlineAccount(accountId, balance.plus(amount));
  }

  /**
   * @param amount to subtract from the balance
   * @return a new state with decreased balance
   */
  public OnlineAccount debit(final Money amount) {
    return new OnlineAccount(accountId, balance.minus(amount));
  }
}
