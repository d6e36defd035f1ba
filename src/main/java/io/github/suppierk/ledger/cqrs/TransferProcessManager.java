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
 * Money transfer saga: a debit of the source account is followed by a credit of the destination
 * account.
 *
 * <p>There is no compensation - if the credit fails, the debit stays committed.
 */
@SuppressWarnings("squid:S6548")
public final class TransferProcessManager implements ProcessManager {
  private TransferProcessManager() {
    // Cannot be instantiated
  }

  /**
   * @return the only instance of this process manager
   */
  public static TransferProcessManager getInstance() {
    return Holder.INSTANCE;
  }

  /** {@inheritDoc} */
  @Override
  public List<Reaction> process(final AccountEvent event) {
    if (event instanceof AccountEvent.TransactionAccountDebited debited) {
      return List.of(
          new Reaction(
              debited.destAccount(),
              new AccountCommand.TransactionDepositTargetAccount(
                  debited.destAccount(), debited.amount(), debited.accountId())));
    }

    return List.of();
  }

  /**
   * @see <a
   *     href="https://en.wikipedia.org/wiki/Initialization-on-demand_holder_idiom">Initialization-on-demand
   *     holder idiom</a>
   */
  private static class Holder {
    private static final TransferProcessManager INSTANCE = new TransferProcessManager();
  }
}
