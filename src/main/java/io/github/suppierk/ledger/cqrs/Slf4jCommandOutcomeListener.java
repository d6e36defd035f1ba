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

import io.github.suppierk.ledger.LedgerException;
import io.github.suppierk.ledger.domain.AccountCommand;
import io.github.suppierk.ledger.domain.AccountEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link CommandOutcomeListener} writing an audit trail of command outcomes via SLF4J. */
public final class Slf4jCommandOutcomeListener implements CommandOutcomeListener {
  private static final Logger log = LoggerFactory.getLogger(Slf4jCommandOutcomeListener.class);

  @Override
  public void onEventsAppended(
      final String streamId, final int expectedVersion, final List<AccountEvent> events) {
    for (int i = 0; i < events.size(); i++) {
      log.info("Stream '{}' v{}: {}", streamId, expectedVersion + 1 + i, events.get(i));
    }
  }

  @Override
  public void onCommandFailed(
      final String streamId, final AccountCommand command, final Throwable cause) {
    if (cause instanceof LedgerException ledgerException) {
      log.info(
          "Stream '{}': {} failed with {} ({})",
          streamId,
          command,
          ledgerException.getStatusCode(),
          ledgerException.getMessage());
    } else {
      log.error("Stream '{}': {} failed unexpectedly", streamId, command, cause);
    }
  }
}
