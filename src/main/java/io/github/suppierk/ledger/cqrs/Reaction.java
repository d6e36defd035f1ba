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
import java.util.UUID;

/**
 * A command which must be submitted to a specific account's stream.
 *
 * @param accountId whose stream the command targets
 * @param command to submit
 */
public record Reaction(UUID accountId, AccountCommand command) {
  public Reaction {
    Suspicious.throwIllegalArgumentIfNull(accountId, "Account ID");
    Suspicious.throwIllegalArgumentIfNull(command, "Command");
  }
}
