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

import io.github.suppierk.ledger.domain.AccountEvent;
import java.util.List;

/**
 * Pure reaction table turning an accepted event into further commands, possibly for other
 * accounts.
 *
 * <p>This is the only place where an event of one aggregate causes activity on another aggregate's
 * stream, driving multi-account workflows (sagas) to completion without a cross-aggregate
 * transaction.
 *
 * @see <a href="https://microservices.io/patterns/data/saga.html">Saga</a>
 */
@FunctionalInterface
public interface ProcessManager {
  /**
   * @return an instance of process manager which never reacts
   */
  static ProcessManager none() {
    return event -> List.of();
  }

  /**
   * @param event which was just appended
   * @return commands to submit in the given order, empty if the event needs no reaction
   */
  List<Reaction> process(final AccountEvent event);
}
