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

/**
 * Outcome of replaying a stream.
 *
 * @param state after the last event
 * @param version zero-based index of the last applied event, {@code -1} for an empty stream
 */
public record ReplayedAccount(Account state, int version) {
  /** Version of a stream without events. */
  public static final int EMPTY_STREAM_VERSION = -1;

  /**
   * @return the starting point of every replay
   */
  public static ReplayedAccount initial() {
    return new ReplayedAccount(Account.Uninitialized.getInstance(), EMPTY_STREAM_VERSION);
  }

  /**
   * @param event to apply next
   * @return state after the event with the version moved by one
   */
  public ReplayedAccount next(final AccountEvent event) {
    return new ReplayedAccount(AccountDomain.apply(state, event), version + 1);
  }
}
