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
 * State of the account aggregate, derived by replaying its event stream.
 *
 * <p>State is never stored directly: it is recomputed from the stream on every command, so the
 * event log remains the only source of truth. The set of states is closed - a stream starts as
 * {@link Uninitialized} and transitions to {@link OnlineAccount} exactly once.
 */
public sealed interface Account permits Account.Uninitialized, OnlineAccount {
  /** No account exists yet, the only valid starting state. */
  @SuppressWarnings("squid:S6548")
  final class Uninitialized implements Account {
    private Uninitialized() {
      // Cannot be instantiated
    }

    /**
     * @return the only instance of this state
     */
    public static Uninitialized getInstance() {
      return Holder.INSTANCE;
    }

    @Override
    public String toString() {
      return "Uninitialized";
    }

    /**
     * @see <a
     *     href="https://en.wikipedia.org/wiki/Initialization-on-demand_holder_idiom">Initialization-on-demand
     *     holder idiom</a>
     */
    private static class Holder {
      private static final Uninitialized INSTANCE = new Uninitialized();
    }
  }
}
