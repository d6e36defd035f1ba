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

package io.github.suppierk.ledger.store;

import io.github.suppierk.ledger.domain.AccountEvent;
import java.util.List;

/**
 * Abstract contract for an append-only storage of {@link AccountEvent}s grouped into streams.
 *
 * <p>Streams are keyed by the canonical string form of the account identifier. The log is the
 * only component allowed to mutate committed history, and it may only ever append to it.
 *
 * <p>For the functionality, it is crucial that {@link #appendToStream(String, int, List)} performs
 * the version check and the append as a single atomic operation: two writers which observed the
 * same version must never both succeed.
 *
 * @see <a href="https://en.wikipedia.org/wiki/Optimistic_concurrency_control">Optimistic
 *     concurrency control</a>
 */
public interface EventLog {
  /** Expected version of a stream which has no events yet. */
  int NO_STREAM = -1;

  /**
   * Appends events to the end of the stream if the stream is still at the expected version.
   *
   * <p>Appending an empty list verifies the version and writes nothing.
   *
   * @param streamId to append to
   * @param expectedVersion the writer has observed, {@link #NO_STREAM} for an empty stream
   * @param events to append in the given order
   * @throws StreamVersionConflictException if the stream version differs from the expected one
   * @throws EventLogException if the append failed for any other reason
   */
  void appendToStream(
      final String streamId, final int expectedVersion, final List<AccountEvent> events)
      throws StreamVersionConflictException, EventLogException;

  /**
   * @param streamId to read
   * @return all events of the stream in commit order, empty list for a nonexistent stream
   * @throws EventLogException if the read failed
   */
  List<AccountEvent> readFromStream(final String streamId) throws EventLogException;
}
