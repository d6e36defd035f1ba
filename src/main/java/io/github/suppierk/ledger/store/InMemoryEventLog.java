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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe {@link EventLog} keeping streams in memory.
 *
 * <p>Check-and-append runs inside {@link ConcurrentMap#compute}, which serializes writers of the
 * same stream while writers of different streams proceed independently. Nothing survives a
 * restart.
 */
public final class InMemoryEventLog implements EventLog {
  private final ConcurrentMap<String, List<AccountEvent>> streams = new ConcurrentHashMap<>();

  /** {@inheritDoc} */
  @Override
  public void appendToStream(
      final String streamId, final int expectedVersion, final List<AccountEvent> events) {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    if (events == null || events.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    streams.compute(
        streamId,
        (id, current) -> {
          final List<AccountEvent> committed = current == null ? List.of() : current;
          final int actualVersion = committed.size() - 1;

          if (actualVersion != expectedVersion) {
            throw new StreamVersionConflictException(id, expectedVersion, actualVersion);
          }

          if (events.isEmpty()) {
            return current;
          }

          final List<AccountEvent> appended = new ArrayList<>(committed.size() + events.size());
          appended.addAll(committed);
          appended.addAll(events);
          return List.copyOf(appended);
        });
  }

  /** {@inheritDoc} */
  @Override
  public List<AccountEvent> readFromStream(final String streamId) {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    return streams.getOrDefault(streamId, List.of());
  }

  /**
   * @return identifiers of all streams with at least one event
   */
  public Set<String> streamIds() {
    return Set.copyOf(streams.keySet());
  }
}
