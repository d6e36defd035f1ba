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

package io.github.suppierk.ledger.jooq;

import io.github.suppierk.ledger.codec.AccountEventJsonCodec;
import io.github.suppierk.ledger.domain.AccountEvent;
import io.github.suppierk.ledger.store.EventLog;
import io.github.suppierk.ledger.store.EventLogException;
import io.github.suppierk.ledger.store.StreamVersionConflictException;
import java.util.List;
import java.util.Objects;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.InsertValuesStep4;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLog} storing events in a relational database through jOOQ.
 *
 * <p>Expected table layout (see {@code ledger/account_event.sql} on the classpath):
 *
 * <ul>
 *   <li>{@code stream_id} - canonical account identifier.
 *   <li>{@code stream_version} - zero-based position of the event in its stream.
 *   <li>{@code event_type} - name given by {@link AccountEventJsonCodec#typeOf(AccountEvent)}.
 *   <li>{@code payload} - JSON given by {@link AccountEventJsonCodec#serialize(AccountEvent)}.
 * </ul>
 *
 * <p>The primary key over {@code (stream_id, stream_version)} is what makes check-and-append
 * atomic: the version check inside the transaction rejects stale writers early, and a writer which
 * passed the check concurrently with another one fails on the key. Such integrity violations are
 * reported as {@link StreamVersionConflictException}, every other database failure as {@link
 * EventLogException}.
 */
public final class JooqEventLog implements EventLog {
  private static final Logger log = LoggerFactory.getLogger(JooqEventLog.class);

  public static final String DEFAULT_TABLE_NAME = "account_event";

  private static final Field<String> STREAM_ID =
      DSL.field(DSL.name("stream_id"), SQLDataType.VARCHAR(64));
  private static final Field<Integer> STREAM_VERSION =
      DSL.field(DSL.name("stream_version"), SQLDataType.INTEGER);
  private static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR(128));
  private static final Field<String> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.VARCHAR);

  private final DslContextProvider dslContextProvider;
  private final AccountEventJsonCodec codec;
  private final Table<Record> table;

  /**
   * Default constructor using {@link #DEFAULT_TABLE_NAME}.
   *
   * @param dslContextProvider to pick the database per stream
   * @param codec to convert events into table rows
   */
  public JooqEventLog(
      final DslContextProvider dslContextProvider, final AccountEventJsonCodec codec) {
    this(dslContextProvider, codec, DEFAULT_TABLE_NAME);
  }

  /**
   * @param dslContextProvider to pick the database per stream
   * @param codec to convert events into table rows
   * @param tableName where events are stored
   */
  public JooqEventLog(
      final DslContextProvider dslContextProvider,
      final AccountEventJsonCodec codec,
      final String tableName) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (codec == null) {
      throw new IllegalArgumentException("Codec cannot be null");
    }

    if (tableName == null || tableName.isBlank()) {
      throw new IllegalArgumentException("Table name cannot be blank");
    }

    this.dslContextProvider = dslContextProvider;
    this.codec = codec;
    this.table = DSL.table(DSL.name(tableName));
  }

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

    final DSLContext dsl = resolve(streamId);

    try {
      dsl.transaction(
          (final Configuration trx) -> {
            final DSLContext trxDsl = trx.dsl();

            final int actualVersion = currentVersion(trxDsl, streamId);
            if (actualVersion != expectedVersion) {
              throw new StreamVersionConflictException(streamId, expectedVersion, actualVersion);
            }

            if (events.isEmpty()) {
              return;
            }

            InsertValuesStep4<Record, String, Integer, String, String> insert =
                trxDsl.insertInto(table, STREAM_ID, STREAM_VERSION, EVENT_TYPE, PAYLOAD);

            int version = expectedVersion;
            for (AccountEvent event : events) {
              version++;
              insert = insert.values(streamId, version, codec.typeOf(event), codec.serialize(event));
            }

            insert.execute();
          });
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        log.debug("Stream '{}' was appended concurrently at version {}", streamId, expectedVersion);
        throw new StreamVersionConflictException(streamId, expectedVersion, e);
      }

      log.error("Failed to append {} events to stream '{}'", events.size(), streamId, e);
      throw new EventLogException("Cannot append to stream '%s'".formatted(streamId), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<AccountEvent> readFromStream(final String streamId) {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    try {
      return List.copyOf(
          resolve(streamId)
              .select(EVENT_TYPE, PAYLOAD)
              .from(table)
              .where(STREAM_ID.eq(streamId))
              .orderBy(STREAM_VERSION.asc())
              .fetch(row -> codec.deserialize(row.value1(), row.value2())));
    } catch (DataAccessException e) {
      log.error("Failed to read stream '{}'", streamId, e);
      throw new EventLogException("Cannot read stream '%s'".formatted(streamId), e);
    }
  }

  /**
   * @param dsl to query with
   * @param streamId to inspect
   * @return version of the last event in the stream or {@link EventLog#NO_STREAM}
   */
  private int currentVersion(final DSLContext dsl, final String streamId) {
    final Integer lastVersion =
        dsl.select(DSL.max(STREAM_VERSION))
            .from(table)
            .where(STREAM_ID.eq(streamId))
            .fetchOne(0, Integer.class);

    return lastVersion == null ? NO_STREAM : lastVersion;
  }

  private DSLContext resolve(final String streamId) {
    final DSLContext dsl = dslContextProvider.apply(streamId);
    if (dsl == null) {
      throw new IllegalStateException(
          "DSLContext for stream '%s' cannot be null".formatted(streamId));
    }

    return dsl;
  }
}
