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

import io.github.suppierk.ledger.LedgerException;
import java.io.Serial;

/**
 * Thrown by an {@link EventLog} when the stream version observed by the writer no longer matches
 * the actual stream version, meaning that another writer appended to the same stream in between.
 *
 * <p>Nothing is appended when this exception is raised. Callers may re-read the stream and retry
 * the whole command, the ledger itself never does that automatically.
 */
public class StreamVersionConflictException extends LedgerException {
  @Serial private static final long serialVersionUID = 8409237318834175603L;

  /** Marks that the actual version could not be determined, e.g. when a database rejected a row. */
  public static final int UNKNOWN_VERSION = Integer.MIN_VALUE;

  private final String streamId;
  private final int expectedVersion;
  private final int actualVersion;

  /**
   * Constructs a new conflict for the known actual version.
   *
   * @param streamId where the conflict happened
   * @param expectedVersion the writer has observed
   * @param actualVersion the stream had at the time of append
   */
  public StreamVersionConflictException(
      String streamId, int expectedVersion, int actualVersion) {
    super(
        "Stream '%s' is at version %d, expected version %d"
            .formatted(streamId, actualVersion, expectedVersion));
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  /**
   * Constructs a new conflict detected by the storage itself, when the actual version is not known.
   *
   * @param streamId where the conflict happened
   * @param expectedVersion the writer has observed
   * @param cause the storage failure which revealed the conflict
   */
  public StreamVersionConflictException(String streamId, int expectedVersion, Throwable cause) {
    super(
        "Stream '%s' was concurrently modified, expected version %d"
            .formatted(streamId, expectedVersion),
        cause);
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = UNKNOWN_VERSION;
  }

  /**
   * @return identifier of the stream which was concurrently modified
   */
  public String getStreamId() {
    return streamId;
  }

  /**
   * @return version the writer expected the stream to have
   */
  public int getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return version the stream actually had or {@link #UNKNOWN_VERSION}
   */
  public int getActualVersion() {
    return actualVersion;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
