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

package io.github.suppierk.ledger;

import java.io.Serial;

/**
 * Common parent of every failure the ledger reports while handling a command.
 *
 * <p>Command handling surfaces all of its failures through a single error channel, so consumers
 * who do not care about the exact reason can catch this type only. Subclasses describe the three
 * kinds of failures the system distinguishes:
 *
 * <ul>
 *   <li>{@link io.github.suppierk.ledger.domain.CommandRejectedException} - command cannot be
 *       applied to the current account state.
 *   <li>{@link io.github.suppierk.ledger.store.StreamVersionConflictException} - another writer
 *       appended to the stream first.
 *   <li>{@link io.github.suppierk.ledger.store.EventLogException} - the event log itself failed.
 * </ul>
 */
public abstract class LedgerException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4329713561930482217L;

  /**
   * Constructs a new ledger exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  protected LedgerException(String message) {
    super(message);
  }

  /**
   * Constructs a new ledger exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   *     (A {@code null} value is permitted, and indicates that the cause is nonexistent or
   *     unknown.)
   */
  protected LedgerException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   */
  public abstract int getStatusCode();
}
