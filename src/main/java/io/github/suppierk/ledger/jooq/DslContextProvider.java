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

import java.util.List;
import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Allows for flexibility to define {@link DSLContext}s to be used per event stream.
 *
 * <p>Extends {@link Function} to give the ability to decide which {@link DSLContext} to use based
 * on the stream identifier, where some of the usage examples might be to keep streams of different
 * accounts in different databases.
 *
 * <p>Since every stream is read and appended through the context returned here, the same stream
 * identifier must always resolve to the same database.
 */
@FunctionalInterface
public interface DslContextProvider extends Function<String, DSLContext> {

  /**
   * Similar to {@link Function#identity()}.
   *
   * @param dslContext to create {@link DslContextProvider} with
   * @return a new instance of {@link DslContextProvider} which simply returns provided {@link
   *     DSLContext} for every stream
   */
  static DslContextProvider dslContextIdentity(DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return streamId -> dslContext;
  }

  /**
   * Spreads streams across several databases by the hash of the stream identifier.
   *
   * <p>The order of shards is significant: changing it or the number of shards moves existing
   * streams to other databases.
   *
   * @param shards to distribute streams between
   * @return a new instance of {@link DslContextProvider} which picks one of the shards per stream
   */
  static DslContextProvider sharded(List<DSLContext> shards) {
    if (shards == null || shards.isEmpty()) {
      throw new IllegalArgumentException("Shards are null or empty");
    }

    for (DSLContext shard : shards) {
      if (shard == null) {
        throw new IllegalArgumentException("Shards contain null DSLContext");
      }
    }

    final List<DSLContext> contexts = List.copyOf(shards);
    return streamId -> contexts.get(Math.floorMod(streamId.hashCode(), contexts.size()));
  }
}
