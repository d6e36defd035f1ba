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

package io.github.suppierk.ledger.codec;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.ledger.domain.AccountEvent;
import io.github.suppierk.ledger.store.EventLogException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts {@link AccountEvent}s to JSON and back for event logs which store payloads as text.
 *
 * <p>An event is described by two values: its type name (the simple name of the event record) and
 * its JSON payload. Known type names are taken from the permitted subclasses of {@link
 * AccountEvent}, so a new event variant is picked up without any registration.
 *
 * <p>Only record components are written and unknown JSON properties are ignored to keep older payloads readable after additive changes.
 * Any serialization failure is reported as {@link EventLogException}, since a log which cannot read
 * its own payloads is broken.
 */
public final class AccountEventJsonCodec {
  private final ObjectMapper objectMapper;
  private final Map<String, Class<? extends AccountEvent>> eventTypes;

  /** Creates a codec with the default {@link ObjectMapper}. */
  public AccountEventJsonCodec() {
    this(new ObjectMapper());
  }

  /**
   * @param objectMapper to base the codec on, a copy is made to avoid affecting other users
   */
  public AccountEventJsonCodec(final ObjectMapper objectMapper) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }

    this.objectMapper =
        objectMapper
            .copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            // Derived flags such as Money#isPositive are not part of the payload
            .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);

    final Map<String, Class<? extends AccountEvent>> types = new HashMap<>();
    for (Class<?> permitted : AccountEvent.class.getPermittedSubclasses()) {
      types.put(permitted.getSimpleName(), permitted.asSubclass(AccountEvent.class));
    }
    this.eventTypes = Map.copyOf(types);
  }

  /**
   * @return every type name this codec can decode
   */
  public Set<String> supportedTypes() {
    return eventTypes.keySet();
  }

  /**
   * @param event to describe
   * @return type name to store alongside the payload
   */
  public String typeOf(final AccountEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    return event.getClass().getSimpleName();
  }

  /**
   * @param event to encode
   * @return JSON representation of the event
   * @throws EventLogException if the event cannot be encoded
   */
  public String serialize(final AccountEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new EventLogException(
          "Cannot serialize '%s' event".formatted(typeOf(event)), e);
    }
  }

  /**
   * @param type name returned by {@link #typeOf(AccountEvent)} at the time of writing
   * @param payload returned by {@link #serialize(AccountEvent)} at the time of writing
   * @return decoded event
   * @throws EventLogException if the type is unknown or the payload cannot be decoded
   */
  public AccountEvent deserialize(final String type, final String payload) {
    final Class<? extends AccountEvent> eventClass = type == null ? null : eventTypes.get(type);
    if (eventClass == null) {
      throw new EventLogException("Unknown event type '%s'".formatted(type));
    }

    if (payload == null) {
      throw new EventLogException("Payload of '%s' event is missing".formatted(type));
    }

    try {
      return objectMapper.readValue(payload, eventClass);
    } catch (JsonProcessingException e) {
      throw new EventLogException("Cannot deserialize '%s' event".formatted(type), e);
    }
  }
}
