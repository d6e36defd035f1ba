package io.github.suppierk.ledger.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.github.suppierk.ledger.LedgerException;
import org.junit.jupiter.api.Test;

class EventLogExceptionTest {
  @Test
  void event_log_failures_are_unavailable() {
    final IllegalStateException cause = new IllegalStateException("down");
    final LedgerException exception = new EventLogException("Cannot read", cause);

    assertEquals(503, exception.getStatusCode());
    assertEquals("Cannot read", exception.getMessage());
    assertSame(cause, exception.getCause());
  }

  @Test
  void conflicts_carry_both_versions() {
    final StreamVersionConflictException conflict =
        new StreamVersionConflictException("stream", 1, 4);

    assertEquals(409, conflict.getStatusCode());
    assertEquals("Stream 'stream' is at version 4, expected version 1", conflict.getMessage());
  }

  @Test
  void conflicts_detected_by_the_database_have_unknown_actual_version() {
    final RuntimeException cause = new RuntimeException("duplicate key");
    final StreamVersionConflictException conflict =
        new StreamVersionConflictException("stream", 2, cause);

    assertEquals(StreamVersionConflictException.UNKNOWN_VERSION, conflict.getActualVersion());
    assertEquals(2, conflict.getExpectedVersion());
    assertSame(cause, conflict.getCause());
  }
}
