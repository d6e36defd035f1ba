package io.github.suppierk.ledger.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.ledger.domain.Account;
import io.github.suppierk.ledger.domain.AccountCommand;
import io.github.suppierk.ledger.domain.AccountCommand.CreateOnlineAccount;
import io.github.suppierk.ledger.domain.AccountCommand.MakeDeposit;
import io.github.suppierk.ledger.domain.AccountCommand.MakeTransaction;
import io.github.suppierk.ledger.domain.AccountCommand.Withdraw;
import io.github.suppierk.ledger.domain.AccountEvent;
import io.github.suppierk.ledger.domain.AccountEvent.DepositMade;
import io.github.suppierk.ledger.domain.AccountEvent.OnlineAccountCreated;
import io.github.suppierk.ledger.domain.AccountEvent.TransactionAccountDebited;
import io.github.suppierk.ledger.domain.AccountEvent.TransactionAccountDeposited;
import io.github.suppierk.ledger.domain.CommandRejectedException;
import io.github.suppierk.ledger.domain.Money;
import io.github.suppierk.ledger.domain.OnlineAccount;
import io.github.suppierk.ledger.domain.ReplayedAccount;
import io.github.suppierk.ledger.store.EventLog;
import io.github.suppierk.ledger.store.EventLogException;
import io.github.suppierk.ledger.store.InMemoryEventLog;
import io.github.suppierk.ledger.store.StreamVersionConflictException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AccountCommandHandlerTest {
  static final UUID A = UUID.randomUUID();
  static final UUID B = UUID.randomUUID();

  InMemoryEventLog eventLog;
  RecordingListener listener;
  AccountCommandHandler handler;

  @BeforeEach
  void setUp() {
    eventLog = new InMemoryEventLog();
    listener = new RecordingListener();
    handler = new AccountCommandHandler(eventLog, TransferProcessManager.getInstance(), listener);
  }

  static List<AccountEvent> success(
      final AccountCommandHandler handler, final UUID id, final AccountCommand command) {
    final AtomicReference<List<AccountEvent>> events = new AtomicReference<>();
    final AtomicReference<Throwable> failure = new AtomicReference<>();

    final var output = handler.handleCommand(id, command);
    output.ifSuccess(events::set);
    output.ifFailure(failure::set);

    assertNull(failure.get(), () -> "Unexpected failure: " + failure.get());
    return events.get();
  }

  static Throwable failure(
      final AccountCommandHandler handler, final UUID id, final AccountCommand command) {
    final AtomicReference<Throwable> failure = new AtomicReference<>();

    handler.handleCommand(id, command).ifFailure(failure::set);

    assertTrue(failure.get() != null, "Failure expected");
    return failure.get();
  }

  Account stateOf(final UUID id) {
    final AtomicReference<ReplayedAccount> state = new AtomicReference<>();
    new AccountStateReader(eventLog).currentState(id).ifSuccess(state::set);
    return state.get().state();
  }

  @Nested
  class SingleAccount {
    @Test
    void accepted_command_appends_its_events() {
      assertEquals(
          List.of(new OnlineAccountCreated(A)), success(handler, A, new CreateOnlineAccount(A)));
      assertEquals(
          List.of(new DepositMade(A, Money.of("100"))),
          success(handler, A, new MakeDeposit(A, Money.of("100"))));

      assertEquals(new OnlineAccount(A, Money.of("100")), stateOf(A));
      assertEquals(2, eventLog.readFromStream(A.toString()).size());
    }

    @Test
    void rejected_command_appends_nothing() {
      success(handler, A, new CreateOnlineAccount(A));
      success(handler, A, new MakeDeposit(A, Money.of("100")));

      final Throwable rejected = failure(handler, A, new Withdraw(A, Money.of("150")));

      assertInstanceOf(CommandRejectedException.class, rejected);
      assertEquals("overdraft not allowed", rejected.getMessage());
      assertEquals(new OnlineAccount(A, Money.of("100")), stateOf(A));
      assertEquals(2, eventLog.readFromStream(A.toString()).size());
    }

    @Test
    void second_creation_is_an_invalid_operation() {
      success(handler, A, new CreateOnlineAccount(A));

      final Throwable rejected = failure(handler, A, new CreateOnlineAccount(A));

      assertTrue(rejected.getMessage().startsWith("invalid operation CreateOnlineAccount"));
    }

    @Test
    void null_arguments_are_rejected() {
      final ProcessManager processManager = ProcessManager.none();

      assertThrows(
          IllegalArgumentException.class,
          () -> handler.handleCommand(null, new CreateOnlineAccount(A)));
      assertThrows(IllegalArgumentException.class, () -> handler.handleCommand(A, null));
      assertThrows(
          IllegalArgumentException.class, () -> new AccountCommandHandler(null, processManager));
      assertThrows(IllegalArgumentException.class, () -> new AccountCommandHandler(eventLog, null));
      assertThrows(
          IllegalArgumentException.class,
          () -> new AccountCommandHandler(eventLog, processManager, null));
    }
  }

  @Nested
  class Transfer {
    @Test
    void transfer_debits_the_source_and_credits_the_destination() {
      success(handler, A, new CreateOnlineAccount(A));
      success(handler, A, new MakeDeposit(A, Money.of("100")));
      success(handler, B, new CreateOnlineAccount(B));

      final List<AccountEvent> events =
          success(handler, A, new MakeTransaction(A, Money.of("50"), B));

      assertEquals(
          List.of(
              new TransactionAccountDebited(A, Money.of("50"), B),
              new TransactionAccountDeposited(B, Money.of("50"), A)),
          events);
      assertEquals(new OnlineAccount(A, Money.of("50")), stateOf(A));
      assertEquals(new OnlineAccount(B, Money.of("50")), stateOf(B));
    }

    @Test
    void failed_credit_leaves_the_debit_committed() {
      success(handler, A, new CreateOnlineAccount(A));
      success(handler, A, new MakeDeposit(A, Money.of("100")));

      final Throwable rejected = failure(handler, A, new MakeTransaction(A, Money.of("50"), B));

      assertInstanceOf(CommandRejectedException.class, rejected);
      assertTrue(rejected.getMessage().startsWith("invalid operation"));
      assertTrue(rejected.getMessage().endsWith("on current state Uninitialized"));
      assertEquals(new OnlineAccount(A, Money.of("50")), stateOf(A));
      assertEquals(Account.Uninitialized.getInstance(), stateOf(B));
      assertTrue(eventLog.readFromStream(B.toString()).isEmpty());
    }

    @Test
    void overflowing_credit_is_rejected_and_destination_stays_usable() {
      success(handler, A, new CreateOnlineAccount(A));
      success(handler, A, new MakeDeposit(A, Money.of("100")));
      success(handler, B, new CreateOnlineAccount(B));
      success(handler, B, new MakeDeposit(B, Money.ofMinorUnits(Long.MAX_VALUE)));

      final Throwable rejected = failure(handler, A, new MakeTransaction(A, Money.of("50"), B));

      assertInstanceOf(CommandRejectedException.class, rejected);
      assertEquals("balance limit exceeded", rejected.getMessage());
      assertEquals(new OnlineAccount(A, Money.of("50")), stateOf(A));
      assertEquals(2, eventLog.readFromStream(B.toString()).size());

      success(handler, B, new Withdraw(B, Money.of("1")));
      assertEquals(
          new OnlineAccount(B, Money.ofMinorUnits(Long.MAX_VALUE - 100L)), stateOf(B));
    }

    @Test
    void listener_sees_every_append_and_the_failure() {
      success(handler, A, new CreateOnlineAccount(A));
      success(handler, A, new MakeDeposit(A, Money.of("100")));
      listener.outcomes.clear();

      failure(handler, A, new MakeTransaction(A, Money.of("50"), B));

      assertEquals(
          List.of(
              "appended "
                  + A
                  + " @1 "
                  + List.of(new TransactionAccountDebited(A, Money.of("50"), B)),
              "failed " + B + " TransactionDepositTargetAccount"),
          listener.outcomes);
    }

    @Test
    void reactions_are_handled_depth_first_in_order() {
      final UUID c = UUID.randomUUID();
      final List<String> handled = new ArrayList<>();
      final ProcessManager fanOut =
          event -> {
            handled.add(event.getClass().getSimpleName() + " " + event.accountId());
            if (event instanceof OnlineAccountCreated created && created.accountId().equals(A)) {
              return List.of(
                  new Reaction(B, new CreateOnlineAccount(B)),
                  new Reaction(c, new CreateOnlineAccount(c)));
            }

            if (event instanceof OnlineAccountCreated created && created.accountId().equals(B)) {
              return List.of(new Reaction(B, new MakeDeposit(B, Money.of("1"))));
            }

            return List.of();
          };
      final AccountCommandHandler cascading = new AccountCommandHandler(eventLog, fanOut);

      final List<AccountEvent> events = success(cascading, A, new CreateOnlineAccount(A));

      assertEquals(
          List.of(
              new OnlineAccountCreated(A),
              new OnlineAccountCreated(B),
              new DepositMade(B, Money.of("1")),
              new OnlineAccountCreated(c)),
          events);
      assertEquals(4, handled.size());
    }

    @Test
    void first_failure_stops_the_cascade() {
      final UUID c = UUID.randomUUID();
      final ProcessManager fanOut =
          event ->
              event instanceof OnlineAccountCreated created && created.accountId().equals(A)
                  ? List.of(
                      new Reaction(B, new MakeDeposit(B, Money.of("1"))),
                      new Reaction(c, new CreateOnlineAccount(c)))
                  : List.of();
      final AccountCommandHandler cascading = new AccountCommandHandler(eventLog, fanOut);

      assertInstanceOf(
          CommandRejectedException.class, failure(cascading, A, new CreateOnlineAccount(A)));

      assertEquals(1, eventLog.readFromStream(A.toString()).size());
      assertTrue(eventLog.readFromStream(c.toString()).isEmpty());
    }

    @Test
    void null_reactions_are_an_illegal_state() {
      final AccountCommandHandler broken = new AccountCommandHandler(eventLog, event -> null);

      assertInstanceOf(IllegalStateException.class, failure(broken, A, new CreateOnlineAccount(A)));
    }
  }

  @Nested
  class EventLogFailures {
    @Test
    void concurrent_writer_causes_a_conflict() {
      success(handler, A, new CreateOnlineAccount(A));
      final EventLog racing = new RacingEventLog(eventLog);
      final AccountCommandHandler racingHandler =
          new AccountCommandHandler(racing, ProcessManager.none(), listener);

      final Throwable conflict = failure(racingHandler, A, new MakeDeposit(A, Money.of("10")));

      final StreamVersionConflictException exception =
          assertInstanceOf(StreamVersionConflictException.class, conflict);
      assertEquals(0, exception.getExpectedVersion());
      assertEquals(1, exception.getActualVersion());
      assertEquals(new OnlineAccount(A, Money.of("5")), stateOf(A));
    }

    @Test
    void retry_after_conflict_sees_the_new_version() {
      success(handler, A, new CreateOnlineAccount(A));
      failure(
          new AccountCommandHandler(new RacingEventLog(eventLog), ProcessManager.none()),
          A,
          new MakeDeposit(A, Money.of("10")));

      success(handler, A, new MakeDeposit(A, Money.of("10")));

      assertEquals(new OnlineAccount(A, Money.of("15")), stateOf(A));
    }

    @Test
    void unavailable_event_log_is_returned_as_failure() {
      final EventLog unavailable =
          new EventLog() {
            @Override
            public void appendToStream(
                final String streamId, final int expectedVersion, final List<AccountEvent> events) {
              throw new EventLogException("down");
            }

            @Override
            public List<AccountEvent> readFromStream(final String streamId) {
              return List.of();
            }
          };

      final Throwable cause =
          failure(
              new AccountCommandHandler(unavailable, ProcessManager.none(), listener),
              A,
              new CreateOnlineAccount(A));

      assertInstanceOf(EventLogException.class, cause);
      assertEquals(List.of("failed " + A + " CreateOnlineAccount"), listener.outcomes);
    }
  }

  /** Lets another writer append a deposit of 5 between the read and the append. */
  static final class RacingEventLog implements EventLog {
    private final EventLog delegate;

    RacingEventLog(final EventLog delegate) {
      this.delegate = delegate;
    }

    @Override
    public void appendToStream(
        final String streamId, final int expectedVersion, final List<AccountEvent> events) {
      delegate.appendToStream(streamId, expectedVersion, events);
    }

    @Override
    public List<AccountEvent> readFromStream(final String streamId) {
      final List<AccountEvent> snapshot = delegate.readFromStream(streamId);
      final UUID id = UUID.fromString(streamId);
      delegate.appendToStream(
          streamId, snapshot.size() - 1, List.of(new DepositMade(id, Money.of("5"))));
      return snapshot;
    }
  }

  static final class RecordingListener implements CommandOutcomeListener {
    final List<String> outcomes = new ArrayList<>();

    @Override
    public void onEventsAppended(
        final String streamId, final int expectedVersion, final List<AccountEvent> events) {
      outcomes.add("appended " + streamId + " @" + expectedVersion + " " + events);
    }

    @Override
    public void onCommandFailed(
        final String streamId, final AccountCommand command, final Throwable cause) {
      outcomes.add("failed " + streamId + " " + command.getClass().getSimpleName());
    }
  }
}
