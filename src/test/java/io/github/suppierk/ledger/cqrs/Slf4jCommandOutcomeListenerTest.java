package io.github.suppierk.ledger.cqrs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.suppierk.ledger.domain.AccountCommand;
import io.github.suppierk.ledger.domain.AccountEvent;
import io.github.suppierk.ledger.domain.Money;
import io.github.suppierk.ledger.domain.OnlineAccount;
import io.github.suppierk.ledger.domain.ReplayedAccount;
import io.github.suppierk.ledger.store.InMemoryEventLog;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class Slf4jCommandOutcomeListenerTest {
  static final UUID ACCOUNT = UUID.randomUUID();

  final CommandOutcomeListener listener = new Slf4jCommandOutcomeListener();

  @Test
  void logging_outcomes_does_not_interfere_with_handling() {
    final InMemoryEventLog eventLog = new InMemoryEventLog();
    final AccountCommandHandler handler =
        new AccountCommandHandler(eventLog, TransferProcessManager.getInstance(), listener);

    handler.handleCommand(ACCOUNT, new AccountCommand.CreateOnlineAccount(ACCOUNT));
    handler.handleCommand(ACCOUNT, new AccountCommand.MakeDeposit(ACCOUNT, Money.of("10")));
    handler.handleCommand(ACCOUNT, new AccountCommand.Withdraw(ACCOUNT, Money.of("20")));

    final AtomicReference<ReplayedAccount> state = new AtomicReference<>();
    new AccountStateReader(eventLog).currentState(ACCOUNT).ifSuccess(state::set);
    assertEquals(new ReplayedAccount(new OnlineAccount(ACCOUNT, Money.of("10")), 1), state.get());
  }

  @Test
  void unexpected_failures_are_logged_with_their_cause() {
    assertDoesNotThrow(
        () ->
            listener.onCommandFailed(
                ACCOUNT.toString(),
                new AccountCommand.CreateOnlineAccount(ACCOUNT),
                new IllegalStateException("boom")));
    assertDoesNotThrow(
        () ->
            listener.onEventsAppended(
                ACCOUNT.toString(), -1, List.of(new AccountEvent.OnlineAccountCreated(ACCOUNT))));
  }
}
