package ca.gc.cra.pulse.domain.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MessageKindTest {

  @Test
  void resolvesEveryWireName() {
    for (MessageKind kind : MessageKind.values()) {
      assertEquals(Optional.of(kind), MessageKind.fromWireName(kind.wireName()));
    }
    assertTrue(MessageKind.fromWireName("pytest_runtest_logreport").isEmpty());
  }

  @Test
  void onlyPerTestMessagesBelongToRunPhase() {
    EnumSet<MessageKind> runPhase = EnumSet.noneOf(MessageKind.class);
    for (MessageKind kind : MessageKind.values()) {
      if (kind.runPhase()) {
        runPhase.add(kind);
      }
    }

    assertEquals(EnumSet.of(MessageKind.START_TEST, MessageKind.TEST_REPORT, MessageKind.END_TEST), runPhase);
  }

  @Test
  void writeSepCarriesTwoArguments() {
    assertEquals(2, MessageKind.WRITE_SEP.arity());
    assertEquals(0, MessageKind.COLLECTION_FINISH.arity());
  }
}
