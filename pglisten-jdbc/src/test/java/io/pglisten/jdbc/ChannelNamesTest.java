package io.pglisten.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChannelNamesTest {

  @Test
  void acceptsOrdinaryAndMixedCaseNames() {
    assertEquals("orders", ChannelNames.validate("orders"));
    assertEquals("Orders.Updated", ChannelNames.validate("Orders.Updated"));
    assertEquals("x".repeat(63), ChannelNames.validate("x".repeat(63)));
  }

  @Test
  void rejectsNamesTheServerWouldTruncate() {
    assertThrows(IllegalArgumentException.class, () -> ChannelNames.validate("x".repeat(64)));
    // 32 two-byte characters = 64 bytes
    assertThrows(IllegalArgumentException.class, () -> ChannelNames.validate("é".repeat(32)));
  }

  @Test
  void rejectsEmptyAndNulNames() {
    assertThrows(NullPointerException.class, () -> ChannelNames.validate(null));
    assertThrows(IllegalArgumentException.class, () -> ChannelNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> ChannelNames.validate("a\0b"));
  }

  @Test
  void quotePreservesCaseAndEscapesQuotes() {
    assertEquals("\"Orders\"", ChannelNames.quote("Orders"));
    assertEquals("\"say \"\"hi\"\"\"", ChannelNames.quote("say \"hi\""));
  }
}
