package com.github.eventfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Optional;

import org.junit.Test;

/**
 * Tests for the lookup tables backing the machine.
 */
public class TransitionTableTest {

  @Test
  public void testRegisterAndLookup() {
    final TransitionTable<String, Integer, Void, StringBuilder> table = new TransitionTable<>();
    final TransitionHandler<Integer, Void, StringBuilder> handler =
        (log, event, payload) -> TransitionResult.success();
    assertTrue(table.register("idle", 1, "busy", handler, Optional.of("start")));
    assertEquals(1, table.size());

    final Optional<TransitionEntry<String, Integer, Void, StringBuilder>> entry =
        table.lookup("idle", 1);
    assertTrue(entry.isPresent());
    assertEquals("busy", entry.get().getTargetState());
    assertSame(handler, entry.get().getHandler());
    assertEquals(Optional.of("start"), entry.get().getName());

    assertFalse(table.lookup("idle", 2).isPresent());
    assertFalse(table.lookup("busy", 1).isPresent());
  }

  @Test
  public void testOverwriteLastWriteWins() {
    final TransitionTable<String, Integer, Void, StringBuilder> table = new TransitionTable<>();
    assertTrue(table.register("idle", 1, "busy", (log, event, payload) -> TransitionResult.success(),
        Optional.empty()));
    assertFalse(table.register("idle", 1, "done",
        (log, event, payload) -> TransitionResult.success(), null));
    assertEquals(1, table.size());
    assertEquals("done", table.lookup("idle", 1).get().getTargetState());
    assertFalse(table.lookup("idle", 1).get().getName().isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingHandler() {
    new TransitionTable<String, Integer, Void, StringBuilder>().register("idle", 1, "busy", null,
        Optional.empty());
  }

  @Test
  public void testEntryExitTable() {
    final EntryExitTable<String, Integer, Void, StringBuilder> table = new EntryExitTable<>();
    assertTrue(table.register("busy", Direction.ENTER, (log) -> TransitionResult.success(),
        Optional.of("in")));
    assertTrue(table.register("busy", Direction.EXIT, (log) -> TransitionResult.success(),
        Optional.of("out")));
    assertFalse(table.register("busy", Direction.ENTER, (log) -> TransitionResult.success(),
        Optional.of("in again")));
    assertEquals(2, table.size());
    assertEquals(Optional.of("in again"), table.lookup("busy", Direction.ENTER).get().getName());
    assertFalse(table.lookup("idle", Direction.ENTER).isPresent());
  }

  @Test
  public void testKeys() {
    assertEquals(TransitionKey.of("idle", 1), TransitionKey.of("idle", 1));
    assertEquals(TransitionKey.of("idle", 1).hashCode(), TransitionKey.of("idle", 1).hashCode());
    assertFalse(TransitionKey.of("idle", 1).equals(TransitionKey.of("idle", 2)));
    assertEquals(EntryExitKey.of("idle", Direction.EXIT), EntryExitKey.of("idle", Direction.EXIT));
    assertFalse(EntryExitKey.of("idle", Direction.EXIT)
        .equals(EntryExitKey.of("idle", Direction.ENTER)));
  }

}
