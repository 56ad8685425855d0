package com.github.eventfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.eventfsm.CoinStillStateMachineTest.CoinType;
import com.github.eventfsm.CoinStillStateMachineTest.StillEvents;
import com.github.eventfsm.CoinStillStateMachineTest.StillState;
import com.github.eventfsm.CoinStillStateMachineTest.StillStates;

/**
 * Tests for the dot output of a machine snapshot.
 */
public class DotExporterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testRenderCoinStill() throws StateMachineException {
    final EventedStateMachine<StillStates, StillEvents, CoinType, StillState> still =
        CoinStillStateMachineTest.buildStill();
    final String dot = exporter().render(still.snapshot());

    assertTrue(dot.startsWith("digraph G"));
    assertTrue(dot.trim().endsWith("}"));
    // 3 states, 2 shadow nodes for the hooks of the open state
    assertEquals(5, count(dot, "[shape="));
    assertEquals(1, count(dot, "[shape=\"diamond\"]"));
    assertTrue(dot.contains("N0[label=\"ClosedWaitForMoney\"][shape=\"diamond\"];"));
    assertTrue(dot.contains("N2[label=\"OpenWaitForTimeOut\"][shape=\"oval\"];"));
    assertTrue(dot.contains("N3[label=\"Enter\"][style=\"dashed\"][shape=\"plain\"];"));
    assertTrue(dot.contains("N4[label=\"Exit\"][style=\"dashed\"][shape=\"plain\"];"));

    // 7 transitions + 2 hooks
    assertEquals(9, count(dot, " -> "));
    assertTrue(dot.contains("N0 -> N1[label=\"ProcessCoin\\n|GotCoin|\"];"));
    assertTrue(dot.contains("N2 -> N0[label=\"TimeOut\\n|Timeout|\"];"));
    // entry edges come out of the shadow node, exit edges go into it
    assertTrue(dot.contains("N3 -> N2[label=\"CountOpens\"];"));
    assertTrue(dot.contains("N2 -> N4[label=\"CountClose\"];"));
  }

  @Test
  public void testSnapshotIsDetached() throws StateMachineException {
    final EventedStateMachine<StillStates, StillEvents, CoinType, StillState> still =
        CoinStillStateMachineTest.buildStill();
    final StateMachineSnapshot<StillStates, StillEvents> snapshot = still.snapshot();
    assertEquals(7, snapshot.getTransitions().size());
    assertEquals(2, snapshot.getHooks().size());
    assertEquals(StillStates.CLOSED_WAIT_FOR_MONEY, snapshot.getInitialState());
    assertTrue(snapshot.hasHook(StillStates.OPEN_WAIT_FOR_TIMEOUT, Direction.ENTER));
    assertFalse(snapshot.hasHook(StillStates.CHECKING_MONEY, Direction.EXIT));

    still.registerTransition(StillStates.CLOSED_WAIT_FOR_MONEY, StillEvents.TIMEOUT,
        StillStates.CLOSED_WAIT_FOR_MONEY, (state, event, coin) -> TransitionResult.success());
    assertEquals(7, snapshot.getTransitions().size());
    assertEquals(8, still.snapshot().getTransitions().size());
  }

  @Test
  public void testUnnamedTransitionAndMissingEventLabel() throws StateMachineException {
    final EventedStateMachine<StillStates, StillEvents, CoinType, StillState> still =
        CoinStillStateMachineTest.buildStill();
    still.registerTransition(StillStates.CLOSED_WAIT_FOR_MONEY, StillEvents.TIMEOUT,
        StillStates.CLOSED_WAIT_FOR_MONEY, (state, event, coin) -> TransitionResult.success());
    final Map<StillEvents, String> eventLabels = eventLabels();
    eventLabels.remove(StillEvents.TIMEOUT);
    final String dot =
        new DotExporter<StillStates, StillEvents>(stateLabels(), eventLabels).render(still
            .snapshot());
    assertTrue(dot.contains("N0 -> N0[label=\"\\n||\"];"));
  }

  @Test
  public void testExportToFile() throws Exception {
    final EventedStateMachine<StillStates, StillEvents, CoinType, StillState> still =
        CoinStillStateMachineTest.buildStill();
    final Path destination = folder.getRoot().toPath().resolve("still.dot");
    exporter().export(still.snapshot(), Optional.of(destination));
    assertTrue(Files.exists(destination));
    final String dot = new String(Files.readAllBytes(destination), StandardCharsets.UTF_8);
    assertTrue(dot.startsWith("digraph G"));
    assertTrue(dot.contains("CountOpens"));
  }

  @Test
  public void testExportToStdout() throws Exception {
    final EventedStateMachine<StillStates, StillEvents, CoinType, StillState> still =
        CoinStillStateMachineTest.buildStill();
    exporter().export(still.snapshot(), Optional.empty());
  }

  @Test
  public void testExportToUncreatableFile() throws Exception {
    final EventedStateMachine<StillStates, StillEvents, CoinType, StillState> still =
        CoinStillStateMachineTest.buildStill();
    final File notADirectory = folder.newFile("plain-file");
    final Path destination = notADirectory.toPath().resolve("still.dot");
    try {
      exporter().export(still.snapshot(), Optional.of(destination));
      fail("expected the export to fail");
    } catch (IOException expected) {
      assertFalse(Files.exists(destination));
    }
  }

  private static DotExporter<StillStates, StillEvents> exporter() {
    return new DotExporter<>(stateLabels(), eventLabels());
  }

  private static Map<StillStates, String> stateLabels() {
    final Map<StillStates, String> labels = new EnumMap<>(StillStates.class);
    labels.put(StillStates.CLOSED_WAIT_FOR_MONEY, "ClosedWaitForMoney");
    labels.put(StillStates.CHECKING_MONEY, "CheckingMoney");
    labels.put(StillStates.OPEN_WAIT_FOR_TIMEOUT, "OpenWaitForTimeOut");
    return labels;
  }

  private static Map<StillEvents, String> eventLabels() {
    final Map<StillEvents, String> labels = new EnumMap<>(StillEvents.class);
    labels.put(StillEvents.GOT_COIN, "GotCoin");
    labels.put(StillEvents.ACCEPT_MONEY, "AcceptMoney");
    labels.put(StillEvents.REJECT_MONEY, "RejectMoney");
    labels.put(StillEvents.TIMEOUT, "Timeout");
    return labels;
  }

  private static int count(final String text, final String token) {
    int count = 0;
    int from = 0;
    while ((from = text.indexOf(token, from)) >= 0) {
      count++;
      from += token.length();
    }
    return count;
  }

}
