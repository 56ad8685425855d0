package com.github.eventfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.eventfsm.EventedStateMachine.EventedStateMachineBuilder;
import com.github.eventfsm.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.eventfsm.StateMachineException.Code;

public class StateMachineConfigurationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDefaults() throws StateMachineException {
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder().build();
    assertEquals(StateMachineConfiguration.defaultMaxDrainWaves, config.getMaxDrainWaves());
    assertTrue(config.getWarnOnOverwrite());
    assertTrue(config.getTrackStatistics());
  }

  @Test
  public void testInvalidMaxDrainWaves() {
    try {
      StateMachineConfigurationBuilder.newBuilder().maxDrainWaves(0).build();
      fail("expected INVALID_MACHINE_CONFIG");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, problem.getCode());
    }
  }

  @Test
  public void testStatisticsCanBeTurnedOff() throws StateMachineException {
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder()
        .trackStatistics(false).warnOnOverwrite(false).build();
    assertFalse(config.getWarnOnOverwrite());
    final EventedStateMachine<Integer, String, Void, int[]> machine =
        EventedStateMachineBuilder.<Integer, String, Void, int[]>newBuilder().name("quiet")
            .initialState(0).extendedState(new int[1]).config(config).build();
    machine.registerTransition(0, "tick", 1, (ticks, event, payload) -> {
      ticks[0]++;
      return TransitionResult.success();
    });
    assertFalse(machine.registerTransition(0, "tick", 1, (ticks, event, payload) -> {
      ticks[0] += 10;
      return TransitionResult.success();
    }));
    machine.enqueue("tick");
    assertEquals(1, machine.processAll());
    assertEquals(Integer.valueOf(1), machine.getCurrentState());
    assertEquals(10, machine.getExtendedState()[0]);
    assertEquals(0L, machine.getStatistics().getWavesProcessed());
    assertEquals(0L, machine.getStatistics().getRegistrationOverwrites());
  }

}
