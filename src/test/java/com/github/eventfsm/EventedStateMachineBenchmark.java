package com.github.eventfsm;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.eventfsm.CoinStillStateMachineTest.CoinType;
import com.github.eventfsm.CoinStillStateMachineTest.StillEvents;
import com.github.eventfsm.CoinStillStateMachineTest.StillState;
import com.github.eventfsm.CoinStillStateMachineTest.StillStates;

public class EventedStateMachineBenchmark {

  @Benchmark
  public int testCoinStillCycle() throws StateMachineException {
    // 1. build the still with all its transitions and hooks
    final EventedStateMachine<StillStates, StillEvents, CoinType, StillState> still =
        CoinStillStateMachineTest.buildStill();

    // 2. closed->checking->open
    still.enqueue(StillEvents.GOT_COIN, CoinType.GOOD);
    int processed = still.processAll();

    // 3. open->closed
    still.enqueue(StillEvents.TIMEOUT);
    processed += still.processAll();

    // 4. stop the fsm
    still.demolish();
    return processed;
  }

  public static void main(String args[]) throws StateMachineException {
    EventedStateMachineBenchmark benchmark = new EventedStateMachineBenchmark();
    benchmark.testCoinStillCycle();
  }

}
