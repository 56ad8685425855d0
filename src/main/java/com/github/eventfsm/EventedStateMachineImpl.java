package com.github.eventfsm;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.eventfsm.StateMachineException.Code;

/**
 * A simple evented Finite State Machine.
 * 
 * Notes for users:<br>
 * 1. this FSM instance is not thread-safe, it is synchronous and non-reentrant. process() runs to
 * completion on the caller thread<br>
 * 
 * 2. the machine owns the extended state for its whole lifetime. Handlers and hooks get it one at a
 * time for the duration of their call; the owner can peek at it only between process() calls<br>
 * 
 * 3. the current state changes only after a transition handler returned successfully. The target
 * state comes from the transition table, never from the handler<br>
 * 
 * 4. no rollback: when a wave fails, everything done by earlier steps of that wave stays done and
 * the remaining events of the wave are dropped<br>
 * 
 * @author gaurav
 */
public final class EventedStateMachineImpl<S, E, P, X> implements EventedStateMachine<S, E, P, X> {
  private static final Logger logger =
      LogManager.getLogger(EventedStateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final String name;
  private final S initialState;
  private final X extendedState;
  private final StateMachineConfiguration config;

  private S currentState;

  private final EventQueue<E, P> eventQueue = new EventQueue<>();
  private final TransitionTable<S, E, P, X> transitionTable = new TransitionTable<>();
  private final EntryExitTable<S, E, P, X> entryExitTable = new EntryExitTable<>();

  private final StateMachineStatistics machineStats;

  private final AtomicBoolean machineAlive = new AtomicBoolean();
  // set for the duration of a wave, guards against re-entrant process() calls
  private final AtomicBoolean processing = new AtomicBoolean();

  EventedStateMachineImpl(final String name, final S initialState, final X extendedState,
      final StateMachineConfiguration config) {
    this.name = name;
    this.initialState = initialState;
    this.currentState = initialState;
    this.extendedState = extendedState;
    this.config = config;
    this.machineStats = new StateMachineStatistics(machineId, name);
    machineAlive.set(true);
    logInfo(machineId, name,
        "Fired up state machine in state " + initialState + " with " + config);
  }

  @Override
  public boolean registerTransition(final S state, final E event, final S targetState,
      final TransitionHandler<E, P, X> handler, final Optional<String> transitionName) {
    final boolean inserted =
        transitionTable.register(state, event, targetState, handler, transitionName);
    logRegistration(inserted, String.format("transition %s--%s-->%s (%s)", state, event,
        targetState, transitionName != null ? transitionName.orElse("unnamed") : "unnamed"));
    return inserted;
  }

  @Override
  public boolean registerTransition(final S state, final E event, final S targetState,
      final TransitionHandler<E, P, X> handler) {
    return registerTransition(state, event, targetState, handler, Optional.empty());
  }

  @Override
  public boolean registerEntryHook(final S state, final EntryExitHandler<E, P, X> handler,
      final Optional<String> hookName) {
    return registerEntryExit(state, Direction.ENTER, handler, hookName);
  }

  @Override
  public boolean registerEntryHook(final S state, final EntryExitHandler<E, P, X> handler) {
    return registerEntryExit(state, Direction.ENTER, handler, Optional.empty());
  }

  @Override
  public boolean registerExitHook(final S state, final EntryExitHandler<E, P, X> handler,
      final Optional<String> hookName) {
    return registerEntryExit(state, Direction.EXIT, handler, hookName);
  }

  @Override
  public boolean registerExitHook(final S state, final EntryExitHandler<E, P, X> handler) {
    return registerEntryExit(state, Direction.EXIT, handler, Optional.empty());
  }

  private boolean registerEntryExit(final S state, final Direction direction,
      final EntryExitHandler<E, P, X> handler, final Optional<String> hookName) {
    final boolean inserted = entryExitTable.register(state, direction, handler, hookName);
    logRegistration(inserted, String.format("%s hook on %s (%s)", direction, state,
        hookName != null ? hookName.orElse("unnamed") : "unnamed"));
    return inserted;
  }

  @Override
  public int enqueue(final List<QueuedEvent<E, P>> events) throws StateMachineException {
    machineAlive();
    if (events == null) {
      throw new StateMachineException(Code.INVALID_EVENT, "Events to enqueue cannot be null");
    }
    validateEvents(events);
    final int added = eventQueue.enqueue(events);
    logDebug(machineId, name, "Added " + added + " events, queue holds " + eventQueue.size());
    return added;
  }

  @Override
  public int enqueue(final E event) throws StateMachineException {
    return enqueue(Collections.singletonList(QueuedEvent.<E, P>of(event)));
  }

  @Override
  public int enqueue(final E event, final P payload) throws StateMachineException {
    return enqueue(Collections.singletonList(QueuedEvent.of(event, payload)));
  }

  @Override
  public int process() throws StateMachineException {
    machineAlive();
    if (!processing.compareAndSet(false, true)) {
      throw new StateMachineException(Code.REENTRANT_PROCESSING,
          "State machine " + name + " is already processing a wave");
    }
    try {
      // freeze the current queue, anything emitted from here on goes to the next wave
      final List<QueuedEvent<E, P>> wave = eventQueue.drain();
      final int waveSize = wave.size();
      logTrace(machineId, name, "Processing wave of " + waveSize + " events");
      for (int iter = 0; iter < waveSize; iter++) {
        try {
          processEvent(wave.get(iter));
        } catch (StateMachineException problem) {
          if (config.getTrackStatistics()) {
            machineStats.waveFailures++;
          }
          logError(machineId, name, String.format(
              "Wave failed on event %d of %d in state %s, dropping %d unprocessed events",
              iter + 1, waveSize, currentState, waveSize - iter - 1), problem);
          throw problem;
        }
      }
      if (config.getTrackStatistics()) {
        machineStats.wavesProcessed++;
      }
      return waveSize;
    } finally {
      processing.set(false);
    }
  }

  @Override
  public int processAll() throws StateMachineException {
    machineAlive();
    if (processing.get()) {
      throw new StateMachineException(Code.REENTRANT_PROCESSING,
          "State machine " + name + " is already processing a wave");
    }
    int processed = 0;
    int waves = 0;
    while (eventQueue.pending()) {
      if (waves >= config.getMaxDrainWaves()) {
        throw new StateMachineException(Code.WAVE_LIMIT_EXCEEDED,
            String.format("State machine %s still holds %d events after %d waves", name,
                eventQueue.size(), waves));
      }
      processed += process();
      waves++;
    }
    return processed;
  }

  /**
   * Runs exit hook, transition handler and entry hook for one event. The first failure is thrown.
   */
  private void processEvent(final QueuedEvent<E, P> queuedEvent) throws StateMachineException {
    final S state = currentState;
    final E event = queuedEvent.getEvent();
    if (config.getTrackStatistics()) {
      machineStats.eventsProcessed++;
    }
    logTrace(machineId, name, "Processing event " + event + " in state " + state);

    final Optional<TransitionEntry<S, E, P, X>> lookedUp = transitionTable.lookup(state, event);
    if (!lookedUp.isPresent()) {
      throw StateMachineException.noTransition(event, state);
    }
    final TransitionEntry<S, E, P, X> transition = lookedUp.get();
    final S targetState = transition.getTargetState();
    final boolean leavingState = !targetState.equals(state);

    if (leavingState) {
      runEntryExit(event, state, state, Direction.EXIT);
    }

    TransitionResult<E, P> result;
    try {
      result = transition.getHandler().transition(extendedState, event, queuedEvent.getPayload());
    } catch (RuntimeException problem) {
      throw StateMachineException.internalError(event, state, problem);
    }
    applyResult(result, event, state);

    logTrace(machineId, name, String.format("Moving machine %s->%s via %s", state, targetState,
        transition.getName().orElse("unnamed transition")));
    currentState = targetState;
    if (config.getTrackStatistics()) {
      machineStats.transitionsApplied++;
    }

    if (leavingState) {
      runEntryExit(event, state, targetState, Direction.ENTER);
    }
  }

  /**
   * Play the entry or exit hook of hookState, if any. Errors are reported against the event and the
   * state the event was processed in.
   */
  private void runEntryExit(final E event, final S state, final S hookState,
      final Direction direction) throws StateMachineException {
    final Optional<EntryExitEntry<E, P, X>> hook = entryExitTable.lookup(hookState, direction);
    if (!hook.isPresent()) {
      return;
    }
    logTrace(machineId, name, String.format("Firing %s hook %s on %s", direction,
        hook.get().getName().orElse("unnamed"), hookState));
    TransitionResult<E, P> result;
    try {
      result = hook.get().getHandler().onEntryExit(extendedState);
    } catch (RuntimeException problem) {
      throw StateMachineException.internalError(event, state, problem);
    }
    if (config.getTrackStatistics()) {
      machineStats.hooksFired++;
    }
    applyResult(result, event, state);
  }

  private void applyResult(final TransitionResult<E, P> result, final E event, final S state)
      throws StateMachineException {
    if (result == null) {
      throw StateMachineException.transitionFailure(event, state);
    }
    if (!result.isSuccessful()) {
      if (result.getError() != null) {
        throw result.getError();
      }
      if (result.getApplicationError() != null) {
        throw StateMachineException.internalError(event, state, result.getApplicationError());
      }
      throw StateMachineException.transitionFailure(event, state);
    }
    if (result.getDescription() != null) {
      logTrace(machineId, name, "Handler for " + event + " in " + state + " reported: "
          + result.getDescription());
    }
    final List<QueuedEvent<E, P>> emitted = result.getEvents();
    if (!emitted.isEmpty()) {
      for (final QueuedEvent<E, P> queued : emitted) {
        if (queued == null || queued.getEvent() == null) {
          throw StateMachineException.transitionFailure(event, state);
        }
      }
      eventQueue.enqueue(emitted);
      logTrace(machineId, name, "Queued " + emitted.size() + " emitted events for the next wave");
    }
  }

  private void validateEvents(final List<QueuedEvent<E, P>> events) throws StateMachineException {
    for (final QueuedEvent<E, P> event : events) {
      if (event == null || event.getEvent() == null) {
        throw new StateMachineException(Code.INVALID_EVENT);
      }
    }
  }

  @Override
  public boolean pending() {
    return eventQueue.pending();
  }

  @Override
  public S getCurrentState() {
    return currentState;
  }

  @Override
  public X getExtendedState() throws StateMachineException {
    if (processing.get()) {
      throw new StateMachineException(Code.MACHINE_BUSY);
    }
    return extendedState;
  }

  @Override
  public StateMachineSnapshot<S, E> snapshot() {
    return new StateMachineSnapshot<>(name, initialState, transitionTable, entryExitTable);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public boolean alive() {
    return machineAlive.get();
  }

  @Override
  public boolean demolish() {
    if (!machineAlive.get()) {
      logInfo(machineId, name, "State machine is already demolished");
      return true;
    }
    if (processing.get()) {
      logWarning(machineId, name, "Cannot demolish state machine while a wave is running");
      return false;
    }
    logInfo(machineId, name, "Demolishing state machine");
    // 1. signal death
    machineAlive.set(false);

    // 2. drop outstanding events
    if (eventQueue.pending()) {
      logWarning(machineId, name, "Dropping " + eventQueue.size() + " pending events");
    }
    eventQueue.clear();

    // 3. print machine stats
    logInfo(machineId, name, machineStats.toString());

    // 4. clear transition tables
    transitionTable.clear();
    entryExitTable.clear();

    logInfo(machineId, name, "Successfully shut down state machine");
    return true;
  }

  private void machineAlive() throws StateMachineException {
    if (!machineAlive.get()) {
      throw new StateMachineException(Code.MACHINE_NOT_ALIVE,
          "State machine id:" + machineId + " is not alive");
    }
  }

  private void logRegistration(final boolean inserted, final String what) {
    if (inserted) {
      logTrace(machineId, name, "Registered " + what);
      return;
    }
    if (config.getTrackStatistics()) {
      machineStats.registrationOverwrites++;
    }
    if (config.getWarnOnOverwrite()) {
      logWarning(machineId, name, "Overwrote previously registered " + what);
    } else {
      logTrace(machineId, name, "Overwrote previously registered " + what);
    }
  }

  private static void logError(final String machineId, final String name, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("][n:").append(name)
        .append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String machineId, final String name,
      final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("][n:").append(name)
        .append("] ").append(message).toString());
  }

  private static void logInfo(final String machineId, final String name, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("][n:").append(name)
        .append("] ").append(message).toString());
  }

  private static void logDebug(final String machineId, final String name, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("][n:").append(name)
          .append("] ").append(message).toString());
    }
  }

  private static void logTrace(final String machineId, final String name, final String message) {
    if (logger.isTraceEnabled()) {
      logger.trace(new StringBuilder().append("[m:").append(machineId).append("][n:").append(name)
          .append("] ").append(message).toString());
    }
  }

}
