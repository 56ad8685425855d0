package com.github.eventfsm;

import java.util.List;
import java.util.Optional;

/**
 * An evented Finite State Machine carrying a single piece of mutable extended state. The state
 * space (S), the events (E), the per-event payload (P) and the extended state (X) are all defined
 * by the application.
 * 
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 * 
 * 1. this FSM instance is NOT thread-safe. If several threads drive the same machine, the caller has
 * to serialize every call (enqueue, process, reads) with its own lock<br>
 * 
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * state machines, just create as many as needed. Machines share nothing with each other<br>
 * 
 * 3. events are only ever queued by {@link #enqueue(List)}; nothing runs until {@link #process()}
 * is called. Each process() call takes the current queue as one wave. Events emitted by handlers
 * while a wave runs are queued for the next wave, so callers should keep calling process() while
 * {@link #pending()} is true and not rely on the state the machine is in until the queue is
 * drained<br>
 * 
 * 4. the first failure within a wave stops the wave. Events of that wave that were not processed yet
 * are dropped, nothing is rolled back, and the machine must be shut down by its owner<br>
 * 
 * 5. exit hooks of the current state run before the transition handler and entry hooks of the target
 * state run after it. Neither runs for a transition back into the same state<br>
 * 
 * @author gaurav
 */
public interface EventedStateMachine<S, E, P, X> {

  ///// Registration API /////
  /**
   * Register a transition from state on event to targetState running the given handler.
   * 
   * Returns true if the (state, event) pair was unused and false if a previous transition got
   * overwritten. Overwrites are legal but usually point at a configuration mistake.
   */
  boolean registerTransition(final S state, final E event, final S targetState,
      final TransitionHandler<E, P, X> handler, final Optional<String> name);

  boolean registerTransition(final S state, final E event, final S targetState,
      final TransitionHandler<E, P, X> handler);

  /**
   * Register a hook run right after a transition moves the machine into state. Same overwrite
   * reporting as {@link #registerTransition(Object, Object, Object, TransitionHandler, Optional)}.
   */
  boolean registerEntryHook(final S state, final EntryExitHandler<E, P, X> handler,
      final Optional<String> name);

  boolean registerEntryHook(final S state, final EntryExitHandler<E, P, X> handler);

  /**
   * Register a hook run right before a transition moves the machine out of state.
   */
  boolean registerExitHook(final S state, final EntryExitHandler<E, P, X> handler,
      final Optional<String> name);

  boolean registerExitHook(final S state, final EntryExitHandler<E, P, X> handler);


  ///// Event API /////
  /**
   * Append events to the back of the queue in the given order. Events are _not_ processed.
   * 
   * Returns the number of events queued.
   */
  int enqueue(final List<QueuedEvent<E, P>> events) throws StateMachineException;

  int enqueue(final E event) throws StateMachineException;

  int enqueue(final E event, final P payload) throws StateMachineException;

  /**
   * Process one wave: every event queued at the time of the call, in order. Events queued while the
   * wave runs are left for the next call.
   * 
   * Returns the number of events captured into the wave. Throws the first error hit by the wave, at
   * which point the machine must be shut down.
   */
  int process() throws StateMachineException;

  /**
   * Keep processing waves until no events are pending. Returns the total of all wave sizes.
   */
  int processAll() throws StateMachineException;

  /**
   * Check whether events are waiting to be processed.
   */
  boolean pending();


  ///// Inspection API /////
  /**
   * Read/report the current state of the state machine.
   */
  S getCurrentState();

  /**
   * Read-only peek at the extended state from outside of handlers. Callers must not modify it or
   * hold on to it across a process() call. Not available while a wave is running.
   */
  X getExtendedState() throws StateMachineException;

  /**
   * Copy of the registered transitions and hooks, e.g. for {@link DotExporter}.
   */
  StateMachineSnapshot<S, E> snapshot();

  /**
   * Reports the name this machine was built with.
   */
  String getName();

  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  /**
   * Returns the config that this fsm is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this FSM
   */
  StateMachineStatistics getStatistics();

  /**
   * Check if the state machine is alive.
   */
  boolean alive();

  /**
   * Shutdown the state machine and clear its queue and tables.
   */
  boolean demolish();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class EventedStateMachineBuilder<S, E, P, X> {
    private StateMachineConfiguration config;
    private String name;
    private S initialState;
    private X extendedState;

    public static <S, E, P, X> EventedStateMachineBuilder<S, E, P, X> newBuilder() {
      return new EventedStateMachineBuilder<>();
    }

    public EventedStateMachineBuilder<S, E, P, X> config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public EventedStateMachineBuilder<S, E, P, X> name(final String name) {
      this.name = name;
      return this;
    }

    public EventedStateMachineBuilder<S, E, P, X> initialState(final S initialState) {
      this.initialState = initialState;
      return this;
    }

    public EventedStateMachineBuilder<S, E, P, X> extendedState(final X extendedState) {
      this.extendedState = extendedState;
      return this;
    }

    public EventedStateMachine<S, E, P, X> build() throws StateMachineException {
      StringBuilder messages = new StringBuilder();
      if (name == null || name.trim().isEmpty()) {
        messages.append("Name cannot be null or empty. ");
      }
      if (initialState == null) {
        messages.append("Initial state cannot be null. ");
      }
      if (extendedState == null) {
        messages.append("Extended state cannot be null. ");
      }
      if (messages.length() > 0) {
        throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
            messages.toString());
      }
      return new EventedStateMachineImpl<>(name, initialState, extendedState,
          config != null ? config : StateMachineConfiguration.defaults());
    }

    private EventedStateMachineBuilder() {}
  }

}
