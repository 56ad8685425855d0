package com.github.eventfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only copy of a machine's tables, detached from the machine that produced it. Later
 * registrations on the machine are not reflected here.
 */
public final class StateMachineSnapshot<S, E> {
  private final String machineName;
  private final S initialState;
  private final List<TransitionView<S, E>> transitions;
  private final List<HookView<S>> hooks;

  <P, X> StateMachineSnapshot(final String machineName, final S initialState,
      final TransitionTable<S, E, P, X> transitionTable,
      final EntryExitTable<S, E, P, X> entryExitTable) {
    this.machineName = machineName;
    this.initialState = initialState;
    final List<TransitionView<S, E>> transitionViews = new ArrayList<>();
    for (final Map.Entry<TransitionKey<S, E>, TransitionEntry<S, E, P, X>> entry : transitionTable
        .entries().entrySet()) {
      transitionViews.add(new TransitionView<>(entry.getKey().getState(), entry.getKey().getEvent(),
          entry.getValue().getTargetState(), entry.getValue().getName()));
    }
    this.transitions = Collections.unmodifiableList(transitionViews);
    final List<HookView<S>> hookViews = new ArrayList<>();
    for (final Map.Entry<EntryExitKey<S>, EntryExitEntry<E, P, X>> entry : entryExitTable
        .entries().entrySet()) {
      hookViews.add(new HookView<>(entry.getKey().getState(), entry.getKey().getDirection(),
          entry.getValue().getName()));
    }
    this.hooks = Collections.unmodifiableList(hookViews);
  }

  public String getMachineName() {
    return machineName;
  }

  public S getInitialState() {
    return initialState;
  }

  public List<TransitionView<S, E>> getTransitions() {
    return transitions;
  }

  public List<HookView<S>> getHooks() {
    return hooks;
  }

  public boolean hasHook(final S state, final Direction direction) {
    for (final HookView<S> hook : hooks) {
      if (hook.getState().equals(state) && hook.getDirection() == direction) {
        return true;
      }
    }
    return false;
  }

  public final static class TransitionView<S, E> {
    private final S state;
    private final E event;
    private final S targetState;
    private final Optional<String> name;

    private TransitionView(final S state, final E event, final S targetState,
        final Optional<String> name) {
      this.state = state;
      this.event = event;
      this.targetState = targetState;
      this.name = name;
    }

    public S getState() {
      return state;
    }

    public E getEvent() {
      return event;
    }

    public S getTargetState() {
      return targetState;
    }

    public Optional<String> getName() {
      return name;
    }

    @Override
    public String toString() {
      return "TransitionView [" + state + " --" + event + "--> " + targetState + ", name="
          + name.orElse("") + "]";
    }
  }

  public final static class HookView<S> {
    private final S state;
    private final Direction direction;
    private final Optional<String> name;

    private HookView(final S state, final Direction direction, final Optional<String> name) {
      this.state = state;
      this.direction = direction;
      this.name = name;
    }

    public S getState() {
      return state;
    }

    public Direction getDirection() {
      return direction;
    }

    public Optional<String> getName() {
      return name;
    }

    @Override
    public String toString() {
      return "HookView [state=" + state + ", direction=" + direction + ", name=" + name.orElse("")
          + "]";
    }
  }

}
