package com.github.eventfsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map of (state, event) to (target state, handler). At most one entry exists per key; registering
 * over an existing key replaces it and reports the overwrite to the caller.
 * 
 * Not thread-safe, the owning machine serializes access.
 */
public final class TransitionTable<S, E, P, X> {
  // insertion ordered so that snapshots and dot output are stable
  private final Map<TransitionKey<S, E>, TransitionEntry<S, E, P, X>> transitions =
      new LinkedHashMap<>();

  /**
   * Returns true if the (state, event) slot was empty, false if a previous entry was overwritten.
   */
  public boolean register(final S state, final E event, final S targetState,
      final TransitionHandler<E, P, X> handler, final Optional<String> name) {
    if (state == null || event == null || targetState == null || handler == null) {
      throw new IllegalArgumentException(
          "state, event, targetState and handler are required to register a transition");
    }
    final TransitionEntry<S, E, P, X> previous = transitions.put(TransitionKey.of(state, event),
        new TransitionEntry<>(targetState, handler, name == null ? Optional.empty() : name));
    return previous == null;
  }

  public Optional<TransitionEntry<S, E, P, X>> lookup(final S state, final E event) {
    return Optional.ofNullable(transitions.get(TransitionKey.of(state, event)));
  }

  public int size() {
    return transitions.size();
  }

  Map<TransitionKey<S, E>, TransitionEntry<S, E, P, X>> entries() {
    return Collections.unmodifiableMap(transitions);
  }

  void clear() {
    transitions.clear();
  }

  @Override
  public String toString() {
    return "TransitionTable " + transitions;
  }
}
