package com.github.eventfsm;

import java.util.Optional;

/**
 * Target of a transition: the state resulting after a successful handler run, the handler itself
 * and an optional name, helpful if the handler is a lambda.
 */
public final class TransitionEntry<S, E, P, X> {
  private final S targetState;
  private final TransitionHandler<E, P, X> handler;
  private final Optional<String> name;

  TransitionEntry(final S targetState, final TransitionHandler<E, P, X> handler,
      final Optional<String> name) {
    this.targetState = targetState;
    this.handler = handler;
    this.name = name;
  }

  public S getTargetState() {
    return targetState;
  }

  public TransitionHandler<E, P, X> getHandler() {
    return handler;
  }

  public Optional<String> getName() {
    return name;
  }

  @Override
  public String toString() {
    return "TransitionEntry [targetState=" + targetState + ", name=" + name.orElse("") + "]";
  }
}
