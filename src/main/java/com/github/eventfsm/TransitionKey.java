package com.github.eventfsm;

import java.util.Objects;

/**
 * Describes where a transition originates: the state the machine is in and the event occurring.
 */
public final class TransitionKey<S, E> {
  private final S state;
  private final E event;

  private TransitionKey(final S state, final E event) {
    this.state = state;
    this.event = event;
  }

  public static <S, E> TransitionKey<S, E> of(final S state, final E event) {
    return new TransitionKey<>(state, event);
  }

  public S getState() {
    return state;
  }

  public E getEvent() {
    return event;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionKey)) {
      return false;
    }
    TransitionKey<?, ?> key = (TransitionKey<?, ?>) o;
    return Objects.equals(state, key.state) && Objects.equals(event, key.event);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, event);
  }

  @Override
  public String toString() {
    return "TransitionKey [state=" + state + ", event=" + event + "]";
  }
}
