package com.github.eventfsm;

import java.util.Objects;
import java.util.Optional;

/**
 * An event instance waiting in the machine's queue together with its optional payload. The payload
 * belongs to this event instance and is handed over to the transition handler that consumes it.
 */
public final class QueuedEvent<E, P> {
  private final E event;
  private final Optional<P> payload;

  private QueuedEvent(final E event, final Optional<P> payload) {
    this.event = event;
    this.payload = payload;
  }

  public static <E, P> QueuedEvent<E, P> of(final E event) {
    return new QueuedEvent<>(event, Optional.empty());
  }

  public static <E, P> QueuedEvent<E, P> of(final E event, final P payload) {
    return new QueuedEvent<>(event, Optional.ofNullable(payload));
  }

  public E getEvent() {
    return event;
  }

  public Optional<P> getPayload() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueuedEvent)) {
      return false;
    }
    QueuedEvent<?, ?> other = (QueuedEvent<?, ?>) o;
    return Objects.equals(event, other.event) && Objects.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(event, payload);
  }

  @Override
  public String toString() {
    return "QueuedEvent [event=" + event + ", payload=" + payload + "]";
  }
}
