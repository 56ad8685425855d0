package com.github.eventfsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FIFO of events waiting to be processed by the owning machine.
 */
public final class EventQueue<E, P> {
  private final Deque<QueuedEvent<E, P>> events = new ArrayDeque<>();

  /**
   * Append the events at the back in the given order. Nothing gets processed.
   */
  public int enqueue(final List<QueuedEvent<E, P>> newEvents) {
    for (final QueuedEvent<E, P> event : newEvents) {
      events.addLast(event);
    }
    return newEvents.size();
  }

  /**
   * Remove every queued event and hand them back in arrival order, leaving this queue empty. The
   * returned list is the wave for one processing call.
   */
  public List<QueuedEvent<E, P>> drain() {
    final List<QueuedEvent<E, P>> wave = new ArrayList<>(events);
    events.clear();
    return wave;
  }

  public boolean pending() {
    return !events.isEmpty();
  }

  public int size() {
    return events.size();
  }

  void clear() {
    events.clear();
  }

  @Override
  public String toString() {
    return "EventQueue " + events;
  }
}
