package com.github.eventfsm;

import java.util.Optional;

public final class EntryExitEntry<E, P, X> {
  private final EntryExitHandler<E, P, X> handler;
  private final Optional<String> name;

  EntryExitEntry(final EntryExitHandler<E, P, X> handler, final Optional<String> name) {
    this.handler = handler;
    this.name = name;
  }

  public EntryExitHandler<E, P, X> getHandler() {
    return handler;
  }

  public Optional<String> getName() {
    return name;
  }

  @Override
  public String toString() {
    return "EntryExitEntry [name=" + name.orElse("") + "]";
  }
}
