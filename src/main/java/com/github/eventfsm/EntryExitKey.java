package com.github.eventfsm;

import java.util.Objects;

public final class EntryExitKey<S> {
  private final S state;
  private final Direction direction;

  private EntryExitKey(final S state, final Direction direction) {
    this.state = state;
    this.direction = direction;
  }

  public static <S> EntryExitKey<S> of(final S state, final Direction direction) {
    return new EntryExitKey<>(state, direction);
  }

  public S getState() {
    return state;
  }

  public Direction getDirection() {
    return direction;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EntryExitKey)) {
      return false;
    }
    EntryExitKey<?> key = (EntryExitKey<?>) o;
    return Objects.equals(state, key.state) && direction == key.direction;
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, direction);
  }

  @Override
  public String toString() {
    return "EntryExitKey [state=" + state + ", direction=" + direction + "]";
  }
}
