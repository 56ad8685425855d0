package com.github.eventfsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map of (state, direction) to hook. Same overwrite semantics as {@link TransitionTable}.
 */
public final class EntryExitTable<S, E, P, X> {
  private final Map<EntryExitKey<S>, EntryExitEntry<E, P, X>> hooks = new LinkedHashMap<>();

  public boolean register(final S state, final Direction direction,
      final EntryExitHandler<E, P, X> handler, final Optional<String> name) {
    if (state == null || direction == null || handler == null) {
      throw new IllegalArgumentException(
          "state, direction and handler are required to register an entry/exit hook");
    }
    final EntryExitEntry<E, P, X> previous = hooks.put(EntryExitKey.of(state, direction),
        new EntryExitEntry<>(handler, name == null ? Optional.empty() : name));
    return previous == null;
  }

  public Optional<EntryExitEntry<E, P, X>> lookup(final S state, final Direction direction) {
    return Optional.ofNullable(hooks.get(EntryExitKey.of(state, direction)));
  }

  public int size() {
    return hooks.size();
  }

  Map<EntryExitKey<S>, EntryExitEntry<E, P, X>> entries() {
    return Collections.unmodifiableMap(hooks);
  }

  void clear() {
    hooks.clear();
  }

  @Override
  public String toString() {
    return "EntryExitTable " + hooks;
  }
}
