package com.github.eventfsm;

/**
 * Hook run when the machine enters or leaves a state. Hooks only see the extended state; they may
 * emit events or fail just like transition handlers.
 */
@FunctionalInterface
public interface EntryExitHandler<E, P, X> {

  TransitionResult<E, P> onEntryExit(final X extendedState);

}
