package com.github.eventfsm;

import java.util.Optional;

/**
 * Application code bound to a (state, event) pair of the transition table.
 * 
 * The contract of transition() is quite simple - implementors should do their thing and encode the
 * outcome in the TransitionResult returned from it. The handler gets exclusive access to the
 * extended state for the duration of the call and must not hold on to it afterwards. The target
 * state is fixed at registration time, the handler cannot change it.
 */
@FunctionalInterface
public interface TransitionHandler<E, P, X> {

  TransitionResult<E, P> transition(final X extendedState, final E event,
      final Optional<P> payload);

}
