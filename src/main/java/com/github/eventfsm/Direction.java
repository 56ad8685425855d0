package com.github.eventfsm;

/**
 * This represents the side of a state change that an entry/exit hook is bound to.
 */
public enum Direction {
  // fires right after a transition moves the machine into the state
  ENTER,
  // fires right before a transition moves the machine out of the state
  EXIT;
}
