package com.github.eventfsm;

/**
 * Unified single exception that's thrown and handled by this FSM. The idea is to use the code enum
 * to encapsulate various error/exception conditions. That said, stack traces, where available and
 * desired, are not meant to be kept from users.
 * 
 * Engine errors raised while processing an event carry the event and the state the event was looked
 * up in. {@link Code#INTERNAL_ERROR} additionally carries the application's own error value, which
 * is opaque to the machine.
 * 
 * Any of {@link Code#NO_TRANSITION}, {@link Code#INTERNAL_ERROR} or
 * {@link Code#TRANSITION_FAILURE} coming out of {@link EventedStateMachine#process()} means the
 * machine must be shut down by its owner.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final transient Object event;
  private final transient Object state;
  private final transient Object applicationError;

  public StateMachineException(final Code code) {
    this(code, code.getDescription());
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.event = null;
    this.state = null;
    this.applicationError = null;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
    this.event = null;
    this.state = null;
    this.applicationError = null;
  }

  private StateMachineException(final Code code, final Object event, final Object state,
      final Object applicationError) {
    super(code.getDescription() + " [event=" + event + ", state=" + state
        + (applicationError != null ? ", error=" + applicationError : "") + "]",
        applicationError instanceof Throwable ? (Throwable) applicationError : null);
    this.code = code;
    this.event = event;
    this.state = state;
    this.applicationError = applicationError;
  }

  /**
   * No transition is registered for the event in the given state.
   */
  public static StateMachineException noTransition(final Object event, final Object state) {
    return new StateMachineException(Code.NO_TRANSITION, event, state, null);
  }

  /**
   * A transition handler or hook reported an application specific failure.
   */
  public static StateMachineException internalError(final Object event, final Object state,
      final Object applicationError) {
    return new StateMachineException(Code.INTERNAL_ERROR, event, state, applicationError);
  }

  public static StateMachineException transitionFailure(final Object event, final Object state) {
    return new StateMachineException(Code.TRANSITION_FAILURE, event, state, null);
  }

  public Code getCode() {
    return code;
  }

  public Object getEvent() {
    return event;
  }

  public Object getState() {
    return state;
  }

  public Object getApplicationError() {
    return applicationError;
  }

  public static enum Code {
    // 1.
    NO_TRANSITION("No transition is registered for the event in the current state"),
    // 2.
    INTERNAL_ERROR("Transition or entry/exit handler reported an application failure"),
    // 3.
    TRANSITION_FAILURE(
        "Failed to transition to desired state. Check exception stacktrace for more details of the failure."),
    // 4.
    INVALID_EVENT("Null event is invalid"),
    // 5.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 6.
    MACHINE_NOT_ALIVE("State machine is not running and cannot service requests"),
    // 7.
    MACHINE_BUSY("State machine is processing events, extended state is not accessible"),
    // 8.
    REENTRANT_PROCESSING("Event processing cannot be started from within a handler"),
    // 9.
    WAVE_LIMIT_EXCEEDED("Event queue did not drain within the configured number of waves");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
