package com.github.eventfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the result of running a TransitionHandler or an EntryExitHandler.
 * 
 * Typically, successes are encoded with {@link #successful} being set to true and may carry new
 * events to be appended to the back of the machine's queue. Failures are expected to report
 * {@link #isSuccessful()} as false and typically carry an associated {@link #error} or an
 * application specific {@link #applicationError}. {@link #description} is optional.
 * 
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult<E, P> {
  private final boolean successful;
  private final String description;
  private final List<QueuedEvent<E, P>> events;
  private final StateMachineException error;
  private final Object applicationError;

  private TransitionResult(final boolean successful, final String description,
      final List<QueuedEvent<E, P>> events, final StateMachineException error,
      final Object applicationError) {
    this.successful = successful;
    this.description = description;
    this.events = events;
    this.error = error;
    this.applicationError = applicationError;
  }

  public static <E, P> TransitionResult<E, P> success() {
    return new TransitionResult<>(true, null, Collections.emptyList(), null, null);
  }

  /**
   * Successful result that asks the machine to queue the given events for the next wave.
   */
  public static <E, P> TransitionResult<E, P> success(final List<QueuedEvent<E, P>> events) {
    final List<QueuedEvent<E, P>> copy = events == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(events));
    return new TransitionResult<>(true, null, copy, null, null);
  }

  /**
   * Successful result emitting a single payload-less event.
   */
  public static <E, P> TransitionResult<E, P> emit(final E event) {
    return success(Collections.singletonList(QueuedEvent.<E, P>of(event)));
  }

  public static <E, P> TransitionResult<E, P> emit(final E event, final P payload) {
    return success(Collections.singletonList(QueuedEvent.of(event, payload)));
  }

  /**
   * Failure without any further detail, reported as
   * {@link StateMachineException.Code#TRANSITION_FAILURE}.
   */
  public static <E, P> TransitionResult<E, P> failure() {
    return new TransitionResult<>(false, null, Collections.emptyList(), null, null);
  }

  /**
   * Failure carrying an engine error as is.
   */
  public static <E, P> TransitionResult<E, P> failure(final StateMachineException error) {
    return new TransitionResult<>(false, null, Collections.emptyList(), error, null);
  }

  /**
   * Failure carrying an application error. The machine reports it as
   * {@link StateMachineException.Code#INTERNAL_ERROR} for the event and state being processed.
   */
  public static <E, P> TransitionResult<E, P> internalError(final Object applicationError) {
    return new TransitionResult<>(false, null, Collections.emptyList(), null, applicationError);
  }

  public TransitionResult<E, P> describedAs(final String description) {
    return new TransitionResult<>(successful, description, events, error, applicationError);
  }

  public boolean isSuccessful() {
    return successful;
  }

  public String getDescription() {
    return description;
  }

  public List<QueuedEvent<E, P>> getEvents() {
    return events;
  }

  public StateMachineException getError() {
    return error;
  }

  public Object getApplicationError() {
    return applicationError;
  }

  @Override
  public String toString() {
    return "TransitionResult [successful=" + successful + ", description=" + description
        + ", events=" + events + ", error=" + error + ", applicationError=" + applicationError
        + "]";
  }
}
