package com.scholary.chapters.progress;

/** Receives events for the session it subscribed to. */
@FunctionalInterface
public interface ProgressSubscriber {

  /**
   * Deliver one event.
   *
   * <p>Throwing removes this subscriber from the session; other subscribers are unaffected.
   *
   * @param event the event
   * @param sequence position of the event within its job's stream, starting at 1
   */
  void onEvent(ProgressEvent event, long sequence);
}
