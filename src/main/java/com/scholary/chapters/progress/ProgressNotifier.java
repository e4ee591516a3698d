package com.scholary.chapters.progress;

/**
 * Session-scoped fan-out of job events.
 *
 * <p>Guarantees:
 *
 * <ul>
 *   <li>Every subscriber of a session receives events published for that session
 *   <li>No replay: subscribers only see events published after they joined
 *   <li>Per group of a session, events are delivered in order; a progress update never follows a
 *       higher one or a terminal event of the same job
 *   <li>A group's events come from one job at a time; a new job's events start only after the
 *       previous job's terminal event
 *   <li>No ordering across different groups
 * </ul>
 */
public interface ProgressNotifier {

  void publish(String sessionId, ProgressEvent event);

  Subscription subscribe(String sessionId, ProgressSubscriber subscriber);

  int subscriberCount(String sessionId);

  /** Handle for leaving a session. Closing twice is harmless. */
  @FunctionalInterface
  interface Subscription extends AutoCloseable {

    @Override
    void close();
  }
}
