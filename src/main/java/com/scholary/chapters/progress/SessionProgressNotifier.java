package com.scholary.chapters.progress;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.chapters.progress.ProgressEvent.JobProgress;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process implementation of ProgressNotifier.
 *
 * <p>Keeps a session to subscriber-set mapping plus one small stream state per group of a session:
 * the job currently owning the group, a sequence counter, the highest progress seen and whether a
 * terminal event went out. Publishing for a group happens under that stream's lock, so concurrent
 * publishers cannot interleave and out-of-order updates are dropped instead of delivered.
 *
 * <p>A group is owned by one job at a time. Once that job's terminal event is out, the first event
 * of a new job for the group starts a fresh progress run; events of any other job, including the
 * finished ones, are dropped.
 *
 * <p>Stream states expire an hour after their last use; a group that finished long ago has nothing
 * left to order.
 */
@Component
public class SessionProgressNotifier implements ProgressNotifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionProgressNotifier.class);

  private final ConcurrentMap<String, Set<ProgressSubscriber>> subscribers =
      new ConcurrentHashMap<>();
  private final Cache<StreamKey, GroupStream> streams =
      Caffeine.newBuilder().expireAfterAccess(Duration.ofHours(1)).build();

  @Override
  public void publish(String sessionId, ProgressEvent event) {
    GroupStream stream =
        streams.get(new StreamKey(sessionId, event.groupId()), key -> new GroupStream());

    synchronized (stream) {
      long sequence = stream.admit(event);
      if (sequence < 0) {
        LOGGER.debug(
            "Dropped out-of-order {} for job {} of group {} (owner {}, last progress {}, "
                + "terminal {})",
            event.eventName(),
            event.jobId(),
            event.groupId(),
            stream.jobId,
            stream.lastProgress,
            stream.terminal);
        return;
      }
      deliver(sessionId, event, sequence);
    }
  }

  private void deliver(String sessionId, ProgressEvent event, long sequence) {
    Set<ProgressSubscriber> sessionSubscribers = subscribers.get(sessionId);
    if (sessionSubscribers == null || sessionSubscribers.isEmpty()) {
      return;
    }

    for (ProgressSubscriber subscriber : sessionSubscribers) {
      try {
        subscriber.onEvent(event, sequence);
      } catch (RuntimeException e) {
        LOGGER.debug(
            "Removing subscriber of session {} after delivery failure: {}",
            sessionId,
            e.getMessage());
        unsubscribe(sessionId, subscriber);
      }
    }
  }

  @Override
  public Subscription subscribe(String sessionId, ProgressSubscriber subscriber) {
    subscribers.compute(
        sessionId,
        (id, set) -> {
          Set<ProgressSubscriber> updated = set == null ? new CopyOnWriteArraySet<>() : set;
          updated.add(subscriber);
          return updated;
        });
    LOGGER.info("Subscriber joined session {}", sessionId);
    return () -> unsubscribe(sessionId, subscriber);
  }

  @Override
  public int subscriberCount(String sessionId) {
    Set<ProgressSubscriber> sessionSubscribers = subscribers.get(sessionId);
    return sessionSubscribers == null ? 0 : sessionSubscribers.size();
  }

  private void unsubscribe(String sessionId, ProgressSubscriber subscriber) {
    subscribers.computeIfPresent(
        sessionId,
        (id, set) -> {
          set.remove(subscriber);
          return set.isEmpty() ? null : set;
        });
  }

  private record StreamKey(String sessionId, String groupId) {}

  /** Ordering state of one group's events. Guarded by its own monitor. */
  private static final class GroupStream {
    private final Set<String> finishedJobs = new HashSet<>();
    private String jobId;
    private long sequence;
    private int lastProgress = -1;
    private boolean terminal;

    /**
     * @return the sequence number assigned to the event, or -1 if it must be dropped
     */
    long admit(ProgressEvent event) {
      if (!event.jobId().equals(jobId)) {
        if (finishedJobs.contains(event.jobId()) || (jobId != null && !terminal)) {
          return -1;
        }
        if (jobId != null) {
          finishedJobs.add(jobId);
        }
        jobId = event.jobId();
        lastProgress = -1;
        terminal = false;
      }
      if (terminal) {
        return -1;
      }
      if (event instanceof JobProgress) {
        int progress = ((JobProgress) event).progress();
        if (progress < lastProgress) {
          return -1;
        }
        lastProgress = progress;
      }
      if (event.isTerminal()) {
        terminal = true;
      }
      return ++sequence;
    }
  }
}
