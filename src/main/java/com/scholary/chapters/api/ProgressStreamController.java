package com.scholary.chapters.api;

import com.scholary.chapters.progress.ProgressNotifier;
import com.scholary.chapters.progress.ProgressNotifier.Subscription;
import com.scholary.chapters.storage.StorageLayout;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Realtime job events of a session over Server-Sent Events.
 *
 * <p>Only events published after the client connects are delivered. Clients that reconnect should
 * fetch {@code /api/sessions/{sessionId}/jobs} to catch up.
 */
@RestController
@Tag(name = "Events", description = "Realtime job progress")
public class ProgressStreamController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressStreamController.class);

  private final ProgressNotifier notifier;
  private final long streamTimeoutMs;

  public ProgressStreamController(
      ProgressNotifier notifier, @Value("${merger.eventStreamTimeoutMs}") long streamTimeoutMs) {
    this.notifier = notifier;
    this.streamTimeoutMs = streamTimeoutMs;
  }

  @GetMapping(
      path = "/api/sessions/{sessionId}/events",
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(
      summary = "Subscribe to session events",
      description = "Stream job-progress, job-complete and job-error events for a session")
  public SseEmitter subscribe(@PathVariable String sessionId) {
    StorageLayout.requireValidSessionId(sessionId);

    SseEmitter emitter = new SseEmitter(streamTimeoutMs);
    Subscription subscription = notifier.subscribe(sessionId, new SseProgressSubscriber(emitter));

    emitter.onCompletion(subscription::close);
    emitter.onTimeout(
        () -> {
          subscription.close();
          emitter.complete();
        });
    emitter.onError(error -> subscription.close());

    LOGGER.debug(
        "Event stream opened for session {} ({} subscribers)",
        sessionId,
        notifier.subscriberCount(sessionId));
    return emitter;
  }
}
