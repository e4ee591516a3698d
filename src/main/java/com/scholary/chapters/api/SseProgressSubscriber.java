package com.scholary.chapters.api;

import com.scholary.chapters.progress.ProgressEvent;
import com.scholary.chapters.progress.ProgressSubscriber;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Forwards job events to one Server-Sent Events connection.
 *
 * <p>Each event is sent under its channel name ({@code job-progress}, {@code job-complete} or
 * {@code job-error}) with id {@code <jobId>:<sequence>} and the event record as JSON data.
 */
class SseProgressSubscriber implements ProgressSubscriber {

  private final SseEmitter emitter;

  SseProgressSubscriber(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public void onEvent(ProgressEvent event, long sequence) {
    try {
      emitter.send(
          SseEmitter.event()
              .id(event.jobId() + ":" + sequence)
              .name(event.eventName())
              .data(event, MediaType.APPLICATION_JSON));
    } catch (IOException e) {
      // Client went away; the notifier drops this subscriber
      throw new UncheckedIOException("Event stream closed", e);
    }
  }
}
