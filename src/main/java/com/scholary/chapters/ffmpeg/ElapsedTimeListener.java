package com.scholary.chapters.ffmpeg;

import java.time.Duration;

/** Receives the amount of media already written by a running concatenation. */
@FunctionalInterface
public interface ElapsedTimeListener {

  ElapsedTimeListener NONE = elapsed -> {};

  /**
   * Called with a non-decreasing elapsed media time.
   *
   * @param elapsed media time processed so far
   */
  void onElapsed(Duration elapsed);
}
