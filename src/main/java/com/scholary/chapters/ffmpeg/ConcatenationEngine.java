package com.scholary.chapters.ffmpeg;

import java.nio.file.Path;
import java.util.List;

/**
 * Joins media files losslessly, in order, into one output.
 *
 * <p>Implementations never re-encode and never reorder: the output streams are the input streams
 * one after another, with only timestamp correction applied at the joins.
 */
public interface ConcatenationEngine {

  /**
   * Concatenate the inputs into the output path.
   *
   * @param orderedInputs inputs in playback order
   * @param output destination file; its parent directory must exist
   * @param listener receives elapsed media time while the join runs
   * @throws ConcatenationException if the join could not be started or did not succeed
   */
  void concatenate(List<Path> orderedInputs, Path output, ElapsedTimeListener listener);
}
