package com.scholary.chapters.ffmpeg;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the elapsed media time from ffmpeg status output.
 *
 * <p>ffmpeg reports progress on stderr as lines like:
 *
 * <pre>
 * frame= 1234 fps=412 q=-1.0 size=  204800kB time=00:01:23.45 bitrate=20098.1kbits/s speed=13.7x
 * </pre>
 *
 * <p>This is the only place that knows the text format. Everything downstream depends on the
 * {@link Duration} it returns.
 */
public final class FfmpegProgressParser {

  // time=HH:MM:SS.xx, time=N/A is skipped, negative times appear briefly at stream start
  private static final Pattern TIME_PATTERN =
      Pattern.compile("time=(-?)(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");

  private FfmpegProgressParser() {}

  /**
   * Parse the last {@code time=} marker on a line.
   *
   * @param line one stderr line
   * @return the elapsed time, or empty if the line carries no usable marker
   */
  public static Optional<Duration> parseElapsed(String line) {
    if (line == null || !line.contains("time=")) {
      return Optional.empty();
    }

    Matcher matcher = TIME_PATTERN.matcher(line);
    Duration last = null;
    while (matcher.find()) {
      if (!matcher.group(1).isEmpty()) {
        last = Duration.ZERO;
        continue;
      }
      long hours = Long.parseLong(matcher.group(2));
      long minutes = Long.parseLong(matcher.group(3));
      double seconds = Double.parseDouble(matcher.group(4));
      last =
          Duration.ofHours(hours)
              .plusMinutes(minutes)
              .plusMillis(Math.round(seconds * 1000.0));
    }
    return Optional.ofNullable(last);
  }

  /** Format a duration the way ffmpeg prints it, e.g. {@code 00:01:23.45}. */
  public static String format(Duration elapsed) {
    long totalCentis = elapsed.toMillis() / 10;
    long hours = totalCentis / 360_000;
    long minutes = (totalCentis / 6_000) % 60;
    long seconds = (totalCentis / 100) % 60;
    long centis = totalCentis % 100;
    return String.format("%02d:%02d:%02d.%02d", hours, minutes, seconds, centis);
  }
}
