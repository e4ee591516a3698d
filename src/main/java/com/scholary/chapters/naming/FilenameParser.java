package com.scholary.chapters.naming;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses chapter filenames written by the camera.
 *
 * <p>Grammar: {@code G<encoding><chapter:2 digits><sequence:4 digits>.<ext>}, for example {@code
 * GX010150.MP4} is chapter 1 of HEVC sequence 150. Matching is case-insensitive and anchored to
 * the whole name.
 */
@Component
public class FilenameParser {

  private static final Pattern CHAPTER_NAME =
      Pattern.compile("^G([HX])(\\d{2})(\\d{4})\\.(MP4|LRV|THM)$", Pattern.CASE_INSENSITIVE);

  /**
   * Parse a raw filename.
   *
   * @param name the filename, without directories
   * @return the parsed descriptor, or {@link ParsedName#UNRECOGNIZED}
   */
  public ParsedName parse(String name) {
    if (name == null || name.isBlank()) {
      return ParsedName.UNRECOGNIZED;
    }

    Matcher matcher = CHAPTER_NAME.matcher(name);
    if (!matcher.matches()) {
      return ParsedName.UNRECOGNIZED;
    }

    int chapter = Integer.parseInt(matcher.group(2));
    if (chapter < 1) {
      // Cameras number chapters from 01
      return ParsedName.UNRECOGNIZED;
    }

    return MediaExtension.fromSuffix(matcher.group(4))
        .map(
            extension ->
                ParsedName.of(
                    Encoding.fromLetter(matcher.group(1)),
                    chapter,
                    Integer.parseInt(matcher.group(3)),
                    extension))
        .orElse(ParsedName.UNRECOGNIZED);
  }
}
