package com.scholary.chapters.grouping;

import com.scholary.chapters.naming.Encoding;
import com.scholary.chapters.naming.FilenameParser;
import com.scholary.chapters.naming.ParsedName;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconstructs recording sequences from a batch of uploaded files.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Parse every filename
 *   <li>Drop unrecognized names and anything that is not a VIDEO file (proxies and thumbnails
 *       belong to the sequence conceptually but are never concatenated)
 *   <li>Bucket by {@code (encoding, sequence)}, keeping first-seen order of the buckets
 *   <li>Sort each bucket by chapter number
 * </ol>
 *
 * <p>Output order follows the input order, so the same batch always produces the same groups.
 */
@Component
public class SequenceGrouper {

  private static final Logger LOGGER = LoggerFactory.getLogger(SequenceGrouper.class);

  private final FilenameParser parser;

  public SequenceGrouper(FilenameParser parser) {
    this.parser = parser;
  }

  /**
   * Group a batch of files into chapter sequences.
   *
   * @param files the uploaded files, in upload order
   * @return zero or more groups; zero is a normal outcome when nothing matches the naming scheme
   * @throws DuplicateChapterException if two files claim the same chapter of a sequence
   */
  public List<SequenceGroup> group(List<FileDescriptor> files) {
    Map<SequenceKey, List<Chapter>> buckets = new LinkedHashMap<>();
    int skipped = 0;

    for (FileDescriptor file : files) {
      ParsedName parsed = parser.parse(file.originalName());
      if (!parsed.isVideo()) {
        skipped++;
        continue;
      }
      buckets
          .computeIfAbsent(
              new SequenceKey(parsed.encoding(), parsed.sequenceNumber()), k -> new ArrayList<>())
          .add(new Chapter(parsed.chapterNumber(), file));
    }

    List<SequenceGroup> groups = new ArrayList<>(buckets.size());
    for (Map.Entry<SequenceKey, List<Chapter>> entry : buckets.entrySet()) {
      SequenceKey key = entry.getKey();
      String groupId = SequenceGroup.idFor(key.encoding(), key.sequenceNumber());

      List<Chapter> chapters = entry.getValue();
      // Stable sort: duplicates stay in upload order, which makes the error message deterministic
      chapters.sort(Comparator.comparingInt(Chapter::chapterNumber));
      rejectDuplicates(groupId, chapters);

      groups.add(new SequenceGroup(groupId, key.encoding(), key.sequenceNumber(), chapters));
    }

    LOGGER.debug(
        "Grouped {} files into {} sequences ({} files not concatenable)",
        files.size(),
        groups.size(),
        skipped);
    return groups;
  }

  private static void rejectDuplicates(String groupId, List<Chapter> sortedChapters) {
    for (int i = 1; i < sortedChapters.size(); i++) {
      Chapter previous = sortedChapters.get(i - 1);
      Chapter current = sortedChapters.get(i);
      if (previous.chapterNumber() == current.chapterNumber()) {
        throw new DuplicateChapterException(
            groupId,
            current.chapterNumber(),
            previous.file().originalName(),
            current.file().originalName());
      }
    }
  }

  private record SequenceKey(Encoding encoding, int sequenceNumber) {}
}
