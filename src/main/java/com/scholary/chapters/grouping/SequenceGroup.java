package com.scholary.chapters.grouping;

import com.scholary.chapters.naming.Encoding;
import java.nio.file.Path;
import java.util.List;

/**
 * The chapters of one recording, ready to be concatenated.
 *
 * <p>Chapters are sorted ascending by chapter number and the numbers are unique. They need not be
 * contiguous: a missing chapter is the client's business, not ours.
 */
public record SequenceGroup(
    String groupId, Encoding encoding, int sequenceNumber, List<Chapter> chapters) {

  public SequenceGroup {
    chapters = List.copyOf(chapters);
    for (int i = 1; i < chapters.size(); i++) {
      if (chapters.get(i).chapterNumber() <= chapters.get(i - 1).chapterNumber()) {
        throw new IllegalArgumentException(
            "Chapters of group " + groupId + " must be strictly ascending");
      }
    }
  }

  /**
   * Stable identifier for an {@code (encoding, sequence)} key, e.g. {@code GX0150}.
   *
   * <p>Derived from the key alone so that re-grouping the same files always yields the same id.
   */
  public static String idFor(Encoding encoding, int sequenceNumber) {
    return String.format("G%s%04d", encoding.name(), sequenceNumber);
  }

  public List<Path> inputPaths() {
    return chapters.stream().map(chapter -> chapter.file().storedPath()).toList();
  }

  public long totalSizeBytes() {
    return chapters.stream().mapToLong(chapter -> chapter.file().sizeBytes()).sum();
  }

  public int chapterCount() {
    return chapters.size();
  }
}
