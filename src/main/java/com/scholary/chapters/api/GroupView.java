package com.scholary.chapters.api;

import com.scholary.chapters.grouping.Chapter;
import com.scholary.chapters.grouping.SequenceGroup;
import java.util.List;

/** A sequence group as shown to clients after upload. */
public record GroupView(
    String id,
    String encoding,
    int sequence,
    List<ChapterView> chapters,
    long totalSize,
    int chapterCount) {

  public record ChapterView(int chapter, String originalName, long size) {

    static ChapterView from(Chapter chapter) {
      return new ChapterView(
          chapter.chapterNumber(), chapter.file().originalName(), chapter.file().sizeBytes());
    }
  }

  public static GroupView from(SequenceGroup group) {
    return new GroupView(
        group.groupId(),
        group.encoding().name(),
        group.sequenceNumber(),
        group.chapters().stream().map(ChapterView::from).toList(),
        group.totalSizeBytes(),
        group.chapterCount());
  }
}
