package com.scholary.chapters.grouping;

/** Two files in one batch claim the same chapter of the same sequence. */
public class DuplicateChapterException extends ValidationException {

  private final String groupId;
  private final int chapterNumber;

  public DuplicateChapterException(
      String groupId, int chapterNumber, String firstName, String secondName) {
    super(
        String.format(
            "Duplicate chapter %d in group %s: %s and %s",
            chapterNumber, groupId, firstName, secondName));
    this.groupId = groupId;
    this.chapterNumber = chapterNumber;
  }

  public String getGroupId() {
    return groupId;
  }

  public int getChapterNumber() {
    return chapterNumber;
  }
}
