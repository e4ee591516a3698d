package com.scholary.chapters.api;

import com.scholary.chapters.storage.OutputFile;
import java.time.Instant;
import java.util.List;

/** Completed outputs of a session. */
public record OutputFilesResponse(String sessionId, List<OutputFileView> files) {

  public record OutputFileView(
      String filename,
      String groupId,
      long size,
      Instant createdAt,
      boolean archived,
      String downloadUrl) {

    static OutputFileView from(OutputFile file) {
      return new OutputFileView(
          file.filename(),
          file.groupId(),
          file.sizeBytes(),
          file.createdAt(),
          file.isArchived(),
          "/api/download/" + file.sessionId() + "/" + file.filename());
    }
  }
}
