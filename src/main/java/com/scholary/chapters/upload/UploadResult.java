package com.scholary.chapters.upload;

import com.scholary.chapters.grouping.SequenceGroup;
import java.util.List;

/** Outcome of an upload: the session it landed in and every group that session now has. */
public record UploadResult(String sessionId, List<SequenceGroup> groups) {}
