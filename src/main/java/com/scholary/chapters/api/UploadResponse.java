package com.scholary.chapters.api;

import java.util.List;

/**
 * Response for an upload.
 *
 * <p>Lists every group of the session, including groups formed by earlier uploads.
 */
public record UploadResponse(String sessionId, List<GroupView> groups) {}
