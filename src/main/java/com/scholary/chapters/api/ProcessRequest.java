package com.scholary.chapters.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/** Request to merge some groups of a session. */
public record ProcessRequest(
    @NotBlank String sessionId, @NotEmpty List<@NotBlank String> groupIds) {}
