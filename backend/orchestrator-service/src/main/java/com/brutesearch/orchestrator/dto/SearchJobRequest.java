package com.brutesearch.orchestrator.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

import java.util.List;

/**
 * Start or resume a checkpointed search job. Passing an existing {@code jobId}
 * resumes it; omitting it starts a new job.
 */
public record SearchJobRequest(
        @Pattern(regexp = "[A-Za-z0-9_-]{1,64}") String jobId,
        @NotBlank String query,
        @NotEmpty List<String> sources
) {
}
