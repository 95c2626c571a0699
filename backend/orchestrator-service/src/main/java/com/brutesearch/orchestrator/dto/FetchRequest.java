package com.brutesearch.orchestrator.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record FetchRequest(
        @NotEmpty @Size(max = 500) List<String> urls
) {
}
