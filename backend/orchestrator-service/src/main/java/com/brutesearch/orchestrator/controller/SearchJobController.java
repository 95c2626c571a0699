package com.brutesearch.orchestrator.controller;

import com.brutesearch.orchestrator.dto.SearchEvent;
import com.brutesearch.orchestrator.dto.SearchJobRequest;
import com.brutesearch.orchestrator.dto.SearchJobResult;
import com.brutesearch.orchestrator.service.SearchJobService;
import com.brutesearch.orchestrator.service.checkpoint.ResumeInfo;
import com.brutesearch.orchestrator.service.event.SearchEventPublisher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Checkpointed search jobs: start/resume, inspect the stored checkpoint, follow progress.
 */
@RestController
@RequestMapping("/api/v1/search-jobs")
@RequiredArgsConstructor
@Slf4j
public class SearchJobController {

    private final SearchJobService searchJobService;
    private final SearchEventPublisher searchEventPublisher;

    // ============================================
    // Job Execution
    // ============================================

    /**
     * Runs the job to completion. Passing the id of an interrupted job resumes it.
     */
    @PostMapping
    public Mono<SearchJobResult> runJob(@Valid @RequestBody SearchJobRequest request) {
        log.info("Search job request: jobId={}, query='{}', sources={}",
                request.jobId(), request.query(), request.sources());
        return searchJobService.run(request.jobId(), request.query(), request.sources());
    }

    // ============================================
    // Job Status
    // ============================================

    @GetMapping("/{jobId}/checkpoint")
    public Mono<ResponseEntity<ResumeInfo>> getCheckpoint(@PathVariable String jobId) {
        return Mono.fromCallable(() -> searchJobService.findCheckpoint(jobId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(found -> found.map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    /**
     * Live progress events for a running job (SSE). Completes after search_completed.
     */
    @GetMapping(value = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SearchEvent>> streamEvents(@PathVariable String jobId) {
        return searchEventPublisher.stream(jobId)
                .map(event -> ServerSentEvent.<SearchEvent>builder()
                        .event(event.type().getValue())
                        .data(event)
                        .build());
    }
}
