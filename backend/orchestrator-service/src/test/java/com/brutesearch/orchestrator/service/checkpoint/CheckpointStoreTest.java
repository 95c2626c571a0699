package com.brutesearch.orchestrator.service.checkpoint;

import com.brutesearch.orchestrator.entity.EngineProgress;
import com.brutesearch.orchestrator.entity.SearchJob;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.smile.databind.SmileMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CheckpointStore 단위 테스트
 */
class CheckpointStoreTest {

    @TempDir
    Path tempDir;

    private CheckpointStore store;

    static CheckpointStore newStore(Path dir) {
        ObjectMapper json = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        ObjectMapper smile = SmileMapper.builder().addModule(new JavaTimeModule()).build();
        return new CheckpointStore(dir, json, smile);
    }

    private static SearchJob sampleJob(String jobId) {
        SearchJob job = SearchJob.start(jobId, Instant.parse("2024-05-01T10:00:00Z"));
        job.setQuery("climate policy");
        job.setSources(List.of("google", "bing", "arxiv"));
        job.getCompletedEngines().add("google");
        job.getFailedEngines().put("bing", "timeout: call timed out");
        job.getEngineProgress().put("google", EngineProgress.builder()
                .status(EngineProgress.Status.COMPLETED)
                .completedQueries(List.of("climate policy"))
                .resultsCount(12)
                .build());
        job.setResultsCount(12);
        job.setUniqueUrls(11);
        return job;
    }

    @BeforeEach
    void setUp() {
        store = newStore(tempDir.resolve("checkpoints"));
    }

    @Nested
    @DisplayName("저장 및 로드")
    class SaveLoadTests {

        @Test
        @DisplayName("저장 시 JSON 본문과 바이너리 백업이 모두 생성된다")
        void writesPrimaryAndBackup() throws IOException {
            store.save(sampleJob("job_1"));

            assertThat(store.primaryPath("job_1")).exists();
            assertThat(store.backupPath("job_1")).exists();
            assertThat(Files.readString(store.primaryPath("job_1"))).contains("\"jobId\" : \"job_1\"");
            assertThat(store.exists("job_1")).isTrue();
            try (var files = Files.list(tempDir.resolve("checkpoints"))) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .containsExactlyInAnyOrder("job_1.json", "job_1.bak");
            }
        }

        @Test
        @DisplayName("저장한 작업을 그대로 읽어온다")
        void loadsSavedJob() throws IOException {
            store.save(sampleJob("job_1"));

            SearchJob loaded = store.load("job_1").orElseThrow();

            assertThat(loaded.getQuery()).isEqualTo("climate policy");
            assertThat(loaded.getCompletedEngines()).containsExactly("google");
            assertThat(loaded.getFailedEngines()).containsEntry("bing", "timeout: call timed out");
            assertThat(loaded.getEngineProgress().get("google").getResultsCount()).isEqualTo(12);
            assertThat(loaded.getCreatedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        }

        @Test
        @DisplayName("체크포인트가 없으면 빈 결과")
        void missingIsEmpty() {
            assertThat(store.load("nothing_here")).isEmpty();
            assertThat(store.exists("nothing_here")).isFalse();
        }
    }

    @Nested
    @DisplayName("손상 복구")
    class CorruptionTests {

        @Test
        @DisplayName("본문이 손상되면 백업에서 복구한다")
        void fallsBackToBackup() throws IOException {
            store.save(sampleJob("job_2"));
            Files.writeString(store.primaryPath("job_2"), "{ not json", StandardCharsets.UTF_8);

            Optional<SearchJob> loaded = store.load("job_2");

            assertThat(loaded).isPresent();
            assertThat(loaded.get().getCompletedEngines()).containsExactly("google");
        }

        @Test
        @DisplayName("본문이 다른 작업의 것이면 백업을 사용한다")
        void rejectsForeignPrimary() throws IOException {
            store.save(sampleJob("job_3"));
            store.save(sampleJob("other"));
            Files.copy(store.primaryPath("other"), store.primaryPath("job_3"),
                    StandardCopyOption.REPLACE_EXISTING);

            assertThat(store.load("job_3").orElseThrow().getJobId()).isEqualTo("job_3");
        }

        @Test
        @DisplayName("본문과 백업이 모두 손상되면 새로 시작한다")
        void bothCorruptStartsFresh() throws IOException {
            store.save(sampleJob("job_4"));
            Files.writeString(store.primaryPath("job_4"), "garbage");
            Files.write(store.backupPath("job_4"), new byte[]{1, 2, 3});

            assertThat(store.load("job_4")).isEmpty();
        }
    }

    @Test
    @DisplayName("delete는 두 파일을 모두 제거한다")
    void deleteRemovesBoth() throws IOException {
        store.save(sampleJob("job_5"));

        store.delete("job_5");

        assertThat(store.primaryPath("job_5")).doesNotExist();
        assertThat(store.backupPath("job_5")).doesNotExist();
        store.delete("job_5");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"../escape", "has space", "slash/inside"})
    @DisplayName("허용되지 않는 작업 ID는 거부된다")
    void rejectsInvalidJobIds(String jobId) {
        assertThat(CheckpointStore.isValidJobId(jobId)).isFalse();
        assertThatThrownBy(() -> store.load(jobId)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"search_20240501_100000_ab12cd34", "job-1", "A"})
    @DisplayName("영문, 숫자, 밑줄, 하이픈으로 된 ID는 허용된다")
    void acceptsValidJobIds(String jobId) {
        assertThat(CheckpointStore.isValidJobId(jobId)).isTrue();
    }
}
