package com.geoinsight.backend.repository;

import com.geoinsight.backend.exception.ErrorType;
import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.AnalysisReport;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.model.InvestmentInput;
import com.geoinsight.backend.model.JobStatus;
import com.geoinsight.backend.model.ReportSection;
import com.geoinsight.backend.model.SectionStatus;
import com.geoinsight.backend.model.SubtaskOutcome;
import com.geoinsight.backend.model.SubtaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobStoreTest {

    private final InMemoryJobStore store = new InMemoryJobStore();

    @Test
    void shouldCreateAndFindJob() {
        store.create(newJob("job-1", Instant.now()));

        AnalysisJob found = store.findById("job-1").orElseThrow();

        assertThat(found.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(found.getInput().getAddress()).isEqualTo("12 MG Road, Pune");
        assertThat(store.findById("missing")).isEmpty();
    }

    @Test
    void shouldRejectDuplicateIds() {
        store.create(newJob("job-dup", Instant.now()));

        assertThatThrownBy(() -> store.create(newJob("job-dup", Instant.now())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReturnCopies() {
        store.create(newJob("job-copy", Instant.now()));

        AnalysisJob copy = store.findById("job-copy").orElseThrow();
        copy.setStatus(JobStatus.SUCCESS);
        copy.getPartialResults().put("walk_score", success());

        AnalysisJob stored = store.findById("job-copy").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(stored.getPartialResults()).isEmpty();
    }

    @Test
    void shouldKeepInputImmutableOnceAccepted() {
        // Given
        AnalysisRequest request = AnalysisRequest.builder()
                .address("12 MG Road, Pune")
                .investment(InvestmentInput.builder().price("85 L").monthlyRent("35,000").build())
                .build();
        store.create(AnalysisJob.builder().id("job-input").status(JobStatus.PENDING)
                .input(request).createdAt(Instant.now()).build());

        // When
        request.setAddress("changed by submitter");
        request.getInvestment().setPrice("1 Cr");
        AnalysisJob read = store.findById("job-input").orElseThrow();
        read.getInput().setAddress("changed by reader");
        read.getInput().getInvestment().setMonthlyRent("0");

        // Then
        AnalysisRequest stored = store.findById("job-input").orElseThrow().getInput();
        assertThat(stored.getAddress()).isEqualTo("12 MG Road, Pune");
        assertThat(stored.getInvestment().getPrice()).isEqualTo("85 L");
        assertThat(stored.getInvestment().getMonthlyRent()).isEqualTo("35,000");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldKeepFinishedReportImmutable() {
        // Given
        store.create(newJob("job-report", Instant.now()));
        store.markRunning("job-report");
        Map<String, Object> walkData = new LinkedHashMap<>();
        walkData.put("score", 72.5);
        walkData.put("categories", new ArrayList<>(List.of("GROCERY")));
        store.recordSubtask("job-report", "walk_score", SubtaskOutcome.success(walkData, Instant.now()));
        AnalysisReport report = AnalysisReport.builder().address("12 MG Road, Pune").build();
        report.getSections().put("walk_score", ReportSection.builder()
                .status(SectionStatus.AVAILABLE).data(new LinkedHashMap<>(walkData)).build());
        store.complete("job-report", report);

        // When
        report.getMissingSections().add("vegetation");
        walkData.put("score", 0.0);
        AnalysisJob read = store.findById("job-report").orElseThrow();
        read.getResult().getMissingSections().add("walk_score");
        read.getResult().getSections().get("walk_score").getData().put("score", 1.0);
        read.getResult().getSections().remove("walk_score");
        read.getPartialResults().get("walk_score").setStatus(SubtaskStatus.FAILED);
        ((List<Object>) read.getPartialResults().get("walk_score").getData().get("categories")).add("PARK");

        // Then
        AnalysisJob stored = store.findById("job-report").orElseThrow();
        assertThat(stored.getResult().getMissingSections()).isEmpty();
        assertThat(stored.getResult().getSections()).containsOnlyKeys("walk_score");
        assertThat(stored.getResult().getSections().get("walk_score").getData()).containsEntry("score", 72.5);
        SubtaskOutcome outcome = stored.getPartialResults().get("walk_score");
        assertThat(outcome.getStatus()).isEqualTo(SubtaskStatus.SUCCESS);
        assertThat(outcome.getData()).containsEntry("score", 72.5);
        assertThat((List<Object>) outcome.getData().get("categories")).containsExactly("GROCERY");
    }

    @Test
    void shouldMarkRunningOnlyOnce() {
        store.create(newJob("job-run", Instant.now()));

        assertThat(store.markRunning("job-run")).isTrue();
        assertThat(store.markRunning("job-run")).isFalse();
        assertThat(store.findById("job-run").orElseThrow().getStartedAt()).isNotNull();
        assertThat(store.markRunning("missing")).isFalse();
    }

    @Test
    void shouldRejectWritesAfterTerminalState() {
        // Given
        store.create(newJob("job-done", Instant.now()));
        store.markRunning("job-done");
        assertThat(store.complete("job-done", AnalysisReport.builder().address("12 MG Road, Pune").build())).isTrue();

        // When
        boolean lateSubtask = store.recordSubtask("job-done", "vegetation", success());
        boolean lateFailure = store.fail("job-done", "Cancelled: too slow");

        // Then
        assertThat(lateSubtask).isFalse();
        assertThat(lateFailure).isFalse();
        AnalysisJob job = store.findById("job-done").orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(job.getError()).isNull();
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(job.getPartialResults()).doesNotContainKey("vegetation");
    }

    @Test
    void shouldKeepPartialResultsWhenFailed() {
        store.create(newJob("job-fail", Instant.now()));
        store.markRunning("job-fail");
        store.recordSubtask("job-fail", "location", success());
        store.recordSubtask("job-fail", "walk_score",
                SubtaskOutcome.failure(ErrorType.PROVIDER_ERROR, "overpass: 504", Instant.now()));

        assertThat(store.fail("job-fail", "Critical subtask 'walk_score' failed")).isTrue();

        AnalysisJob job = store.findById("job-fail").orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILURE);
        assertThat(job.getPartialResults()).containsOnlyKeys("location", "walk_score");
        assertThat(job.getResult()).isNull();
    }

    @Test
    void shouldNotLoseConcurrentSubtaskMerges() throws Exception {
        // Given
        store.create(newJob("job-race", Instant.now()));
        store.markRunning("job-race");
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);

        // When
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String name = "subtask_" + i;
            results.add(pool.submit(() -> {
                start.await();
                return store.recordSubtask("job-race", name, success());
            }));
        }
        start.countDown();
        for (Future<Boolean> result : results) {
            assertThat(result.get()).isTrue();
        }
        pool.shutdown();

        // Then
        assertThat(store.findById("job-race").orElseThrow().getPartialResults()).hasSize(writers);
    }

    @Test
    void shouldListMostRecentFirst() {
        Instant now = Instant.now();
        store.create(newJob("old", now.minusSeconds(60)));
        store.create(newJob("new", now));
        store.create(newJob("mid", now.minusSeconds(30)));

        assertThat(store.findRecent(2)).extracting(AnalysisJob::getId).containsExactly("new", "mid");
    }

    private static AnalysisJob newJob(String id, Instant createdAt) {
        return AnalysisJob.builder()
                .id(id)
                .status(JobStatus.PENDING)
                .input(AnalysisRequest.builder().address("12 MG Road, Pune").build())
                .createdAt(createdAt)
                .build();
    }

    private static SubtaskOutcome success() {
        return SubtaskOutcome.success(Map.of("score", 72.5), Instant.now());
    }
}
