package com.geoinsight.backend.repository;

import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.AnalysisReport;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.model.InvestmentInput;
import com.geoinsight.backend.model.JobStatus;
import com.geoinsight.backend.model.ReportSection;
import com.geoinsight.backend.model.SubtaskOutcome;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-local {@link JobStore}. Each write runs inside
 * {@link ConcurrentHashMap#compute}, which serializes writers of the same job.
 * Records are deep-copied on the way in and out, so neither the submitter nor
 * a reader can change a stored input or a finished report.
 */
@Repository
@ConditionalOnProperty(name = "geoinsight.storage.mode", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();

    @Override
    public AnalysisJob create(AnalysisJob job) {
        AnalysisJob stored = copy(job);
        stored.setUpdatedAt(job.getCreatedAt());
        if (jobs.putIfAbsent(job.getId(), stored) != null) {
            throw new IllegalStateException("Job already exists: " + job.getId());
        }
        return copy(stored);
    }

    @Override
    public Optional<AnalysisJob> findById(String id) {
        AnalysisJob job = jobs.get(id);
        if (job == null) {
            return Optional.empty();
        }
        synchronized (job) {
            return Optional.of(copy(job));
        }
    }

    @Override
    public List<AnalysisJob> findRecent(int limit) {
        return jobs.values().stream()
                .sorted(Comparator.comparing(AnalysisJob::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(Math.max(1, limit))
                .map(job -> {
                    synchronized (job) {
                        return copy(job);
                    }
                })
                .toList();
    }

    @Override
    public boolean markRunning(String id) {
        return update(id, false, job -> {
            Instant now = Instant.now();
            job.setStatus(JobStatus.RUNNING);
            job.setStartedAt(now);
            job.setUpdatedAt(now);
        });
    }

    @Override
    public boolean recordSubtask(String id, String name, SubtaskOutcome outcome) {
        return update(id, true, job -> {
            job.getPartialResults().put(name, copyOutcome(outcome));
            job.setUpdatedAt(Instant.now());
        });
    }

    @Override
    public boolean complete(String id, AnalysisReport report) {
        return update(id, true, job -> {
            Instant now = Instant.now();
            job.setStatus(JobStatus.SUCCESS);
            job.setResult(copyReport(report));
            job.setCompletedAt(now);
            job.setUpdatedAt(now);
        });
    }

    @Override
    public boolean fail(String id, String error) {
        return update(id, true, job -> {
            Instant now = Instant.now();
            job.setStatus(JobStatus.FAILURE);
            job.setError(error);
            job.setCompletedAt(now);
            job.setUpdatedAt(now);
        });
    }

    /**
     * @param allowRunning whether RUNNING jobs accept the write; PENDING always does
     */
    private boolean update(String id, boolean allowRunning, Consumer<AnalysisJob> mutation) {
        boolean[] applied = {false};
        jobs.computeIfPresent(id, (key, job) -> {
            synchronized (job) {
                JobStatus status = job.getStatus();
                if (status == JobStatus.PENDING || (allowRunning && status == JobStatus.RUNNING)) {
                    mutation.accept(job);
                    applied[0] = true;
                }
            }
            return job;
        });
        return applied[0];
    }

    private static AnalysisJob copy(AnalysisJob job) {
        Map<String, SubtaskOutcome> partialResults = new LinkedHashMap<>();
        if (job.getPartialResults() != null) {
            job.getPartialResults().forEach((name, outcome) -> partialResults.put(name, copyOutcome(outcome)));
        }
        return AnalysisJob.builder()
                .id(job.getId())
                .status(job.getStatus())
                .input(copyRequest(job.getInput()))
                .partialResults(partialResults)
                .result(copyReport(job.getResult()))
                .error(job.getError())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }

    private static AnalysisRequest copyRequest(AnalysisRequest request) {
        if (request == null) {
            return null;
        }
        InvestmentInput investment = request.getInvestment();
        return request.toBuilder()
                .investment(investment == null ? null : investment.toBuilder().build())
                .build();
    }

    private static SubtaskOutcome copyOutcome(SubtaskOutcome outcome) {
        if (outcome == null) {
            return null;
        }
        return outcome.toBuilder().data(copyData(outcome.getData())).build();
    }

    private static AnalysisReport copyReport(AnalysisReport report) {
        if (report == null) {
            return null;
        }
        Map<String, ReportSection> sections = new LinkedHashMap<>();
        if (report.getSections() != null) {
            report.getSections().forEach((name, section) -> sections.put(name, section == null ? null
                    : section.toBuilder().data(copyData(section.getData())).build()));
        }
        return report.toBuilder()
                .sections(sections)
                .missingSections(report.getMissingSections() == null
                        ? new ArrayList<>() : new ArrayList<>(report.getMissingSections()))
                .build();
    }

    private static Map<String, Object> copyData(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        data.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) value).forEach((key, nested) -> copy.put(key, copyValue(nested)));
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object nested : (Collection<Object>) value) {
                copy.add(copyValue(nested));
            }
            return copy;
        }
        return value;
    }
}
