package com.geoinsight.backend.repository;

import com.geoinsight.backend.exception.OrchestratorFaultException;
import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.AnalysisReport;
import com.geoinsight.backend.model.JobStatus;
import com.geoinsight.backend.model.SubtaskOutcome;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link JobStore} on MongoDB. Conditional writes are single-document
 * updates filtered on the job status, so MongoDB's per-document atomicity
 * gives the merge and terminal guarantees.
 */
@Repository
@ConditionalOnProperty(name = "geoinsight.storage.mode", havingValue = "mongo", matchIfMissing = true)
public class MongoJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final List<JobStatus> ACTIVE = List.of(JobStatus.PENDING, JobStatus.RUNNING);

    private final AnalysisJobRepository jobRepository;
    private final MongoTemplate mongoTemplate;

    public MongoJobStore(AnalysisJobRepository jobRepository, MongoTemplate mongoTemplate) {
        this.jobRepository = jobRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public AnalysisJob create(AnalysisJob job) {
        try {
            job.setUpdatedAt(job.getCreatedAt());
            return mongoTemplate.insert(job);
        } catch (DataAccessException e) {
            throw new OrchestratorFaultException("Failed to store job " + job.getId(), e);
        }
    }

    @Override
    public Optional<AnalysisJob> findById(String id) {
        try {
            return jobRepository.findById(id);
        } catch (DataAccessException e) {
            throw new OrchestratorFaultException("Failed to load job " + id, e);
        }
    }

    @Override
    public List<AnalysisJob> findRecent(int limit) {
        try {
            return jobRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
        } catch (DataAccessException e) {
            throw new OrchestratorFaultException("Failed to list jobs", e);
        }
    }

    @Override
    public boolean markRunning(String id) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", JobStatus.RUNNING)
                .set("startedAt", now)
                .set("updatedAt", now);
        return apply(id, Criteria.where("status").is(JobStatus.PENDING), update, "mark running");
    }

    @Override
    public boolean recordSubtask(String id, String name, SubtaskOutcome outcome) {
        Update update = new Update()
                .set("partialResults." + name, outcome)
                .set("updatedAt", Instant.now());
        return apply(id, Criteria.where("status").in(ACTIVE), update, "record subtask " + name);
    }

    @Override
    public boolean complete(String id, AnalysisReport report) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", JobStatus.SUCCESS)
                .set("result", report)
                .set("completedAt", now)
                .set("updatedAt", now);
        return apply(id, Criteria.where("status").in(ACTIVE), update, "complete");
    }

    @Override
    public boolean fail(String id, String error) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", JobStatus.FAILURE)
                .set("error", error)
                .set("completedAt", now)
                .set("updatedAt", now);
        return apply(id, Criteria.where("status").in(ACTIVE), update, "fail");
    }

    private boolean apply(String id, Criteria statusGuard, Update update, String operation) {
        Query query = new Query(Criteria.where("_id").is(id).andOperator(statusGuard));
        try {
            UpdateResult result = mongoTemplate.updateFirst(query, update, AnalysisJob.class);
            boolean applied = result.getModifiedCount() > 0;
            if (!applied) {
                log.debug("Rejected {} on job {}", operation, id);
            }
            return applied;
        } catch (DataAccessException e) {
            throw new OrchestratorFaultException("Failed to " + operation + " on job " + id, e);
        }
    }
}
