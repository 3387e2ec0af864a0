package com.geoinsight.backend.repository;

import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnalysisJobRepository extends MongoRepository<AnalysisJob, String> {

    List<AnalysisJob> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<AnalysisJob> findByStatusIn(List<JobStatus> statuses);
}
