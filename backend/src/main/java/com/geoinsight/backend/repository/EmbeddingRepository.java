package com.geoinsight.backend.repository;

import com.geoinsight.backend.model.EmbeddingDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for property embeddings.
 */
@Repository
public interface EmbeddingRepository extends MongoRepository<EmbeddingDocument, String> {

    List<EmbeddingDocument> findAllByOrderBySequenceAsc();
}
