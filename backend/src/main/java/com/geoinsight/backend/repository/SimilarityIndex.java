package com.geoinsight.backend.repository;

import com.geoinsight.backend.model.EmbeddingRecord;
import com.geoinsight.backend.model.SimilarityMatch;

import java.util.List;
import java.util.Optional;

/**
 * Store of property embeddings with nearest-neighbour search.
 *
 * <p>Every stored vector has length {@link #dimension()}. Search results are
 * ordered by descending cosine similarity; equal scores keep insertion order,
 * so repeated queries against an unchanged index return the same list.
 */
public interface SimilarityIndex {

    int dimension();

    /**
     * Insert or replace. A replaced record moves to the end of the insertion order.
     *
     * @throws com.geoinsight.backend.exception.DimensionMismatchException on a wrong vector length
     */
    void upsert(EmbeddingRecord record);

    boolean delete(String propertyId);

    Optional<EmbeddingRecord> find(String propertyId);

    long size();

    /**
     * Records with similarity strictly above {@code threshold}, at most {@code limit}.
     *
     * @throws com.geoinsight.backend.exception.DimensionMismatchException on a wrong query length
     */
    List<SimilarityMatch> search(double[] query, double threshold, int limit);
}
