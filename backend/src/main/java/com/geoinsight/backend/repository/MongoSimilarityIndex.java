package com.geoinsight.backend.repository;

import com.geoinsight.backend.config.SimilarityProperties;
import com.geoinsight.backend.exception.DimensionMismatchException;
import com.geoinsight.backend.model.EmbeddingDocument;
import com.geoinsight.backend.model.EmbeddingRecord;
import com.geoinsight.backend.model.SequenceCounter;
import com.geoinsight.backend.model.SimilarityMatch;
import com.geoinsight.backend.scoring.SimilarityRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * {@link SimilarityIndex} backed by the {@code property_embeddings}
 * collection. Search is a brute-force scan in insertion order through
 * {@link SimilarityRanker}.
 */
@Repository
@ConditionalOnProperty(name = "geoinsight.storage.mode", havingValue = "mongo", matchIfMissing = true)
public class MongoSimilarityIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(MongoSimilarityIndex.class);

    static final String SEQUENCE_NAME = "property_embeddings";

    private final EmbeddingRepository embeddingRepository;
    private final MongoTemplate mongoTemplate;
    private final SimilarityRanker ranker;
    private final int dimension;

    public MongoSimilarityIndex(EmbeddingRepository embeddingRepository,
            MongoTemplate mongoTemplate,
            SimilarityRanker ranker,
            SimilarityProperties properties) {
        this.embeddingRepository = embeddingRepository;
        this.mongoTemplate = mongoTemplate;
        this.ranker = ranker;
        this.dimension = properties.getDimension();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void upsert(EmbeddingRecord record) {
        if (record.vector() == null || record.vector().length != dimension) {
            throw new DimensionMismatchException(dimension, record.vector() == null ? 0 : record.vector().length);
        }
        List<Double> embedding = new ArrayList<>(record.vector().length);
        for (double v : record.vector()) {
            embedding.add(v);
        }

        embeddingRepository.deleteById(record.propertyId());
        EmbeddingDocument document = EmbeddingDocument.builder()
                .id(record.propertyId())
                .embedding(embedding)
                .metadata(new HashMap<>(record.metadata()))
                .sequence(nextSequence())
                .createdAt(Instant.now())
                .build();
        embeddingRepository.save(document);
        log.info("[INDEX] Upserted embedding for property {}", record.propertyId());
    }

    @Override
    public boolean delete(String propertyId) {
        if (!embeddingRepository.existsById(propertyId)) {
            return false;
        }
        embeddingRepository.deleteById(propertyId);
        log.info("[INDEX] Deleted embedding for property {}", propertyId);
        return true;
    }

    @Override
    public Optional<EmbeddingRecord> find(String propertyId) {
        return embeddingRepository.findById(propertyId).map(MongoSimilarityIndex::toRecord);
    }

    @Override
    public long size() {
        return embeddingRepository.count();
    }

    @Override
    public List<SimilarityMatch> search(double[] query, double threshold, int limit) {
        List<EmbeddingRecord> candidates = embeddingRepository.findAllByOrderBySequenceAsc().stream()
                .map(MongoSimilarityIndex::toRecord)
                .toList();
        List<SimilarityMatch> matches = ranker.rank(query, candidates, dimension, threshold, limit);
        log.debug("[INDEX] Scanned {} embeddings, {} matches above {}", candidates.size(), matches.size(), threshold);
        return matches;
    }

    private long nextSequence() {
        SequenceCounter counter = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(SEQUENCE_NAME)),
                new Update().inc("value", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceCounter.class);
        return counter != null ? counter.getValue() : 1L;
    }

    private static EmbeddingRecord toRecord(EmbeddingDocument document) {
        List<Double> embedding = document.getEmbedding() != null ? document.getEmbedding() : List.of();
        double[] vector = new double[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = embedding.get(i);
        }
        return new EmbeddingRecord(document.getId(), vector, document.getMetadata());
    }
}
