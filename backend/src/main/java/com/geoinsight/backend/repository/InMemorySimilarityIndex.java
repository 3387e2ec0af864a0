package com.geoinsight.backend.repository;

import com.geoinsight.backend.config.SimilarityProperties;
import com.geoinsight.backend.exception.DimensionMismatchException;
import com.geoinsight.backend.model.EmbeddingRecord;
import com.geoinsight.backend.model.SimilarityMatch;
import com.geoinsight.backend.scoring.SimilarityRanker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link SimilarityIndex}; the map's iteration order is the
 * insertion order.
 */
@Repository
@ConditionalOnProperty(name = "geoinsight.storage.mode", havingValue = "memory")
public class InMemorySimilarityIndex implements SimilarityIndex {

    private final Map<String, EmbeddingRecord> records = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SimilarityRanker ranker;
    private final int dimension;

    public InMemorySimilarityIndex(SimilarityRanker ranker, SimilarityProperties properties) {
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
        lock.writeLock().lock();
        try {
            records.remove(record.propertyId());
            records.put(record.propertyId(), new EmbeddingRecord(
                    record.propertyId(), record.vector().clone(), record.metadata()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String propertyId) {
        lock.writeLock().lock();
        try {
            return records.remove(propertyId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<EmbeddingRecord> find(String propertyId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(propertyId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SimilarityMatch> search(double[] query, double threshold, int limit) {
        List<EmbeddingRecord> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(records.values());
        } finally {
            lock.readLock().unlock();
        }
        return ranker.rank(query, snapshot, dimension, threshold, limit);
    }
}
