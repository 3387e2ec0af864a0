package com.geoinsight.backend.scoring;

import com.geoinsight.backend.exception.DimensionMismatchException;
import com.geoinsight.backend.model.EmbeddingRecord;
import com.geoinsight.backend.model.SimilarityMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brute-force cosine similarity ranking.
 *
 * <p>Matches are sorted by descending similarity with a stable sort, so equal
 * scores keep the order in which candidates were supplied.
 */
public class SimilarityRanker {

    public List<SimilarityMatch> rank(double[] query,
                                      List<EmbeddingRecord> candidates,
                                      int dimension,
                                      double threshold,
                                      int limit) {
        if (query == null || query.length != dimension) {
            throw new DimensionMismatchException(dimension, query == null ? 0 : query.length);
        }
        if (limit <= 0 || candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        double queryNorm = norm(query);
        List<SimilarityMatch> matches = new ArrayList<>();
        for (EmbeddingRecord candidate : candidates) {
            double[] vector = candidate.vector();
            if (vector == null || vector.length != dimension) {
                throw new DimensionMismatchException(dimension, vector == null ? 0 : vector.length);
            }
            double similarity = cosine(query, queryNorm, vector);
            if (similarity > threshold) {
                matches.add(new SimilarityMatch(candidate.propertyId(), similarity, candidate.metadata()));
            }
        }

        matches.sort(Comparator.comparingDouble(SimilarityMatch::similarity).reversed());
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
    }

    public double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        return cosine(a, norm(a), b);
    }

    private static double cosine(double[] query, double queryNorm, double[] vector) {
        double vectorNorm = norm(vector);
        if (queryNorm == 0 || vectorNorm == 0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < query.length; i++) {
            dot += query[i] * vector[i];
        }
        return dot / (queryNorm * vectorNorm);
    }

    private static double norm(double[] vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }
}
