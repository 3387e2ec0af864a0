package com.geoinsight.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "geoinsight.similarity")
public class SimilarityProperties {

    private int dimension = 512;
    private double threshold = 0.70;
    private int defaultLimit = 5;
    private int maxLimit = 20;

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    /**
     * Requested limit clamped to [1, maxLimit], default when absent.
     */
    public int resolveLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(maxLimit, requested));
    }
}
