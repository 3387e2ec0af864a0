package com.geoinsight.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Worker pool and per-subtask time limits of the analysis pipeline.
 */
@ConfigurationProperties(prefix = "geoinsight.orchestrator")
public class OrchestratorProperties {

    private int coordinatorPoolSize = 4;
    private int corePoolSize = 8;
    private int maxPoolSize = 16;
    private int queueCapacity = 200;
    private int defaultRadiusMeters = 1000;
    private int similarityLimit = 5;
    private final Timeouts timeouts = new Timeouts();

    public int getCoordinatorPoolSize() {
        return coordinatorPoolSize;
    }

    public void setCoordinatorPoolSize(int coordinatorPoolSize) {
        this.coordinatorPoolSize = coordinatorPoolSize;
    }

    public int getCorePoolSize() {
        return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
        this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getDefaultRadiusMeters() {
        return defaultRadiusMeters;
    }

    public void setDefaultRadiusMeters(int defaultRadiusMeters) {
        this.defaultRadiusMeters = defaultRadiusMeters;
    }

    public int getSimilarityLimit() {
        return similarityLimit;
    }

    public void setSimilarityLimit(int similarityLimit) {
        this.similarityLimit = similarityLimit;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public static class Timeouts {

        private Duration location = Duration.ofSeconds(15);
        private Duration walkScore = Duration.ofSeconds(30);
        private Duration vegetation = Duration.ofSeconds(30);
        private Duration investment = Duration.ofSeconds(10);
        private Duration similarity = Duration.ofSeconds(30);
        private Duration summary = Duration.ofSeconds(60);

        public Duration getLocation() {
            return location;
        }

        public void setLocation(Duration location) {
            this.location = location;
        }

        public Duration getWalkScore() {
            return walkScore;
        }

        public void setWalkScore(Duration walkScore) {
            this.walkScore = walkScore;
        }

        public Duration getVegetation() {
            return vegetation;
        }

        public void setVegetation(Duration vegetation) {
            this.vegetation = vegetation;
        }

        public Duration getInvestment() {
            return investment;
        }

        public void setInvestment(Duration investment) {
            this.investment = investment;
        }

        public Duration getSimilarity() {
            return similarity;
        }

        public void setSimilarity(Duration similarity) {
            this.similarity = similarity;
        }

        public Duration getSummary() {
            return summary;
        }

        public void setSummary(Duration summary) {
            this.summary = summary;
        }
    }
}
