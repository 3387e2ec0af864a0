package com.geoinsight.backend.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Units of work of an analysis job. A failed critical subtask fails the
 * whole job; a failed degradable one only flags its report section.
 */
public enum SubtaskType {
    LOCATION("location", true),
    WALK_SCORE("walk_score", true),
    VEGETATION("vegetation", false),
    INVESTMENT("investment", false),
    SIMILARITY("similarity", false),
    SUMMARY("summary", false);

    private final String key;
    private final boolean critical;

    SubtaskType(String key, boolean critical) {
        this.key = key;
        this.critical = critical;
    }

    /**
     * Name used in {@code partialResults} and in report sections.
     */
    public String key() {
        return key;
    }

    public boolean isCritical() {
        return critical;
    }

    public static Optional<SubtaskType> fromKey(String key) {
        return Arrays.stream(values()).filter(t -> t.key.equals(key)).findFirst();
    }
}
