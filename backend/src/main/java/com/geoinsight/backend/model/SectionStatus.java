package com.geoinsight.backend.model;

public enum SectionStatus {
    AVAILABLE,
    FAILED,
    NOT_REQUESTED
}
