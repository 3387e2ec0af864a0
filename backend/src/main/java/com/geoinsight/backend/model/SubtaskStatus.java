package com.geoinsight.backend.model;

public enum SubtaskStatus {
    SUCCESS,
    FAILED
}
