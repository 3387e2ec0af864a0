package com.geoinsight.backend.model;

import com.geoinsight.backend.exception.ErrorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReportSection {

    private SectionStatus status;
    private Map<String, Object> data;
    private ErrorType errorType;
    private String error;
}
