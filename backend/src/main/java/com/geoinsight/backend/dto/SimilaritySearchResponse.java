package com.geoinsight.backend.dto;

import com.geoinsight.backend.model.SimilarityMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilaritySearchResponse {

    private List<SimilarityMatch> matches;
    private int count;
    private double threshold;
}
