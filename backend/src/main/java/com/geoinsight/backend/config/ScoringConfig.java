package com.geoinsight.backend.config;

import com.geoinsight.backend.scoring.AmountParser;
import com.geoinsight.backend.scoring.FinancialMetricsEngine;
import com.geoinsight.backend.scoring.IrrSolver;
import com.geoinsight.backend.scoring.SimilarityRanker;
import com.geoinsight.backend.scoring.VegetationEstimator;
import com.geoinsight.backend.scoring.WalkScoreCalculator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the stateless scoring library as beans.
 */
@Configuration
@EnableConfigurationProperties({ScoringProperties.class, SimilarityProperties.class})
public class ScoringConfig {

    @Bean
    public WalkScoreCalculator walkScoreCalculator() {
        return new WalkScoreCalculator();
    }

    @Bean
    public VegetationEstimator vegetationEstimator() {
        return new VegetationEstimator();
    }

    @Bean
    public IrrSolver irrSolver() {
        return new IrrSolver();
    }

    @Bean
    public FinancialMetricsEngine financialMetricsEngine(IrrSolver irrSolver) {
        return new FinancialMetricsEngine(irrSolver);
    }

    @Bean
    public AmountParser amountParser() {
        return new AmountParser();
    }

    @Bean
    public SimilarityRanker similarityRanker() {
        return new SimilarityRanker();
    }
}
