package com.geoinsight.backend.config;

import com.geoinsight.backend.model.AmenityCategory;
import com.geoinsight.backend.scoring.IrrSolverConfig;
import com.geoinsight.backend.scoring.VegetationThresholds;
import com.geoinsight.backend.scoring.WalkScoreConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tuning of the scoring library, bound from {@code geoinsight.scoring.*}.
 */
@ConfigurationProperties(prefix = "geoinsight.scoring")
public class ScoringProperties {

    private final Walk walk = new Walk();
    private final Vegetation vegetation = new Vegetation();
    private final Irr irr = new Irr();

    public Walk getWalk() {
        return walk;
    }

    public Vegetation getVegetation() {
        return vegetation;
    }

    public Irr getIrr() {
        return irr;
    }

    public WalkScoreConfig toWalkScoreConfig() {
        Map<AmenityCategory, WalkScoreConfig.CategoryWeight> weights = WalkScoreConfig.defaultWeights();
        walk.getWeights().forEach((category, weight) ->
                weights.put(category, new WalkScoreConfig.CategoryWeight(weight.getWeight(), weight.getMaxCount())));
        return new WalkScoreConfig(weights, walk.getFullCreditDistanceMeters(), walk.getCutoffDistanceMeters());
    }

    public VegetationThresholds toVegetationThresholds() {
        return new VegetationThresholds(
                vegetation.getHueMinDegrees(),
                vegetation.getHueMaxDegrees(),
                vegetation.getMinSaturation(),
                vegetation.getMinValue(),
                vegetation.getOpeningKernelSize());
    }

    public IrrSolverConfig toIrrSolverConfig() {
        return new IrrSolverConfig(irr.getInitialGuess(), irr.getTolerance(), irr.getMaxIterations(),
                irr.getDerivativeEpsilon());
    }

    public static class Walk {

        private double fullCreditDistanceMeters = WalkScoreConfig.DEFAULT_FULL_CREDIT_DISTANCE;
        private double cutoffDistanceMeters = WalkScoreConfig.DEFAULT_CUTOFF_DISTANCE;

        /**
         * Overrides of the default category weights.
         */
        private Map<AmenityCategory, Weight> weights = new EnumMap<>(AmenityCategory.class);

        public double getFullCreditDistanceMeters() {
            return fullCreditDistanceMeters;
        }

        public void setFullCreditDistanceMeters(double fullCreditDistanceMeters) {
            this.fullCreditDistanceMeters = fullCreditDistanceMeters;
        }

        public double getCutoffDistanceMeters() {
            return cutoffDistanceMeters;
        }

        public void setCutoffDistanceMeters(double cutoffDistanceMeters) {
            this.cutoffDistanceMeters = cutoffDistanceMeters;
        }

        public Map<AmenityCategory, Weight> getWeights() {
            return weights;
        }

        public void setWeights(Map<AmenityCategory, Weight> weights) {
            this.weights = weights;
        }
    }

    public static class Weight {

        private double weight;
        private int maxCount = 1;

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public int getMaxCount() {
            return maxCount;
        }

        public void setMaxCount(int maxCount) {
            this.maxCount = maxCount;
        }
    }

    public static class Vegetation {

        private double hueMinDegrees = 60.0;
        private double hueMaxDegrees = 180.0;
        private double minSaturation = 0.08;
        private double minValue = 0.25;
        private int openingKernelSize = 3;

        public double getHueMinDegrees() {
            return hueMinDegrees;
        }

        public void setHueMinDegrees(double hueMinDegrees) {
            this.hueMinDegrees = hueMinDegrees;
        }

        public double getHueMaxDegrees() {
            return hueMaxDegrees;
        }

        public void setHueMaxDegrees(double hueMaxDegrees) {
            this.hueMaxDegrees = hueMaxDegrees;
        }

        public double getMinSaturation() {
            return minSaturation;
        }

        public void setMinSaturation(double minSaturation) {
            this.minSaturation = minSaturation;
        }

        public double getMinValue() {
            return minValue;
        }

        public void setMinValue(double minValue) {
            this.minValue = minValue;
        }

        public int getOpeningKernelSize() {
            return openingKernelSize;
        }

        public void setOpeningKernelSize(int openingKernelSize) {
            this.openingKernelSize = openingKernelSize;
        }
    }

    public static class Irr {

        private double initialGuess = 0.1;
        private double tolerance = 1e-6;
        private int maxIterations = 100;
        private double derivativeEpsilon = 1e-12;

        /**
         * Initial guesses tried in order after the configured one fails.
         */
        private List<Double> fallbackGuesses = new ArrayList<>(List.of(0.0, 0.05, 0.25, -0.05, 0.5));

        public double getInitialGuess() {
            return initialGuess;
        }

        public void setInitialGuess(double initialGuess) {
            this.initialGuess = initialGuess;
        }

        public double getTolerance() {
            return tolerance;
        }

        public void setTolerance(double tolerance) {
            this.tolerance = tolerance;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public double getDerivativeEpsilon() {
            return derivativeEpsilon;
        }

        public void setDerivativeEpsilon(double derivativeEpsilon) {
            this.derivativeEpsilon = derivativeEpsilon;
        }

        public List<Double> getFallbackGuesses() {
            return fallbackGuesses;
        }

        public void setFallbackGuesses(List<Double> fallbackGuesses) {
            this.fallbackGuesses = fallbackGuesses;
        }
    }
}
