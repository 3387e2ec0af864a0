package com.geoinsight.backend.scoring;

import com.geoinsight.backend.model.AmenityCategory;
import com.geoinsight.backend.model.AmenityRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WalkScoreCalculatorTest {

    private final WalkScoreCalculator calculator = new WalkScoreCalculator();
    private final WalkScoreConfig config = WalkScoreConfig.defaults();

    @Test
    void shouldScoreZeroWithoutAmenities() {
        WalkScoreResult result = calculator.score(List.of(), config);

        assertThat(result.score()).isZero();
        assertThat(result.totalAmenities()).isZero();
        assertThat(result.breakdown()).hasSize(config.weights().size());
    }

    @Test
    void shouldGiveFullCreditWithinFullCreditDistance() {
        // Given one grocery at 100 m, weight 18 spread over 2 counted stores
        List<AmenityRecord> amenities = List.of(new AmenityRecord("Corner Market", AmenityCategory.GROCERY, 100));

        // When
        WalkScoreResult result = calculator.score(amenities, config);

        // Then
        assertThat(result.score()).isEqualTo(9.0);
        CategoryScore grocery = breakdownOf(result, AmenityCategory.GROCERY);
        assertThat(grocery.found()).isEqualTo(1);
        assertThat(grocery.counted()).isEqualTo(1);
        assertThat(grocery.nearestDistanceMeters()).isEqualTo(100.0);
        assertThat(grocery.maxPoints()).isEqualTo(18.0);
    }

    @Test
    void shouldDecayLinearlyBetweenFullCreditAndCutoff() {
        assertThat(calculator.decay(400, config)).isEqualTo(1.0);
        assertThat(calculator.decay(1000, config)).isCloseTo(0.5, within(1e-9));
        assertThat(calculator.decay(1600, config)).isZero();
        assertThat(calculator.decay(5000, config)).isZero();

        WalkScoreResult result = calculator.score(
                List.of(new AmenityRecord("Far Market", AmenityCategory.GROCERY, 1000)), config);
        assertThat(result.score()).isEqualTo(4.5);
    }

    @Test
    void shouldIgnoreAmenitiesBeyondCutoffButCountThem() {
        WalkScoreResult result = calculator.score(
                List.of(new AmenityRecord("Distant Park", AmenityCategory.PARK, 2500)), config);

        assertThat(result.score()).isZero();
        assertThat(result.totalAmenities()).isEqualTo(1);
        assertThat(breakdownOf(result, AmenityCategory.PARK).counted()).isZero();
    }

    @Test
    void shouldCountOnlyClosestAmenitiesPerCategory() {
        // Given five pharmacies while only one is counted
        List<AmenityRecord> amenities = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            amenities.add(new AmenityRecord("Pharmacy " + i, AmenityCategory.PHARMACY, 50 + i * 10));
        }

        // When
        WalkScoreResult result = calculator.score(amenities, config);

        // Then
        CategoryScore pharmacy = breakdownOf(result, AmenityCategory.PHARMACY);
        assertThat(pharmacy.found()).isEqualTo(5);
        assertThat(pharmacy.counted()).isEqualTo(1);
        assertThat(pharmacy.points()).isEqualTo(6.0);
        assertThat(result.score()).isEqualTo(6.0);
    }

    @Test
    void shouldReachHundredForSaturatedNeighbourhood() {
        List<AmenityRecord> amenities = new ArrayList<>();
        config.weights().forEach((category, weight) -> {
            for (int i = 0; i < weight.maxCount() + 2; i++) {
                amenities.add(new AmenityRecord(category + "-" + i, category, 20));
            }
        });

        WalkScoreResult result = calculator.score(amenities, config);

        assertThat(result.score()).isEqualTo(100.0);
    }

    @Test
    void shouldNeverDecreaseWhenCloserAmenityIsAdded() {
        List<AmenityRecord> amenities = new ArrayList<>(List.of(
                new AmenityRecord("Stop A", AmenityCategory.TRANSIT, 900),
                new AmenityRecord("Stop B", AmenityCategory.TRANSIT, 1200),
                new AmenityRecord("Stop C", AmenityCategory.TRANSIT, 1500)));
        double before = calculator.score(amenities, config).score();

        amenities.add(new AmenityRecord("Stop D", AmenityCategory.TRANSIT, 300));
        double after = calculator.score(amenities, config).score();

        assertThat(after).isGreaterThanOrEqualTo(before);
    }

    @Test
    void shouldIgnoreCategoriesWithoutWeight() {
        WalkScoreResult result = calculator.score(
                List.of(new AmenityRecord("Kiosk", AmenityCategory.OTHER, 10)), config);

        assertThat(result.score()).isZero();
        assertThat(result.totalAmenities()).isEqualTo(1);
    }

    @Test
    void shouldApplyCustomWeights() {
        WalkScoreConfig custom = new WalkScoreConfig(
                Map.of(AmenityCategory.CAFE, new WalkScoreConfig.CategoryWeight(40, 1)), 100, 500);

        WalkScoreResult result = calculator.score(
                List.of(new AmenityRecord("Espresso Bar", AmenityCategory.CAFE, 300)), custom);

        assertThat(result.score()).isEqualTo(20.0);
        assertThat(result.breakdown()).hasSize(1);
    }

    @Test
    void shouldScoreSameAmenitiesIdentically() {
        List<AmenityRecord> amenities = List.of(
                new AmenityRecord("Corner Market", AmenityCategory.GROCERY, 120),
                new AmenityRecord("Vohuman Cafe", AmenityCategory.CAFE, 640),
                new AmenityRecord("Bus Stand", AmenityCategory.TRANSIT, 310),
                new AmenityRecord("Bus Depot", AmenityCategory.TRANSIT, 980),
                new AmenityRecord("Empress Garden", AmenityCategory.PARK, 1450));

        WalkScoreResult first = calculator.score(amenities, config);
        WalkScoreResult second = calculator.score(amenities, config);

        assertThat(second).isEqualTo(first);
        assertThat(second.score()).isEqualTo(first.score());
    }

    private static CategoryScore breakdownOf(WalkScoreResult result, AmenityCategory category) {
        return result.breakdown().stream()
                .filter(score -> score.category() == category)
                .findFirst()
                .orElseThrow();
    }
}
