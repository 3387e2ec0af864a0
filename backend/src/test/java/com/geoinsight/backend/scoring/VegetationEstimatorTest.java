package com.geoinsight.backend.scoring;

import com.geoinsight.backend.exception.InvalidImageException;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VegetationEstimatorTest {

    private static final Color FOLIAGE = new Color(34, 139, 34);
    private static final Color ASPHALT = new Color(90, 90, 90);
    private static final Color WATER = new Color(20, 60, 200);

    private final VegetationEstimator estimator = new VegetationEstimator();
    private final VegetationThresholds thresholds = VegetationThresholds.defaults();

    @Test
    void shouldReportFullCoverageForUniformGreen() throws IOException {
        BufferedImage image = filled(10, 10, FOLIAGE);

        VegetationResult result = estimator.estimate(encode(image), thresholds);

        assertThat(result.coverage()).isEqualTo(1.0);
        assertThat(result.vegetationPixels()).isEqualTo(100);
        assertThat(result.totalPixels()).isEqualTo(100);
    }

    @Test
    void shouldReportNoCoverageForGreyOrBlue() {
        assertThat(estimator.estimate(filled(8, 8, ASPHALT), thresholds).coverage()).isZero();
        assertThat(estimator.estimate(filled(8, 8, WATER), thresholds).coverage()).isZero();
    }

    @Test
    void shouldKeepSolidRegionsThroughOpening() {
        // Given left half green, right half grey
        BufferedImage image = filled(10, 10, ASPHALT);
        paint(image, 0, 0, 5, 10, FOLIAGE);

        // When
        VegetationResult result = estimator.estimate(image, thresholds);

        // Then
        assertThat(result.coverage()).isEqualTo(0.5);
        assertThat(result.mask().get(0, 0)).isTrue();
        assertThat(result.mask().get(4, 9)).isTrue();
        assertThat(result.mask().get(5, 5)).isFalse();
    }

    @Test
    void shouldRemoveIsolatedSpeckles() {
        BufferedImage image = filled(9, 9, ASPHALT);
        image.setRGB(4, 4, FOLIAGE.getRGB());

        assertThat(estimator.estimate(image, thresholds).vegetationPixels()).isZero();
    }

    @Test
    void shouldKeepSpecklesWhenOpeningIsDisabled() {
        BufferedImage image = filled(10, 10, ASPHALT);
        image.setRGB(4, 4, FOLIAGE.getRGB());
        VegetationThresholds noOpening = new VegetationThresholds(60, 180, 0.08, 0.25, 1);

        VegetationResult result = estimator.estimate(image, noOpening);

        assertThat(result.vegetationPixels()).isEqualTo(1);
        assertThat(result.coverage()).isEqualTo(0.01);
    }

    @Test
    void shouldIgnoreDarkGreen() {
        BufferedImage image = filled(6, 6, new Color(0, 40, 0));

        assertThat(estimator.estimate(image, thresholds).coverage()).isZero();
    }

    @Test
    void shouldRejectUndecodableBytes() {
        assertThatThrownBy(() -> estimator.estimate(new byte[]{1, 2, 3, 4}, thresholds))
                .isInstanceOf(InvalidImageException.class);
        assertThatThrownBy(() -> estimator.estimate(new byte[0], thresholds))
                .isInstanceOf(InvalidImageException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldRejectZeroAreaMask() {
        assertThatThrownBy(() -> estimator.estimate(new VegetationMask(0, 5)))
                .isInstanceOf(InvalidImageException.class);
    }

    @Test
    void shouldEstimateSameImageIdentically() throws IOException {
        BufferedImage image = filled(12, 12, ASPHALT);
        paint(image, 0, 0, 6, 12, FOLIAGE);
        paint(image, 8, 2, 3, 3, FOLIAGE);
        image.setRGB(10, 10, FOLIAGE.getRGB());
        byte[] encoded = encode(image);

        VegetationResult first = estimator.estimate(encoded, thresholds);
        VegetationResult second = estimator.estimate(encoded, thresholds);

        assertThat(second.coverage()).isEqualTo(first.coverage());
        assertThat(second.vegetationPixels()).isEqualTo(first.vegetationPixels());
        assertThat(second.mask().toBitSet()).isEqualTo(first.mask().toBitSet());
    }

    private static BufferedImage filled(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        paint(image, 0, 0, width, height, color);
        return image;
    }

    private static void paint(BufferedImage image, int x0, int y0, int width, int height, Color color) {
        for (int y = y0; y < y0 + height; y++) {
            for (int x = x0; x < x0 + width; x++) {
                image.setRGB(x, y, color.getRGB());
            }
        }
    }

    private static byte[] encode(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
