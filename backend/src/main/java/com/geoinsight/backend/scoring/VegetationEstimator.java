package com.geoinsight.backend.scoring;

import com.geoinsight.backend.exception.InvalidImageException;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Estimates the share of green vegetation in an image.
 *
 * <p>Pixels are classified in HSV space, then the mask is cleaned with a
 * morphological opening (erosion followed by dilation) so isolated green
 * speckles do not count. Neighbours outside the image are ignored by both
 * passes.
 */
public class VegetationEstimator {

    public VegetationResult estimate(byte[] encodedImage, VegetationThresholds thresholds) {
        if (encodedImage == null || encodedImage.length == 0) {
            throw new InvalidImageException("Image data is empty");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(encodedImage));
        } catch (IOException e) {
            throw new InvalidImageException("Image could not be decoded", e);
        }
        if (image == null) {
            throw new InvalidImageException("Unsupported or corrupt image format");
        }
        return estimate(image, thresholds);
    }

    public VegetationResult estimate(BufferedImage image, VegetationThresholds thresholds) {
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidImageException("Image has zero area");
        }
        VegetationMask raw = classify(image, thresholds);
        VegetationMask opened = open(raw, thresholds.openingKernelSize());
        return estimate(opened);
    }

    /**
     * Coverage of a pre-computed mask.
     */
    public VegetationResult estimate(VegetationMask mask) {
        if (mask == null || mask.area() == 0) {
            throw new InvalidImageException("Image has zero area");
        }
        int vegetation = mask.count();
        int total = mask.area();
        return new VegetationResult((double) vegetation / total, vegetation, total, mask);
    }

    VegetationMask classify(BufferedImage image, VegetationThresholds thresholds) {
        int width = image.getWidth();
        int height = image.getHeight();
        VegetationMask mask = new VegetationMask(width, height);
        float[] hsb = new float[3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                Color.RGBtoHSB((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF, hsb);
                double hue = hsb[0] * 360.0;
                boolean green = hue >= thresholds.hueMinDegrees()
                        && hue <= thresholds.hueMaxDegrees()
                        && hsb[1] >= thresholds.minSaturation()
                        && hsb[2] >= thresholds.minValue();
                if (green) {
                    mask.set(x, y, true);
                }
            }
        }
        return mask;
    }

    VegetationMask open(VegetationMask mask, int kernelSize) {
        if (kernelSize <= 1) {
            return mask;
        }
        int radius = kernelSize / 2;
        return dilate(erode(mask, radius), radius);
    }

    private VegetationMask erode(VegetationMask mask, int radius) {
        int width = mask.getWidth();
        int height = mask.getHeight();
        VegetationMask out = new VegetationMask(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (mask.get(x, y) && allSet(mask, x, y, radius)) {
                    out.set(x, y, true);
                }
            }
        }
        return out;
    }

    private VegetationMask dilate(VegetationMask mask, int radius) {
        int width = mask.getWidth();
        int height = mask.getHeight();
        VegetationMask out = new VegetationMask(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (anySet(mask, x, y, radius)) {
                    out.set(x, y, true);
                }
            }
        }
        return out;
    }

    private static boolean allSet(VegetationMask mask, int cx, int cy, int radius) {
        for (int y = Math.max(0, cy - radius); y <= Math.min(mask.getHeight() - 1, cy + radius); y++) {
            for (int x = Math.max(0, cx - radius); x <= Math.min(mask.getWidth() - 1, cx + radius); x++) {
                if (!mask.get(x, y)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean anySet(VegetationMask mask, int cx, int cy, int radius) {
        for (int y = Math.max(0, cy - radius); y <= Math.min(mask.getHeight() - 1, cy + radius); y++) {
            for (int x = Math.max(0, cx - radius); x <= Math.min(mask.getWidth() - 1, cx + radius); x++) {
                if (mask.get(x, y)) {
                    return true;
                }
            }
        }
        return false;
    }
}
