package com.geoinsight.backend.support;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Small PNG fixtures.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * PNG whose left {@code greenColumns} columns are foliage green and the rest grey.
     */
    public static byte[] png(int width, int height, int greenColumns) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int green = new Color(34, 139, 34).getRGB();
        int grey = new Color(90, 90, 90).getRGB();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, x < greenColumns ? green : grey);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
