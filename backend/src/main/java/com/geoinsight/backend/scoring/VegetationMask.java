package com.geoinsight.backend.scoring;

import java.util.BitSet;

/**
 * Row-major binary mask, {@code true} for vegetation pixels.
 */
public final class VegetationMask {

    private final int width;
    private final int height;
    private final BitSet bits;

    public VegetationMask(int width, int height) {
        this(width, height, new BitSet(Math.max(0, width) * Math.max(0, height)));
    }

    public VegetationMask(int width, int height, BitSet bits) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("negative mask size " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.bits = (BitSet) bits.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int area() {
        return width * height;
    }

    public boolean get(int x, int y) {
        return bits.get(y * width + x);
    }

    public void set(int x, int y, boolean value) {
        bits.set(y * width + x, value);
    }

    public int count() {
        return bits.cardinality();
    }

    public BitSet toBitSet() {
        return (BitSet) bits.clone();
    }
}
