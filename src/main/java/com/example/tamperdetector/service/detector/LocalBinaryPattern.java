package com.example.tamperdetector.service.detector;

/**
 * Rotation-invariant uniform local binary patterns over a circular neighbourhood sampled with
 * bilinear interpolation. Uniform codes hold the number of set bits ({@code 0..points}); every
 * other pattern maps to {@code points + 1}.
 */
final class LocalBinaryPattern {

    private final int points;
    private final double[] rowOffsets;
    private final double[] columnOffsets;

    LocalBinaryPattern(int points, double radius) {
        if (points < 1 || radius <= 0) {
            throw new IllegalArgumentException("points and radius must be positive");
        }
        this.points = points;
        this.rowOffsets = new double[points];
        this.columnOffsets = new double[points];
        for (int i = 0; i < points; i++) {
            double angle = 2 * Math.PI * i / points;
            rowOffsets[i] = round5(-radius * Math.sin(angle));
            columnOffsets[i] = round5(radius * Math.cos(angle));
        }
    }

    int codes() {
        return points + 2;
    }

    int[] compute(double[] gray, int width, int height) {
        int[] result = new int[width * height];
        boolean[] signs = new boolean[points];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                double center = gray[r * width + c];
                for (int i = 0; i < points; i++) {
                    double sample = interpolate(gray, width, height, r + rowOffsets[i], c + columnOffsets[i]);
                    signs[i] = sample - center >= 0;
                }
                result[r * width + c] = code(signs);
            }
        }
        return result;
    }

    /**
     * Normalized histogram of the codes, one bin per code value.
     */
    double[] histogram(int[] codes) {
        double[] histogram = new double[codes()];
        if (codes.length == 0) {
            return histogram;
        }
        for (int code : codes) {
            histogram[code]++;
        }
        for (int i = 0; i < histogram.length; i++) {
            histogram[i] /= codes.length;
        }
        return histogram;
    }

    static double uniformity(double[] histogram) {
        double sum = 0.0;
        for (double p : histogram) {
            sum += p * p;
        }
        return sum;
    }

    private int code(boolean[] signs) {
        int transitions = 0;
        int ones = 0;
        for (int i = 0; i < points; i++) {
            if (signs[i]) {
                ones++;
            }
            if (i > 0 && signs[i] != signs[i - 1]) {
                transitions++;
            }
        }
        return transitions <= 2 ? ones : points + 1;
    }

    // samples outside the image read as 0
    private static double interpolate(double[] gray, int width, int height, double row, double column) {
        int minRow = (int) Math.floor(row);
        int minColumn = (int) Math.floor(column);
        int maxRow = (int) Math.ceil(row);
        int maxColumn = (int) Math.ceil(column);
        double dr = row - minRow;
        double dc = column - minColumn;
        double top = (1 - dc) * pixel(gray, width, height, minRow, minColumn)
                + dc * pixel(gray, width, height, minRow, maxColumn);
        double bottom = (1 - dc) * pixel(gray, width, height, maxRow, minColumn)
                + dc * pixel(gray, width, height, maxRow, maxColumn);
        return (1 - dr) * top + dr * bottom;
    }

    private static double pixel(double[] gray, int width, int height, int row, int column) {
        if (row < 0 || row >= height || column < 0 || column >= width) {
            return 0.0;
        }
        return gray[row * width + column];
    }

    private static double round5(double value) {
        return Math.round(value * 1e5) / 1e5;
    }
}
