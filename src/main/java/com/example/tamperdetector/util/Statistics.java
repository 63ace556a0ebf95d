package com.example.tamperdetector.util;

import java.util.List;

/**
 * Population statistics over sample arrays. Empty inputs yield {@code 0} instead of NaN.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double value : values) {
            double delta = value - mean;
            sum += delta * delta;
        }
        return sum / values.length;
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double mean(List<Double> values) {
        return mean(toArray(values));
    }

    public static double standardDeviation(List<Double> values) {
        return standardDeviation(toArray(values));
    }

    /**
     * Ratio guarded against a zero or negative denominator.
     */
    public static double safeRatio(double numerator, double denominator) {
        if (denominator <= 0.0 || Double.isNaN(denominator) || Double.isNaN(numerator)) {
            return 0.0;
        }
        return numerator / denominator;
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
