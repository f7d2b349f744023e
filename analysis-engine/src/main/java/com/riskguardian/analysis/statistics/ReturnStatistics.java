package com.riskguardian.analysis.statistics;

import java.util.List;

/**
 * Pure return-series utilities.
 * Input closes are expected oldest-first (index 0 = earliest close).
 */
public final class ReturnStatistics {

    private ReturnStatistics() {}

    // ── returns ─────────────────────────────────────────────────────────────

    /**
     * Simple daily returns {@code (c[i] - c[i-1]) / c[i-1]}.
     * @param closes  closing prices, oldest-first, all positive
     * @return {@code closes.size() - 1} returns; empty for fewer than two closes
     */
    public static double[] simpleReturns(List<Double> closes) {
        if (closes == null || closes.size() < 2) return new double[0];
        double[] returns = new double[closes.size() - 1];
        for (int i = 1; i < closes.size(); i++) {
            double prev = closes.get(i - 1);
            returns[i - 1] = (closes.get(i) - prev) / prev;
        }
        return returns;
    }

    /**
     * Fixed-weight blend of aligned return series: {@code Σ w_k · r_k[t]}.
     * Weights are used as given; callers normalise them.
     */
    public static double[] weightedReturns(List<double[]> series, double[] weights) {
        if (series.size() != weights.length) {
            throw new IllegalArgumentException("series/weights size mismatch: " + series.size() + " vs " + weights.length);
        }
        if (series.isEmpty()) return new double[0];
        int length = series.get(0).length;
        double[] blended = new double[length];
        for (int k = 0; k < series.size(); k++) {
            double[] r = series.get(k);
            if (r.length != length) {
                throw new IllegalArgumentException("return series are not aligned: " + r.length + " vs " + length);
            }
            for (int t = 0; t < length; t++) {
                blended[t] += weights[k] * r[t];
            }
        }
        return blended;
    }

    // ── correlation ─────────────────────────────────────────────────────────

    /**
     * Pearson correlation coefficient of two aligned series.
     * @return value in [-1, 1]; 0.0 for mismatched or empty input, a zero-variance series,
     *         or any non-finite intermediate
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) return 0.0;
        int n = x.length;
        double meanX = 0, meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        double cov = 0, varX = 0, varY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            cov  += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) return 0.0;
        double r = cov / Math.sqrt(varX * varY);
        if (Double.isNaN(r) || Double.isInfinite(r)) return 0.0;
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /** {@code round(|r| × 100)} clamped to [0, 100]. */
    public static int toPercentage(double coefficient) {
        long pct = Math.round(Math.abs(coefficient) * 100.0);
        return (int) Math.max(0, Math.min(100, pct));
    }
}
