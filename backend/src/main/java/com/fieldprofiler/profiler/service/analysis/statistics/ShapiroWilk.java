package com.fieldprofiler.profiler.service.analysis.statistics;

import java.util.Arrays;

import org.apache.commons.math3.distribution.NormalDistribution;

import lombok.Value;

/**
 * Shapiro-Wilk W test for normality following Royston's algorithm AS R94 (Applied Statistics,
 * 1995), valid for 3 to 5000 observations.
 */
public final class ShapiroWilk {

  public static final int MIN_SAMPLE_SIZE = 3;

  private static final double[] G = {-2.273, 0.459};
  private static final double[] C1 = {0.0, 0.221157, -0.147981, -2.07119, 4.434685, -2.706056};
  private static final double[] C2 = {0.0, 0.042981, -0.293762, -1.752461, 5.682633, -3.582633};
  private static final double[] C3 = {0.544, -0.39978, 0.025054, -6.714e-4};
  private static final double[] C4 = {1.3822, -0.77857, 0.062767, -0.0020322};
  private static final double[] C5 = {-1.5861, -0.31082, -0.083751, 0.0038915};
  private static final double[] C6 = {-0.4803, -0.082676, 0.0030302};

  private static final double SMALL = 1e-19;
  private static final double PI6 = 6.0 / Math.PI;
  private static final double STQR = Math.PI / 3.0;

  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

  private ShapiroWilk() {}

  @Value
  public static class Result {
    double statistic;
    double pValue;
  }

  /**
   * @param data NaN-free observations in any order
   * @throws IllegalArgumentException if fewer than three observations are given
   */
  public static Result test(double[] data) {
    int n = data.length;
    if (n < MIN_SAMPLE_SIZE) {
      throw new IllegalArgumentException("Data must be at least length 3.");
    }
    double[] x = data.clone();
    Arrays.sort(x);

    double range = x[n - 1] - x[0];
    if (range < SMALL) {
      return new Result(1.0, 1.0);
    }

    double[] a = coefficients(n);
    double w1 = oneMinusW(x, a, range);
    double w = 1.0 - w1;
    return new Result(w, pValue(n, w, w1));
  }

  /** Positive half of the antisymmetric coefficient vector; a[i] weights x[n-1-i] - x[i]. */
  private static double[] coefficients(int n) {
    int half = n / 2;
    double[] a = new double[half];
    if (n == 3) {
      a[0] = Math.sqrt(0.5);
      return a;
    }

    double an25 = n + 0.25;
    double[] m = new double[half];
    double summ2 = 0.0;
    for (int i = 0; i < half; i++) {
      m[i] = STANDARD_NORMAL.inverseCumulativeProbability((i + 1 - 0.375) / an25);
      summ2 += m[i] * m[i];
    }
    summ2 *= 2.0;
    double ssumm2 = Math.sqrt(summ2);
    double rsn = 1.0 / Math.sqrt(n);
    double a1 = poly(C1, rsn) - m[0] / ssumm2;

    int first;
    double fac;
    if (n > 5) {
      first = 2;
      double a2 = -m[1] / ssumm2 + poly(C2, rsn);
      fac =
          Math.sqrt(
              (summ2 - 2.0 * (m[0] * m[0]) - 2.0 * (m[1] * m[1]))
                  / (1.0 - 2.0 * (a1 * a1) - 2.0 * (a2 * a2)));
      a[1] = a2;
    } else {
      first = 1;
      fac = Math.sqrt((summ2 - 2.0 * (m[0] * m[0])) / (1.0 - 2.0 * (a1 * a1)));
    }
    a[0] = a1;
    for (int i = first; i < half; i++) {
      a[i] = -m[i] / fac;
    }
    return a;
  }

  /** 1 - W, computed as one minus the squared correlation of coefficients and scaled data. */
  private static double oneMinusW(double[] x, double[] a, double range) {
    int n = x.length;
    int half = a.length;
    double[] c = new double[n];
    for (int i = 0; i < half; i++) {
      c[i] = -a[i];
      c[n - 1 - i] = a[i];
    }

    double meanC = 0.0;
    double meanX = 0.0;
    double[] scaled = new double[n];
    for (int i = 0; i < n; i++) {
      scaled[i] = x[i] / range;
      meanC += c[i];
      meanX += scaled[i];
    }
    meanC /= n;
    meanX /= n;

    double ssa = 0.0;
    double ssx = 0.0;
    double sax = 0.0;
    for (int i = 0; i < n; i++) {
      double dc = c[i] - meanC;
      double dx = scaled[i] - meanX;
      ssa += dc * dc;
      ssx += dx * dx;
      sax += dc * dx;
    }
    double ssassx = Math.sqrt(ssa * ssx);
    return (ssassx - sax) * (ssassx + sax) / (ssa * ssx);
  }

  private static double pValue(int n, double w, double w1) {
    if (n == 3) {
      // W of three points lies in [0.75, 1]; rounding may overshoot either bound
      double bounded = Math.min(1.0, Math.max(0.75, w));
      double p = PI6 * (Math.asin(Math.sqrt(bounded)) - STQR);
      return Math.min(1.0, Math.max(0.0, p));
    }

    // rounding can push 1 - W marginally below zero for a perfect fit
    double y = Math.log(Math.max(w1, 0.0));
    double m;
    double s;
    if (n <= 11) {
      double gamma = poly(G, n);
      if (y >= gamma) {
        return 1e-99;
      }
      y = -Math.log(gamma - y);
      m = poly(C3, n);
      s = Math.exp(poly(C4, n));
    } else {
      double xx = Math.log(n);
      m = poly(C5, xx);
      s = Math.exp(poly(C6, xx));
    }
    return 1.0 - STANDARD_NORMAL.cumulativeProbability((y - m) / s);
  }

  /** Evaluates c[0] + c[1]x + c[2]x^2 + ... */
  private static double poly(double[] c, double x) {
    double result = 0.0;
    for (int i = c.length - 1; i >= 0; i--) {
      result = result * x + c[i];
    }
    return result;
  }
}
