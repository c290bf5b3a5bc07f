/*
 * Copyright (c) 2025 The findcont Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.findcont.util;

import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.jetbrains.annotations.NotNull;

/**
 * Robust statistics on plain arrays.
 */
public final class MathUtils {

  /**
   * Converts a median absolute deviation into a Gaussian standard deviation.
   */
  public static final double MAD_TO_SIGMA = 1.4826;

  /**
   * Blocks whose spread is below this are treated as constant.
   */
  public static final double ZERO_SPREAD = 1e-17;

  private MathUtils() {
  }

  public static double median(@NotNull double[] data) {
    if (data.length == 0) {
      return Double.NaN;
    }
    return new Median().evaluate(data);
  }

  /**
   * @return raw median absolute deviation, not scaled to sigma
   */
  public static double mad(@NotNull double[] data) {
    if (data.length == 0) {
      return Double.NaN;
    }
    final Median med = new Median();
    final double m = med.evaluate(data);
    final double[] dev = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      dev[i] = Math.abs(data[i] - m);
    }
    return med.evaluate(dev);
  }

  public static double scaledMad(@NotNull double[] data) {
    return MAD_TO_SIGMA * mad(data);
  }

  /**
   * Population standard deviation.
   */
  public static double std(@NotNull double[] data) {
    if (data.length == 0) {
      return 0d;
    }
    return new StandardDeviation(false).evaluate(data);
  }

  public static double min(@NotNull double[] a) {
    double min = Double.POSITIVE_INFINITY;
    for (double v : a) {
      min = Math.min(min, v);
    }
    return min;
  }

  public static double max(@NotNull double[] a) {
    double max = Double.NEGATIVE_INFINITY;
    for (double v : a) {
      max = Math.max(max, v);
    }
    return max;
  }

  /**
   * @return the most frequent value, the smallest one on ties
   */
  public static double mode(@NotNull double[] a) {
    final double[] c = Arrays.copyOf(a, a.length);
    Arrays.sort(c);
    double best = c[0];
    int bestCount = 0;
    int run = 0;
    for (int i = 0; i < c.length; i++) {
      run = i > 0 && c[i] == c[i - 1] ? run + 1 : 1;
      if (run > bestCount) {
        bestCount = run;
        best = c[i];
      }
    }
    return best;
  }

  /**
   * n-th order absolute differences, |Δⁿa|.
   */
  public static double[] absDiff(@NotNull double[] a, int order) {
    double[] d = a;
    for (int o = 0; o < order && d.length > 0; o++) {
      final double[] next = new double[Math.max(0, d.length - 1)];
      for (int i = 0; i < next.length; i++) {
        next[i] = d[i + 1] - d[i];
      }
      d = next;
    }
    final double[] out = new double[d.length];
    for (int i = 0; i < d.length; i++) {
      out[i] = Math.abs(d[i]);
    }
    return out;
  }

  public static boolean nearlyEqual(double a, double b, double relTolerance) {
    return Math.abs(a - b) <= Math.abs(relTolerance * b) || a == b;
  }
}
