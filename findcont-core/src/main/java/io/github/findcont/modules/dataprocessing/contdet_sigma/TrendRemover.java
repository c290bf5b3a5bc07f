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

package io.github.findcont.modules.dataprocessing.contdet_sigma;

import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.util.MathUtils;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Least squares polynomial fit over continuum channels. The constant term is kept when the trend is
 * removed, so the baseline level of the spectrum does not move.
 */
public class TrendRemover {

  private static final Logger logger = Logger.getLogger(TrendRemover.class.getName());

  private final int maxOrder;
  private final double improvementRatio;

  /**
   * @param maxOrder         1 for linear, 2 for quadratic
   * @param improvementRatio required MAD(before) / MAD(after) of the fitted channels
   */
  public TrendRemover(int maxOrder, double improvementRatio) {
    if (maxOrder < 1) {
      throw new IllegalArgumentException("maxOrder must be at least 1");
    }
    this.maxOrder = maxOrder;
    this.improvementRatio = improvementRatio;
  }

  /**
   * @param channels continuum channels to fit
   * @return the best trend if removing it reduces the MAD of the channels enough, otherwise null
   */
  public @Nullable Trend findTrend(@NotNull Spectrum spectrum, @NotNull int[] channels) {
    final int n = spectrum.getNumberOfChannels();
    final double[] y = spectrum.getValues(channels);
    final double madBefore = MathUtils.mad(y);
    if (channels.length < maxOrder + 2 || n < 2 || !(madBefore > 0)) {
      return null;
    }

    Trend best = null;
    for (int order = 1; order <= maxOrder; order++) {
      final double[] coefficients = fit(channels, y, n, order);
      final double[] residual = new double[y.length];
      for (int i = 0; i < y.length; i++) {
        residual[i] = y[i] - evaluateWithoutConstant(coefficients, normalize(channels[i], n));
      }
      final double madAfter = MathUtils.mad(residual);
      if (best == null || madAfter < best.madAfter()) {
        best = new Trend(order, coefficients, madBefore, madAfter);
      }
    }

    final Trend trend = best;
    if (trend.improvement() <= improvementRatio) {
      logger.fine(() -> "No trend removed, MAD improves only by %.2f with order %d".formatted(
          trend.improvement(), trend.order()));
      return null;
    }
    logger.fine(() -> "Found order %d trend, MAD %g -> %g".formatted(trend.order(), madBefore,
        trend.madAfter()));
    return trend;
  }

  /**
   * @return the spectrum with the non constant terms of the trend subtracted from every channel
   */
  public @NotNull Spectrum removeTrend(@NotNull Spectrum spectrum, @NotNull Trend trend) {
    final int n = spectrum.getNumberOfChannels();
    final double[] values = spectrum.getValues();
    for (int c = 0; c < n; c++) {
      values[c] -= evaluateWithoutConstant(trend.coefficients(), normalize(c, n));
    }
    return spectrum.withValues(values);
  }

  private double[] fit(int[] channels, double[] y, int n, int order) {
    final double[] x = new double[channels.length];
    for (int i = 0; i < x.length; i++) {
      x[i] = normalize(channels[i], n);
    }
    final RealMatrix vandermonde = createVandermondeMatrix(x, order + 1);
    final DecompositionSolver solver = new SingularValueDecomposition(vandermonde).getSolver();
    final RealVector coefficients = solver.solve(new ArrayRealVector(y));
    return coefficients.toArray();
  }

  private static double normalize(int channel, int n) {
    return n > 1 ? (double) channel / (n - 1) : 0d;
  }

  /**
   * @param coefficients lowest power first
   */
  private static double evaluateWithoutConstant(double[] coefficients, double x) {
    double result = 0.0;
    double power = x;
    for (int i = 1; i < coefficients.length; i++) {
      result += coefficients[i] * power;
      power *= x;
    }
    return result;
  }

  private static RealMatrix createVandermondeMatrix(double[] x, int columns) {
    final double[][] matrix = new double[x.length][columns];
    for (int i = 0; i < x.length; i++) {
      double power = 1.0;
      for (int j = 0; j < columns; j++) {
        matrix[i][j] = power;
        power *= x[i];
      }
    }
    return new Array2DRowRealMatrix(matrix);
  }

  /**
   * @param order        polynomial order
   * @param coefficients lowest power first, in channel / (channels - 1)
   * @param madBefore    MAD of the fitted channels
   * @param madAfter     MAD of the fitted channels after removal
   */
  public record Trend(int order, double[] coefficients, double madBefore, double madAfter) {

    public double improvement() {
      return madAfter > 0 ? madBefore / madAfter : Double.POSITIVE_INFINITY;
    }
  }
}
