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

package io.github.findcont.modules.dataprocessing.contdet_baseline;

import com.google.common.primitives.ImmutableIntArray;
import org.jetbrains.annotations.NotNull;

/**
 * Noise and baseline level of one spectrum.
 *
 * @param median                 median of the baseline subset
 * @param scaledMAD              MAD of the baseline subset times 1.4826, after line forest scaling
 * @param correctionFactor       converts the subset MAD into a population sigma
 * @param medianCorrectionFactor offset from subset median to true median, in scaled MADs
 * @param signalRatio            1 without lines, 0.25 if half of the channels carry signal
 * @param usedSubset             subset that defined the statistics
 * @param trueMedian             inferred median of the line-free population
 * @param percentile             baseline channels as a percentage of all channels
 * @param baselineChannels       channel indices of the used subset, ascending
 * @param spectralDiff2          median second difference as a percentage of the median, NaN if
 *                               not evaluated
 * @param suggestedTrimChannels  trim per group suggested by the line forest heuristics, 0 for none
 */
public record BaselineStatistics(double median, double scaledMAD, double correctionFactor,
                                 double medianCorrectionFactor, double signalRatio,
                                 @NotNull BaselineSubset usedSubset, double trueMedian,
                                 double percentile, @NotNull ImmutableIntArray baselineChannels,
                                 double spectralDiff2, int suggestedTrimChannels) {

  public BaselineStatistics {
    if (scaledMAD < 0 || Double.isNaN(scaledMAD)) {
      throw new IllegalArgumentException("scaledMAD must be >= 0 but is " + scaledMAD);
    }
    if (!(signalRatio >= 0 && signalRatio <= 1)) {
      throw new IllegalArgumentException("signalRatio must be within [0,1] but is " + signalRatio);
    }
  }

  /**
   * @return threshold distance from the true median for a given sigma
   */
  public double thresholdDistance(double sigma) {
    return sigma * correctionFactor * scaledMAD;
  }
}
