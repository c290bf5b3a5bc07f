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

package io.github.findcont.modules.dataprocessing.contdet_classifier;

import io.github.findcont.datamodel.ChannelSelection;
import io.github.findcont.modules.dataprocessing.contdet_baseline.BaselineStatistics;
import org.jetbrains.annotations.NotNull;

/**
 * Result of one classifier pass.
 *
 * @param selection                 continuum channels
 * @param statistics                baseline statistics the thresholds were derived from
 * @param sigma                     sigma of this pass
 * @param positiveThreshold         channels at or above are line emission
 * @param negativeThreshold         channels at or below are absorption
 * @param singleChannelPeaks        groups above the positive threshold that are one channel wide
 * @param allGroupsAbove            all groups above the positive threshold
 * @param droppedRangeCount         ranges removed by the narrow and inner window rejection
 * @param candidateChannelCount     channels between the thresholds before any trimming
 * @param channelRatio              channels above the true median over channels below it
 * @param sumRatio                  summed excess above the true median over the summed deficit
 * @param madOfPointsBelowThreshold scaled MAD of all valid channels below the positive threshold
 * @param peakOverMad               (max - true median) / scaled MAD
 * @param trimUsed                  trim per group edge that was applied, fraction or count
 * @param widestFeature             width of the widest group above the positive threshold
 */
public record ChannelClassification(@NotNull ChannelSelection selection,
                                    @NotNull BaselineStatistics statistics, double sigma,
                                    double positiveThreshold, double negativeThreshold,
                                    int singleChannelPeaks, int allGroupsAbove,
                                    int droppedRangeCount, int candidateChannelCount,
                                    double channelRatio, double sumRatio,
                                    double madOfPointsBelowThreshold, double peakOverMad,
                                    double trimUsed, int widestFeature) {

  public double trueMedian() {
    return statistics.trueMedian();
  }

  public double scaledMAD() {
    return statistics.scaledMAD();
  }

  public int groups() {
    return selection.getNumberOfRanges();
  }

  /**
   * @return true if every peak above the threshold is a single channel, and there is more than
   * one
   */
  public boolean onlySingleChannelPeaks() {
    return allGroupsAbove > 1 && singleChannelPeaks == allGroupsAbove;
  }
}
