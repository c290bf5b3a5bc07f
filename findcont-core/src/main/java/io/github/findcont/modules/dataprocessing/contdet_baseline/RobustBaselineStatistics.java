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
import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.BaselineMode;
import io.github.findcont.parameters.ParameterSet;
import io.github.findcont.util.ChannelGroupUtils;
import io.github.findcont.util.MathUtils;
import java.util.Arrays;
import java.util.Comparator;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;

/**
 * Estimates the baseline level and noise of a spectrum from a biased subset of its channels.
 * <p>
 * The k lowest channels of a spectrum with emission lines are line free, but their median and MAD
 * underestimate the population values. Closed-form power law corrections in the subset percentile
 * and the number of channels convert them back. Absorption and mixed spectra are recognized by a
 * clearly smaller MAD in the highest or middle channels.
 */
public class RobustBaselineStatistics {

  private static final Logger logger = Logger.getLogger(RobustBaselineStatistics.class.getName());

  private static final double SIGNAL_RATIO_THRESHOLD_FACTOR = 2.0;
  private static final double DEEP_SEARCH_SIGNAL_RATIO = 0.99;
  private static final int LINE_FOREST_MIN_CHANNELS = 200;
  private static final double LINE_FOREST_MAX_DIFF2 = 0.6;
  private static final double LINE_FOREST_MAX_SIGNAL_RATIO = 0.95;
  private static final double LINE_FOREST_MIN_SNR = 20;
  private static final double LINE_FOREST_MAD_SCALE = 0.33;
  private static final int LINE_FOREST_TRIM = 6;

  private final double nBaselineChannels;
  private final BaselineMode baselineMode;
  private final double lookAheadFactor;
  private final double dropExtremeFraction;
  private final double dropExtremeRatioMin;
  private final double dropExtremeRatioMax;
  private final double deepSearchThresholdFactor;
  private final boolean lineForestHeuristics;

  public RobustBaselineStatistics(@NotNull ParameterSet parameters) {
    nBaselineChannels = parameters.getValue(FindContinuumParameters.nBaselineChannels);
    baselineMode = parameters.getValue(FindContinuumParameters.baselineMode);
    lookAheadFactor = parameters.getValue(FindContinuumParameters.lookAheadFactor);
    dropExtremeFraction = parameters.getValue(FindContinuumParameters.dropExtremeFraction);
    dropExtremeRatioMin = parameters.getValue(FindContinuumParameters.dropExtremeRatioMin);
    dropExtremeRatioMax = parameters.getValue(FindContinuumParameters.dropExtremeRatioMax);
    deepSearchThresholdFactor = parameters.getValue(
        FindContinuumParameters.deepSearchThresholdFactor);
    lineForestHeuristics = parameters.getValue(FindContinuumParameters.lineForestHeuristics);
  }

  /**
   * @param numberOfChannels all channels of the spectrum
   * @return the baseline subset size
   * @throws IllegalArgumentException if fewer than 2 channels would be used
   */
  public int resolveBaselineChannelCount(int numberOfChannels) {
    final int k = nBaselineChannels < 1 ? (int) Math.round(nBaselineChannels * numberOfChannels)
        : (int) Math.round(nBaselineChannels);
    if (k < 2) {
      throw new IllegalArgumentException(
          "At least 2 baseline channels are required but " + k + " were requested for "
              + numberOfChannels + " channels");
    }
    return k;
  }

  /**
   * @param sigma the classification sigma, sets the level above which channels count as signal
   */
  public @NotNull BaselineStatistics compute(@NotNull Spectrum spectrum, double sigma) {
    final int n = spectrum.getNumberOfChannels();
    final int requested = resolveBaselineChannelCount(n);
    final int[] valid = spectrum.getValidChannels();
    if (valid.length < 2) {
      throw new IllegalArgumentException("At least 2 valid channels are required");
    }
    final int k = Math.min(requested, valid.length);
    final double percentile = 100.0 * k / n;

    final Subset chosen = baselineMode == BaselineMode.EDGE ? edgeSubset(spectrum, valid, k)
        : minSubset(spectrum, k);
    final double[] subsetValues = spectrum.getValues(chosen.channels);
    final double median = MathUtils.median(subsetValues);
    double scaledMad = MathUtils.scaledMad(subsetValues);

    final double correctionFactor = sigmaCorrectionFactor(chosen.kind, n, percentile);
    final double medianCorrectionFactor = medianCorrectionFactor(chosen.kind, percentile);
    final double sigmaEffective = sigma * correctionFactor;
    final double[] validValues = spectrum.getValidValues();

    double signalRatio = signalRatio(validValues, median,
        sigmaEffective * scaledMad * SIGNAL_RATIO_THRESHOLD_FACTOR);
    if (signalRatio >= DEEP_SEARCH_SIGNAL_RATIO) {
      // look for weak lines before declaring the spectrum line free
      signalRatio = signalRatio(validValues, median,
          sigmaEffective * scaledMad * deepSearchThresholdFactor);
    }

    double spectralDiff2 = Double.NaN;
    int suggestedTrim = 0;
    if (lineForestHeuristics && median > 0 && validValues.length > 2) {
      spectralDiff2 = 100 * MathUtils.median(MathUtils.absDiff(validValues, 2)) / median;
      if (spectralDiff2 < LINE_FOREST_MAX_DIFF2 && n > LINE_FOREST_MIN_CHANNELS
          && signalRatio < LINE_FOREST_MAX_SIGNAL_RATIO) {
        // channel averaged spectrum full of real lines, do not raise the median
        signalRatio = 0;
        final double lineSnr = scaledMad > 0 ? (MathUtils.max(validValues) - median) / scaledMad
            : 0d;
        logger.fine(() -> "Line forest: spectralDiff2=%.3f, lineSNR=%.1f".formatted(
            100 * MathUtils.median(MathUtils.absDiff(validValues, 2)) / median, lineSnr));
        if (lineSnr > LINE_FOREST_MIN_SNR) {
          scaledMad *= LINE_FOREST_MAD_SCALE;
          suggestedTrim = LINE_FOREST_TRIM;
        }
      }
    }

    double trueMedian = switch (chosen.kind) {
      case LOW -> median + medianCorrectionFactor * scaledMad * signalRatio;
      case HIGH -> median - medianCorrectionFactor * scaledMad * signalRatio;
      case MIDDLE, EDGE -> median;
    };
    if (trueMedian < MathUtils.min(validValues) || trueMedian > MathUtils.max(validValues)) {
      final double corrected = trueMedian;
      trueMedian = MathUtils.median(validValues);
      final double fallback = trueMedian;
      logger.fine(() -> "Corrected median %g outside the data range, using sample median %g"
          .formatted(corrected, fallback));
    }

    final int[] sortedChannels = chosen.channels.clone();
    Arrays.sort(sortedChannels);
    final BaselineStatistics stats = new BaselineStatistics(median, scaledMad, correctionFactor,
        medianCorrectionFactor, signalRatio, chosen.kind, trueMedian, percentile,
        ImmutableIntArray.copyOf(sortedChannels), spectralDiff2, suggestedTrim);
    logger.finest(() -> "Baseline statistics: " + stats);
    return stats;
  }

  /**
   * Measured MAD of the lowest N percent of a data stream is lower than the MAD of all points.
   */
  public static double sigmaCorrectionFactor(@NotNull BaselineSubset subset, int npts,
      double percentile) {
    final double edgeValue = Math.pow(npts / 128.0, 0.08);
    if (!subset.isExtreme()) {
      return edgeValue;
    }
    return edgeValue * 2.8 * Math.pow(percentile / 10.0, -0.25);
  }

  /**
   * (true median - observed median) / observed MAD for the lowest N percent of Gaussian noise.
   */
  public static double medianCorrectionFactor(@NotNull BaselineSubset subset, double percentile) {
    if (!subset.isExtreme()) {
      return 0d;
    }
    return 6.3 * Math.sqrt(5.0 / percentile);
  }

  static double signalRatio(double[] values, double median, double threshold) {
    int exceeding = 0;
    for (double v : values) {
      if (Math.abs(v - median) > threshold) {
        exceeding++;
      }
    }
    final double clear = 1.0 - (double) exceeding / values.length;
    return clear * clear;
  }

  private Subset edgeSubset(Spectrum spectrum, int[] valid, int k) {
    final int half = Math.max(1, k / 2);
    final int[] lower = Arrays.copyOfRange(valid, 0, Math.min(half, valid.length));
    final int[] upper = Arrays.copyOfRange(valid, Math.max(0, valid.length - half), valid.length);
    if (MathUtils.std(spectrum.getValues(lower)) == 0) {
      logger.fine("Edge mode: dropping lower channels from the statistics");
      return new Subset(BaselineSubset.EDGE, upper);
    }
    if (MathUtils.std(spectrum.getValues(upper)) == 0) {
      logger.fine("Edge mode: dropping upper channels from the statistics");
      return new Subset(BaselineSubset.EDGE, lower);
    }
    return new Subset(BaselineSubset.EDGE,
        IntStream.concat(IntStream.of(lower), IntStream.of(upper)).distinct().toArray());
  }

  private Subset minSubset(Spectrum spectrum, int k) {
    final int[] pool = ChannelGroupUtils.validChannelsWithoutEdgeRuns(spectrum);
    if (pool.length < spectrum.getNumberOfValidChannels()) {
      final int avoided = spectrum.getNumberOfValidChannels() - pool.length;
      logger.fine(() -> "Avoided " + avoided + " repeated edge channels in the baseline");
    }
    final int size = Math.min(k, pool.length);
    final Subset low = subsetWithSpread(spectrum, pool, size, BaselineSubset.LOW);
    final Subset high = subsetWithSpread(spectrum, pool, size, BaselineSubset.HIGH);
    final Subset middle = subsetWithSpread(spectrum, pool, size, BaselineSubset.MIDDLE);
    Subset chosen = chooseSubset(spectrum, low, high, middle);
    if (dropExtremeFraction > 0) {
      chosen = maybeDropExtremes(spectrum, chosen);
    }
    return chosen;
  }

  /**
   * A block of identical values has no spread. Its value is excluded and the subset picked again.
   */
  private Subset subsetWithSpread(Spectrum spectrum, int[] pool, int k, BaselineSubset kind) {
    final Subset subset = subsetOfKind(spectrum, pool, k, kind);
    if (subset.channels.length < 2
        || MathUtils.mad(spectrum.getValues(subset.channels)) >= MathUtils.ZERO_SPREAD) {
      return subset;
    }
    final double repeated = MathUtils.mode(spectrum.getValues(subset.channels));
    final int[] reduced = IntStream.of(pool).filter(c -> spectrum.getValue(c) != repeated)
        .toArray();
    logger.fine(() -> "Zero MAD in the %s subset, excluding the repeated value %g".formatted(kind,
        repeated));
    if (reduced.length < 2) {
      return subset;
    }
    return subsetOfKind(spectrum, reduced, Math.min(k, reduced.length), kind);
  }

  private Subset chooseSubset(Spectrum spectrum, Subset low, Subset high, Subset middle) {
    final double madLow = MathUtils.mad(spectrum.getValues(low.channels));
    final double madHigh = madOf(spectrum, high);
    final double madMiddle = madOf(spectrum, middle);

    Subset best = low;
    double bestMad = madLow;
    if (lookAheadFactor * madHigh < madLow && madHigh <= madMiddle) {
      best = high;
      bestMad = madHigh;
    } else if (lookAheadFactor * madMiddle < madLow) {
      best = middle;
      bestMad = madMiddle;
    }
    final Subset result = best;
    final double resultMad = bestMad;
    logger.fine(() -> "Using %s %d channels as baseline (MAD low=%g, high=%g, middle=%g -> %g)"
        .formatted(result.kind, result.channels.length, madLow, madHigh, madMiddle, resultMad));
    return best;
  }

  /**
   * @return MAD of an alternative subset, infinite if it is degenerate and cannot compete
   */
  private static double madOf(Spectrum spectrum, Subset subset) {
    if (subset.channels.length < 2) {
      return Double.POSITIVE_INFINITY;
    }
    final double mad = MathUtils.mad(spectrum.getValues(subset.channels));
    return mad < MathUtils.ZERO_SPREAD ? Double.POSITIVE_INFINITY : mad;
  }

  private Subset subsetOfKind(Spectrum spectrum, int[] pool, int k, BaselineSubset kind) {
    final int[] sorted = IntStream.of(pool).boxed()
        .sorted(Comparator.comparingDouble(spectrum::getValue)).mapToInt(Integer::intValue)
        .toArray();
    return switch (kind) {
      case LOW, EDGE -> new Subset(BaselineSubset.LOW, Arrays.copyOfRange(sorted, 0, k));
      case HIGH -> new Subset(BaselineSubset.HIGH,
          Arrays.copyOfRange(sorted, sorted.length - k, sorted.length));
      case MIDDLE -> sorted.length > 2 * k ? new Subset(BaselineSubset.MIDDLE,
          Arrays.copyOfRange(sorted, k, sorted.length - k))
          : new Subset(BaselineSubset.LOW, Arrays.copyOfRange(sorted, 0, k));
    };
  }

  /**
   * A few towering spikes inflate the MAD. Drop the most extreme members and keep the smaller
   * subset if the MAD falls by a moderate ratio; a larger ratio means the subset is bimodal.
   */
  private Subset maybeDropExtremes(Spectrum spectrum, Subset subset) {
    final double[] values = spectrum.getValues(subset.channels);
    final int drop = (int) Math.ceil(dropExtremeFraction * values.length);
    if (drop <= 0 || values.length - drop < 2) {
      return subset;
    }
    final double median = MathUtils.median(values);
    final int[] kept = IntStream.of(subset.channels).boxed()
        .sorted(Comparator.comparingDouble(c -> Math.abs(spectrum.getValue(c) - median)))
        .limit(values.length - drop).mapToInt(Integer::intValue).toArray();
    final double madAll = MathUtils.mad(values);
    final double madKept = MathUtils.mad(spectrum.getValues(kept));
    if (madKept <= 0) {
      return subset;
    }
    final double ratio = madAll / madKept;
    if (ratio >= dropExtremeRatioMin && ratio <= dropExtremeRatioMax) {
      logger.fine(() -> "Dropped %d extreme baseline channels, MAD ratio %.3f".formatted(drop,
          ratio));
      return new Subset(subset.kind, kept);
    }
    return subset;
  }

  private record Subset(BaselineSubset kind, int[] channels) {

  }
}
