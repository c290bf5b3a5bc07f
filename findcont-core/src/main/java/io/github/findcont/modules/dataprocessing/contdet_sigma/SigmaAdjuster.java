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

import io.github.findcont.datamodel.ChannelSelection;
import io.github.findcont.datamodel.SpectralSetup;
import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.modules.dataprocessing.contdet_baseline.BaselineStatistics;
import io.github.findcont.modules.dataprocessing.contdet_baseline.RobustBaselineStatistics;
import io.github.findcont.modules.dataprocessing.contdet_classifier.ChannelClassification;
import io.github.findcont.modules.dataprocessing.contdet_classifier.ChannelClassifier;
import io.github.findcont.modules.dataprocessing.contdet_sigma.TrendRemover.Trend;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.MeanSpectrumMethod;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.TrimMode;
import io.github.findcont.parameters.ParameterSet;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Runs the classifier with a starting sigma and applies at most one corrective sigma change,
 * followed by an optional detrended pass. Every pass recomputes the baseline statistics.
 */
public class SigmaAdjuster {

  private static final Logger logger = Logger.getLogger(SigmaAdjuster.class.getName());

  static final double NOISE_SPIKE_FACTOR = 1.5;
  static final double MAD_RATIO_CUTOFF = 1.15;
  static final double PEAK_OVER_MAD_CUTOFF = 20;
  static final int MAX_GROUPS_FOR_MAD_RATIO = 16;
  static final double MAD_RATIO_FACTOR = 5.0 / 7.0;
  static final double AUTO_LOWER_MAD_RATIO_FACTOR = 6.0 / 7.0;
  private static final double HIGH_FREQUENCY_HZ = 60e9;
  private static final double MIN_SPLIT_RATIO = 0.2;

  private final RobustBaselineStatistics baselineStatistics;
  private final ChannelClassifier classifier;
  private final TrendRemover trendRemover;
  private final MeanSpectrumMethod meanSpectrumMethod;
  private final boolean autoSigma;
  private final boolean removeTrend;
  private final double channelFractionForTrendRemoval;

  public SigmaAdjuster(@NotNull ParameterSet parameters) {
    this(parameters, new RobustBaselineStatistics(parameters), new ChannelClassifier(parameters));
  }

  public SigmaAdjuster(@NotNull ParameterSet parameters,
      @NotNull RobustBaselineStatistics baselineStatistics, @NotNull ChannelClassifier classifier) {
    this.baselineStatistics = baselineStatistics;
    this.classifier = classifier;
    trendRemover = new TrendRemover(parameters.getValue(FindContinuumParameters.maxTrendOrder),
        parameters.getValue(FindContinuumParameters.trendImprovementRatio));
    meanSpectrumMethod = parameters.getValue(FindContinuumParameters.meanSpectrumMethod);
    autoSigma = parameters.getValue(FindContinuumParameters.autoSigma);
    removeTrend = parameters.getValue(FindContinuumParameters.removeTrend);
    channelFractionForTrendRemoval = parameters.getValue(
        FindContinuumParameters.channelFractionForTrendRemoval);
  }

  /**
   * @param autoLowerMode uses the milder MAD ratio reduction of the auto-lower mode
   */
  public @NotNull SigmaAdjustment adjust(@NotNull Spectrum spectrum, @NotNull SpectralSetup setup,
      double initialSigma, boolean autoLowerMode) {
    final int n = spectrum.getNumberOfChannels();
    double sigma = initialSigma;
    int maxTrim = classifier.getMaxTrim();
    int reruns = 0;

    ChannelClassification result = classifyOnce(spectrum, sigma, maxTrim);

    final boolean autoTrim = classifier.getTrimMode() == TrimMode.AUTO;
    boolean maxTrimChanged = false;
    if (result.groups() <= 2 && !setup.tdm() && autoTrim
        && maxTrim == FindContinuumParameters.DEFAULT_MAX_TRIM) {
      maxTrim = FindContinuumParameters.DEFAULT_MAX_TRIM * n / 128;
      maxTrimChanged = maxTrim != FindContinuumParameters.DEFAULT_MAX_TRIM;
      final int newMaxTrim = maxTrim;
      logger.fine(() -> "Setting max trim to %d for this FDM spectrum".formatted(newMaxTrim));
    }

    final double factor = correctiveFactor(result, setup, sigma, autoLowerMode);
    if (factor != 1.0) {
      sigma *= factor;
      final double newSigma = sigma;
      final ChannelClassification first = result;
      logger.fine(() -> "Scaling sigma by %.3f to %.3f (groups=%d, channelRatio=%.3f)".formatted(
          factor, newSigma, first.groups(), first.channelRatio()));
      result = classifyOnce(spectrum, sigma, maxTrim);
      reruns++;
    } else if (maxTrimChanged) {
      logger.fine("Re-running with the new max trim");
      result = classifyOnce(spectrum, sigma, maxTrim);
      reruns++;
    }

    // detrend
    Spectrum finalSpectrum = spectrum;
    Trend trend = null;
    final ChannelSelection selection = result.selection();
    if (removeTrend && qualifiesForTrendRemoval(selection, n)) {
      boolean rerun = false;
      if (factor >= NOISE_SPIKE_FACTOR && !maxTrimChanged && autoTrim) {
        sigma /= factor;
        rerun = true;
        final double restored = sigma;
        logger.fine(() -> "Restoring sigma to " + restored);
      }
      trend = trendRemover.findTrend(spectrum, selection.toChannelArray());
      Spectrum candidate = spectrum;
      if (trend != null) {
        candidate = trendRemover.removeTrend(spectrum, trend);
        rerun = true;
      }
      if (rerun) {
        final ChannelClassification previous = result;
        BaselineStatistics stats = baselineStatistics.compute(candidate, sigma);
        if (trend != null && stats.scaledMAD() > previous.scaledMAD()) {
          logger.fine("Trend removal increased the baseline MAD, keeping the trend");
          trend = null;
          candidate = spectrum;
          stats = baselineStatistics.compute(candidate, sigma);
        }
        final ChannelClassification detrended = classifier.classify(candidate, sigma, stats,
            maxTrim);
        reruns++;
        if (splitsSingleWindow(previous, detrended)) {
          logger.fine("Discarding the detrended result, it split the single window");
          trend = null;
        } else {
          result = detrended;
          finalSpectrum = candidate;
        }
      }
    }
    return new SigmaAdjustment(result, initialSigma, factor, reruns, finalSpectrum, trend);
  }

  private ChannelClassification classifyOnce(Spectrum spectrum, double sigma, int maxTrim) {
    final BaselineStatistics stats = baselineStatistics.compute(spectrum, sigma);
    return classifier.classify(spectrum, sigma, stats, maxTrim);
  }

  /**
   * @return the sigma multiplier of the corrective rerun, 1.0 for no rerun
   */
  double correctiveFactor(ChannelClassification c, SpectralSetup setup, double sigma,
      boolean autoLowerMode) {
    final int groups = c.groups();
    final double channelRatio = c.channelRatio();
    if (c.onlySingleChannelPeaks()) {
      // all peaks look like noise spikes
      return sigma < SigmaDefaults.tdmSigma(meanSpectrumMethod) ? NOISE_SPIKE_FACTOR : 1.0;
    }
    if ((groups > 3 || (groups > 1 && channelRatio < 1.0) || channelRatio < 0.5 || (groups == 2
        && channelRatio < 1.3)) && autoSigma
        && meanSpectrumMethod != MeanSpectrumMethod.PEAK_OVER_MAD) {
      return groupRatioFactor(groups, channelRatio, setup);
    }
    // noise below the threshold against the bias corrected baseline noise, line wings raise it
    final double madRatio = c.madOfPointsBelowThreshold() / (c.scaledMAD()
        * c.statistics().correctionFactor());
    if (madRatio > MAD_RATIO_CUTOFF && c.peakOverMad() > PEAK_OVER_MAD_CUTOFF && groups > 1
        && groups < MAX_GROUPS_FOR_MAD_RATIO) {
      final double base = autoLowerMode ? AUTO_LOWER_MAD_RATIO_FACTOR : MAD_RATIO_FACTOR;
      return base + (1.0 - base) * (groups - 2) / (MAX_GROUPS_FOR_MAD_RATIO - 2.0);
    }
    return 1.0;
  }

  /**
   * Lowers sigma to admit more continuum when there are many groups or more channels below the
   * median than above it.
   */
  static double groupRatioFactor(int groups, double channelRatio, SpectralSetup setup) {
    final double channelWidth = Math.abs(setup.channelWidthHz());
    if (channelRatio < 0.9 && channelRatio > 0.1 && setup.firstFrequencyHz() > HIGH_FREQUENCY_HZ
        && !setup.tdm() && groups > 2) {
      return 0.333;
    }
    if (groups <= 2) {
      if (channelRatio < 1.3 && channelRatio > 0.1 && groups == 2 && !setup.tdm()
          && channelWidth >= SpectralSetup.REFERENCE_BANDWIDTH_HZ / 480) {
        // galaxy spectra at 480 or 240 channel resolution
        return channelWidth < SpectralSetup.REFERENCE_BANDWIDTH_HZ / 360 ? 0.5 : 0.7;
      }
      return 0.9;
    }
    if (setup.tdm()) {
      return 1.0;
    }
    final double factor = Math.log(3) / Math.log(groups);
    if (setup.hasChannelWidth()) {
      // tempers the reduction for narrow bandwidths
      return Math.pow(factor, setup.bandwidthHz() / SpectralSetup.REFERENCE_BANDWIDTH_HZ);
    }
    return factor;
  }

  private boolean qualifiesForTrendRemoval(ChannelSelection selection, int n) {
    if (selection.isEmpty()) {
      return false;
    }
    return selection.getChannelCount() > channelFractionForTrendRemoval * n || (
        selection.getLargestRangeWidth() > n / 3 && selection.getNumberOfRanges() <= 2
            && channelFractionForTrendRemoval < 1);
  }

  /**
   * A single window that falls apart into up to 3 windows with a tiny one among them is more
   * likely an artifact of the fit than real structure.
   */
  private static boolean splitsSingleWindow(ChannelClassification before,
      ChannelClassification after) {
    if (before.groups() != 1 || after.groups() > 3 || after.selection().isEmpty()) {
      return false;
    }
    final ChannelSelection s = after.selection();
    return (double) s.getSmallestRangeWidth() / s.getLargestRangeWidth() < MIN_SPLIT_RATIO;
  }
}
