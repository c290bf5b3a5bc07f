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

package io.github.findcont.modules.dataprocessing.findcont;

import io.github.findcont.parameters.Parameter;
import io.github.findcont.parameters.impl.SimpleParameterSet;
import io.github.findcont.parameters.parametertypes.BooleanParameter;
import io.github.findcont.parameters.parametertypes.ComboParameter;
import io.github.findcont.parameters.parametertypes.DoubleParameter;
import io.github.findcont.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;

/**
 * Parameters of the continuum finder. Every component reads the values it needs once, in its
 * constructor.
 */
public class FindContinuumParameters extends SimpleParameterSet {

  public static final int DEFAULT_MAX_TRIM = 20;

  public enum BaselineMode {
    /**
     * Lowest (or highest / middle) valued channels define the baseline.
     */
    MIN,
    /**
     * Half of the baseline channels are taken from each edge of the spectrum.
     */
    EDGE
  }

  public enum TrimMode {
    AUTO, FIXED
  }

  public enum MeanSpectrumMethod {
    MEAN_ABOVE_THRESHOLD, PEAK_OVER_MAD
  }

  // baseline statistics
  public static final DoubleParameter nBaselineChannels = new DoubleParameter(
      "Baseline channels",
      "Number of channels used to estimate the noise. Values below 1 are a fraction of all channels.",
      new DecimalFormat("0.###"), 0.19, 0d, Double.MAX_VALUE);

  public static final ComboParameter<BaselineMode> baselineMode = new ComboParameter<>(
      "Baseline mode", "How the baseline channels are picked.", BaselineMode.values(),
      BaselineMode.MIN);

  public static final DoubleParameter lookAheadFactor = new DoubleParameter("Look-ahead factor",
      "The high or middle subset replaces the low subset only if its MAD times this factor is still smaller.",
      new DecimalFormat("0.##"), 1.5, 1d, 100d);

  public static final DoubleParameter dropExtremeFraction = new DoubleParameter(
      "Drop extreme fraction",
      "Fraction of the most extreme baseline channels dropped on trial. 0 disables the check.",
      new DecimalFormat("0.###"), 0d, 0d, 0.5);

  public static final DoubleParameter dropExtremeRatioMin = new DoubleParameter(
      "Drop extreme min ratio", "Lower bound of the MAD ratio that accepts the dropped subset.",
      new DecimalFormat("0.##"), 1.15, 1d, 100d);

  public static final DoubleParameter dropExtremeRatioMax = new DoubleParameter(
      "Drop extreme max ratio", "Upper bound of the MAD ratio that accepts the dropped subset.",
      new DecimalFormat("0.##"), 1.5, 1d, 100d);

  public static final DoubleParameter deepSearchThresholdFactor = new DoubleParameter(
      "Deep search factor",
      "Threshold multiplier (in effective sigma x MAD) of the second signal ratio pass.",
      new DecimalFormat("0.##"), 1d, 0.1, 10d);

  public static final BooleanParameter lineForestHeuristics = new BooleanParameter(
      "Line forest heuristics",
      "Lower the baseline level and trimming for spectra dominated by many lines.", true);

  // classifier
  public static final ComboParameter<MeanSpectrumMethod> meanSpectrumMethod = new ComboParameter<>(
      "Mean spectrum method", "Method that produced the spectrum. Selects the default sigma.",
      MeanSpectrumMethod.values(), MeanSpectrumMethod.MEAN_ABOVE_THRESHOLD);

  public static final BooleanParameter autoSigma = new BooleanParameter("Automatic sigma",
      "Start from the sigma default of the spectral setup and adjust it automatically.", true);

  public static final DoubleParameter sigmaFindContinuum = new DoubleParameter("Sigma",
      "Threshold in units of the corrected scaled MAD. Used when automatic sigma is off.",
      new DecimalFormat("0.##"), 3.5, 0.1, 100d);

  public static final DoubleParameter negativeThresholdFactor = new DoubleParameter(
      "Negative threshold factor",
      "Multiplier of the threshold distance below the median, makes absorption harder to flag.",
      new DecimalFormat("0.##"), 1.15, 0.1, 10d);

  public static final ComboParameter<TrimMode> trimMode = new ComboParameter<>("Trim mode",
      "AUTO trims 10% per group up to max trim channels.", TrimMode.values(), TrimMode.AUTO);

  public static final DoubleParameter trimChannels = new DoubleParameter("Trim channels",
      "FIXED mode: channels trimmed from each group edge. Values below 1 are a fraction of the group.",
      new DecimalFormat("0.###"), 0.1, 0d, 10000d);

  public static final IntegerParameter maxTrim = new IntegerParameter("Max trim",
      "AUTO mode: maximum number of channels trimmed from each group edge.", DEFAULT_MAX_TRIM, 0,
      100000);

  public static final DoubleParameter maxTrimFraction = new DoubleParameter("Max trim fraction",
      "AUTO mode: maximum trimmed fraction of a group.", new DecimalFormat("0.##"), 1d, 0d, 1d);

  public static final IntegerParameter edgeTrimLimit = new IntegerParameter("Edge trim limit",
      "Maximum trim on the band edge side of the outermost groups.", 3, 0, 100);

  public static final IntegerParameter narrow = new IntegerParameter("Narrow",
      "Minimum width of a continuum group in channels. 0 picks ceil(log10(channels)).", 0, 0,
      100000);

  // sigma adjustment and detrending
  public static final BooleanParameter removeTrend = new BooleanParameter("Remove trend",
      "Fit and remove a polynomial trend from the continuum channels if it reduces the noise.",
      true);

  public static final IntegerParameter maxTrendOrder = new IntegerParameter("Max trend order",
      "1 for linear, 2 for quadratic trends.", 2, 1, 2);

  public static final DoubleParameter channelFractionForTrendRemoval = new DoubleParameter(
      "Trend channel fraction",
      "Minimum fraction of channels selected as continuum before a trend is fitted.",
      new DecimalFormat("0.##"), 0.8, 0d, 1d);

  public static final DoubleParameter trendImprovementRatio = new DoubleParameter(
      "Trend improvement ratio",
      "Required ratio of the baseline MAD before and after removing the trend.",
      new DecimalFormat("0.##"), 1.6, 1d, 100d);

  // mask amendment
  public static final IntegerParameter maxAmendIterations = new IntegerParameter(
      "Amendment iterations", "Maximum number of mask amendment stages after the original one.",
      2, 0, 3);

  public static final DoubleParameter autoLowerSigmaFraction = new DoubleParameter(
      "Auto lower fraction", "Sigma multiplier of the auto-lower stage.",
      new DecimalFormat("0.###"), 0.8, 0.1, 1d);

  public static final DoubleParameter fourLetterThreshold = new DoubleParameter(
      "Four letter threshold",
      "Relative change below which a diagnostic counts as unchanged. The MAD uses twice this value.",
      new DecimalFormat("0.###"), 0.05, 0d, 10d);

  public static final DoubleParameter looseFourLetterThreshold = new DoubleParameter(
      "Loose four letter threshold", "Threshold used to validate an appended continuum range.",
      new DecimalFormat("0.###"), 0.1, 0d, 10d);

  public static final DoubleParameter lowBandwidthFraction = new DoubleParameter(
      "Low bandwidth fraction", "Selected channel fraction below which the bandwidth is low.",
      new DecimalFormat("0.####"), 0.0625, 0d, 1d);

  public static final DoubleParameter lowSpreadFraction = new DoubleParameter(
      "Low spread fraction", "Fraction of the band spanned by the selection below which the spread is low.",
      new DecimalFormat("0.####"), 0.3333, 0d, 1d);

  public static final DoubleParameter narrowRangeFraction = new DoubleParameter(
      "Narrow range fraction", "A single range narrower than this fraction of the band is flagged.",
      new DecimalFormat("0.###"), 0.05, 0d, 1d);

  public static final IntegerParameter noiseSeed = new IntegerParameter("Noise seed",
      "Seed of the noise injected into line channels of synthesized spectra.", 1);

  public FindContinuumParameters() {
    super(new Parameter<?>[]{nBaselineChannels, baselineMode, lookAheadFactor, dropExtremeFraction,
        dropExtremeRatioMin, dropExtremeRatioMax, deepSearchThresholdFactor, lineForestHeuristics,
        meanSpectrumMethod, autoSigma, sigmaFindContinuum, negativeThresholdFactor, trimMode,
        trimChannels, maxTrim, maxTrimFraction, edgeTrimLimit, narrow, removeTrend, maxTrendOrder,
        channelFractionForTrendRemoval, trendImprovementRatio, maxAmendIterations,
        autoLowerSigmaFraction, fourLetterThreshold, looseFourLetterThreshold,
        lowBandwidthFraction, lowSpreadFraction, narrowRangeFraction, noiseSeed});
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean ok = super.checkParameterValues(errorMessages);
    if (getValue(dropExtremeRatioMin) > getValue(dropExtremeRatioMax)) {
      errorMessages.add(dropExtremeRatioMin.getName() + " must not exceed "
          + dropExtremeRatioMax.getName());
      ok = false;
    }
    final double baseline = getValue(nBaselineChannels);
    if (baseline >= 1 && baseline != Math.rint(baseline)) {
      errorMessages.add(nBaselineChannels.getName() + " above 1 must be a channel count");
      ok = false;
    }
    return ok;
  }
}
