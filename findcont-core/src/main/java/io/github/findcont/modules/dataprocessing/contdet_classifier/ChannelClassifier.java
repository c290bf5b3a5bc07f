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
import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.modules.dataprocessing.contdet_baseline.BaselineStatistics;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.TrimMode;
import io.github.findcont.parameters.ParameterSet;
import io.github.findcont.util.ChannelGroupUtils;
import io.github.findcont.util.MathUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;

/**
 * Threshold based continuum channel selection for a fixed sigma.
 * <p>
 * Channels strictly between the negative and positive threshold are candidates. Edge artifacts and
 * degenerate groups are removed, the remaining groups are trimmed at their edges to drop line
 * wings, and finally narrow groups are rejected. The classifier is stateless, repeated calls with
 * the same input give the same selection.
 */
public class ChannelClassifier {

  private static final Logger logger = Logger.getLogger(ChannelClassifier.class.getName());

  private static final double AUTO_TRIM_FRACTION = 0.1;
  private static final int MAX_GROUPS_FOR_MAX_TRIM_ADJUSTMENT = 3;
  private static final int MIN_INNER_WINDOW_GROUPS = 3;
  private static final int MAX_INNER_WINDOW_GROUPS = 15;
  private static final int WIDE_INNER_WINDOW_GROUPS = 8;
  private static final double MINIMUM_EDGE_RELATIVE_TOLERANCE = 1e-10;

  // rich line spectra, see lineForest in the baseline statistics
  private static final int HOT_CORE_TRIM = 13;
  private static final int HOT_CORE_MIN_CHANNELS = 1000;
  private static final double HOT_CORE_MAX_SIGNAL_RATIO = 0.6;
  private static final double HOT_CORE_MAX_DIFF2 = 1.2;

  private final double negativeThresholdFactor;
  private final TrimMode trimMode;
  private final double trimChannels;
  private final int maxTrim;
  private final double maxTrimFraction;
  private final int edgeTrimLimit;
  private final int narrow;

  public ChannelClassifier(@NotNull ParameterSet parameters) {
    negativeThresholdFactor = parameters.getValue(FindContinuumParameters.negativeThresholdFactor);
    trimMode = parameters.getValue(FindContinuumParameters.trimMode);
    trimChannels = parameters.getValue(FindContinuumParameters.trimChannels);
    maxTrim = parameters.getValue(FindContinuumParameters.maxTrim);
    maxTrimFraction = parameters.getValue(FindContinuumParameters.maxTrimFraction);
    edgeTrimLimit = parameters.getValue(FindContinuumParameters.edgeTrimLimit);
    narrow = parameters.getValue(FindContinuumParameters.narrow);
  }

  /**
   * ceil(log10(n)): 2 for 64 channels, 3 for 128 to 960, 4 up to 9600.
   */
  public static int pickNarrow(int numberOfChannels) {
    return (int) Math.ceil(Math.log10(numberOfChannels));
  }

  /**
   * @return 0.1 (a fraction) unless that is more than maxTrim channels, then maxTrim
   */
  public static double pickAutoTrimChannels(int candidateChannels, int maxTrim) {
    if (candidateChannels * AUTO_TRIM_FRACTION > maxTrim) {
      return maxTrim;
    }
    return AUTO_TRIM_FRACTION;
  }

  public int getMaxTrim() {
    return maxTrim;
  }

  public TrimMode getTrimMode() {
    return trimMode;
  }

  public int resolveNarrow(int numberOfChannels) {
    return narrow > 0 ? narrow : pickNarrow(numberOfChannels);
  }

  public @NotNull ChannelClassification classify(@NotNull Spectrum spectrum, double sigma,
      @NotNull BaselineStatistics stats) {
    return classify(spectrum, sigma, stats, maxTrim);
  }

  /**
   * @param maxTrimOverride AUTO trim cap, replaces the configured max trim for this pass
   */
  public @NotNull ChannelClassification classify(@NotNull Spectrum spectrum, double sigma,
      @NotNull BaselineStatistics stats, int maxTrimOverride) {
    final int n = spectrum.getNumberOfChannels();
    final double distance = stats.thresholdDistance(sigma);
    final double positiveThreshold = stats.trueMedian() + distance;
    final double negativeThreshold = stats.trueMedian() - negativeThresholdFactor * distance;
    logger.finest(() -> "sigma=%.3f, thresholds %g / %g around %g".formatted(sigma,
        negativeThreshold, positiveThreshold, stats.trueMedian()));

    final int[] valid = spectrum.getValidChannels();
    int[] candidates = IntStream.of(valid).filter(c -> {
      final double v = spectrum.getValue(c);
      return v > negativeThreshold && v < positiveThreshold;
    }).toArray();
    final int candidateCount = candidates.length;

    // line emission statistics
    final int[] peakChannels = IntStream.of(valid)
        .filter(c -> spectrum.getValue(c) > positiveThreshold).toArray();
    final List<int[]> peakGroups = ChannelGroupUtils.splitIntoContiguousGroups(peakChannels);
    final int allGroupsAbove = peakGroups.size();
    final int singleChannelPeaks = (int) peakGroups.stream().filter(g -> g.length < 2).count();
    final int widestFeature = ChannelGroupUtils.maxLength(peakGroups);

    candidates = removeEdgeArtifacts(spectrum, candidates);

    List<int[]> groups = ChannelGroupUtils.splitIntoContiguousGroups(candidates);
    groups = rejectZeroStdGroups(spectrum, groups);

    // trim
    double trim = resolveTrim(n, stats, widestFeature, candidates.length, maxTrimOverride);
    final boolean auto = isAutoTrim(stats, widestFeature, n);
    List<int[]> trimmed = trimGroups(groups, trim, auto);
    if (trimmed.isEmpty() && !groups.isEmpty()) {
      trim = pickAutoTrimChannels(ChannelGroupUtils.totalLength(groups), 2 * maxTrimOverride);
      logger.fine("Trimming removed every group, retrying with trim " + trim);
      trimmed = trimGroups(groups, trim, true);
      if (trimmed.isEmpty()) {
        logger.fine("Relaxed trimming removed every group, keeping the untrimmed groups");
        trimmed = groups;
        trim = 0;
      }
    }
    if (auto && trimmed.size() > MAX_GROUPS_FOR_MAX_TRIM_ADJUSTMENT
        && maxTrimOverride > FindContinuumParameters.DEFAULT_MAX_TRIM) {
      logger.fine(() -> "Restoring max trim %d because there are more than %d groups".formatted(
          FindContinuumParameters.DEFAULT_MAX_TRIM, MAX_GROUPS_FOR_MAX_TRIM_ADJUSTMENT));
      final double defaultTrim = pickAutoTrimChannels(ChannelGroupUtils.totalLength(trimmed),
          FindContinuumParameters.DEFAULT_MAX_TRIM);
      final List<int[]> retrimmed = trimGroups(trimmed, defaultTrim, true);
      if (!retrimmed.isEmpty()) {
        trimmed = retrimmed;
        trim = defaultTrim;
      }
    }

    final int beforeRejection = trimmed.size();
    List<int[]> result = rejectNarrowInnerWindows(trimmed);
    result = rejectNarrowGroups(result, resolveNarrow(n));
    final int dropped = beforeRejection - result.size();

    final ChannelSelection selection = ChannelSelection.fromChannels(
        ChannelGroupUtils.flatten(result));

    // above / below the true median
    int above = 0, below = 0;
    double sumAbove = 0, sumBelow = 0;
    for (int c : valid) {
      final double v = spectrum.getValue(c);
      if (v > stats.trueMedian()) {
        above++;
        sumAbove += v - stats.trueMedian();
      } else if (v < stats.trueMedian()) {
        below++;
        sumBelow += stats.trueMedian() - v;
      }
    }
    final double channelRatio = below > 0 ? (double) above / below : Double.POSITIVE_INFINITY;
    final double sumRatio = sumBelow > 0 ? sumAbove / sumBelow : Double.POSITIVE_INFINITY;

    final double[] belowThreshold = IntStream.of(valid).mapToDouble(spectrum::getValue)
        .filter(v -> v < positiveThreshold).toArray();
    final double madBelow =
        belowThreshold.length > 0 ? MathUtils.scaledMad(belowThreshold) : Double.NaN;
    final double peakOverMad = stats.scaledMAD() > 0 ?
        (MathUtils.max(spectrum.getValidValues()) - stats.trueMedian()) / stats.scaledMAD()
        : Double.POSITIVE_INFINITY;

    final double trimUsed = trim;
    final ChannelClassification classification = new ChannelClassification(selection, stats,
        sigma, positiveThreshold, negativeThreshold, singleChannelPeaks, allGroupsAbove, dropped,
        candidateCount, channelRatio, sumRatio, madBelow, peakOverMad, trimUsed, widestFeature);
    logger.fine(() -> "Found %d continuum channels in %d groups (sigma=%.2f, trim=%s): %s".formatted(
        selection.getChannelCount(), selection.getNumberOfRanges(), sigma, trimUsed, selection));
    return classification;
  }

  private boolean isAutoTrim(BaselineStatistics stats, int widestFeature, int n) {
    return trimMode == TrimMode.AUTO && stats.suggestedTrimChannels() <= 0 && !isHotCore(stats,
        widestFeature, n);
  }

  private boolean isHotCore(BaselineStatistics stats, int widestFeature, int n) {
    return stats.signalRatio() > 0 && stats.signalRatio() < HOT_CORE_MAX_SIGNAL_RATIO
        && stats.spectralDiff2() < HOT_CORE_MAX_DIFF2 && n > HOT_CORE_MIN_CHANNELS
        && widestFeature < n / 8;
  }

  private double resolveTrim(int n, BaselineStatistics stats, int widestFeature, int candidates,
      int maxTrimOverride) {
    if (trimMode == TrimMode.FIXED) {
      return trimChannels;
    }
    if (stats.suggestedTrimChannels() > 0) {
      return stats.suggestedTrimChannels();
    }
    if (isHotCore(stats, widestFeature, n)) {
      logger.fine(() -> "Many lines appear to be present, trimming %d channels".formatted(
          HOT_CORE_TRIM));
      return HOT_CORE_TRIM;
    }
    return pickAutoTrimChannels(candidates, maxTrimOverride);
  }

  /**
   * Removes candidates at either edge of the spectrum that repeat the edge value, or that sit at
   * the spectrum minimum all the way to the edge.
   */
  private int[] removeEdgeArtifacts(Spectrum spectrum, int[] candidates) {
    if (candidates.length == 0) {
      return candidates;
    }
    final int[] valid = spectrum.getValidChannels();
    final int[] runs = ChannelGroupUtils.edgeRunLengths(spectrum);
    final int lowLimit = runs[0] > 0 ? valid[runs[0] - 1] : -1;
    final int highLimit =
        runs[1] > 0 ? valid[valid.length - runs[1]] : spectrum.getNumberOfChannels();
    int[] kept = IntStream.of(candidates).filter(c -> c > lowLimit && c < highLimit).toArray();
    if (kept.length == 0) {
      kept = candidates;
    }

    final double min = MathUtils.min(spectrum.getValidValues());
    int from = 0, to = kept.length;
    while (to - from > 1 && atMinimum(spectrum.getValue(kept[from]), min)) {
      from++;
    }
    while (to - from > 1 && atMinimum(spectrum.getValue(kept[to - 1]), min)) {
      to--;
    }
    final int removed = candidates.length - (to - from);
    if (removed > 0) {
      logger.fine(() -> "Removed " + removed + " edge channels that repeat the edge or minimum");
    }
    return Arrays.copyOfRange(kept, from, to);
  }

  private static boolean atMinimum(double value, double min) {
    return MathUtils.nearlyEqual(value, min, MINIMUM_EDGE_RELATIVE_TOLERANCE);
  }

  private List<int[]> rejectZeroStdGroups(Spectrum spectrum, List<int[]> groups) {
    final List<int[]> kept = new ArrayList<>();
    for (int[] group : groups) {
      if (group.length > 1 && MathUtils.std(spectrum.getValues(group)) == 0) {
        logger.fine(() -> "Rejecting %d channel group at %d with zero deviation".formatted(
            group.length, group[0]));
        continue;
      }
      kept.add(group);
    }
    return kept;
  }

  /**
   * @param trim fraction of each group if below 1, otherwise channels per edge
   * @param auto limits the trim to the max trim fraction of each group
   */
  List<int[]> trimGroups(List<int[]> groups, double trim, boolean auto) {
    if (trim <= 0) {
      return groups;
    }
    final List<int[]> out = new ArrayList<>();
    for (int i = 0; i < groups.size(); i++) {
      final int[] group = groups.get(i);
      int trimChan = trim < 1 ? (int) Math.ceil(group.length * trim) : (int) trim;
      if (auto && (double) trimChan / group.length > maxTrimFraction) {
        trimChan = (int) Math.floor(maxTrimFraction * group.length);
      }
      if (trimChan == 0) {
        out.add(group);
        continue;
      }
      if (group.length < 1 + 2 * trimChan) {
        if (groups.size() == 1) {
          // a single short group keeps its first channel
          out.add(Arrays.copyOfRange(group, 0, 1));
        }
        continue;
      }
      int lowTrim = trimChan;
      int highTrim = trimChan;
      // preserve bandwidth towards the band edges
      if (i == 0) {
        lowTrim = Math.min(trimChan, edgeTrimLimit);
      }
      if (i == groups.size() - 1) {
        highTrim = Math.min(trimChan, edgeTrimLimit);
      }
      out.add(Arrays.copyOfRange(group, lowTrim, group.length - highTrim));
    }
    return out;
  }

  /**
   * With 3 to 15 groups, inner groups narrower than both outer groups (or a fifth of them, from 8
   * groups on) are more likely noise than continuum.
   */
  List<int[]> rejectNarrowInnerWindows(List<int[]> groups) {
    final int count = groups.size();
    if (count < MIN_INNER_WINDOW_GROUPS || count > MAX_INNER_WINDOW_GROUPS) {
      return groups;
    }
    final double widthFactor = count < WIDE_INNER_WINDOW_GROUPS ? 1.0 : 0.2;
    final double minWidth =
        widthFactor * Math.min(groups.get(0).length, groups.get(count - 1).length);
    final List<int[]> out = new ArrayList<>();
    out.add(groups.get(0));
    for (int i = 1; i < count - 1; i++) {
      if (groups.get(i).length >= minWidth) {
        out.add(groups.get(i));
      }
    }
    out.add(groups.get(count - 1));
    if (out.size() < count) {
      logger.fine(() -> "Rejected %d narrow inner windows".formatted(count - out.size()));
    }
    return out;
  }

  List<int[]> rejectNarrowGroups(List<int[]> groups, int minWidth) {
    if (groups.size() < 2) {
      return groups;
    }
    final List<int[]> out = groups.stream().filter(g -> g.length >= minWidth).toList();
    if (out.isEmpty()) {
      logger.fine(() -> "Not rejecting narrow groups, none is at least %d channels wide".formatted(
          minWidth));
      return groups;
    }
    return out;
  }
}
