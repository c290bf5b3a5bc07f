/*
 * Copyright (c) 2025 The findcont Development Team
 */

package io.github.findcont.modules.dataprocessing.contdet_classifier;

import com.google.common.collect.Range;
import com.google.common.primitives.ImmutableIntArray;
import io.github.findcont.datamodel.ChannelSelection;
import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.datamodel.TestSpectra;
import io.github.findcont.modules.dataprocessing.contdet_baseline.BaselineStatistics;
import io.github.findcont.modules.dataprocessing.contdet_baseline.BaselineSubset;
import io.github.findcont.modules.dataprocessing.contdet_baseline.RobustBaselineStatistics;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.TrimMode;
import io.github.findcont.parameters.ParameterSet;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ChannelClassifierTest {

  private static ParameterSet untrimmedParameters() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.trimMode, TrimMode.FIXED);
    parameters.setParameter(FindContinuumParameters.trimChannels, 0.0);
    parameters.setParameter(FindContinuumParameters.narrow, 2);
    return parameters;
  }

  private static ChannelClassification classify(ParameterSet parameters, Spectrum spectrum,
      double sigma) {
    BaselineStatistics stats = new RobustBaselineStatistics(parameters).compute(spectrum, sigma);
    return new ChannelClassifier(parameters).classify(spectrum, sigma, stats);
  }

  @Test
  void testEmissionLineIsExcluded() {
    ChannelClassification result = classify(untrimmedParameters(), TestSpectra.lineSpectrum(),
        3.0);
    Assertions.assertEquals(ChannelSelection.parse("0~89;111~199"), result.selection());
    Assertions.assertEquals(1, result.allGroupsAbove());
    Assertions.assertEquals(21, result.widestFeature());
    Assertions.assertEquals(179, result.candidateChannelCount());
    Assertions.assertTrue(result.positiveThreshold() < 5.0);
    Assertions.assertTrue(result.negativeThreshold() < result.trueMedian());
    Assertions.assertEquals(0, result.droppedRangeCount());
    Assertions.assertFalse(result.onlySingleChannelPeaks());
  }

  @Test
  void testDefaultTrimmingKeepsBandEdges() {
    ChannelClassification result = classify(new FindContinuumParameters(),
        TestSpectra.lineSpectrum(), 3.0);
    Assertions.assertEquals(ChannelSelection.parse("3~80;120~196"), result.selection());
    Assertions.assertEquals(0.1, result.trimUsed(), 0);
  }

  @Test
  void testPureNoiseIsOneRange() {
    ChannelClassification result = classify(new FindContinuumParameters(),
        Spectrum.of(TestSpectra.quantileNoise(200, 1.0, 0.1)), 3.5);
    Assertions.assertEquals(ChannelSelection.of(3, 196), result.selection());
    Assertions.assertEquals(0, result.allGroupsAbove());
  }

  @Test
  void testRepeatedEdgeChannelsAreRemoved() {
    for (double edge : new double[]{1.0, 0.0}) {
      for (double sigma : new double[]{3.0, 3.5}) {
        ChannelClassification result = classify(new FindContinuumParameters(),
            TestSpectra.paddedEdgeSpectrum(edge), sigma);
        Assertions.assertEquals(ChannelSelection.of(8, 191), result.selection(),
            "edge " + edge + ", sigma " + sigma);
      }
    }
  }

  @Test
  void testClassificationIsRepeatable() {
    ParameterSet parameters = new FindContinuumParameters();
    Spectrum spectrum = TestSpectra.lineSpectrum();
    BaselineStatistics stats = new RobustBaselineStatistics(parameters).compute(spectrum, 3.5);
    ChannelClassifier classifier = new ChannelClassifier(parameters);
    Assertions.assertEquals(classifier.classify(spectrum, 3.5, stats),
        classifier.classify(spectrum, 3.5, stats));
  }

  @Test
  void testCandidatesGrowWithSigma() {
    ParameterSet parameters = new FindContinuumParameters();
    Spectrum spectrum = TestSpectra.lineSpectrum();
    BaselineStatistics stats = new RobustBaselineStatistics(parameters).compute(spectrum, 3.5);
    ChannelClassifier classifier = new ChannelClassifier(parameters);
    int previous = 0;
    for (double sigma = 0.5; sigma <= 8; sigma += 0.5) {
      ChannelClassification result = classifier.classify(spectrum, sigma, stats);
      Assertions.assertTrue(result.candidateChannelCount() >= previous, "sigma " + sigma);
      previous = result.candidateChannelCount();
    }
  }

  @Test
  void testRangesAreSortedAndInBounds() {
    Spectrum spectrum = TestSpectra.lineSpectrum();
    for (double sigma = 2.0; sigma <= 6; sigma += 0.5) {
      ChannelClassification result = classify(new FindContinuumParameters(), spectrum, sigma);
      int previousUpper = -2;
      for (Range<Integer> range : result.selection().getRanges()) {
        Assertions.assertTrue(range.lowerEndpoint() > previousUpper + 1);
        Assertions.assertTrue(range.lowerEndpoint() >= 0);
        Assertions.assertTrue(range.upperEndpoint() < spectrum.getNumberOfChannels());
        previousUpper = range.upperEndpoint();
      }
      Assertions.assertFalse(result.selection().isEmpty());
    }
  }

  @Test
  void testPickNarrow() {
    Assertions.assertEquals(2, ChannelClassifier.pickNarrow(64));
    Assertions.assertEquals(3, ChannelClassifier.pickNarrow(128));
    Assertions.assertEquals(3, ChannelClassifier.pickNarrow(960));
    Assertions.assertEquals(4, ChannelClassifier.pickNarrow(3840));
    Assertions.assertEquals(2, new ChannelClassifier(untrimmedParameters()).resolveNarrow(3840));
  }

  @Test
  void testPickAutoTrimChannels() {
    Assertions.assertEquals(0.1, ChannelClassifier.pickAutoTrimChannels(150, 20), 0);
    Assertions.assertEquals(0.1, ChannelClassifier.pickAutoTrimChannels(200, 20), 0);
    Assertions.assertEquals(20, ChannelClassifier.pickAutoTrimChannels(201, 20), 0);
  }

  @Test
  void testTrimGroups() {
    ChannelClassifier classifier = new ChannelClassifier(new FindContinuumParameters());
    List<int[]> groups = List.of(range(0, 29), range(40, 69), range(80, 109));
    List<int[]> trimmed = classifier.trimGroups(groups, 5, true);
    Assertions.assertEquals(3, trimmed.size());
    // the band edge sides are trimmed by at most 3 channels
    Assertions.assertArrayEquals(range(3, 24), trimmed.get(0));
    Assertions.assertArrayEquals(range(45, 64), trimmed.get(1));
    Assertions.assertArrayEquals(range(85, 106), trimmed.get(2));

    List<int[]> tooShort = classifier.trimGroups(List.of(range(0, 29), range(40, 44)), 3,
        false);
    Assertions.assertEquals(1, tooShort.size());

    List<int[]> single = classifier.trimGroups(List.of(range(10, 14)), 4, false);
    Assertions.assertArrayEquals(new int[]{10}, single.get(0));
  }

  @Test
  void testRejectNarrowInnerWindows() {
    ChannelClassifier classifier = new ChannelClassifier(new FindContinuumParameters());
    List<int[]> groups = List.of(range(0, 19), range(30, 34), range(40, 69), range(80, 99));
    List<int[]> kept = classifier.rejectNarrowInnerWindows(groups);
    Assertions.assertEquals(3, kept.size());
    Assertions.assertArrayEquals(range(40, 69), kept.get(1));

    List<int[]> two = List.of(range(0, 19), range(30, 34));
    Assertions.assertSame(two, classifier.rejectNarrowInnerWindows(two));
  }

  @Test
  void testNarrowRejectionNeverEmptiesTheSelection() {
    ChannelClassifier classifier = new ChannelClassifier(new FindContinuumParameters());
    List<int[]> narrow = List.of(range(0, 1), range(10, 11));
    Assertions.assertEquals(2, classifier.rejectNarrowGroups(narrow, 3).size());
    List<int[]> mixed = List.of(range(0, 1), range(10, 19));
    Assertions.assertEquals(1, classifier.rejectNarrowGroups(mixed, 3).size());
    List<int[]> single = List.of(range(0, 1));
    Assertions.assertEquals(1, classifier.rejectNarrowGroups(single, 3).size());
  }

  @Test
  void testAboveBelowStatistics() {
    ChannelClassification result = classify(new FindContinuumParameters(),
        TestSpectra.lineSpectrum(), 3.5);
    Assertions.assertTrue(result.channelRatio() > 1);
    Assertions.assertTrue(result.sumRatio() > 1);
    Assertions.assertTrue(result.peakOverMad() > 20);
    Assertions.assertTrue(result.madOfPointsBelowThreshold() > 0);
  }

  private static int[] range(int from, int to) {
    int[] channels = new int[to - from + 1];
    for (int i = 0; i < channels.length; i++) {
      channels[i] = from + i;
    }
    return channels;
  }

  /**
   * Noise at 1.0 with a 20 channel line of 5.0 in the middle.
   */
  private static Spectrum centralLineSpectrum(int n) {
    double[] noise = TestSpectra.quantileNoise(n - 20, 1.0, 0.1);
    double[] values = new double[n];
    int next = 0;
    for (int c = 0; c < n; c++) {
      values[c] = c >= n / 2 - 10 && c < n / 2 + 10 ? 5.0 : noise[next++];
    }
    return Spectrum.of(values);
  }

  private static BaselineStatistics unitStatistics(double signalRatio, double spectralDiff2,
      int suggestedTrim) {
    return new BaselineStatistics(1.0, 0.1, 1.0, 0, signalRatio, BaselineSubset.LOW, 1.0, 19,
        ImmutableIntArray.of(), spectralDiff2, suggestedTrim);
  }

  @Test
  void testLineForestTrim() {
    ChannelClassification result = new ChannelClassifier(new FindContinuumParameters()).classify(
        centralLineSpectrum(200), 3.5, unitStatistics(0, 0.1, 6));
    Assertions.assertEquals(6, result.trimUsed(), 0);
    Assertions.assertEquals(ChannelSelection.parse("3~83;116~196"), result.selection());
  }

  @Test
  void testHotCoreTrim() {
    ChannelClassifier classifier = new ChannelClassifier(new FindContinuumParameters());
    Spectrum spectrum = centralLineSpectrum(1200);

    ChannelClassification hotCore = classifier.classify(spectrum, 3.5,
        unitStatistics(0.4, 0.9, 0));
    Assertions.assertEquals(20, hotCore.widestFeature());
    Assertions.assertEquals(13, hotCore.trimUsed(), 0);
    Assertions.assertEquals(ChannelSelection.parse("3~576;623~1196"), hotCore.selection());

    // regular automatic trimming, capped at max trim
    ChannelClassification strongSignal = classifier.classify(spectrum, 3.5,
        unitStatistics(0.7, 0.9, 0));
    Assertions.assertEquals(20, strongSignal.trimUsed(), 0);
    Assertions.assertEquals(ChannelSelection.parse("3~569;630~1196"), strongSignal.selection());
    Assertions.assertEquals(20,
        classifier.classify(spectrum, 3.5, unitStatistics(0.4, 1.5, 0)).trimUsed(), 0);
    Assertions.assertEquals(20,
        classifier.classify(spectrum, 3.5, unitStatistics(0, 0.9, 0)).trimUsed(), 0);
    Assertions.assertEquals(20, classifier.classify(centralLineSpectrum(1000), 3.5,
        unitStatistics(0.4, 0.9, 0)).trimUsed(), 0);
  }

  @Test
  void testFixedTrimIgnoresLineHeuristics() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.trimMode, TrimMode.FIXED);
    parameters.setParameter(FindContinuumParameters.trimChannels, 2.0);
    ChannelClassifier classifier = new ChannelClassifier(parameters);
    Spectrum spectrum = centralLineSpectrum(1200);
    Assertions.assertEquals(2,
        classifier.classify(spectrum, 3.5, unitStatistics(0.4, 0.9, 0)).trimUsed(), 0);
    Assertions.assertEquals(2,
        classifier.classify(spectrum, 3.5, unitStatistics(0, 0.1, 6)).trimUsed(), 0);
  }
}
