/*
 * Copyright (c) 2025 The findcont Development Team
 */

package io.github.findcont.modules.dataprocessing.contdet_baseline;

import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.datamodel.TestSpectra;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.BaselineMode;
import io.github.findcont.parameters.ParameterSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RobustBaselineStatisticsTest {

  private static RobustBaselineStatistics defaultStatistics() {
    return new RobustBaselineStatistics(new FindContinuumParameters());
  }

  @Test
  void testTooFewBaselineChannels() {
    RobustBaselineStatistics statistics = defaultStatistics();
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> statistics.resolveBaselineChannelCount(5));
    Assertions.assertEquals(2, statistics.resolveBaselineChannelCount(10));
    Assertions.assertEquals(38, statistics.resolveBaselineChannelCount(200));

    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.nBaselineChannels, 25.0);
    Assertions.assertEquals(25, new RobustBaselineStatistics(parameters)
        .resolveBaselineChannelCount(200));
  }

  @Test
  void testComputeRejectsTinySpectrum() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> defaultStatistics().compute(Spectrum.of(1, 2, 3), 3.5));
  }

  @Test
  void testCorrectionFactors() {
    Assertions.assertEquals(2.8,
        RobustBaselineStatistics.sigmaCorrectionFactor(BaselineSubset.LOW, 128, 10), 1e-12);
    Assertions.assertEquals(1.0,
        RobustBaselineStatistics.sigmaCorrectionFactor(BaselineSubset.MIDDLE, 128, 10), 1e-12);
    Assertions.assertEquals(Math.pow(2, 0.08),
        RobustBaselineStatistics.sigmaCorrectionFactor(BaselineSubset.EDGE, 256, 50), 1e-12);
    Assertions.assertEquals(6.3,
        RobustBaselineStatistics.medianCorrectionFactor(BaselineSubset.HIGH, 5), 1e-12);
    Assertions.assertEquals(0,
        RobustBaselineStatistics.medianCorrectionFactor(BaselineSubset.EDGE, 5), 0);
  }

  @Test
  void testSignalRatio() {
    double[] values = {1, 1, 1, 1, 5, 5, 5, 5};
    Assertions.assertEquals(1.0, RobustBaselineStatistics.signalRatio(values, 1, 10), 0);
    Assertions.assertEquals(0.25, RobustBaselineStatistics.signalRatio(values, 1, 2), 1e-12);
    Assertions.assertEquals(0.0, RobustBaselineStatistics.signalRatio(values, 100, 2), 0);
  }

  @Test
  void testEmissionLineUsesLowSubset() {
    BaselineStatistics stats = defaultStatistics().compute(TestSpectra.lineSpectrum(), 3.0);
    Assertions.assertEquals(BaselineSubset.LOW, stats.usedSubset());
    Assertions.assertEquals(38, stats.baselineChannels().length());
    Assertions.assertEquals(19.0, stats.percentile(), 1e-12);
    Assertions.assertTrue(stats.scaledMAD() > 0);
    Assertions.assertTrue(stats.signalRatio() > 0 && stats.signalRatio() < 1);
    // the corrected median moves up from the low subset median towards the noise level
    Assertions.assertTrue(stats.trueMedian() > stats.median());
    Assertions.assertEquals(1.0, stats.trueMedian(), 0.05);
    for (int i = 0; i < stats.baselineChannels().length(); i++) {
      int c = stats.baselineChannels().get(i);
      Assertions.assertTrue(c < 90 || c > 110, "line channel " + c + " in the baseline");
    }
  }

  @Test
  void testAbsorptionLineUsesHighSubset() {
    double[] noise = TestSpectra.quantileNoise(179, 1.0, 0.1);
    double[] values = new double[200];
    int next = 0;
    for (int c = 0; c < values.length; c++) {
      values[c] = c >= 90 && c <= 110 ? 1 - 3 * Math.exp(-Math.pow((c - 100) / 5.0, 2))
          : noise[next++];
    }
    BaselineStatistics stats = defaultStatistics().compute(Spectrum.of(values), 3.0);
    Assertions.assertEquals(BaselineSubset.HIGH, stats.usedSubset());
    Assertions.assertTrue(stats.trueMedian() < stats.median());
    Assertions.assertEquals(1.0, stats.trueMedian(), 0.05);
  }

  @Test
  void testPureNoiseIsNearlyLineFree() {
    BaselineStatistics stats = defaultStatistics().compute(
        Spectrum.of(TestSpectra.quantileNoise(200, 1.0, 0.1)), 3.5);
    Assertions.assertTrue(stats.signalRatio() > 0.95);
    Assertions.assertEquals(1.0, stats.trueMedian(), 0.01);
    // low subset MAD times the correction is close to the population sigma
    Assertions.assertEquals(0.1, stats.scaledMAD() * stats.correctionFactor(), 0.02);
  }

  @Test
  void testIdenticalBlockDoesNotCollapseTheNoise() {
    double[] noise = TestSpectra.quantileNoise(160, 1.0, 0.1);
    double[] values = new double[200];
    int next = 0;
    for (int c = 0; c < values.length; c++) {
      values[c] = c >= 50 && c < 90 ? 0.5 : noise[next++];
    }
    BaselineStatistics stats = defaultStatistics().compute(Spectrum.of(values), 3.5);
    Assertions.assertTrue(stats.scaledMAD() > 0.01);
    for (int i = 0; i < stats.baselineChannels().length(); i++) {
      int c = stats.baselineChannels().get(i);
      Assertions.assertFalse(c >= 50 && c < 90);
    }
  }

  @Test
  void testEdgeModeIgnoresConstantEdge() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.baselineMode, BaselineMode.EDGE);
    double[] values = TestSpectra.quantileNoise(200, 1.0, 0.1);
    for (int c = 0; c < 19; c++) {
      values[c] = 0;
    }
    BaselineStatistics stats = new RobustBaselineStatistics(parameters).compute(
        Spectrum.of(values), 3.5);
    Assertions.assertEquals(BaselineSubset.EDGE, stats.usedSubset());
    Assertions.assertEquals(19, stats.baselineChannels().length());
    Assertions.assertEquals(181, stats.baselineChannels().get(0));
    Assertions.assertEquals(stats.median(), stats.trueMedian(), 0);
  }

  @Test
  void testFlaggedChannelsAreIgnored() {
    double[] values = TestSpectra.quantileNoise(200, 1.0, 0.1);
    boolean[] flagged = new boolean[200];
    for (int c = 0; c < 100; c++) {
      values[c] = -50;
      flagged[c] = true;
    }
    BaselineStatistics stats = defaultStatistics().compute(new Spectrum(values, flagged), 3.5);
    for (int i = 0; i < stats.baselineChannels().length(); i++) {
      Assertions.assertTrue(stats.baselineChannels().get(i) >= 100);
    }
    Assertions.assertTrue(stats.median() > 0.5);
  }

  private static RobustBaselineStatistics dropExtremeStatistics(double fraction) {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.dropExtremeFraction, fraction);
    return new RobustBaselineStatistics(parameters);
  }

  @Test
  void testDropExtremesWithinRatioWindow() {
    Spectrum noise = Spectrum.of(TestSpectra.quantileNoise(200, 1.0, 0.1));
    BaselineStatistics all = defaultStatistics().compute(noise, 3.5);
    // 8 of the 38 low channels furthest from their median go, the MAD falls by about 1.43
    BaselineStatistics dropped = dropExtremeStatistics(0.2).compute(noise, 3.5);
    Assertions.assertEquals(BaselineSubset.LOW, dropped.usedSubset());
    Assertions.assertEquals(30, dropped.baselineChannels().length());
    double ratio = all.scaledMAD() / dropped.scaledMAD();
    Assertions.assertTrue(ratio >= 1.15 && ratio <= 1.5, "ratio " + ratio);
  }

  @Test
  void testDropExtremesOutsideRatioWindowKeepsSubset() {
    Spectrum noise = Spectrum.of(TestSpectra.quantileNoise(200, 1.0, 0.1));
    BaselineStatistics all = defaultStatistics().compute(noise, 3.5);
    // MAD ratio of about 1.61, above the window
    BaselineStatistics tooMuch = dropExtremeStatistics(0.3).compute(noise, 3.5);
    Assertions.assertEquals(38, tooMuch.baselineChannels().length());
    Assertions.assertEquals(all.scaledMAD(), tooMuch.scaledMAD(), 0);
    // MAD ratio of about 1.08, below the window
    BaselineStatistics tooLittle = dropExtremeStatistics(0.05).compute(noise, 3.5);
    Assertions.assertEquals(38, tooLittle.baselineChannels().length());
    Assertions.assertEquals(all.scaledMAD(), tooLittle.scaledMAD(), 0);
  }

  /**
   * Absorption ramp at 20..59 and emission ramp at 140..179, both far outside the noise.
   */
  static Spectrum mixedLineSpectrum() {
    double[] noise = TestSpectra.quantileNoise(120, 1.0, 0.1);
    double[] values = new double[200];
    int next = 0;
    for (int c = 0; c < values.length; c++) {
      if (c >= 20 && c <= 59) {
        values[c] = 0.5 - 0.1 * (c - 20);
      } else if (c >= 140 && c <= 179) {
        values[c] = 1.5 + 0.1 * (c - 140);
      } else {
        values[c] = noise[next++];
      }
    }
    return Spectrum.of(values);
  }

  @Test
  void testMixedSpectrumUsesMiddleSubset() {
    BaselineStatistics stats = defaultStatistics().compute(mixedLineSpectrum(), 3.5);
    Assertions.assertEquals(BaselineSubset.MIDDLE, stats.usedSubset());
    Assertions.assertEquals(124, stats.baselineChannels().length());
    Assertions.assertEquals(Math.pow(200 / 128.0, 0.08), stats.correctionFactor(), 1e-12);
    Assertions.assertEquals(0, stats.medianCorrectionFactor(), 0);
    Assertions.assertEquals(stats.median(), stats.trueMedian(), 0);
    Assertions.assertEquals(1.0, stats.trueMedian(), 0.01);
    Assertions.assertEquals(0.1, stats.scaledMAD(), 0.01);
  }

  /**
   * Smooth spectrum of 400 channels with six bright lines, like a channel averaged hot core.
   */
  static Spectrum lineForestSpectrum() {
    double[] values = TestSpectra.quantileNoise(400, 10.0, 0.01);
    int[] centers = {40, 100, 160, 220, 280, 340};
    for (int c = 0; c < values.length; c++) {
      for (int center : centers) {
        values[c] += 5 * Math.exp(-0.5 * Math.pow((c - center) / 4.0, 2));
      }
    }
    return Spectrum.of(values);
  }

  @Test
  void testLineForestHeuristics() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.lineForestHeuristics, false);
    BaselineStatistics plain = new RobustBaselineStatistics(parameters).compute(
        lineForestSpectrum(), 3.5);
    BaselineStatistics forest = defaultStatistics().compute(lineForestSpectrum(), 3.5);

    Assertions.assertTrue(Double.isNaN(plain.spectralDiff2()));
    Assertions.assertEquals(0, plain.suggestedTrimChannels());
    Assertions.assertTrue(plain.signalRatio() > 0 && plain.signalRatio() < 0.95);

    Assertions.assertEquals(BaselineSubset.LOW, forest.usedSubset());
    Assertions.assertTrue(forest.spectralDiff2() < 0.6);
    Assertions.assertEquals(0, forest.signalRatio(), 0);
    Assertions.assertEquals(plain.scaledMAD() * 0.33, forest.scaledMAD(), 1e-15);
    Assertions.assertEquals(6, forest.suggestedTrimChannels());
    // no median correction without signal
    Assertions.assertEquals(forest.median(), forest.trueMedian(), 0);
  }

  @Test
  void testLineForestNeedsMoreThan200Channels() {
    double[] values = new double[200];
    System.arraycopy(lineForestSpectrum().getValues(), 0, values, 0, 200);
    BaselineStatistics stats = defaultStatistics().compute(Spectrum.of(values), 3.5);
    Assertions.assertEquals(0, stats.suggestedTrimChannels());
    Assertions.assertTrue(stats.signalRatio() > 0);
  }
}
