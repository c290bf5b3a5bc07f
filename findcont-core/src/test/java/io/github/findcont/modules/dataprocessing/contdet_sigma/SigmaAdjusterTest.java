/*
 * Copyright (c) 2025 The findcont Development Team
 */

package io.github.findcont.modules.dataprocessing.contdet_sigma;

import com.google.common.primitives.ImmutableIntArray;
import io.github.findcont.datamodel.ChannelSelection;
import io.github.findcont.datamodel.SpectralSetup;
import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.datamodel.TestSpectra;
import io.github.findcont.modules.dataprocessing.contdet_baseline.BaselineStatistics;
import io.github.findcont.modules.dataprocessing.contdet_baseline.BaselineSubset;
import io.github.findcont.modules.dataprocessing.contdet_baseline.RobustBaselineStatistics;
import io.github.findcont.modules.dataprocessing.contdet_classifier.ChannelClassification;
import io.github.findcont.modules.dataprocessing.contdet_classifier.ChannelClassifier;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.MeanSpectrumMethod;
import io.github.findcont.parameters.ParameterSet;
import io.github.findcont.util.MathUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SigmaAdjusterTest {

  private static final SpectralSetup FDM_200 = SpectralSetup.unknownFrequencies(200, false);

  @Test
  void testNoiseSpikesRaiseSigma() {
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters());
    SigmaAdjustment adjustment = adjuster.adjust(TestSpectra.spikeSpectrum(), FDM_200, 3.5, false);
    Assertions.assertEquals(1.5, adjustment.factor(), 0);
    Assertions.assertEquals(5.25, adjustment.finalSigma(), 1e-12);
    Assertions.assertEquals(3.5, adjustment.initialSigma(), 0);
    Assertions.assertEquals(1, adjustment.reruns());
    Assertions.assertFalse(adjustment.trendRemoved());
    Assertions.assertEquals(ChannelSelection.parse("6~31;169~193"),
        adjustment.classification().selection());
  }

  @Test
  void testNoiseSpikesAboveTdmSigmaAreKept() {
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters());
    SigmaAdjustment adjustment = adjuster.adjust(TestSpectra.spikeSpectrum(), FDM_200, 5.0, false);
    Assertions.assertEquals(1.0, adjustment.factor(), 0);
  }

  @Test
  void testEmissionLineKeepsSigma() {
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters());
    SigmaAdjustment adjustment = adjuster.adjust(TestSpectra.lineSpectrum(), FDM_200, 3.5, false);
    Assertions.assertEquals(1.0, adjustment.factor(), 0);
    Assertions.assertEquals(3.5, adjustment.finalSigma(), 0);
    // the max trim change alone triggers one rerun
    Assertions.assertEquals(1, adjustment.reruns());
    ChannelSelection selection = adjustment.classification().selection();
    for (int c = 90; c <= 110; c++) {
      Assertions.assertFalse(selection.contains(c));
    }
    Assertions.assertEquals(2, selection.getNumberOfRanges());
  }

  @Test
  void testReruns() {
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters());
    for (Spectrum spectrum : new Spectrum[]{TestSpectra.lineSpectrum(),
        TestSpectra.spikeSpectrum(), TestSpectra.paddedEdgeSpectrum(0),
        Spectrum.of(TestSpectra.quantileNoise(200, 1.0, 0.1))}) {
      for (boolean tdm : new boolean[]{false, true}) {
        SigmaAdjustment adjustment = adjuster.adjust(spectrum,
            SpectralSetup.unknownFrequencies(200, tdm), 3.5, false);
        Assertions.assertTrue(adjustment.reruns() <= 2);
        Assertions.assertEquals(200, adjustment.spectrum().getNumberOfChannels());
      }
    }
  }

  @Test
  void testTdmKeepsMaxTrim() {
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters());
    SigmaAdjustment adjustment = adjuster.adjust(TestSpectra.lineSpectrum(),
        SpectralSetup.unknownFrequencies(200, true), 3.5, false);
    Assertions.assertEquals(0, adjustment.reruns());
  }

  @Test
  void testGroupRatioFactor() {
    Assertions.assertEquals(1.0, SigmaAdjuster.groupRatioFactor(5, 1.0,
        new SpectralSetup(128, 15.625e6, 100e9, true)), 0);
    Assertions.assertEquals(0.9, SigmaAdjuster.groupRatioFactor(1, 1.0, FDM_200), 0);
    Assertions.assertEquals(0.5, SigmaAdjuster.groupRatioFactor(2, 1.0,
        SpectralSetup.of(400, 1.875e9 / 400, 100e9)), 0);
    Assertions.assertEquals(0.7, SigmaAdjuster.groupRatioFactor(2, 1.0,
        SpectralSetup.of(240, 7.8125e6, 100e9)), 0);
    Assertions.assertEquals(0.333, SigmaAdjuster.groupRatioFactor(5, 0.5,
        SpectralSetup.of(3840, 1.875e9 / 3840, 100e9)), 0);
    Assertions.assertEquals(0.5, SigmaAdjuster.groupRatioFactor(9, 1.0,
        SpectralSetup.of(3840, 1.875e9 / 3840, 100e9)), 1e-12);
    Assertions.assertEquals(0.5, SigmaAdjuster.groupRatioFactor(9, 1.0, FDM_200), 1e-12);
    // half the reference bandwidth tempers the reduction
    Assertions.assertEquals(Math.sqrt(0.5), SigmaAdjuster.groupRatioFactor(9, 1.0,
        SpectralSetup.of(1920, 1.875e9 / 3840, 100e9)), 1e-12);
  }

  @Test
  void testPeakOverMadMethodSkipsGroupRatioFactor() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.meanSpectrumMethod,
        MeanSpectrumMethod.PEAK_OVER_MAD);
    parameters.setParameter(FindContinuumParameters.trimMode,
        FindContinuumParameters.TrimMode.FIXED);
    parameters.setParameter(FindContinuumParameters.trimChannels, 0.0);
    SigmaAdjuster adjuster = new SigmaAdjuster(parameters);
    // many narrow noise groups at a low sigma
    SigmaAdjustment adjustment = adjuster.adjust(TestSpectra.lineSpectrum(), FDM_200, 2.0, false);
    Assertions.assertTrue(adjustment.factor() >= 5.0 / 7.0);
    Assertions.assertNotEquals(0.9, adjustment.factor());
  }

  @Test
  void testSigmaDefaults() {
    Assertions.assertEquals(3.5,
        SigmaDefaults.initialSigma(MeanSpectrumMethod.MEAN_ABOVE_THRESHOLD, false), 0);
    Assertions.assertEquals(4.5,
        SigmaDefaults.initialSigma(MeanSpectrumMethod.MEAN_ABOVE_THRESHOLD, true), 0);
    Assertions.assertEquals(6.0, SigmaDefaults.initialSigma(MeanSpectrumMethod.PEAK_OVER_MAD, false),
        0);
    Assertions.assertEquals(6.5, SigmaDefaults.tdmSigma(MeanSpectrumMethod.PEAK_OVER_MAD), 0);
  }

  private static ChannelSelection groups(int count) {
    List<String> ranges = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      ranges.add(i * 10 + "~" + (i * 10 + 4));
    }
    return ChannelSelection.parse(String.join(";", ranges));
  }

  private static BaselineStatistics unitStatistics(double scaledMad) {
    return new BaselineStatistics(1.0, scaledMad, 1.0, 0, 1, BaselineSubset.LOW, 1.0, 19,
        ImmutableIntArray.of(), Double.NaN, 0);
  }

  private static ChannelClassification classification(ChannelSelection selection,
      BaselineStatistics stats, double sigma, double madBelow, double peakOverMad) {
    return new ChannelClassification(selection, stats, sigma, 1.35, 0.6, 0, 1, 0,
        selection.getChannelCount(), 1.0, 1.0, madBelow, peakOverMad, 0, 5);
  }

  @Test
  void testMadRatioFactor() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.autoSigma, false);
    SigmaAdjuster adjuster = new SigmaAdjuster(parameters);
    BaselineStatistics stats = unitStatistics(0.1);

    // MAD below the threshold is 1.2 times the baseline MAD, peak at 25 MADs
    Assertions.assertEquals(5.0 / 7.0, adjuster.correctiveFactor(
        classification(groups(2), stats, 3.5, 0.12, 25), FDM_200, 3.5, false), 1e-12);
    Assertions.assertEquals(6.0 / 7.0, adjuster.correctiveFactor(
        classification(groups(2), stats, 3.5, 0.12, 25), FDM_200, 3.5, true), 1e-12);
    // relaxed towards 1 as the group count approaches 16
    Assertions.assertEquals(6.0 / 7.0, adjuster.correctiveFactor(
        classification(groups(9), stats, 3.5, 0.12, 25), FDM_200, 3.5, false), 1e-12);
    Assertions.assertEquals(13.0 / 14.0, adjuster.correctiveFactor(
        classification(groups(9), stats, 3.5, 0.12, 25), FDM_200, 3.5, true), 1e-12);
    Assertions.assertEquals(5.0 / 7.0 + 2.0 / 7.0 * 13.0 / 14.0, adjuster.correctiveFactor(
        classification(groups(15), stats, 3.5, 0.12, 25), FDM_200, 3.5, false), 1e-12);
    Assertions.assertEquals(1.0, adjuster.correctiveFactor(
        classification(groups(16), stats, 3.5, 0.12, 25), FDM_200, 3.5, false), 0);
    Assertions.assertEquals(1.0, adjuster.correctiveFactor(
        classification(groups(1), stats, 3.5, 0.12, 25), FDM_200, 3.5, false), 0);
  }

  @Test
  void testMadRatioFactorNeedsBothCutoffs() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.autoSigma, false);
    SigmaAdjuster adjuster = new SigmaAdjuster(parameters);
    BaselineStatistics stats = unitStatistics(0.1);
    Assertions.assertEquals(1.0, adjuster.correctiveFactor(
        classification(groups(4), stats, 3.5, 0.11, 25), FDM_200, 3.5, false), 0);
    Assertions.assertEquals(1.0, adjuster.correctiveFactor(
        classification(groups(4), stats, 3.5, 0.12, 15), FDM_200, 3.5, false), 0);
    // the correction factor scales the baseline MAD
    Assertions.assertEquals(1.0, adjuster.correctiveFactor(classification(groups(4),
        new BaselineStatistics(1.0, 0.1, 1.2, 0, 1, BaselineSubset.LOW, 1.0, 19,
            ImmutableIntArray.of(), Double.NaN, 0), 3.5, 0.12, 25), FDM_200, 3.5, false), 0);
  }

  /**
   * 1.0 to 3.0 across the band with noise of 0.01.
   */
  private static Spectrum slopedSpectrum() {
    double[] values = TestSpectra.quantileNoise(200, 0.0, 0.01);
    for (int c = 0; c < values.length; c++) {
      values[c] += 1 + 2.0 * c / 199;
    }
    return Spectrum.of(values);
  }

  private static final SpectralSetup TDM_200 = SpectralSetup.unknownFrequencies(200, true);

  @Test
  void testTrendRemovalIsAccepted() {
    Spectrum sloped = slopedSpectrum();
    ScriptedStatistics statistics = new ScriptedStatistics(
        s -> MathUtils.scaledMad(s.getValues()));
    ScriptedClassifier classifier = new ScriptedClassifier(
        s -> s == sloped ? ChannelSelection.of(0, 199) : ChannelSelection.parse("0~89;111~199"));
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters(), statistics,
        classifier);
    SigmaAdjustment adjustment = adjuster.adjust(sloped, TDM_200, 3.5, false);

    Assertions.assertTrue(adjustment.trendRemoved());
    Assertions.assertEquals(1, adjustment.reruns());
    Assertions.assertEquals(ChannelSelection.parse("0~89;111~199"),
        adjustment.classification().selection());
    Assertions.assertNotSame(sloped, adjustment.spectrum());
    Assertions.assertEquals(adjustment.spectrum().getValue(0), adjustment.spectrum().getValue(199),
        0.1);
    Assertions.assertEquals(2, classifier.spectra.size());
    Assertions.assertSame(adjustment.spectrum(), classifier.spectra.get(1));
  }

  @Test
  void testTrendRemovalIsRevertedIfTheBaselineMadRises() {
    Spectrum sloped = slopedSpectrum();
    ScriptedStatistics statistics = new ScriptedStatistics(s -> s == sloped ? 0.01 : 0.02);
    ScriptedClassifier classifier = new ScriptedClassifier(s -> ChannelSelection.of(0, 199));
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters(), statistics,
        classifier);
    SigmaAdjustment adjustment = adjuster.adjust(sloped, TDM_200, 3.5, false);

    Assertions.assertFalse(adjustment.trendRemoved());
    Assertions.assertSame(sloped, adjustment.spectrum());
    Assertions.assertEquals(1, adjustment.reruns());
    Assertions.assertEquals(0.01, adjustment.classification().scaledMAD(), 0);
    // the detrended spectrum was measured once and then dropped
    Assertions.assertEquals(3, statistics.spectra.size());
    Assertions.assertNotSame(sloped, statistics.spectra.get(1));
    Assertions.assertSame(sloped, classifier.spectra.get(1));
  }

  @Test
  void testTrendRemovalThatSplitsTheWindowIsDiscarded() {
    Spectrum sloped = slopedSpectrum();
    ScriptedStatistics statistics = new ScriptedStatistics(
        s -> MathUtils.scaledMad(s.getValues()));
    ScriptedClassifier classifier = new ScriptedClassifier(
        s -> s == sloped ? ChannelSelection.of(0, 199) : ChannelSelection.parse("0~9;20~199"));
    SigmaAdjuster adjuster = new SigmaAdjuster(new FindContinuumParameters(), statistics,
        classifier);
    SigmaAdjustment adjustment = adjuster.adjust(sloped, TDM_200, 3.5, false);

    Assertions.assertFalse(adjustment.trendRemoved());
    Assertions.assertSame(sloped, adjustment.spectrum());
    Assertions.assertEquals(ChannelSelection.of(0, 199), adjustment.classification().selection());
  }

  @Test
  void testTrendRemovalCanBeDisabled() {
    ParameterSet parameters = new FindContinuumParameters();
    parameters.setParameter(FindContinuumParameters.removeTrend, false);
    Spectrum sloped = slopedSpectrum();
    ScriptedClassifier classifier = new ScriptedClassifier(s -> ChannelSelection.of(0, 199));
    SigmaAdjustment adjustment = new SigmaAdjuster(parameters,
        new ScriptedStatistics(s -> 0.01), classifier).adjust(sloped, TDM_200, 3.5, false);

    Assertions.assertFalse(adjustment.trendRemoved());
    Assertions.assertEquals(0, adjustment.reruns());
    Assertions.assertEquals(1, classifier.spectra.size());
  }

  /**
   * Baseline statistics with a prepared scaled MAD per spectrum.
   */
  private static final class ScriptedStatistics extends RobustBaselineStatistics {

    private final ToDoubleFunction<Spectrum> scaledMad;
    private final List<Spectrum> spectra = new ArrayList<>();

    private ScriptedStatistics(ToDoubleFunction<Spectrum> scaledMad) {
      super(new FindContinuumParameters());
      this.scaledMad = scaledMad;
    }

    @Override
    public @NotNull BaselineStatistics compute(@NotNull Spectrum spectrum, double sigma) {
      spectra.add(spectrum);
      return unitStatistics(scaledMad.applyAsDouble(spectrum));
    }
  }

  /**
   * Returns a prepared selection per spectrum.
   */
  private static final class ScriptedClassifier extends ChannelClassifier {

    private final Function<Spectrum, ChannelSelection> selections;
    private final List<Spectrum> spectra = new ArrayList<>();

    private ScriptedClassifier(Function<Spectrum, ChannelSelection> selections) {
      super(new FindContinuumParameters());
      this.selections = selections;
    }

    @Override
    public @NotNull ChannelClassification classify(@NotNull Spectrum spectrum, double sigma,
        @NotNull BaselineStatistics stats, int maxTrimOverride) {
      spectra.add(spectrum);
      return classification(selections.apply(spectrum), stats, sigma, Double.NaN, 0);
    }
  }
}
